/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.cellindex.geo;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.google.common.geometry.S1Angle;
import com.google.common.geometry.S2Cap;
import com.google.common.geometry.S2Cell;
import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2LatLng;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CoveringPolicyTest
{
    private static final S2LatLng PARIS = S2LatLng.fromDegrees(48.8566, 2.3522);

    // the corner shared by faces 0, 1 and 2
    private static final S2LatLng CUBE_CORNER = S2LatLng.fromDegrees(35.26438968, 45);

    private static final S2CellId CELL = S2CellId.fromLatLng(PARIS).parent(12);

    private static CellCoverer.Factory fixed(List<S2CellId> covering, AtomicInteger created)
    {
        return (min, max, cells) -> {
            created.incrementAndGet();
            return region -> covering;
        };
    }

    @Test
    public void testCellRegionIsItsOwnCovering()
    {
        AtomicInteger created = new AtomicInteger();
        CoveringPolicy policy = new CoveringPolicy(0, 30, 4, fixed(Collections.emptyList(), created));

        assertEquals(Collections.singletonList(CELL), policy.covering(new S2Cell(CELL)));
        assertEquals("no coverer needed for a cell", 0, created.get());
    }

    @Test
    public void testCovererCreatedOnceOnFirstUse()
    {
        AtomicInteger created = new AtomicInteger();
        CoveringPolicy policy = new CoveringPolicy(0, 30, 4, fixed(Arrays.asList(CELL, CELL.next()), created));
        assertEquals(0, created.get());

        S2Cap cap = S2Cap.fromAxisAngle(PARIS.toPoint(), S1Angle.degrees(0.01));
        assertEquals(Arrays.asList(CELL, CELL.next()), policy.covering(cap));
        assertEquals(Arrays.asList(CELL, CELL.next()), policy.covering(cap));
        assertEquals(1, created.get());
    }

    @Test
    public void testSingleCellBudgetRejectsWiderCovering()
    {
        CoveringPolicy policy = new CoveringPolicy(0, 30, 1, fixed(Arrays.asList(CELL, CELL.next()), new AtomicInteger()));
        assertTrue(policy.isSingleCell());
        assertNull(policy.covering(S2Cap.fromAxisAngle(PARIS.toPoint(), S1Angle.degrees(0.01))));
    }

    @Test
    public void testSingleCellBudgetAcceptsSingleCell()
    {
        CoveringPolicy policy = new CoveringPolicy(0, 30, 1, fixed(Collections.singletonList(CELL), new AtomicInteger()));
        assertEquals(Collections.singletonList(CELL), policy.covering(S2Cap.fromAxisAngle(PARIS.toPoint(), S1Angle.degrees(0.01))));
    }

    @Test
    public void testWiderBudgetKeepsMultiCellCovering()
    {
        CoveringPolicy policy = new CoveringPolicy(0, 30, 2, fixed(Arrays.asList(CELL, CELL.next()), new AtomicInteger()));
        assertEquals(2, policy.covering(S2Cap.fromAxisAngle(PARIS.toPoint(), S1Angle.degrees(0.01))).size());
    }

    @Test
    public void testS2CoveringWithinBudget()
    {
        CoveringPolicy policy = new CoveringPolicy(0, 30, 4);
        List<S2CellId> covering = policy.covering(S2Cap.fromAxisAngle(PARIS.toPoint(), S1Angle.degrees(0.5)));

        assertNotNull(covering);
        assertFalse(covering.isEmpty());
        assertTrue(covering.toString(), covering.size() <= 4);
        for (S2CellId cell : covering)
            assertTrue(cell.isValid());
    }

    @Test
    public void testS2CoveringAcrossFacesSkippedWithSingleCellBudget()
    {
        S2Cap corner = S2Cap.fromAxisAngle(CUBE_CORNER.toPoint(), S1Angle.degrees(0.1));

        assertNull(new CoveringPolicy(0, 30, 1).covering(corner));
        assertNotNull(new CoveringPolicy(0, 30, 4).covering(corner));
    }

    @Test
    public void testInvalidBudgets()
    {
        assertInvalid(-1, 30, 4);
        assertInvalid(0, 31, 4);
        assertInvalid(12, 11, 4);
        assertInvalid(0, 30, 0);
    }

    private static void assertInvalid(int min, int max, int cells)
    {
        try
        {
            new CoveringPolicy(min, max, cells);
            fail(String.format("Budget [%d, %d] x %d should be rejected", min, max, cells));
        }
        catch (IllegalArgumentException e)
        {
            // expected
        }
    }
}
