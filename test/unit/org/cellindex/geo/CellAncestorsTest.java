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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2LatLng;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CellAncestorsTest
{
    private static final S2CellId LEAF = S2CellId.fromLatLng(S2LatLng.fromDegrees(37.7749, -122.4194));

    @Test
    public void testSingleCell()
    {
        S2CellId cell = LEAF.parent(5);
        List<S2CellId> ancestors = CellAncestors.of(cell);

        assertEquals(Arrays.asList(cell.parent(4), cell.parent(3), cell.parent(2), cell.parent(1), cell.parent(0)), ancestors);
    }

    @Test
    public void testFaceCellHasNoAncestors()
    {
        assertTrue(CellAncestors.of(S2CellId.fromFace(3)).isEmpty());
    }

    @Test
    public void testSiblingsShareAncestorsOnce()
    {
        S2CellId parent = LEAF.parent(9);
        List<S2CellId> covering = new ArrayList<>();
        for (S2CellId child = parent.childBegin(); !child.equals(parent.childEnd()); child = child.next())
            covering.add(child);

        List<S2CellId> ancestors = CellAncestors.of(covering);
        assertEquals(10, ancestors.size());
        assertEquals(10, new HashSet<>(ancestors).size());
        for (int level = 0; level <= 9; level++)
            assertTrue(ancestors.contains(LEAF.parent(level)));
    }

    @Test
    public void testInputCellsNeverReturned()
    {
        S2CellId outer = LEAF.parent(6);
        S2CellId inner = LEAF.parent(11);

        for (List<S2CellId> cells : Arrays.asList(Arrays.asList(inner, outer), Arrays.asList(outer, inner)))
        {
            List<S2CellId> ancestors = CellAncestors.of(cells);
            assertFalse(ancestors.contains(inner));
            assertFalse(ancestors.contains(outer));
            assertEquals(expected(cells), new HashSet<>(ancestors));
            assertEquals("no duplicates for " + cells, ancestors.size(), new HashSet<>(ancestors).size());
        }
    }

    @Test
    public void testSetIndependentOfInputOrder()
    {
        List<S2CellId> cells = Arrays.asList(LEAF.parent(14),
                                             S2CellId.fromLatLng(S2LatLng.fromDegrees(-33.87, 151.21)).parent(8),
                                             LEAF.parent(14).next(),
                                             LEAF.parent(3).prev());
        List<S2CellId> reversed = new ArrayList<>(cells);
        Collections.reverse(reversed);

        assertEquals(new HashSet<>(CellAncestors.of(cells)), new HashSet<>(CellAncestors.of(reversed)));
        assertEquals(expected(cells), new HashSet<>(CellAncestors.of(cells)));
        assertEquals(CellAncestors.sorted(cells), CellAncestors.sorted(reversed));
    }

    @Test
    public void testSortedIsInCellIdOrder()
    {
        List<S2CellId> sorted = CellAncestors.sorted(Arrays.asList(LEAF.parent(7), S2CellId.fromFace(0).childBegin(4)));
        for (int i = 1; i < sorted.size(); i++)
            assertTrue(sorted.get(i - 1).compareTo(sorted.get(i)) < 0);
    }

    private static Set<S2CellId> expected(List<S2CellId> cells)
    {
        Set<S2CellId> expected = new HashSet<>();
        for (S2CellId cell : cells)
        {
            for (int level = cell.level() - 1; level >= 0; level--)
                expected.add(cell.parent(level));
        }
        expected.removeAll(cells);
        return expected;
    }
}
