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
package org.cellindex.query;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2LatLng;

import org.cellindex.geo.CellAncestors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class QueryTranslatorTest
{
    private static final S2CellId LEAF = S2CellId.fromLatLng(S2LatLng.fromDegrees(51.5074, -0.1278));
    private static final S2CellId A = LEAF.parent(13);
    private static final S2CellId B = A.next();
    private static final List<S2CellId> COVERING = Arrays.asList(A, B);

    @Test
    public void testContainsScansDescendantRanges()
    {
        CellPredicate predicate = QueryTranslator.translate(Operation.CONTAINS, COVERING);

        assertEquals(Operation.CONTAINS, predicate.operation());
        assertEquals(2, predicate.coveringSize());
        assertTrue(predicate.isRangeOnly());
        assertEquals(Arrays.asList(new TokenRange(A.rangeMin().toToken(), A.rangeMax().toToken()),
                                   new TokenRange(B.rangeMin().toToken(), B.rangeMax().toToken())),
                     predicate.ranges());
    }

    @Test
    public void testContainsMatchesDescendantsOnly()
    {
        CellPredicate predicate = QueryTranslator.translate(Operation.CONTAINS, Collections.singletonList(A));

        assertTrue(predicate.matches(A.toToken()));
        assertTrue(predicate.matches(A.childBegin(20).toToken()));
        assertTrue(predicate.matches(A.childEnd().prev().toToken()));
        assertFalse(predicate.matches(A.parent(12).toToken()));
        assertFalse(predicate.matches(B.toToken()));
        assertFalse(predicate.matches(A.prev().toToken()));
    }

    @Test
    public void testContainingMatchesAncestorsAndCovering()
    {
        CellPredicate predicate = QueryTranslator.translate(Operation.CONTAINING, COVERING);

        assertTrue(predicate.ranges().isEmpty());
        Set<String> expected = tokens(CellAncestors.of(COVERING));
        expected.addAll(tokens(COVERING));
        assertEquals(expected, predicate.exactTokens());

        assertTrue(predicate.matches(A.toToken()));
        assertTrue(predicate.matches(A.parent(2).toToken()));
        assertFalse("descendants do not contain the query", predicate.matches(A.childBegin(14).toToken()));
    }

    @Test
    public void testIntersectsDoesNotRepeatCoveringCells()
    {
        CellPredicate predicate = QueryTranslator.translate(Operation.INTERSECTS, COVERING);

        assertEquals(QueryTranslator.translate(Operation.CONTAINS, COVERING).ranges(), predicate.ranges());
        assertEquals(tokens(CellAncestors.of(COVERING)), predicate.exactTokens());
        assertFalse(predicate.exactTokens().contains(A.toToken()));
        assertFalse(predicate.exactTokens().contains(B.toToken()));

        assertTrue(predicate.matches(A.toToken()));
        assertTrue(predicate.matches(A.parent(0).toToken()));
        assertTrue(predicate.matches(B.childBegin(30).toToken()));
    }

    @Test
    public void testIntersectsOnFaceHasNoExactClause()
    {
        CellPredicate predicate = QueryTranslator.translate(Operation.INTERSECTS, Collections.singletonList(S2CellId.fromFace(4)));
        assertTrue(predicate.isRangeOnly());
        assertEquals(1, predicate.ranges().size());
    }

    @Test
    public void testExactTokensInCellIdOrder()
    {
        CellPredicate first = QueryTranslator.translate(Operation.CONTAINING, Arrays.asList(A, B));
        CellPredicate second = QueryTranslator.translate(Operation.CONTAINING, Arrays.asList(B, A));
        assertEquals(first.exactTokens().asList(), second.exactTokens().asList());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyCoveringRejected()
    {
        QueryTranslator.translate(Operation.CONTAINS, Collections.emptyList());
    }

    private static Set<String> tokens(List<S2CellId> cells)
    {
        Set<String> tokens = new HashSet<>();
        for (S2CellId cell : cells)
            tokens.add(cell.toToken());
        return tokens;
    }
}
