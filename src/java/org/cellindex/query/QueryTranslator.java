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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import com.google.common.base.Preconditions;
import com.google.common.geometry.S2CellId;

import org.cellindex.geo.CellAncestors;

/**
 * Translates an operation over a query covering into a {@link CellPredicate}.
 *
 * <ul>
 *   <li>contains: postings under a descendant of (or equal to) a covering cell. One token range per covering cell,
 *   since every descendant's token sorts within {@code [rangeMin, rangeMax]} of its ancestor.</li>
 *   <li>containing: postings under an ancestor of (or equal to) a covering cell. Ancestors are not contiguous in
 *   token order, so this is an exact match over the ancestors plus the covering itself.</li>
 *   <li>intersects: both of the above. The covering cells are already matched by their ranges and are not repeated
 *   in the exact match.</li>
 * </ul>
 */
public final class QueryTranslator
{
    private QueryTranslator()
    {
    }

    public static CellPredicate translate(Operation operation, List<S2CellId> covering)
    {
        Preconditions.checkArgument(!covering.isEmpty(), "Cannot translate an empty covering");

        switch (operation)
        {
            case CONTAINS:
                return new CellPredicate(operation, covering.size(), descendantRanges(covering), Collections.emptyList());
            case CONTAINING:
            {
                TreeSet<S2CellId> cells = new TreeSet<>(CellAncestors.of(covering));
                cells.addAll(covering);
                return new CellPredicate(operation, covering.size(), Collections.emptyList(), tokens(cells));
            }
            case INTERSECTS:
                return new CellPredicate(operation, covering.size(), descendantRanges(covering), tokens(CellAncestors.sorted(covering)));
            default:
                throw new AssertionError("Unhandled operation: " + operation);
        }
    }

    private static List<TokenRange> descendantRanges(List<S2CellId> covering)
    {
        List<TokenRange> ranges = new ArrayList<>(covering.size());
        for (S2CellId cell : covering)
            ranges.add(TokenRange.descendantsOf(cell));
        return ranges;
    }

    private static List<String> tokens(Iterable<S2CellId> cells)
    {
        List<String> tokens = new ArrayList<>();
        for (S2CellId cell : cells)
            tokens.add(cell.toToken());
        return tokens;
    }
}
