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
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.geometry.S2CellId;

/**
 * Enumerates the strict ancestors of a set of cells.
 */
public final class CellAncestors
{
    private CellAncestors()
    {
    }

    /**
     * Returns every cell that strictly contains one of {@code cells}, each exactly once, never one of
     * {@code cells} itself.
     *
     * Each input cell is walked up one level at a time. A walk stops at the first parent that was already seen:
     * that parent's own ancestors are, or will be, enumerated by the walk that first reached it. Cells of a covering
     * usually share a near ancestor, so most walks stop after a step or two.
     *
     * The result depends on the order of {@code cells} only in its enumeration order; use {@link #sorted} when a
     * stable order matters (e.g. for statement text).
     */
    public static List<S2CellId> of(Collection<S2CellId> cells)
    {
        Set<S2CellId> seen = new HashSet<>(cells);
        List<S2CellId> ancestors = new ArrayList<>();
        for (S2CellId cell : cells)
        {
            for (int level = cell.level() - 1; level >= 0; level--)
            {
                S2CellId parent = cell.parent(level);
                if (!seen.add(parent))
                    break;
                ancestors.add(parent);
            }
        }
        return ancestors;
    }

    public static List<S2CellId> of(S2CellId... cells)
    {
        List<S2CellId> list = new ArrayList<>(cells.length);
        Collections.addAll(list, cells);
        return of(list);
    }

    /**
     * Same set as {@link #of(Collection)}, in cell id order.
     */
    public static List<S2CellId> sorted(Collection<S2CellId> cells)
    {
        List<S2CellId> ancestors = of(cells);
        Collections.sort(ancestors);
        return ancestors;
    }
}
