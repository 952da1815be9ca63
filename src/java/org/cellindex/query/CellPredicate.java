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

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A query translated into the cell-token key space: a posting matches if its token falls in one of the
 * {@link #ranges()} or equals one of the {@link #exactTokens()}.
 */
public final class CellPredicate
{
    private final Operation operation;
    private final int coveringSize;
    private final ImmutableList<TokenRange> ranges;
    private final ImmutableSet<String> exactTokens;

    CellPredicate(Operation operation, int coveringSize, List<TokenRange> ranges, Iterable<String> exactTokens)
    {
        this.operation = operation;
        this.coveringSize = coveringSize;
        this.ranges = ImmutableList.copyOf(ranges);
        this.exactTokens = ImmutableSet.copyOf(exactTokens);
    }

    public Operation operation()
    {
        return operation;
    }

    /**
     * Number of cells in the query covering this predicate was built from.
     */
    public int coveringSize()
    {
        return coveringSize;
    }

    public ImmutableList<TokenRange> ranges()
    {
        return ranges;
    }

    public ImmutableSet<String> exactTokens()
    {
        return exactTokens;
    }

    /**
     * @return true if this predicate can be answered with range scans alone
     */
    public boolean isRangeOnly()
    {
        return exactTokens.isEmpty();
    }

    public boolean matches(String token)
    {
        if (exactTokens.contains(token))
            return true;

        for (TokenRange range : ranges)
        {
            if (range.contains(token))
                return true;
        }
        return false;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                          .add("operation", operation)
                          .add("coveringSize", coveringSize)
                          .add("ranges", ranges)
                          .add("exactTokens", exactTokens)
                          .toString();
    }
}
