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

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * A query resolved at one level, as handed to a backend. There is no {@link #predicate()} for backends that do not
 * answer from a cell covering.
 */
public final class QueryPlan
{
    public final Query query;
    public final int level;
    @Nullable
    private final CellPredicate predicate;
    public final boolean requireDistinct;

    public QueryPlan(Query query, int level, @Nullable CellPredicate predicate, boolean requireDistinct)
    {
        this.query = query;
        this.level = level;
        this.predicate = predicate;
        this.requireDistinct = requireDistinct;
    }

    public boolean hasPredicate()
    {
        return predicate != null;
    }

    public CellPredicate predicate()
    {
        if (predicate == null)
            throw new IllegalStateException("No cell predicate was computed for " + query + " at level " + level);
        return predicate;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                          .add("query", query)
                          .add("level", level)
                          .add("predicate", predicate)
                          .add("requireDistinct", requireDistinct)
                          .toString();
    }
}
