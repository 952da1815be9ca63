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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Cardinality of one executed query.
 *
 * {@link #rowCount()} counts matching postings and may count an object once per matching cell;
 * {@link #distinctCount()} counts distinct object ids. A backend that was allowed to skip deduplication
 * (see {@link CountingPolicy}) reports the row count for both.
 */
public final class QueryResult
{
    /** The query had no usable covering under the configured budget. Not an error, not a sample. */
    public static final QueryResult SKIPPED = new QueryResult(-1, -1, false);

    private final long rowCount;
    private final long distinctCount;
    private final boolean distinct;

    private QueryResult(long rowCount, long distinctCount, boolean distinct)
    {
        this.rowCount = rowCount;
        this.distinctCount = distinctCount;
        this.distinct = distinct;
    }

    public static QueryResult of(long rowCount, long distinctCount)
    {
        Preconditions.checkArgument(rowCount >= 0 && distinctCount >= 0 && distinctCount <= rowCount,
                                    "Invalid counts: %s rows, %s distinct", rowCount, distinctCount);
        return new QueryResult(rowCount, distinctCount, true);
    }

    /**
     * A result whose row count is known to equal its distinct count.
     */
    public static QueryResult rows(long rowCount)
    {
        Preconditions.checkArgument(rowCount >= 0, "Invalid row count %s", rowCount);
        return new QueryResult(rowCount, rowCount, false);
    }

    public boolean isSkipped()
    {
        return this == SKIPPED;
    }

    public long rowCount()
    {
        return rowCount;
    }

    public long distinctCount()
    {
        return distinctCount;
    }

    /**
     * @return whether the distinct count was actually computed, rather than assumed equal to the row count
     */
    public boolean isDeduplicated()
    {
        return distinct;
    }

    /**
     * The count recorded for this result: distinct ids when {@code requireDistinct}, raw rows otherwise.
     */
    public long count(boolean requireDistinct)
    {
        Preconditions.checkState(!isSkipped(), "Skipped queries have no count");
        return requireDistinct ? distinctCount : rowCount;
    }

    @Override
    public String toString()
    {
        if (isSkipped())
            return "QueryResult{skipped}";

        return MoreObjects.toStringHelper(this)
                          .add("rowCount", rowCount)
                          .add("distinctCount", distinctCount)
                          .add("deduplicated", distinct)
                          .toString();
    }
}
