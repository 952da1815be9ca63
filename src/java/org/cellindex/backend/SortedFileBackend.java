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
package org.cellindex.backend;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.cellindex.index.SortedPostingIndex;
import org.cellindex.query.CellPredicate;
import org.cellindex.query.Operation;
import org.cellindex.query.QueryPlan;
import org.cellindex.query.QueryResult;
import org.cellindex.query.TokenRange;

/**
 * Answers cell predicates with range scans over a sorted posting file. Exact tokens are scanned as single key
 * ranges.
 *
 * {@link Operation#CONTAINING} is not served: its matches are the ancestors of the query covering, scattered over
 * the key space rather than gathered in a few ranges.
 */
public class SortedFileBackend implements IndexBackend
{
    private final SortedPostingIndex index;

    public SortedFileBackend(SortedPostingIndex index)
    {
        this.index = index;
    }

    public String name()
    {
        return "sorted";
    }

    public boolean supports(Operation operation)
    {
        return operation != Operation.CONTAINING;
    }

    public QueryResult execute(QueryPlan plan) throws IOException
    {
        CellPredicate predicate = plan.predicate();
        if (!supports(predicate.operation()))
            throw new UnsupportedOperationException(name() + " backend does not serve " + predicate.operation() + " queries");

        List<TokenRange> ranges = predicate.ranges();
        if (!predicate.isRangeOnly())
        {
            ranges = new ArrayList<>(ranges);
            for (String token : predicate.exactTokens())
                ranges.add(new TokenRange(token, token));
        }
        return index.count(ranges, plan.requireDistinct);
    }

    public void close() throws IOException
    {
        index.close();
    }
}
