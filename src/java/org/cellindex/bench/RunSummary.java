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
package org.cellindex.bench;

import java.util.concurrent.TimeUnit;

import com.google.common.base.MoreObjects;

import org.cellindex.query.Operation;

/**
 * Outcome of one benchmark run. A cancelled run is not a failure: its histograms hold the queries finished before
 * the cancellation.
 */
public final class RunSummary
{
    public final Operation operation;
    public final long queries;
    public final long skipped;
    public final boolean cancelled;
    public final long elapsedNanos;

    public RunSummary(Operation operation, long queries, long skipped, boolean cancelled, long elapsedNanos)
    {
        this.operation = operation;
        this.queries = queries;
        this.skipped = skipped;
        this.cancelled = cancelled;
        this.elapsedNanos = elapsedNanos;
    }

    public boolean cancelled()
    {
        return cancelled;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                          .add("operation", operation)
                          .add("queries", queries)
                          .add("skipped", skipped)
                          .add("cancelled", cancelled)
                          .add("elapsedMs", TimeUnit.NANOSECONDS.toMillis(elapsedNanos))
                          .toString();
    }
}
