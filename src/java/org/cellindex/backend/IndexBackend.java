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

import java.io.Closeable;
import java.io.IOException;

import org.cellindex.query.Operation;
import org.cellindex.query.QueryPlan;
import org.cellindex.query.QueryResult;

/**
 * A store of postings that can count the objects matching a query.
 *
 * Implementations are used from a single thread. A failed execution throws; it is never retried.
 */
public interface IndexBackend extends Closeable
{
    String name();

    boolean supports(Operation operation);

    /**
     * @return whether {@link #execute} reads {@link QueryPlan#predicate()}. Queries whose region has no covering
     * under the budget are skipped for such backends.
     */
    default boolean usesCovering()
    {
        return true;
    }

    /**
     * @return the counts of the objects matching {@code plan}, or {@link QueryResult#SKIPPED}
     * @throws IOException if the store failed to answer; {@link org.cellindex.exceptions.BackendException} carries
     * the failing statement where there is one
     */
    QueryResult execute(QueryPlan plan) throws IOException;
}
