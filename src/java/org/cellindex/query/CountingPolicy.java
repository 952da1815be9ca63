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

import java.util.Locale;

import org.cellindex.exceptions.ConfigurationException;

/**
 * Decides when a raw row count may stand in for a count of distinct object ids.
 *
 * An object is posted once per cell of its own covering, and a query probing several cells can find it under more
 * than one of them, so in general only the distinct count is the true result cardinality.
 */
public enum CountingPolicy
{
    /** Always count distinct object ids. */
    DISTINCT,

    /** Count rows when both the index covering and the query covering are a single cell. */
    SINGLE_CELL,

    /**
     * Count rows whenever the index posts each object under a single cell, whatever the query covering size.
     * Every object then has exactly one posting, so no predicate can match it twice.
     */
    INDEX_SINGLE_CELL;

    public boolean requiresDistinct(int indexMaxCells, int queryCoveringSize)
    {
        switch (this)
        {
            case DISTINCT:
                return true;
            case SINGLE_CELL:
                return indexMaxCells != 1 || queryCoveringSize != 1;
            case INDEX_SINGLE_CELL:
                return indexMaxCells != 1;
            default:
                throw new AssertionError(this);
        }
    }

    public String toString()
    {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CountingPolicy fromString(String name) throws ConfigurationException
    {
        if (name == null)
            throw new ConfigurationException("Missing counting policy");

        try
        {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e)
        {
            throw new ConfigurationException(String.format("Unknown counting policy '%s', expected one of distinct, single_cell, index_single_cell", name), false);
        }
    }
}
