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

import org.junit.Test;

import org.cellindex.exceptions.ConfigurationException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CountingPolicyTest
{
    @Test
    public void testDistinctAlwaysDeduplicates()
    {
        assertTrue(CountingPolicy.DISTINCT.requiresDistinct(1, 1));
        assertTrue(CountingPolicy.DISTINCT.requiresDistinct(8, 3));
    }

    @Test
    public void testSingleCell()
    {
        assertFalse(CountingPolicy.SINGLE_CELL.requiresDistinct(1, 1));
        assertTrue(CountingPolicy.SINGLE_CELL.requiresDistinct(1, 2));
        assertTrue(CountingPolicy.SINGLE_CELL.requiresDistinct(4, 1));
    }

    @Test
    public void testIndexSingleCell()
    {
        assertFalse(CountingPolicy.INDEX_SINGLE_CELL.requiresDistinct(1, 1));
        assertFalse(CountingPolicy.INDEX_SINGLE_CELL.requiresDistinct(1, 12));
        assertTrue(CountingPolicy.INDEX_SINGLE_CELL.requiresDistinct(2, 1));
    }

    @Test
    public void testFromString() throws ConfigurationException
    {
        assertEquals(CountingPolicy.SINGLE_CELL, CountingPolicy.fromString("single_cell"));
        assertEquals(CountingPolicy.INDEX_SINGLE_CELL, CountingPolicy.fromString(" Index_Single_Cell "));
        assertEquals("distinct", CountingPolicy.DISTINCT.toString());

        assertEquals(Operation.CONTAINING, Operation.fromString("containing"));
        assertEquals(Operation.INTERSECTS, Operation.fromString("INTERSECTS"));
        assertEquals("contains", Operation.CONTAINS.toString());
    }

    @Test
    public void testUnknownNames()
    {
        try
        {
            CountingPolicy.fromString("approximate");
            fail("Expected an unknown counting policy to be rejected");
        }
        catch (ConfigurationException e)
        {
            assertTrue(e.getMessage().contains("approximate"));
        }

        try
        {
            Operation.fromString("within");
            fail("Expected an unknown operation to be rejected");
        }
        catch (ConfigurationException e)
        {
            assertTrue(e.getMessage().contains("within"));
        }
    }

    @Test
    public void testQueryResultCounts()
    {
        QueryResult result = QueryResult.of(5, 3);
        assertEquals(3, result.count(true));
        assertEquals(5, result.count(false));
        assertTrue(result.isDeduplicated());

        QueryResult rows = QueryResult.rows(4);
        assertEquals(4, rows.count(true));
        assertFalse(rows.isDeduplicated());
        assertTrue(QueryResult.SKIPPED.isSkipped());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMoreDistinctThanRowsRejected()
    {
        QueryResult.of(2, 3);
    }
}
