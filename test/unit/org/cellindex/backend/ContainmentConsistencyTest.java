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
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2LatLng;

import org.cellindex.geo.Shape;
import org.cellindex.index.SortedPostingIndex;
import org.cellindex.index.SortedPostingIndexWriter;
import org.cellindex.query.Operation;
import org.cellindex.query.Query;
import org.cellindex.query.QueryPlan;
import org.cellindex.query.QueryTranslator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * The sorted file and the relational backend must agree on every operation they both serve.
 */
public class ContainmentConsistencyTest
{
    private static final S2LatLng CENTER = S2LatLng.fromDegrees(35.6762, 139.6503);
    private static final S2CellId X = S2CellId.fromLatLng(CENTER).parent(13);
    private static final S2CellId Y = X.parent(10);
    private static final S2CellId Z = sibling(Y).childBegin(13);
    private static final S2CellId PROBE = X.parent(11);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private IndexBackend sorted;
    private IndexBackend jdbc;

    @Before
    public void setUp() throws IOException, SQLException
    {
        Path path = folder.newFile().toPath();
        Connection connection = DriverManager.getConnection("jdbc:h2:mem:" + getClass().getSimpleName());
        try (Statement ddl = connection.createStatement())
        {
            ddl.execute("CREATE TABLE postings (id INTEGER, cellToken VARCHAR(16), PRIMARY KEY (cellToken, id))");
        }

        try (SortedPostingIndexWriter writer = new SortedPostingIndexWriter(path, 32);
             PreparedStatement insert = connection.prepareStatement("INSERT INTO postings (id, cellToken) VALUES (?, ?)"))
        {
            post(writer, insert, 1, Y);
            post(writer, insert, 2, X);
            post(writer, insert, 3, Z);
            post(writer, insert, 4, X.childBegin(20));
            post(writer, insert, 4, X.childEnd().prev());
            writer.finish();
        }
        sorted = new SortedFileBackend(SortedPostingIndex.open(path, 1 << 16));
        jdbc = new JdbcPostingBackend(connection, "postings");
    }

    @After
    public void tearDown() throws IOException
    {
        sorted.close();
        jdbc.close();
    }

    /**
     * Another child of {@code cell}'s parent, so that both share every ancestor above them.
     */
    private static S2CellId sibling(S2CellId cell)
    {
        S2CellId first = cell.parent(cell.level() - 1).childBegin();
        return first.equals(cell) ? cell.next() : first;
    }

    private static void post(SortedPostingIndexWriter writer, PreparedStatement insert, long id, S2CellId cell) throws IOException, SQLException
    {
        writer.add(cell, id);
        insert.setLong(1, id);
        insert.setString(2, cell.toToken());
        insert.executeUpdate();
    }

    private static QueryPlan plan(Operation operation, S2CellId probe)
    {
        Query query = new Query(CENTER, Shape.CELL, operation);
        return new QueryPlan(query, probe.level(), QueryTranslator.translate(operation, Collections.singletonList(probe)), true);
    }

    @Test
    public void testContains() throws IOException
    {
        assertEquals(3, sorted.execute(plan(Operation.CONTAINS, PROBE)).rowCount());
        assertEquals(2, sorted.execute(plan(Operation.CONTAINS, PROBE)).distinctCount());
        assertEquals(2, jdbc.execute(plan(Operation.CONTAINS, PROBE)).distinctCount());

        assertEquals(1, sorted.execute(plan(Operation.CONTAINS, X.childBegin(20))).distinctCount());
        assertEquals(1, jdbc.execute(plan(Operation.CONTAINS, X.childBegin(20))).distinctCount());
    }

    @Test
    public void testContaining() throws IOException
    {
        assertFalse(sorted.supports(Operation.CONTAINING));
        assertTrue(jdbc.supports(Operation.CONTAINING));

        assertEquals(1, jdbc.execute(plan(Operation.CONTAINING, PROBE)).distinctCount());
        assertEquals(2, jdbc.execute(plan(Operation.CONTAINING, X)).distinctCount());
        assertEquals(3, jdbc.execute(plan(Operation.CONTAINING, X.childBegin(20))).distinctCount());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testSortedRejectsContaining() throws IOException
    {
        sorted.execute(plan(Operation.CONTAINING, PROBE));
    }

    @Test
    public void testIntersects() throws IOException
    {
        for (S2CellId probe : new S2CellId[]{ Y, PROBE, X, X.childBegin(20), Z, Y.parent(3) })
        {
            long expected = jdbc.execute(plan(Operation.INTERSECTS, probe)).distinctCount();
            assertEquals(probe.toToken(), expected, sorted.execute(plan(Operation.INTERSECTS, probe)).distinctCount());
            assertEquals(probe.toToken(), jdbc.execute(plan(Operation.INTERSECTS, probe)).rowCount(),
                         sorted.execute(plan(Operation.INTERSECTS, probe)).rowCount());
        }
        assertEquals(3, sorted.execute(plan(Operation.INTERSECTS, PROBE)).distinctCount());
        assertEquals(4, sorted.execute(plan(Operation.INTERSECTS, Y.parent(3))).distinctCount());
    }
}
