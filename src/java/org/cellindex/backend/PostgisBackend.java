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
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.geometry.S2Cell;
import com.google.common.geometry.S2LatLng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.cellindex.exceptions.BackendException;
import org.cellindex.geo.CellMetrics;
import org.cellindex.geo.Shape;
import org.cellindex.query.Operation;
import org.cellindex.query.Query;
import org.cellindex.query.QueryPlan;
import org.cellindex.query.QueryResult;

/**
 * Baseline backend: answers queries with PostGIS bounding box operators against a table of object geometries
 * {@code (id, geometry)}, one row per object. Does not use cell coverings.
 */
public class PostgisBackend extends AbstractJdbcBackend
{
    private static final Logger logger = LoggerFactory.getLogger(PostgisBackend.class);

    public PostgisBackend(Connection connection, String table)
    {
        super(connection, table);
    }

    public static PostgisBackend connect(String url, String user, String password, String table) throws IOException
    {
        PostgisBackend backend = new PostgisBackend(connect(url, user, password), table);
        logger.info("Connected to {}, reading geometries from {}", url, table);
        return backend;
    }

    public String name()
    {
        return "postgis";
    }

    public boolean supports(Operation operation)
    {
        return true;
    }

    @Override
    public boolean usesCovering()
    {
        return false;
    }

    @VisibleForTesting
    static String operator(Operation operation)
    {
        switch (operation)
        {
            case CONTAINS:
                return "@";
            case CONTAINING:
                return "~";
            case INTERSECTS:
                return "&&";
            default:
                throw new AssertionError(operation);
        }
    }

    @VisibleForTesting
    static String geometry(Shape shape)
    {
        switch (shape)
        {
            case CELL:
            case RECT:
                return "ST_MakeEnvelope(?, ?, ?, ?)";
            case CAP:
                return "ST_Buffer(ST_MakePoint(?, ?)::geography, ?)::geometry";
            default:
                throw new AssertionError(shape);
        }
    }

    @VisibleForTesting
    String sql(Shape shape, Operation operation)
    {
        return String.format("WITH t (geom) AS (SELECT %s) SELECT count(id) FROM %s, t WHERE %s.geometry %s t.geom",
                             geometry(shape), table, table, operator(operation));
    }

    public QueryResult execute(QueryPlan plan) throws IOException
    {
        Query query = plan.query;
        String sql = sql(query.shape, query.operation);
        try
        {
            PreparedStatement ps = prepare(sql);
            bind(ps, query, plan.level);
            try (ResultSet rs = ps.executeQuery())
            {
                if (!rs.next())
                    throw new BackendException(sql, new SQLException("No row returned for count"));
                return QueryResult.rows(rs.getLong(1));
            }
        }
        catch (SQLException e)
        {
            throw new BackendException(sql + " for " + query + " at level " + plan.level, e);
        }
    }

    private static void bind(PreparedStatement ps, Query query, int level) throws SQLException
    {
        if (query.shape == Shape.CAP)
        {
            ps.setDouble(1, query.center.lngDegrees());
            ps.setDouble(2, query.center.latDegrees());
            ps.setInt(3, (int) CellMetrics.metersFromLevel(level));
        }
        else
        {
            S2Cell cell = new S2Cell(Shape.cellAt(query.center, level));
            S2LatLng v0 = new S2LatLng(cell.getVertex(0));
            S2LatLng v2 = new S2LatLng(cell.getVertex(2));
            ps.setDouble(1, v0.lngDegrees());
            ps.setDouble(2, v0.latDegrees());
            ps.setDouble(3, v2.lngDegrees());
            ps.setDouble(4, v2.latDegrees());
        }
    }
}
