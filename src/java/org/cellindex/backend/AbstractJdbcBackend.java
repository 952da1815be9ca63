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
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.cellindex.exceptions.BackendException;

/**
 * A backend reached over one JDBC connection. Statements are prepared once per distinct SQL text and kept until
 * the backend is closed.
 */
public abstract class AbstractJdbcBackend implements IndexBackend
{
    private static final Logger logger = LoggerFactory.getLogger(AbstractJdbcBackend.class);

    protected final Connection connection;
    protected final String table;
    private final Map<String, PreparedStatement> prepared = new HashMap<>();

    protected AbstractJdbcBackend(Connection connection, String table)
    {
        this.connection = connection;
        this.table = table;
    }

    protected static Connection connect(String url, String user, String password) throws IOException
    {
        try
        {
            Connection connection = DriverManager.getConnection(url, user, password);
            connection.setReadOnly(true);
            return connection;
        }
        catch (SQLException e)
        {
            throw new BackendException("connect " + url, e);
        }
    }

    protected PreparedStatement prepare(String sql) throws SQLException
    {
        PreparedStatement ps = prepared.get(sql);
        if (ps == null)
        {
            ps = connection.prepareStatement(sql);
            prepared.put(sql, ps);
            logger.debug("Prepared {}", sql);
        }
        return ps;
    }

    @VisibleForTesting
    int preparedStatements()
    {
        return prepared.size();
    }

    public void close() throws IOException
    {
        SQLException failure = null;
        for (PreparedStatement ps : prepared.values())
        {
            try
            {
                ps.close();
            }
            catch (SQLException e)
            {
                failure = merge(failure, e);
            }
        }
        prepared.clear();

        try
        {
            connection.close();
        }
        catch (SQLException e)
        {
            failure = merge(failure, e);
        }

        if (failure != null)
            throw new BackendException("close " + name() + " backend", failure);
    }

    private static SQLException merge(SQLException failure, SQLException e)
    {
        if (failure == null)
            return e;
        failure.addSuppressed(e);
        return failure;
    }
}
