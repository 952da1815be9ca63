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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.cellindex.exceptions.BackendException;
import org.cellindex.query.Operation;
import org.cellindex.query.QueryPlan;
import org.cellindex.query.QueryResult;

/**
 * Answers cell predicates with counting statements against a relational posting table, one row per
 * (object, covering cell) pair. Serves every operation.
 */
public class JdbcPostingBackend extends AbstractJdbcBackend
{
    private static final Logger logger = LoggerFactory.getLogger(JdbcPostingBackend.class);

    public JdbcPostingBackend(Connection connection, String table)
    {
        super(connection, table);
    }

    public static JdbcPostingBackend connect(String url, String user, String password, String table) throws IOException
    {
        JdbcPostingBackend backend = new JdbcPostingBackend(connect(url, user, password), table);
        logger.info("Connected to {}, reading postings from {}", url, table);
        return backend;
    }

    public String name()
    {
        return "jdbc";
    }

    public boolean supports(Operation operation)
    {
        return true;
    }

    public QueryResult execute(QueryPlan plan) throws IOException
    {
        PostingsStatement statement = PostingsStatement.create(table, plan.predicate(), plan.requireDistinct);
        if (logger.isTraceEnabled())
            logger.trace("Executing {}", statement);

        try
        {
            PreparedStatement ps = prepare(statement.sql);
            statement.bind(ps);
            try (ResultSet rs = ps.executeQuery())
            {
                if (!rs.next())
                    throw new BackendException(statement.toString(), new SQLException("No row returned for count"));

                long rows = rs.getLong(1);
                return statement.distinct ? QueryResult.of(rows, rs.getLong(2)) : QueryResult.rows(rows);
            }
        }
        catch (SQLException e)
        {
            throw new BackendException(statement.toString(), e);
        }
    }
}
