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

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.cellindex.query.CellPredicate;
import org.cellindex.query.TokenRange;

/**
 * Counting statement over a posting table {@code (id, cellToken)} for one {@link CellPredicate}:
 * <pre>
 *   SELECT count(id)[, count(DISTINCT id)] FROM postings
 *   WHERE cellToken BETWEEN ? AND ? OR ... OR cellToken IN (?, ...)
 * </pre>
 * Tokens are always bound as parameters. Statements for predicates with the same number of ranges and exact tokens
 * share their SQL text, so a prepared statement can be reused across queries.
 */
public final class PostingsStatement
{
    public final String sql;
    public final boolean distinct;
    private final ImmutableList<String> parameters;

    private PostingsStatement(String sql, boolean distinct, List<String> parameters)
    {
        this.sql = sql;
        this.distinct = distinct;
        this.parameters = ImmutableList.copyOf(parameters);
    }

    public static PostingsStatement create(String table, CellPredicate predicate, boolean distinct)
    {
        StringBuilder sql = new StringBuilder("SELECT count(id)");
        if (distinct)
            sql.append(", count(DISTINCT id)");
        sql.append(" FROM ").append(table).append(" WHERE ");

        List<String> parameters = new ArrayList<>();
        boolean first = true;
        for (TokenRange range : predicate.ranges())
        {
            if (!first)
                sql.append(" OR ");
            sql.append("cellToken BETWEEN ? AND ?");
            parameters.add(range.low);
            parameters.add(range.high);
            first = false;
        }

        if (!predicate.exactTokens().isEmpty())
        {
            if (!first)
                sql.append(" OR ");
            sql.append("cellToken IN (");
            for (int i = 0; i < predicate.exactTokens().size(); i++)
                sql.append(i == 0 ? "?" : ", ?");
            sql.append(')');
            parameters.addAll(predicate.exactTokens());
        }
        return new PostingsStatement(sql.toString(), distinct, parameters);
    }

    public List<String> parameters()
    {
        return parameters;
    }

    public void bind(PreparedStatement statement) throws SQLException
    {
        for (int i = 0; i < parameters.size(); i++)
            statement.setString(i + 1, parameters.get(i));
    }

    /**
     * The statement text with its parameters inlined, for error messages and logs.
     */
    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder(sql.length() + parameters.size() * 18);
        int parameter = 0;
        for (int i = 0; i < sql.length(); i++)
        {
            char c = sql.charAt(i);
            if (c == '?' && parameter < parameters.size())
                builder.append('\'').append(parameters.get(parameter++)).append('\'');
            else
                builder.append(c);
        }
        return builder.toString();
    }
}
