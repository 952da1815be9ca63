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
 * Geometric relation between indexed objects and the query region, in terms of the cells each is covered by.
 */
public enum Operation
{
    /** Indexed objects whose cells lie within the query covering (descendants of, or equal to, a probe cell). */
    CONTAINS,
    /** Indexed objects whose cells contain the query covering (ancestors of, or equal to, a probe cell). */
    CONTAINING,
    /** Union of {@link #CONTAINS} and {@link #CONTAINING}. */
    INTERSECTS;

    public String toString()
    {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Operation fromString(String name) throws ConfigurationException
    {
        if (name == null)
            throw new ConfigurationException("Missing query operation");

        try
        {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e)
        {
            throw new ConfigurationException(String.format("Unknown query operation '%s', expected one of contains, containing, intersects", name), false);
        }
    }
}
