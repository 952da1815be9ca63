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
package org.cellindex.geo;

/**
 * Size of cells per level, for building query regions and for reporting.
 */
public final class CellMetrics
{
    // equatorial radius; the earth is not a sphere, this is for reporting only
    public static final double EARTH_RADIUS_METERS = 6378137;

    // derivative of the average angle span metric (quadratic projection)
    private static final double AVG_ANGLE_SPAN_DERIV = Math.PI / 2;

    private CellMetrics()
    {
    }

    /**
     * Average angular edge length, in radians, of a cell at {@code level}.
     */
    public static double avgAngleSpan(int level)
    {
        return Math.scalb(AVG_ANGLE_SPAN_DERIV, -level);
    }

    /**
     * Approximate ground distance spanned by a cell at {@code level}.
     */
    public static double metersFromLevel(int level)
    {
        return EARTH_RADIUS_METERS * avgAngleSpan(level);
    }
}
