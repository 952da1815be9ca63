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

import java.util.Locale;

import com.google.common.geometry.S1Angle;
import com.google.common.geometry.S2Cap;
import com.google.common.geometry.S2Cell;
import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2LatLng;
import com.google.common.geometry.S2LatLngRect;
import com.google.common.geometry.S2Region;

import org.cellindex.exceptions.ConfigurationException;

/**
 * The kind of region a query is built around. Each shape resolves a sample center and a cell level into a single
 * region whose size tracks the level.
 */
public enum Shape
{
    /** The bounds of the cell containing the center. The best case for a cell index. */
    CELL
    {
        public S2Region region(S2LatLng center, int level)
        {
            return new S2Cell(cellAt(center, level));
        }
    },

    /** A disc around the center, with a radius of the average cell edge at the level. */
    CAP
    {
        public S2Region region(S2LatLng center, int level)
        {
            return S2Cap.fromAxisAngle(center.toPoint(), S1Angle.radians(CellMetrics.avgAngleSpan(level)));
        }
    },

    /** The lat/lng rectangle spanned by two opposite corners of the {@link #CELL} shape's cell. */
    RECT
    {
        public S2Region region(S2LatLng center, int level)
        {
            S2Cell cell = new S2Cell(cellAt(center, level));
            return S2LatLngRect.fromPointPair(new S2LatLng(cell.getVertex(0)), new S2LatLng(cell.getVertex(2)));
        }
    };

    public abstract S2Region region(S2LatLng center, int level);

    public static S2CellId cellAt(S2LatLng center, int level)
    {
        return S2CellId.fromLatLng(center).parent(level);
    }

    public String toString()
    {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Shape fromString(String name) throws ConfigurationException
    {
        if (name == null)
            throw new ConfigurationException("Missing query shape");

        try
        {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e)
        {
            throw new ConfigurationException(String.format("Unknown query shape '%s', expected one of cell, cap, rect", name), false);
        }
    }
}
