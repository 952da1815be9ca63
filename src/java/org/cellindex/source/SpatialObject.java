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
package org.cellindex.source;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.geometry.S2LatLng;
import com.google.common.geometry.S2Point;
import com.google.common.geometry.S2Polyline;
import com.google.common.geometry.S2Region;

/**
 * An indexed object: an id and the vertices of its geometry, a single point or a polyline.
 */
public final class SpatialObject
{
    public final long id;
    public final ImmutableList<S2LatLng> points;

    public SpatialObject(long id, List<S2LatLng> points)
    {
        Preconditions.checkArgument(!points.isEmpty(), "Object %s has no points", id);
        this.id = id;
        this.points = ImmutableList.copyOf(points);
    }

    /**
     * The first vertex, used as the center of the queries sampled from this object.
     */
    public S2LatLng center()
    {
        return points.get(0);
    }

    public S2Region region()
    {
        if (points.size() == 1)
            return points.get(0).toPoint();

        List<S2Point> vertices = new ArrayList<>(points.size());
        for (S2LatLng point : points)
            vertices.add(point.toPoint());
        return new S2Polyline(vertices);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                          .add("id", id)
                          .add("points", points.size())
                          .toString();
    }
}
