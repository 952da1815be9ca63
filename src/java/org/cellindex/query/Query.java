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

import com.google.common.base.MoreObjects;
import com.google.common.geometry.S2LatLng;
import com.google.common.geometry.S2Region;

import org.cellindex.geo.Shape;

/**
 * A sampled query: a center, the shape built around it and the operation to run. The same query is issued once
 * per cell level, each time against the region {@link #region(int)} resolves for that level.
 */
public final class Query
{
    public final S2LatLng center;
    public final Shape shape;
    public final Operation operation;

    public Query(S2LatLng center, Shape shape, Operation operation)
    {
        this.center = center;
        this.shape = shape;
        this.operation = operation;
    }

    public S2Region region(int level)
    {
        return shape.region(center, level);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                          .add("center", center)
                          .add("shape", shape)
                          .add("operation", operation)
                          .toString();
    }
}
