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
package org.cellindex.bench;

import java.util.Random;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.geometry.S2LatLng;

import org.cellindex.source.SpatialObject;
import org.cellindex.source.SpatialObjectSource;

/**
 * Picks query centers from a stream of objects: each object is kept with probability {@code selectivity / 100},
 * decided by a generator with a fixed seed so that runs over the same input query the same centers. The center is
 * the object's first point.
 */
public class QuerySampler implements AutoCloseable
{
    private final SpatialObjectSource source;
    private final int selectivityPercent;
    private final Random random;
    private long drawn;

    public QuerySampler(SpatialObjectSource source, int selectivityPercent, long seed)
    {
        Preconditions.checkArgument(selectivityPercent > 0 && selectivityPercent <= 100,
                                    "Selectivity must be in (0, 100], got %s", selectivityPercent);
        this.source = source;
        this.selectivityPercent = selectivityPercent;
        this.random = new Random(seed);
    }

    /**
     * @return the next query center, or null once the source is exhausted
     */
    @Nullable
    public S2LatLng next()
    {
        while (source.hasNext())
        {
            SpatialObject object = source.next();
            drawn++;
            if (random.nextInt(100) < selectivityPercent)
                return object.center();
        }
        return null;
    }

    /**
     * @return the number of objects read from the source so far
     */
    public long drawn()
    {
        return drawn;
    }

    public void close()
    {
        source.close();
    }
}
