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
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import com.google.common.geometry.S2LatLng;

/**
 * In-memory object source for tests.
 */
public class ListSource implements SpatialObjectSource
{
    private final Iterator<SpatialObject> objects;
    public boolean closed;

    public ListSource(List<SpatialObject> objects)
    {
        this.objects = objects.iterator();
    }

    /**
     * One single point object per center, numbered from 0.
     */
    public static ListSource points(S2LatLng... centers)
    {
        List<SpatialObject> objects = new ArrayList<>();
        for (S2LatLng center : centers)
            objects.add(new SpatialObject(objects.size(), Arrays.asList(center)));
        return new ListSource(objects);
    }

    public boolean hasNext()
    {
        return objects.hasNext();
    }

    public SpatialObject next()
    {
        return objects.next();
    }

    public void close()
    {
        closed = true;
    }
}
