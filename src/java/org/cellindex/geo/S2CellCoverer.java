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

import java.util.ArrayList;
import java.util.List;

import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2Region;
import com.google.common.geometry.S2RegionCoverer;

/**
 * {@link CellCoverer} backed by the S2 library's region coverer.
 */
public class S2CellCoverer implements CellCoverer
{
    public static final CellCoverer.Factory FACTORY = S2CellCoverer::new;

    private final S2RegionCoverer coverer;
    private final int minLevel;
    private final int maxLevel;
    private final int maxCells;

    public S2CellCoverer(int minLevel, int maxLevel, int maxCells)
    {
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
        this.maxCells = maxCells;
        this.coverer = S2RegionCoverer.builder()
                                      .setMinLevel(minLevel)
                                      .setMaxLevel(maxLevel)
                                      .setMaxCells(maxCells)
                                      .build();
    }

    @Override
    public List<S2CellId> covering(S2Region region)
    {
        ArrayList<S2CellId> covering = new ArrayList<>();
        coverer.getCovering(region, covering);
        return covering;
    }

    @Override
    public String toString()
    {
        return String.format("S2CellCoverer(minLevel=%d, maxLevel=%d, maxCells=%d)",
                             minLevel, maxLevel, maxCells);
    }
}
