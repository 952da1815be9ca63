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

import java.util.List;

import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2Region;

/**
 * Approximates a region with a bounded set of cells. The budget is fixed when the coverer is created.
 */
public interface CellCoverer
{
    /**
     * @return the covering cells, ordered by cell id and without duplicates. May hold more cells than the
     * budget allows when the region cannot be expressed within it (e.g. it spans several cube faces).
     */
    List<S2CellId> covering(S2Region region);

    interface Factory
    {
        CellCoverer create(int minLevel, int maxLevel, int maxCells);
    }
}
