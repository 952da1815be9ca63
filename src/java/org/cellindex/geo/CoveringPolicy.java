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

import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.geometry.S2Cell;
import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns arbitrary regions into a bounded set of cells under a (minLevel, maxLevel, maxCells) budget.
 *
 * The same policy is used on both sides of the index: to compute the cells an object is posted under, and to
 * compute the probe cells of a query. The underlying coverer is only created on the first covering that needs it.
 */
public final class CoveringPolicy
{
    private static final Logger logger = LoggerFactory.getLogger(CoveringPolicy.class);

    public static final int MAX_LEVEL = S2CellId.MAX_LEVEL;

    private final int minLevel;
    private final int maxLevel;
    private final int maxCells;
    private final Supplier<CellCoverer> coverer;

    public CoveringPolicy(int minLevel, int maxLevel, int maxCells)
    {
        this(minLevel, maxLevel, maxCells, S2CellCoverer.FACTORY);
    }

    public CoveringPolicy(int minLevel, int maxLevel, int maxCells, CellCoverer.Factory factory)
    {
        Preconditions.checkArgument(minLevel >= 0 && minLevel <= MAX_LEVEL, "min level %s out of range [0, %s]", minLevel, MAX_LEVEL);
        Preconditions.checkArgument(maxLevel >= minLevel && maxLevel <= MAX_LEVEL, "max level %s out of range [%s, %s]", maxLevel, minLevel, MAX_LEVEL);
        Preconditions.checkArgument(maxCells >= 1, "max cells must be at least 1, got %s", maxCells);
        Preconditions.checkNotNull(factory);

        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
        this.maxCells = maxCells;
        this.coverer = Suppliers.memoize(() -> factory.create(minLevel, maxLevel, maxCells));
    }

    /**
     * Computes the covering of a region.
     *
     * @return the covering cells, or {@code null} when the region cannot be represented under this budget: with a
     * single cell budget, a region straddling a cube face boundary needs several cells. A {@code null} covering means
     * "skip this sample", not an error.
     */
    @Nullable
    public List<S2CellId> covering(S2Region region)
    {
        if (region instanceof S2Cell)
            return Collections.singletonList(((S2Cell) region).id());

        List<S2CellId> covering = coverer.get().covering(region);
        if (maxCells == 1 && covering.size() != 1)
        {
            logger.debug("Region {} needs {} cells, not representable with a single cell budget", region, covering.size());
            return null;
        }
        return covering;
    }

    public int minLevel()
    {
        return minLevel;
    }

    public int maxLevel()
    {
        return maxLevel;
    }

    public int maxCells()
    {
        return maxCells;
    }

    public boolean isSingleCell()
    {
        return maxCells == 1;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                          .add("minLevel", minLevel)
                          .add("maxLevel", maxLevel)
                          .add("maxCells", maxCells)
                          .toString();
    }
}
