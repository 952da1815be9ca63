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
package org.cellindex.config;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.cellindex.backend.IndexBackend;
import org.cellindex.exceptions.ConfigurationException;
import org.cellindex.geo.CellCoverer;
import org.cellindex.geo.CoveringPolicy;
import org.cellindex.geo.S2CellCoverer;
import org.cellindex.geo.Shape;
import org.cellindex.query.CountingPolicy;
import org.cellindex.query.Operation;

/**
 * Validated, typed view of a {@link Config}. Every name and range is checked when the descriptor is built, so a bad
 * configuration fails before any query is issued.
 */
public class BenchmarkDescriptor
{
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkDescriptor.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    static final int DEFAULT_QUERIES_PER_LEVEL = 100;

    private final Config config;
    private final CoveringPolicy coveringPolicy;
    private final Shape shape;
    private final ImmutableList<Operation> operations;
    private final CountingPolicy countingPolicy;
    private final long maxQueries;

    public BenchmarkDescriptor(Config config) throws ConfigurationException
    {
        this(config, S2CellCoverer.FACTORY);
    }

    public BenchmarkDescriptor(Config config, CellCoverer.Factory coverers) throws ConfigurationException
    {
        this.config = config;

        try
        {
            coveringPolicy = new CoveringPolicy(config.index_min_level, config.index_max_level, config.index_max_cells, coverers);
        }
        catch (IllegalArgumentException e)
        {
            throw new ConfigurationException("Invalid index covering budget: " + e.getMessage(), false);
        }

        checkLevel("query_min_level", config.query_min_level);
        checkLevel("query_max_level", config.query_max_level);
        if (config.query_min_level > config.query_max_level)
            throw new ConfigurationException(String.format("query_min_level %d is greater than query_max_level %d",
                                                           config.query_min_level, config.query_max_level), false);

        maxQueries = config.query_max_count == null
                     ? (long) (config.query_max_level - config.query_min_level + 1) * DEFAULT_QUERIES_PER_LEVEL
                     : config.query_max_count;
        checkPositive("query_max_count", maxQueries);

        if (config.query_selectivity_percent <= 0 || config.query_selectivity_percent > 100)
            throw new ConfigurationException("query_selectivity_percent must be in (0, 100], got " + config.query_selectivity_percent, false);

        shape = Shape.fromString(config.query_shape);
        countingPolicy = CountingPolicy.fromString(config.count_policy);

        if (config.query_operations == null || config.query_operations.isEmpty())
            throw new ConfigurationException("query_operations must name at least one operation", false);
        Set<Operation> operations = new LinkedHashSet<>();
        for (String name : config.query_operations)
        {
            if (!operations.add(Operation.fromString(name)))
                logger.warn("Operation {} is listed more than once in query_operations, running it once", name);
        }
        this.operations = ImmutableList.copyOf(operations);

        checkPositive("repeat_count", config.repeat_count);
        checkPositive("histogram_reservoir_size", config.histogram_reservoir_size);
        checkPositive("sorted_index_block_size_kb", config.sorted_index_block_size_kb);
        if (config.block_cache_size_mb < 0)
            throw new ConfigurationException("block_cache_size_mb must not be negative, got " + config.block_cache_size_mb, false);
        if (config.progress_interval_ms < 0)
            throw new ConfigurationException("progress_interval_ms must not be negative, got " + config.progress_interval_ms, false);
        if (config.build_max_objects != null)
            checkPositive("build_max_objects", config.build_max_objects);

        checkTableName("postings_table", config.postings_table);
        checkTableName("geometries_table", config.geometries_table);
    }

    private static void checkLevel(String name, int level) throws ConfigurationException
    {
        if (level < 0 || level > CoveringPolicy.MAX_LEVEL)
            throw new ConfigurationException(String.format("%s must be in [0, %d], got %d", name, CoveringPolicy.MAX_LEVEL, level), false);
    }

    private static void checkPositive(String name, long value) throws ConfigurationException
    {
        if (value <= 0)
            throw new ConfigurationException(String.format("%s must be positive, got %d", name, value), false);
    }

    private static void checkTableName(String name, String table) throws ConfigurationException
    {
        if (table == null || !TABLE_NAME.matcher(table).matches())
            throw new ConfigurationException(String.format("%s must be a plain table name, got '%s'", name, table), false);
    }

    /**
     * @throws ConfigurationException if {@code backend} cannot serve one of the configured operations
     */
    public void checkSupported(IndexBackend backend) throws ConfigurationException
    {
        for (Operation operation : operations)
        {
            if (!backend.supports(operation))
                throw new ConfigurationException(String.format("The %s backend does not support %s queries; remove it from query_operations",
                                                               backend.name(), operation), false);
        }
    }

    public Config config()
    {
        return config;
    }

    public CoveringPolicy coveringPolicy()
    {
        return coveringPolicy;
    }

    public Shape shape()
    {
        return shape;
    }

    public ImmutableList<Operation> operations()
    {
        return operations;
    }

    public CountingPolicy countingPolicy()
    {
        return countingPolicy;
    }

    public int queryMinLevel()
    {
        return config.query_min_level;
    }

    public int queryMaxLevel()
    {
        return config.query_max_level;
    }

    public long maxQueries()
    {
        return maxQueries;
    }

    public int selectivityPercent()
    {
        return config.query_selectivity_percent;
    }

    public long sampleSeed()
    {
        return config.sample_seed;
    }

    public long progressIntervalMillis()
    {
        return config.progress_interval_ms;
    }

    public int repeatCount()
    {
        return config.repeat_count;
    }

    public boolean accumulateAcrossRepeats()
    {
        return config.accumulate_across_repeats;
    }

    public int histogramReservoirSize()
    {
        return config.histogram_reservoir_size;
    }

    public int sortedIndexBlockSize()
    {
        return config.sorted_index_block_size_kb * 1024;
    }

    public long blockCacheBytes()
    {
        return config.block_cache_size_mb * 1024L * 1024L;
    }

    public long buildMaxObjects()
    {
        return config.build_max_objects == null ? Long.MAX_VALUE : config.build_max_objects;
    }
}
