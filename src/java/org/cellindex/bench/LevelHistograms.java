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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.UniformReservoir;

import org.cellindex.geo.CoveringPolicy;
import org.cellindex.query.Operation;

/**
 * Latency (nanoseconds) and cardinality histograms of one operation, one pair per query level, plus the
 * distribution of query covering sizes. Histograms are registered as
 * {@code query.<operation>.level<NN>.latency|cardinality} and {@code query.<operation>.coveringSize}.
 *
 * Only mutated by the query loop.
 */
public class LevelHistograms
{
    private final Operation operation;
    private final MetricRegistry registry;
    private final Histogram[] latencies = new Histogram[CoveringPolicy.MAX_LEVEL + 1];
    private final Histogram[] cardinalities = new Histogram[CoveringPolicy.MAX_LEVEL + 1];
    private final Histogram coveringSizes;
    private final List<String> names = new ArrayList<>();

    public LevelHistograms(Operation operation, int reservoirSize, MetricRegistry registry)
    {
        Preconditions.checkArgument(reservoirSize > 0, "Reservoir size must be positive, got %s", reservoirSize);
        this.operation = operation;
        this.registry = registry;
        for (int level = 0; level < latencies.length; level++)
        {
            latencies[level] = register(name(level, "latency"), reservoirSize);
            cardinalities[level] = register(name(level, "cardinality"), reservoirSize);
        }
        coveringSizes = register(MetricRegistry.name("query", operation.toString(), "coveringSize"), reservoirSize);
    }

    private String name(int level, String kind)
    {
        return MetricRegistry.name("query", operation.toString(), String.format("level%02d", level), kind);
    }

    private Histogram register(String name, int reservoirSize)
    {
        names.add(name);
        return registry.register(name, new Histogram(new UniformReservoir(reservoirSize)));
    }

    public Operation operation()
    {
        return operation;
    }

    public void record(int level, long latencyNanos, long count)
    {
        latencies[level].update(latencyNanos);
        cardinalities[level].update(count);
    }

    public void recordCoveringSize(int size)
    {
        coveringSizes.update(size);
    }

    public Histogram latency(int level)
    {
        return latencies[level];
    }

    public Histogram cardinality(int level)
    {
        return cardinalities[level];
    }

    public Histogram coveringSizes()
    {
        return coveringSizes;
    }

    /**
     * @return the number of queries recorded over all levels
     */
    public long count()
    {
        long count = 0;
        for (Histogram latency : latencies)
            count += latency.getCount();
        return count;
    }

    /**
     * Removes this set's histograms from the registry, so that a new set can be registered for the same operation.
     */
    public void release()
    {
        for (String name : names)
            registry.remove(name);
    }

    /**
     * A fresh set for the same operation, replacing this one in the registry.
     */
    public LevelHistograms reset(int reservoirSize)
    {
        release();
        return new LevelHistograms(operation, reservoirSize, registry);
    }
}
