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
package org.cellindex.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletionException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.github.benmanes.caffeine.cache.CacheLoader;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

/**
 * Bounded in-memory cache of the data blocks of one sorted table, weighed by block size.
 *
 * Cached buffers are shared: callers must read them through {@link ByteBuffer#duplicate()} and never write to them.
 */
public class BlockCache
{
    private static final Logger logger = LoggerFactory.getLogger(BlockCache.class);

    private final LoadingCache<Integer, ByteBuffer> cache;
    private final long capacity;

    public interface BlockLoader
    {
        ByteBuffer load(int block) throws IOException;
    }

    public BlockCache(long capacity, BlockLoader loader)
    {
        this.capacity = capacity;
        CacheLoader<Integer, ByteBuffer> cacheLoader = loader::load;
        this.cache = Caffeine.newBuilder()
                             .maximumWeight(capacity)
                             .weigher((Integer block, ByteBuffer buffer) -> buffer.capacity())
                             .executor(Runnable::run)
                             .recordStats()
                             .build(cacheLoader);
    }

    /**
     * @return the block, read from disk on a miss
     */
    public ByteBuffer get(int block) throws IOException
    {
        try
        {
            return cache.get(block).duplicate();
        }
        catch (CompletionException | UncheckedIOException e)
        {
            if (e.getCause() != null)
                Throwables.throwIfInstanceOf(e.getCause(), IOException.class);
            throw e;
        }
    }

    public long capacity()
    {
        return capacity;
    }

    public long weightedSize()
    {
        return cache.policy().eviction().map(e -> e.weightedSize().orElse(0L)).orElse(0L);
    }

    public CacheStats stats()
    {
        return cache.stats();
    }

    public void registerMetrics(MetricRegistry registry, String prefix)
    {
        registry.register(MetricRegistry.name(prefix, "hits"), (Gauge<Long>) () -> cache.stats().hitCount());
        registry.register(MetricRegistry.name(prefix, "misses"), (Gauge<Long>) () -> cache.stats().missCount());
        registry.register(MetricRegistry.name(prefix, "weightedSize"), (Gauge<Long>) this::weightedSize);
        registry.register(MetricRegistry.name(prefix, "capacity"), (Gauge<Long>) this::capacity);
    }

    @VisibleForTesting
    public void invalidateAll()
    {
        cache.invalidateAll();
        cache.cleanUp();
        logger.trace("Invalidated all cached blocks");
    }
}
