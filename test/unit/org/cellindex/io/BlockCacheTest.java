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
import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class BlockCacheTest
{
    @Test
    public void testLoadsOnce() throws IOException
    {
        AtomicInteger loads = new AtomicInteger();
        BlockCache cache = new BlockCache(1024, block -> {
            loads.incrementAndGet();
            return ByteBuffer.wrap(new byte[]{ (byte) block, 1, 2 });
        });

        assertEquals(7, cache.get(7).get(0));
        assertEquals(3, cache.get(7).remaining());
        assertEquals(1, loads.get());
        assertEquals(1, cache.stats().hitCount());
        assertEquals(1, cache.stats().missCount());
        assertEquals(3, cache.weightedSize());
    }

    @Test
    public void testCallersGetIndependentPositions() throws IOException
    {
        BlockCache cache = new BlockCache(1024, block -> ByteBuffer.wrap(new byte[]{ 1, 2, 3, 4 }));

        ByteBuffer first = cache.get(0);
        first.get();
        first.get();
        ByteBuffer second = cache.get(0);
        assertEquals(0, second.position());
        assertEquals(4, second.remaining());
    }

    @Test
    public void testEvictsBeyondCapacity() throws IOException
    {
        AtomicInteger loads = new AtomicInteger();
        BlockCache cache = new BlockCache(10, block -> {
            loads.incrementAndGet();
            return ByteBuffer.allocate(8);
        });

        cache.get(0);
        cache.get(1);
        cache.get(2);
        assertTrue(cache.weightedSize() <= 10);
        assertEquals(3, loads.get());
    }

    @Test
    public void testReadFailurePropagates()
    {
        BlockCache cache = new BlockCache(1024, block -> {
            throw new IOException("disk on fire");
        });

        try
        {
            cache.get(0);
            fail("Expected the read failure to propagate");
        }
        catch (IOException e)
        {
            assertEquals("disk on fire", e.getMessage());
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testMetrics() throws IOException
    {
        BlockCache cache = new BlockCache(1024, block -> ByteBuffer.allocate(16));
        MetricRegistry registry = new MetricRegistry();
        cache.registerMetrics(registry, "index.cache");

        cache.get(0);
        cache.get(0);
        cache.get(1);

        assertEquals(1L, ((Gauge<Long>) registry.getGauges().get("index.cache.hits")).getValue().longValue());
        assertEquals(2L, ((Gauge<Long>) registry.getGauges().get("index.cache.misses")).getValue().longValue());
        assertEquals(32L, ((Gauge<Long>) registry.getGauges().get("index.cache.weightedSize")).getValue().longValue());
        assertEquals(1024L, ((Gauge<Long>) registry.getGauges().get("index.cache.capacity")).getValue().longValue());

        cache.invalidateAll();
        assertEquals(0L, cache.weightedSize());
    }
}
