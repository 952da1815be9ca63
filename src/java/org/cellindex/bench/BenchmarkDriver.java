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

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2LatLng;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.cellindex.backend.IndexBackend;
import org.cellindex.config.BenchmarkDescriptor;
import org.cellindex.exceptions.ConfigurationException;
import org.cellindex.geo.CoveringPolicy;
import org.cellindex.query.CellPredicate;
import org.cellindex.query.Operation;
import org.cellindex.query.Query;
import org.cellindex.query.QueryPlan;
import org.cellindex.query.QueryResult;
import org.cellindex.query.QueryTranslator;

/**
 * Runs the queries of one operation against a backend and records their latency and cardinality per level.
 *
 * For every sampled center, one query is issued per level, from the maximum query level down to the minimum. A
 * query whose region has no covering under the budget is skipped: it neither counts towards the query budget nor
 * records anything. The run ends when the budget is spent, the sampler runs dry, or the run is cancelled.
 *
 * Queries are issued one at a time from the calling thread. Cancellation, from {@link #cancel()} or from the
 * {@link InterruptSource} watched during {@link #run}, is checked before each query; a query in flight is left to
 * finish and is recorded.
 */
public class BenchmarkDriver
{
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkDriver.class);

    public enum State
    {
        IDLE, SAMPLING, QUERYING, RECORDING, DONE, CANCELLED
    }

    private final BenchmarkDescriptor descriptor;
    private final Operation operation;
    private final IndexBackend backend;
    private final LevelHistograms histograms;
    private final Ticker ticker;

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicLong finished = new AtomicLong();
    private volatile State state = State.IDLE;

    public BenchmarkDriver(BenchmarkDescriptor descriptor, Operation operation, IndexBackend backend, LevelHistograms histograms) throws ConfigurationException
    {
        this(descriptor, operation, backend, histograms, Ticker.systemTicker());
    }

    @VisibleForTesting
    BenchmarkDriver(BenchmarkDescriptor descriptor, Operation operation, IndexBackend backend, LevelHistograms histograms, Ticker ticker) throws ConfigurationException
    {
        if (!backend.supports(operation))
            throw new ConfigurationException(String.format("The %s backend does not support %s queries", backend.name(), operation), false);
        Preconditions.checkArgument(histograms.operation() == operation,
                                    "Histograms of %s cannot record %s queries", histograms.operation(), operation);

        this.descriptor = descriptor;
        this.operation = operation;
        this.backend = backend;
        this.histograms = histograms;
        this.ticker = ticker;
    }

    /**
     * Requests the run to stop before its next query.
     *
     * @return true if this call cancelled the run, false if it was already cancelled
     */
    public boolean cancel()
    {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled()
    {
        return cancelled.get();
    }

    public State state()
    {
        return state;
    }

    public long finishedQueries()
    {
        return finished.get();
    }

    public RunSummary run(QuerySampler sampler, InterruptSource interrupts) throws IOException
    {
        Preconditions.checkState(state == State.IDLE, "A driver runs once, this one is %s", state);

        ExecutorService listenerExecutor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder().setDaemon(true)
                                                                                                      .setNameFormat("interrupt-listener-%d")
                                                                                                      .build());
        Future<?> listener = listenerExecutor.submit(() -> {
            try
            {
                interrupts.await();
                if (cancel())
                    logger.info("Interrupted after {} {} queries, stopping", finished.get(), operation);
            }
            catch (InterruptedException e)
            {
                // the run ended first
                Thread.currentThread().interrupt();
            }
        });

        long start = ticker.read();
        try (ProgressReporter progress = new ProgressReporter(descriptor.progressIntervalMillis(), finished::get))
        {
            long skipped = runQueries(sampler);
            state = cancelled.get() ? State.CANCELLED : State.DONE;
            RunSummary summary = new RunSummary(operation, finished.get(), skipped, cancelled.get(), ticker.read() - start);
            logger.info("Finished {} run: {}", operation, summary);
            return summary;
        }
        finally
        {
            listener.cancel(true);
            listenerExecutor.shutdownNow();
        }
    }

    /**
     * @return the number of skipped queries
     */
    private long runQueries(QuerySampler sampler) throws IOException
    {
        CoveringPolicy policy = descriptor.coveringPolicy();
        long maxQueries = descriptor.maxQueries();
        long skipped = 0;

        while (finished.get() < maxQueries && !cancelled.get())
        {
            state = State.SAMPLING;
            S2LatLng center = sampler.next();
            if (center == null)
            {
                logger.debug("Sampler exhausted after {} objects", sampler.drawn());
                break;
            }

            Query query = new Query(center, descriptor.shape(), operation);
            for (int level = descriptor.queryMaxLevel(); level >= descriptor.queryMinLevel(); level--)
            {
                if (finished.get() >= maxQueries || cancelled.get())
                    break;

                state = State.QUERYING;
                QueryPlan plan = plan(policy, query, level);
                if (plan == null)
                {
                    skipped++;
                    continue;
                }

                long queryStart = ticker.read();
                QueryResult result = backend.execute(plan);
                long latency = ticker.read() - queryStart;
                if (result.isSkipped())
                {
                    skipped++;
                    continue;
                }

                state = State.RECORDING;
                histograms.record(level, latency, result.count(plan.requireDistinct));
                finished.incrementAndGet();
            }
        }
        return skipped;
    }

    @Nullable
    private QueryPlan plan(CoveringPolicy policy, Query query, int level)
    {
        if (!backend.usesCovering())
            return new QueryPlan(query, level, null, false);

        List<S2CellId> covering = policy.covering(query.region(level));
        if (covering == null)
            return null;

        histograms.recordCoveringSize(covering.size());
        CellPredicate predicate = QueryTranslator.translate(operation, covering);
        boolean distinct = descriptor.countingPolicy().requiresDistinct(policy.maxCells(), covering.size());
        return new QueryPlan(query, level, predicate, distinct);
    }
}
