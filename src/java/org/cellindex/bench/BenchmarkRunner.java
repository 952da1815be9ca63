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
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import com.codahale.metrics.MetricRegistry;
import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.cellindex.backend.IndexBackend;
import org.cellindex.config.BenchmarkDescriptor;
import org.cellindex.exceptions.ConfigurationException;
import org.cellindex.query.Operation;
import org.cellindex.source.SpatialObjectSource;

/**
 * Runs every configured operation against one backend, {@code repeat_count} times each, and prints a report after
 * every run. Repeats of an operation either start from empty histograms or keep recording into the same ones,
 * depending on {@code accumulate_across_repeats}. An interrupt ends the whole benchmark.
 */
public class BenchmarkRunner
{
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkRunner.class);

    private final BenchmarkDescriptor descriptor;
    private final IndexBackend backend;
    private final SpatialObjectSource.Factory sources;
    private final MetricRegistry registry;
    private final PrintStream out;

    public BenchmarkRunner(BenchmarkDescriptor descriptor, IndexBackend backend, SpatialObjectSource.Factory sources, MetricRegistry registry, PrintStream out)
    {
        this.descriptor = descriptor;
        this.backend = backend;
        this.sources = sources;
        this.registry = registry;
        this.out = out;
    }

    public List<RunSummary> run(InterruptSource interrupts) throws IOException, ConfigurationException
    {
        descriptor.checkSupported(backend);

        List<RunSummary> summaries = new ArrayList<>();
        for (Operation operation : descriptor.operations())
        {
            LevelHistograms histograms = new LevelHistograms(operation, descriptor.histogramReservoirSize(), registry);
            for (int repeat = 1; repeat <= descriptor.repeatCount(); repeat++)
            {
                if (repeat > 1 && !descriptor.accumulateAcrossRepeats())
                    histograms = histograms.reset(descriptor.histogramReservoirSize());

                if (!summaries.isEmpty())
                    out.println();
                out.printf("starting query type %s shape %s on %s (run %d of %d)%n",
                           operation, descriptor.shape(), backend.name(), repeat, descriptor.repeatCount());

                RunSummary summary;
                try (QuerySampler sampler = new QuerySampler(sources.open(), descriptor.selectivityPercent(), descriptor.sampleSeed()))
                {
                    summary = newDriver(operation, histograms).run(sampler, interrupts);
                }
                summaries.add(summary);

                out.printf("finished query type %s shape %s%n", operation, descriptor.shape());
                LevelReport.print(histograms, out);
                LevelReport.printCoveringSizes(histograms, out);
                out.flush();

                if (summary.cancelled())
                {
                    logger.info("Benchmark interrupted during {} run {} of {}", operation, repeat, descriptor.repeatCount());
                    return summaries;
                }
            }
        }
        return summaries;
    }

    @VisibleForTesting
    BenchmarkDriver newDriver(Operation operation, LevelHistograms histograms) throws ConfigurationException
    {
        return new BenchmarkDriver(descriptor, operation, backend, histograms);
    }
}
