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

import java.io.PrintStream;
import java.util.concurrent.TimeUnit;

import com.codahale.metrics.Snapshot;

import org.cellindex.geo.CellMetrics;
import org.cellindex.geo.CoveringPolicy;

/**
 * Prints the per level latency and cardinality table of a run. Levels without samples are left out.
 */
public final class LevelReport
{
    public static final String HEADER = "level__meters_____numQ_pMin(ms)__p50(ms)__p95(ms)__p99(ms)_pMax(ms)__count50__count95__count99_countMax";

    private static final String ROW = "%5d %7d %8d %8.2f %8.2f %8.2f %8.2f %8.2f %8d %8d %8d %8d%n";

    private LevelReport()
    {
    }

    public static void print(LevelHistograms histograms, PrintStream out)
    {
        out.println(HEADER);
        for (int level = 0; level <= CoveringPolicy.MAX_LEVEL; level++)
        {
            long samples = histograms.latency(level).getCount();
            if (samples == 0)
                continue;

            Snapshot latency = histograms.latency(level).getSnapshot();
            Snapshot cardinality = histograms.cardinality(level).getSnapshot();
            out.printf(ROW,
                       level,
                       (long) CellMetrics.metersFromLevel(level),
                       samples,
                       millis(latency.getMin()),
                       millis(latency.getMedian()),
                       millis(latency.get95thPercentile()),
                       millis(latency.get99thPercentile()),
                       millis(latency.getMax()),
                       Math.round(cardinality.getMedian()),
                       Math.round(cardinality.get95thPercentile()),
                       Math.round(cardinality.get99thPercentile()),
                       cardinality.getMax());
        }
    }

    public static void printCoveringSizes(LevelHistograms histograms, PrintStream out)
    {
        Snapshot sizes = histograms.coveringSizes().getSnapshot();
        if (sizes.size() == 0)
            return;
        out.printf("covering sizes: n=%d min=%d p50=%d p99=%d max=%d%n",
                   histograms.coveringSizes().getCount(),
                   sizes.getMin(),
                   Math.round(sizes.getMedian()),
                   Math.round(sizes.get99thPercentile()),
                   sizes.getMax());
    }

    private static double millis(double nanos)
    {
        return nanos / TimeUnit.MILLISECONDS.toNanos(1);
    }
}
