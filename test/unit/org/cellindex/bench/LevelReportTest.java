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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.codahale.metrics.MetricRegistry;

import org.cellindex.query.Operation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LevelReportTest
{
    @Test
    public void testPrintsRecordedLevelsOnly()
    {
        LevelHistograms histograms = new LevelHistograms(Operation.CONTAINS, 64, new MetricRegistry());
        for (int i = 1; i <= 4; i++)
            histograms.record(20, TimeUnit.MILLISECONDS.toNanos(2), 10);
        histograms.record(8, TimeUnit.MICROSECONDS.toNanos(500), 0);

        String[] lines = print(histograms).split("\n");
        assertEquals(3, lines.length);
        assertEquals(LevelReport.HEADER, lines[0]);
        assertEquals(String.format("%5d %7d %8d %8.2f %8.2f %8.2f %8.2f %8.2f %8d %8d %8d %8d", 8, 39135, 1, 0.5, 0.5, 0.5, 0.5, 0.5, 0, 0, 0, 0),
                     lines[1]);
        assertEquals(String.format("%5d %7d %8d %8.2f %8.2f %8.2f %8.2f %8.2f %8d %8d %8d %8d", 20, 9, 4, 2.0, 2.0, 2.0, 2.0, 2.0, 10, 10, 10, 10),
                     lines[2]);
    }

    @Test
    public void testEmptyReportIsHeaderOnly()
    {
        LevelHistograms histograms = new LevelHistograms(Operation.INTERSECTS, 64, new MetricRegistry());
        assertEquals(LevelReport.HEADER + "\n", print(histograms));

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        LevelReport.printCoveringSizes(histograms, new PrintStream(bytes, true));
        assertEquals(0, bytes.size());
    }

    @Test
    public void testCoveringSizes()
    {
        LevelHistograms histograms = new LevelHistograms(Operation.INTERSECTS, 64, new MetricRegistry());
        histograms.recordCoveringSize(1);
        histograms.recordCoveringSize(4);
        histograms.recordCoveringSize(8);

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        LevelReport.printCoveringSizes(histograms, new PrintStream(bytes, true));
        String line = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(line, line.startsWith("covering sizes: n=3 min=1 p50=4 "));
        assertTrue(line, line.trim().endsWith("max=8"));
    }

    @Test
    public void testResetReplacesRegisteredHistograms()
    {
        MetricRegistry registry = new MetricRegistry();
        LevelHistograms histograms = new LevelHistograms(Operation.CONTAINS, 64, registry);
        histograms.record(12, 1000, 1);
        assertEquals(2 * 31 + 1, registry.getHistograms().size());

        LevelHistograms fresh = histograms.reset(64);
        assertEquals(0, fresh.count());
        assertEquals(2 * 31 + 1, registry.getHistograms().size());
        assertEquals(0, registry.histogram("query.contains.level12.latency").getCount());
    }

    private static String print(LevelHistograms histograms)
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        LevelReport.print(histograms, new PrintStream(bytes, true));
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }
}
