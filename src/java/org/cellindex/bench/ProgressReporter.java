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

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the number of finished queries at a fixed interval, from its own thread.
 */
public class ProgressReporter implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);

    private final ScheduledExecutorService executor;
    private final Stopwatch stopwatch = Stopwatch.createStarted();

    public ProgressReporter(long intervalMillis, LongSupplier finished)
    {
        this.executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder().setDaemon(true)
                                                                                             .setNameFormat("progress-reporter-%d")
                                                                                             .build());
        if (intervalMillis > 0)
            executor.scheduleAtFixedRate(() -> logger.info("finished {} queries in {}", finished.getAsLong(), stopwatch),
                                         intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    public void close()
    {
        executor.shutdownNow();
    }
}
