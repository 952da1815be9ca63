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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Uninterruptibles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Catches Ctrl-C. The shutdown hook signals the interrupt, then holds the JVM until the run it interrupted has
 * reported, or for at most {@link #REPORT_GRACE_SECONDS}.
 */
public class ShutdownHookInterruptSource implements InterruptSource, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(ShutdownHookInterruptSource.class);

    static final long REPORT_GRACE_SECONDS = 30;

    private final CountDownLatch interrupted = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);
    @VisibleForTesting
    final Thread hook;

    public ShutdownHookInterruptSource()
    {
        hook = new Thread(() -> {
            logger.info("Received an interrupt, stopping...");
            interrupted.countDown();
            Uninterruptibles.awaitUninterruptibly(finished, REPORT_GRACE_SECONDS, TimeUnit.SECONDS);
        }, "interrupt-hook");
        Runtime.getRuntime().addShutdownHook(hook);
    }

    public void await() throws InterruptedException
    {
        interrupted.await();
    }

    public void close()
    {
        finished.countDown();
        if (interrupted.getCount() == 0)
            return;

        try
        {
            Runtime.getRuntime().removeShutdownHook(hook);
        }
        catch (IllegalStateException e)
        {
            logger.debug("JVM already shutting down, leaving the interrupt hook in place", e);
        }
    }
}
