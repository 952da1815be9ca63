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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ShutdownHookInterruptSourceTest
{
    @Test
    public void testHookReleasesWaiters() throws Exception
    {
        ShutdownHookInterruptSource source = new ShutdownHookInterruptSource();
        CompletableFuture<Void> waiter = CompletableFuture.runAsync(() -> {
            try
            {
                source.await();
            }
            catch (InterruptedException e)
            {
                throw new AssertionError(e);
            }
        });

        Thread.sleep(50);
        assertFalse(waiter.isDone());

        // run the hook body directly, as the JVM would on SIGINT; it returns at once since the run already finished
        source.close();
        source.hook.run();
        waiter.get(10, TimeUnit.SECONDS);
        assertTrue(waiter.isDone());
    }

    @Test
    public void testCloseRemovesHook()
    {
        ShutdownHookInterruptSource source = new ShutdownHookInterruptSource();
        source.close();
        assertFalse("hook was already removed", Runtime.getRuntime().removeShutdownHook(source.hook));
    }
}
