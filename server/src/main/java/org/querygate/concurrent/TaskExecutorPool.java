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

package org.querygate.concurrent;

import java.util.concurrent.Callable;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;

/**
 * A named pool of Vert.x worker threads for blocking work that must not run on the caller's thread, such as
 * hit-count updates and periodic cache sweeps. Timers are delegated to the owning {@link Vertx} instance.
 */
public class TaskExecutorPool
{
    private final String name;
    private final Vertx vertx;
    private final WorkerExecutor workerExecutor;

    public TaskExecutorPool(String name, Vertx vertx, int poolSize)
    {
        this.name = name;
        this.vertx = vertx;
        this.workerExecutor = vertx.createSharedWorkerExecutor(name, poolSize);
    }

    /**
     * @param blockingCode the work to run on a worker thread
     * @param ordered      whether runs submitted to this pool execute one at a time in submission order
     * @param <T>          the result type
     * @return a future completed with the result of {@code blockingCode}
     */
    public <T> Future<T> executeBlocking(Callable<T> blockingCode, boolean ordered)
    {
        return workerExecutor.executeBlocking(blockingCode, ordered);
    }

    /**
     * Runs {@code action} on a worker thread without ordering guarantees
     *
     * @param action the work to run
     * @return a future completed when the action finishes
     */
    public Future<Void> runBlocking(Runnable action)
    {
        return executeBlocking(() -> {
            action.run();
            return null;
        }, false);
    }

    public long setTimer(long delayMillis, Handler<Long> handler)
    {
        return vertx.setTimer(delayMillis, handler);
    }

    public boolean cancelTimer(long timerId)
    {
        return vertx.cancelTimer(timerId);
    }

    public String name()
    {
        return name;
    }

    public Future<Void> close()
    {
        return workerExecutor.close();
    }
}
