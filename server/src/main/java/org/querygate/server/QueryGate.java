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

package org.querygate.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import io.vertx.core.Vertx;
import org.querygate.common.CqlSessionProvider;
import org.querygate.concurrent.TaskExecutorPool;
import org.querygate.tasks.PeriodicTaskExecutor;
import org.querygate.tasks.QueryCacheSweepTask;

/**
 * Lifecycle of the background parts of QueryGate: the periodic cache sweep, the worker pools and the Cassandra
 * session
 */
@Singleton
public class QueryGate
{
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryGate.class);

    private final PeriodicTaskExecutor periodicTaskExecutor;
    private final QueryCacheSweepTask sweepTask;
    private final TaskExecutorPool hitCountPool;
    private final TaskExecutorPool internalPool;
    private final CqlSessionProvider sessionProvider;
    private final Vertx vertx;

    @Inject
    public QueryGate(PeriodicTaskExecutor periodicTaskExecutor,
                     QueryCacheSweepTask sweepTask,
                     @Named(MainModule.HIT_COUNT_POOL) TaskExecutorPool hitCountPool,
                     @Named(MainModule.INTERNAL_POOL) TaskExecutorPool internalPool,
                     CqlSessionProvider sessionProvider,
                     Vertx vertx)
    {
        this.periodicTaskExecutor = periodicTaskExecutor;
        this.sweepTask = sweepTask;
        this.hitCountPool = hitCountPool;
        this.internalPool = internalPool;
        this.sessionProvider = sessionProvider;
        this.vertx = vertx;
    }

    public void start()
    {
        LOGGER.info("Starting QueryGate");
        periodicTaskExecutor.schedule(sweepTask);
    }

    public void stop()
    {
        LOGGER.info("Stopping QueryGate");
        periodicTaskExecutor.close();
        hitCountPool.close();
        internalPool.close();
        try
        {
            sessionProvider.close();
        }
        catch (RuntimeException e)
        {
            LOGGER.warn("Failed to close the Cassandra session", e);
        }
        vertx.close();
    }
}
