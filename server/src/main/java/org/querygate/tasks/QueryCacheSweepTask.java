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

package org.querygate.tasks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Promise;
import org.querygate.cache.QueryCache;
import org.querygate.common.utils.DurationSpec;
import org.querygate.config.QueryCacheConfiguration;

/**
 * Removes expired entries from the query cache at the configured sweep interval
 */
public class QueryCacheSweepTask implements PeriodicTask
{
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryCacheSweepTask.class);

    private final QueryCache queryCache;
    private final QueryCacheConfiguration config;

    public QueryCacheSweepTask(QueryCache queryCache, QueryCacheConfiguration config)
    {
        this.queryCache = queryCache;
        this.config = config;
    }

    @Override
    public DurationSpec delay()
    {
        return config.sweepInterval();
    }

    @Override
    public boolean shouldSkip()
    {
        return !config.enabled();
    }

    @Override
    public void execute(Promise<Void> promise)
    {
        try
        {
            int removed = queryCache.sweepExpired();
            if (removed > 0)
            {
                LOGGER.info("Swept expired query cache entries. removed={}", removed);
            }
            promise.complete();
        }
        catch (RuntimeException e)
        {
            LOGGER.warn("Unable to sweep expired query cache entries", e);
            promise.fail(e);
        }
    }
}
