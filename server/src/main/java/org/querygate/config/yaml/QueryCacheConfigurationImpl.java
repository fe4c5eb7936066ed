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

package org.querygate.config.yaml;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.querygate.common.utils.SecondBoundConfiguration;
import org.querygate.config.QueryCacheConfiguration;

/**
 * {@inheritDoc}
 */
public class QueryCacheConfigurationImpl implements QueryCacheConfiguration
{
    public static final int DEFAULT_MAX_CACHED_ROWS = 10_000;

    @JsonProperty("enabled")
    protected final boolean enabled;

    @JsonProperty("store")
    protected final StoreType store;

    @JsonProperty("ttl")
    protected final SecondBoundConfiguration ttl;

    @JsonProperty("max_cached_rows")
    protected final int maxCachedRows;

    @JsonProperty("sweep_interval")
    protected final SecondBoundConfiguration sweepInterval;

    @JsonProperty("hit_count_pool_size")
    protected final int hitCountPoolSize;

    public QueryCacheConfigurationImpl()
    {
        this(true,
             StoreType.MEMORY,
             SecondBoundConfiguration.parse("24h"),
             DEFAULT_MAX_CACHED_ROWS,
             SecondBoundConfiguration.parse("10m"),
             2);
    }

    public QueryCacheConfigurationImpl(boolean enabled,
                                       StoreType store,
                                       SecondBoundConfiguration ttl,
                                       int maxCachedRows,
                                       SecondBoundConfiguration sweepInterval,
                                       int hitCountPoolSize)
    {
        this.enabled = enabled;
        this.store = store;
        this.ttl = ttl;
        this.maxCachedRows = maxCachedRows;
        this.sweepInterval = sweepInterval;
        this.hitCountPoolSize = hitCountPoolSize;
    }

    @Override
    @JsonProperty("enabled")
    public boolean enabled()
    {
        return enabled;
    }

    @Override
    @JsonProperty("store")
    public StoreType store()
    {
        return store;
    }

    @Override
    @JsonProperty("ttl")
    public SecondBoundConfiguration ttl()
    {
        return ttl;
    }

    @Override
    @JsonProperty("max_cached_rows")
    public int maxCachedRows()
    {
        return maxCachedRows;
    }

    @Override
    @JsonProperty("sweep_interval")
    public SecondBoundConfiguration sweepInterval()
    {
        return sweepInterval;
    }

    @Override
    @JsonProperty("hit_count_pool_size")
    public int hitCountPoolSize()
    {
        return hitCountPoolSize;
    }
}
