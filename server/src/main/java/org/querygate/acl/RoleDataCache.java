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

package org.querygate.acl;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.vertx.core.json.JsonObject;
import org.querygate.config.CacheConfiguration;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * Caches role and grant records read while hydrating permission snapshots. Entries expire a fixed time after they
 * were written and are replaced lazily on the next read; there is no background refresh.
 *
 * <p>Profiles and record lists are held in separate caches, keyed by strings such as {@code user_roles:<principal>}.
 */
public class RoleDataCache
{
    private static final Logger LOGGER = LoggerFactory.getLogger(RoleDataCache.class);

    private final CacheConfiguration config;
    // both caches are null when the RoleDataCache is disabled
    private final Cache<String, JsonObject> profiles;
    private final Cache<String, List<JsonObject>> records;

    public RoleDataCache(CacheConfiguration config, Clock clock)
    {
        this(config, clockTicker(clock));
    }

    @VisibleForTesting
    RoleDataCache(CacheConfiguration config, Ticker ticker)
    {
        this.config = config;
        this.profiles = config.enabled() ? initCache(ticker) : null;
        this.records = config.enabled() ? initCache(ticker) : null;
    }

    /**
     * Returns the cached records for {@code key}, hydrating them with {@code loader} when absent or expired.
     * Exceptions thrown by the loader propagate and nothing is cached. When the cache is disabled the loader runs
     * on every call.
     *
     * @param key    the cache key
     * @param loader reads the records from the identity store
     * @return the cached or freshly loaded records
     */
    public List<JsonObject> records(String key, Supplier<List<JsonObject>> loader)
    {
        if (records == null)
        {
            return loader.get();
        }
        return records.get(key, k -> {
            LOGGER.debug("Hydrating role data key={}", k);
            return loader.get();
        });
    }

    /**
     * Returns the cached profile for {@code key}. A missing profile is not cached, so a profile created later is
     * picked up on the next read.
     *
     * @param key    the cache key
     * @param loader reads the profile from the identity store
     * @return the cached or freshly loaded profile, if any
     */
    public Optional<JsonObject> profile(String key, Supplier<Optional<JsonObject>> loader)
    {
        if (profiles == null)
        {
            return loader.get();
        }

        JsonObject cached = profiles.getIfPresent(key);
        if (cached != null)
        {
            return Optional.of(cached);
        }

        LOGGER.debug("Hydrating role data key={}", key);
        Optional<JsonObject> loaded = loader.get();
        loaded.ifPresent(value -> profiles.put(key, value));
        return loaded;
    }

    /**
     * Drops every cached entry. The next read of any key goes to the identity store.
     */
    public void invalidateAll()
    {
        if (!enabled())
        {
            return;
        }
        LOGGER.info("Invalidating role data cache. profiles={} records={}",
                    profiles.estimatedSize(), records.estimatedSize());
        profiles.invalidateAll();
        records.invalidateAll();
    }

    public boolean enabled()
    {
        return records != null;
    }

    @VisibleForTesting
    long size()
    {
        if (!enabled())
        {
            return 0;
        }
        profiles.cleanUp();
        records.cleanUp();
        return profiles.estimatedSize() + records.estimatedSize();
    }

    private <V> Cache<String, V> initCache(Ticker ticker)
    {
        return Caffeine.newBuilder()
                       .expireAfterWrite(config.expireAfterWrite().toMillis(), TimeUnit.MILLISECONDS)
                       .maximumSize(config.maximumSize())
                       .ticker(ticker)
                       // maintenance runs on the calling thread
                       .executor(Runnable::run)
                       .build();
    }

    private static Ticker clockTicker(Clock clock)
    {
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }
}
