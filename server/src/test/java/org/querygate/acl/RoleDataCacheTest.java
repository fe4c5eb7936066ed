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

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.vertx.core.json.JsonObject;
import org.querygate.common.utils.MillisecondBoundConfiguration;
import org.querygate.config.CacheConfiguration;
import org.querygate.config.yaml.CacheConfigurationImpl;
import org.querygate.exceptions.HydrationException;
import org.querygate.utils.MutableClock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RoleDataCache}
 */
class RoleDataCacheTest
{
    private static final CacheConfiguration ENABLED
    = new CacheConfigurationImpl(true, MillisecondBoundConfiguration.parse("1m"), 100);

    private AtomicLong nanos;
    private AtomicInteger loads;
    private RoleDataCache cache;

    @BeforeEach
    void setup()
    {
        nanos = new AtomicLong();
        loads = new AtomicInteger();
        cache = new RoleDataCache(ENABLED, nanos::get);
    }

    @Test
    void testHydratesOnceWithinTtl()
    {
        assertThat(cache.records("user_roles:u1", this::load)).isEqualTo(roles(1));
        nanos.addAndGet(TimeUnit.SECONDS.toNanos(59));
        assertThat(cache.records("user_roles:u1", this::load)).isEqualTo(roles(1));
        assertThat(loads.get()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void testEntriesExpireAfterWrite()
    {
        cache.records("user_roles:u1", this::load);
        nanos.addAndGet(TimeUnit.SECONDS.toNanos(61));

        assertThat(cache.records("user_roles:u1", this::load)).isEqualTo(roles(2));
        assertThat(loads.get()).isEqualTo(2);
    }

    @Test
    void testKeysAreIndependent()
    {
        cache.records("user_roles:u1", this::load);
        cache.records("user_roles:u2", this::load);
        cache.profile("user_profile:u1", () -> Optional.of(profile()));

        assertThat(loads.get()).isEqualTo(3);
        assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    void testInvalidateAll()
    {
        cache.records("user_roles:u1", this::load);
        cache.profile("user_profile:u1", () -> Optional.of(profile()));
        cache.invalidateAll();

        assertThat(cache.size()).isZero();
        assertThat(cache.records("user_roles:u1", this::load)).isEqualTo(roles(3));
    }

    @Test
    void testLoaderFailureIsNotCached()
    {
        assertThatThrownBy(() -> cache.records("user_roles:u1", () -> {
            throw new HydrationException("unavailable");
        })).isInstanceOf(HydrationException.class);

        assertThat(cache.size()).isZero();
        assertThat(cache.records("user_roles:u1", this::load)).isEqualTo(roles(1));
    }

    @Test
    void testMissingProfileIsNotCached()
    {
        assertThat(cache.profile("user_profile:u1", Optional::empty)).isEmpty();
        assertThat(cache.size()).isZero();

        assertThat(cache.profile("user_profile:u1", () -> Optional.of(profile()))).contains(profile(1));
        assertThat(cache.profile("user_profile:u1", () -> Optional.of(profile()))).contains(profile(1));
        assertThat(loads.get()).isEqualTo(1);
    }

    @Test
    void testDisabledCacheAlwaysLoads()
    {
        CacheConfiguration disabled = new CacheConfigurationImpl(false, MillisecondBoundConfiguration.parse("1m"), 100);
        RoleDataCache passThrough = new RoleDataCache(disabled, nanos::get);

        assertThat(passThrough.enabled()).isFalse();
        assertThat(passThrough.records("k", this::load)).isEqualTo(roles(1));
        assertThat(passThrough.records("k", this::load)).isEqualTo(roles(2));
        assertThat(passThrough.profile("k", () -> Optional.of(profile()))).contains(profile(3));
        assertThat(passThrough.size()).isZero();
        passThrough.invalidateAll();
    }

    @Test
    void testClockDrivenExpiry()
    {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        RoleDataCache clockCache = new RoleDataCache(ENABLED, clock);

        clockCache.records("k", this::load);
        clock.advance(Duration.ofSeconds(30));
        assertThat(clockCache.records("k", this::load)).isEqualTo(roles(1));
        clock.advance(Duration.ofSeconds(31));
        assertThat(clockCache.records("k", this::load)).isEqualTo(roles(2));
    }

    private List<JsonObject> load()
    {
        return roles(loads.incrementAndGet());
    }

    private JsonObject profile()
    {
        return profile(loads.incrementAndGet());
    }

    private static List<JsonObject> roles(int version)
    {
        return Collections.singletonList(new JsonObject().put("role_id", "r" + version));
    }

    private static JsonObject profile(int version)
    {
        return new JsonObject().put("user_id", "u1").put("version", version);
    }
}
