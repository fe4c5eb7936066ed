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

import org.junit.jupiter.api.Test;

import io.vertx.core.Promise;
import org.querygate.cache.QueryCache;
import org.querygate.common.utils.SecondBoundConfiguration;
import org.querygate.config.QueryCacheConfiguration;
import org.querygate.exceptions.CacheStoreException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link QueryCacheSweepTask}
 */
class QueryCacheSweepTaskTest
{
    @Test
    void testDelayFollowsSweepInterval()
    {
        QueryCacheConfiguration config = config(true);

        QueryCacheSweepTask task = new QueryCacheSweepTask(mock(QueryCache.class), config);

        assertThat(task.delay()).isEqualTo(SecondBoundConfiguration.parse("30s"));
        assertThat(task.initialDelay()).isEqualTo(task.delay());
        assertThat(task.shouldSkip()).isFalse();
    }

    @Test
    void testSkippedWhenCacheDisabled()
    {
        QueryCacheSweepTask task = new QueryCacheSweepTask(mock(QueryCache.class), config(false));

        assertThat(task.shouldSkip()).isTrue();
    }

    @Test
    void testCompletesAfterSweep()
    {
        QueryCache cache = mock(QueryCache.class);
        when(cache.sweepExpired()).thenReturn(3);
        Promise<Void> promise = Promise.promise();

        new QueryCacheSweepTask(cache, config(true)).execute(promise);

        assertThat(promise.future().succeeded()).isTrue();
    }

    @Test
    void testFailsWhenStoreFails()
    {
        QueryCache cache = mock(QueryCache.class);
        when(cache.sweepExpired()).thenThrow(new CacheStoreException("store down"));
        Promise<Void> promise = Promise.promise();

        new QueryCacheSweepTask(cache, config(true)).execute(promise);

        assertThat(promise.future().failed()).isTrue();
        assertThat(promise.future().cause()).isInstanceOf(CacheStoreException.class)
                                            .hasMessage("store down");
    }

    private static QueryCacheConfiguration config(boolean enabled)
    {
        QueryCacheConfiguration config = mock(QueryCacheConfiguration.class);
        when(config.enabled()).thenReturn(enabled);
        when(config.sweepInterval()).thenReturn(SecondBoundConfiguration.parse("30s"));
        return config;
    }
}
