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

package org.querygate.acl.hydration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.vertx.core.json.JsonObject;
import org.querygate.acl.RoleDataCache;
import org.querygate.common.utils.MillisecondBoundConfiguration;
import org.querygate.config.yaml.CacheConfigurationImpl;
import org.querygate.exceptions.HydrationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CachingHydrationSource}
 */
class CachingHydrationSourceTest
{
    private HydrationSource delegate;
    private RoleDataCache cache;
    private CachingHydrationSource source;

    @BeforeEach
    void setup()
    {
        delegate = mock(HydrationSource.class);
        cache = new RoleDataCache(new CacheConfigurationImpl(true, MillisecondBoundConfiguration.parse("5m"), 100),
                                  Clock.systemUTC());
        source = new CachingHydrationSource(delegate, cache);
    }

    @Test
    void testRolesAreReadOnce()
    {
        List<JsonObject> roles = new ArrayList<>();
        roles.add(new JsonObject().put("role_id", "r1").put("role_name", "analyst"));
        when(delegate.roles("u1")).thenReturn(roles);

        List<JsonObject> first = source.roles("u1");
        List<JsonObject> second = source.roles("u1");

        assertThat(first).isEqualTo(second).hasSize(1);
        verify(delegate, times(1)).roles("u1");

        // the cached list does not follow changes to the delegate's list
        roles.add(new JsonObject().put("role_id", "r2"));
        assertThat(source.roles("u1")).hasSize(1);
        assertThatThrownBy(() -> first.add(new JsonObject())).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testRoleRecordsAreKeyedByKind()
    {
        when(delegate.rolePermissions("r1"))
        .thenReturn(Collections.singletonList(new JsonObject().put("permission", "query:execute")));
        when(delegate.roleDatasetAccess("r1"))
        .thenReturn(Collections.singletonList(new JsonObject().put("dataset_id", "sales")));

        assertThat(source.rolePermissions("r1")).extracting(r -> r.getString("permission"))
                                                .containsExactly("query:execute");
        assertThat(source.roleDatasetAccess("r1")).extracting(r -> r.getString("dataset_id"))
                                                   .containsExactly("sales");
        source.rolePermissions("r1");
        source.roleDatasetAccess("r1");

        verify(delegate, times(1)).rolePermissions("r1");
        verify(delegate, times(1)).roleDatasetAccess("r1");
    }

    @Test
    void testNullListBecomesEmpty()
    {
        when(delegate.rolePermissions("r1")).thenReturn(null);

        assertThat(source.rolePermissions("r1")).isEmpty();
    }

    @Test
    void testMissingProfileIsLookedUpAgain()
    {
        when(delegate.profile("u1")).thenReturn(Optional.empty())
                                    .thenReturn(Optional.of(new JsonObject().put("user_id", "u1")));

        assertThat(source.profile("u1")).isEmpty();
        assertThat(source.profile("u1")).isPresent();
        assertThat(source.profile("u1")).isPresent();

        verify(delegate, times(2)).profile("u1");
    }

    @Test
    void testFailuresAreNotCached()
    {
        when(delegate.roles("u1")).thenThrow(new HydrationException("unavailable"))
                                  .thenReturn(Collections.emptyList());

        assertThatThrownBy(() -> source.roles("u1")).isInstanceOf(HydrationException.class);
        assertThat(source.roles("u1")).isEmpty();
        verify(delegate, times(2)).roles("u1");
    }

    @Test
    void testInvalidateAllRereadsDelegate()
    {
        when(delegate.roles("u1")).thenReturn(Collections.emptyList());

        source.roles("u1");
        cache.invalidateAll();
        source.roles("u1");

        verify(delegate, times(2)).roles("u1");
    }
}
