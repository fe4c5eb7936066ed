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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import io.vertx.core.json.JsonObject;
import org.querygate.acl.RoleDataCache;
import org.querygate.exceptions.HydrationException;

/**
 * {@link HydrationSource} that serves records from a {@link RoleDataCache} and reads the delegate only on a miss
 */
public class CachingHydrationSource implements HydrationSource
{
    private final HydrationSource delegate;
    private final RoleDataCache cache;

    public CachingHydrationSource(HydrationSource delegate, RoleDataCache cache)
    {
        this.delegate = delegate;
        this.cache = cache;
    }

    @Override
    public Optional<JsonObject> profile(String principalId) throws HydrationException
    {
        return cache.profile("user_profile:" + principalId, () -> delegate.profile(principalId));
    }

    @Override
    public List<JsonObject> roles(String principalId) throws HydrationException
    {
        return cache.records("user_roles:" + principalId, () -> snapshot(delegate.roles(principalId)));
    }

    @Override
    public List<JsonObject> rolePermissions(String roleId) throws HydrationException
    {
        return cache.records("role_permissions:" + roleId, () -> snapshot(delegate.rolePermissions(roleId)));
    }

    @Override
    public List<JsonObject> roleDatasetAccess(String roleId) throws HydrationException
    {
        return cache.records("role_dataset_access:" + roleId, () -> snapshot(delegate.roleDatasetAccess(roleId)));
    }

    private static List<JsonObject> snapshot(List<JsonObject> records)
    {
        return records == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(records));
    }
}
