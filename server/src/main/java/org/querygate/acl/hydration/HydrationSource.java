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

import java.util.List;
import java.util.Optional;

import io.vertx.core.json.JsonObject;
import org.querygate.exceptions.HydrationException;

/**
 * Source of the profile, role and grant records a permission snapshot is built from. Records are loosely typed;
 * the snapshot builder validates their shape and degrades gracefully when a record does not match.
 *
 * <p>Any failure to reach the underlying store must surface as an exception, never as an empty result, so that a
 * principal is not silently handed an empty (or stale) set of grants.
 */
public interface HydrationSource
{
    /**
     * @param principalId the principal
     * @return the principal's profile record, if one exists
     * @throws HydrationException when the store cannot be read
     */
    Optional<JsonObject> profile(String principalId) throws HydrationException;

    /**
     * @param principalId the principal
     * @return role assignment records, carrying {@code role_id} and {@code role_name}
     * @throws HydrationException when the store cannot be read
     */
    List<JsonObject> roles(String principalId) throws HydrationException;

    /**
     * @param roleId the role
     * @return permission records, carrying {@code permission}
     * @throws HydrationException when the store cannot be read
     */
    List<JsonObject> rolePermissions(String roleId) throws HydrationException;

    /**
     * @param roleId the role
     * @return dataset access records, carrying {@code dataset_id} and an optional {@code table_id}
     * @throws HydrationException when the store cannot be read
     */
    List<JsonObject> roleDatasetAccess(String roleId) throws HydrationException;
}
