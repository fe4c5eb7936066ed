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

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vertx.core.json.JsonObject;
import org.jetbrains.annotations.Nullable;

/**
 * A role held by a principal
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RoleAssignment
{
    private final String roleId;
    private final String roleName;

    @JsonCreator
    public RoleAssignment(@JsonProperty("role_id") @Nullable String roleId,
                          @JsonProperty(value = "role_name", required = true) String roleName)
    {
        this.roleId = roleId == null || roleId.isEmpty() ? null : roleId;
        this.roleName = Objects.requireNonNull(roleName, "role_name");
    }

    /**
     * Recovers the role key from a record that failed validation, preferring {@code role_id} over
     * {@code role_name}
     */
    public static Optional<RoleAssignment> fromRaw(JsonObject raw)
    {
        Optional<String> roleId = HydrationRecords.scalar(raw, "role_id");
        Optional<String> roleName = HydrationRecords.scalar(raw, "role_name");
        if (roleId.isEmpty() && roleName.isEmpty())
        {
            return Optional.empty();
        }
        return Optional.of(new RoleAssignment(roleId.orElse(null), roleName.orElseGet(roleId::get)));
    }

    /**
     * @return the identifier used to look up the role's permissions and grants
     */
    public String key()
    {
        return roleId != null ? roleId : roleName;
    }

    public String roleName()
    {
        return roleName;
    }
}
