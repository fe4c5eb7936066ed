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

/**
 * A coarse permission granted to a role, e.g. {@code query:execute}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RolePermission
{
    private final String permission;

    @JsonCreator
    public RolePermission(@JsonProperty(value = "permission", required = true) String permission)
    {
        this.permission = Objects.requireNonNull(permission, "permission");
    }

    public static Optional<RolePermission> fromRaw(JsonObject raw)
    {
        return HydrationRecords.scalar(raw, "permission").map(RolePermission::new);
    }

    public String permission()
    {
        return permission;
    }
}
