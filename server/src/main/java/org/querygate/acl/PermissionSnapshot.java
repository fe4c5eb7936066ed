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

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.querygate.common.utils.Identifiers;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static org.querygate.common.utils.Identifiers.WILDCARD;

/**
 * What a principal may see, built once per request. Dataset and table names are held normalized.
 *
 * <p>A dataset present in {@link #allowedDatasets()} without an entry in {@link #allowedTables()} grants every
 * table in that dataset. Once any grant lists tables for a dataset, only those tables are granted, whatever
 * other roles grant on the dataset as a whole. {@code *} in the dataset set grants every dataset; {@code *} in a table set grants every
 * table of that dataset.
 */
public final class PermissionSnapshot
{
    private final String principalId;
    private final List<String> roles;
    private final Set<String> permissions;
    private final Set<String> allowedDatasets;
    private final Map<String, Set<String>> allowedTables;
    private final Map<String, Object> profileMetadata;
    private final Instant expiresAt;

    private PermissionSnapshot(Builder builder)
    {
        this.principalId = builder.principalId;
        this.roles = ImmutableList.copyOf(builder.roles);
        this.permissions = ImmutableSet.copyOf(builder.permissions);
        this.allowedDatasets = ImmutableSet.copyOf(builder.allowedDatasets);
        ImmutableMap.Builder<String, Set<String>> tables = ImmutableMap.builder();
        builder.allowedTables.forEach((dataset, tableSet) -> tables.put(dataset, ImmutableSet.copyOf(tableSet)));
        this.allowedTables = tables.build();
        this.profileMetadata = ImmutableMap.copyOf(builder.profileMetadata);
        this.expiresAt = builder.expiresAt;
    }

    public static Builder builder(String principalId)
    {
        return new Builder(principalId);
    }

    public String principalId()
    {
        return principalId;
    }

    /**
     * @return names of the roles the principal holds, in hydration order
     */
    public List<String> roles()
    {
        return roles;
    }

    public Set<String> permissions()
    {
        return permissions;
    }

    public Set<String> allowedDatasets()
    {
        return allowedDatasets;
    }

    public Map<String, Set<String>> allowedTables()
    {
        return allowedTables;
    }

    public Map<String, Object> profileMetadata()
    {
        return profileMetadata;
    }

    public Optional<Instant> expiresAt()
    {
        return Optional.ofNullable(expiresAt);
    }

    public boolean hasPermission(String permission)
    {
        return permissions.contains(permission);
    }

    /**
     * @param dataset a dataset name, normalized or not
     * @return whether the dataset is granted, either by name or through the wildcard
     */
    public boolean canAccessDataset(String dataset)
    {
        return allowedDatasets.contains(WILDCARD) || allowedDatasets.contains(Identifiers.normalize(dataset));
    }

    /**
     * @param dataset a dataset name, normalized or not
     * @param table   a table name, normalized or not
     * @return whether the table is granted
     */
    public boolean canAccessTable(String dataset, String table)
    {
        if (allowedDatasets.contains(WILDCARD))
        {
            return true;
        }

        String normalizedDataset = Identifiers.normalize(dataset);
        if (!allowedDatasets.contains(normalizedDataset))
        {
            return false;
        }

        Set<String> tables = allowedTables.get(normalizedDataset);
        if (tables == null)
        {
            return true;
        }
        return tables.contains(WILDCARD) || tables.contains(Identifiers.normalize(table));
    }

    /**
     * @param now the instant to check against
     * @return {@code true} when an expiry is known and {@code now} is at or after it
     */
    public boolean isExpired(@NotNull Instant now)
    {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    @Override
    public String toString()
    {
        return "PermissionSnapshot{principalId='" + principalId + '\''
               + ", roles=" + roles
               + ", permissions=" + permissions
               + ", allowedDatasets=" + allowedDatasets
               + ", allowedTables=" + allowedTables
               + ", expiresAt=" + expiresAt
               + '}';
    }

    /**
     * Collects grants while hydrating. Not thread-safe; the built snapshot is.
     */
    public static final class Builder
    {
        private final String principalId;
        private final List<String> roles = new ArrayList<>();
        private final Set<String> permissions = new LinkedHashSet<>();
        private final Set<String> allowedDatasets = new LinkedHashSet<>();
        private final Map<String, Set<String>> allowedTables = new HashMap<>();
        private final Map<String, Object> profileMetadata = new HashMap<>();
        private Instant expiresAt;

        private Builder(String principalId)
        {
            Preconditions.checkArgument(principalId != null && !principalId.isEmpty(), "principalId must not be empty");
            this.principalId = principalId;
        }

        public Builder addRole(String role)
        {
            roles.add(Objects.requireNonNull(role, "role"));
            return this;
        }

        public Builder addPermission(String permission)
        {
            permissions.add(Objects.requireNonNull(permission, "permission"));
            return this;
        }

        /**
         * Grants a whole dataset, unless some other grant lists tables for it
         */
        public Builder addDataset(String dataset)
        {
            allowedDatasets.add(Identifiers.normalize(dataset));
            return this;
        }

        /**
         * Grants one table, which also marks the dataset as granted and restricts it to its listed tables
         */
        public Builder addTable(String dataset, String table)
        {
            String normalizedDataset = Identifiers.normalize(dataset);
            allowedDatasets.add(normalizedDataset);
            allowedTables.computeIfAbsent(normalizedDataset, k -> new LinkedHashSet<>()).add(Identifiers.normalize(table));
            return this;
        }

        public Builder profileMetadata(Map<String, Object> metadata)
        {
            metadata.forEach((key, value) -> {
                // ImmutableMap rejects null values
                if (key != null && value != null)
                {
                    profileMetadata.put(key, value);
                }
            });
            return this;
        }

        public Builder expiresAt(@Nullable Instant expiresAt)
        {
            this.expiresAt = expiresAt;
            return this;
        }

        public PermissionSnapshot build()
        {
            return new PermissionSnapshot(this);
        }
    }
}
