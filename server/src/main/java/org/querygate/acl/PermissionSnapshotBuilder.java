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
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.vertx.core.json.JsonObject;
import org.querygate.acl.hydration.DatasetGrant;
import org.querygate.acl.hydration.HydratedRecord;
import org.querygate.acl.hydration.HydrationRecords;
import org.querygate.acl.hydration.HydrationSource;
import org.querygate.acl.hydration.RoleAssignment;
import org.querygate.acl.hydration.RolePermission;
import org.querygate.acl.hydration.UserProfile;
import org.querygate.exceptions.HydrationException;
import org.jetbrains.annotations.Nullable;

/**
 * Builds a {@link PermissionSnapshot} from the records of a {@link HydrationSource}: the principal's profile, its
 * roles and, for each role, its permissions and dataset grants.
 *
 * <p>Records that do not bind to their typed form are not fatal. The same fields are recovered from the raw record
 * where possible; records that yield nothing usable are skipped with a warning. A failure of the source itself
 * aborts the build.
 */
@Singleton
public class PermissionSnapshotBuilder
{
    private static final Logger LOGGER = LoggerFactory.getLogger(PermissionSnapshotBuilder.class);

    private final HydrationSource hydrationSource;

    @Inject
    public PermissionSnapshotBuilder(HydrationSource hydrationSource)
    {
        this.hydrationSource = hydrationSource;
    }

    /**
     * @param principalId the already authenticated principal
     * @param tokenExpiry when the principal's credentials expire, if known
     * @return the principal's permissions
     * @throws HydrationException     when the identity store cannot be read
     * @throws IllegalArgumentException when {@code principalId} is empty
     */
    public PermissionSnapshot build(String principalId, @Nullable Instant tokenExpiry) throws HydrationException
    {
        PermissionSnapshot.Builder builder = PermissionSnapshot.builder(principalId).expiresAt(tokenExpiry);
        try
        {
            return hydrate(builder, principalId);
        }
        catch (HydrationException e)
        {
            throw e;
        }
        catch (RuntimeException e)
        {
            throw new HydrationException("Unable to hydrate permissions for principal " + principalId, e);
        }
    }

    private PermissionSnapshot hydrate(PermissionSnapshot.Builder builder, String principalId)
    {
        hydrationSource.profile(principalId)
                       .flatMap(raw -> resolve(HydrationRecords.parse(raw, UserProfile.class),
                                               UserProfile::fromRaw, "profile", principalId))
                       .ifPresent(profile -> builder.profileMetadata(profile.metadata()));

        for (JsonObject rawRole : nullToEmpty(hydrationSource.roles(principalId)))
        {
            Optional<RoleAssignment> role = resolve(HydrationRecords.parse(rawRole, RoleAssignment.class),
                                                    RoleAssignment::fromRaw, "role", principalId);
            if (role.isEmpty())
            {
                continue;
            }

            builder.addRole(role.get().roleName());
            String roleKey = role.get().key();

            for (JsonObject rawPermission : nullToEmpty(hydrationSource.rolePermissions(roleKey)))
            {
                resolve(HydrationRecords.parse(rawPermission, RolePermission.class),
                        RolePermission::fromRaw, "permission", principalId)
                .ifPresent(permission -> builder.addPermission(permission.permission()));
            }

            for (JsonObject rawGrant : nullToEmpty(hydrationSource.roleDatasetAccess(roleKey)))
            {
                resolve(HydrationRecords.parse(rawGrant, DatasetGrant.class),
                        DatasetGrant::fromRaw, "dataset grant", principalId)
                .ifPresent(grant -> {
                    if (grant.tableId().isPresent())
                    {
                        builder.addTable(grant.datasetId(), grant.tableId().get());
                    }
                    else
                    {
                        builder.addDataset(grant.datasetId());
                    }
                });
            }
        }

        PermissionSnapshot snapshot = builder.build();
        LOGGER.debug("Hydrated permissions {}", snapshot);
        return snapshot;
    }

    private static <T> Optional<T> resolve(HydratedRecord<T> record,
                                           Function<JsonObject, Optional<T>> fallback,
                                           String recordKind,
                                           String principalId)
    {
        if (!record.isValidated())
        {
            LOGGER.warn("Degraded {} record principal={} reason={} fields={}",
                        recordKind, principalId, record.reason(), record.raw().fieldNames());
        }

        Optional<T> value = record.resolve(fallback);
        if (value.isEmpty())
        {
            LOGGER.warn("Skipping unusable {} record principal={} fields={}",
                        recordKind, principalId, record.raw().fieldNames());
        }
        return value;
    }

    private static List<JsonObject> nullToEmpty(@Nullable List<JsonObject> records)
    {
        return records == null ? Collections.emptyList() : records;
    }
}
