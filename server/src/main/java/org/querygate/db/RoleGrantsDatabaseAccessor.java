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

package org.querygate.db;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import com.datastax.driver.core.BoundStatement;
import com.datastax.driver.core.ResultSet;
import com.datastax.driver.core.Row;
import com.datastax.driver.core.exceptions.DriverException;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import org.querygate.acl.hydration.HydrationSource;
import org.querygate.common.CqlSessionProvider;
import org.querygate.config.SchemaKeyspaceConfiguration;
import org.querygate.db.schema.RoleGrantsSchema;
import org.querygate.exceptions.HydrationException;
import org.querygate.exceptions.SchemaModificationException;
import org.querygate.exceptions.SchemaUnavailableException;
import org.querygate.exceptions.StoreUnavailableException;

/**
 * Reads identity records from the {@link RoleGrantsSchema} tables. Rows are handed out as JSON records without
 * validation; binding them to typed records is left to the snapshot builder.
 */
public class RoleGrantsDatabaseAccessor extends DatabaseAccessor<RoleGrantsSchema> implements HydrationSource
{
    public RoleGrantsDatabaseAccessor(RoleGrantsSchema roleGrantsSchema,
                                      CqlSessionProvider sessionProvider,
                                      SchemaKeyspaceConfiguration keyspaceConfiguration)
    {
        super(roleGrantsSchema, sessionProvider, keyspaceConfiguration);
    }

    @Override
    public Optional<JsonObject> profile(String principalId) throws HydrationException
    {
        return read("profile", principalId, schema -> {
            ResultSet result = execute(schema.profile().bind(principalId));
            Row row = result.one();
            if (row == null)
            {
                return Optional.empty();
            }
            JsonObject profile = new JsonObject().put("user_id", row.getString("user_id"));
            String metadata = row.getString("metadata");
            if (metadata != null)
            {
                profile.put("metadata", decodeMetadata(metadata));
            }
            return Optional.of(profile);
        });
    }

    @Override
    public List<JsonObject> roles(String principalId) throws HydrationException
    {
        return read("roles", principalId, schema -> {
            List<JsonObject> roles = new ArrayList<>();
            for (Row row : execute(schema.roles().bind(principalId)))
            {
                roles.add(new JsonObject().put("role_id", row.getString("role_id"))
                                          .put("role_name", row.getString("role_name")));
            }
            return roles;
        });
    }

    @Override
    public List<JsonObject> rolePermissions(String roleId) throws HydrationException
    {
        return read("role permissions", roleId, schema -> {
            List<JsonObject> permissions = new ArrayList<>();
            for (Row row : execute(schema.rolePermissions().bind(roleId)))
            {
                permissions.add(new JsonObject().put("permission", row.getString("permission")));
            }
            return permissions;
        });
    }

    @Override
    public List<JsonObject> roleDatasetAccess(String roleId) throws HydrationException
    {
        return read("role dataset access", roleId, schema -> {
            BoundStatement statement = schema.roleDatasetAccess().bind(roleId);
            List<JsonObject> grants = new ArrayList<>();
            for (Row row : execute(statement))
            {
                grants.add(new JsonObject().put("dataset_id", row.getString("dataset_id"))
                                           .put("table_id", row.getString("table_id")));
            }
            return grants;
        });
    }

    private <R> R read(String what, String key, Function<RoleGrantsSchema, R> query)
    {
        try
        {
            return query.apply(schema());
        }
        catch (DriverException | StoreUnavailableException | SchemaUnavailableException
               | SchemaModificationException e)
        {
            throw new HydrationException(String.format("Unable to read %s for %s", what, key), e);
        }
    }

    // metadata that is not a JSON object is passed through as text and rejected when the profile is bound
    private static Object decodeMetadata(String metadata)
    {
        try
        {
            return new JsonObject(metadata);
        }
        catch (DecodeException | ClassCastException e)
        {
            return metadata;
        }
    }
}
