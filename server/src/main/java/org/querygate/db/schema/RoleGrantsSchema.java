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

package org.querygate.db.schema;

import java.util.Arrays;
import java.util.List;

import com.datastax.driver.core.Metadata;
import com.datastax.driver.core.PreparedStatement;
import com.datastax.driver.core.Session;
import org.querygate.config.SchemaKeyspaceConfiguration;
import org.jetbrains.annotations.NotNull;

/**
 * Identity store tables: principal profiles, role assignments, role permissions and dataset grants. A dataset
 * grant with an empty {@code table_id} covers the whole dataset.
 */
public class RoleGrantsSchema extends AbstractSchema
{
    private static final String USER_PROFILES_TABLE = "user_profiles";
    private static final String USER_ROLES_TABLE = "user_roles";
    private static final String ROLE_PERMISSIONS_TABLE = "role_permissions";
    private static final String ROLE_DATASET_ACCESS_TABLE = "role_dataset_access";

    private final SchemaKeyspaceConfiguration keyspaceConfig;

    private PreparedStatement profile;
    private PreparedStatement roles;
    private PreparedStatement rolePermissions;
    private PreparedStatement roleDatasetAccess;

    public RoleGrantsSchema(SchemaKeyspaceConfiguration keyspaceConfig)
    {
        this.keyspaceConfig = keyspaceConfig;
    }

    @Override
    protected String keyspaceName()
    {
        return keyspaceConfig.keyspace();
    }

    @Override
    protected boolean exists(@NotNull Metadata metadata)
    {
        return tablesExist(metadata, USER_PROFILES_TABLE, USER_ROLES_TABLE,
                           ROLE_PERMISSIONS_TABLE, ROLE_DATASET_ACCESS_TABLE);
    }

    @Override
    protected void prepareStatements(@NotNull Session session)
    {
        String keyspace = keyspaceConfig.keyspace();
        profile = prepare(profile, session,
                          String.format("SELECT user_id, metadata FROM %s.%s WHERE user_id = ?",
                                        keyspace, USER_PROFILES_TABLE));
        roles = prepare(roles, session,
                        String.format("SELECT role_id, role_name FROM %s.%s WHERE user_id = ?",
                                      keyspace, USER_ROLES_TABLE));
        rolePermissions = prepare(rolePermissions, session,
                                  String.format("SELECT permission FROM %s.%s WHERE role_id = ?",
                                                keyspace, ROLE_PERMISSIONS_TABLE));
        roleDatasetAccess = prepare(roleDatasetAccess, session,
                                    String.format("SELECT dataset_id, table_id FROM %s.%s WHERE role_id = ?",
                                                  keyspace, ROLE_DATASET_ACCESS_TABLE));
    }

    @Override
    protected List<String> createSchemaStatements()
    {
        String keyspace = keyspaceConfig.keyspace();
        return Arrays.asList(
        String.format("CREATE KEYSPACE IF NOT EXISTS %s WITH REPLICATION = %s",
                      keyspace, keyspaceConfig.createReplicationStrategyString()),
        String.format("CREATE TABLE IF NOT EXISTS %s.%s ("
                      + "user_id text PRIMARY KEY,"
                      + "metadata text)",
                      keyspace, USER_PROFILES_TABLE),
        String.format("CREATE TABLE IF NOT EXISTS %s.%s ("
                      + "user_id text,"
                      + "role_id text,"
                      + "role_name text,"
                      + "PRIMARY KEY (user_id, role_id))",
                      keyspace, USER_ROLES_TABLE),
        String.format("CREATE TABLE IF NOT EXISTS %s.%s ("
                      + "role_id text,"
                      + "permission text,"
                      + "PRIMARY KEY (role_id, permission))",
                      keyspace, ROLE_PERMISSIONS_TABLE),
        String.format("CREATE TABLE IF NOT EXISTS %s.%s ("
                      + "role_id text,"
                      + "dataset_id text,"
                      + "table_id text,"
                      + "PRIMARY KEY (role_id, dataset_id, table_id))",
                      keyspace, ROLE_DATASET_ACCESS_TABLE));
    }

    public PreparedStatement profile()
    {
        return profile;
    }

    public PreparedStatement roles()
    {
        return roles;
    }

    public PreparedStatement rolePermissions()
    {
        return rolePermissions;
    }

    public PreparedStatement roleDatasetAccess()
    {
        return roleDatasetAccess;
    }
}
