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

package org.querygate.config.yaml;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.querygate.acl.UnqualifiedTablePolicy;
import org.querygate.config.AccessControlConfiguration;
import org.querygate.config.CacheConfiguration;

/**
 * {@inheritDoc}
 */
public class AccessControlConfigurationImpl implements AccessControlConfiguration
{
    public static final String DEFAULT_REQUIRED_PERMISSION = "query:execute";
    private static final UnqualifiedTablePolicy DEFAULT_UNQUALIFIED_TABLE_POLICY = UnqualifiedTablePolicy.ALLOW;

    @JsonProperty("required_permission")
    protected final String requiredPermission;

    @JsonProperty("unqualified_table_policy")
    protected final UnqualifiedTablePolicy unqualifiedTablePolicy;

    @JsonProperty("default_project")
    protected final String defaultProject;

    @JsonProperty("role_cache")
    protected final CacheConfiguration roleCacheConfiguration;

    public AccessControlConfigurationImpl()
    {
        this(DEFAULT_REQUIRED_PERMISSION, DEFAULT_UNQUALIFIED_TABLE_POLICY, null, new CacheConfigurationImpl());
    }

    public AccessControlConfigurationImpl(String requiredPermission,
                                          UnqualifiedTablePolicy unqualifiedTablePolicy,
                                          String defaultProject,
                                          CacheConfiguration roleCacheConfiguration)
    {
        this.requiredPermission = requiredPermission;
        this.unqualifiedTablePolicy = unqualifiedTablePolicy;
        this.defaultProject = defaultProject;
        this.roleCacheConfiguration = roleCacheConfiguration;
    }

    @Override
    @JsonProperty("required_permission")
    public String requiredPermission()
    {
        return requiredPermission;
    }

    @Override
    @JsonProperty("unqualified_table_policy")
    public UnqualifiedTablePolicy unqualifiedTablePolicy()
    {
        return unqualifiedTablePolicy;
    }

    @Override
    @JsonProperty("default_project")
    public String defaultProject()
    {
        return defaultProject;
    }

    @Override
    @JsonProperty("role_cache")
    public CacheConfiguration roleCacheConfiguration()
    {
        return roleCacheConfiguration;
    }
}
