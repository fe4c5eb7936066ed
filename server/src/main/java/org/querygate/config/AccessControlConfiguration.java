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

package org.querygate.config;

import org.querygate.acl.UnqualifiedTablePolicy;
import org.jetbrains.annotations.Nullable;

/**
 * Configuration for authorizing queries against a principal's dataset and table grants
 */
public interface AccessControlConfiguration
{
    /**
     * @return the permission a principal must hold to run a query, {@code query:execute} by default
     */
    String requiredPermission();

    /**
     * @return how a table reference without a resolvable dataset is treated
     */
    UnqualifiedTablePolicy unqualifiedTablePolicy();

    /**
     * @return the project assigned to {@code dataset.table} references, or {@code null} when none is configured
     */
    @Nullable
    String defaultProject();

    /**
     * @return the configuration of the cache holding hydrated role data
     */
    CacheConfiguration roleCacheConfiguration();
}
