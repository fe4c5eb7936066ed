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
import org.querygate.config.SchemaKeyspaceConfiguration;

/**
 * {@inheritDoc}
 */
public class SchemaKeyspaceConfigurationImpl implements SchemaKeyspaceConfiguration
{
    public static final String DEFAULT_KEYSPACE = "querygate";
    public static final String DEFAULT_REPLICATION_STRATEGY = "SimpleStrategy";
    public static final int DEFAULT_REPLICATION_FACTOR = 1;

    @JsonProperty("create_schema")
    protected final boolean createSchema;

    @JsonProperty("keyspace")
    protected final String keyspace;

    @JsonProperty("replication_strategy")
    protected final String replicationStrategy;

    @JsonProperty("replication_factor")
    protected final int replicationFactor;

    public SchemaKeyspaceConfigurationImpl()
    {
        this(false, DEFAULT_KEYSPACE, DEFAULT_REPLICATION_STRATEGY, DEFAULT_REPLICATION_FACTOR);
    }

    public SchemaKeyspaceConfigurationImpl(boolean createSchema,
                                           String keyspace,
                                           String replicationStrategy,
                                           int replicationFactor)
    {
        this.createSchema = createSchema;
        this.keyspace = keyspace;
        this.replicationStrategy = replicationStrategy;
        this.replicationFactor = replicationFactor;
    }

    @Override
    @JsonProperty("create_schema")
    public boolean createSchema()
    {
        return createSchema;
    }

    @Override
    @JsonProperty("keyspace")
    public String keyspace()
    {
        return keyspace;
    }

    @Override
    @JsonProperty("replication_strategy")
    public String replicationStrategy()
    {
        return replicationStrategy;
    }

    @Override
    @JsonProperty("replication_factor")
    public int replicationFactor()
    {
        return replicationFactor;
    }
}
