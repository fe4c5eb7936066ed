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

/**
 * Configuration of the keyspace holding the role grant and query cache tables
 */
public interface SchemaKeyspaceConfiguration
{
    /**
     * @return whether QueryGate may create its keyspace and tables when they are missing
     */
    boolean createSchema();

    String keyspace();

    String replicationStrategy();

    int replicationFactor();

    /**
     * @return the replication clause used in {@code CREATE KEYSPACE}
     */
    default String createReplicationStrategyString()
    {
        return String.format("{'class':'%s', 'replication_factor':'%d'}", replicationStrategy(), replicationFactor());
    }
}
