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
 * Tables backing the Cassandra query cache store.
 * <ul>
 *     <li>{@code query_cache_v1} holds the entries, newest first within a query hash</li>
 *     <li>{@code query_cache_hits_v1} holds the hit counters, which cannot share a table with regular columns</li>
 *     <li>{@code table_dependencies_v1} indexes entries by the tables they were computed from</li>
 * </ul>
 * Entries and dependency rows are written with a TTL matching the entry expiry.
 */
public class QueryCacheSchema extends AbstractSchema
{
    static final String ENTRIES_TABLE = "query_cache_v1";
    static final String HITS_TABLE = "query_cache_hits_v1";
    static final String DEPENDENCIES_TABLE = "table_dependencies_v1";

    private final SchemaKeyspaceConfiguration keyspaceConfig;

    private PreparedStatement insertEntry;
    private PreparedStatement insertDependency;
    private PreparedStatement selectEntriesByHash;
    private PreparedStatement selectEntry;
    private PreparedStatement selectAllEntries;
    private PreparedStatement deleteEntry;
    private PreparedStatement incrementHits;
    private PreparedStatement selectHits;
    private PreparedStatement selectAllHits;
    private PreparedStatement deleteHits;
    private PreparedStatement selectDependents;
    private PreparedStatement deleteDependent;

    public QueryCacheSchema(SchemaKeyspaceConfiguration keyspaceConfig)
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
        return tablesExist(metadata, ENTRIES_TABLE, HITS_TABLE, DEPENDENCIES_TABLE);
    }

    @Override
    protected void prepareStatements(@NotNull Session session)
    {
        insertEntry = prepare(insertEntry, session, CqlLiterals.insertEntry(keyspaceConfig));
        insertDependency = prepare(insertDependency, session, CqlLiterals.insertDependency(keyspaceConfig));
        selectEntriesByHash = prepare(selectEntriesByHash, session, CqlLiterals.selectEntriesByHash(keyspaceConfig));
        selectEntry = prepare(selectEntry, session, CqlLiterals.selectEntry(keyspaceConfig));
        selectAllEntries = prepare(selectAllEntries, session, CqlLiterals.selectAllEntries(keyspaceConfig));
        deleteEntry = prepare(deleteEntry, session, CqlLiterals.deleteEntry(keyspaceConfig));
        incrementHits = prepare(incrementHits, session, CqlLiterals.incrementHits(keyspaceConfig));
        selectHits = prepare(selectHits, session, CqlLiterals.selectHits(keyspaceConfig));
        selectAllHits = prepare(selectAllHits, session, CqlLiterals.selectAllHits(keyspaceConfig));
        deleteHits = prepare(deleteHits, session, CqlLiterals.deleteHits(keyspaceConfig));
        selectDependents = prepare(selectDependents, session, CqlLiterals.selectDependents(keyspaceConfig));
        deleteDependent = prepare(deleteDependent, session, CqlLiterals.deleteDependent(keyspaceConfig));
    }

    @Override
    protected List<String> createSchemaStatements()
    {
        String keyspace = keyspaceConfig.keyspace();
        return Arrays.asList(
        String.format("CREATE KEYSPACE IF NOT EXISTS %s WITH REPLICATION = %s",
                      keyspace, keyspaceConfig.createReplicationStrategyString()),
        String.format("CREATE TABLE IF NOT EXISTS %s.%s ("
                      + "query_hash text,"
                      + "created_at timestamp,"
                      + "id uuid,"
                      + "owner_principal_id text,"
                      + "sql text,"
                      + "payload text,"
                      + "expires_at timestamp,"
                      + "dependencies set<text>,"
                      + "PRIMARY KEY ((query_hash), created_at, id)"
                      + ") WITH CLUSTERING ORDER BY (created_at DESC, id ASC)",
                      keyspace, ENTRIES_TABLE),
        String.format("CREATE TABLE IF NOT EXISTS %s.%s ("
                      + "query_hash text,"
                      + "id uuid,"
                      + "hits counter,"
                      + "PRIMARY KEY ((query_hash), id))",
                      keyspace, HITS_TABLE),
        String.format("CREATE TABLE IF NOT EXISTS %s.%s ("
                      + "dataset text,"
                      + "table_name text,"
                      + "project text,"
                      + "query_hash text,"
                      + "created_at timestamp,"
                      + "id uuid,"
                      + "PRIMARY KEY ((dataset, table_name), project, query_hash, created_at, id))",
                      keyspace, DEPENDENCIES_TABLE));
    }

    public List<String> truncateStatements()
    {
        String keyspace = keyspaceConfig.keyspace();
        return Arrays.asList(String.format("TRUNCATE %s.%s", keyspace, ENTRIES_TABLE),
                             String.format("TRUNCATE %s.%s", keyspace, HITS_TABLE),
                             String.format("TRUNCATE %s.%s", keyspace, DEPENDENCIES_TABLE));
    }

    public PreparedStatement insertEntry()
    {
        return insertEntry;
    }

    public PreparedStatement insertDependency()
    {
        return insertDependency;
    }

    public PreparedStatement selectEntriesByHash()
    {
        return selectEntriesByHash;
    }

    public PreparedStatement selectEntry()
    {
        return selectEntry;
    }

    public PreparedStatement selectAllEntries()
    {
        return selectAllEntries;
    }

    public PreparedStatement deleteEntry()
    {
        return deleteEntry;
    }

    public PreparedStatement incrementHits()
    {
        return incrementHits;
    }

    public PreparedStatement selectHits()
    {
        return selectHits;
    }

    public PreparedStatement selectAllHits()
    {
        return selectAllHits;
    }

    public PreparedStatement deleteHits()
    {
        return deleteHits;
    }

    public PreparedStatement selectDependents()
    {
        return selectDependents;
    }

    public PreparedStatement deleteDependent()
    {
        return deleteDependent;
    }

    private static class CqlLiterals
    {
        private static final String ENTRY_COLUMNS
        = "query_hash, created_at, id, owner_principal_id, sql, payload, expires_at, dependencies";

        static String insertEntry(SchemaKeyspaceConfiguration config)
        {
            return String.format("INSERT INTO %s.%s (%s) VALUES (?, ?, ?, ?, ?, ?, ?, ?) USING TTL ?",
                                 config.keyspace(), ENTRIES_TABLE, ENTRY_COLUMNS);
        }

        static String insertDependency(SchemaKeyspaceConfiguration config)
        {
            return String.format("INSERT INTO %s.%s (dataset, table_name, project, query_hash, created_at, id) "
                                 + "VALUES (?, ?, ?, ?, ?, ?) USING TTL ?",
                                 config.keyspace(), DEPENDENCIES_TABLE);
        }

        static String selectEntriesByHash(SchemaKeyspaceConfiguration config)
        {
            return String.format("SELECT %s FROM %s.%s WHERE query_hash = ?",
                                 ENTRY_COLUMNS, config.keyspace(), ENTRIES_TABLE);
        }

        static String selectEntry(SchemaKeyspaceConfiguration config)
        {
            return String.format("SELECT id FROM %s.%s WHERE query_hash = ? AND created_at = ? AND id = ?",
                                 config.keyspace(), ENTRIES_TABLE);
        }

        static String selectAllEntries(SchemaKeyspaceConfiguration config)
        {
            return String.format("SELECT %s FROM %s.%s", ENTRY_COLUMNS, config.keyspace(), ENTRIES_TABLE);
        }

        static String deleteEntry(SchemaKeyspaceConfiguration config)
        {
            return String.format("DELETE FROM %s.%s WHERE query_hash = ? AND created_at = ? AND id = ?",
                                 config.keyspace(), ENTRIES_TABLE);
        }

        static String incrementHits(SchemaKeyspaceConfiguration config)
        {
            return String.format("UPDATE %s.%s SET hits = hits + 1 WHERE query_hash = ? AND id = ?",
                                 config.keyspace(), HITS_TABLE);
        }

        static String selectHits(SchemaKeyspaceConfiguration config)
        {
            return String.format("SELECT hits FROM %s.%s WHERE query_hash = ? AND id = ?",
                                 config.keyspace(), HITS_TABLE);
        }

        static String selectAllHits(SchemaKeyspaceConfiguration config)
        {
            return String.format("SELECT query_hash, id, hits FROM %s.%s", config.keyspace(), HITS_TABLE);
        }

        static String deleteHits(SchemaKeyspaceConfiguration config)
        {
            return String.format("DELETE FROM %s.%s WHERE query_hash = ? AND id = ?",
                                 config.keyspace(), HITS_TABLE);
        }

        static String selectDependents(SchemaKeyspaceConfiguration config)
        {
            return String.format("SELECT project, query_hash, created_at, id FROM %s.%s "
                                 + "WHERE dataset = ? AND table_name = ?",
                                 config.keyspace(), DEPENDENCIES_TABLE);
        }

        static String deleteDependent(SchemaKeyspaceConfiguration config)
        {
            return String.format("DELETE FROM %s.%s WHERE dataset = ? AND table_name = ? AND project = ? "
                                 + "AND query_hash = ? AND created_at = ? AND id = ?",
                                 config.keyspace(), DEPENDENCIES_TABLE);
        }
    }
}
