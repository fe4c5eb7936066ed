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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.datastax.driver.core.BatchStatement;
import com.datastax.driver.core.Row;
import com.datastax.driver.core.Session;
import com.datastax.driver.core.exceptions.DriverException;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import org.querygate.cache.CacheStats;
import org.querygate.cache.CacheStore;
import org.querygate.cache.CachedResult;
import org.querygate.cache.QueryCacheEntry;
import org.querygate.cache.TableDependency;
import org.querygate.common.CqlSessionProvider;
import org.querygate.common.utils.Identifiers;
import org.querygate.config.SchemaKeyspaceConfiguration;
import org.querygate.db.schema.QueryCacheSchema;
import org.querygate.exceptions.CacheStoreException;
import org.querygate.exceptions.SchemaModificationException;
import org.querygate.exceptions.SchemaUnavailableException;
import org.querygate.exceptions.StoreUnavailableException;
import org.jetbrains.annotations.Nullable;

/**
 * {@link CacheStore} persisted in the {@link QueryCacheSchema} tables. Lookups and invalidations are single
 * partition reads. Sweeping, clearing and statistics scan the entries table and are meant for operators.
 */
public class QueryCacheDatabaseAccessor extends DatabaseAccessor<QueryCacheSchema> implements CacheStore
{
    // Cassandra rejects TTLs above 20 years
    private static final long MAX_TTL_SECONDS = 630_720_000L;

    public QueryCacheDatabaseAccessor(QueryCacheSchema queryCacheSchema,
                                      CqlSessionProvider sessionProvider,
                                      SchemaKeyspaceConfiguration keyspaceConfiguration)
    {
        super(queryCacheSchema, sessionProvider, keyspaceConfiguration);
    }

    @Override
    public void insert(QueryCacheEntry entry)
    {
        guarded("insert entry", () -> {
            QueryCacheSchema schema = schema();
            int ttlSeconds = ttlSeconds(entry.createdAt(), entry.expiresAt());
            Date createdAt = Date.from(entry.createdAt());
            Set<String> dependencies = entry.dependencies()
                                            .stream()
                                            .map(TableDependency::toString)
                                            .collect(Collectors.toSet());

            BatchStatement batch = new BatchStatement(BatchStatement.Type.LOGGED);
            batch.add(schema.insertEntry().bind(entry.queryHash(),
                                                createdAt,
                                                entry.id(),
                                                entry.ownerPrincipalId(),
                                                entry.sql(),
                                                entry.payload().toJson().encode(),
                                                Date.from(entry.expiresAt()),
                                                dependencies,
                                                ttlSeconds));
            for (TableDependency dependency : entry.dependencies())
            {
                batch.add(schema.insertDependency().bind(dependency.dataset(),
                                                         dependency.table(),
                                                         dependency.project(),
                                                         entry.queryHash(),
                                                         createdAt,
                                                         entry.id(),
                                                         ttlSeconds));
            }
            execute(batch);
            return null;
        });
    }

    @Override
    public Optional<QueryCacheEntry> findLatest(String queryHash, @Nullable String ownerPrincipalId, Instant now)
    {
        return guarded("find entry", () -> {
            QueryCacheSchema schema = schema();
            // rows come newest first
            for (Row row : execute(schema.selectEntriesByHash().bind(queryHash)))
            {
                QueryCacheEntry entry = toEntry(row);
                if ((ownerPrincipalId == null || ownerPrincipalId.equals(entry.ownerPrincipalId()))
                    && !entry.isExpired(now))
                {
                    Row hits = execute(schema.selectHits().bind(queryHash, entry.id())).one();
                    return Optional.of(hits == null ? entry : entry.withHitCount(hits.getLong("hits")));
                }
            }
            return Optional.empty();
        });
    }

    @Override
    public void incrementHitCount(QueryCacheEntry entry)
    {
        guarded("increment hit count", () -> execute(schema().incrementHits().bind(entry.queryHash(), entry.id())));
    }

    @Override
    public int deleteExpired(Instant now)
    {
        return guarded("delete expired entries", () -> {
            QueryCacheSchema schema = schema();
            int removed = 0;
            for (Row row : execute(schema.selectAllEntries().bind()))
            {
                QueryCacheEntry entry = toEntry(row);
                if (entry.isExpired(now))
                {
                    delete(schema, entry.queryHash(), row.getTimestamp("created_at"), entry.id());
                    removed++;
                }
            }
            return removed;
        });
    }

    @Override
    public int deleteByDependency(@Nullable String project, String dataset, String table)
    {
        return guarded("invalidate table", () -> {
            QueryCacheSchema schema = schema();
            String normalizedDataset = Identifiers.normalize(dataset);
            String normalizedTable = Identifiers.normalize(table);
            int removed = 0;
            for (Row row : execute(schema.selectDependents().bind(normalizedDataset, normalizedTable)))
            {
                String dependencyProject = row.getString("project");
                TableDependency dependency = new TableDependency(dependencyProject, normalizedDataset, normalizedTable);
                if (!dependency.matches(project, dataset, table))
                {
                    continue;
                }

                String queryHash = row.getString("query_hash");
                Date createdAt = row.getTimestamp("created_at");
                UUID id = row.getUUID("id");
                if (execute(schema.selectEntry().bind(queryHash, createdAt, id)).one() != null)
                {
                    delete(schema, queryHash, createdAt, id);
                    removed++;
                }
                execute(schema.deleteDependent().bind(normalizedDataset, normalizedTable, dependencyProject,
                                                      queryHash, createdAt, id));
            }
            return removed;
        });
    }

    @Override
    public int deleteAll()
    {
        return guarded("clear cache", () -> {
            QueryCacheSchema schema = schema();
            int removed = 0;
            for (Row ignored : execute(schema.selectAllEntries().bind()))
            {
                removed++;
            }
            Session session = session();
            for (String truncate : schema.truncateStatements())
            {
                session.execute(truncate);
            }
            return removed;
        });
    }

    @Override
    public CacheStats stats(Instant now)
    {
        return guarded("read statistics", () -> {
            QueryCacheSchema schema = schema();
            Map<UUID, Long> hits = allHits(schema);
            long total = 0;
            long expired = 0;
            long totalHits = 0;
            for (Row row : execute(schema.selectAllEntries().bind()))
            {
                QueryCacheEntry entry = toEntry(row);
                total++;
                totalHits += hits.getOrDefault(entry.id(), 0L);
                if (entry.isExpired(now))
                {
                    expired++;
                }
            }
            return new CacheStats(total, totalHits, expired);
        });
    }

    @Override
    public List<QueryCacheEntry> topEntries(int limit)
    {
        return guarded("read top entries", () -> {
            QueryCacheSchema schema = schema();
            Map<UUID, Long> hits = allHits(schema);
            List<QueryCacheEntry> entries = new ArrayList<>();
            for (Row row : execute(schema.selectAllEntries().bind()))
            {
                QueryCacheEntry entry = toEntry(row);
                entries.add(entry.withHitCount(hits.getOrDefault(entry.id(), 0L)));
            }
            return entries.stream()
                          .sorted(Comparator.comparingLong(QueryCacheEntry::hitCount).reversed())
                          .limit(limit)
                          .collect(Collectors.toList());
        });
    }

    private void delete(QueryCacheSchema schema, String queryHash, Date createdAt, UUID id)
    {
        execute(schema.deleteEntry().bind(queryHash, createdAt, id));
        execute(schema.deleteHits().bind(queryHash, id));
    }

    private Map<UUID, Long> allHits(QueryCacheSchema schema)
    {
        Map<UUID, Long> hits = new HashMap<>();
        for (Row row : execute(schema.selectAllHits().bind()))
        {
            hits.put(row.getUUID("id"), row.getLong("hits"));
        }
        return hits;
    }

    private QueryCacheEntry toEntry(Row row)
    {
        Set<TableDependency> dependencies = new HashSet<>();
        for (String dependency : row.getSet("dependencies", String.class))
        {
            try
            {
                dependencies.add(TableDependency.parse(dependency));
            }
            catch (IllegalArgumentException e)
            {
                logger.warn("Ignoring malformed table dependency {} of entry {}", dependency, row.getUUID("id"));
            }
        }

        return new QueryCacheEntry(row.getUUID("id"),
                                   row.getString("query_hash"),
                                   row.getString("owner_principal_id"),
                                   row.getString("sql"),
                                   decodePayload(row.getString("payload")),
                                   row.getTimestamp("created_at").toInstant(),
                                   row.getTimestamp("expires_at").toInstant(),
                                   0,
                                   dependencies);
    }

    private static CachedResult decodePayload(String payload)
    {
        try
        {
            return CachedResult.fromJson(new JsonObject(payload));
        }
        catch (DecodeException | ClassCastException e)
        {
            throw new CacheStoreException("Stored payload is not a valid result", e);
        }
    }

    private static int ttlSeconds(Instant createdAt, Instant expiresAt)
    {
        long millis = Duration.between(createdAt, expiresAt).toMillis();
        long seconds = (millis + 999) / 1000;
        return (int) Math.max(1, Math.min(MAX_TTL_SECONDS, seconds));
    }

    private <R> R guarded(String operation, Supplier<R> action)
    {
        try
        {
            return action.get();
        }
        catch (DriverException | StoreUnavailableException | SchemaUnavailableException
               | SchemaModificationException e)
        {
            throw new CacheStoreException("Unable to " + operation + " in the query cache", e);
        }
    }
}
