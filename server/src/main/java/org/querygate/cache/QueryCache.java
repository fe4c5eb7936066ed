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

package org.querygate.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import org.querygate.common.utils.Identifiers;
import org.querygate.concurrent.TaskExecutorPool;
import org.querygate.config.QueryCacheConfiguration;
import org.querygate.exceptions.CacheStoreException;
import org.querygate.metrics.QueryCacheMetrics;
import org.jetbrains.annotations.Nullable;

/**
 * Per-principal cache of query results, addressed by {@link QueryCacheKeys#hash} and expiring after a TTL.
 * Entries record the tables they were computed from so a change to a table can evict every dependent result.
 *
 * <p>The cache is an optimization: a store failure on lookup or write is logged and reported as a miss or as
 * {@link StoreResult#NOT_STORED_ERROR}, never as an exception. Maintenance operations ({@link #invalidateTable},
 * {@link #sweepExpired}, {@link #clearAll}, {@link #stats}, {@link #topQueries}) propagate store failures to the
 * operator.
 */
public class QueryCache
{
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryCache.class);

    private final CacheStore store;
    private final QueryCacheConfiguration config;
    private final Clock clock;
    private final TaskExecutorPool hitCountPool;
    private final QueryCacheMetrics metrics;

    public QueryCache(CacheStore store,
                      QueryCacheConfiguration config,
                      Clock clock,
                      TaskExecutorPool hitCountPool,
                      QueryCacheMetrics metrics)
    {
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.hitCountPool = hitCountPool;
        this.metrics = metrics;
    }

    /**
     * @param queryHash        the query key
     * @param ownerPrincipalId the principal asking; only its own entries are visible
     * @return the newest unexpired entry stored by {@code ownerPrincipalId} for the query
     */
    public Optional<QueryCacheEntry> get(String queryHash, String ownerPrincipalId)
    {
        return lookup(queryHash, Objects.requireNonNull(ownerPrincipalId, "ownerPrincipalId"));
    }

    /**
     * Elevated lookup ignoring ownership. Only for service-level callers that act on behalf of every principal.
     *
     * @param queryHash the query key
     * @return the newest unexpired entry for the query, whoever stored it
     */
    public Optional<QueryCacheEntry> getAsService(String queryHash)
    {
        return lookup(queryHash, null);
    }

    /**
     * Stores a result with the configured TTL
     *
     * @see #put(String, String, String, CachedResult, Set, Duration)
     */
    public StoreResult put(String queryHash,
                           String ownerPrincipalId,
                           String sql,
                           @Nullable CachedResult payload,
                           Set<TableDependency> dependencies)
    {
        return put(queryHash, ownerPrincipalId, sql, payload, dependencies, config.ttl().toDuration());
    }

    /**
     * @param queryHash        the query key
     * @param ownerPrincipalId the principal that produced the result
     * @param sql              the original query text, kept for diagnostics
     * @param payload          the result
     * @param dependencies     the tables the result was computed from
     * @param ttl              how long the entry is served
     * @return whether the entry was stored, and if not why
     */
    public StoreResult put(String queryHash,
                           String ownerPrincipalId,
                           String sql,
                           @Nullable CachedResult payload,
                           Set<TableDependency> dependencies,
                           Duration ttl)
    {
        if (!config.enabled())
        {
            return StoreResult.NOT_STORED_DISABLED;
        }

        if (ttl.isNegative() || ttl.isZero())
        {
            LOGGER.warn("Refusing to cache a result with a non-positive ttl. queryHash={} ttl={}", queryHash, ttl);
            metrics.rejected.mark();
            return StoreResult.NOT_STORED_INVALID_TTL;
        }

        if (payload == null || payload.isEmpty())
        {
            metrics.rejected.mark();
            return StoreResult.NOT_STORED_EMPTY;
        }

        if (payload.rowCount() > config.maxCachedRows())
        {
            LOGGER.debug("Result too large to cache. queryHash={} rows={} maxCachedRows={}",
                         queryHash, payload.rowCount(), config.maxCachedRows());
            metrics.rejected.mark();
            return StoreResult.NOT_STORED_TOO_LARGE;
        }

        Instant now = clock.instant();
        QueryCacheEntry entry = new QueryCacheEntry(UUID.randomUUID(),
                                                    queryHash,
                                                    ownerPrincipalId,
                                                    sql,
                                                    payload,
                                                    now,
                                                    now.plus(ttl),
                                                    0,
                                                    dependencies);
        try
        {
            store.insert(entry);
        }
        catch (CacheStoreException e)
        {
            LOGGER.warn("Unable to store query result. queryHash={} owner={}", queryHash, ownerPrincipalId, e);
            metrics.storeFailures.mark();
            return StoreResult.NOT_STORED_ERROR;
        }

        LOGGER.debug("Stored query result. queryHash={} owner={} rows={} dependencies={}",
                     queryHash, ownerPrincipalId, payload.rowCount(), dependencies);
        metrics.stored.mark();
        return StoreResult.STORED;
    }

    /**
     * Removes every entry computed from the table
     *
     * @param project the project, or {@code null} / empty to match any project
     * @param dataset the dataset
     * @param table   the table
     * @return the number of entries removed
     */
    public int invalidateTable(@Nullable String project, String dataset, String table)
    {
        String normalizedDataset = Identifiers.normalize(dataset);
        String normalizedTable = Identifiers.normalize(table);
        Preconditions.checkArgument(!normalizedDataset.isEmpty(), "dataset must not be empty");
        Preconditions.checkArgument(!normalizedTable.isEmpty(), "table must not be empty");

        int removed = store.deleteByDependency(Identifiers.normalize(project), normalizedDataset, normalizedTable);
        LOGGER.info("Invalidated cached results. table={}.{}.{} removed={}",
                    Identifiers.normalize(project), normalizedDataset, normalizedTable, removed);
        metrics.invalidatedEntries.mark(removed);
        return removed;
    }

    /**
     * @return the number of expired entries removed
     */
    public int sweepExpired()
    {
        int removed = store.deleteExpired(clock.instant());
        metrics.expiredEntries.mark(removed);
        return removed;
    }

    /**
     * @return the number of entries removed
     */
    public int clearAll()
    {
        int removed = store.deleteAll();
        LOGGER.info("Cleared query cache. removed={}", removed);
        metrics.invalidatedEntries.mark(removed);
        return removed;
    }

    public CacheStats stats()
    {
        return store.stats(clock.instant());
    }

    /**
     * @param limit the maximum number of entries returned
     * @return the most frequently served entries
     */
    public List<QueryCacheEntry> topQueries(int limit)
    {
        Preconditions.checkArgument(limit > 0, "limit must be positive");
        return store.topEntries(limit);
    }

    public boolean enabled()
    {
        return config.enabled();
    }

    private Optional<QueryCacheEntry> lookup(String queryHash, @Nullable String ownerPrincipalId)
    {
        if (!config.enabled())
        {
            return Optional.empty();
        }

        Optional<QueryCacheEntry> found;
        try
        {
            found = store.findLatest(queryHash, ownerPrincipalId, clock.instant());
        }
        catch (CacheStoreException e)
        {
            LOGGER.warn("Query cache lookup failed, treating as a miss. queryHash={} owner={}",
                        queryHash, ownerPrincipalId, e);
            metrics.storeFailures.mark();
            return Optional.empty();
        }

        if (found.isPresent())
        {
            metrics.hits.mark();
            recordHit(found.get());
        }
        else
        {
            metrics.misses.mark();
        }
        return found;
    }

    private void recordHit(QueryCacheEntry entry)
    {
        try
        {
            hitCountPool.runBlocking(() -> store.incrementHitCount(entry))
                        .onFailure(cause -> LOGGER.warn("Unable to record cache hit. entry={}", entry.id(), cause));
        }
        catch (RuntimeException e)
        {
            LOGGER.warn("Unable to schedule cache hit recording. entry={}", entry.id(), e);
        }
    }
}
