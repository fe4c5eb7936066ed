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

package org.querygate.service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.querygate.acl.AuthorizationException;
import org.querygate.acl.PermissionSnapshot;
import org.querygate.acl.PermissionSnapshotBuilder;
import org.querygate.acl.TableAccessAuthorizer;
import org.querygate.cache.CachedResult;
import org.querygate.cache.QueryCache;
import org.querygate.cache.QueryCacheEntry;
import org.querygate.cache.QueryCacheKeys;
import org.querygate.cache.StoreResult;
import org.querygate.cache.TableDependency;
import org.querygate.config.AccessControlConfiguration;
import org.querygate.exceptions.HydrationException;
import org.querygate.sql.TableReference;
import org.querygate.sql.TableReferenceExtractor;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point for query handlers. Every query goes through {@link #authorizeAndLookup} (or {@link #authorize}
 * when caching is not wanted) before it may run; the results of queries that ran are offered back through
 * {@link #recordResult}.
 */
public class QueryAccessService
{
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryAccessService.class);

    private final PermissionSnapshotBuilder snapshotBuilder;
    private final TableReferenceExtractor extractor;
    private final TableAccessAuthorizer authorizer;
    private final QueryCache queryCache;
    private final AccessControlConfiguration config;
    private final Clock clock;

    public QueryAccessService(PermissionSnapshotBuilder snapshotBuilder,
                              TableReferenceExtractor extractor,
                              TableAccessAuthorizer authorizer,
                              QueryCache queryCache,
                              AccessControlConfiguration config,
                              Clock clock)
    {
        this.snapshotBuilder = snapshotBuilder;
        this.extractor = extractor;
        this.authorizer = authorizer;
        this.queryCache = queryCache;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Authorizes the query with the configured required permission and looks up a cached result
     *
     * @see #authorizeAndLookup(String, Instant, String, Map, String)
     */
    public LookupResult authorizeAndLookup(String principalId,
                                           @Nullable Instant tokenExpiry,
                                           String sql,
                                           @Nullable Map<String, ?> params)
    {
        return authorizeAndLookup(principalId, tokenExpiry, sql, params, config.requiredPermission());
    }

    /**
     * @param principalId        the authenticated principal
     * @param tokenExpiry        when the principal's credentials expire, if known
     * @param sql                the query text
     * @param params             the query parameters, part of the cache key
     * @param requiredPermission the permission the principal must hold
     * @return a cached result of the principal's own, or the go-ahead to execute
     * @throws HydrationException     when the principal's grants cannot be read
     * @throws AuthorizationException when the credentials expired, the permission is missing, or a table is denied
     */
    public LookupResult authorizeAndLookup(String principalId,
                                           @Nullable Instant tokenExpiry,
                                           String sql,
                                           @Nullable Map<String, ?> params,
                                           String requiredPermission)
    {
        List<TableReference> references = authorize(principalId, tokenExpiry, sql, requiredPermission);
        String queryHash = QueryCacheKeys.hash(sql, params);
        Optional<QueryCacheEntry> cached = queryCache.get(queryHash, principalId);
        if (cached.isPresent())
        {
            LOGGER.debug("Serving cached result. principal={} queryHash={}", principalId, queryHash);
            return LookupResult.cacheHit(cached.get(), references);
        }
        return LookupResult.mustExecute(queryHash, references);
    }

    /**
     * Authorizes the query without consulting the cache
     *
     * @return the table references found in the query
     * @throws HydrationException     when the principal's grants cannot be read
     * @throws AuthorizationException when the credentials expired, the permission is missing, or a table is denied
     */
    public List<TableReference> authorize(String principalId,
                                          @Nullable Instant tokenExpiry,
                                          String sql,
                                          String requiredPermission)
    {
        PermissionSnapshot snapshot = snapshotBuilder.build(principalId, tokenExpiry);
        if (snapshot.isExpired(clock.instant()))
        {
            LOGGER.info("Rejecting expired credentials. principal={} expiresAt={}", principalId, tokenExpiry);
            throw AuthorizationException.expired(principalId);
        }

        List<TableReference> references = extractor.extract(sql, Optional.ofNullable(config.defaultProject()));
        authorizer.authorize(snapshot, references, requiredPermission);
        return references;
    }

    /**
     * Offers the result of an executed query to the cache, recording the tables it was computed from
     *
     * @param principalId the principal that ran the query
     * @param sql         the query text
     * @param params      the query parameters
     * @param references  the references returned by the lookup
     * @param payload     the result
     * @return whether the result was stored
     */
    public StoreResult recordResult(String principalId,
                                    String sql,
                                    @Nullable Map<String, ?> params,
                                    List<TableReference> references,
                                    CachedResult payload)
    {
        Set<TableDependency> dependencies = new LinkedHashSet<>();
        for (TableReference reference : references)
        {
            TableDependency.fromReference(reference).ifPresent(dependencies::add);
        }
        return queryCache.put(QueryCacheKeys.hash(sql, params), principalId, sql, payload, dependencies);
    }

    /**
     * Evicts every cached result computed from the table
     *
     * @return the number of entries removed
     */
    public int invalidateTable(@Nullable String project, String dataset, String table)
    {
        return queryCache.invalidateTable(project, dataset, table);
    }
}
