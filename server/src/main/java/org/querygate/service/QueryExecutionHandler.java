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

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.querygate.cache.CachedResult;
import org.querygate.cache.QueryCacheKeys;
import org.querygate.cache.StoreResult;
import org.querygate.config.AccessControlConfiguration;
import org.querygate.sql.TableReference;
import org.jetbrains.annotations.Nullable;

/**
 * Runs a query for a principal: authorize, serve from the cache when possible, otherwise execute on the
 * {@link QueryEngine} and offer the result to the cache
 */
@Singleton
public class QueryExecutionHandler
{
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryExecutionHandler.class);

    private final QueryAccessService accessService;
    private final QueryEngine queryEngine;
    private final AccessControlConfiguration config;

    @Inject
    public QueryExecutionHandler(QueryAccessService accessService,
                                 QueryEngine queryEngine,
                                 AccessControlConfiguration config)
    {
        this.accessService = accessService;
        this.queryEngine = queryEngine;
        this.config = config;
    }

    public QueryResponse execute(String principalId,
                                 @Nullable Instant tokenExpiry,
                                 String sql,
                                 @Nullable Map<String, ?> params,
                                 boolean useCache)
    {
        if (!useCache)
        {
            accessService.authorize(principalId, tokenExpiry, sql, config.requiredPermission());
            CachedResult result = queryEngine.execute(sql);
            return QueryResponse.executed(QueryCacheKeys.hash(sql, params), result, null);
        }

        LookupResult lookup = accessService.authorizeAndLookup(principalId, tokenExpiry, sql, params);
        if (lookup.isCacheHit())
        {
            return QueryResponse.fromCache(lookup.entry().get());
        }

        CachedResult result = queryEngine.execute(sql);
        List<TableReference> references = lookup.references();
        StoreResult stored = accessService.recordResult(principalId, sql, params, references, result);
        LOGGER.debug("Executed query. principal={} queryHash={} rows={} storeResult={}",
                     principalId, lookup.queryHash(), result.rowCount(), stored);
        return QueryResponse.executed(lookup.queryHash(), result, stored);
    }
}
