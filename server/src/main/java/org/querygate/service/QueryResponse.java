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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.querygate.cache.CachedResult;
import org.querygate.cache.QueryCacheEntry;
import org.querygate.cache.StoreResult;
import org.jetbrains.annotations.Nullable;

/**
 * What a query handler returns to its caller
 */
public final class QueryResponse
{
    private final String queryHash;
    private final CachedResult result;
    private final boolean cacheHit;
    private final StoreResult storeResult;

    private QueryResponse(String queryHash, CachedResult result, boolean cacheHit, @Nullable StoreResult storeResult)
    {
        this.queryHash = queryHash;
        this.result = result;
        this.cacheHit = cacheHit;
        this.storeResult = storeResult;
    }

    static QueryResponse fromCache(QueryCacheEntry entry)
    {
        return new QueryResponse(entry.queryHash(), entry.payload(), true, null);
    }

    static QueryResponse executed(String queryHash, CachedResult result, @Nullable StoreResult storeResult)
    {
        return new QueryResponse(queryHash, result, false, storeResult);
    }

    public String queryHash()
    {
        return queryHash;
    }

    public JsonArray rows()
    {
        return result.rows();
    }

    public JsonObject metadata()
    {
        return result.metadata();
    }

    public boolean cacheHit()
    {
        return cacheHit;
    }

    /**
     * @return whether the executed result was cached, {@code null} when it was served from the cache or caching
     * was not requested
     */
    @Nullable
    public StoreResult storeResult()
    {
        return storeResult;
    }

    public JsonObject toJson()
    {
        JsonObject json = new JsonObject().put("query_hash", queryHash)
                                          .put("rows", result.rows())
                                          .put("metadata", result.metadata())
                                          .put("cached", cacheHit);
        if (storeResult != null)
        {
            json.put("store_result", storeResult.name());
        }
        return json;
    }
}
