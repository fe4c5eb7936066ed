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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.querygate.exceptions.CacheStoreException;
import org.jetbrains.annotations.Nullable;

/**
 * Persistence for {@link QueryCacheEntry} instances and their table dependencies. Every method may throw
 * {@link CacheStoreException} when the backing store fails.
 */
public interface CacheStore
{
    /**
     * Persists the entry together with its dependencies
     */
    void insert(QueryCacheEntry entry) throws CacheStoreException;

    /**
     * @param queryHash        the query key
     * @param ownerPrincipalId only entries owned by this principal match; {@code null} matches any owner
     * @param now              entries expiring at or before this instant are ignored
     * @return the most recently created matching entry
     */
    Optional<QueryCacheEntry> findLatest(String queryHash, @Nullable String ownerPrincipalId, Instant now)
    throws CacheStoreException;

    void incrementHitCount(QueryCacheEntry entry) throws CacheStoreException;

    /**
     * @return the number of entries removed
     */
    int deleteExpired(Instant now) throws CacheStoreException;

    /**
     * Removes every entry depending on the table, see {@link TableDependency#matches(String, String, String)}
     *
     * @return the number of entries removed
     */
    int deleteByDependency(@Nullable String project, String dataset, String table) throws CacheStoreException;

    /**
     * @return the number of entries removed
     */
    int deleteAll() throws CacheStoreException;

    CacheStats stats(Instant now) throws CacheStoreException;

    /**
     * @param limit the maximum number of entries returned
     * @return entries ordered by descending hit count
     */
    List<QueryCacheEntry> topEntries(int limit) throws CacheStoreException;
}
