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
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.google.common.collect.ImmutableSet;

/**
 * A stored query result, owned by the principal that produced it
 */
public final class QueryCacheEntry
{
    private final UUID id;
    private final String queryHash;
    private final String ownerPrincipalId;
    private final String sql;
    private final CachedResult payload;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final long hitCount;
    private final Set<TableDependency> dependencies;

    public QueryCacheEntry(UUID id,
                           String queryHash,
                           String ownerPrincipalId,
                           String sql,
                           CachedResult payload,
                           Instant createdAt,
                           Instant expiresAt,
                           long hitCount,
                           Set<TableDependency> dependencies)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.queryHash = Objects.requireNonNull(queryHash, "queryHash");
        this.ownerPrincipalId = Objects.requireNonNull(ownerPrincipalId, "ownerPrincipalId");
        this.sql = sql;
        this.payload = Objects.requireNonNull(payload, "payload");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        this.hitCount = hitCount;
        this.dependencies = ImmutableSet.copyOf(dependencies);
    }

    public UUID id()
    {
        return id;
    }

    public String queryHash()
    {
        return queryHash;
    }

    public String ownerPrincipalId()
    {
        return ownerPrincipalId;
    }

    public String sql()
    {
        return sql;
    }

    public CachedResult payload()
    {
        return payload;
    }

    public Instant createdAt()
    {
        return createdAt;
    }

    public Instant expiresAt()
    {
        return expiresAt;
    }

    /**
     * @return how many lookups were served by this entry; may lag behind since increments are asynchronous
     */
    public long hitCount()
    {
        return hitCount;
    }

    public Set<TableDependency> dependencies()
    {
        return dependencies;
    }

    /**
     * @param now the instant to check against
     * @return {@code true} when {@code now} is at or after the expiry
     */
    public boolean isExpired(Instant now)
    {
        return !now.isBefore(expiresAt);
    }

    public QueryCacheEntry withHitCount(long hitCount)
    {
        return new QueryCacheEntry(id, queryHash, ownerPrincipalId, sql, payload, createdAt, expiresAt, hitCount, dependencies);
    }

    /**
     * @param hitCount the hit count of the copy
     * @return a copy whose payload shares no mutable JSON with this entry
     */
    public QueryCacheEntry detached(long hitCount)
    {
        return new QueryCacheEntry(id, queryHash, ownerPrincipalId, sql, payload.copy(),
                                   createdAt, expiresAt, hitCount, dependencies);
    }

    @Override
    public String toString()
    {
        return "QueryCacheEntry{id=" + id
               + ", queryHash='" + queryHash + '\''
               + ", owner='" + ownerPrincipalId + '\''
               + ", createdAt=" + createdAt
               + ", expiresAt=" + expiresAt
               + ", hitCount=" + hitCount
               + ", dependencies=" + dependencies
               + '}';
    }
}
