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
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.jetbrains.annotations.Nullable;

/**
 * {@link CacheStore} kept in process memory. Entries are lost on restart.
 */
public class InMemoryCacheStore implements CacheStore
{
    private final Map<UUID, Slot> entries = new ConcurrentHashMap<>();

    @Override
    public void insert(QueryCacheEntry entry)
    {
        entries.put(entry.id(), new Slot(entry));
    }

    @Override
    public Optional<QueryCacheEntry> findLatest(String queryHash, @Nullable String ownerPrincipalId, Instant now)
    {
        return entries.values()
                      .stream()
                      .filter(slot -> slot.entry.queryHash().equals(queryHash))
                      .filter(slot -> ownerPrincipalId == null || slot.entry.ownerPrincipalId().equals(ownerPrincipalId))
                      .filter(slot -> !slot.entry.isExpired(now))
                      .max(Comparator.comparing(slot -> slot.entry.createdAt()))
                      .map(Slot::snapshot);
    }

    @Override
    public void incrementHitCount(QueryCacheEntry entry)
    {
        Slot slot = entries.get(entry.id());
        if (slot != null)
        {
            slot.hits.incrementAndGet();
        }
    }

    @Override
    public int deleteExpired(Instant now)
    {
        return removeIf(entry -> entry.isExpired(now));
    }

    @Override
    public int deleteByDependency(@Nullable String project, String dataset, String table)
    {
        return removeIf(entry -> entry.dependencies()
                                      .stream()
                                      .anyMatch(dependency -> dependency.matches(project, dataset, table)));
    }

    @Override
    public int deleteAll()
    {
        return removeIf(entry -> true);
    }

    @Override
    public CacheStats stats(Instant now)
    {
        long total = 0;
        long hits = 0;
        long expired = 0;
        for (Slot slot : entries.values())
        {
            total++;
            hits += slot.hits.get();
            if (slot.entry.isExpired(now))
            {
                expired++;
            }
        }
        return new CacheStats(total, hits, expired);
    }

    @Override
    public List<QueryCacheEntry> topEntries(int limit)
    {
        return entries.values()
                      .stream()
                      .map(Slot::snapshot)
                      .sorted(Comparator.comparingLong(QueryCacheEntry::hitCount).reversed())
                      .limit(limit)
                      .collect(Collectors.toList());
    }

    private int removeIf(Predicate<QueryCacheEntry> predicate)
    {
        int removed = 0;
        for (Iterator<Slot> it = entries.values().iterator(); it.hasNext(); )
        {
            if (predicate.test(it.next().entry))
            {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private static class Slot
    {
        private final QueryCacheEntry entry;
        private final AtomicLong hits;

        Slot(QueryCacheEntry entry)
        {
            this.entry = entry.detached(entry.hitCount());
            this.hits = new AtomicLong(entry.hitCount());
        }

        QueryCacheEntry snapshot()
        {
            return entry.detached(hits.get());
        }
    }
}
