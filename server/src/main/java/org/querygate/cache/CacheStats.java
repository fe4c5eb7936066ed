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

import io.vertx.core.json.JsonObject;

/**
 * Point-in-time counters over the whole query cache
 */
public final class CacheStats
{
    private final long totalEntries;
    private final long totalHits;
    private final long expiredEntries;

    public CacheStats(long totalEntries, long totalHits, long expiredEntries)
    {
        this.totalEntries = totalEntries;
        this.totalHits = totalHits;
        this.expiredEntries = expiredEntries;
    }

    public long totalEntries()
    {
        return totalEntries;
    }

    public long totalHits()
    {
        return totalHits;
    }

    public long expiredEntries()
    {
        return expiredEntries;
    }

    public long activeEntries()
    {
        return totalEntries - expiredEntries;
    }

    public JsonObject toJson()
    {
        return new JsonObject().put("total_entries", totalEntries)
                               .put("active_entries", activeEntries())
                               .put("expired_entries", expiredEntries)
                               .put("total_hits", totalHits);
    }

    @Override
    public String toString()
    {
        return "CacheStats{totalEntries=" + totalEntries
               + ", totalHits=" + totalHits
               + ", expiredEntries=" + expiredEntries
               + '}';
    }
}
