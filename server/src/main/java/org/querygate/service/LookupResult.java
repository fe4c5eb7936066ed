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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import org.querygate.cache.QueryCacheEntry;
import org.querygate.sql.TableReference;

/**
 * Outcome of an authorized lookup: either a cached result the caller may return as is, or the go-ahead to run
 * the query, with the references needed to record its result afterwards
 */
public final class LookupResult
{
    private final String queryHash;
    private final List<TableReference> references;
    private final QueryCacheEntry entry;

    private LookupResult(String queryHash, List<TableReference> references, QueryCacheEntry entry)
    {
        this.queryHash = Objects.requireNonNull(queryHash, "queryHash");
        this.references = ImmutableList.copyOf(references);
        this.entry = entry;
    }

    public static LookupResult cacheHit(QueryCacheEntry entry, List<TableReference> references)
    {
        Objects.requireNonNull(entry, "entry");
        return new LookupResult(entry.queryHash(), references, entry);
    }

    public static LookupResult mustExecute(String queryHash, List<TableReference> references)
    {
        return new LookupResult(queryHash, references, null);
    }

    public boolean isCacheHit()
    {
        return entry != null;
    }

    public Optional<QueryCacheEntry> entry()
    {
        return Optional.ofNullable(entry);
    }

    public String queryHash()
    {
        return queryHash;
    }

    public List<TableReference> references()
    {
        return references;
    }

    @Override
    public String toString()
    {
        return isCacheHit()
               ? "LookupResult{cacheHit, entry=" + entry.id() + '}'
               : "LookupResult{mustExecute, queryHash='" + queryHash + "', references=" + references + '}';
    }
}
