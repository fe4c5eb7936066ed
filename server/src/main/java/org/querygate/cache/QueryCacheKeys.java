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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.CharMatcher;
import com.google.common.hash.Hashing;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.jetbrains.annotations.Nullable;

/**
 * Computes the content address of a query. Two queries that differ only in letter case or whitespace, with
 * parameters that are equal as JSON values, share a key.
 */
public final class QueryCacheKeys
{
    private static final ObjectMapper CANONICAL_MAPPER
    = new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private QueryCacheKeys()
    {
    }

    /**
     * @param sql    the query text
     * @param params the query parameters, may be {@code null} or empty
     * @return the lower-case hex SHA-256 of the normalized query text and canonical parameters
     */
    public static String hash(String sql, @Nullable Map<String, ?> params)
    {
        StringBuilder key = new StringBuilder(normalizeSql(sql));
        if (params != null && !params.isEmpty())
        {
            key.append('\n').append(canonicalJson(params));
        }
        return Hashing.sha256().hashString(key, StandardCharsets.UTF_8).toString();
    }

    /**
     * @param sql the query text
     * @return the text trimmed, lower-cased and with every whitespace run collapsed to one space
     */
    public static String normalizeSql(String sql)
    {
        return CharMatcher.whitespace().trimAndCollapseFrom(sql.toLowerCase(Locale.ROOT), ' ');
    }

    static String canonicalJson(Map<String, ?> params)
    {
        try
        {
            return CANONICAL_MAPPER.writeValueAsString(canonical(params));
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalArgumentException("Query parameters cannot be rendered as JSON", e);
        }
    }

    private static Object canonical(Object value)
    {
        if (value instanceof JsonObject)
        {
            return canonical(((JsonObject) value).getMap());
        }
        if (value instanceof JsonArray)
        {
            return canonical(((JsonArray) value).getList());
        }
        if (value instanceof Map)
        {
            Map<String, Object> sorted = new TreeMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> sorted.put(String.valueOf(k), canonical(v)));
            return sorted;
        }
        if (value instanceof List)
        {
            List<Object> list = new ArrayList<>();
            ((List<?>) value).forEach(v -> list.add(canonical(v)));
            return list;
        }
        return value;
    }
}
