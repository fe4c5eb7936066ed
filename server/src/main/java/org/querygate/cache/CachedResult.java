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

import java.util.Objects;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Result of a query as handed back by the query engine: the rows and the engine's statistics for the run.
 * The contents are opaque to the cache.
 */
public final class CachedResult
{
    private final JsonArray rows;
    private final JsonObject metadata;

    public CachedResult(JsonArray rows, JsonObject metadata)
    {
        this.rows = Objects.requireNonNull(rows, "rows");
        this.metadata = metadata == null ? new JsonObject() : metadata;
    }

    public static CachedResult fromJson(JsonObject json)
    {
        JsonArray rows = json.getJsonArray("rows");
        return new CachedResult(rows == null ? new JsonArray() : rows, json.getJsonObject("metadata"));
    }

    public JsonArray rows()
    {
        return rows;
    }

    public JsonObject metadata()
    {
        return metadata;
    }

    public int rowCount()
    {
        return rows.size();
    }

    public boolean isEmpty()
    {
        return rows.isEmpty();
    }

    /**
     * @return a deep copy that shares no mutable JSON with this result
     */
    public CachedResult copy()
    {
        return new CachedResult(rows.copy(), metadata.copy());
    }

    public JsonObject toJson()
    {
        return new JsonObject().put("rows", rows).put("metadata", metadata);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (o == null || getClass() != o.getClass())
        {
            return false;
        }
        CachedResult that = (CachedResult) o;
        return rows.equals(that.rows) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(rows, metadata);
    }
}
