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

package org.querygate.acl.hydration;

import java.util.Optional;

import io.vertx.core.json.JsonObject;

/**
 * Binding of raw hydration records to their typed form, and helpers for reading raw fields without assuming their shape
 */
public final class HydrationRecords
{
    private HydrationRecords()
    {
    }

    /**
     * Binds {@code raw} to {@code type}. Binding failures never escape; they produce a degraded record.
     *
     * @param raw  the record as returned by a {@link HydrationSource}
     * @param type the record type
     * @param <T>  the record type
     * @return a validated or a degraded record
     */
    public static <T> HydratedRecord<T> parse(JsonObject raw, Class<T> type)
    {
        if (raw == null)
        {
            return HydratedRecord.degraded(new JsonObject(), "null record");
        }
        try
        {
            return HydratedRecord.validated(raw.mapTo(type), raw);
        }
        catch (RuntimeException e)
        {
            return HydratedRecord.degraded(raw, e.getMessage());
        }
    }

    /**
     * @param raw   a raw record
     * @param field the field to read
     * @return the field rendered as a non-empty string when it holds a string, number or boolean
     */
    public static Optional<String> scalar(JsonObject raw, String field)
    {
        Object value = raw.getValue(field);
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean)
        {
            String text = value.toString();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        }
        return Optional.empty();
    }

    /**
     * @param raw   a raw record
     * @param field the field to check
     * @return {@code true} when the field holds something that is neither null nor a scalar
     */
    public static boolean isNonScalar(JsonObject raw, String field)
    {
        Object value = raw.getValue(field);
        return value != null && !(value instanceof CharSequence || value instanceof Number || value instanceof Boolean);
    }
}
