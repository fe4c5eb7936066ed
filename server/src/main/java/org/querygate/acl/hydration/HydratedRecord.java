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
import java.util.function.Function;

import io.vertx.core.json.JsonObject;

/**
 * Outcome of reading one hydration record: either it matched the expected shape and was bound to {@code T}, or it
 * did not and only the raw fields are available.
 *
 * @param <T> the bound record type
 */
public final class HydratedRecord<T>
{
    /**
     * Whether the record was bound or kept raw
     */
    public enum Kind
    {
        VALIDATED,
        DEGRADED
    }

    private final Kind kind;
    private final T value;
    private final JsonObject raw;
    private final String reason;

    private HydratedRecord(Kind kind, T value, JsonObject raw, String reason)
    {
        this.kind = kind;
        this.value = value;
        this.raw = raw;
        this.reason = reason;
    }

    public static <T> HydratedRecord<T> validated(T value, JsonObject raw)
    {
        return new HydratedRecord<>(Kind.VALIDATED, value, raw, null);
    }

    public static <T> HydratedRecord<T> degraded(JsonObject raw, String reason)
    {
        return new HydratedRecord<>(Kind.DEGRADED, null, raw, reason);
    }

    public Kind kind()
    {
        return kind;
    }

    public boolean isValidated()
    {
        return kind == Kind.VALIDATED;
    }

    /**
     * @return the bound value
     * @throws IllegalStateException when the record is degraded
     */
    public T value()
    {
        if (kind != Kind.VALIDATED)
        {
            throw new IllegalStateException("Record is degraded: " + reason);
        }
        return value;
    }

    public JsonObject raw()
    {
        return raw;
    }

    /**
     * @return why binding failed, or {@code null} for a validated record
     */
    public String reason()
    {
        return reason;
    }

    /**
     * @param fallback extracts the same logical fields from the raw record
     * @return the bound value, or whatever the fallback can recover from a degraded record
     */
    public Optional<T> resolve(Function<JsonObject, Optional<T>> fallback)
    {
        return kind == Kind.VALIDATED ? Optional.of(value) : fallback.apply(raw);
    }
}
