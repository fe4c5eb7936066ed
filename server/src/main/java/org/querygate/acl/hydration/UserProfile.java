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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vertx.core.json.JsonObject;

/**
 * A principal's profile record
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class UserProfile
{
    private final String userId;
    private final Map<String, Object> metadata;

    @JsonCreator
    public UserProfile(@JsonProperty(value = "user_id", required = true) String userId,
                       @JsonProperty("metadata") Map<String, Object> metadata)
    {
        this.userId = Objects.requireNonNull(userId, "user_id");
        this.metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    /**
     * Recovers what can be read from a profile record that failed validation
     */
    public static Optional<UserProfile> fromRaw(JsonObject raw)
    {
        Object metadata = raw.getValue("metadata");
        Map<String, Object> recovered = metadata instanceof JsonObject
                                        ? ((JsonObject) metadata).getMap()
                                        : Collections.emptyMap();
        return Optional.of(new UserProfile(HydrationRecords.scalar(raw, "user_id").orElse(""), recovered));
    }

    public String userId()
    {
        return userId;
    }

    public Map<String, Object> metadata()
    {
        return metadata;
    }
}
