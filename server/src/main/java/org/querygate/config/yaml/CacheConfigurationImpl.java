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

package org.querygate.config.yaml;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.querygate.common.utils.MillisecondBoundConfiguration;
import org.querygate.config.CacheConfiguration;

/**
 * The {@code access_control.role_cache} section: how long hydrated identity records are reused
 */
public class CacheConfigurationImpl implements CacheConfiguration
{
    public static final MillisecondBoundConfiguration DEFAULT_EXPIRE_AFTER_WRITE = MillisecondBoundConfiguration.parse("5m");
    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    @JsonProperty("enabled")
    protected final boolean enabled;

    @JsonProperty("expire_after_write")
    protected final MillisecondBoundConfiguration expireAfterWrite;

    @JsonProperty("maximum_size")
    protected final long maximumSize;

    public CacheConfigurationImpl()
    {
        this(true, DEFAULT_EXPIRE_AFTER_WRITE, DEFAULT_MAXIMUM_SIZE);
    }

    public CacheConfigurationImpl(boolean enabled, MillisecondBoundConfiguration expireAfterWrite, long maximumSize)
    {
        this.enabled = enabled;
        this.expireAfterWrite = expireAfterWrite;
        this.maximumSize = maximumSize;
    }

    @Override
    @JsonProperty("enabled")
    public boolean enabled()
    {
        return enabled;
    }

    @Override
    @JsonProperty("expire_after_write")
    public MillisecondBoundConfiguration expireAfterWrite()
    {
        return expireAfterWrite;
    }

    @Override
    @JsonProperty("maximum_size")
    public long maximumSize()
    {
        return maximumSize;
    }
}
