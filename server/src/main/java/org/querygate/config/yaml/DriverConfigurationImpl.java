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

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.querygate.config.DriverConfiguration;

/**
 * The driver configuration to use when connecting to Cassandra
 */
public class DriverConfigurationImpl implements DriverConfiguration
{
    @JsonProperty("contact_points")
    private final List<String> contactPoints;

    @JsonProperty("local_dc")
    private final String localDc;

    @JsonProperty("username")
    private final String username;

    @JsonProperty("password")
    private final String password;

    public DriverConfigurationImpl()
    {
        this(Collections.emptyList(), null, null, null);
    }

    public DriverConfigurationImpl(List<String> contactPoints, String localDc, String username, String password)
    {
        this.contactPoints = contactPoints;
        this.localDc = localDc;
        this.username = username;
        this.password = password;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    @JsonProperty("contact_points")
    public List<String> contactPoints()
    {
        return contactPoints;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    @JsonProperty("local_dc")
    public String localDc()
    {
        return localDc;
    }

    @Override
    @JsonProperty("username")
    public String username()
    {
        return username;
    }

    @Override
    @JsonProperty("password")
    public String password()
    {
        return password;
    }
}
