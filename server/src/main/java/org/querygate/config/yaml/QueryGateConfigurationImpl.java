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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.querygate.config.AccessControlConfiguration;
import org.querygate.config.CacheConfiguration;
import org.querygate.config.DriverConfiguration;
import org.querygate.config.QueryCacheConfiguration;
import org.querygate.config.QueryGateConfiguration;
import org.querygate.config.SchemaKeyspaceConfiguration;

/**
 * Configuration for QueryGate, bound from YAML
 */
public class QueryGateConfigurationImpl implements QueryGateConfiguration
{
    @JsonProperty("access_control")
    protected final AccessControlConfiguration accessControlConfiguration;

    @JsonProperty("query_cache")
    protected final QueryCacheConfiguration queryCacheConfiguration;

    @JsonProperty("driver")
    protected final DriverConfiguration driverConfiguration;

    @JsonProperty("schema")
    protected final SchemaKeyspaceConfiguration schemaKeyspaceConfiguration;

    public QueryGateConfigurationImpl()
    {
        this(new AccessControlConfigurationImpl(),
             new QueryCacheConfigurationImpl(),
             new DriverConfigurationImpl(),
             new SchemaKeyspaceConfigurationImpl());
    }

    public QueryGateConfigurationImpl(AccessControlConfiguration accessControlConfiguration,
                                      QueryCacheConfiguration queryCacheConfiguration,
                                      DriverConfiguration driverConfiguration,
                                      SchemaKeyspaceConfiguration schemaKeyspaceConfiguration)
    {
        this.accessControlConfiguration = accessControlConfiguration;
        this.queryCacheConfiguration = queryCacheConfiguration;
        this.driverConfiguration = driverConfiguration;
        this.schemaKeyspaceConfiguration = schemaKeyspaceConfiguration;
    }

    @Override
    @JsonProperty("access_control")
    public AccessControlConfiguration accessControlConfiguration()
    {
        return accessControlConfiguration;
    }

    @Override
    @JsonProperty("query_cache")
    public QueryCacheConfiguration queryCacheConfiguration()
    {
        return queryCacheConfiguration;
    }

    @Override
    @JsonProperty("driver")
    public DriverConfiguration driverConfiguration()
    {
        return driverConfiguration;
    }

    @Override
    @JsonProperty("schema")
    public SchemaKeyspaceConfiguration schemaKeyspaceConfiguration()
    {
        return schemaKeyspaceConfiguration;
    }

    /**
     * Reads the configuration from the YAML file at {@code yamlConfigurationPath}. Sections that are missing from
     * the file keep their defaults.
     *
     * @param yamlConfigurationPath the path to {@code querygate.yaml}
     * @return the parsed configuration
     * @throws IOException when the file cannot be read or parsed
     */
    public static QueryGateConfiguration readYamlConfiguration(Path yamlConfigurationPath) throws IOException
    {
        try (InputStream inputStream = Files.newInputStream(yamlConfigurationPath))
        {
            return readYamlConfiguration(inputStream);
        }
    }

    public static QueryGateConfiguration readYamlConfiguration(InputStream inputStream) throws IOException
    {
        return yamlMapper().readValue(inputStream, QueryGateConfigurationImpl.class);
    }

    private static ObjectMapper yamlMapper()
    {
        SimpleModule simpleModule = new SimpleModule()
                                    .addAbstractTypeMapping(AccessControlConfiguration.class,
                                                            AccessControlConfigurationImpl.class)
                                    .addAbstractTypeMapping(CacheConfiguration.class,
                                                            CacheConfigurationImpl.class)
                                    .addAbstractTypeMapping(QueryCacheConfiguration.class,
                                                            QueryCacheConfigurationImpl.class)
                                    .addAbstractTypeMapping(DriverConfiguration.class,
                                                            DriverConfigurationImpl.class)
                                    .addAbstractTypeMapping(SchemaKeyspaceConfiguration.class,
                                                            SchemaKeyspaceConfigurationImpl.class);

        return YAMLMapper.builder()
                         .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                         .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                         .addModule(simpleModule)
                         .build();
    }
}
