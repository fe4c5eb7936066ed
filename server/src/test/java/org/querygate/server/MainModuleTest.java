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

package org.querygate.server;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.vertx.core.Vertx;
import org.querygate.acl.TableAccessAuthorizer;
import org.querygate.acl.UnqualifiedTablePolicy;
import org.querygate.cache.CacheStore;
import org.querygate.cache.InMemoryCacheStore;
import org.querygate.cache.QueryCache;
import org.querygate.config.AccessControlConfiguration;
import org.querygate.config.QueryCacheConfiguration;
import org.querygate.config.SchemaKeyspaceConfiguration;
import org.querygate.db.QueryCacheDatabaseAccessor;
import org.querygate.service.QueryEngine;
import org.querygate.service.QueryExecutionHandler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for the {@link MainModule} bindings
 */
class MainModuleTest
{
    private final List<Injector> injectors = new ArrayList<>();

    @TempDir
    Path tempDir;

    @AfterEach
    void closeVertx()
    {
        injectors.forEach(injector -> injector.getInstance(Vertx.class).close());
    }

    @Test
    void testConfigurationBindings() throws Exception
    {
        Injector injector = injector(testConfigPath());

        AccessControlConfiguration accessControl = injector.getInstance(AccessControlConfiguration.class);
        assertThat(accessControl.requiredPermission()).isEqualTo("query:run");
        assertThat(accessControl.unqualifiedTablePolicy()).isEqualTo(UnqualifiedTablePolicy.DENY);

        QueryCacheConfiguration queryCache = injector.getInstance(QueryCacheConfiguration.class);
        assertThat(queryCache.maxCachedRows()).isEqualTo(500);

        SchemaKeyspaceConfiguration schema = injector.getInstance(SchemaKeyspaceConfiguration.class);
        assertThat(schema.keyspace()).isEqualTo("querygate_test");
    }

    @Test
    void testCassandraStoreSelected() throws Exception
    {
        Injector injector = injector(testConfigPath());

        assertThat(injector.getInstance(CacheStore.class)).isInstanceOf(QueryCacheDatabaseAccessor.class);
    }

    @Test
    void testMemoryStoreSelected() throws IOException
    {
        Path conf = tempDir.resolve("querygate.yaml");
        Files.write(conf, ("query_cache:\n"
                           + "  store: memory\n").getBytes(StandardCharsets.UTF_8));

        Injector injector = injector(conf);

        assertThat(injector.getInstance(CacheStore.class)).isInstanceOf(InMemoryCacheStore.class);
        assertThat(injector.getInstance(QueryCache.class)).isSameAs(injector.getInstance(QueryCache.class));
        assertThat(injector.getInstance(TableAccessAuthorizer.class)).isNotNull();
        assertThat(injector.getInstance(QueryExecutionHandler.class)).isNotNull();
        assertThat(injector.getInstance(QueryGate.class)).isNotNull();
    }

    @Test
    void testMissingConfigurationPath()
    {
        Injector injector = Guice.createInjector(new MainModule());

        assertThatThrownBy(() -> injector.getInstance(AccessControlConfiguration.class))
        .isInstanceOf(ProvisionException.class)
        .rootCause()
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("YAML configuration path");
    }

    private Injector injector(Path conf)
    {
        Injector injector = Guice.createInjector(new MainModule(conf), new AbstractModule()
        {
            @Override
            protected void configure()
            {
                bind(QueryEngine.class).toInstance(mock(QueryEngine.class));
            }
        });
        injectors.add(injector);
        return injector;
    }

    private static Path testConfigPath() throws URISyntaxException
    {
        return Paths.get(MainModuleTest.class.getResource("/config/querygate_test.yaml").toURI());
    }
}
