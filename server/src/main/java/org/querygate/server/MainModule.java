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
import java.nio.file.Path;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import io.vertx.core.Vertx;
import org.querygate.acl.PermissionSnapshotBuilder;
import org.querygate.acl.RoleDataCache;
import org.querygate.acl.TableAccessAuthorizer;
import org.querygate.acl.hydration.CachingHydrationSource;
import org.querygate.acl.hydration.HydrationSource;
import org.querygate.cache.CacheStore;
import org.querygate.cache.InMemoryCacheStore;
import org.querygate.cache.QueryCache;
import org.querygate.cluster.CqlSessionProviderImpl;
import org.querygate.common.CqlSessionProvider;
import org.querygate.concurrent.TaskExecutorPool;
import org.querygate.config.AccessControlConfiguration;
import org.querygate.config.QueryCacheConfiguration;
import org.querygate.config.QueryGateConfiguration;
import org.querygate.config.SchemaKeyspaceConfiguration;
import org.querygate.config.yaml.QueryGateConfigurationImpl;
import org.querygate.db.QueryCacheDatabaseAccessor;
import org.querygate.db.RoleGrantsDatabaseAccessor;
import org.querygate.db.schema.QueryCacheSchema;
import org.querygate.db.schema.RoleGrantsSchema;
import org.querygate.metrics.QueryCacheMetrics;
import org.querygate.service.QueryAccessService;
import org.querygate.sql.TableReferenceExtractor;
import org.querygate.tasks.PeriodicTaskExecutor;
import org.querygate.tasks.QueryCacheSweepTask;

/**
 * Provides the main bindings of QueryGate. The {@link org.querygate.service.QueryEngine} is not bound here; it is
 * supplied by the module of the embedding application.
 */
public class MainModule extends AbstractModule
{
    private static final Logger LOGGER = LoggerFactory.getLogger(MainModule.class);
    public static final String HIT_COUNT_POOL = "hitCountPool";
    public static final String INTERNAL_POOL = "internalPool";

    protected final Path confPath;

    /**
     * Constructs the Guice main module without a configuration file; the configuration must then be bound
     * by an overriding module
     */
    public MainModule()
    {
        confPath = null;
    }

    /**
     * Constructs the Guice main module with the configured yaml {@code confPath}
     *
     * @param confPath the path to the yaml configuration file
     */
    public MainModule(Path confPath)
    {
        this.confPath = confPath;
    }

    @Provides
    @Singleton
    public QueryGateConfiguration queryGateConfiguration() throws IOException
    {
        if (confPath == null)
        {
            throw new NullPointerException("the YAML configuration path for QueryGate has not been defined.");
        }
        LOGGER.info("Reading configuration from {}", confPath);
        return QueryGateConfigurationImpl.readYamlConfiguration(confPath);
    }

    @Provides
    @Singleton
    public AccessControlConfiguration accessControlConfiguration(QueryGateConfiguration configuration)
    {
        return configuration.accessControlConfiguration();
    }

    @Provides
    @Singleton
    public QueryCacheConfiguration queryCacheConfiguration(QueryGateConfiguration configuration)
    {
        return configuration.queryCacheConfiguration();
    }

    @Provides
    @Singleton
    public SchemaKeyspaceConfiguration schemaKeyspaceConfiguration(QueryGateConfiguration configuration)
    {
        return configuration.schemaKeyspaceConfiguration();
    }

    @Provides
    @Singleton
    public Vertx vertx()
    {
        return Vertx.vertx();
    }

    @Provides
    @Singleton
    public Clock clock()
    {
        return Clock.systemUTC();
    }

    @Provides
    @Singleton
    public MetricRegistry metricRegistry()
    {
        return new MetricRegistry();
    }

    @Provides
    @Singleton
    public QueryCacheMetrics queryCacheMetrics(MetricRegistry metricRegistry)
    {
        return new QueryCacheMetrics(metricRegistry);
    }

    @Provides
    @Singleton
    @Named(HIT_COUNT_POOL)
    public TaskExecutorPool hitCountPool(Vertx vertx, QueryCacheConfiguration queryCacheConfiguration)
    {
        return new TaskExecutorPool("querygate-hit-count", vertx, queryCacheConfiguration.hitCountPoolSize());
    }

    @Provides
    @Singleton
    @Named(INTERNAL_POOL)
    public TaskExecutorPool internalPool(Vertx vertx)
    {
        return new TaskExecutorPool("querygate-internal", vertx, 1);
    }

    @Provides
    @Singleton
    public CqlSessionProvider cqlSessionProvider(QueryGateConfiguration configuration)
    {
        return new CqlSessionProviderImpl(configuration.driverConfiguration());
    }

    @Provides
    @Singleton
    public RoleDataCache roleDataCache(AccessControlConfiguration accessControlConfiguration, Clock clock)
    {
        return new RoleDataCache(accessControlConfiguration.roleCacheConfiguration(), clock);
    }

    @Provides
    @Singleton
    public HydrationSource hydrationSource(CqlSessionProvider sessionProvider,
                                           SchemaKeyspaceConfiguration keyspaceConfiguration,
                                           RoleDataCache roleDataCache)
    {
        RoleGrantsDatabaseAccessor accessor = new RoleGrantsDatabaseAccessor(new RoleGrantsSchema(keyspaceConfiguration),
                                                                             sessionProvider,
                                                                             keyspaceConfiguration);
        return new CachingHydrationSource(accessor, roleDataCache);
    }

    @Provides
    @Singleton
    public TableAccessAuthorizer tableAccessAuthorizer(AccessControlConfiguration accessControlConfiguration)
    {
        return new TableAccessAuthorizer(accessControlConfiguration.unqualifiedTablePolicy());
    }

    @Provides
    @Singleton
    public TableReferenceExtractor tableReferenceExtractor()
    {
        return new TableReferenceExtractor();
    }

    @Provides
    @Singleton
    public CacheStore cacheStore(QueryCacheConfiguration queryCacheConfiguration,
                                 CqlSessionProvider sessionProvider,
                                 SchemaKeyspaceConfiguration keyspaceConfiguration)
    {
        switch (queryCacheConfiguration.store())
        {
            case CASSANDRA:
                LOGGER.info("Using Cassandra query cache store in keyspace {}", keyspaceConfiguration.keyspace());
                return new QueryCacheDatabaseAccessor(new QueryCacheSchema(keyspaceConfiguration),
                                                      sessionProvider,
                                                      keyspaceConfiguration);
            case MEMORY:
            default:
                LOGGER.info("Using in-memory query cache store");
                return new InMemoryCacheStore();
        }
    }

    @Provides
    @Singleton
    public QueryCache queryCache(CacheStore cacheStore,
                                 QueryCacheConfiguration queryCacheConfiguration,
                                 Clock clock,
                                 @Named(HIT_COUNT_POOL) TaskExecutorPool hitCountPool,
                                 QueryCacheMetrics metrics)
    {
        return new QueryCache(cacheStore, queryCacheConfiguration, clock, hitCountPool, metrics);
    }

    @Provides
    @Singleton
    public QueryAccessService queryAccessService(PermissionSnapshotBuilder snapshotBuilder,
                                                 TableReferenceExtractor extractor,
                                                 TableAccessAuthorizer authorizer,
                                                 QueryCache queryCache,
                                                 AccessControlConfiguration accessControlConfiguration,
                                                 Clock clock)
    {
        return new QueryAccessService(snapshotBuilder, extractor, authorizer, queryCache, accessControlConfiguration, clock);
    }

    @Provides
    @Singleton
    public PeriodicTaskExecutor periodicTaskExecutor(@Named(INTERNAL_POOL) TaskExecutorPool internalPool)
    {
        return new PeriodicTaskExecutor(internalPool);
    }

    @Provides
    @Singleton
    public QueryCacheSweepTask queryCacheSweepTask(QueryCache queryCache, QueryCacheConfiguration queryCacheConfiguration)
    {
        return new QueryCacheSweepTask(queryCache, queryCacheConfiguration);
    }
}
