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

package org.querygate.cluster;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datastax.driver.core.Cluster;
import com.datastax.driver.core.Session;
import com.datastax.driver.core.exceptions.DriverException;
import com.datastax.driver.core.policies.DCAwareRoundRobinPolicy;
import com.datastax.driver.core.policies.ExponentialReconnectionPolicy;
import com.datastax.driver.core.policies.ReconnectionPolicy;
import com.datastax.driver.core.policies.TokenAwarePolicy;
import com.google.common.net.HostAndPort;
import org.querygate.common.CqlSessionProvider;
import org.querygate.config.DriverConfiguration;
import org.querygate.exceptions.ConfigurationException;
import org.querygate.exceptions.StoreUnavailableException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * Provides the session to the Cassandra cluster holding the identity tables and the persistent query cache.
 * The connection is made on first use.
 */
public class CqlSessionProviderImpl implements CqlSessionProvider
{
    private static final Logger LOGGER = LoggerFactory.getLogger(CqlSessionProviderImpl.class);
    private static final int DEFAULT_CQL_PORT = 9042;

    private final List<InetSocketAddress> contactPoints;
    private final String localDc;
    private final String username;
    private final String password;
    private final ReconnectionPolicy reconnectionPolicy;
    private volatile Session session;

    public CqlSessionProviderImpl(DriverConfiguration driverConfiguration)
    {
        this(parseContactPoints(driverConfiguration.contactPoints()),
             driverConfiguration.localDc(),
             driverConfiguration.username(),
             driverConfiguration.password());
    }

    @VisibleForTesting
    public CqlSessionProviderImpl(List<InetSocketAddress> contactPoints,
                                  String localDc,
                                  String username,
                                  String password)
    {
        this.contactPoints = contactPoints;
        this.localDc = localDc;
        this.username = username;
        this.password = password;
        this.reconnectionPolicy = new ExponentialReconnectionPolicy(500, 60_000);
    }

    /**
     * @param contactPoints contact points written as {@code host} or {@code host:port}
     * @return the resolved socket addresses
     * @throws ConfigurationException when a contact point cannot be parsed
     */
    @VisibleForTesting
    static List<InetSocketAddress> parseContactPoints(List<String> contactPoints)
    {
        try
        {
            return contactPoints.stream()
                                .map(HostAndPort::fromString)
                                .map(hp -> new InetSocketAddress(hp.getHost(), hp.getPortOrDefault(DEFAULT_CQL_PORT)))
                                .collect(Collectors.toList());
        }
        catch (IllegalArgumentException e)
        {
            throw new ConfigurationException("Invalid driver contact points " + contactPoints, e);
        }
    }

    /**
     * @return a session connected to the cluster
     * @throws StoreUnavailableException when no connection can be made
     */
    @Override
    @NotNull
    public synchronized Session get() throws StoreUnavailableException
    {
        if (session != null)
        {
            return session;
        }

        if (contactPoints.isEmpty())
        {
            throw new StoreUnavailableException("No contact points are configured");
        }

        LOGGER.info("Connecting to Cassandra. contactPoints={} localDc={}", contactPoints, localDc);
        Cluster cluster = buildCluster();
        try
        {
            session = cluster.connect();
            LOGGER.info("Connected to Cassandra. clusterName={}", cluster.getClusterName());
            return session;
        }
        catch (DriverException | IllegalStateException e)
        {
            LOGGER.error("Failed to reach Cassandra. contactPoints={}", contactPoints, e);
            closeQuietly(cluster, e);
            throw new StoreUnavailableException(e);
        }
    }

    private Cluster buildCluster()
    {
        Cluster.Builder builder = Cluster.builder()
                                         .addContactPointsWithPorts(contactPoints)
                                         .withReconnectionPolicy(reconnectionPolicy)
                                         .withoutMetrics();
        if (localDc != null)
        {
            builder.withLoadBalancingPolicy(new TokenAwarePolicy(DCAwareRoundRobinPolicy.builder()
                                                                                       .withLocalDc(localDc)
                                                                                       .build()));
        }
        if (username != null && password != null)
        {
            builder.withCredentials(username, password);
        }
        return builder.build();
    }

    private static void closeQuietly(Cluster cluster, Exception connectFailure)
    {
        try
        {
            cluster.close();
        }
        catch (RuntimeException closeFailure)
        {
            connectFailure.addSuppressed(closeFailure);
        }
    }

    @Override
    @Nullable
    public Session getIfConnected()
    {
        return session;
    }

    @Override
    public void close()
    {
        Session localSession;
        synchronized (this)
        {
            localSession = this.session;
            this.session = null;
        }
        if (localSession == null)
        {
            return;
        }
        try
        {
            localSession.getCluster().closeAsync().get(1, TimeUnit.MINUTES);
            LOGGER.info("Closed Cassandra session");
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        catch (TimeoutException e)
        {
            LOGGER.warn("Cassandra session did not close within 1 minute", e);
        }
        catch (ExecutionException e)
        {
            throw new StoreUnavailableException(e.getCause());
        }
    }
}
