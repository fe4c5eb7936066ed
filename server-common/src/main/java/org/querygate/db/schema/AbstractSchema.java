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

package org.querygate.db.schema;

import java.util.List;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datastax.driver.core.ConsistencyLevel;
import com.datastax.driver.core.KeyspaceMetadata;
import com.datastax.driver.core.Metadata;
import com.datastax.driver.core.PreparedStatement;
import com.datastax.driver.core.ResultSet;
import com.datastax.driver.core.Session;
import org.querygate.exceptions.SchemaModificationException;
import org.jetbrains.annotations.NotNull;

/**
 * Base class for the Cassandra tables QueryGate reads and writes. A schema is initialized once per session: its
 * tables are created when missing (if allowed) and its statements are prepared.
 */
public abstract class AbstractSchema
{
    protected Logger logger = LoggerFactory.getLogger(this.getClass());
    private volatile boolean initialized = false;

    public synchronized boolean initialize(@NotNull Session session, @NotNull Predicate<AbstractSchema> shouldCreateSchema)
    {
        initialized = initialized || initializeInternal(session, shouldCreateSchema);
        return initialized;
    }

    public boolean isInitialized()
    {
        return initialized;
    }

    protected PreparedStatement prepare(PreparedStatement cached, Session session, String cqlLiteral)
    {
        return cached == null ? session.prepare(cqlLiteral).setConsistencyLevel(ConsistencyLevel.LOCAL_QUORUM) : cached;
    }

    protected boolean initializeInternal(@NotNull Session session,
                                         @NotNull Predicate<AbstractSchema> shouldCreateSchema)
    {
        if (!exists(session.getCluster().getMetadata()))
        {
            if (!shouldCreateSchema.test(this))
            {
                logger.info("Schema {} does not exist and creation is disabled", getClass().getSimpleName());
                return false;
            }

            try
            {
                for (String statement : createSchemaStatements())
                {
                    ResultSet res = session.execute(statement);
                    if (!res.getExecutionInfo().isSchemaInAgreement())
                    {
                        logger.warn("Schema is not yet in agreement.");
                        return false;
                    }
                }
            }
            catch (Exception exception)
            {
                String schemaName = this.getClass().getSimpleName();
                throw new SchemaModificationException("Failed to modify schema for " + schemaName, exception);
            }
        }

        prepareStatements(session);
        return true;
    }

    /**
     * @param metadata the cluster metadata
     * @param tables   table names expected under {@link #keyspaceName()}
     * @return {@code true} when the keyspace and every table exist
     */
    protected boolean tablesExist(@NotNull Metadata metadata, String... tables)
    {
        KeyspaceMetadata keyspace = metadata.getKeyspace(keyspaceName());
        if (keyspace == null)
        {
            return false;
        }
        for (String table : tables)
        {
            if (keyspace.getTable(table) == null)
            {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the name of the Cassandra keyspace
     */
    protected abstract String keyspaceName();

    /**
     * Prepares the statements used by the accessor of this schema
     *
     * @param session the CQL session
     */
    protected abstract void prepareStatements(@NotNull Session session);

    /**
     * @param metadata the cluster metadata
     * @return {@code true} if the schema already exists in the database, {@code false} otherwise
     */
    protected abstract boolean exists(@NotNull Metadata metadata);

    /**
     * @return the statements creating the schema, executed in order
     */
    protected abstract List<String> createSchemaStatements();
}
