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

package org.querygate.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datastax.driver.core.ResultSet;
import com.datastax.driver.core.Session;
import com.datastax.driver.core.Statement;
import org.querygate.common.CqlSessionProvider;
import org.querygate.config.SchemaKeyspaceConfiguration;
import org.querygate.db.schema.AbstractSchema;
import org.querygate.exceptions.SchemaUnavailableException;
import org.querygate.exceptions.StoreUnavailableException;

/**
 * Base class for the classes that read and write the tables of one {@link AbstractSchema}. The schema is
 * initialized lazily against the current session, creating its tables when the configuration allows it.
 *
 * @param <T> the schema accessed
 */
public abstract class DatabaseAccessor<T extends AbstractSchema>
{
    protected final Logger logger = LoggerFactory.getLogger(this.getClass());
    protected final T tableSchema;
    protected final CqlSessionProvider sessionProvider;
    private final SchemaKeyspaceConfiguration keyspaceConfiguration;

    protected DatabaseAccessor(T tableSchema,
                               CqlSessionProvider sessionProvider,
                               SchemaKeyspaceConfiguration keyspaceConfiguration)
    {
        this.tableSchema = tableSchema;
        this.sessionProvider = sessionProvider;
        this.keyspaceConfiguration = keyspaceConfiguration;
    }

    /**
     * @return the schema, with its statements prepared
     * @throws StoreUnavailableException  when Cassandra cannot be reached
     * @throws SchemaUnavailableException when the schema does not exist and cannot be created
     */
    protected T schema()
    {
        session();
        return tableSchema;
    }

    protected ResultSet execute(Statement statement)
    {
        return session().execute(statement);
    }

    protected Session session()
    {
        Session session = sessionProvider.get();
        if (!tableSchema.initialize(session, schema -> keyspaceConfiguration.createSchema()))
        {
            throw new SchemaUnavailableException("Schema " + tableSchema.getClass().getSimpleName()
                                                 + " is not available in keyspace " + keyspaceConfiguration.keyspace());
        }
        return session;
    }
}
