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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.datastax.driver.core.KeyspaceMetadata;
import com.datastax.driver.core.ResultSet;
import com.datastax.driver.core.Session;
import com.datastax.driver.core.TableMetadata;
import org.querygate.config.yaml.SchemaKeyspaceConfigurationImpl;
import org.querygate.exceptions.SchemaModificationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link QueryCacheSchema} and the initialization it inherits from {@link AbstractSchema}
 */
class QueryCacheSchemaTest
{
    private Session session;
    private QueryCacheSchema schema;

    @BeforeEach
    void setup()
    {
        session = mock(Session.class, RETURNS_DEEP_STUBS);
        schema = new QueryCacheSchema(new SchemaKeyspaceConfigurationImpl(true, "qg", "SimpleStrategy", 1));
    }

    @Test
    void testExistingSchemaIsPrepared()
    {
        KeyspaceMetadata keyspace = mock(KeyspaceMetadata.class);
        when(keyspace.getTable(anyString())).thenReturn(mock(TableMetadata.class));
        when(session.getCluster().getMetadata().getKeyspace("qg")).thenReturn(keyspace);

        assertThat(schema.initialize(session, s -> false)).isTrue();
        assertThat(schema.isInitialized()).isTrue();
        assertThat(schema.insertEntry()).isNotNull();
        assertThat(schema.deleteDependent()).isNotNull();
        verify(session, times(12)).prepare(anyString());
        verify(session, never()).execute(anyString());

        // a second call does not prepare again
        assertThat(schema.initialize(session, s -> false)).isTrue();
        verify(session, times(12)).prepare(anyString());
    }

    @Test
    void testMissingSchemaWithoutCreation()
    {
        when(session.getCluster().getMetadata().getKeyspace("qg")).thenReturn(null);

        assertThat(schema.initialize(session, s -> false)).isFalse();
        assertThat(schema.isInitialized()).isFalse();
        verify(session, never()).execute(anyString());
    }

    @Test
    void testMissingSchemaIsCreated()
    {
        when(session.getCluster().getMetadata().getKeyspace("qg")).thenReturn(null);
        ResultSet created = mock(ResultSet.class, RETURNS_DEEP_STUBS);
        when(created.getExecutionInfo().isSchemaInAgreement()).thenReturn(true);
        when(session.execute(anyString())).thenReturn(created);

        assertThat(schema.initialize(session, s -> true)).isTrue();
        verify(session, times(4)).execute(anyString());
        verify(session, times(12)).prepare(anyString());
    }

    @Test
    void testCreationFailure()
    {
        when(session.getCluster().getMetadata().getKeyspace("qg")).thenReturn(null);
        when(session.execute(anyString())).thenThrow(new IllegalStateException("unavailable"));

        assertThatThrownBy(() -> schema.initialize(session, s -> true))
        .isInstanceOf(SchemaModificationException.class)
        .hasMessageContaining("QueryCacheSchema");
    }

    @Test
    void testStatements()
    {
        List<String> create = schema.createSchemaStatements();

        assertThat(create).hasSize(4);
        assertThat(create.get(0)).contains("CREATE KEYSPACE IF NOT EXISTS qg")
                                 .contains("'class':'SimpleStrategy'");
        assertThat(create.get(1)).contains("qg.query_cache_v1").contains("CLUSTERING ORDER BY (created_at DESC");
        assertThat(create.get(2)).contains("qg.query_cache_hits_v1").contains("hits counter");
        assertThat(create.get(3)).contains("qg.table_dependencies_v1");
        assertThat(schema.truncateStatements()).containsExactly("TRUNCATE qg.query_cache_v1",
                                                                "TRUNCATE qg.query_cache_hits_v1",
                                                                "TRUNCATE qg.table_dependencies_v1");
    }
}
