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

package org.querygate.acl;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.vertx.core.json.JsonObject;
import org.querygate.acl.hydration.HydrationSource;
import org.querygate.exceptions.HydrationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link PermissionSnapshotBuilder}
 */
class PermissionSnapshotBuilderTest
{
    private HydrationSource source;
    private PermissionSnapshotBuilder builder;

    @BeforeEach
    void setup()
    {
        source = mock(HydrationSource.class);
        when(source.profile(anyString())).thenReturn(Optional.empty());
        when(source.roles(anyString())).thenReturn(Collections.emptyList());
        when(source.rolePermissions(anyString())).thenReturn(Collections.emptyList());
        when(source.roleDatasetAccess(anyString())).thenReturn(Collections.emptyList());
        builder = new PermissionSnapshotBuilder(source);
    }

    @Test
    void testBuildsFromValidatedRecords()
    {
        when(source.profile("u1"))
        .thenReturn(Optional.of(new JsonObject().put("user_id", "u1")
                                                .put("metadata", new JsonObject().put("team", "finance"))));
        when(source.roles("u1"))
        .thenReturn(Collections.singletonList(new JsonObject().put("role_id", "r1").put("role_name", "analyst")));
        when(source.rolePermissions("r1"))
        .thenReturn(Collections.singletonList(new JsonObject().put("permission", "query:execute")));
        when(source.roleDatasetAccess("r1"))
        .thenReturn(Arrays.asList(new JsonObject().put("dataset_id", "Sales").put("table_id", "Orders"),
                                  new JsonObject().put("dataset_id", "marketing").putNull("table_id")));

        Instant expiry = Instant.parse("2030-01-01T00:00:00Z");
        PermissionSnapshot snapshot = builder.build("u1", expiry);

        assertThat(snapshot.principalId()).isEqualTo("u1");
        assertThat(snapshot.roles()).containsExactly("analyst");
        assertThat(snapshot.hasPermission("query:execute")).isTrue();
        assertThat(snapshot.allowedDatasets()).containsExactlyInAnyOrder("sales", "marketing");
        assertThat(snapshot.canAccessTable("sales", "orders")).isTrue();
        assertThat(snapshot.canAccessTable("sales", "customers")).isFalse();
        assertThat(snapshot.canAccessTable("marketing", "campaigns")).isTrue();
        assertThat(snapshot.profileMetadata()).containsEntry("team", "finance");
        assertThat(snapshot.expiresAt()).contains(expiry);
    }

    @Test
    void testRoleWithoutNameFallsBackToItsId()
    {
        when(source.roles("u1")).thenReturn(Collections.singletonList(new JsonObject().put("role_id", "r7")));
        when(source.rolePermissions("r7"))
        .thenReturn(Collections.singletonList(new JsonObject().put("permission", "query:execute")));

        PermissionSnapshot snapshot = builder.build("u1", null);

        assertThat(snapshot.roles()).containsExactly("r7");
        assertThat(snapshot.hasPermission("query:execute")).isTrue();
    }

    @Test
    void testRoleNameIsTheKeyWhenIdIsMissing()
    {
        when(source.roles("u1")).thenReturn(Collections.singletonList(new JsonObject().put("role_name", "reader")));
        when(source.roleDatasetAccess("reader"))
        .thenReturn(Collections.singletonList(new JsonObject().put("dataset_id", "sales")));

        PermissionSnapshot snapshot = builder.build("u1", null);

        assertThat(snapshot.roles()).containsExactly("reader");
        assertThat(snapshot.canAccessDataset("sales")).isTrue();
    }

    @Test
    void testTableListFromOneRoleRestrictsWholeDatasetGrantFromAnother()
    {
        when(source.roles("u1"))
        .thenReturn(Arrays.asList(new JsonObject().put("role_id", "ra").put("role_name", "sales-reader"),
                                  new JsonObject().put("role_id", "rb").put("role_name", "orders-reader")));
        when(source.roleDatasetAccess("ra"))
        .thenReturn(Collections.singletonList(new JsonObject().put("dataset_id", "sales")));
        when(source.roleDatasetAccess("rb"))
        .thenReturn(Collections.singletonList(new JsonObject().put("dataset_id", "sales").put("table_id", "orders")));

        PermissionSnapshot snapshot = builder.build("u1", null);

        assertThat(snapshot.allowedDatasets()).containsExactly("sales");
        assertThat(snapshot.allowedTables()).containsOnlyKeys("sales");
        assertThat(snapshot.allowedTables().get("sales")).containsExactly("orders");
        assertThat(snapshot.canAccessTable("sales", "orders")).isTrue();
        assertThat(snapshot.canAccessTable("sales", "customers")).isFalse();
    }

    @Test
    void testUnusableRecordsAreSkipped()
    {
        when(source.profile("u1")).thenReturn(Optional.of(new JsonObject().put("metadata", "not an object")));
        when(source.roles("u1"))
        .thenReturn(Arrays.asList(new JsonObject().put("unrelated", true),
                                  new JsonObject().put("role_id", "r1").put("role_name", "analyst")));
        when(source.rolePermissions("r1"))
        .thenReturn(Arrays.asList(new JsonObject().put("permission", new JsonObject()),
                                  new JsonObject().put("permission", "query:execute")));
        when(source.roleDatasetAccess("r1"))
        .thenReturn(Arrays.asList(new JsonObject().put("table_id", "orders"),
                                  new JsonObject().put("dataset_id", "hr").put("table_id", new JsonObject()),
                                  new JsonObject().put("dataset_id", "finance").put("table_id", " ` "),
                                  new JsonObject().put("dataset_id", "sales").put("table_id", "orders")));

        PermissionSnapshot snapshot = builder.build("u1", null);

        assertThat(snapshot.roles()).containsExactly("analyst");
        assertThat(snapshot.permissions()).containsExactly("query:execute");
        assertThat(snapshot.allowedDatasets()).containsExactly("sales");
        assertThat(snapshot.canAccessDataset("hr")).isFalse();
        assertThat(snapshot.canAccessDataset("finance")).isFalse();
        assertThat(snapshot.profileMetadata()).isEmpty();
    }

    @Test
    void testNullRecordListsAreEmpty()
    {
        when(source.roles("u1")).thenReturn(null);

        PermissionSnapshot snapshot = builder.build("u1", null);

        assertThat(snapshot.roles()).isEmpty();
        assertThat(snapshot.allowedDatasets()).isEmpty();
    }

    @Test
    void testSourceFailurePropagates()
    {
        HydrationException failure = new HydrationException("identity store unavailable");
        when(source.roles("u1")).thenThrow(failure);

        assertThatThrownBy(() -> builder.build("u1", null)).isSameAs(failure);
    }

    @Test
    void testUnexpectedFailureIsWrapped()
    {
        when(source.roles("u1"))
        .thenReturn(Collections.singletonList(new JsonObject().put("role_id", "r1").put("role_name", "analyst")));
        IllegalStateException failure = new IllegalStateException("boom");
        when(source.rolePermissions("r1")).thenThrow(failure);

        assertThatThrownBy(() -> builder.build("u1", null))
        .isInstanceOf(HydrationException.class)
        .hasMessageContaining("u1")
        .hasCause(failure);
    }

    @Test
    void testEmptyPrincipalIsRejected()
    {
        assertThatThrownBy(() -> builder.build("", null)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(source);
    }
}
