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

package org.querygate.acl.hydration;

import org.junit.jupiter.api.Test;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HydrationRecords} and the record types it binds
 */
class HydrationRecordsTest
{
    @Test
    void testValidatedBinding()
    {
        JsonObject raw = new JsonObject().put("dataset_id", " Sales ").put("table_id", "`Orders`").put("extra", 1);

        HydratedRecord<DatasetGrant> record = HydrationRecords.parse(raw, DatasetGrant.class);

        assertThat(record.isValidated()).isTrue();
        assertThat(record.kind()).isEqualTo(HydratedRecord.Kind.VALIDATED);
        assertThat(record.reason()).isNull();
        assertThat(record.value().datasetId()).isEqualTo("sales");
        assertThat(record.value().tableId()).contains("orders");
        assertThat(record.raw()).isSameAs(raw);
    }

    @Test
    void testMissingRequiredFieldDegrades()
    {
        JsonObject raw = new JsonObject().put("table_id", "orders");

        HydratedRecord<DatasetGrant> record = HydrationRecords.parse(raw, DatasetGrant.class);

        assertThat(record.isValidated()).isFalse();
        assertThat(record.reason()).isNotNull();
        assertThat(record.raw()).isSameAs(raw);
        assertThatThrownBy(record::value).isInstanceOf(IllegalStateException.class);
        assertThat(record.resolve(DatasetGrant::fromRaw)).isEmpty();
    }

    @Test
    void testNullRecordDegrades()
    {
        HydratedRecord<RolePermission> record = HydrationRecords.parse(null, RolePermission.class);

        assertThat(record.isValidated()).isFalse();
        assertThat(record.raw().isEmpty()).isTrue();
    }

    @Test
    void testScalarReads()
    {
        JsonObject raw = new JsonObject().put("s", "text")
                                         .put("n", 42)
                                         .put("b", true)
                                         .put("empty", "")
                                         .put("o", new JsonObject())
                                         .put("a", new JsonArray());

        assertThat(HydrationRecords.scalar(raw, "s")).contains("text");
        assertThat(HydrationRecords.scalar(raw, "n")).contains("42");
        assertThat(HydrationRecords.scalar(raw, "b")).contains("true");
        assertThat(HydrationRecords.scalar(raw, "empty")).isEmpty();
        assertThat(HydrationRecords.scalar(raw, "o")).isEmpty();
        assertThat(HydrationRecords.scalar(raw, "missing")).isEmpty();

        assertThat(HydrationRecords.isNonScalar(raw, "o")).isTrue();
        assertThat(HydrationRecords.isNonScalar(raw, "a")).isTrue();
        assertThat(HydrationRecords.isNonScalar(raw, "s")).isFalse();
        assertThat(HydrationRecords.isNonScalar(raw, "missing")).isFalse();
    }

    @Test
    void testDatasetGrantTableIdHandling()
    {
        assertThat(new DatasetGrant("sales", null).tableId()).isEmpty();
        assertThat(new DatasetGrant("sales", "").tableId()).isEmpty();
        assertThatThrownBy(() -> new DatasetGrant("sales", " ` ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DatasetGrant("  ", "orders")).isInstanceOf(IllegalArgumentException.class);

        // an unreadable table_id must not widen into a whole-dataset grant
        assertThat(DatasetGrant.fromRaw(new JsonObject().put("dataset_id", "sales")
                                                        .put("table_id", new JsonArray().add("orders"))))
        .isEmpty();
        assertThat(DatasetGrant.fromRaw(new JsonObject().put("dataset_id", 7).put("table_id", 12)))
        .hasValueSatisfying(grant -> {
            assertThat(grant.datasetId()).isEqualTo("7");
            assertThat(grant.tableId()).contains("12");
        });
    }

    @Test
    void testRoleAssignmentFallbacks()
    {
        assertThat(RoleAssignment.fromRaw(new JsonObject())).isEmpty();
        assertThat(RoleAssignment.fromRaw(new JsonObject().put("role_id", "r1")))
        .hasValueSatisfying(role -> {
            assertThat(role.key()).isEqualTo("r1");
            assertThat(role.roleName()).isEqualTo("r1");
        });
        assertThat(new RoleAssignment("", "reader").key()).isEqualTo("reader");
    }

    @Test
    void testUserProfileFallback()
    {
        JsonObject raw = new JsonObject().put("metadata", new JsonObject().put("team", "finance"));

        HydratedRecord<UserProfile> record = HydrationRecords.parse(raw, UserProfile.class);

        assertThat(record.isValidated()).isFalse();
        assertThat(record.resolve(UserProfile::fromRaw))
        .hasValueSatisfying(profile -> assertThat(profile.metadata()).containsEntry("team", "finance"));
    }
}
