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

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vertx.core.json.JsonObject;
import org.querygate.common.utils.Identifiers;
import org.jetbrains.annotations.Nullable;

/**
 * Access to a dataset, or to one table of it when {@code table_id} is set. Names are normalized on construction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DatasetGrant
{
    private final String datasetId;
    private final String tableId;

    @JsonCreator
    public DatasetGrant(@JsonProperty(value = "dataset_id", required = true) String datasetId,
                        @JsonProperty("table_id") @Nullable String tableId)
    {
        String dataset = Identifiers.normalize(datasetId);
        if (dataset.isEmpty())
        {
            throw new IllegalArgumentException("dataset_id must not be empty");
        }
        this.datasetId = dataset;
        if (tableId == null || tableId.isEmpty())
        {
            this.tableId = null;
        }
        else
        {
            String table = Identifiers.normalize(tableId);
            // a blank table name must not turn into a whole-dataset grant
            if (table.isEmpty())
            {
                throw new IllegalArgumentException("table_id must not be blank");
            }
            this.tableId = table;
        }
    }

    /**
     * Recovers a grant from a record that failed validation. A record whose {@code table_id} is present but
     * unreadable is dropped rather than widened to the whole dataset.
     */
    public static Optional<DatasetGrant> fromRaw(JsonObject raw)
    {
        if (HydrationRecords.isNonScalar(raw, "table_id"))
        {
            return Optional.empty();
        }
        Optional<String> dataset = HydrationRecords.scalar(raw, "dataset_id");
        if (dataset.isEmpty())
        {
            return Optional.empty();
        }
        try
        {
            return Optional.of(new DatasetGrant(dataset.get(), HydrationRecords.scalar(raw, "table_id").orElse(null)));
        }
        catch (IllegalArgumentException e)
        {
            return Optional.empty();
        }
    }

    public String datasetId()
    {
        return datasetId;
    }

    public Optional<String> tableId()
    {
        return Optional.ofNullable(tableId);
    }
}
