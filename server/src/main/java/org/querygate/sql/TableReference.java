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

package org.querygate.sql;

import java.util.Objects;
import java.util.Optional;

import org.jetbrains.annotations.Nullable;

/**
 * A table referenced by a query, as far as a lexical scan could resolve it. Present parts are normalized.
 */
public final class TableReference
{
    private final String project;
    private final String dataset;
    private final String table;

    public TableReference(@Nullable String project, @Nullable String dataset, @Nullable String table)
    {
        this.project = emptyToNull(project);
        this.dataset = emptyToNull(dataset);
        this.table = emptyToNull(table);
    }

    public static TableReference of(String project, String dataset, String table)
    {
        return new TableReference(project, dataset, table);
    }

    /**
     * @return a reference naming only a table, whose dataset is unknown
     */
    public static TableReference unqualified(String table)
    {
        return new TableReference(null, null, table);
    }

    public Optional<String> project()
    {
        return Optional.ofNullable(project);
    }

    public Optional<String> dataset()
    {
        return Optional.ofNullable(dataset);
    }

    public Optional<String> table()
    {
        return Optional.ofNullable(table);
    }

    /**
     * @return {@code true} when project, dataset and table are all known
     */
    public boolean isFullyQualified()
    {
        return project != null && dataset != null && table != null;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (o == null || getClass() != o.getClass())
        {
            return false;
        }
        TableReference that = (TableReference) o;
        return Objects.equals(project, that.project)
               && Objects.equals(dataset, that.dataset)
               && Objects.equals(table, that.table);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(project, dataset, table);
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder();
        if (project != null)
        {
            sb.append(project).append('.');
        }
        if (dataset != null)
        {
            sb.append(dataset).append('.');
        }
        return sb.append(table == null ? "?" : table).toString();
    }

    private static String emptyToNull(String value)
    {
        return value == null || value.isEmpty() ? null : value;
    }
}
