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

package org.querygate.cache;

import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;
import org.querygate.common.utils.Identifiers;
import org.querygate.sql.TableReference;
import org.jetbrains.annotations.Nullable;

/**
 * A table a cached result was computed from. An empty project means the project was not known when the result
 * was stored; such a dependency matches an invalidation for any project.
 */
public final class TableDependency
{
    private final String project;
    private final String dataset;
    private final String table;

    public TableDependency(@Nullable String project, String dataset, String table)
    {
        this.project = Identifiers.normalize(project);
        this.dataset = Identifiers.normalize(dataset);
        this.table = Identifiers.normalize(table);
        Preconditions.checkArgument(!this.dataset.isEmpty(), "dataset must not be empty");
        Preconditions.checkArgument(!this.table.isEmpty(), "table must not be empty");
    }

    /**
     * @param reference a reference extracted from a query
     * @return the dependency, or empty when the reference does not name both a dataset and a table
     */
    public static Optional<TableDependency> fromReference(TableReference reference)
    {
        if (reference.dataset().isEmpty() || reference.table().isEmpty())
        {
            return Optional.empty();
        }
        return Optional.of(new TableDependency(reference.project().orElse(null),
                                               reference.dataset().get(),
                                               reference.table().get()));
    }

    /**
     * Parses the {@code project.dataset.table} form produced by {@link #toString()}
     *
     * @param value the encoded dependency
     * @return the dependency
     * @throws IllegalArgumentException when the value does not have three parts
     */
    public static TableDependency parse(String value)
    {
        String[] parts = value.split("\\.", -1);
        Preconditions.checkArgument(parts.length == 3, "Invalid table dependency %s", value);
        return new TableDependency(parts[0], parts[1], parts[2]);
    }

    /**
     * @param project an invalidated project, normalized or not
     * @param dataset an invalidated dataset, normalized or not
     * @param table   an invalidated table, normalized or not
     * @return whether this dependency refers to that table
     */
    public boolean matches(@Nullable String project, String dataset, String table)
    {
        String normalizedProject = Identifiers.normalize(project);
        return this.dataset.equals(Identifiers.normalize(dataset))
               && this.table.equals(Identifiers.normalize(table))
               && (this.project.isEmpty() || normalizedProject.isEmpty() || this.project.equals(normalizedProject));
    }

    public String project()
    {
        return project;
    }

    public String dataset()
    {
        return dataset;
    }

    public String table()
    {
        return table;
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
        TableDependency that = (TableDependency) o;
        return project.equals(that.project) && dataset.equals(that.dataset) && table.equals(that.table);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(project, dataset, table);
    }

    @Override
    public String toString()
    {
        return project + '.' + dataset + '.' + table;
    }
}
