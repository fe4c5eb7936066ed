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

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.querygate.sql.TableReference;

/**
 * Checks the table references of a query against a {@link PermissionSnapshot}. Authorization is all-or-nothing:
 * the first reference that is not granted fails the whole query, and references checked before it confer nothing.
 */
public class TableAccessAuthorizer
{
    private static final Logger LOGGER = LoggerFactory.getLogger(TableAccessAuthorizer.class);

    private final UnqualifiedTablePolicy unqualifiedTablePolicy;

    public TableAccessAuthorizer(UnqualifiedTablePolicy unqualifiedTablePolicy)
    {
        this.unqualifiedTablePolicy = unqualifiedTablePolicy;
    }

    /**
     * @param snapshot           what the principal may see
     * @param references         the tables the query reads, in scan order; {@code null} is treated as empty
     * @param requiredPermission the permission needed to run the query at all
     * @throws AuthorizationException naming the first denied permission, dataset or table
     */
    public void authorize(PermissionSnapshot snapshot, List<TableReference> references, String requiredPermission)
    throws AuthorizationException
    {
        if (!snapshot.hasPermission(requiredPermission))
        {
            throw deny(snapshot, AuthorizationException.missingPermission(requiredPermission));
        }

        if (references == null)
        {
            return;
        }

        for (TableReference reference : references)
        {
            Optional<String> dataset = reference.dataset();
            Optional<String> table = reference.table();

            if (dataset.isPresent() && table.isPresent())
            {
                if (!snapshot.canAccessTable(dataset.get(), table.get()))
                {
                    throw deny(snapshot, AuthorizationException.tableDenied(dataset.get(), table.get()));
                }
            }
            else if (dataset.isPresent())
            {
                if (!snapshot.canAccessDataset(dataset.get()))
                {
                    throw deny(snapshot, AuthorizationException.datasetDenied(dataset.get()));
                }
            }
            else if (table.isPresent())
            {
                checkUnqualified(snapshot, table.get());
            }
        }
    }

    public UnqualifiedTablePolicy unqualifiedTablePolicy()
    {
        return unqualifiedTablePolicy;
    }

    private void checkUnqualified(PermissionSnapshot snapshot, String table)
    {
        if (unqualifiedTablePolicy == UnqualifiedTablePolicy.DENY)
        {
            throw deny(snapshot, AuthorizationException.unqualifiedTableDenied(table));
        }
        LOGGER.debug("Unqualified table reference passes unchecked principal={} table={}", snapshot.principalId(), table);
    }

    private static AuthorizationException deny(PermissionSnapshot snapshot, AuthorizationException exception)
    {
        LOGGER.info("Authorization denied principal={} resource={}", snapshot.principalId(), exception.resource());
        return exception;
    }
}
