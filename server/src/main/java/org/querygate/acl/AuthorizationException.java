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

/**
 * Thrown when a principal may not run a query. The message names the denied resource: a missing permission, a
 * dataset, a {@code dataset.table} pair, or the principal itself when its credentials expired.
 */
public class AuthorizationException extends RuntimeException
{
    private final String resource;

    public AuthorizationException(String resource, String message)
    {
        super(message);
        this.resource = resource;
    }

    public static AuthorizationException missingPermission(String permission)
    {
        return new AuthorizationException(permission, "Missing required permission: " + permission);
    }

    public static AuthorizationException datasetDenied(String dataset)
    {
        return new AuthorizationException(dataset, "Access denied to dataset " + dataset);
    }

    public static AuthorizationException tableDenied(String dataset, String table)
    {
        String resource = dataset + "." + table;
        return new AuthorizationException(resource, "Access denied to table " + resource);
    }

    public static AuthorizationException unqualifiedTableDenied(String table)
    {
        return new AuthorizationException(table, "Access denied to unqualified table " + table);
    }

    public static AuthorizationException expired(String principalId)
    {
        return new AuthorizationException("principal:" + principalId,
                                          "Credentials for principal " + principalId + " have expired");
    }

    /**
     * @return the permission, dataset, {@code dataset.table} or principal that was denied
     */
    public String resource()
    {
        return resource;
    }
}
