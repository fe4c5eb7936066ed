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
 * Decides what happens to a table reference for which no dataset could be resolved, e.g. {@code FROM orders}.
 * Such a reference carries nothing to check against dataset grants.
 */
public enum UnqualifiedTablePolicy
{
    /**
     * Let the reference pass. The query engine has no default dataset, so an unqualified name cannot resolve to a
     * managed table; the lexical scanner also produces such references for CTE names, {@code UNNEST} and
     * {@code EXTRACT(... FROM column)}.
     */
    ALLOW,

    /**
     * Reject the query, naming the unqualified table
     */
    DENY
}
