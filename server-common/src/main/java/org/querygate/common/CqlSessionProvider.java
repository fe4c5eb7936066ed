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

package org.querygate.common;

import com.datastax.driver.core.Session;
import org.querygate.exceptions.StoreUnavailableException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Provides the CQL session used by the Cassandra-backed stores
 */
public interface CqlSessionProvider
{
    /**
     * Returns the current session, connecting first when no session exists yet.
     *
     * @return a connected session
     * @throws StoreUnavailableException when the cluster cannot be reached
     */
    @NotNull
    Session get() throws StoreUnavailableException;

    /**
     * @return the current session, or {@code null} when no connection was made yet
     */
    @Nullable
    Session getIfConnected();

    /**
     * Closes the session and its cluster, if any
     */
    void close();
}
