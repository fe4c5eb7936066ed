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

package org.querygate.config;

import org.querygate.common.utils.SecondBoundConfiguration;

/**
 * Configuration for the query result cache
 */
public interface QueryCacheConfiguration
{
    /**
     * Backing stores for the query cache
     */
    enum StoreType
    {
        MEMORY,
        CASSANDRA
    }

    boolean enabled();

    /**
     * @return where cache entries and their table dependencies are kept
     */
    StoreType store();

    /**
     * @return how long a stored result may be served
     */
    SecondBoundConfiguration ttl();

    /**
     * @return results with more rows than this are not cached
     */
    int maxCachedRows();

    /**
     * @return how often expired entries are deleted
     */
    SecondBoundConfiguration sweepInterval();

    /**
     * @return the number of worker threads recording cache hits
     */
    int hitCountPoolSize();
}
