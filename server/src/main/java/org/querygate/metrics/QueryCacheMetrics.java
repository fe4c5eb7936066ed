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

package org.querygate.metrics;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;

/**
 * Tracks lookups and writes of the query cache
 */
public class QueryCacheMetrics
{
    public static final String DOMAIN = "querygate.QueryCache";

    public final Meter hits;
    public final Meter misses;
    public final Meter stored;
    /**
     * Results refused because they were empty or too large
     */
    public final Meter rejected;
    public final Meter storeFailures;
    public final Meter invalidatedEntries;
    public final Meter expiredEntries;

    public QueryCacheMetrics(MetricRegistry metricRegistry)
    {
        hits = metricRegistry.meter(name("Hits"));
        misses = metricRegistry.meter(name("Misses"));
        stored = metricRegistry.meter(name("Stored"));
        rejected = metricRegistry.meter(name("Rejected"));
        storeFailures = metricRegistry.meter(name("StoreFailures"));
        invalidatedEntries = metricRegistry.meter(name("InvalidatedEntries"));
        expiredEntries = metricRegistry.meter(name("ExpiredEntries"));
    }

    private static String name(String metric)
    {
        return MetricRegistry.name(DOMAIN, metric);
    }
}
