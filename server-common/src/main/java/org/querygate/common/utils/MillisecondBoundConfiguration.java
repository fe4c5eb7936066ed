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

package org.querygate.common.utils;

import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * A configured duration with millisecond resolution, used for cache expiries.
 */
public class MillisecondBoundConfiguration extends DurationSpec
{
    public static final MillisecondBoundConfiguration ZERO = new MillisecondBoundConfiguration(0, TimeUnit.MILLISECONDS);

    @JsonCreator
    public MillisecondBoundConfiguration(String value)
    {
        super(value);
    }

    public MillisecondBoundConfiguration(long quantity, TimeUnit unit)
    {
        super(quantity, unit);
    }

    public static MillisecondBoundConfiguration parse(String value)
    {
        return new MillisecondBoundConfiguration(value);
    }

    @Override
    public TimeUnit minimumUnit()
    {
        return TimeUnit.MILLISECONDS;
    }
}
