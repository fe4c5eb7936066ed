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
 * A configured duration with second resolution. Used for the query cache TTL and the sweep interval, where
 * sub-second precision has no meaning.
 */
public class SecondBoundConfiguration extends DurationSpec
{
    @JsonCreator
    public SecondBoundConfiguration(String value)
    {
        super(value);
    }

    public SecondBoundConfiguration(long quantity, TimeUnit unit)
    {
        super(quantity, unit);
    }

    public static SecondBoundConfiguration parse(String value)
    {
        return new SecondBoundConfiguration(value);
    }

    @Override
    public TimeUnit minimumUnit()
    {
        return TimeUnit.SECONDS;
    }
}
