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

import java.util.Locale;

import com.google.common.base.CharMatcher;
import org.jetbrains.annotations.Nullable;

/**
 * Canonicalization of dataset and table names. Every grant and every reference extracted from a query is
 * compared in this form.
 */
public final class Identifiers
{
    /**
     * Grant value meaning "every dataset" or "every table in the dataset"
     */
    public static final String WILDCARD = "*";

    private static final CharMatcher SURROUNDING = CharMatcher.anyOf("`\"'").or(CharMatcher.whitespace());

    private Identifiers()
    {
    }

    /**
     * Strips surrounding whitespace and quote characters (back-tick, double and single quote) and lower-cases
     * the remainder. Total and idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.
     *
     * @param identifier a dataset or table name as written by a user or stored in a grant
     * @return the normalized identifier, or the empty string for {@code null}
     */
    public static String normalize(@Nullable String identifier)
    {
        if (identifier == null || identifier.isEmpty())
        {
            return "";
        }
        return SURROUNDING.trimFrom(identifier).toLowerCase(Locale.ROOT);
    }
}
