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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.quicktheories.QuickTheory.qt;
import static org.quicktheories.generators.SourceDSL.strings;

/**
 * Unit tests for {@link Identifiers}
 */
class IdentifiersTest
{
    @Test
    void testNormalizeStripsQuotesAndWhitespace()
    {
        assertThat(Identifiers.normalize("` My-Dataset `")).isEqualTo("my-dataset");
        assertThat(Identifiers.normalize("  \"Sales\"  ")).isEqualTo("sales");
        assertThat(Identifiers.normalize("'orders'")).isEqualTo("orders");
        assertThat(Identifiers.normalize("\tORDERS\n")).isEqualTo("orders");
    }

    @ParameterizedTest
    @CsvSource(value = { "sales_2024,sales_2024", "Sales.Orders,sales.orders", "my`table,my`table" })
    void testInnerCharactersAreKept(String input, String expected)
    {
        assertThat(Identifiers.normalize(input)).isEqualTo(expected);
    }

    @Test
    void testNormalizeIsTotal()
    {
        assertThat(Identifiers.normalize(null)).isEmpty();
        assertThat(Identifiers.normalize("")).isEmpty();
        assertThat(Identifiers.normalize("   ")).isEmpty();
        assertThat(Identifiers.normalize("``")).isEmpty();
        assertThat(Identifiers.normalize(" '\"` ")).isEmpty();
    }

    @Test
    void testNormalizeIsIdempotent()
    {
        qt().forAll(strings().basicLatinAlphabet().ofLengthBetween(0, 40))
            .check(value -> {
                String once = Identifiers.normalize(value);
                return Identifiers.normalize(once).equals(once);
            });
    }

    @Test
    void testNormalizedValuesHaveNoSurroundingQuotes()
    {
        qt().forAll(strings().basicLatinAlphabet().ofLengthBetween(1, 40))
            .check(value -> {
                String normalized = Identifiers.normalize(value);
                return normalized.isEmpty()
                       || ("`\"' ".indexOf(normalized.charAt(0)) < 0
                           && "`\"' ".indexOf(normalized.charAt(normalized.length() - 1)) < 0);
            });
    }
}
