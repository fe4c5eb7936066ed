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

package org.querygate.cache;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import static org.assertj.core.api.Assertions.assertThat;
import static org.quicktheories.QuickTheory.qt;
import static org.quicktheories.generators.SourceDSL.integers;
import static org.quicktheories.generators.SourceDSL.strings;

/**
 * Unit tests for {@link QueryCacheKeys}
 */
class QueryCacheKeysTest
{
    @Test
    void testWhitespaceAndCaseDoNotMatter()
    {
        assertThat(QueryCacheKeys.hash("SELECT *\n  FROM sales.orders\tLIMIT 10", null))
        .isEqualTo(QueryCacheKeys.hash("  select * from SALES.ORDERS limit 10 ", null));
    }

    @Test
    void testNormalizeSql()
    {
        assertThat(QueryCacheKeys.normalizeSql("  SELECT\t*\r\n FROM   t  ")).isEqualTo("select * from t");
    }

    @Test
    void testHashIsLowerCaseHexSha256()
    {
        assertThat(QueryCacheKeys.hash("select 1", null)).hasSize(64).matches("[0-9a-f]{64}");
    }

    @Test
    void testParameterOrderDoesNotMatter()
    {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("region", "emea");
        first.put("limit", 10);
        first.put("filter", new JsonObject().put("b", 2).put("a", 1));

        Map<String, Object> second = new LinkedHashMap<>();
        second.put("filter", new JsonObject().put("a", 1).put("b", 2));
        second.put("limit", 10);
        second.put("region", "emea");

        assertThat(QueryCacheKeys.hash("select 1", first)).isEqualTo(QueryCacheKeys.hash("select 1", second));
    }

    @Test
    void testNestedJsonAndPlainCollectionsAgree()
    {
        Map<String, Object> nested = new HashMap<>();
        nested.put("a", 1);
        Map<String, Object> plain = new HashMap<>();
        plain.put("filter", nested);
        plain.put("ids", Arrays.asList(3, 1, 2));

        JsonObject json = new JsonObject().put("ids", new JsonArray().add(3).add(1).add(2))
                                          .put("filter", new JsonObject().put("a", 1));

        assertThat(QueryCacheKeys.canonicalJson(plain)).isEqualTo("{\"filter\":{\"a\":1},\"ids\":[3,1,2]}");
        assertThat(QueryCacheKeys.canonicalJson(json.getMap())).isEqualTo(QueryCacheKeys.canonicalJson(plain));
    }

    @Test
    void testEmptyParametersEqualNoParameters()
    {
        assertThat(QueryCacheKeys.hash("select 1", new HashMap<>())).isEqualTo(QueryCacheKeys.hash("select 1", null));
    }

    @Test
    void testDifferentParameterValuesDiffer()
    {
        qt().forAll(integers().all(), integers().all())
            .assuming((a, b) -> !a.equals(b))
            .check((a, b) -> !QueryCacheKeys.hash("select 1", Map.of("limit", a))
                                            .equals(QueryCacheKeys.hash("select 1", Map.of("limit", b))));
    }

    @Test
    void testDifferentQueriesDiffer()
    {
        assertThat(QueryCacheKeys.hash("select * from sales.orders", null))
        .isNotEqualTo(QueryCacheKeys.hash("select * from sales.customers", null));
        assertThat(QueryCacheKeys.hash("select 1", Map.of("limit", "10")))
        .isNotEqualTo(QueryCacheKeys.hash("select 1", Map.of("limit", 10)));
    }

    @Test
    void testNormalizationIsIdempotent()
    {
        qt().forAll(strings().basicLatinAlphabet().ofLengthBetween(0, 40))
            .check(sql -> QueryCacheKeys.normalizeSql(QueryCacheKeys.normalizeSql(sql))
                                        .equals(QueryCacheKeys.normalizeSql(sql)));
    }
}
