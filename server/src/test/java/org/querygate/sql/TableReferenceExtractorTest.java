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

package org.querygate.sql;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TableReferenceExtractor}
 */
class TableReferenceExtractorTest
{
    private final TableReferenceExtractor extractor = new TableReferenceExtractor();

    @Test
    void testFullyQualifiedReference()
    {
        assertThat(extractor.extract("SELECT * FROM proj.ds.tbl", Optional.empty()))
        .containsExactly(TableReference.of("proj", "ds", "tbl"));
    }

    @Test
    void testJoinKeepsSourceOrder()
    {
        assertThat(extractor.extract("SELECT x FROM a.b JOIN c.d ON b.id = d.id", Optional.of("p")))
        .containsExactly(TableReference.of("p", "a", "b"), TableReference.of("p", "c", "d"));
    }

    @Test
    void testTwoPartReferenceWithoutDefaultProject()
    {
        assertThat(extractor.extract("select * from sales.orders", Optional.empty()))
        .containsExactly(new TableReference(null, "sales", "orders"));
    }

    @Test
    void testDefaultProjectIsNormalized()
    {
        assertThat(extractor.extract("SELECT * FROM sales.orders", Optional.of(" Analytics-Prod ")))
        .containsExactly(TableReference.of("analytics-prod", "sales", "orders"));
    }

    @Test
    void testIdentifiersAreNormalized()
    {
        assertThat(extractor.extract("SELECT * FROM `Proj.Sales.Orders`", Optional.empty()))
        .containsExactly(TableReference.of("proj", "sales", "orders"));
        assertThat(extractor.extract("SELECT * FROM `proj`.`Sales`.`ORDERS`", Optional.empty()))
        .containsExactly(TableReference.of("proj", "sales", "orders"));
    }

    @Test
    void testUnqualifiedReference()
    {
        assertThat(extractor.extract("SELECT * FROM orders", Optional.of("p")))
        .containsExactly(TableReference.unqualified("orders"));
    }

    @Test
    void testLongerPathsKeepTrailingThreeParts()
    {
        assertThat(extractor.extract("SELECT * FROM region.proj.ds.tbl", Optional.empty()))
        .containsExactly(TableReference.of("proj", "ds", "tbl"));
    }

    @Test
    void testDuplicatesAreCollapsed()
    {
        String sql = "SELECT * FROM sales.orders o JOIN sales.orders p ON o.parent = p.id "
                     + "LEFT JOIN sales.customers c ON o.customer = c.id";

        assertThat(extractor.extract(sql, Optional.of("p")))
        .containsExactly(TableReference.of("p", "sales", "orders"), TableReference.of("p", "sales", "customers"));
    }

    @Test
    void testKeywordsAreCaseInsensitiveAcrossLines()
    {
        String sql = "select id\n  from\n    sales.orders\n  inner join\tsales.refunds using (id)";

        assertThat(extractor.extract(sql, Optional.of("p")))
        .containsExactly(TableReference.of("p", "sales", "orders"), TableReference.of("p", "sales", "refunds"));
    }

    @Test
    void testNoReferences()
    {
        assertThat(extractor.extract("SELECT 1", Optional.empty())).isEmpty();
        assertThat(extractor.extract("", Optional.empty())).isEmpty();
        assertThat(extractor.extract(null, Optional.empty())).isEmpty();
    }

    @Test
    void testKeywordInsideIdentifierIsIgnored()
    {
        assertThat(extractor.extract("SELECT fromage FROM dairy.cheese", Optional.of("p")))
        .containsExactly(TableReference.of("p", "dairy", "cheese"));
    }
}
