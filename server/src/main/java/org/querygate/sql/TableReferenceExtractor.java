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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.querygate.common.utils.Identifiers;

/**
 * Best-effort lexical scanner for the tables a query reads. Every identifier run following {@code FROM} or
 * {@code JOIN} is taken as a table path and split on dots:
 * <ul>
 *   <li>{@code project.dataset.table} keeps all three parts</li>
 *   <li>{@code dataset.table} takes the default project, if any</li>
 *   <li>{@code table} leaves project and dataset unknown</li>
 *   <li>longer paths keep their trailing three parts</li>
 * </ul>
 *
 * <p>This is not a parser. Comments, string literals, CTE names, aliases and function syntax such as
 * {@code EXTRACT(YEAR FROM col)} are not understood, so the scanner can miss real references and report false
 * ones. Authorization treats its output as the complete list of tables the query reads.
 */
public class TableReferenceExtractor
{
    private static final Pattern TABLE_AFTER_KEYWORD
    = Pattern.compile("\\b(?:FROM|JOIN)\\s+([A-Za-z0-9_.\\-`]+)", Pattern.CASE_INSENSITIVE);

    /**
     * @param sql            the query text
     * @param defaultProject the project assigned to {@code dataset.table} references
     * @return references in first-seen order, without duplicates
     */
    public List<TableReference> extract(String sql, Optional<String> defaultProject)
    {
        if (sql == null || sql.isEmpty())
        {
            return List.of();
        }

        String project = defaultProject.map(Identifiers::normalize).filter(p -> !p.isEmpty()).orElse(null);
        Set<TableReference> references = new LinkedHashSet<>();
        Matcher matcher = TABLE_AFTER_KEYWORD.matcher(sql);
        while (matcher.find())
        {
            List<String> parts = split(matcher.group(1));
            int size = parts.size();
            if (size == 0)
            {
                continue;
            }
            if (size == 1)
            {
                references.add(TableReference.unqualified(parts.get(0)));
            }
            else if (size == 2)
            {
                references.add(TableReference.of(project, parts.get(0), parts.get(1)));
            }
            else
            {
                references.add(TableReference.of(parts.get(size - 3), parts.get(size - 2), parts.get(size - 1)));
            }
        }
        return new ArrayList<>(references);
    }

    private static List<String> split(String path)
    {
        return Arrays.stream(path.replace("`", "").split("\\."))
                     .map(Identifiers::normalize)
                     .filter(part -> !part.isEmpty())
                     .collect(Collectors.toList());
    }
}
