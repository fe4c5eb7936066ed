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

package org.querygate.db;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.datastax.driver.core.BoundStatement;
import com.datastax.driver.core.PreparedStatement;
import com.datastax.driver.core.ResultSet;
import com.datastax.driver.core.Row;
import org.mockito.Answers;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Driver mocks shared by the accessor tests
 */
final class CqlMocks
{
    private CqlMocks()
    {
    }

    /**
     * A prepared statement that binds to {@code bound} and records the values of every bind
     */
    static class RecordingStatement
    {
        final BoundStatement bound = mock(BoundStatement.class);
        final List<List<Object>> binds = new ArrayList<>();
        final PreparedStatement prepared = mock(PreparedStatement.class, invocation -> {
            if ("bind".equals(invocation.getMethod().getName()))
            {
                binds.add(Arrays.asList(invocation.getArguments()));
                return bound;
            }
            return Answers.RETURNS_DEFAULTS.answer(invocation);
        });
    }

    static ResultSet resultSet(Row... rows)
    {
        List<Row> list = Arrays.asList(rows);
        ResultSet resultSet = mock(ResultSet.class);
        when(resultSet.iterator()).thenAnswer(invocation -> list.iterator());
        when(resultSet.one()).thenReturn(rows.length == 0 ? null : rows[0]);
        return resultSet;
    }
}
