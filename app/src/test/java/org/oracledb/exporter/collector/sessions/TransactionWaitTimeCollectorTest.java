/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.oracledb.exporter.collector.sessions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.oracledb.exporter.config.CollectorsConfig;
import org.oracledb.exporter.metrics.MetricSample;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionWaitTimeCollectorTest {

    @Mock
    private CollectorsConfig config;

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Mock
    private ResultSet rs;

    @InjectMocks
    private TransactionWaitTimeCollector collector;

    @BeforeEach
    void setUp() throws SQLException {
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(anyString())).thenReturn(rs);
        when(rs.next()).thenReturn(true, false);
        when(rs.wasNull()).thenReturn(false);
    }

    @Test
    void testCollect_BlockedTransaction() throws SQLException {
        when(rs.getString("sid")).thenReturn("42");
        when(rs.getString("event")).thenReturn("enq: TX - row lock contention");
        when(rs.getString("blocking_session")).thenReturn("17");
        when(rs.getDouble("last_call_et")).thenReturn(30.0);

        List<MetricSample> samples = new ArrayList<>();
        collector.collect(connection, samples::add);

        assertEquals(1, samples.size());
        assertEquals(TransactionWaitTimeCollector.TRANSACTION_WAIT_TIME, samples.get(0).descriptor());
        assertEquals("oracledb_transaction_wait_time", samples.get(0).name());
        assertEquals(List.of("42", "enq: TX - row lock contention", "17"), samples.get(0).labelValues());
        assertEquals(30.0, samples.get(0).value());
    }
}
