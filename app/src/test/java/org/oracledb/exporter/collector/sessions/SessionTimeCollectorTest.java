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
class SessionTimeCollectorTest {

    @Mock
    private CollectorsConfig config;

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Mock
    private ResultSet rs;

    @InjectMocks
    private SessionTimeCollector collector;

    @BeforeEach
    void setUp() throws SQLException {
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(anyString())).thenReturn(rs);
    }

    @Test
    void testCollect_LoggedAndSqlTimePerSession() throws SQLException {
        when(rs.next()).thenReturn(true, false);
        when(rs.getString("username")).thenReturn("APP");
        when(rs.getString("terminal")).thenReturn(null);
        when(rs.getString("program")).thenReturn("JDBC Thin Client");
        when(rs.getDouble("seconds_logged_on")).thenReturn(3600.5);
        when(rs.getDouble("seconds_for_current_sql")).thenReturn(12.0);
        when(rs.wasNull()).thenReturn(false);

        List<MetricSample> samples = new ArrayList<>();
        collector.collect(connection, samples::add);

        assertEquals(2, samples.size());
        assertEquals("oracledb_sessions_logged_time", samples.get(0).name());
        assertEquals(3600.5, samples.get(0).value());
        assertEquals(List.of("APP", "unknown", "JDBC Thin Client"), samples.get(0).labelValues());
        assertEquals("oracledb_sessions_sql_time", samples.get(1).name());
        assertEquals(12.0, samples.get(1).value());
    }
}
