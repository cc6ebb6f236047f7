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
package org.oracledb.exporter.collector.cache;

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
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LibraryCacheHitCollectorTest {

    @Mock
    private CollectorsConfig config;

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Mock
    private ResultSet rs;

    @InjectMocks
    private LibraryCacheHitCollector collector;

    @BeforeEach
    void setUp() throws SQLException {
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(anyString())).thenReturn(rs);
        when(rs.next()).thenReturn(true, false);
        when(rs.wasNull()).thenReturn(false);
    }

    @Test
    void testCollect_PinHitRatio() throws SQLException {
        when(rs.getDouble("pin_hits")).thenReturn(950.0);
        when(rs.getDouble("pins")).thenReturn(1000.0);

        List<MetricSample> samples = new ArrayList<>();
        collector.collect(connection, samples::add);

        assertEquals(1, samples.size());
        assertEquals(LibraryCacheHitCollector.SGA_HITS, samples.get(0).descriptor());
        assertEquals("oracledb_sga_hits", samples.get(0).name());
        assertEquals(0.95, samples.get(0).value(), 1e-9);
    }

    @Test
    void testCollect_NoPinsFails() throws SQLException {
        when(rs.getDouble("pin_hits")).thenReturn(0.0);
        when(rs.getDouble("pins")).thenReturn(0.0);

        List<MetricSample> samples = new ArrayList<>();
        assertThrows(SQLDataException.class, () -> collector.collect(connection, samples::add));
        assertTrue(samples.isEmpty());
    }
}
