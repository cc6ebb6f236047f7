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
package org.oracledb.exporter.db;

import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.AgroalConnectionFactoryConfiguration;
import io.agroal.api.configuration.AgroalConnectionPoolConfiguration;
import io.agroal.api.configuration.AgroalDataSourceConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DatabaseServiceTest {

    private DatabaseService databaseService;

    @Mock
    private AgroalDataSource dataSource;

    @Mock
    private AgroalDataSourceConfiguration dataSourceConfig;

    @Mock
    private AgroalConnectionPoolConfiguration poolConfig;

    @Mock
    private AgroalConnectionFactoryConfiguration factoryConfig;

    @Mock
    private Connection mockConnection;

    @Mock
    private Statement mockStatement;

    @Mock
    private ResultSet mockResultSet;

    @BeforeEach
    void setUp() {
        databaseService = new DatabaseService(dataSource);
    }

    @Test
    void testConstructor_NullDataSource_ThrowsException() {
        assertThrows(NullPointerException.class, () -> new DatabaseService(null));
    }

    @Test
    void testGetUrl_ReturnsConfiguredUrl() {
        // Setup
        when(dataSource.getConfiguration()).thenReturn(dataSourceConfig);
        when(dataSourceConfig.connectionPoolConfiguration()).thenReturn(poolConfig);
        when(poolConfig.connectionFactoryConfiguration()).thenReturn(factoryConfig);
        when(factoryConfig.jdbcUrl()).thenReturn("jdbc:oracle:thin:@//db:1521/ORCLPDB1");

        // Execute & Verify
        assertEquals("jdbc:oracle:thin:@//db:1521/ORCLPDB1", databaseService.getUrl());
    }

    @Test
    void testGetUrl_Exception_ReturnsUnavailable() {
        // Setup
        when(dataSource.getConfiguration()).thenThrow(new RuntimeException("Config error"));

        // Execute & Verify
        assertEquals("unavailable", databaseService.getUrl());
    }

    @Test
    void testGetPooledConnection_ThrowsSQLException() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenThrow(new SQLException("ORA-12541: TNS:no listener"));

        // Execute & Verify
        assertThrows(SQLException.class, () -> databaseService.getPooledConnection());
    }

    @Test
    void testTestConnection_Success() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenReturn(mockConnection);
        when(mockConnection.createStatement()).thenReturn(mockStatement);
        when(mockStatement.executeQuery(DatabaseService.PING_SQL)).thenReturn(mockResultSet);
        when(mockResultSet.next()).thenReturn(true);
        when(mockResultSet.getInt(1)).thenReturn(1);

        // Execute
        boolean result = databaseService.testConnection();

        // Verify
        assertTrue(result);
        verify(mockConnection).close();
    }

    @Test
    void testTestConnection_ConnectionFails_ReturnsFalse() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection failed"));

        // Execute & Verify
        assertFalse(databaseService.testConnection());
    }

    @Test
    void testTestConnection_NoRows_ReturnsFalse() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenReturn(mockConnection);
        when(mockConnection.createStatement()).thenReturn(mockStatement);
        when(mockStatement.executeQuery(DatabaseService.PING_SQL)).thenReturn(mockResultSet);
        when(mockResultSet.next()).thenReturn(false);

        // Execute & Verify
        assertFalse(databaseService.testConnection());
    }

    @Test
    void testTestConnection_UnexpectedException_ReturnsFalse() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenThrow(new IllegalStateException("pool closed"));

        // Execute & Verify
        assertFalse(databaseService.testConnection());
    }

    @Test
    void testDetectServerBanner_Success() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenReturn(mockConnection);
        when(mockConnection.createStatement()).thenReturn(mockStatement);
        when(mockStatement.executeQuery(DatabaseService.BANNER_SQL)).thenReturn(mockResultSet);
        when(mockResultSet.next()).thenReturn(true);
        when(mockResultSet.getString(1)).thenReturn("Oracle Database 19c Enterprise Edition Release 19.0.0.0.0 - Production");

        // Execute
        Optional<String> banner = databaseService.detectServerBanner();

        // Verify
        assertTrue(banner.isPresent());
        assertTrue(banner.get().startsWith("Oracle Database 19c"));
    }

    @Test
    void testDetectServerBanner_QueryFails_ReturnsEmpty() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenReturn(mockConnection);
        when(mockConnection.createStatement()).thenReturn(mockStatement);
        when(mockStatement.executeQuery(DatabaseService.BANNER_SQL)).thenThrow(new SQLException("ORA-00942"));

        // Execute & Verify
        assertTrue(databaseService.detectServerBanner().isEmpty());
        verify(mockConnection).close();
    }
}
