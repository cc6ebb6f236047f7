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
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.faulttolerance.Timeout;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Access point to the monitored Oracle database.
 */
@Slf4j
@ApplicationScoped
public class DatabaseService {
    public static final String PING_SQL = "SELECT 1 FROM DUAL";
    static final String BANNER_SQL = "SELECT banner FROM v$version WHERE ROWNUM = 1";

    private final AgroalDataSource dataSource;

    @Inject
    public DatabaseService(AgroalDataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /**
     * Get the JDBC URL for logging/debugging purposes.
     *
     * @return JDBC URL or "unavailable" if not accessible
     */
    public String getUrl() {
        try {
            return dataSource.getConfiguration().connectionPoolConfiguration()
                    .connectionFactoryConfiguration().jdbcUrl();
        } catch (Exception e) {
            log.debug("Could not retrieve JDBC URL", e);
            return "unavailable";
        }
    }

    /**
     * Borrow a connection from the pool. Callers must close it.
     */
    public Connection getPooledConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Test database connectivity. Used by the liveness health check.
     */
    @Timeout(value = 5, unit = ChronoUnit.SECONDS)
    public boolean testConnection() {
        try (Connection conn = getPooledConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(PING_SQL)) {
            return rs.next() && rs.getInt(1) == 1;
        } catch (SQLException e) {
            log.debug("Connection test failed", e);
            return false;
        } catch (Exception e) {
            log.warn("Unexpected error during connection test", e);
            return false;
        }
    }

    /**
     * Read the Oracle server banner (e.g. "Oracle Database 19c Enterprise Edition ...").
     *
     * @return Banner, or empty if the database could not be queried
     */
    public Optional<String> detectServerBanner() {
        try (Connection conn = getPooledConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(BANNER_SQL)) {
            if (rs.next()) {
                return Optional.ofNullable(rs.getString(1));
            }
            return Optional.empty();
        } catch (SQLException e) {
            log.warn("Failed to read Oracle server banner: {}", e.getMessage());
            log.debug("Banner detection error details:", e);
            return Optional.empty();
        }
    }
}
