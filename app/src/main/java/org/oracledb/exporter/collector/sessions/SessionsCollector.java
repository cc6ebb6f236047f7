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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.oracledb.exporter.collector.Collector;
import org.oracledb.exporter.common.Constants;
import org.oracledb.exporter.common.MetricNameBuilder;
import org.oracledb.exporter.common.ValueUtils;
import org.oracledb.exporter.config.CollectorsConfig;
import org.oracledb.exporter.metrics.MetricDescriptor;
import org.oracledb.exporter.metrics.MetricSink;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Collector for session counts grouped by status and type.
 *
 * <p>Besides the per-group gauge it emits two aggregate gauges, the number of
 * {@code ACTIVE} and {@code INACTIVE} sessions. Those are kept for existing
 * dashboards and are deprecated in favour of summing {@code oracledb_sessions_activity}.
 * The aggregates are emitted after every row was read, so a failure mid-way
 * leaves them out of the pass.
 */
@Slf4j
@ApplicationScoped
public class SessionsCollector implements Collector {
    private static final String SQL = """
            SELECT status, type, COUNT(*) AS session_count
            FROM v$session
            GROUP BY status, type""";

    static final MetricDescriptor SESSIONS_ACTIVITY = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_SESSIONS, "activity"),
            "Gauge metric with count of sessions by status and type",
            "status", "type");
    static final MetricDescriptor SESSIONS_ACTIVE = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_SESSIONS, "active"),
            "Gauge metric with count of sessions marked ACTIVE. "
                    + "DEPRECATED: use sum(oracledb_sessions_activity{status='ACTIVE'}) instead.");
    static final MetricDescriptor SESSIONS_INACTIVE = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_SESSIONS, "inactive"),
            "Gauge metric with count of sessions marked INACTIVE. "
                    + "DEPRECATED: use sum(oracledb_sessions_activity{status='INACTIVE'}) instead.");

    @Inject
    CollectorsConfig config;

    @Override
    public String getName() {
        return "sessions";
    }

    @Override
    public boolean isEnabled() {
        return config.sessionsEnabled();
    }

    @Override
    public void collect(Connection connection, MetricSink sink) throws SQLException {
        Objects.requireNonNull(connection, "Connection must not be null");
        Objects.requireNonNull(sink, "Sink must not be null");

        double active = 0;
        double inactive = 0;
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(SQL)) {
            while (rs.next()) {
                String status = rs.getString("status");
                double count = emitGroup(rs, status, sink);
                if (Constants.SESSION_STATUS_ACTIVE.equals(status)) {
                    active += count;
                } else if (Constants.SESSION_STATUS_INACTIVE.equals(status)) {
                    inactive += count;
                }
            }
        }

        log.debug("Sessions: {} active, {} inactive", active, inactive);
        sink.accept(SESSIONS_ACTIVE.sample(active));
        sink.accept(SESSIONS_INACTIVE.sample(inactive));
    }

    private double emitGroup(ResultSet rs, String status, MetricSink sink) throws SQLException {
        String type = ValueUtils.getOrUnknown(rs.getString("type"));
        double count = ValueUtils.getRequiredDouble(rs, "session_count");
        sink.accept(SESSIONS_ACTIVITY.sample(count, ValueUtils.getOrUnknown(status), type));
        return count;
    }
}
