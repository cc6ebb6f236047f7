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
import org.oracledb.exporter.collector.AbstractQueryCollector;
import org.oracledb.exporter.common.Constants;
import org.oracledb.exporter.common.MetricNameBuilder;
import org.oracledb.exporter.common.ValueUtils;
import org.oracledb.exporter.metrics.MetricDescriptor;
import org.oracledb.exporter.metrics.MetricSink;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Collector for how long active user sessions have been logged on and how long
 * their current call has been running, both in seconds.
 */
@ApplicationScoped
public class SessionTimeCollector extends AbstractQueryCollector {
    private static final String SQL = """
            SELECT username,
              terminal,
              program,
              ROUND((SYSDATE - logon_time) * (24 * 60 * 60), 1) AS seconds_logged_on,
              ROUND(last_call_et, 1) AS seconds_for_current_sql
            FROM v$session
            WHERE status = 'ACTIVE'
              AND username IS NOT NULL
            ORDER BY seconds_logged_on DESC""";

    static final MetricDescriptor LOGGED_TIME = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_SESSIONS, "logged_time"),
            "logged time unit second",
            "username", "terminal", "program");
    static final MetricDescriptor SQL_TIME = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_SESSIONS, "sql_time"),
            "current sql time unit second",
            "username", "terminal", "program");

    @Override
    public String getName() {
        return "session_user";
    }

    @Override
    public boolean isEnabled() {
        return config.sessionTimeEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        String username = ValueUtils.getOrUnknown(rs.getString("username"));
        String terminal = ValueUtils.getOrUnknown(rs.getString("terminal"));
        String program = ValueUtils.getOrUnknown(rs.getString("program"));
        double logged = ValueUtils.getRequiredDouble(rs, "seconds_logged_on");
        double currentSql = ValueUtils.getRequiredDouble(rs, "seconds_for_current_sql");

        sink.accept(LOGGED_TIME.sample(logged, username, terminal, program));
        sink.accept(SQL_TIME.sample(currentSql, username, terminal, program));
    }
}
