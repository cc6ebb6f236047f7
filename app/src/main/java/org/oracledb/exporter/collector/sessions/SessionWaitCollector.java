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
 * Collector for accumulated wait time per session, taken from the active session history.
 */
@ApplicationScoped
public class SessionWaitCollector extends AbstractQueryCollector {
    private static final String SQL = """
            SELECT
              s.sid,
              s.username,
              SUM(ash.wait_time + ash.time_waited) AS total_wait_time
            FROM v$active_session_history ash, v$session s
            WHERE ash.session_id = s.sid
            GROUP BY s.sid, s.username
            ORDER BY total_wait_time DESC""";

    static final MetricDescriptor SESSION_WAIT = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_SESSION, "wait_second"),
            "session wait second",
            "sid", "username");

    @Override
    public String getName() {
        return "session_wait";
    }

    @Override
    public boolean isEnabled() {
        return config.sessionWaitEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        String sid = ValueUtils.getOrUnknown(rs.getString("sid"));
        // background sessions have no username
        String username = ValueUtils.getOrUnknown(rs.getString("username"));
        double waited = ValueUtils.getRequiredDouble(rs, "total_wait_time");
        sink.accept(SESSION_WAIT.sample(waited, sid, username));
    }
}
