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
 * Collector for active sessions blocked by another session.
 *
 * <p>The value is the time in seconds since the blocked session's current call started.
 */
@ApplicationScoped
public class TransactionWaitTimeCollector extends AbstractQueryCollector {
    private static final String SQL = """
            SELECT sid, event, blocking_session, last_call_et
            FROM v$session
            WHERE status = 'ACTIVE'
              AND blocking_session IS NOT NULL""";

    static final MetricDescriptor TRANSACTION_WAIT_TIME = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_TRANSACTION, "wait_time"),
            "transaction wait time",
            "sid", "event", "blocking_session");

    @Override
    public String getName() {
        return "transaction";
    }

    @Override
    public boolean isEnabled() {
        return config.transactionEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        String sid = ValueUtils.getOrUnknown(rs.getString("sid"));
        String event = ValueUtils.getOrUnknown(rs.getString("event"));
        String blockingSession = ValueUtils.getOrUnknown(rs.getString("blocking_session"));
        double elapsed = ValueUtils.getRequiredDouble(rs, "last_call_et");
        sink.accept(TRANSACTION_WAIT_TIME.sample(elapsed, sid, event, blockingSession));
    }
}
