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
package org.oracledb.exporter.collector.activity;

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
 * Collector for average active sessions per wait class from {@code v$waitclassmetric}.
 *
 * <p>The value is {@code time_waited / intsize_csec} rounded to three decimals.
 * The {@code Idle} class is excluded.
 */
@ApplicationScoped
public class WaitTimeCollector extends AbstractQueryCollector {
    private static final String SQL = """
            SELECT n.wait_class, m.time_waited, m.intsize_csec
            FROM v$waitclassmetric m, v$system_wait_class n
            WHERE m.wait_class_id = n.wait_class_id
              AND n.wait_class != 'Idle'""";

    @Override
    public String getName() {
        return "wait_time";
    }

    @Override
    public boolean isEnabled() {
        return config.waitTimeEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        String waitClass = ValueUtils.getOrUnknown(rs.getString("wait_class"));
        double timeWaited = ValueUtils.getRequiredDouble(rs, "time_waited");
        double intervalCsec = ValueUtils.getRequiredDouble(rs, "intsize_csec");
        double activeSessions = ValueUtils.ratio(timeWaited, intervalCsec, "wait time of class " + waitClass);

        MetricDescriptor descriptor = MetricDescriptor.counter(
                MetricNameBuilder.fromDatabaseName(Constants.SUBSYSTEM_WAIT_TIME, waitClass),
                "Generic counter metric from v$waitclassmetric view in Oracle.");
        sink.accept(descriptor.sample(Math.round(activeSessions * 1000.0) / 1000.0));
    }
}
