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
 * Collector for cumulative activity statistics from {@code v$sysstat}.
 *
 * <p>Each statistic becomes its own counter family, named after the sanitized
 * statistic name, e.g. {@code parse count (total)} is exported as
 * {@code oracledb_activity_parse_count_total}.
 */
@ApplicationScoped
public class ActivityCollector extends AbstractQueryCollector {
    private static final String SQL = """
            SELECT name, value
            FROM v$sysstat
            WHERE name IN ('parse count (total)', 'execute count', 'user commits', 'user rollbacks')""";

    @Override
    public String getName() {
        return "activity";
    }

    @Override
    public boolean isEnabled() {
        return config.activityEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        String name = ValueUtils.getOrUnknown(rs.getString("name"));
        double value = ValueUtils.getRequiredDouble(rs, "value");
        MetricDescriptor descriptor = MetricDescriptor.counter(
                MetricNameBuilder.fromDatabaseName(Constants.SUBSYSTEM_ACTIVITY, name),
                "Generic counter metric from v$sysstat view in Oracle.");
        sink.accept(descriptor.sample(value));
    }
}
