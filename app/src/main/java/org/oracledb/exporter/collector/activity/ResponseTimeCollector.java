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
import org.oracledb.exporter.common.NameSanitizer;
import org.oracledb.exporter.common.ValueUtils;
import org.oracledb.exporter.metrics.MetricDescriptor;
import org.oracledb.exporter.metrics.MetricSink;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Collector for the database CPU and wait time ratios of the longest
 * {@code v$sysmetric} interval.
 */
@ApplicationScoped
public class ResponseTimeCollector extends AbstractQueryCollector {
    private static final String SQL = """
            SELECT metric_name, value
            FROM sys.v_$sysmetric
            WHERE metric_name IN ('Database CPU Time Ratio', 'Database Wait Time Ratio')
              AND intsize_csec = (SELECT max(intsize_csec) FROM sys.v_$sysmetric)""";

    static final MetricDescriptor RESPONSE_TIME = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_RESPONSE, "time"),
            "database response time.",
            "type");

    @Override
    public String getName() {
        return "response_time";
    }

    @Override
    public boolean isEnabled() {
        return config.responseTimeEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        String metricName = NameSanitizer.sanitize(ValueUtils.getOrUnknown(rs.getString("metric_name")));
        double value = ValueUtils.getRequiredDouble(rs, "value");
        sink.accept(RESPONSE_TIME.sample(value, metricName));
    }
}
