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
package org.oracledb.exporter.collector.database;

import jakarta.enterprise.context.ApplicationScoped;
import org.oracledb.exporter.collector.AbstractQueryCollector;
import org.oracledb.exporter.common.Constants;
import org.oracledb.exporter.common.MetricNameBuilder;
import org.oracledb.exporter.metrics.MetricDescriptor;
import org.oracledb.exporter.metrics.MetricSink;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Collector exporting whether force logging is enabled (1) or not (0).
 */
@ApplicationScoped
public class ForceLogCollector extends AbstractQueryCollector {
    private static final String SQL = "SELECT force_logging FROM v$database";

    static final MetricDescriptor FORCE_LOG = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_FORCE, "log"),
            "force log");

    @Override
    public String getName() {
        return "force_log";
    }

    @Override
    public boolean isEnabled() {
        return config.forceLogEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        boolean forced = Constants.FORCE_LOGGING_YES.equals(rs.getString("force_logging"));
        sink.accept(FORCE_LOG.sample(forced ? 1.0 : 0.0));
    }
}
