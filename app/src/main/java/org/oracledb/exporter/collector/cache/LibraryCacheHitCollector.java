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
package org.oracledb.exporter.collector.cache;

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
 * Collector for the library cache hit ratio, {@code sum(pinhits) / sum(pins)}
 * over {@code v$librarycache}.
 */
@ApplicationScoped
public class LibraryCacheHitCollector extends AbstractQueryCollector {
    private static final String SQL = """
            SELECT SUM(pinhits) AS pin_hits, SUM(pins) AS pins
            FROM v$librarycache""";

    static final MetricDescriptor SGA_HITS = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_SGA, "hits"),
            "sga hits percentage.");

    @Override
    public String getName() {
        return "sga";
    }

    @Override
    public boolean isEnabled() {
        return config.sgaEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        double pinHits = ValueUtils.getRequiredDouble(rs, "pin_hits");
        double pins = ValueUtils.getRequiredDouble(rs, "pins");
        sink.accept(SGA_HITS.sample(ValueUtils.ratio(pinHits, pins, "library cache hit ratio")));
    }
}
