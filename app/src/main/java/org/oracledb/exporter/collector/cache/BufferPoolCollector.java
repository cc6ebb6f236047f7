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
import org.oracledb.exporter.common.NameSanitizer;
import org.oracledb.exporter.common.ValueUtils;
import org.oracledb.exporter.metrics.MetricDescriptor;
import org.oracledb.exporter.metrics.MetricSink;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Collector for the hit ratio of each buffer pool.
 *
 * <p>The ratio is {@code 1 - physical_reads / (db_block_gets + consistent_gets)}.
 * A pool without any logical reads fails the collector instead of exporting a
 * non-finite value.
 */
@ApplicationScoped
public class BufferPoolCollector extends AbstractQueryCollector {
    private static final String SQL = """
            SELECT name, physical_reads, db_block_gets, consistent_gets
            FROM v$buffer_pool_statistics""";

    static final MetricDescriptor BUFFER_HITS = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_BUFFER, "hits"),
            "buffer hits percentage.",
            "table");

    @Override
    public String getName() {
        return "buffer";
    }

    @Override
    public boolean isEnabled() {
        return config.bufferEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        String pool = NameSanitizer.sanitize(ValueUtils.getOrUnknown(rs.getString("name")));
        double physicalReads = ValueUtils.getRequiredDouble(rs, "physical_reads");
        double dbBlockGets = ValueUtils.getRequiredDouble(rs, "db_block_gets");
        double consistentGets = ValueUtils.getRequiredDouble(rs, "consistent_gets");

        double hitRatio = 1 - ValueUtils.ratio(physicalReads, dbBlockGets + consistentGets,
                "hit ratio of buffer pool " + pool);
        sink.accept(BUFFER_HITS.sample(hitRatio, pool));
    }
}
