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
package org.oracledb.exporter.collector;

import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.oracledb.exporter.config.CollectorsConfig;
import org.oracledb.exporter.metrics.MetricSink;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Abstract base class for collectors that map each row of a single query to samples.
 *
 * <p><b>Use this class when:</b>
 * <ul>
 *   <li>One SQL statement provides everything the collector exports</li>
 *   <li>Every row can be turned into samples on its own</li>
 * </ul>
 *
 * <p>Collectors that need to look at all rows before emitting (e.g. totals) implement
 * {@link Collector} directly.
 */
@Slf4j
public abstract class AbstractQueryCollector implements Collector {

    @Inject
    protected CollectorsConfig config;

    @Override
    public void collect(Connection connection, MetricSink sink) throws SQLException {
        Objects.requireNonNull(connection, "Connection must not be null");
        Objects.requireNonNull(sink, "Sink must not be null");

        int rows = 0;
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(getQuery())) {
            while (rs.next()) {
                emitRow(rs, sink);
                rows++;
            }
        }
        log.debug("Collector {} processed {} rows", getName(), rows);
    }

    /**
     * @return SQL statement executed once per pass
     */
    protected abstract String getQuery();

    /**
     * Turn the current row into samples.
     *
     * <p><b>DO NOT</b> advance the result set or catch {@link SQLException}; let it
     * propagate so the orchestrator can count the failure.
     *
     * @param rs   Result set positioned on the row
     * @param sink Destination for the samples
     * @throws SQLException If a column cannot be read or holds an unusable value
     */
    protected abstract void emitRow(ResultSet rs, MetricSink sink) throws SQLException;
}
