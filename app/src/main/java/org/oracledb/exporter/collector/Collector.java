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

import org.oracledb.exporter.metrics.MetricSink;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Interface for metric collectors.
 *
 * <p>Each collector runs one query against Oracle and emits the resulting samples
 * into the sink supplied by the orchestrator. Collectors hold no state between
 * passes.
 *
 * <p><b>Implementations should usually extend</b> {@link AbstractQueryCollector}.
 *
 * <p>Passes never overlap, but consecutive passes may run on different threads.
 */
public interface Collector {

    /**
     * Get the name of this collector.
     *
     * <p>Used for logging and as the {@code collector} label of the scrape error counter.
     *
     * @return Collector name (unique and stable)
     */
    String getName();

    /**
     * Collect metrics from the database.
     *
     * <p>Samples emitted before a failure stay emitted.
     *
     * @param connection Database connection (never null, already open)
     * @param sink       Destination for the samples (never null)
     * @throws SQLException If the query, reading a row or a value check fails
     *                      (counted and logged by orchestrator)
     */
    void collect(Connection connection, MetricSink sink) throws SQLException;

    /**
     * Check if this collector is enabled.
     *
     * <p>Disabled collectors are not called by the orchestrator.
     *
     * @return {@code true} if enabled, {@code false} otherwise
     */
    boolean isEnabled();
}
