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
package org.oracledb.exporter.collector.storage;

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
 * Collector for data file availability: 1 when the file is {@code ONLINE}, 0 otherwise.
 * Files of the SYSTEM tablespace are skipped.
 */
@ApplicationScoped
public class DataFileCollector extends AbstractQueryCollector {
    private static final String SQL = """
            SELECT file# AS file_number, name, status
            FROM v$datafile
            WHERE status != 'SYSTEM'""";

    static final MetricDescriptor DATA_FILE_STATUS = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_DATA_FILE, "status"),
            "data file status",
            "file", "filename");

    @Override
    public String getName() {
        return "date_file";
    }

    @Override
    public boolean isEnabled() {
        return config.dataFileEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        String file = ValueUtils.getOrUnknown(rs.getString("file_number"));
        String filename = NameSanitizer.sanitize(ValueUtils.getOrUnknown(rs.getString("name")));
        boolean online = Constants.DATA_FILE_STATUS_ONLINE.equals(rs.getString("status"));
        sink.accept(DATA_FILE_STATUS.sample(online ? 1.0 : 0.0, file, filename));
    }
}
