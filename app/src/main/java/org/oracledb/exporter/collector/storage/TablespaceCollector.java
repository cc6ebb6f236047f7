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
import lombok.extern.slf4j.Slf4j;
import org.oracledb.exporter.collector.AbstractQueryCollector;
import org.oracledb.exporter.common.Constants;
import org.oracledb.exporter.common.MetricNameBuilder;
import org.oracledb.exporter.common.ValueUtils;
import org.oracledb.exporter.metrics.MetricDescriptor;
import org.oracledb.exporter.metrics.MetricSink;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Collector for tablespace sizes.
 *
 * <p>Covers permanent tablespaces (data files and free extents) as well as
 * temporary ones (temp files and sort segment usage). For every tablespace it
 * exports:
 * <ul>
 *   <li>allocated bytes</li>
 *   <li>maximum bytes the files can grow to (allocated bytes when autoextend is off)</li>
 *   <li>free bytes</li>
 * </ul>
 * labelled by tablespace name and contents type ({@code PERMANENT}, {@code TEMPORARY}, {@code UNDO}).
 */
@Slf4j
@ApplicationScoped
public class TablespaceCollector extends AbstractQueryCollector {
    private static final String SQL = """
            SELECT
              z.name,
              dt.status,
              dt.contents,
              dt.extent_management,
              z.bytes,
              z.max_bytes,
              z.free_bytes
            FROM
            (
              SELECT
                x.name                   AS name,
                SUM(nvl(x.free_bytes,0)) AS free_bytes,
                SUM(x.bytes)             AS bytes,
                SUM(x.max_bytes)         AS max_bytes
              FROM
                (
                  SELECT
                    ddf.tablespace_name AS name,
                    ddf.status AS status,
                    ddf.bytes AS bytes,
                    sum(dfs.bytes) AS free_bytes,
                    CASE
                      WHEN ddf.maxbytes = 0 THEN ddf.bytes
                      ELSE ddf.maxbytes
                    END AS max_bytes
                  FROM
                    sys.dba_data_files ddf,
                    sys.dba_tablespaces dt,
                    sys.dba_free_space dfs
                  WHERE ddf.tablespace_name = dt.tablespace_name
                  AND ddf.file_id = dfs.file_id(+)
                  GROUP BY
                    ddf.tablespace_name,
                    ddf.file_name,
                    ddf.status,
                    ddf.bytes,
                    ddf.maxbytes
                ) x
              GROUP BY x.name
              UNION ALL
              SELECT
                y.name                   AS name,
                MAX(nvl(y.free_bytes,0)) AS free_bytes,
                SUM(y.bytes)             AS bytes,
                SUM(y.max_bytes)         AS max_bytes
              FROM
                (
                  SELECT
                    dtf.tablespace_name AS name,
                    dtf.status AS status,
                    dtf.bytes AS bytes,
                    (
                      SELECT
                        ((f.total_blocks - s.tot_used_blocks)*vp.value)
                      FROM
                        (SELECT tablespace_name, sum(used_blocks) tot_used_blocks FROM gv$sort_segment WHERE tablespace_name!='DUMMY' GROUP BY tablespace_name) s,
                        (SELECT tablespace_name, sum(blocks) total_blocks FROM dba_temp_files WHERE tablespace_name !='DUMMY' GROUP BY tablespace_name) f,
                        (SELECT value FROM v$parameter WHERE name = 'db_block_size') vp
                      WHERE f.tablespace_name=s.tablespace_name AND f.tablespace_name = dtf.tablespace_name
                    ) AS free_bytes,
                    CASE
                      WHEN dtf.maxbytes = 0 THEN dtf.bytes
                      ELSE dtf.maxbytes
                    END AS max_bytes
                  FROM
                    sys.dba_temp_files dtf
                ) y
              GROUP BY y.name
            ) z, sys.dba_tablespaces dt
            WHERE
              z.name = dt.tablespace_name""";

    static final MetricDescriptor TABLESPACE_BYTES = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_TABLESPACE, "bytes"),
            "Generic counter metric of tablespaces bytes in Oracle.",
            "tablespace", "type");
    static final MetricDescriptor TABLESPACE_MAX_BYTES = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_TABLESPACE, "max_bytes"),
            "Generic counter metric of tablespaces max bytes in Oracle.",
            "tablespace", "type");
    static final MetricDescriptor TABLESPACE_FREE = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_TABLESPACE, "free"),
            "Generic counter metric of tablespaces free bytes in Oracle.",
            "tablespace", "type");

    @Override
    public String getName() {
        return "tablespace";
    }

    @Override
    public boolean isEnabled() {
        return config.tablespaceEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        String tablespace = ValueUtils.getOrUnknown(rs.getString("name"));
        String contents = ValueUtils.getOrUnknown(rs.getString("contents"));
        double bytes = ValueUtils.getRequiredDouble(rs, "bytes");
        double maxBytes = ValueUtils.getRequiredDouble(rs, "max_bytes");
        double freeBytes = ValueUtils.getRequiredDouble(rs, "free_bytes");

        log.trace("Tablespace {} ({}): {} of {} bytes free", tablespace, contents, freeBytes, bytes);
        sink.accept(TABLESPACE_BYTES.sample(bytes, tablespace, contents));
        sink.accept(TABLESPACE_MAX_BYTES.sample(maxBytes, tablespace, contents));
        sink.accept(TABLESPACE_FREE.sample(freeBytes, tablespace, contents));
    }
}
