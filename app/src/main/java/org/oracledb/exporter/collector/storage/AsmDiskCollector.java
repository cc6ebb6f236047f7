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
 * Collector for the used fraction of each ASM disk group, {@code 1 - free_mb / total_mb}.
 *
 * <p>Label layout is kept compatible with existing dashboards: {@code type} carries the
 * sanitized disk group name and {@code group_name} the disk group number.
 * Instances without ASM return no rows and export nothing.
 */
@ApplicationScoped
public class AsmDiskCollector extends AbstractQueryCollector {
    private static final String SQL = """
            SELECT group_number, name, free_mb, total_mb
            FROM v$asm_diskgroup""";

    static final MetricDescriptor ASM_DISK_USAGE = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_ASM, "disk_usage"),
            "asm disk usage",
            "type", "group_name");

    @Override
    public String getName() {
        return "asm_disk";
    }

    @Override
    public boolean isEnabled() {
        return config.asmDiskEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        String groupNumber = ValueUtils.getOrUnknown(rs.getString("group_number"));
        String name = NameSanitizer.sanitize(ValueUtils.getOrUnknown(rs.getString("name")));
        double freeMb = ValueUtils.getRequiredDouble(rs, "free_mb");
        double totalMb = ValueUtils.getRequiredDouble(rs, "total_mb");

        double used = 1 - ValueUtils.ratio(freeMb, totalMb, "usage of ASM disk group " + name);
        sink.accept(ASM_DISK_USAGE.sample(used, name, groupNumber));
    }
}
