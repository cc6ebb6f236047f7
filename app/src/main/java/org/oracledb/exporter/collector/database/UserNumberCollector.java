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
import org.oracledb.exporter.common.ValueUtils;
import org.oracledb.exporter.metrics.MetricDescriptor;
import org.oracledb.exporter.metrics.MetricSink;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Collector for the number of database users in {@code dba_users}.
 */
@ApplicationScoped
public class UserNumberCollector extends AbstractQueryCollector {
    private static final String SQL = "SELECT count(1) AS user_count FROM dba_users";

    static final MetricDescriptor USER_NUMBER = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_USER, "number"),
            "user number.");

    @Override
    public String getName() {
        return "user_number";
    }

    @Override
    public boolean isEnabled() {
        return config.userNumberEnabled();
    }

    @Override
    protected String getQuery() {
        return SQL;
    }

    @Override
    protected void emitRow(ResultSet rs, MetricSink sink) throws SQLException {
        sink.accept(USER_NUMBER.sample(ValueUtils.getRequiredDouble(rs, "user_count")));
    }
}
