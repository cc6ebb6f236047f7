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
package org.oracledb.exporter.common;

import lombok.experimental.UtilityClass;

/**
 * Builds metric names of the form {@code oracledb_<subsystem>_<name>}.
 *
 * <p>Families whose name comes from the database itself (statistic names, wait classes)
 * go through {@link #fromDatabaseName(String, String)} so the Oracle display name is
 * sanitized first.
 */
@UtilityClass
public final class MetricNameBuilder {
    /**
     * Build a fully qualified metric name
     *
     * @param subsystem The subsystem (e.g., "sessions", "tablespace", "exporter"), may be empty
     * @param name      The metric name
     * @return The fully qualified metric name
     */
    public static String build(String subsystem, String name) {
        if (subsystem == null || subsystem.isEmpty()) {
            return build(name);
        }
        return Constants.NAMESPACE + "_" + subsystem + "_" + name;
    }

    /**
     * Build a metric name without a subsystem
     *
     * @param name The metric name
     * @return The metric name with namespace
     */
    public static String build(String name) {
        return Constants.NAMESPACE + "_" + name;
    }

    /**
     * Build a metric name from a name reported by Oracle, e.g. {@code "parse count (total)"}
     * under {@code activity} becomes {@code oracledb_activity_parse_count_total}.
     *
     * @param subsystem    The subsystem
     * @param databaseName Statistic or wait class name as returned by the database
     * @return The fully qualified metric name
     * @throws IllegalArgumentException If the name is blank or sanitizes to nothing
     */
    public static String fromDatabaseName(String subsystem, String databaseName) {
        String sanitized = NameSanitizer.sanitize(databaseName);
        if (sanitized.isBlank()) {
            throw new IllegalArgumentException("Cannot derive a metric name from '" + databaseName + "'");
        }
        return build(subsystem, sanitized);
    }
}
