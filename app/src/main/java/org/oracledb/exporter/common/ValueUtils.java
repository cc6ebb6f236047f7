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

import java.sql.ResultSet;
import java.sql.SQLDataException;
import java.sql.SQLException;

/**
 * Helpers for turning result set columns into metric values and labels.
 */
@UtilityClass
public final class ValueUtils {

    /**
     * Return the value itself, or {@code "unknown"} when it is null.
     */
    public static String getOrUnknown(String value) {
        return value != null ? value : Constants.UNKNOWN;
    }

    /**
     * Read a numeric column that must not be NULL.
     *
     * @param rs     Result set positioned on a row
     * @param column Column label
     * @return Column value
     * @throws SQLDataException If the column is NULL
     * @throws SQLException     If the column cannot be read
     */
    public static double getRequiredDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        if (rs.wasNull()) {
            throw new SQLDataException("Column '" + column + "' is NULL");
        }
        return value;
    }

    /**
     * Divide two values, refusing to produce a non-finite result.
     *
     * @param numerator   Dividend
     * @param denominator Divisor
     * @param what        Description of the ratio, used in the error message
     * @return numerator / denominator
     * @throws SQLDataException If the denominator is zero or the result is not finite
     */
    public static double ratio(double numerator, double denominator, String what) throws SQLDataException {
        if (denominator == 0.0) {
            throw new SQLDataException("Division by zero while computing " + what);
        }
        double result = numerator / denominator;
        if (!Double.isFinite(result)) {
            throw new SQLDataException("Non-finite value " + result + " while computing " + what);
        }
        return result;
    }
}
