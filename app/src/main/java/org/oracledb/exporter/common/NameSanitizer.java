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

import java.util.Locale;

/**
 * Turns the display names Oracle returns (e.g. {@code "parse count (total)"}) into
 * tokens usable inside metric names: spaces become underscores, parentheses and
 * forward slashes are dropped and the result is lowercased.
 *
 * <p>Applying the transformation twice yields the same result as applying it once.
 */
@UtilityClass
public final class NameSanitizer {

    /**
     * Sanitize a database-supplied name.
     *
     * @param name Raw name (may be null)
     * @return Sanitized name, or an empty string for null input
     */
    public static String sanitize(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            switch (c) {
                case ' ' -> sb.append('_');
                case '(', ')', '/' -> {
                    // dropped
                }
                default -> sb.append(c);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
