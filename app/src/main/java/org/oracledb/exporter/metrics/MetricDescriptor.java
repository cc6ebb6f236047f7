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
package org.oracledb.exporter.metrics;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Static schema of a metric family: name, help text, ordered label keys and kind.
 *
 * <p>Every {@link MetricSample} created through {@link #sample(double, String...)} carries
 * exactly the declared label keys, in the declared order.
 *
 * @param name      Fully qualified family name (see {@link org.oracledb.exporter.common.MetricNameBuilder})
 * @param help      Help text
 * @param labelKeys Ordered label keys (may be empty)
 * @param type      Value kind
 */
public record MetricDescriptor(String name, String help, List<String> labelKeys, MetricType type) {

    public MetricDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        help = help != null ? help : "";
        labelKeys = List.copyOf(labelKeys);
    }

    public static MetricDescriptor gauge(String name, String help, String... labelKeys) {
        return new MetricDescriptor(name, help, Arrays.asList(labelKeys), MetricType.GAUGE);
    }

    public static MetricDescriptor counter(String name, String help, String... labelKeys) {
        return new MetricDescriptor(name, help, Arrays.asList(labelKeys), MetricType.COUNTER);
    }

    /**
     * Create a sample of this family.
     *
     * @param value       Sample value
     * @param labelValues Label values, one per declared key and in the same order
     * @return New sample
     * @throws IllegalArgumentException If the number of label values does not match the label keys
     */
    public MetricSample sample(double value, String... labelValues) {
        return new MetricSample(this, List.of(labelValues), value);
    }
}
