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

import java.util.List;
import java.util.Objects;

/**
 * One observation of a metric family produced during a collection pass.
 *
 * @param descriptor  Family schema
 * @param labelValues Label values aligned with {@link MetricDescriptor#labelKeys()}
 * @param value       Observed value
 */
public record MetricSample(MetricDescriptor descriptor, List<String> labelValues, double value) {

    public MetricSample {
        Objects.requireNonNull(descriptor, "descriptor");
        labelValues = List.copyOf(labelValues);
        if (labelValues.size() != descriptor.labelKeys().size()) {
            throw new IllegalArgumentException("Metric " + descriptor.name() + " expects labels "
                    + descriptor.labelKeys() + " but got values " + labelValues);
        }
    }

    public String name() {
        return descriptor.name();
    }
}
