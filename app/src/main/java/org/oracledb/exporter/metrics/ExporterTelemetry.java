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

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * Operational metrics about the exporter process itself, published through Micrometer
 * on the Quarkus management endpoint ({@code /q/metrics}).
 */
@Slf4j
@ApplicationScoped
public class ExporterTelemetry {

    private static final String NAME_COLLECTOR_DURATION = "oracledb.exporter.collector.duration";
    private static final String NAME_UPTIME = "oracledb.exporter.uptime";

    private final Instant startTime = Instant.now();

    private final MeterRegistry registry;

    @Inject
    public ExporterTelemetry(MeterRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        Gauge.builder(NAME_UPTIME, () -> Duration.between(startTime, Instant.now()).toSeconds())
                .description("Duration in seconds since the exporter started")
                .baseUnit("seconds")
                .register(registry);
        log.info("Exporter telemetry initialized");
    }

    /**
     * Record how long a single collector took during a pass.
     *
     * @param collectorName Name of the collector
     * @param duration      Time spent in the collector
     */
    public void recordCollectorDuration(String collectorName, Duration duration) {
        Timer.builder(NAME_COLLECTOR_DURATION)
                .tag("collector", collectorName)
                .description("Time spent running each collector")
                .register(registry)
                .record(duration);
    }
}
