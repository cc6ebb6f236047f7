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
package org.oracledb.exporter.prometheus;

import io.prometheus.metrics.model.registry.MultiCollector;
import io.prometheus.metrics.model.snapshots.CounterSnapshot;
import io.prometheus.metrics.model.snapshots.GaugeSnapshot;
import io.prometheus.metrics.model.snapshots.Labels;
import io.prometheus.metrics.model.snapshots.MetricSnapshot;
import io.prometheus.metrics.model.snapshots.MetricSnapshots;
import io.prometheus.metrics.model.snapshots.PrometheusNaming;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.oracledb.exporter.collector.CollectorOrchestrator;
import org.oracledb.exporter.metrics.MetricDescriptor;
import org.oracledb.exporter.metrics.MetricSample;
import org.oracledb.exporter.metrics.MetricType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bridges {@link CollectorOrchestrator} to the Prometheus client model.
 *
 * <p>Every {@link #collect()} runs a fresh pass. Samples are grouped into one
 * snapshot per family, in first-seen order. When a pass yields the same label set
 * twice for a family, the first sample is kept.
 */
@Slf4j
@ApplicationScoped
public class PrometheusCollectorAdapter implements MultiCollector {

    private final CollectorOrchestrator orchestrator;

    private volatile List<String> prometheusNames;

    @Inject
    public PrometheusCollectorAdapter(CollectorOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public MetricSnapshots collect() {
        List<MetricSample> samples = new ArrayList<>();
        orchestrator.collect(samples::add);
        return toSnapshots(samples);
    }

    /**
     * Family names known to the registry, discovered once through a describe pass.
     */
    @Override
    public List<String> getPrometheusNames() {
        List<String> names = prometheusNames;
        if (names == null) {
            synchronized (this) {
                names = prometheusNames;
                if (names == null) {
                    Set<String> discovered = new LinkedHashSet<>();
                    orchestrator.describe(descriptor -> discovered.add(prometheusName(descriptor)));
                    names = List.copyOf(discovered);
                    prometheusNames = names;
                    log.debug("Discovered {} metric families", names.size());
                }
            }
        }
        return names;
    }

    static MetricSnapshots toSnapshots(List<MetricSample> samples) {
        Map<String, Family> families = new LinkedHashMap<>();
        for (MetricSample sample : samples) {
            String name = prometheusName(sample.descriptor());
            Family family = families.computeIfAbsent(name, k -> new Family(k, sample.descriptor()));
            family.add(sample);
        }

        List<MetricSnapshot> snapshots = new ArrayList<>(families.size());
        for (Family family : families.values()) {
            snapshots.add(family.build());
        }
        return new MetricSnapshots(snapshots);
    }

    /**
     * Name as the client library expects it: counters lose their {@code _total}
     * suffix here and get it back on exposition.
     */
    static String prometheusName(MetricDescriptor descriptor) {
        return PrometheusNaming.sanitizeMetricName(descriptor.name());
    }

    private static final class Family {
        private final String name;
        private final MetricDescriptor descriptor;
        private final Map<Labels, Double> points = new LinkedHashMap<>();

        Family(String name, MetricDescriptor descriptor) {
            this.name = name;
            this.descriptor = descriptor;
        }

        void add(MetricSample sample) {
            Labels labels = Labels.of(descriptor.labelKeys(), sample.labelValues());
            Double previous = points.putIfAbsent(labels, sample.value());
            if (previous != null) {
                log.debug("Dropping duplicate sample for {}{}", name, labels);
            }
        }

        MetricSnapshot build() {
            if (descriptor.type() == MetricType.COUNTER) {
                CounterSnapshot.Builder builder = CounterSnapshot.builder().name(name).help(descriptor.help());
                points.forEach((labels, value) -> builder.dataPoint(
                        CounterSnapshot.CounterDataPointSnapshot.builder().labels(labels).value(value).build()));
                return builder.build();
            }
            GaugeSnapshot.Builder builder = GaugeSnapshot.builder().name(name).help(descriptor.help());
            points.forEach((labels, value) -> builder.dataPoint(
                    GaugeSnapshot.GaugeDataPointSnapshot.builder().labels(labels).value(value).build()));
            return builder.build();
        }
    }
}
