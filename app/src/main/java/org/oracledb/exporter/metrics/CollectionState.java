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

import jakarta.enterprise.context.ApplicationScoped;
import org.oracledb.exporter.common.Constants;
import org.oracledb.exporter.common.MetricNameBuilder;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State describing the exporter's own scrapes: last duration, last error flag,
 * total number of scrapes, errors per collector and database reachability.
 *
 * <p>Updated by the orchestrator once per collection pass and emitted alongside
 * the database metrics. Counters only ever increase; gauges are overwritten.
 */
@ApplicationScoped
public class CollectionState {

    static final MetricDescriptor LAST_SCRAPE_DURATION = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "last_scrape_duration_seconds"),
            "Duration of the last scrape of metrics from Oracle DB.");
    static final MetricDescriptor SCRAPES_TOTAL = MetricDescriptor.counter(
            MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "scrapes_total"),
            "Total number of times Oracle DB was scraped for metrics.");
    static final MetricDescriptor SCRAPE_ERRORS_TOTAL = MetricDescriptor.counter(
            MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "scrape_errors_total"),
            "Total number of times an error occurred scraping an Oracle database.",
            "collector");
    static final MetricDescriptor LAST_SCRAPE_ERROR = MetricDescriptor.gauge(
            MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "last_scrape_error"),
            "Whether the last scrape of metrics from Oracle DB resulted in an error (1 for error, 0 for success).");
    static final MetricDescriptor UP = MetricDescriptor.gauge(
            MetricNameBuilder.build("up"),
            "Whether the Oracle database server is up.");

    private final AtomicLong totalScrapes = new AtomicLong();
    private final Map<String, AtomicLong> collectorErrors = new ConcurrentSkipListMap<>();

    private volatile double lastDurationSeconds;
    private volatile boolean lastError;
    private volatile boolean up;

    public void incrementTotalScrapes() {
        totalScrapes.incrementAndGet();
    }

    /**
     * Increment the error counter of a single collector.
     *
     * @param collectorName Name of the collector that failed
     */
    public void incrementCollectorError(String collectorName) {
        collectorErrors.computeIfAbsent(collectorName, k -> new AtomicLong()).incrementAndGet();
    }

    public void recordDuration(Duration duration) {
        lastDurationSeconds = duration.toNanos() / 1_000_000_000.0;
    }

    public void setLastError(boolean error) {
        lastError = error;
    }

    public void setUp(boolean databaseUp) {
        up = databaseUp;
    }

    public long getTotalScrapes() {
        return totalScrapes.get();
    }

    /**
     * @return Errors recorded for the collector, 0 if it never failed
     */
    public long getCollectorErrors(String collectorName) {
        AtomicLong counter = collectorErrors.get(collectorName);
        return counter != null ? counter.get() : 0L;
    }

    public double getLastDurationSeconds() {
        return lastDurationSeconds;
    }

    public boolean isLastError() {
        return lastError;
    }

    public boolean isUp() {
        return up;
    }

    /**
     * Emit the exporter's own families into the sink.
     *
     * <p>Error counters appear only for collectors that failed at least once.
     */
    public void emitTo(MetricSink sink) {
        sink.accept(LAST_SCRAPE_DURATION.sample(lastDurationSeconds));
        sink.accept(SCRAPES_TOTAL.sample(totalScrapes.get()));
        sink.accept(LAST_SCRAPE_ERROR.sample(lastError ? 1.0 : 0.0));
        collectorErrors.forEach((name, count) -> sink.accept(SCRAPE_ERRORS_TOTAL.sample(count.get(), name)));
        sink.accept(UP.sample(up ? 1.0 : 0.0));
    }
}
