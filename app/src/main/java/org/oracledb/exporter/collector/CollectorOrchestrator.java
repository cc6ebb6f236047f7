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
package org.oracledb.exporter.collector;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.oracledb.exporter.db.DatabaseService;
import org.oracledb.exporter.metrics.CollectionState;
import org.oracledb.exporter.metrics.ExporterTelemetry;
import org.oracledb.exporter.metrics.MetricDescriptor;
import org.oracledb.exporter.metrics.MetricSample;
import org.oracledb.exporter.metrics.MetricSink;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Runs collection passes against Oracle.
 *
 * <p>A pass opens one pooled connection, probes it with {@value DatabaseService#PING_SQL},
 * runs every enabled collector in roster order and finally emits the exporter's own
 * families from {@link CollectionState}. A failing collector is counted and logged,
 * the remaining ones still run. Failing to connect or to probe aborts the pass and
 * marks the database as down.
 *
 * <p>Passes are serialized: a caller arriving while a pass is running waits for it
 * to finish and then runs its own.
 */
@Slf4j
@ApplicationScoped
public class CollectorOrchestrator {

    private static final long HANDOFF_POLL_MILLIS = 100;

    private final Lock passLock = new ReentrantLock();

    private final DatabaseService databaseService;
    private final CollectionState state;
    private final ExporterTelemetry telemetry;
    private final List<Collector> activeCollectors;

    @Inject
    public CollectorOrchestrator(DatabaseService databaseService,
                                 CollectionState state,
                                 ExporterTelemetry telemetry,
                                 CollectorRoster roster) {
        this.databaseService = databaseService;
        this.state = state;
        this.telemetry = telemetry;
        this.activeCollectors = roster.getEnabledCollectors();

        for (Collector collector : roster.getCollectors()) {
            if (collector.isEnabled()) {
                log.info("Enabled collector: {}", collector.getName());
            } else {
                log.debug("Disabled collector: {}", collector.getName());
            }
        }
    }

    /**
     * Run one full pass and emit every sample into the sink.
     *
     * <p>Never throws because of the database: failures are reflected in the
     * exporter families and in the returned result.
     *
     * @param sink Destination for domain and exporter samples
     * @return Outcome of the pass
     */
    public ScrapeResult collect(MetricSink sink) {
        Objects.requireNonNull(sink, "Sink must not be null");
        passLock.lock();
        try {
            ScrapeResult result = scrape(sink);
            state.emitTo(sink);
            logResult(result);
            return result;
        } finally {
            passLock.unlock();
        }
    }

    /**
     * Report the descriptor of every sample a pass produces.
     *
     * <p>Runs a real pass: samples are handed one by one to a consumer thread that
     * forwards their descriptors, and the call returns only once that thread is done.
     * Families a collector did not produce in this pass are not reported.
     *
     * @param descriptorSink Receives one descriptor per sample, duplicates included
     * @throws IllegalStateException If the calling thread was interrupted meanwhile
     */
    public void describe(Consumer<MetricDescriptor> descriptorSink) {
        Objects.requireNonNull(descriptorSink, "Descriptor sink must not be null");

        DescriptorHandoff handoff = new DescriptorHandoff(descriptorSink);
        try {
            collect(handoff::send);
        } finally {
            handoff.finish();
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new IllegalStateException("Interrupted while describing metrics");
        }
    }

    private ScrapeResult scrape(MetricSink sink) {
        Instant start = Instant.now();
        state.incrementTotalScrapes();
        log.debug("Starting scrape");

        Connection connection = null;
        try {
            connection = openConnection();
            ping(connection);
        } catch (SQLException | RuntimeException e) {
            closeConnection(connection);
            state.setUp(false);
            state.setLastError(true);
            return ScrapeResult.aborted(start, recordDuration(start), e);
        }

        try {
            state.setUp(true);
            List<String> failed = collectFromAll(connection, sink);
            state.setLastError(false);
            return ScrapeResult.completed(start, recordDuration(start), failed);
        } finally {
            closeConnection(connection);
        }
    }

    private Connection openConnection() throws SQLException {
        try {
            return databaseService.getPooledConnection();
        } catch (SQLException | RuntimeException e) {
            log.error("Error opening connection to database: {}", e.getMessage(), e);
            throw e;
        }
    }

    private void ping(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(DatabaseService.PING_SQL)) {
            if (!rs.next()) {
                throw new SQLException("Liveness probe returned no rows");
            }
        } catch (SQLException | RuntimeException e) {
            log.error("Error pinging database: {}", e.getMessage(), e);
            throw e;
        }
    }

    private void closeConnection(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close database connection: {}", e.getMessage());
        }
    }

    private List<String> collectFromAll(Connection connection, MetricSink sink) {
        List<String> failed = new ArrayList<>();
        for (Collector collector : activeCollectors) {
            if (!executeCollector(collector, connection, sink)) {
                failed.add(collector.getName());
            }
        }
        return failed;
    }

    private boolean executeCollector(Collector collector, Connection connection, MetricSink sink) {
        long collectionStart = System.nanoTime();
        try {
            log.debug("Collecting metrics from: {}", collector.getName());
            collector.collect(connection, sink);
            return true;
        } catch (Exception e) {
            log.error("Error scraping for {}: {}", collector.getName(), e.getMessage(), e);
            state.incrementCollectorError(collector.getName());
            return false;
        } finally {
            Duration duration = Duration.ofNanos(System.nanoTime() - collectionStart);
            telemetry.recordCollectorDuration(collector.getName(), duration);
            log.debug("Collector {} completed in {} ms", collector.getName(), duration.toMillis());
        }
    }

    private Duration recordDuration(Instant start) {
        Duration duration = Duration.between(start, Instant.now());
        state.recordDuration(duration);
        return duration;
    }

    private static void logResult(ScrapeResult result) {
        long millis = result.duration().toMillis();
        if (!result.up()) {
            log.warn("Scrape aborted after {} ms, database unreachable: {}", millis, result.error().getMessage());
        } else if (!result.successful()) {
            log.warn("Scrape completed in {} ms with {} collector failures: {}",
                    millis, result.failedCollectors().size(), result.failedCollectors());
        } else {
            log.debug("Scrape completed in {} ms", millis);
        }
    }

    /**
     * @return Number of enabled collectors
     */
    public int getActiveCollectorCount() {
        return activeCollectors.size();
    }

    /**
     * @return Names of the enabled collectors in execution order
     */
    public List<String> getCollectorNames() {
        return activeCollectors.stream().map(Collector::getName).toList();
    }

    /**
     * Rendezvous between the pass (producer, caller thread) and a single consumer
     * thread forwarding descriptors.
     *
     * <p>The consumer keeps draining after the descriptor sink throws, so the producer
     * never blocks on a dead consumer. The first such failure is rethrown by {@link #finish()}.
     */
    private static final class DescriptorHandoff {
        private static final MetricSample END_OF_STREAM =
                MetricDescriptor.gauge("end_of_stream", "").sample(0);

        private final SynchronousQueue<MetricSample> queue = new SynchronousQueue<>();
        private final FutureTask<Void> consumer;
        private final Thread consumerThread;
        private boolean interrupted;

        DescriptorHandoff(Consumer<MetricDescriptor> descriptorSink) {
            this.consumer = new FutureTask<>(() -> drain(descriptorSink));
            this.consumerThread = new Thread(consumer, "oracledb-describe");
            this.consumerThread.setDaemon(true);
            this.consumerThread.start();
        }

        private Void drain(Consumer<MetricDescriptor> descriptorSink) throws InterruptedException {
            RuntimeException failure = null;
            while (true) {
                MetricSample sample = queue.take();
                if (sample == END_OF_STREAM) {
                    break;
                }
                if (failure != null) {
                    continue;
                }
                try {
                    descriptorSink.accept(sample.descriptor());
                } catch (RuntimeException e) {
                    failure = e;
                }
            }
            if (failure != null) {
                throw failure;
            }
            return null;
        }

        void send(MetricSample sample) {
            while (!consumer.isDone()) {
                try {
                    if (queue.offer(sample, HANDOFF_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                        return;
                    }
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }

        void finish() {
            try {
                send(END_OF_STREAM);
                join();
                rethrowFailure();
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }

        private void join() {
            while (consumerThread.isAlive()) {
                try {
                    consumerThread.join();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }

        private void rethrowFailure() {
            while (true) {
                try {
                    consumer.get();
                    return;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof RuntimeException runtime) {
                        throw runtime;
                    }
                    throw new IllegalStateException("Describe consumer failed", e.getCause());
                }
            }
        }
    }
}
