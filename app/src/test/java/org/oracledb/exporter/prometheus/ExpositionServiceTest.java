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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.oracledb.exporter.collector.CollectorOrchestrator;
import org.oracledb.exporter.metrics.MetricDescriptor;
import org.oracledb.exporter.metrics.MetricSink;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExpositionServiceTest {

    private static final MetricDescriptor UP = MetricDescriptor.gauge("oracledb_up", "Whether the database is up");
    private static final MetricDescriptor SCRAPES =
            MetricDescriptor.counter("oracledb_exporter_scrapes_total", "Total scrapes");

    @Mock
    private CollectorOrchestrator orchestrator;

    private ExpositionService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        lenient().doAnswer(inv -> {
            Consumer<MetricDescriptor> sink = inv.getArgument(0);
            sink.accept(UP);
            sink.accept(SCRAPES);
            return null;
        }).when(orchestrator).describe(any(Consumer.class));
        lenient().doAnswer(inv -> {
            MetricSink sink = inv.getArgument(0);
            sink.accept(SCRAPES.sample(3));
            sink.accept(UP.sample(1.0));
            return null;
        }).when(orchestrator).collect(any());

        service = new ExpositionService(new PrometheusCollectorAdapter(orchestrator));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testRegisterExporter_IsIdempotent() {
        service.registerExporter();
        service.registerExporter();

        verify(orchestrator, times(1)).describe(any(Consumer.class));
    }

    @Test
    void testScrape_PrometheusTextFormat() throws IOException {
        service.registerExporter();

        ExpositionService.Exposition exposition = service.scrape("text/plain");
        String body = new String(exposition.body(), StandardCharsets.UTF_8);

        assertTrue(exposition.contentType().startsWith("text/plain"));
        assertTrue(body.contains("oracledb_up 1.0"), body);
        assertTrue(body.contains("oracledb_exporter_scrapes_total 3.0"), body);
        assertTrue(body.contains("# TYPE oracledb_up gauge"), body);
    }

    @Test
    void testScrape_OpenMetricsFormat() throws IOException {
        service.registerExporter();

        ExpositionService.Exposition exposition =
                service.scrape("application/openmetrics-text; version=1.0.0; charset=utf-8");
        String body = new String(exposition.body(), StandardCharsets.UTF_8);

        assertTrue(exposition.contentType().startsWith("application/openmetrics-text"));
        assertTrue(body.contains("# TYPE oracledb_exporter_scrapes counter"), body);
        assertTrue(body.trim().endsWith("# EOF"), body);
    }

    @Test
    void testScrape_BeforeRegistrationIsEmpty() throws IOException {
        ExpositionService.Exposition exposition = service.scrape(null);

        assertFalse(new String(exposition.body(), StandardCharsets.UTF_8).contains("oracledb_up"));
        verify(orchestrator, never()).collect(any());
    }
}
