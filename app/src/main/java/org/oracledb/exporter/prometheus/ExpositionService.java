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

import io.prometheus.metrics.expositionformats.ExpositionFormatWriter;
import io.prometheus.metrics.expositionformats.ExpositionFormats;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the Prometheus registry holding the Oracle families and renders it
 * in the format negotiated from the request's {@code Accept} header.
 */
@Slf4j
@ApplicationScoped
public class ExpositionService {

    private final PrometheusRegistry registry = new PrometheusRegistry();
    private final ExpositionFormats formats = ExpositionFormats.init();
    private final AtomicBoolean registered = new AtomicBoolean();

    private final PrometheusCollectorAdapter adapter;

    @Inject
    public ExpositionService(PrometheusCollectorAdapter adapter) {
        this.adapter = adapter;
    }

    /**
     * Register the Oracle collector with the registry. Triggers one describe pass.
     * Later calls are no-ops.
     */
    public void registerExporter() {
        if (registered.compareAndSet(false, true)) {
            registry.register(adapter);
            log.info("Registered Oracle collector with {} metric families", adapter.getPrometheusNames().size());
        }
    }

    /**
     * Run a pass and render it.
     *
     * @param acceptHeader Value of the {@code Accept} header, may be null
     * @return Rendered body with its content type
     * @throws IOException If writing the exposition fails
     */
    public Exposition scrape(String acceptHeader) throws IOException {
        ExpositionFormatWriter writer = formats.findWriter(acceptHeader);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.write(out, registry.scrape());
        return new Exposition(writer.getContentType(), out.toByteArray());
    }

    /**
     * Rendered exposition body.
     *
     * @param contentType Content type of the chosen format
     * @param body        Encoded metrics
     */
    public record Exposition(String contentType, byte[] body) {
    }
}
