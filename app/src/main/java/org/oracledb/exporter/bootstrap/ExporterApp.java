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
package org.oracledb.exporter.bootstrap;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.oracledb.exporter.collector.CollectorOrchestrator;
import org.oracledb.exporter.db.DatabaseService;
import org.oracledb.exporter.prometheus.ExpositionService;

import java.util.Optional;

/**
 * Application lifecycle bean that prepares the exporter on startup.
 *
 * <p><b>Startup:</b>
 * <ol>
 *   <li>Print banner and log configuration</li>
 *   <li>Log the Oracle server banner, best effort</li>
 *   <li>Register the Oracle collector, which runs a first pass to discover families</li>
 * </ol>
 * There is no background scraping: every pass is driven by a request to {@code /metrics}.
 */
@Slf4j
@ApplicationScoped
public class ExporterApp {
    private final DatabaseService databaseService;
    private final CollectorOrchestrator orchestrator;
    private final ExpositionService expositionService;
    private final Banners banner;

    @Inject
    public ExporterApp(DatabaseService databaseService,
                       CollectorOrchestrator orchestrator,
                       ExpositionService expositionService,
                       Banners banner) {
        this.databaseService = databaseService;
        this.orchestrator = orchestrator;
        this.expositionService = expositionService;
        this.banner = banner;
    }

    void onStartup(@Observes StartupEvent event) {
        banner.printHeader();
        logConfiguration();
        logServerBanner();
        expositionService.registerExporter();
        banner.printFooter();
    }

    private void logConfiguration() {
        log.info("Configuration:");
        log.info("  Active collectors:      {}", orchestrator.getActiveCollectorCount());
        log.info("  Collectors:             {}", String.join(", ", orchestrator.getCollectorNames()));
        log.info("  Data source:            {}", maskSensitiveInfo(databaseService.getUrl()));
    }

    /**
     * Hide credentials embedded in a data source name.
     *
     * <p>Handles {@code user/password@host} as used by Oracle as well as
     * {@code user:password@host} and {@code password=} query parameters.
     *
     * @param url Data source name
     * @return Masked data source name
     */
    static String maskSensitiveInfo(String url) {
        if (url == null) {
            return "not configured";
        }
        return url.replaceAll("password=[^&\\s]+", "password=***")
                .replaceAll("([^:/@]+)/[^/@]+@", "$1/***@")
                .replaceAll(":[^:/@]+@", ":***@");
    }

    private void logServerBanner() {
        Optional<String> serverBanner = databaseService.detectServerBanner();
        if (serverBanner.isPresent()) {
            log.info("Database connection successful:");
            log.info("  Oracle server:          {}", serverBanner.get());
        } else {
            log.warn("Could not reach Oracle on startup, check DATA_SOURCE_NAME");
            log.warn("Scrapes will report oracledb_up 0 until the database is reachable");
        }
    }
}
