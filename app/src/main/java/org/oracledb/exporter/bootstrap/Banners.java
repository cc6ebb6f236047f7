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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Prints the startup banner to the log.
 */
@Slf4j
@ApplicationScoped
public class Banners {

    private final int width;
    private final String version;

    @Inject
    public Banners(@ConfigProperty(name = "app.banner.width", defaultValue = "60") int width,
                   @ConfigProperty(name = "quarkus.application.version", defaultValue = "0.0.0.dev") String version) {
        this.width = width;
        this.version = version;
    }

    public void printHeader() {
        String line = "=".repeat(width);
        log.info(line);
        log.info(centerText("Oracle DB Exporter " + version));
        log.info(line);
    }

    public void printFooter() {
        String line = "=".repeat(width);
        log.info(line);
        log.info(centerText("Exporter Ready"));
        log.info("");
        log.info("  Oracle metrics:       /metrics");
        log.info("  Exporter metrics:     /q/metrics");
        log.info("  Live check:           /q/health/live");
        log.info("");
        log.info(line);
    }

    String centerText(String text) {
        int padding = (width - text.length()) / 2;
        if (padding <= 0) {
            return text;
        }
        return " ".repeat(padding) + text;
    }
}
