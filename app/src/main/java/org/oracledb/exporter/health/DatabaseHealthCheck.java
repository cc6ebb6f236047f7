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
package org.oracledb.exporter.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;
import org.oracledb.exporter.db.DatabaseService;
import org.oracledb.exporter.metrics.CollectionState;

/**
 * Liveness check probing the Oracle database with {@value DatabaseService#PING_SQL}.
 *
 * <p>The response also carries what the last collection pass observed, so a probe
 * failure can be told apart from a database that was already down during scrapes.
 */
@Liveness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    private final DatabaseService databaseService;
    private final CollectionState collectionState;

    @Inject
    public DatabaseHealthCheck(DatabaseService databaseService, CollectionState collectionState) {
        this.databaseService = databaseService;
        this.collectionState = collectionState;
    }

    @Override
    public HealthCheckResponse call() {
        boolean reachable = databaseService.testConnection();

        return HealthCheckResponse.named("oracle-connection")
                .status(reachable)
                .withData("reachable", reachable)
                .withData("lastScrapeUp", collectionState.isUp())
                .withData("totalScrapes", collectionState.getTotalScrapes())
                .build();
    }
}
