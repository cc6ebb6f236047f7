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
import org.oracledb.exporter.collector.activity.ActivityCollector;
import org.oracledb.exporter.collector.activity.ResponseTimeCollector;
import org.oracledb.exporter.collector.activity.WaitTimeCollector;
import org.oracledb.exporter.collector.cache.BufferPoolCollector;
import org.oracledb.exporter.collector.cache.LibraryCacheHitCollector;
import org.oracledb.exporter.collector.database.ForceLogCollector;
import org.oracledb.exporter.collector.database.UserNumberCollector;
import org.oracledb.exporter.collector.sessions.SessionTimeCollector;
import org.oracledb.exporter.collector.sessions.SessionWaitCollector;
import org.oracledb.exporter.collector.sessions.SessionsCollector;
import org.oracledb.exporter.collector.sessions.TransactionWaitTimeCollector;
import org.oracledb.exporter.collector.storage.AsmDiskCollector;
import org.oracledb.exporter.collector.storage.DataFileCollector;
import org.oracledb.exporter.collector.storage.TablespaceCollector;

import java.util.List;

/**
 * The fixed, ordered set of collectors run by every pass.
 *
 * <p>Order matters: samples reach the exposition in this order, and dashboards
 * relying on the first-wins rule for duplicate series depend on it.
 */
@ApplicationScoped
public class CollectorRoster {

    private final List<Collector> collectors;

    @Inject
    public CollectorRoster(ActivityCollector activity,
                           TablespaceCollector tablespace,
                           WaitTimeCollector waitTime,
                           SessionsCollector sessions,
                           BufferPoolCollector buffer,
                           LibraryCacheHitCollector sga,
                           UserNumberCollector userNumber,
                           ResponseTimeCollector responseTime,
                           AsmDiskCollector asmDisk,
                           DataFileCollector dataFile,
                           SessionWaitCollector sessionWait,
                           ForceLogCollector forceLog,
                           SessionTimeCollector sessionTime,
                           TransactionWaitTimeCollector transaction) {
        this(List.of(activity, tablespace, waitTime, sessions, buffer, sga, userNumber,
                responseTime, asmDisk, dataFile, sessionWait, forceLog, sessionTime, transaction));
    }

    /**
     * @param collectors Collectors in execution order
     */
    public CollectorRoster(List<Collector> collectors) {
        this.collectors = List.copyOf(collectors);
    }

    /**
     * @return All collectors in execution order, enabled or not
     */
    public List<Collector> getCollectors() {
        return collectors;
    }

    /**
     * @return Enabled collectors in execution order
     */
    public List<Collector> getEnabledCollectors() {
        return collectors.stream().filter(Collector::isEnabled).toList();
    }
}
