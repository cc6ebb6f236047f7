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
package org.oracledb.exporter.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Per-collector toggles. Disabled collectors are skipped without changing the
 * order in which the remaining collectors run.
 */
@ConfigMapping(prefix = "app.collectors")
public interface CollectorsConfig {

    @WithDefault("true")
    boolean activityEnabled();

    @WithDefault("true")
    boolean tablespaceEnabled();

    @WithDefault("true")
    boolean waitTimeEnabled();

    @WithDefault("true")
    boolean sessionsEnabled();

    @WithDefault("true")
    boolean bufferEnabled();

    @WithDefault("true")
    boolean sgaEnabled();

    @WithDefault("true")
    boolean userNumberEnabled();

    @WithDefault("true")
    boolean responseTimeEnabled();

    @WithDefault("true")
    boolean asmDiskEnabled();

    @WithDefault("true")
    boolean dataFileEnabled();

    @WithDefault("true")
    boolean sessionWaitEnabled();

    @WithDefault("true")
    boolean forceLogEnabled();

    @WithDefault("true")
    boolean sessionTimeEnabled();

    @WithDefault("true")
    boolean transactionEnabled();
}
