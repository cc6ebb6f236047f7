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
package org.oracledb.exporter.common;

import lombok.experimental.UtilityClass;

/**
 * Global constants for Oracle exporter metrics
 */
@UtilityClass
public final class Constants {
    public static final String NAMESPACE = "oracledb";
    public static final String SUBSYSTEM_EXPORTER = "exporter";
    public static final String SUBSYSTEM_ACTIVITY = "activity";
    public static final String SUBSYSTEM_TABLESPACE = "tablespace";
    public static final String SUBSYSTEM_WAIT_TIME = "wait_time";
    public static final String SUBSYSTEM_SESSIONS = "sessions";
    public static final String SUBSYSTEM_SESSION = "session";
    public static final String SUBSYSTEM_BUFFER = "buffer";
    public static final String SUBSYSTEM_SGA = "sga";
    public static final String SUBSYSTEM_USER = "user";
    public static final String SUBSYSTEM_RESPONSE = "response";
    public static final String SUBSYSTEM_ASM = "asm";
    public static final String SUBSYSTEM_DATA_FILE = "data_file";
    public static final String SUBSYSTEM_FORCE = "force";
    public static final String SUBSYSTEM_TRANSACTION = "transaction";
    public static final String UNKNOWN = "unknown";
    public static final String SESSION_STATUS_ACTIVE = "ACTIVE";
    public static final String SESSION_STATUS_INACTIVE = "INACTIVE";
    public static final String DATA_FILE_STATUS_ONLINE = "ONLINE";
    public static final String FORCE_LOGGING_YES = "YES";
}
