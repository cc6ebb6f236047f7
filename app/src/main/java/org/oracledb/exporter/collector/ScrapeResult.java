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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one collection pass.
 *
 * @param timestamp        When the pass started
 * @param duration         Wall-clock duration of the whole pass
 * @param up               Whether the database was reachable (connection opened and probe answered)
 * @param error            Error that aborted the pass before any collector ran, or null
 * @param failedCollectors Names of the collectors that failed, in execution order
 */
public record ScrapeResult(Instant timestamp,
                           Duration duration,
                           boolean up,
                           Throwable error,
                           List<String> failedCollectors) {

    public ScrapeResult {
        failedCollectors = List.copyOf(failedCollectors);
    }

    /**
     * Create the result of a pass that reached the collectors.
     *
     * @param start            When the pass started
     * @param duration         Pass duration
     * @param failedCollectors Collectors that failed
     * @return Result with {@code up == true}
     */
    public static ScrapeResult completed(Instant start, Duration duration, List<String> failedCollectors) {
        return new ScrapeResult(start, duration, true, null, failedCollectors);
    }

    /**
     * Create the result of a pass aborted because the database was unreachable.
     *
     * @param start    When the pass started
     * @param duration Pass duration
     * @param error    Connection or probe failure
     * @return Result with {@code up == false}
     */
    public static ScrapeResult aborted(Instant start, Duration duration, Throwable error) {
        return new ScrapeResult(start, duration, false, error, List.of());
    }

    /**
     * @return true when the database was reachable and every collector succeeded
     */
    public boolean successful() {
        return up && failedCollectors.isEmpty();
    }
}
