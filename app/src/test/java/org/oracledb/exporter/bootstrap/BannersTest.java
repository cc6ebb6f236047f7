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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BannersTest {

    @Test
    void testCenterText() {
        Banners banners = new Banners(20, "1.0");

        assertEquals("     0123456789", banners.centerText("0123456789"));
    }

    @Test
    void testCenterText_TooWide() {
        Banners banners = new Banners(4, "1.0");

        assertEquals("Oracle DB Exporter", banners.centerText("Oracle DB Exporter"));
    }
}
