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

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;

/**
 * HTTP surface of the exporter: the Prometheus scrape endpoint and a landing page.
 */
@Path("/")
public class MetricsResource {

    static final String LANDING_PAGE = """
            <html>
            <head><title>Oracle DB Exporter %1$s</title></head>
            <body>
            <h1>Oracle DB Exporter %1$s</h1>
            <p><a href="metrics">Metrics</a></p>
            </body>
            </html>
            """;

    @Inject
    ExpositionService expositionService;

    @ConfigProperty(name = "quarkus.application.version", defaultValue = "0.0.0.dev")
    String version;

    @GET
    @Path("metrics")
    public Response metrics(@HeaderParam(HttpHeaders.ACCEPT) String accept) throws IOException {
        ExpositionService.Exposition exposition = expositionService.scrape(accept);
        return Response.ok(exposition.body())
                .type(exposition.contentType())
                .build();
    }

    @GET
    @Produces(MediaType.TEXT_HTML)
    public String landingPage() {
        return LANDING_PAGE.formatted(version);
    }
}
