package com.fenceping.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI (Swagger) configuration for the operational API.
 *
 * - Swagger UI: http://localhost:8080/swagger-ui.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI geofenceEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("FencePing Geofence Engine API")
                        .description("Operational API of the geofence event detection engine.\n\n" +
                                "## Pipeline\n\n" +
                                "1. Location samples are consumed from the `raw_events` topic, keyed by device\n" +
                                "2. Candidate geofences come from the per-account geofence index\n" +
                                "3. The containment state machine emits `enter`, `exit` and `dwell` transitions\n" +
                                "4. Events are recorded in `geofence_events` and published to `gf_events`\n\n" +
                                "## Endpoints\n\n" +
                                "- Index statistics, inspection and invalidation per account\n" +
                                "- Containment state lookup per (device, geofence)\n" +
                                "- Recent events per device\n" +
                                "- Dry-run evaluation of a coordinate")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
