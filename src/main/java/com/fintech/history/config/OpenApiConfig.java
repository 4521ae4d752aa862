package com.fintech.history.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI marketHistoryOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Market History Query Service API")
                        .description("""
                                Read-only queries over sharded SQLite market history.

                                **Features:**
                                - Bars for indices, ETFs and stocks across year and month shards
                                - Server-side rollup to 5m, 15m, 30m, 1h and 1d
                                - Option chains around the money with Black-Scholes Greeks
                                - Partial results when a shard file is missing or corrupt

                                **Tech Stack:**
                                - SQLite shard files behind per-shard HikariCP pools
                                - Resilience4j breakers for degraded shards
                                - Spring Boot 3.2
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
