package com.fintech.pricehistory.config;

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
    public OpenAPI priceHistoryOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Price History Service API")
                        .description("""
                                Daily OHLCV price history with anomaly handling.

                                **Read paths:**
                                - Filtered daily and recent series (anomalies dropped)
                                - Monthly close averages
                                - Repaired series with a per-candle repair log

                                Dates are ISO `YYYY-MM-DD`, months `YYYY-MM`.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
