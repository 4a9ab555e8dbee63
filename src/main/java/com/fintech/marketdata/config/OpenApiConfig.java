package com.fintech.marketdata.config;

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
    public OpenAPI marketDataPipelineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Market Data Pipeline API")
                        .description("""
                                Read-only access to persisted market events and derived features.

                                **Buckets:**
                                - trades: executed transactions
                                - depths: order-book volume snapshots
                                - features: derived observations (exclusive time bounds)
                                - prices: price/VWAP snapshots for labelling

                                Times are Unix epoch milliseconds.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
