package com.infra.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI telemetryAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Telemetry Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Streaming anomaly scoring for infrastructure telemetry with drift-driven retraining.\n\n" +
                                "**Scoring Pipeline:**\n" +
                                "1. Receive a metric sample via `POST /telemetry/samples`\n" +
                                "2. Validate arity and per-feature ranges\n" +
                                "3. Append to the bounded feature window\n" +
                                "4. Score against the active Isolation Forest model (score in [0, 1], ~0.5 normal, ~1 anomalous)\n" +
                                "5. Return the verdict with the model version that produced it\n\n" +
                                "**Retraining Loop:**\n" +
                                "- Drift check compares the recent window with the active model's reference using five tests: " +
                                "`KOLMOGOROV_SMIRNOV`, `WASSERSTEIN`, `ANDERSON_DARLING`, `JENSEN_SHANNON`, `MEAN_SHIFT`\n" +
                                "- Drift is declared when at least 3 of 5 tests agree\n" +
                                "- Retraining runs on drift or every 5 minutes; a candidate is promoted only if its F1 " +
                                "is within tolerance of the active model's F1\n" +
                                "- Promotion swaps the active model atomically; retired versions remain available for rollback")
                        .contact(new Contact().name("Infrastructure Monitoring Team")));
    }
}
