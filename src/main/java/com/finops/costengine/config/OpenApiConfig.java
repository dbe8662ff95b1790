package com.finops.costengine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI costEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Cost Anomaly & Right-Sizing API")
                        .version("1.0.0")
                        .description(
                                "Cost anomaly detection and resource right-sizing for cloud tenants.\n\n" +
                                "**Anomaly pipeline:**\n" +
                                "1. Train a tenant model on at least 90 daily costs via `POST /anomalies/{tenantId}/train`\n" +
                                "2. Score a date range via `POST /anomalies/{tenantId}/detect`\n" +
                                "3. Each outlier gets a severity (LOW..CRITICAL), a type (SPIKE, DROP, PATTERN_CHANGE), " +
                                "affected services and an estimated impact\n\n" +
                                "**Right-sizing pipeline:**\n" +
                                "1. Submit utilization summaries via `POST /right-sizing/recommendations`\n" +
                                "2. Each resource is matched to the cheapest smaller catalog type that still covers " +
                                "p99 utilization plus 20% headroom\n" +
                                "3. Recommendations carry a risk level, confidence and monthly savings, highest savings first")
                        .contact(new Contact().name("FinOps Platform Team")));
    }
}
