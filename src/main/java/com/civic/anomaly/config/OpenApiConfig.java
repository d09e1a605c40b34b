package com.civic.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI anomalyDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Anomaly Detection Engine API")
                        .version("1.0.0")
                        .description(
                                "Batch anomaly detection over civic and commerce activity records.\n\n" +
                                "**Scan Pipeline:**\n" +
                                "1. Refresh statistical baselines for every metric used by an active statistical rule\n" +
                                "2. Run the four detector categories concurrently, each under its own timeout\n" +
                                "3. Store every finding as a `pending` anomaly, skipping (rule, entity) pairs already pending\n" +
                                "4. Evaluate alert thresholds and notify\n\n" +
                                "**Categories:**\n" +
                                "- `statistical` (z-score and IQR outliers against baselines)\n" +
                                "- `behavioral` (action counts, cumulative value, first-action latency, channel diversity)\n" +
                                "- `temporal` (unusual hour-of-day activity, rapid repeated actions)\n" +
                                "- `pattern` (attribute clusters, self-dealing, bilateral volume)\n\n" +
                                "**Investigation lifecycle:** `pending` -> `false_positive`, " +
                                "`pending` -> `confirmed` -> `resolved`")
                        .contact(new Contact().name("Anomaly Detection Team")));
    }
}
