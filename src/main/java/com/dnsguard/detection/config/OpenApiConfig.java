package com.dnsguard.detection.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI dnsTunnelDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("DNS Tunnel Detection API")
                        .version("1.0.0")
                        .description(
                                "Real-time anomaly scoring of DNS queries with feedback-driven threshold tuning.\n\n" +
                                "**Analysis Pipeline:**\n" +
                                "1. Receive a query via `POST /dns/analyze`\n" +
                                "2. Extract 10 features: 6 from the query name, 4 from the client's trailing 60s window\n" +
                                "3. Score the feature vector with the outlier model, rescaled to [0, 1] against the training baseline\n" +
                                "4. Classify: **NORMAL** (< suspicious), **SUSPICIOUS**, **HIGH** (>= high)\n\n" +
                                "**Adaptive Thresholds:**\n" +
                                "- Analysts submit verdicts via `POST /feedback`\n" +
                                "- Every hour the controller evaluates the last 24h of feedback and scores\n" +
                                "- Thresholds move in small steps towards a 3% false-positive rate, at most once every 6h, " +
                                "and only with at least 100 feedback samples")
                        .contact(new Contact().name("Detection Engineering Team")));
    }
}
