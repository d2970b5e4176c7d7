package com.dnsguard.detection.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single DNS query observed from a client")
public class QueryRecord {

    @Schema(description = "Queried domain name", example = "mail.example.com")
    private String subject;

    @Schema(description = "Originating client key (usually the client IP)", example = "192.168.1.100")
    private String sourceKey;

    @Schema(description = "Observation time in epoch milliseconds. Defaults to current time if not provided.", example = "1739886764000")
    private Long observedAt;
}
