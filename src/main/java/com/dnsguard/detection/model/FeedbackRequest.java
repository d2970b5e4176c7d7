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
@Schema(description = "Analyst feedback on an alert")
public class FeedbackRequest {

    @Schema(description = "Identifier of the alerted query", example = "42")
    private String subjectId;

    @Schema(description = "True if the alert was a false positive")
    private Boolean falsePositive;

    @Schema(description = "Score that triggered the alert", example = "0.78")
    private Double score;

    @Schema(description = "Reviewing analyst", example = "soc-analyst-1")
    private String analyst;

    @Schema(description = "Optional notes", example = "Known CDN hostname pattern")
    private String notes;
}
