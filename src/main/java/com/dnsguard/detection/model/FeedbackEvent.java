package com.dnsguard.detection.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Analyst verdict on a previously raised alert")
public class FeedbackEvent {

    @Schema(description = "Identifier of the alerted query", example = "42")
    String subjectId;

    @Schema(description = "True if the analyst judged the alert not to be a genuine threat")
    boolean falsePositive;

    @Schema(description = "Score that triggered the alert", example = "0.78")
    double score;

    @Schema(description = "Reviewing analyst", example = "soc-analyst-1")
    String analyst;

    @Schema(description = "Optional free-text notes")
    String notes;

    @Schema(description = "When the feedback was received, epoch milliseconds", example = "1739886764000")
    long receivedAt;
}
