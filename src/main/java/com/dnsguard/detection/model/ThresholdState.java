package com.dnsguard.detection.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

/**
 * Severity boundaries. Immutable; the adaptive threshold controller publishes a new instance
 * on every change.
 */
@Value
@Schema(description = "Current severity thresholds")
public class ThresholdState {

    @Schema(description = "Scores at or above this are SUSPICIOUS", example = "0.70")
    double suspicious;

    @Schema(description = "Scores at or above this are HIGH", example = "0.85")
    double high;

    @JsonCreator
    public ThresholdState(@JsonProperty("suspicious") double suspicious,
                          @JsonProperty("high") double high) {
        if (!(suspicious < high)) {
            throw new IllegalArgumentException(
                    String.format("suspicious threshold (%.3f) must be below high threshold (%.3f)", suspicious, high));
        }
        this.suspicious = suspicious;
        this.high = high;
    }

    public boolean isWithin(double minThreshold, double maxThreshold) {
        return suspicious >= minThreshold && high <= maxThreshold;
    }
}
