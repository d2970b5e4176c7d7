package com.dnsguard.detection.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

/**
 * Summary statistics of raw outlier scores over the training set.
 */
@Value
@Schema(description = "Raw-score baseline captured at training time")
public class BaselineCalibration {

    double min;
    double max;
    double mean;
    double std;

    @JsonCreator
    public BaselineCalibration(@JsonProperty("min") double min,
                               @JsonProperty("max") double max,
                               @JsonProperty("mean") double mean,
                               @JsonProperty("std") double std) {
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.std = std;
    }

    /** Population statistics over the given raw scores. */
    public static BaselineCalibration fromScores(double[] rawScores) {
        if (rawScores.length == 0) {
            throw new IllegalArgumentException("Cannot calibrate on an empty score set");
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        for (double s : rawScores) {
            min = Math.min(min, s);
            max = Math.max(max, s);
            sum += s;
        }
        double mean = sum / rawScores.length;
        double sq = 0.0;
        for (double s : rawScores) {
            sq += (s - mean) * (s - mean);
        }
        return new BaselineCalibration(min, max, mean, Math.sqrt(sq / rawScores.length));
    }

    @JsonIgnore
    public boolean isDegenerate() {
        return !(max > min);
    }
}
