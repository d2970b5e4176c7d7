package com.dnsguard.detection.engine.scoring;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Pluggable outlier-detection capability. Implementations must be Jackson-serialisable so that
 * they can travel inside a model artifact; register extra subtypes on the artifact mapper.
 *
 * Raw score convention: lower (more negative) means more anomalous.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RandomCutForestOutlierModel.class, name = RandomCutForestOutlierModel.TYPE)
})
public interface OutlierModel {

    /** Fits the model on baseline (assumed benign) vectors, replacing any previous fit. */
    void fit(List<double[]> vectors);

    /**
     * @throws IllegalStateException if the model has not been fitted
     */
    double score(double[] vector);

    @JsonIgnore
    boolean isFitted();

    String modelType();
}
