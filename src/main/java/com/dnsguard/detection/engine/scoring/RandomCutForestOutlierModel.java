package com.dnsguard.detection.engine.scoring;

import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.config.Precision;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.amazon.randomcutforest.state.RandomCutForestState;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * {@link OutlierModel} backed by a Random Cut Forest.
 *
 * RCF reports higher scores for anomalies (about 1.0 for typical points), so the raw score
 * exposed here is the negated RCF score. Fitting samples without time decay, so the forest
 * reflects the whole baseline rather than its tail.
 */
@JsonTypeName(RandomCutForestOutlierModel.TYPE)
public class RandomCutForestOutlierModel implements OutlierModel {

    public static final String TYPE = "random-cut-forest";

    private final int numberOfTrees;
    private final int sampleSize;
    private final long randomSeed;

    private volatile RandomCutForest forest;
    private volatile int trainingSamples;

    public RandomCutForestOutlierModel(int numberOfTrees, int sampleSize, long randomSeed) {
        this.numberOfTrees = numberOfTrees;
        this.sampleSize = sampleSize;
        this.randomSeed = randomSeed;
    }

    @JsonCreator
    static RandomCutForestOutlierModel fromState(@JsonProperty("numberOfTrees") int numberOfTrees,
                                                 @JsonProperty("sampleSize") int sampleSize,
                                                 @JsonProperty("randomSeed") long randomSeed,
                                                 @JsonProperty("trainingSamples") int trainingSamples,
                                                 @JsonProperty("state") RandomCutForestState state) {
        RandomCutForestOutlierModel model = new RandomCutForestOutlierModel(numberOfTrees, sampleSize, randomSeed);
        if (state != null) {
            model.forest = newMapper().toModel(state);
            model.trainingSamples = trainingSamples;
        }
        return model;
    }

    @Override
    public synchronized void fit(List<double[]> vectors) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a forest on an empty training set");
        }
        RandomCutForest fresh = RandomCutForest.builder()
                .dimensions(vectors.get(0).length)
                .numberOfTrees(numberOfTrees)
                .sampleSize(sampleSize)
                .randomSeed(randomSeed)
                .precision(Precision.FLOAT_64)
                .outputAfter(1)
                .timeDecay(0.0)
                .build();
        for (double[] point : vectors) {
            fresh.update(point);
        }
        this.forest = fresh;
        this.trainingSamples = vectors.size();
    }

    @Override
    public double score(double[] vector) {
        RandomCutForest current = forest;
        if (current == null) {
            throw new IllegalStateException("Random Cut Forest has not been fitted");
        }
        return -current.getAnomalyScore(vector);
    }

    @Override
    public boolean isFitted() {
        return forest != null;
    }

    @Override
    public String modelType() {
        return TYPE;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public int getTrainingSamples() {
        return trainingSamples;
    }

    @JsonProperty("state")
    public RandomCutForestState getState() {
        RandomCutForest current = forest;
        return current == null ? null : newMapper().toState(current);
    }

    private static RandomCutForestMapper newMapper() {
        RandomCutForestMapper mapper = new RandomCutForestMapper();
        mapper.setSaveExecutorContextEnabled(true);
        mapper.setSaveTreeStateEnabled(true);
        return mapper;
    }
}
