package com.dnsguard.detection.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Trailing span of per-source history used for rate and diversity features.
    private int windowSeconds = 60;

    // How often idle source windows are swept out of memory.
    private int idleSweepIntervalSeconds = 300;

    // What to do with a query when no outlier model has been trained or loaded yet.
    private UnscoredPolicy unscoredPolicy = UnscoredPolicy.REJECT;

    private Forest forest = new Forest();

    public enum UnscoredPolicy {
        // Surface the missing model to the caller (HTTP 503).
        REJECT,
        // Pass the query through as NORMAL with score 0.
        TREAT_AS_NORMAL
    }

    @Data
    public static class Forest {
        private int numberOfTrees = 100;
        private int sampleSize = 256;
        private long randomSeed = 42L;
    }
}
