package com.dnsguard.detection.model;

/**
 * Canonical feature ordering. The ordinal is the column index the outlier model sees,
 * so new constants may only ever be appended.
 */
public enum Feature {
    LENGTH("len_q"),
    ENTROPY("entropy"),
    LABEL_COUNT("num_labels"),
    MAX_LABEL_LENGTH("max_label_len"),
    DIGIT_RATIO("digits_ratio"),
    NON_ALPHANUMERIC_RATIO("non_alnum_ratio"),
    QUERY_RATE("qps"),
    UNIQUE_SUBJECTS("unique_subdomains"),
    MEAN_ENTROPY("avg_entropy"),
    MAX_ENTROPY("max_entropy");

    public static final int COUNT = values().length;

    private final String key;

    Feature(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Feature fromKey(String key) {
        for (Feature feature : values()) {
            if (feature.key.equals(key)) {
                return feature;
            }
        }
        throw new IllegalArgumentException("Unknown feature key: " + key);
    }
}
