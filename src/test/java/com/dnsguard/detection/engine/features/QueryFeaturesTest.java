package com.dnsguard.detection.engine.features;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QueryFeaturesTest {

    @Test
    void entropy_emptyString_isZero() {
        assertThat(QueryFeatures.entropy("")).isEqualTo(0.0);
    }

    @Test
    void entropy_singleRepeatedCharacter_isZero() {
        assertThat(QueryFeatures.entropy("aaaaaaaa")).isEqualTo(0.0);
    }

    @Test
    void entropy_twoEquallyLikelyCharacters_isOneBit() {
        assertThat(QueryFeatures.entropy("abab")).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void entropy_allDistinct_isLog2OfLength() {
        assertThat(QueryFeatures.entropy("abcdefgh")).isCloseTo(3.0, within(1e-12));
    }

    @Test
    void entropy_boundedByLog2OfDistinctSymbols() {
        String subject = "x7f3k9q2m1.a.tunnel.example.com";
        long distinct = subject.chars().distinct().count();
        double entropy = QueryFeatures.entropy(subject);

        assertThat(entropy).isGreaterThanOrEqualTo(0.0);
        assertThat(entropy).isLessThanOrEqualTo(Math.log(distinct) / Math.log(2) + 1e-12);
    }

    @Test
    void labelCount_isDotsPlusOne() {
        assertThat(QueryFeatures.labelCount("www.example.com")).isEqualTo(3);
        assertThat(QueryFeatures.labelCount("localhost")).isEqualTo(1);
        assertThat(QueryFeatures.labelCount("")).isEqualTo(1);
    }

    @Test
    void labelCount_trailingDotCountsEmptyLabel() {
        assertThat(QueryFeatures.labelCount("example.com.")).isEqualTo(3);
    }

    @Test
    void maxLabelLength_picksLongestLabel() {
        assertThat(QueryFeatures.maxLabelLength("a.bbbbb.cc")).isEqualTo(5);
        assertThat(QueryFeatures.maxLabelLength("")).isEqualTo(0);
    }

    @Test
    void digitRatio_countsAsciiDigits() {
        assertThat(QueryFeatures.digitRatio("ab12")).isCloseTo(0.5, within(1e-12));
        assertThat(QueryFeatures.digitRatio("")).isEqualTo(0.0);
    }

    @Test
    void nonAlphanumericRatio_excludesDots() {
        assertThat(QueryFeatures.nonAlphanumericRatio("a-b.c")).isCloseTo(0.2, within(1e-12));
        assertThat(QueryFeatures.nonAlphanumericRatio("www.example.com")).isEqualTo(0.0);
    }

    @Test
    void length_isCharacterCount() {
        assertThat(QueryFeatures.length("example.com")).isEqualTo(11);
    }
}
