package com.premiumlens.core.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FuzzyMatcher}.
 */
class FuzzyMatcherTest {

    @Test
    @DisplayName("Should compute similarity from the edit distance")
    void shouldComputeSimilarity() {
        assertThat(FuzzyMatcher.similarity("商业险", "商业险")).isEqualTo(1.0);
        assertThat(FuzzyMatcher.similarity("商业线", "商业险")).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(FuzzyMatcher.similarity("", "")).isEqualTo(1.0);
        assertThat(FuzzyMatcher.similarity("abc", "")).isZero();
        assertThat(FuzzyMatcher.distance("kitten", "sitting")).isEqualTo(3);
    }

    @Test
    @DisplayName("Should return the closest candidate above the threshold")
    void shouldFindBestMatch() {
        assertThat(FuzzyMatcher.bestMatch("续保单子", List.of("新保", "续保", "续保单"), 0.6)).contains("续保单");
    }

    @Test
    @DisplayName("Should prefer the earlier candidate on equal similarity")
    void shouldPreferEarlierCandidate() {
        assertThat(FuzzyMatcher.bestMatch("商业线", List.of("商业险", "商业"), 0.6)).contains("商业险");
    }

    @Test
    @DisplayName("Should return empty below the threshold or for blank input")
    void shouldReturnEmpty() {
        assertThat(FuzzyMatcher.bestMatch("完全不同", List.of("商业险", "交强险"), 0.6)).isEmpty();
        assertThat(FuzzyMatcher.bestMatch("", List.of("商业险"), 0.6)).isEmpty();
        assertThat(FuzzyMatcher.bestMatch(null, List.of("商业险"), 0.6)).isEmpty();
    }
}
