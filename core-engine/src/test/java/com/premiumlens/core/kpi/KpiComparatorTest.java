package com.premiumlens.core.kpi;

import com.premiumlens.core.model.KpiKey;
import com.premiumlens.core.model.KpiResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link KpiComparator}.
 */
class KpiComparatorTest {

    @Test
    @DisplayName("Should treat a falling loss ratio as an improvement")
    void shouldRespectLowerIsBetter() {
        MetricChange change = KpiComparator.compare(KpiKey.LOSS_RATIO, kpi(40.0, 100), kpi(50.0, 100));

        assertThat(change.getAbsoluteChange()).isCloseTo(-10.0, within(1e-9));
        assertThat(change.getPercentChange()).isCloseTo(-20.0, within(1e-9));
        assertThat(change.getDirection()).isEqualTo(ChangeDirection.DOWN);
        assertThat(change.isBetter()).isTrue();
        assertThat(change.isWorsened()).isFalse();
    }

    @Test
    @DisplayName("Should treat a falling premium as a deterioration")
    void shouldRespectHigherIsBetter() {
        MetricChange change = KpiComparator.compare(KpiKey.SIGNED_PREMIUM, kpi(50.0, 80), kpi(50.0, 100));

        assertThat(change.getDirection()).isEqualTo(ChangeDirection.DOWN);
        assertThat(change.isWorsened()).isTrue();
    }

    @Test
    @DisplayName("Should leave changes undefined when either side is missing")
    void shouldHandleMissingValues() {
        MetricChange change = KpiComparator.compare(KpiKey.LOSS_RATIO, kpi(null, 100), kpi(50.0, 100));
        MetricChange noPrevious = KpiComparator.compare(KpiKey.SIGNED_PREMIUM, kpi(50.0, 100), null);

        assertThat(change.getAbsoluteChange()).isNull();
        assertThat(change.getDirection()).isEqualTo(ChangeDirection.FLAT);
        assertThat(noPrevious.getPercentChange()).isNull();
        assertThat(noPrevious.isBetter()).isFalse();
    }

    @Test
    @DisplayName("Should leave the percentage undefined against a zero baseline")
    void shouldHandleZeroBaseline() {
        MetricChange change = KpiComparator.compare(KpiKey.SIGNED_PREMIUM, kpi(50.0, 10), kpi(50.0, 0));

        assertThat(change.getAbsoluteChange()).isCloseTo(10.0, within(1e-9));
        assertThat(change.getPercentChange()).isNull();
        assertThat(change.getDirection()).isEqualTo(ChangeDirection.UP);
    }

    @Test
    @DisplayName("Should split a full comparison into improvements and deteriorations")
    void shouldCompareAllMetrics() {
        KpiComparison comparison = KpiComparator.compare(kpi(40.0, 80), kpi(50.0, 100));

        assertThat(comparison.asMap()).hasSize(KpiKey.values().length);
        assertThat(comparison.improvements()).extracting(MetricChange::getKey).containsExactly(KpiKey.LOSS_RATIO);
        assertThat(comparison.deteriorations()).extracting(MetricChange::getKey)
                .containsExactly(KpiKey.SIGNED_PREMIUM);
    }

    @Test
    @DisplayName("Should rank groups by the size of their change")
    void shouldRankDimensionChanges() {
        Map<String, KpiResult> now = new LinkedHashMap<>();
        now.put("天府", kpi(50.0, 101));
        now.put("高新", kpi(50.0, 70));
        now.put("宜宾", kpi(50.0, 5));
        Map<String, KpiResult> before = Map.of("天府", kpi(50.0, 100), "高新", kpi(50.0, 100));

        List<DimensionChange> changes = KpiComparator.compareByDimension(KpiKey.SIGNED_PREMIUM, now, before);

        assertThat(changes).extracting(DimensionChange::getGroup).containsExactly("高新", "天府", "宜宾");
        assertThat(changes.get(2).getChange().getAbsoluteChange()).isNull();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static KpiResult kpi(Double lossRatio, double signedPremium) {
        return KpiResult.builder().lossRatio(lossRatio).signedPremium(signedPremium).build();
    }
}
