package com.premiumlens.core.kpi;

import com.premiumlens.core.model.DataViewType;
import com.premiumlens.core.model.FilterState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link KpiCache}.
 */
class KpiCacheTest {

    private KpiCache<String> cache;
    private AtomicInteger computations;

    @BeforeEach
    void setUp() {
        cache = new KpiCache<>(2);
        computations = new AtomicInteger();
    }

    @Test
    @DisplayName("Should compute once per key and count hits and misses")
    void shouldMemoize() {
        FilterState state = FilterState.builder().weeks(Set.of(24)).build();

        String first = cache.get(1, state, "kpi", "24", this::compute);
        String second = cache.get(1, FilterState.builder().weeks(Set.of(24)).build(), "kpi", "24", this::compute);

        assertThat(second).isSameAs(first);
        assertThat(computations).hasValue(1);
        assertThat(cache.getHits()).isEqualTo(1);
        assertThat(cache.getMisses()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should treat every key component as significant")
    void shouldDistinguishKeyComponents() {
        FilterState state = FilterState.empty();

        cache.get(1, state, "kpi", "all", this::compute);
        cache.get(2, state, "kpi", "all", this::compute);
        cache.get(2, state.toBuilder().dataViewType(DataViewType.INCREMENT).build(), "kpi", "all", this::compute);
        cache.get(2, state, "trend", "all", this::compute);

        assertThat(computations).hasValue(4);
        assertThat(cache.getHits()).isZero();
    }

    @Test
    @DisplayName("Should evict the least recently used entry")
    void shouldEvictLeastRecentlyUsed() {
        FilterState state = FilterState.empty();
        cache.get(1, state, "a", "w", this::compute);
        cache.get(1, state, "b", "w", this::compute);
        cache.get(1, state, "a", "w", this::compute);

        cache.get(1, state, "c", "w", this::compute);
        cache.get(1, state, "a", "w", this::compute);
        cache.get(1, state, "b", "w", this::compute);

        assertThat(cache.size()).isEqualTo(2);
        assertThat(computations).hasValue(4);
    }

    @Test
    @DisplayName("Should empty the cache on clear and reject a zero capacity")
    void shouldClear() {
        cache.get(1, FilterState.empty(), "a", "w", this::compute);

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThatThrownBy(() -> new KpiCache<String>(0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String compute() {
        return "value-" + computations.incrementAndGet();
    }
}
