package com.premiumlens.core.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CsvColumn}.
 */
class CsvColumnTest {

    @Test
    @DisplayName("Should list every header once in canonical export order")
    void shouldListHeadersInOrder() {
        assertThat(CsvColumn.headers())
                .hasSize(26)
                .startsWith("snapshot_date", "policy_start_year")
                .endsWith("marginal_contribution_amount_yuan", "week_number");
    }

    @Test
    @DisplayName("Should expose the header set read-only")
    void shouldRejectModification() {
        assertThatThrownBy(() -> CsvColumn.headers().add("extra"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
