package com.premiumlens.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.premiumlens.core.kpi.KpiEngine;
import com.premiumlens.core.kpi.KpiOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JSON shape of {@link InsuranceRecord} and {@link KpiResult}.
 */
class InsuranceRecordJsonTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    @Test
    @DisplayName("Should serialize a record with CSV column names and display labels")
    void shouldSerializeRecord() {
        JsonNode json = mapper.valueToTree(TestRecords.record().build());

        assertThat(json.fieldNames().next()).isEqualTo("snapshot_date");
        assertThat(json.get("snapshot_date").asText()).isEqualTo("2024-06-15");
        assertThat(json.get("chengdu_branch").asText()).isEqualTo("成都");
        assertThat(json.get("insurance_type").asText()).isEqualTo("商业险");
        assertThat(json.get("vehicle_insurance_grade").asText()).isEqualTo("A");
        assertThat(json.get("is_new_energy_vehicle").asBoolean()).isFalse();
        assertThat(json.get("signed_premium_yuan").asDouble()).isEqualTo(10_000);
        assertThat(json.has("highway_risk_grade")).isTrue();
        assertThat(json.get("highway_risk_grade").isNull()).isTrue();
    }

    @Test
    @DisplayName("Should serialize KPI results with snake_case keys and explicit nulls")
    void shouldSerializeKpiResult() {
        KpiResult kpi = KpiEngine.calculate(List.of(TestRecords.record().build()), KpiOptions.defaults())
                .orElseThrow();

        JsonNode json = mapper.valueToTree(kpi);

        assertThat(json.get("loss_ratio").asDouble()).isEqualTo(50.0);
        assertThat(json.get("signed_premium").asDouble()).isEqualTo(1.0);
        assertThat(json.get("premium_progress").isNull()).isTrue();
    }
}
