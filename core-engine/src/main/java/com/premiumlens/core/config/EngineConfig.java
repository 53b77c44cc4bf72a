package com.premiumlens.core.config;

import com.premiumlens.core.model.Branch;
import com.premiumlens.core.model.CoverageType;
import com.premiumlens.core.model.InsuranceType;
import com.premiumlens.core.model.LabeledValue;
import com.premiumlens.core.model.RenewalStatus;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * ingest:
 *   chunkSize: 1000
 *   maxReportedErrors: 20
 *   candidateEncodings: [utf-8, gb18030, gbk, gb2312]
 * fuzzyMatchThreshold: 0.6
 * aliases:
 *   insurance_type:
 *     商业保险: 商业险
 * </pre>
 *
 * <p>
 * Every field has a default, so {@link #defaults()} is a complete working
 * configuration. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig {

    /** CSV columns whose values may be rewritten through an alias table. */
    static final Map<String, Class<? extends LabeledValue>> ALIASABLE_COLUMNS = Map.of(
            "chengdu_branch", Branch.class,
            "insurance_type", InsuranceType.class,
            "coverage_type", CoverageType.class,
            "renewal_status", RenewalStatus.class);

    private IngestSettings ingest = new IngestSettings();
    private double fuzzyMatchThreshold = 0.6;
    private Map<String, Map<String, String>> aliases = defaultAliases();

    /**
     * @return a configuration holding only built-in defaults
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML binding)
    // ---------------------------------------------------------------

    public IngestSettings getIngest() {
        return ingest;
    }

    public void setIngest(IngestSettings ingest) {
        this.ingest = ingest != null ? ingest : new IngestSettings();
    }

    public double getFuzzyMatchThreshold() {
        return fuzzyMatchThreshold;
    }

    public void setFuzzyMatchThreshold(double fuzzyMatchThreshold) {
        this.fuzzyMatchThreshold = fuzzyMatchThreshold;
    }

    /**
     * Alias tables per CSV column name, raw value to canonical label.
     *
     * @return unmodifiable view
     */
    public Map<String, Map<String, String>> getAliases() {
        return Collections.unmodifiableMap(aliases);
    }

    public void setAliases(Map<String, Map<String, String>> aliases) {
        this.aliases = new LinkedHashMap<>();
        if (aliases != null) {
            aliases.forEach((column, table) -> this.aliases.put(column,
                    table != null ? new LinkedHashMap<>(table) : new LinkedHashMap<>()));
        }
    }

    /**
     * Alias table of one column.
     *
     * @param column CSV column name
     * @return unmodifiable table, empty when none is configured
     */
    public Map<String, String> aliasesFor(String column) {
        return Collections.unmodifiableMap(aliases.getOrDefault(column, Map.of()));
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting and alias table.
     *
     * <p>
     * Collects all problems and throws a single exception listing them.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        ingest.collectErrors(errors);

        if (fuzzyMatchThreshold <= 0 || fuzzyMatchThreshold > 1) {
            errors.add("fuzzyMatchThreshold must be in (0, 1], got: " + fuzzyMatchThreshold);
        }

        aliases.forEach((column, table) -> {
            Class<? extends LabeledValue> type = ALIASABLE_COLUMNS.get(column);
            if (type == null) {
                errors.add("aliases." + column + ": column does not accept aliases; supported: "
                        + ALIASABLE_COLUMNS.keySet().stream().sorted().toList());
                return;
            }
            Set<String> legal = labelsOf(type);
            table.forEach((raw, canonical) -> {
                if (!legal.contains(canonical)) {
                    errors.add("aliases." + column + "." + raw + ": '" + canonical
                            + "' is not one of " + legal);
                }
            });
        });

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Set<String> labelsOf(Class<? extends LabeledValue> type) {
        return Arrays.stream(type.getEnumConstants())
                .map(LabeledValue::label)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Map<String, Map<String, String>> defaultAliases() {
        Map<String, Map<String, String>> tables = new LinkedHashMap<>();

        Map<String, String> insuranceType = new LinkedHashMap<>();
        insuranceType.put("商业保险", "商业险");
        insuranceType.put("商险", "商业险");
        insuranceType.put("商业", "商业险");
        insuranceType.put("交强", "交强险");
        insuranceType.put("交强保险", "交强险");
        insuranceType.put("强制险", "交强险");
        tables.put("insurance_type", insuranceType);

        Map<String, String> renewalStatus = new LinkedHashMap<>();
        renewalStatus.put("新", "新保");
        renewalStatus.put("新保单", "新保");
        renewalStatus.put("续", "续保");
        renewalStatus.put("续保单", "续保");
        renewalStatus.put("转", "转保");
        renewalStatus.put("转保单", "转保");
        tables.put("renewal_status", renewalStatus);

        Map<String, String> coverageType = new LinkedHashMap<>();
        coverageType.put("全险", "主全");
        coverageType.put("全保", "主全");
        coverageType.put("交强+三者", "交三");
        coverageType.put("单交强", "单交");
        tables.put("coverage_type", coverageType);

        Map<String, String> branch = new LinkedHashMap<>();
        branch.put("成都分公司", "成都");
        branch.put("中心支公司", "中支");
        tables.put("chengdu_branch", branch);

        return tables;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "ingest=" + ingest +
                ", fuzzyMatchThreshold=" + fuzzyMatchThreshold +
                ", aliasColumns=" + aliases.keySet() +
                '}';
    }
}
