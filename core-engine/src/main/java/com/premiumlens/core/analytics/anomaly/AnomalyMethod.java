package com.premiumlens.core.analytics.anomaly;

import java.util.Locale;
import java.util.Objects;

/**
 * Statistical test used to flag anomalies, with its default threshold.
 *
 * @since 1.0.0
 */
public enum AnomalyMethod {
    /** Distance from the mean in standard deviations. */
    ZSCORE("zscore", 3.0),
    /** Distance outside the interquartile fences. */
    IQR("iqr", 1.5),
    /** Modified z-score based on the median absolute deviation. */
    MAD("mad", 3.0);

    private final String code;
    private final double defaultThreshold;

    AnomalyMethod(String code, double defaultThreshold) {
        this.code = code;
        this.defaultThreshold = defaultThreshold;
    }

    public String code() {
        return code;
    }

    public double defaultThreshold() {
        return defaultThreshold;
    }

    /**
     * @param code method code, case-insensitive ({@code zscore}, {@code iqr},
     *             {@code mad})
     * @throws IllegalArgumentException if the code is unknown
     */
    public static AnomalyMethod fromCode(String code) {
        Objects.requireNonNull(code, "Anomaly method must not be null");
        String normalized = code.strip().toLowerCase(Locale.ROOT);
        for (AnomalyMethod method : values()) {
            if (method.code.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException(
                "Unknown anomaly method: '" + code + "'. Supported methods: zscore, iqr, mad");
    }
}
