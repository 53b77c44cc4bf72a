package com.premiumlens.core.analytics.anomaly;

import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances.
 *
 * <p>
 * This is the single point of extension when adding new methods: add the
 * constant to {@link AnomalyMethod} and create the corresponding detector
 * here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private DetectorFactory() {
        // utility class
    }

    /**
     * @param method    detection method; must not be {@code null}
     * @param threshold flagging threshold, or {@code null} for the method's
     *                  default
     * @return a detector
     * @throws IllegalArgumentException if {@code threshold} is not positive
     */
    public static AnomalyDetector create(AnomalyMethod method, Double threshold) {
        Objects.requireNonNull(method, "AnomalyMethod must not be null");
        double t = threshold != null ? threshold : method.defaultThreshold();
        return switch (method) {
            case ZSCORE -> new ZScoreDetector(t);
            case IQR -> new IqrDetector(t);
            case MAD -> new MadDetector(t);
        };
    }

    /**
     * @param method method code ({@code zscore}, {@code iqr} or {@code mad})
     * @throws IllegalArgumentException if the code is unknown
     */
    public static AnomalyDetector create(String method, Double threshold) {
        return create(AnomalyMethod.fromCode(method), threshold);
    }

    static double requirePositive(double threshold) {
        if (!(threshold > 0) || !Double.isFinite(threshold)) {
            throw new IllegalArgumentException("threshold must be a finite value > 0, got: " + threshold);
        }
        return threshold;
    }
}
