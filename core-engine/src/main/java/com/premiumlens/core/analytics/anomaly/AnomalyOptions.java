package com.premiumlens.core.analytics.anomaly;

import java.util.Objects;

/**
 * Parameters of an anomaly scan.
 *
 * @since 1.0.0
 */
public final class AnomalyOptions {

    /** Default minimum number of finite values for a scan to run. */
    public static final int DEFAULT_MIN_DATA_POINTS = 5;

    private final AnomalyMethod method;
    private final Double threshold;
    private final int minDataPoints;

    private AnomalyOptions(Builder b) {
        this.method = Objects.requireNonNull(b.method, "AnomalyMethod must not be null");
        this.threshold = b.threshold;
        this.minDataPoints = b.minDataPoints;
    }

    public static AnomalyOptions of(AnomalyMethod method) {
        return builder().method(method).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public AnomalyMethod getMethod() {
        return method;
    }

    /**
     * @return the configured threshold, or the method's default
     */
    public double getThreshold() {
        return threshold != null ? threshold : method.defaultThreshold();
    }

    public int getMinDataPoints() {
        return minDataPoints;
    }

    @Override
    public String toString() {
        return "AnomalyOptions{method=" + method + ", threshold=" + getThreshold() + ", minDataPoints="
                + minDataPoints + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private AnomalyMethod method = AnomalyMethod.ZSCORE;
        private Double threshold;
        private int minDataPoints = DEFAULT_MIN_DATA_POINTS;

        public Builder method(AnomalyMethod v) {
            this.method = v;
            return this;
        }

        /**
         * @param v positive threshold, or {@code null} for the method default
         */
        public Builder threshold(Double v) {
            if (v != null && !(v > 0 && Double.isFinite(v))) {
                throw new IllegalArgumentException("threshold must be a finite value > 0, got: " + v);
            }
            this.threshold = v;
            return this;
        }

        public Builder minDataPoints(int v) {
            if (v < 1) {
                throw new IllegalArgumentException("minDataPoints must be >= 1, got: " + v);
            }
            this.minDataPoints = v;
            return this;
        }

        public AnomalyOptions build() {
            return new AnomalyOptions(this);
        }
    }
}
