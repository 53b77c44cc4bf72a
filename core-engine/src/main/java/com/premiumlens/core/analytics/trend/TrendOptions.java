package com.premiumlens.core.analytics.trend;

import java.util.Objects;

/**
 * Parameters of a trend fit. Only the parameter of the chosen method is
 * consulted.
 *
 * @since 1.0.0
 */
public final class TrendOptions {

    private final TrendMethod method;
    private final int window;
    private final double alpha;
    private final int degree;
    private final int predictSteps;

    private TrendOptions(Builder b) {
        this.method = Objects.requireNonNull(b.method, "TrendMethod must not be null");
        this.window = b.window;
        this.alpha = b.alpha;
        this.degree = b.degree;
        this.predictSteps = b.predictSteps;
    }

    /**
     * @return options for {@code method} with default parameters and no
     *         forecast
     */
    public static TrendOptions of(TrendMethod method) {
        return builder().method(method).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public TrendMethod getMethod() {
        return method;
    }

    public int getWindow() {
        return window;
    }

    public double getAlpha() {
        return alpha;
    }

    public int getDegree() {
        return degree;
    }

    public int getPredictSteps() {
        return predictSteps;
    }

    @Override
    public String toString() {
        return "TrendOptions{method=" + method + ", window=" + window + ", alpha=" + alpha + ", degree=" + degree
                + ", predictSteps=" + predictSteps + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private TrendMethod method = TrendMethod.LINEAR;
        private int window = 3;
        private double alpha = 0.3;
        private int degree = 2;
        private int predictSteps;

        public Builder method(TrendMethod v) {
            this.method = v;
            return this;
        }

        /** Moving-average window, at least 1. */
        public Builder window(int v) {
            if (v < 1) {
                throw new IllegalArgumentException("window must be >= 1, got: " + v);
            }
            this.window = v;
            return this;
        }

        /** EMA smoothing factor in {@code (0, 1]}. */
        public Builder alpha(double v) {
            if (!(v > 0 && v <= 1)) {
                throw new IllegalArgumentException("alpha must be in (0, 1], got: " + v);
            }
            this.alpha = v;
            return this;
        }

        /** Polynomial degree, at least 1. */
        public Builder degree(int v) {
            if (v < 1) {
                throw new IllegalArgumentException("degree must be >= 1, got: " + v);
            }
            this.degree = v;
            return this;
        }

        /** Number of forecast points past the last value; 0 disables it. */
        public Builder predictSteps(int v) {
            if (v < 0) {
                throw new IllegalArgumentException("predictSteps must be >= 0, got: " + v);
            }
            this.predictSteps = v;
            return this;
        }

        public TrendOptions build() {
            return new TrendOptions(this);
        }
    }
}
