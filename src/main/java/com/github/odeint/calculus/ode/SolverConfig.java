package com.github.odeint.calculus.ode;

import com.github.odeint.calculus.exceptions.InvalidConfigurationException;

import java.util.Arrays;

/**
 * Immutable description of one initial value problem run: the interval, the nominal step and the
 * initial state, plus the controls consulted only by adaptive schemes.
 */
public final class SolverConfig {

    public static final double DEFAULT_TOLERANCE = 1e-6;
    public static final double DEFAULT_MIN_STEP = 1e-10;
    public static final double DEFAULT_MAX_STEP = 0.1;

    private final double timeStart;
    private final double timeEnd;
    private final double stepSize;
    private final double[] initialState;

    private final double tolerance;
    private final double minStep;
    private final double maxStep;

    private final boolean failOnNonFinite;

    private SolverConfig(Builder builder) {
        this.timeStart = builder.timeStart;
        this.timeEnd = builder.timeEnd;
        this.stepSize = builder.stepSize;
        this.initialState = Arrays.copyOf(builder.initialState, builder.initialState.length);
        this.tolerance = builder.tolerance;
        this.minStep = builder.minStep;
        this.maxStep = builder.maxStep;
        this.failOnNonFinite = builder.failOnNonFinite;
    }

    /**
     * Smallest step that still moves a time within {@code [timeStart, timeEnd]} forward:
     * twice the spacing of doubles at the larger end.
     */
    public static double timeResolution(double timeStart, double timeEnd) {
        return 2 * Math.ulp(Math.max(Math.abs(timeStart), Math.abs(timeEnd)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .timeStart(timeStart)
                .timeEnd(timeEnd)
                .stepSize(stepSize)
                .initialState(initialState)
                .tolerance(tolerance)
                .minStep(minStep)
                .maxStep(maxStep)
                .failOnNonFinite(failOnNonFinite);
    }

    public double getTimeStart() {
        return timeStart;
    }

    public double getTimeEnd() {
        return timeEnd;
    }

    /**
     * Nominal step for fixed-step schemes, initial step guess for adaptive ones.
     */
    public double getStepSize() {
        return stepSize;
    }

    public double[] getInitialState() {
        return Arrays.copyOf(initialState, initialState.length);
    }

    public int getDimension() {
        return initialState.length;
    }

    public double getTolerance() {
        return tolerance;
    }

    public double getMinStep() {
        return minStep;
    }

    public double getMaxStep() {
        return maxStep;
    }

    /**
     * When set, solvers throw {@link com.github.odeint.calculus.exceptions.NonFiniteResultException}
     * as soon as a recorded state holds NaN or an infinity. Otherwise such values are recorded as is.
     */
    public boolean isFailOnNonFinite() {
        return failOnNonFinite;
    }

    @Override
    public String toString() {
        return String.format("SolverConfig[t=%s..%s, h=%s, y0=%s, tol=%s, h in [%s, %s]]",
                timeStart, timeEnd, stepSize, Arrays.toString(initialState), tolerance, minStep, maxStep);
    }

    public static final class Builder {

        private double timeStart = Double.NaN;
        private double timeEnd = Double.NaN;
        private double stepSize = Double.NaN;
        private double[] initialState;

        private double tolerance = DEFAULT_TOLERANCE;
        private double minStep = DEFAULT_MIN_STEP;
        private double maxStep = DEFAULT_MAX_STEP;

        private boolean failOnNonFinite = false;

        private Builder() {
        }

        public Builder timeStart(double timeStart) {
            this.timeStart = timeStart;
            return this;
        }

        public Builder timeEnd(double timeEnd) {
            this.timeEnd = timeEnd;
            return this;
        }

        public Builder interval(double timeStart, double timeEnd) {
            return timeStart(timeStart).timeEnd(timeEnd);
        }

        public Builder stepSize(double stepSize) {
            this.stepSize = stepSize;
            return this;
        }

        public Builder initialState(double... initialState) {
            this.initialState = initialState == null ? null : Arrays.copyOf(initialState, initialState.length);
            return this;
        }

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public Builder minStep(double minStep) {
            this.minStep = minStep;
            return this;
        }

        public Builder maxStep(double maxStep) {
            this.maxStep = maxStep;
            return this;
        }

        public Builder failOnNonFinite(boolean failOnNonFinite) {
            this.failOnNonFinite = failOnNonFinite;
            return this;
        }

        public SolverConfig build() throws InvalidConfigurationException {
            if (!Double.isFinite(timeStart)) {
                throw new InvalidConfigurationException("timeStart", timeStart, "must be set to a finite value");
            }
            if (!Double.isFinite(timeEnd)) {
                throw new InvalidConfigurationException("timeEnd", timeEnd, "must be set to a finite value");
            }
            if (timeEnd < timeStart) {
                throw new InvalidConfigurationException(String.format(
                        "timeEnd (%s) must not precede timeStart (%s)", timeEnd, timeStart));
            }
            if (!(stepSize > 0) || !Double.isFinite(stepSize)) {
                throw new InvalidConfigurationException("stepSize", stepSize, "must be finite and positive");
            }
            if (initialState == null || initialState.length == 0) {
                throw new InvalidConfigurationException("initialState must hold at least one component");
            }
            for (int i = 0; i < initialState.length; ++i) {
                if (!Double.isFinite(initialState[i])) {
                    throw new InvalidConfigurationException("initialState[" + i + "]", initialState[i],
                            "must be finite");
                }
            }
            if (!(tolerance > 0)) {
                throw new InvalidConfigurationException("tolerance", tolerance, "must be positive");
            }
            if (!(minStep > 0)) {
                throw new InvalidConfigurationException("minStep", minStep, "must be positive");
            }
            if (!(maxStep >= minStep)) {
                throw new InvalidConfigurationException("maxStep", maxStep, "must not be less than minStep " + minStep);
            }
            // steps below the spacing of doubles around the interval would not advance time
            double resolution = timeResolution(timeStart, timeEnd);
            if (stepSize < resolution) {
                throw new InvalidConfigurationException("stepSize", stepSize,
                        "must be at least the time resolution " + resolution + " of the interval");
            }
            if (minStep < resolution) {
                throw new InvalidConfigurationException("minStep", minStep,
                        "must be at least the time resolution " + resolution + " of the interval");
            }
            return new SolverConfig(this);
        }
    }
}
