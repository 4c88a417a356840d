package com.github.odeint.calculus.ode;

import java.util.Arrays;

public final class EmbeddedStep {

    private final double[] lower;
    private final double[] higher;

    EmbeddedStep(double[] lower, double[] higher) {
        this.lower = lower;
        this.higher = higher;
    }

    /**
     * Estimate used to advance the solution (4th order for Fehlberg).
     */
    public double[] getLower() {
        return Arrays.copyOf(lower, lower.length);
    }

    /**
     * Estimate used to judge the local error (5th order for Fehlberg).
     */
    public double[] getHigher() {
        return Arrays.copyOf(higher, higher.length);
    }

    double[] lower() {
        return lower;
    }

    double[] higher() {
        return higher;
    }
}
