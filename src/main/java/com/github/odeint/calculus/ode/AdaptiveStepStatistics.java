package com.github.odeint.calculus.ode;

/**
 * Counts adaptive step outcomes. Not thread-safe: use one instance per solving thread.
 */
public class AdaptiveStepStatistics implements AdaptiveStepListener {

    private int accepted;
    private int rejected;
    private int forced;
    private double maxForcedError;
    private double smallestStep = Double.POSITIVE_INFINITY;
    private double largestStep;

    @Override
    public void onAccepted(double t, double h, double error) {
        accepted++;
        track(h);
    }

    @Override
    public void onRejected(double t, double h, double error) {
        rejected++;
    }

    @Override
    public void onForcedAcceptance(double t, double h, double error) {
        forced++;
        maxForcedError = Math.max(maxForcedError, error);
        track(h);
    }

    private void track(double h) {
        smallestStep = Math.min(smallestStep, h);
        largestStep = Math.max(largestStep, h);
    }

    public int getAccepted() {
        return accepted;
    }

    public int getRejected() {
        return rejected;
    }

    public int getForced() {
        return forced;
    }

    public double getMaxForcedError() {
        return maxForcedError;
    }

    public double getSmallestStep() {
        return smallestStep;
    }

    public double getLargestStep() {
        return largestStep;
    }

    public void reset() {
        accepted = 0;
        rejected = 0;
        forced = 0;
        maxForcedError = 0;
        smallestStep = Double.POSITIVE_INFINITY;
        largestStep = 0;
    }

    @Override
    public String toString() {
        return String.format("accepted=%d rejected=%d forced=%d h in [%s, %s]",
                accepted, rejected, forced, smallestStep, largestStep);
    }
}
