package com.github.odeint.calculus.ode;

/**
 * Observes the accept/reject decisions of an adaptive solver. Called on the solving thread.
 */
public interface AdaptiveStepListener {

    AdaptiveStepListener NO_OP = new AdaptiveStepListener() {
    };

    /**
     * A step within tolerance moved the solution from {@code t} to {@code t + h}.
     */
    default void onAccepted(double t, double h, double error) {
    }

    /**
     * A step at {@code t} exceeded the tolerance and is retried with a smaller {@code h}.
     */
    default void onRejected(double t, double h, double error) {
    }

    /**
     * A step exceeded the tolerance but was accepted anyway because {@code h} hit the minimum
     * step size. The recorded point does not satisfy the tolerance.
     */
    default void onForcedAcceptance(double t, double h, double error) {
    }
}
