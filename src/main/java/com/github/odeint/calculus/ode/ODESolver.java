package com.github.odeint.calculus.ode;

/**
 * Integration scheme for initial value problems {@code dy/dt = f(t, y), y(t0) = y0}.
 * <p>
 * Solvers hold no per-run state: every {@link #solve} call works on its own copy of the time,
 * state and step size, so one instance may serve any number of sequential or concurrent runs.
 * An {@link AdaptiveStepListener} given to an adaptive solver is called from every run; a
 * stateful one such as {@link AdaptiveStepStatistics} restricts that instance to one thread.
 * Inputs are not validated beyond the derivative dimension; NaN or infinite derivatives propagate
 * into the trajectory unless {@link SolverConfig#isFailOnNonFinite()} is set.
 */
public interface ODESolver {

    int MAX_RESERVED_POINTS = 1 << 20;

    /**
     * Advances {@code y} at time {@code t} by exactly {@code h}. Neither {@code y} nor anything
     * returned by {@code f} is modified.
     */
    double[] step(DerivativeFunction f, double t, double[] y, double h);

    /**
     * Integrates from {@link SolverConfig#getTimeStart()} to {@link SolverConfig#getTimeEnd()}.
     * The returned trajectory starts with the initial condition and ends exactly at the end time.
     */
    Trajectory solve(DerivativeFunction f, SolverConfig config);

    String name();

    /**
     * Global order of accuracy p, i.e. the error scales as O(h^p).
     */
    int order();

    /**
     * {@code result[i] = a[i] + scaleB * b[i]}.
     */
    default double[] addStates(double[] a, double[] b, double scaleB) {
        double[] result = new double[a.length];
        for (int i = 0; i < a.length; ++i) {
            result[i] = a[i] + scaleB * b[i];
        }
        return result;
    }

    default double[] addStates(double[] a, double[] b) {
        return addStates(a, b, 1.0);
    }

    /**
     * Pre-sizes {@code trajectory} for {@code floor((timeEnd - timeStart) / stepSize) + 1} points.
     * Only an allocation hint.
     */
    default void reserve(Trajectory trajectory, SolverConfig config) {
        double estimate = Math.floor((config.getTimeEnd() - config.getTimeStart()) / config.getStepSize()) + 1;
        if (estimate > 0) {
            trajectory.ensureCapacity((int) Math.min(estimate, MAX_RESERVED_POINTS));
        }
    }
}
