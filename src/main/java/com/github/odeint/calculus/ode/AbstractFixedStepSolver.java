package com.github.odeint.calculus.ode;

/**
 * Drives a scheme-specific {@link #step} with a constant nominal step from the start to the end
 * of the interval. The last step is shortened so that it ends exactly on the end time.
 * A remainder shorter than {@code 1e-9} of the nominal step is absorbed by the last step, so an
 * interval such as {@code [0, 1 + 1e-11]} with {@code h = 0.1} takes 10 steps rather than
 * {@code ceil((timeEnd - timeStart) / h) = 11}.
 */
public abstract class AbstractFixedStepSolver extends AbstractODESolver {

    @Override
    public Trajectory solve(DerivativeFunction f, SolverConfig config) {
        final double tStart = config.getTimeStart();
        final double tFinal = config.getTimeEnd();
        final double step = config.getStepSize();

        Trajectory trajectory = startTrajectory(config);

        double t = tStart;
        double[] y = config.getInitialState();
        long n = 0;
        while (t < tFinal) {
            // node times come from the step index, so rounding does not accumulate
            double next = tStart + (n + 1) * step;
            if (next >= tFinal - END_SNAP_FRACTION * step) {
                next = tFinal;
            }
            y = step(f, t, y, next - t);
            t = next;
            ++n;
            record(trajectory, t, y, config);
        }
        return finish(trajectory);
    }
}
