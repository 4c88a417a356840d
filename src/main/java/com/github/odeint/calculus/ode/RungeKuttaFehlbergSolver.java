package com.github.odeint.calculus.ode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adaptive Runge-Kutta-Fehlberg 4(5) method.
 * <p>
 * Every attempt evaluates six stages and combines them into a 4th and a 5th order estimate.
 * Their largest relative component difference is the error of the attempt: within
 * {@link SolverConfig#getTolerance()} the 4th order estimate is recorded and the step grows,
 * otherwise the attempt is discarded and retried from the same point with a smaller step.
 * Steps are kept within {@code [minStep, maxStep]}, and never below the spacing of doubles at the
 * current time; an attempt at the minimum step is accepted regardless of its error, which bounds
 * the number of steps by
 * {@code (timeEnd - timeStart) / minStep}. Such forced acceptances are reported to the
 * {@link AdaptiveStepListener} and logged.
 */
public class RungeKuttaFehlbergSolver extends AbstractODESolver {

    private static final Logger log = LoggerFactory.getLogger(RungeKuttaFehlbergSolver.class);

    static final double ERROR_EPSILON = 1e-10;
    static final double SAFETY = 0.9;
    static final double MIN_FACTOR = 0.1;
    static final double MAX_FACTOR = 5.0;

    private static final ButcherTableau FEHLBERG = new ButcherTableau(
            new double[][] {
                    {},
                    {1.0 / 4},
                    {3.0 / 32, 9.0 / 32},
                    {1932.0 / 2197, -7200.0 / 2197, 7296.0 / 2197},
                    {439.0 / 216, -8, 3680.0 / 513, -845.0 / 4104},
                    {-8.0 / 27, 2, -3544.0 / 2565, 1859.0 / 4104, -11.0 / 40}},
            new double[] {25.0 / 216, 0, 1408.0 / 2565, 2197.0 / 4104, -1.0 / 5, 0},
            new double[] {0, 1.0 / 4, 3.0 / 8, 12.0 / 13, 1, 1.0 / 2});

    private static final double[] FIFTH_ORDER_WEIGHTS =
            {16.0 / 135, 0, 6656.0 / 12825, 28561.0 / 56430, -9.0 / 50, 2.0 / 55};

    private final AdaptiveStepListener listener;

    public RungeKuttaFehlbergSolver() {
        this(AdaptiveStepListener.NO_OP);
    }

    public RungeKuttaFehlbergSolver(AdaptiveStepListener listener) {
        this.listener = listener == null ? AdaptiveStepListener.NO_OP : listener;
    }

    /**
     * Single non-adaptive step returning the 4th order estimate.
     */
    @Override
    public double[] step(DerivativeFunction f, double t, double[] y, double h) {
        return stepEmbedded(f, t, y, h).lower();
    }

    public EmbeddedStep stepEmbedded(DerivativeFunction f, double t, double[] y, double h) {
        double[][] k = FEHLBERG.evaluateStages(f, t, y, h);
        return new EmbeddedStep(
                FEHLBERG.advance(y, h, k),
                ButcherTableau.combine(y, h, k, FIFTH_ORDER_WEIGHTS, k.length));
    }

    /**
     * Largest relative difference {@code |y5[i] - y4[i]| / (|y5[i]| + 1e-10)} over all components.
     * A NaN difference counts as an infinite error.
     */
    double computeError(double[] y4, double[] y5) {
        double maxError = 0.0;
        for (int i = 0; i < y4.length; ++i) {
            double relative = Math.abs(y5[i] - y4[i]) / (Math.abs(y5[i]) + ERROR_EPSILON);
            if (Double.isNaN(relative)) {
                return Double.POSITIVE_INFINITY;
            }
            maxError = Math.max(maxError, relative);
        }
        return maxError;
    }

    /**
     * Step size for the next attempt: doubled on a zero error, otherwise scaled by
     * {@code 0.9 (tolerance / error)^(1/4)} limited to {@code [0.1, 5]}.
     */
    double adjustStepSize(double h, double error, double tolerance) {
        if (error == 0.0) {
            return h * 2.0;
        }
        double factor = SAFETY * Math.pow(tolerance / error, 0.25);
        factor = Math.max(MIN_FACTOR, Math.min(factor, MAX_FACTOR));
        return h * factor;
    }

    @Override
    public Trajectory solve(DerivativeFunction f, SolverConfig config) {
        final double tFinal = config.getTimeEnd();
        final double tolerance = config.getTolerance();
        final double minStep = config.getMinStep();
        final double maxStep = config.getMaxStep();

        Trajectory trajectory = startTrajectory(config);

        double t = config.getTimeStart();
        double[] y = config.getInitialState();
        double h = config.getStepSize();

        int rejected = 0;
        int forced = 0;
        double worstForcedError = 0.0;

        while (t < tFinal) {
            double floor = Math.max(minStep, Math.ulp(t));
            h = Math.max(floor, Math.min(h, maxStep));
            boolean atFloor = h <= floor;
            // truncate after the bounds so the final step never passes the end time
            boolean last = t + h >= tFinal - END_SNAP_FRACTION * h;
            if (last) {
                h = tFinal - t;
                atFloor |= h <= floor;
            }

            EmbeddedStep attempt = stepEmbedded(f, t, y, h);
            double error = computeError(attempt.lower(), attempt.higher());

            if (error <= tolerance || atFloor) {
                if (error <= tolerance) {
                    listener.onAccepted(t, h, error);
                } else {
                    forced++;
                    worstForcedError = Math.max(worstForcedError, error);
                    listener.onForcedAcceptance(t, h, error);
                }
                y = attempt.lower();
                t = last ? tFinal : t + h;
                record(trajectory, t, y, config);

                if (error > 0.0 && !atFloor) {
                    h = adjustStepSize(h, error, tolerance);
                }
            } else {
                rejected++;
                log.trace("rejected step at t = {}: h = {}, error = {}", t, h, error);
                listener.onRejected(t, h, error);
                h = adjustStepSize(h, error, tolerance);
            }
        }

        if (forced > 0) {
            log.warn("{}: {} step(s) accepted at the minimum step size {} above tolerance {} (worst error {})",
                    name(), forced, minStep, tolerance, worstForcedError);
        }
        log.debug("{}: {} rejected attempt(s)", name(), rejected);
        return finish(trajectory);
    }

    @Override
    public String name() {
        return "RK45 (Runge-Kutta-Fehlberg)";
    }

    @Override
    public int order() {
        return 4;
    }
}
