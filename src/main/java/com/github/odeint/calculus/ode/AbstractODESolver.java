package com.github.odeint.calculus.ode;

import com.github.odeint.calculus.exceptions.DimensionMismatchException;
import com.github.odeint.calculus.exceptions.NonFiniteResultException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class AbstractODESolver implements ODESolver {

    private static final Logger log = LoggerFactory.getLogger(AbstractODESolver.class);

    /**
     * Remainders shorter than this fraction of the current step are folded into the final step
     * instead of producing a sliver step out of rounding noise.
     */
    protected static final double END_SNAP_FRACTION = 1e-9;

    protected final Trajectory startTrajectory(SolverConfig config) {
        log.debug("{}: solving on [{}, {}] with h = {}, dimension {}",
                name(), config.getTimeStart(), config.getTimeEnd(), config.getStepSize(), config.getDimension());
        Trajectory trajectory = new Trajectory();
        reserve(trajectory, config);
        trajectory.append(config.getTimeStart(), config.getInitialState());
        return trajectory;
    }

    protected final void record(Trajectory trajectory, double t, double[] y, SolverConfig config) {
        if (config.isFailOnNonFinite()) {
            for (int i = 0; i < y.length; ++i) {
                if (!Double.isFinite(y[i])) {
                    throw new NonFiniteResultException(t, i, y[i]);
                }
            }
        }
        trajectory.append(t, y);
    }

    protected final Trajectory finish(Trajectory trajectory) {
        log.debug("{}: finished at t = {} with {} points", name(), trajectory.last().getTime(), trajectory.size());
        return trajectory;
    }

    protected static double[] evaluate(DerivativeFunction f, double t, double[] y) {
        double[] dy = f.call(t, y);
        if (dy == null || dy.length != y.length) {
            throw new DimensionMismatchException(y.length, dy == null ? 0 : dy.length, t);
        }
        return dy;
    }

    @Override
    public String toString() {
        return name() + " (order " + order() + ")";
    }
}
