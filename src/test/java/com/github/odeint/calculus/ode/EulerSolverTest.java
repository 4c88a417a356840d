package com.github.odeint.calculus.ode;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.odeint.calculus.exceptions.DimensionMismatchException;
import com.github.odeint.calculus.exceptions.NonFiniteResultException;
import org.junit.jupiter.api.Test;

class EulerSolverTest {

    private final EulerSolver solver = new EulerSolver();

    @Test
    void stepAddsScaledDerivative() {
        double[] y = {10.0};
        double[] next = solver.step(Problems.decay(0.5), 0.0, y, 0.1);

        assertArrayEquals(new double[] {9.5}, next, 1e-15);
        assertArrayEquals(new double[] {10.0}, y, 0.0);
    }

    @Test
    void describesItself() {
        assertEquals("Euler", solver.name());
        assertEquals(1, solver.order());
    }

    @Test
    void decayToFiveHasFirstOrderError() throws Exception {
        SolverConfig config = Problems.config(0.0, 5.0, 0.1, 10.0);
        double exact = 10.0 * Math.exp(-2.5);

        Trajectory trajectory = solver.solve(Problems.decay(0.5), config);
        double error = Math.abs(trajectory.last().getValue(0) - exact);

        assertEquals(51, trajectory.size());
        assertEquals(5.0, trajectory.last().getTime(), 0.0);
        // 10 * 0.95^50
        assertEquals(10.0 * Math.pow(0.95, 50), trajectory.last().getValue(0), 1e-12);
        assertTrue(error > 0.01 && error < 0.1, "error " + error);
    }

    @Test
    void halvingTheStepHalvesTheError() throws Exception {
        double exact = Math.exp(-1.0);
        double[] steps = {0.1, 0.05, 0.025};
        double[] errors = new double[steps.length];
        for (int i = 0; i < steps.length; ++i) {
            errors[i] = Problems.terminalError(solver, Problems.decay(1.0),
                    Problems.config(0.0, 1.0, steps[i], 1.0), exact);
        }
        for (int i = 0; i < errors.length - 1; ++i) {
            double ratio = errors[i] / errors[i + 1];
            assertTrue(ratio > 1.8 && ratio < 2.2, "ratio " + ratio);
        }
    }

    @Test
    void smallerStepIsMoreAccurate() throws Exception {
        double exact = Math.exp(-1.0);
        double coarse = Problems.terminalError(solver, Problems.decay(1.0), Problems.config(0, 1, 0.1, 1.0), exact);
        double fine = Problems.terminalError(solver, Problems.decay(1.0), Problems.config(0, 1, 0.01, 1.0), exact);

        assertTrue(fine < coarse);
        assertTrue(fine < 0.01);
    }

    @Test
    void lastStepIsClampedToTheEndTime() throws Exception {
        Trajectory trajectory = solver.solve(Problems.decay(1.0), Problems.config(0.0, 1.0, 0.3, 1.0));

        assertEquals(5, trajectory.size());
        assertEquals(1.0, trajectory.last().getTime(), 0.0);
        double[] times = trajectory.getTimes();
        assertEquals(0.1, times[4] - times[3], 1e-12);
    }

    @Test
    void stepCountIsCeilingOfIntervalOverStep() throws Exception {
        assertEquals(11, solver.solve(Problems.decay(1.0), Problems.config(0.0, 1.0, 0.1, 1.0)).size());
        assertEquals(4, solver.solve(Problems.decay(1.0), Problems.config(2.0, 2.25, 0.1, 1.0)).size());
    }

    @Test
    void negligibleRemainderIsAbsorbedByTheLastStep() throws Exception {
        Trajectory trajectory = solver.solve(Problems.decay(1.0), Problems.config(0.0, 1.0 + 1e-11, 0.1, 1.0));

        assertEquals(11, trajectory.size());
        assertEquals(1.0 + 1e-11, trajectory.last().getTime(), 0.0);
        assertEquals(0.9, trajectory.get(9).getTime(), 1e-15);
    }

    @Test
    void emptyIntervalYieldsOnlyTheInitialCondition() throws Exception {
        Trajectory trajectory = solver.solve(Problems.decay(1.0), Problems.config(3.0, 3.0, 0.1, 7.0));

        assertEquals(1, trajectory.size());
        assertEquals(3.0, trajectory.first().getTime(), 0.0);
        assertEquals(7.0, trajectory.first().getValue(0), 0.0);
    }

    @Test
    void nonFiniteDerivativesPropagateUnlessRequestedOtherwise() throws Exception {
        DerivativeFunction blowUp = (t, y) -> new double[] {t > 0.25 ? Double.NaN : 1.0};
        SolverConfig config = Problems.config(0.0, 1.0, 0.1, 0.0);

        Trajectory trajectory = solver.solve(blowUp, config);
        assertTrue(Double.isNaN(trajectory.last().getValue(0)));

        NonFiniteResultException e = assertThrows(NonFiniteResultException.class,
                () -> solver.solve(blowUp, config.toBuilder().failOnNonFinite(true).build()));
        assertEquals(0, e.getComponent());
        assertEquals(0.4, e.getTime(), 1e-12);
    }

    @Test
    void derivativeOfWrongDimensionIsRejected() throws Exception {
        DerivativeFunction wrong = (t, y) -> new double[] {1.0, 2.0};

        DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
                () -> solver.solve(wrong, Problems.config(0.0, 1.0, 0.1, 0.0)));
        assertEquals(1, e.getExpected());
        assertEquals(2, e.getActual());
    }

    @Test
    void timesKeepIncreasingFarFromTheOrigin() throws Exception {
        double start = 1e8;
        double end = 1e8 + 1e-5;
        SolverConfig config = Problems.config(0.0, 1.0, 1e-7, 1.0).toBuilder()
                .interval(start, end)
                .minStep(1e-7)
                .build();
        Trajectory trajectory = solver.solve(Problems.decay(1.0), config);

        double[] times = trajectory.getTimes();
        for (int i = 1; i < times.length; ++i) {
            assertTrue(times[i] > times[i - 1], "time did not advance at " + i);
        }
        assertEquals(end, trajectory.last().getTime(), 0.0);
        assertTrue(trajectory.size() >= 101, trajectory.size() + " points");
    }
}
