package com.github.odeint.calculus.ode;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ODESolverTest {

    private final ODESolver solver = new EulerSolver();

    @Test
    void addStatesScalesTheSecondOperand() {
        double[] a = {1.0, 2.0, 3.0};
        double[] b = {0.5, -1.0, 4.0};

        assertArrayEquals(new double[] {1.25, 1.5, 5.0}, solver.addStates(a, b, 0.5), 0.0);
        assertArrayEquals(new double[] {1.5, 1.0, 7.0}, solver.addStates(a, b), 0.0);
        assertArrayEquals(new double[] {1.0, 2.0, 3.0}, a, 0.0);
    }

    @Test
    void reserveIsOnlyAHint() throws Exception {
        Trajectory huge = new Trajectory();
        solver.reserve(huge, Problems.config(0.0, 1e5, 1e-7, 1.0));
        Trajectory empty = new Trajectory();
        solver.reserve(empty, Problems.config(1.0, 1.0, 0.5, 1.0));

        assertEquals(0, huge.size());
        assertEquals(0, empty.size());
    }
}
