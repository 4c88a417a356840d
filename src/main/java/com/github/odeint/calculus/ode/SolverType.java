package com.github.odeint.calculus.ode;

public enum SolverType {

    EULER {
        @Override
        public ODESolver create() {
            return new EulerSolver();
        }
    },
    RK2 {
        @Override
        public ODESolver create() {
            return RungeKuttaSolver.createMidpoint();
        }
    },
    HEUN {
        @Override
        public ODESolver create() {
            return RungeKuttaSolver.createHeun();
        }
    },
    RK4 {
        @Override
        public ODESolver create() {
            return RungeKuttaSolver.createRK4();
        }
    },
    RK45 {
        @Override
        public ODESolver create() {
            return new RungeKuttaFehlbergSolver();
        }

        @Override
        public boolean isAdaptive() {
            return true;
        }
    };

    public abstract ODESolver create();

    public boolean isAdaptive() {
        return false;
    }
}
