package com.github.odeint.calculus.ode;

public class EulerSolver extends AbstractFixedStepSolver {

    @Override
    public double[] step(DerivativeFunction f, double t, double[] y, double h) {
        return addStates(y, evaluate(f, t, y), h);
    }

    @Override
    public String name() {
        return "Euler";
    }

    @Override
    public int order() {
        return 1;
    }
}
