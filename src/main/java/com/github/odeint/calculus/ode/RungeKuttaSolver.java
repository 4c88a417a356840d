package com.github.odeint.calculus.ode;

public class RungeKuttaSolver extends AbstractFixedStepSolver {

    private final ButcherTableau tableau;
    private final String name;
    private final int order;

    public static RungeKuttaSolver createMidpoint() {
        return new RungeKuttaSolver(ButcherTableau.MIDPOINT, "RK2 (midpoint)", 2);
    }

    /**
     * Heun's method, the trapezoidal "modified Euler" predictor-corrector.
     */
    public static RungeKuttaSolver createHeun() {
        return new RungeKuttaSolver(ButcherTableau.HEUN, "RK2 (Heun)", 2);
    }

    public static RungeKuttaSolver createRK4() {
        return new RungeKuttaSolver(ButcherTableau.CLASSIC_RK4, "RK4", 4);
    }

    public RungeKuttaSolver() {
        this(ButcherTableau.CLASSIC_RK4, "RK4", 4);
    }

    public RungeKuttaSolver(ButcherTableau tableau, String name, int order) {
        this.tableau = tableau;
        this.name = name;
        this.order = order;
    }

    @Override
    public double[] step(DerivativeFunction f, double t, double[] y, double h) {
        return tableau.advance(y, h, tableau.evaluateStages(f, t, y, h));
    }

    public ButcherTableau getTableau() {
        return tableau;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int order() {
        return order;
    }
}
