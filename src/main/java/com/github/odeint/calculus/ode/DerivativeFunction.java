package com.github.odeint.calculus.ode;

/**
 * Right-hand side {@code dy/dt = f(t, y)} of an ODE system.
 * <p>
 * Implementations must be deterministic, must not modify {@code y}, and must return a fresh
 * array with the same number of components as {@code y}. Solvers may call the function any
 * number of times per step.
 */
@FunctionalInterface
public interface DerivativeFunction {

    double[] call(double t, double[] y);

    /**
     * Assembles a vector derivative from one scalar function per state component.
     * Component {@code i} of the result is {@code functions[i].call(t, y)}.
     */
    static DerivativeFunction ofComponents(final ComponentFunction... functions) {
        final ComponentFunction[] copy = functions.clone();
        return new DerivativeFunction() {
            @Override
            public double[] call(double t, double[] y) {
                double[] dy = new double[copy.length];
                for (int i = 0; i < copy.length; ++i) {
                    dy[i] = copy[i].call(t, y);
                }
                return dy;
            }
        };
    }
}
