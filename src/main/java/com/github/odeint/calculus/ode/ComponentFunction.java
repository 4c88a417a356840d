package com.github.odeint.calculus.ode;

@FunctionalInterface
public interface ComponentFunction {

    double call(double t, double[] y);

}
