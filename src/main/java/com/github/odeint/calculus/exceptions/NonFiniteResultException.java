package com.github.odeint.calculus.exceptions;

public class NonFiniteResultException extends RuntimeException {

    private final double time;
    private final int component;

    public NonFiniteResultException(double time, int component, double value) {
        super(String.format("State component %d became %s at t = %s", component, value, time));
        this.time = time;
        this.component = component;
    }

    public double getTime() {
        return time;
    }

    public int getComponent() {
        return component;
    }
}
