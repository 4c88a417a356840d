package com.github.odeint.calculus.ode;

import java.util.Arrays;

public final class TrajectoryPoint {

    private final double time;
    private final double[] state;

    TrajectoryPoint(double time, double[] state) {
        this.time = time;
        this.state = Arrays.copyOf(state, state.length);
    }

    public double getTime() {
        return time;
    }

    public double[] getState() {
        return getState(true);
    }

    /**
     * @param makeCopy {@code false} hands out the internal array, which callers must not modify
     */
    public double[] getState(boolean makeCopy) {
        return makeCopy ? Arrays.copyOf(state, state.length) : state;
    }

    public double getValue(int i) {
        return state[i];
    }

    public int getDimension() {
        return state.length;
    }

    @Override
    public String toString() {
        return "t=" + time + " y=" + Arrays.toString(state);
    }
}
