package com.github.odeint.calculus.ode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered sequence of accepted (time, state) samples produced by a single
 * {@link ODESolver#solve} call. Times strictly increase; the first point is the initial
 * condition and the last point lies exactly on the end of the interval.
 */
public final class Trajectory implements Iterable<TrajectoryPoint> {

    private final ArrayList<TrajectoryPoint> points = new ArrayList<>();

    Trajectory() {
    }

    void append(double t, double[] y) {
        points.add(new TrajectoryPoint(t, y));
    }

    void ensureCapacity(int capacity) {
        points.ensureCapacity(capacity);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public TrajectoryPoint get(int i) {
        return points.get(i);
    }

    public TrajectoryPoint first() {
        return points.get(0);
    }

    public TrajectoryPoint last() {
        return points.get(points.size() - 1);
    }

    public double[] getTimes() {
        double[] times = new double[points.size()];
        for (int i = 0; i < times.length; ++i) {
            times[i] = points.get(i).getTime();
        }
        return times;
    }

    public double[] getComponent(int component) {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; ++i) {
            values[i] = points.get(i).getValue(component);
        }
        return values;
    }

    public List<TrajectoryPoint> asList() {
        return Collections.unmodifiableList(points);
    }

    @Override
    public Iterator<TrajectoryPoint> iterator() {
        return asList().iterator();
    }
}
