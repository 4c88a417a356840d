package com.github.odeint.calculus.ode;

import java.util.Arrays;

/**
 * Coefficients of an explicit Runge-Kutta method.
 * <p>
 * Stage {@code s} is evaluated at {@code t + c[s] h} on {@code y + h * sum(a[s][j] k[j], j < s)};
 * the step result is {@code y + h * sum(b[s] k[s])}. Entries of {@code a[s]} at or past index
 * {@code s} are ignored, so rows may be padded with zeros.
 */
public final class ButcherTableau {

    public static final ButcherTableau MIDPOINT = new ButcherTableau(
            new double[][] {
                    {0},
                    {.5},
            },
            new double[] {0, 1},
            new double[] {0, .5});

    public static final ButcherTableau HEUN = new ButcherTableau(
            new double[][] {
                    {0},
                    {1},
            },
            new double[] {.5, .5},
            new double[] {0, 1});

    public static final ButcherTableau CLASSIC_RK4 = new ButcherTableau(
            new double[][] {
                    {0, 0, 0},
                    {.5, 0, 0},
                    {0, .5, 0},
                    {0, 0, 1}},
            new double[] {1.0 / 6, 2.0 / 6, 2.0 / 6, 1.0 / 6},
            new double[] {0, .5, .5, 1});

    private final double[][] a;
    private final double[] b;
    private final double[] c;

    public ButcherTableau(double[][] a, double[] b, double[] c) {
        if (a.length != b.length || b.length != c.length) {
            throw new IllegalArgumentException(String.format(
                    "Inconsistent tableau: %d rows, %d weights, %d nodes", a.length, b.length, c.length));
        }
        for (int s = 0; s < a.length; ++s) {
            if (a[s].length < s) {
                throw new IllegalArgumentException("Row " + s + " of a needs at least " + s + " entries");
            }
        }
        this.a = new double[a.length][];
        for (int s = 0; s < a.length; ++s) {
            this.a[s] = Arrays.copyOf(a[s], a[s].length);
        }
        this.b = Arrays.copyOf(b, b.length);
        this.c = Arrays.copyOf(c, c.length);
    }

    public int getStages() {
        return b.length;
    }

    public double[] getWeights() {
        return Arrays.copyOf(b, b.length);
    }

    /**
     * Evaluates all stage slopes {@code k[0..stages-1]} of one step.
     */
    double[][] evaluateStages(DerivativeFunction f, double t, double[] y, double h) {
        double[][] k = new double[b.length][];
        for (int s = 0; s < k.length; ++s) {
            double[] yStage = s == 0 ? y : combine(y, h, k, a[s], s);
            k[s] = AbstractODESolver.evaluate(f, t + c[s] * h, yStage);
        }
        return k;
    }

    double[] advance(double[] y, double h, double[][] k) {
        return combine(y, h, k, b, k.length);
    }

    /**
     * {@code y + h * sum(weights[j] k[j], j < count)}; zero weights are skipped.
     */
    static double[] combine(double[] y, double h, double[][] k, double[] weights, int count) {
        double[] result = Arrays.copyOf(y, y.length);
        for (int j = 0; j < count; ++j) {
            if (weights[j] == 0) {
                continue;
            }
            double scale = h * weights[j];
            for (int i = 0; i < result.length; ++i) {
                result[i] += scale * k[j][i];
            }
        }
        return result;
    }
}
