package org.molsel.selCompiler.method;

/** Coordinates of all atoms at one point of a trajectory. */
public final class Frame {
    public final double time;
    final double[] x;
    final double[] y;
    final double[] z;

    public Frame(double time, double[] x, double[] y, double[] z) {
        this.time = time;
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public double x(int atom) {
        return this.x[atom];
    }

    public double y(int atom) {
        return this.y[atom];
    }

    public double z(int atom) {
        return this.z[atom];
    }
}
