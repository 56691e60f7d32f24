package org.molsel.selCompiler.ir.value;

import org.molsel.util.Utilities;

import java.util.Arrays;

/**
 * A set of 3D positions.  Position i is computed from the atoms
 * group[blockStart[i]] .. group[blockStart[i+1]-1].
 */
public final class PositionSet {
    private int count;
    private double[] coordinates;
    private int[] blockStart;
    /** All atoms that contribute to some position. */
    public final IndexGroup group;

    public PositionSet() {
        this.count = 0;
        this.coordinates = new double[0];
        this.blockStart = new int[] { 0 };
        this.group = new IndexGroup();
    }

    public int count() {
        return this.count;
    }

    public void reserve(int positions) {
        if (this.blockStart.length >= positions + 1)
            return;
        this.coordinates = Arrays.copyOf(this.coordinates, 3 * positions);
        this.blockStart = Arrays.copyOf(this.blockStart, positions + 1);
    }

    public int capacity() {
        return this.blockStart.length - 1;
    }

    public void clear() {
        this.count = 0;
        this.group.clear();
    }

    /** Append a position built from the atoms in 'atoms', which must follow all previous atoms. */
    public void add(double x, double y, double z, int[] atoms) {
        this.reserve(this.count + 1);
        this.coordinates[3 * this.count] = x;
        this.coordinates[3 * this.count + 1] = y;
        this.coordinates[3 * this.count + 2] = z;
        for (int a: atoms)
            this.group.add(a);
        this.count++;
        this.blockStart[this.count] = this.group.size();
    }

    public double x(int position) {
        Utilities.enforce(position < this.count);
        return this.coordinates[3 * position];
    }

    public double y(int position) {
        Utilities.enforce(position < this.count);
        return this.coordinates[3 * position + 1];
    }

    public double z(int position) {
        Utilities.enforce(position < this.count);
        return this.coordinates[3 * position + 2];
    }

    /** Atoms that contribute to the given position. */
    public int[] atomsOf(int position) {
        Utilities.enforce(position < this.count);
        int[] result = new int[this.blockStart[position + 1] - this.blockStart[position]];
        for (int i = 0; i < result.length; i++)
            result[i] = this.group.get(this.blockStart[position] + i);
        return result;
    }

    public void copyFrom(PositionSet other) {
        this.reserve(other.count);
        System.arraycopy(other.coordinates, 0, this.coordinates, 0, 3 * other.count);
        System.arraycopy(other.blockStart, 0, this.blockStart, 0, other.count + 1);
        this.group.copyFrom(other.group);
        this.count = other.count;
    }

    @Override
    public String toString() {
        return "positions(" + this.count + ") of " + this.group;
    }
}
