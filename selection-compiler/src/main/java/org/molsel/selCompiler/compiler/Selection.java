package org.molsel.selCompiler.compiler;

import org.molsel.selCompiler.ir.SelElement;

import java.util.EnumSet;

/** A selection requested by the user, evaluated by one root of the forest. */
public final class Selection {
    public final String name;
    public final SelElement root;
    public final EnumSet<SelectionFlag> flags;
    /** Masses and charges of the positions for the maximal group. */
    double[] originalMasses = new double[0];
    double[] originalCharges = new double[0];
    /** Masses and charges of the currently selected positions. */
    double[] masses = new double[0];
    double[] charges = new double[0];
    boolean dynamic;

    Selection(String name, SelElement root, EnumSet<SelectionFlag> flags) {
        this.name = name;
        this.root = root;
        this.flags = flags;
    }

    public boolean isDynamic() {
        return this.dynamic;
    }

    public boolean hasFlag(SelectionFlag flag) {
        return this.flags.contains(flag);
    }

    public double[] getOriginalMasses() {
        return this.originalMasses;
    }

    public double[] getOriginalCharges() {
        return this.originalCharges;
    }

    public double[] getMasses() {
        return this.masses;
    }

    public double[] getCharges() {
        return this.charges;
    }

    /** True if the current masses share the arrays of the original ones. */
    public boolean sharesMassArrays() {
        return this.masses == this.originalMasses;
    }

    @Override
    public String toString() {
        return this.name;
    }
}
