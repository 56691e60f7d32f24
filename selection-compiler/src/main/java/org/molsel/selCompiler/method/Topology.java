package org.molsel.selCompiler.method;

import org.molsel.util.Utilities;

/** Static information about the atoms of the system. */
public final class Topology {
    private final double[] masses;
    private final double[] charges;
    private final int[] residues;
    private final int[] molecules;

    public Topology(double[] masses, double[] charges, int[] residues, int[] molecules) {
        Utilities.enforce(masses.length == charges.length
                && masses.length == residues.length
                && masses.length == molecules.length, "Inconsistent topology arrays");
        this.masses = masses;
        this.charges = charges;
        this.residues = residues;
        this.molecules = molecules;
    }

    public int atomCount() {
        return this.masses.length;
    }

    public double mass(int atom) {
        return this.masses[atom];
    }

    public double charge(int atom) {
        return this.charges[atom];
    }

    public int residue(int atom) {
        return this.residues[atom];
    }

    public int molecule(int atom) {
        return this.molecules[atom];
    }
}
