package org.molsel.selCompiler.method;

import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.ir.value.PositionSet;
import org.molsel.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/** Computes positions (single atoms or centers of residues/molecules) for a group of atoms. */
public final class PositionCalculation {
    public final PositionType type;
    private final EnumSet<PositionFlag> flags;
    @Nullable
    private IndexGroup maxIndex;
    @Nullable
    private final Topology topology;

    PositionCalculation(PositionType type, EnumSet<PositionFlag> flags, @Nullable Topology topology) {
        this.type = type;
        this.flags = EnumSet.copyOf(flags);
        this.topology = topology;
    }

    public EnumSet<PositionFlag> getFlags() {
        return this.flags;
    }

    public void setFlags(EnumSet<PositionFlag> flags) {
        this.flags.clear();
        this.flags.addAll(flags);
    }

    public void setMaxIndex(IndexGroup group) {
        this.maxIndex = group.copy();
    }

    @Nullable
    public IndexGroup getMaxIndex() {
        return this.maxIndex;
    }

    int blockOf(int atom) {
        switch (this.type) {
            case ATOM:
                return atom;
            case RES_COM:
            case RES_COG:
                return Utilities.enforceNotNull(this.topology, "Residue positions need a topology").residue(atom);
            default:
                return Utilities.enforceNotNull(this.topology, "Molecule positions need a topology").molecule(atom);
        }
    }

    /** Size the output so that it can hold the positions of the maximal group. */
    public void initPositions(PositionSet positions) {
        IndexGroup max = Utilities.enforceNotNull(this.maxIndex, "Maximal group not set");
        positions.reserve(max.size());
        positions.group.reserve(max.size());
    }

    /** Compute the positions for the atoms in 'group'.
     * Atoms of the same block must be contiguous in the group. */
    public void update(Frame frame, IndexGroup group, PositionSet out) {
        out.clear();
        int i = 0;
        while (i < group.size()) {
            int block = this.blockOf(group.get(i));
            List<Integer> atoms = new ArrayList<>();
            double x = 0, y = 0, z = 0, total = 0;
            while (i < group.size() && this.blockOf(group.get(i)) == block) {
                int atom = group.get(i);
                double weight = this.type.usesMass() ? Utilities.enforceNotNull(this.topology, "").mass(atom) : 1;
                x += weight * frame.x(atom);
                y += weight * frame.y(atom);
                z += weight * frame.z(atom);
                total += weight;
                atoms.add(atom);
                i++;
            }
            int[] members = atoms.stream().mapToInt(Integer::intValue).toArray();
            out.add(x / total, y / total, z / total, members);
        }
    }

    @Override
    public String toString() {
        return this.type.text + this.flags;
    }
}
