package org.molsel.selCompiler.compiler;

import org.molsel.selCompiler.eval.EvaluationContext;
import org.molsel.selCompiler.ir.data.MethodData;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.ir.value.PositionSet;
import org.molsel.selCompiler.ir.value.SelectionValue;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.selCompiler.method.Frame;
import org.molsel.selCompiler.method.MethodFlag;
import org.molsel.selCompiler.method.SelectionMethod;
import org.molsel.selCompiler.method.Topology;

import javax.annotation.Nullable;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/** A small system and a few selection methods used by the compiler tests. */
public final class SelectionFixtures {
    private SelectionFixtures() {}

    public static final int ATOMS = 10;

    /** Ten atoms; atom i has mass i+1, residue i/2 and molecule i/5. */
    public static Topology topology() {
        double[] masses = new double[ATOMS];
        double[] charges = new double[ATOMS];
        int[] residues = new int[ATOMS];
        int[] molecules = new int[ATOMS];
        for (int i = 0; i < ATOMS; i++) {
            masses[i] = i + 1;
            charges[i] = i % 2 == 0 ? 0.5 : -0.5;
            residues[i] = i / 2;
            molecules[i] = i / 5;
        }
        return new Topology(masses, charges, residues, molecules);
    }

    /** Atom i is at x = i + shift. */
    public static Frame frame(double shift) {
        double[] x = new double[ATOMS];
        double[] y = new double[ATOMS];
        double[] z = new double[ATOMS];
        for (int i = 0; i < ATOMS; i++)
            x[i] = i + shift;
        return new Frame(shift, x, y, z);
    }

    public static SelectionCompiler compiler() {
        return new SelectionCompiler(new CompilerOptions(), topology());
    }

    /** A fixed set of atoms, like a residue name keyword. */
    public static final class AtomSet implements SelectionMethod {
        final String name;
        final IndexGroup atoms;
        int initCalls = 0;
        int updateCalls = 0;

        public AtomSet(String name, int... atoms) {
            this.name = name;
            this.atoms = IndexGroup.of(atoms);
        }

        @Override
        public String getName() {
            return this.name;
        }

        @Override
        public ValueType getType() {
            return ValueType.GROUP_VALUE;
        }

        @Override
        public EnumSet<MethodFlag> getFlags() {
            return EnumSet.noneOf(MethodFlag.class);
        }

        @Override
        public void init(@Nullable Topology topology, MethodData data) {
            this.initCalls++;
        }

        @Override
        public void update(EvaluationContext context, MethodData data, IndexGroup group, SelectionValue out) {
            this.updateCalls++;
            IndexGroup.intersection(out.group(), this.atoms, group);
            out.setCount(1);
        }
    }

    /** Atoms with an x coordinate below a limit; depends on the frame. */
    public static final class XBelow implements SelectionMethod {
        final double limit;
        int updateCalls = 0;

        public XBelow(double limit) {
            this.limit = limit;
        }

        @Override
        public String getName() {
            return "x <";
        }

        @Override
        public ValueType getType() {
            return ValueType.GROUP_VALUE;
        }

        @Override
        public EnumSet<MethodFlag> getFlags() {
            return EnumSet.of(MethodFlag.DYNAMIC);
        }

        @Override
        public void update(EvaluationContext context, MethodData data, IndexGroup group, SelectionValue out) {
            this.updateCalls++;
            Frame frame = context.getFrame();
            IndexGroup result = out.group();
            result.clear();
            for (int i = 0; i < group.size(); i++) {
                int atom = group.get(i);
                if (frame.x(atom) < this.limit)
                    result.add(atom);
            }
            out.setCount(1);
        }
    }

    /** All atoms in the same residue as some atom of the group parameter. */
    public static final class SameResidue implements SelectionMethod {
        @Override
        public String getName() {
            return "same residue as";
        }

        @Override
        public ValueType getType() {
            return ValueType.GROUP_VALUE;
        }

        @Override
        public EnumSet<MethodFlag> getFlags() {
            return EnumSet.noneOf(MethodFlag.class);
        }

        @Override
        public void update(EvaluationContext context, MethodData data, IndexGroup group, SelectionValue out) {
            Topology topology = context.topology;
            IndexGroup source = data.params.get(0).value.group();
            Set<Integer> residues = new HashSet<>();
            for (int i = 0; i < source.size(); i++)
                residues.add(topology.residue(source.get(i)));
            IndexGroup result = out.group();
            result.clear();
            for (int i = 0; i < group.size(); i++) {
                int atom = group.get(i);
                if (residues.contains(topology.residue(atom)))
                    result.add(atom);
            }
            out.setCount(1);
        }
    }

    /** A method that claims to produce characters but has a numeric type. */
    public static final class BrokenCharMethod implements SelectionMethod {
        @Override
        public String getName() {
            return "name";
        }

        @Override
        public ValueType getType() {
            return ValueType.REAL_VALUE;
        }

        @Override
        public EnumSet<MethodFlag> getFlags() {
            return EnumSet.of(MethodFlag.CHARVAL);
        }

        @Override
        public void update(EvaluationContext context, MethodData data, IndexGroup group, SelectionValue out) {
            out.setCount(group.size());
        }
    }

    /** Converts a group into positions of a configurable type. */
    public static final class PositionKeyword implements SelectionMethod {
        @Override
        public String getName() {
            return "positions";
        }

        @Override
        public ValueType getType() {
            return ValueType.POS_VALUE;
        }

        @Override
        public EnumSet<MethodFlag> getFlags() {
            return EnumSet.noneOf(MethodFlag.class);
        }

        @Override
        public boolean isPositionKeyword() {
            return true;
        }

        @Override
        public boolean hasUpdate() {
            return false;
        }

        @Override
        public boolean updatesPositions() {
            return true;
        }

        @Override
        public void updatePositions(EvaluationContext context, MethodData data, PositionSet positions, SelectionValue out) {
            out.positions().copyFrom(positions);
            out.setCount(1);
        }
    }
}
