package org.molsel.selCompiler.compiler;

import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.data.RootData;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.ir.value.PositionSet;
import org.molsel.selCompiler.ir.value.SelectionValue;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.selCompiler.method.Topology;
import org.molsel.util.IWritesLogs;
import org.molsel.util.Logger;

import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * Computes the mass and charge of every position of the compiled selections.
 * Without a topology every position has mass 1 and charge 0.
 */
final class MassChargeCalculator implements IWritesLogs {
    @Nullable
    final Topology topology;

    MassChargeCalculator(@Nullable Topology topology) {
        this.topology = topology;
    }

    void initialize(Iterable<Selection> selections) {
        for (Selection selection: selections) {
            SelElement expression = selection.root.child(0);
            selection.dynamic = expression.isDynamic();
            SelectionValue value = expression.getValue();
            if (value.type == ValueType.POS_VALUE) {
                this.compute(selection, value.positions(), true);
            } else {
                // A dynamic selection is sized for the largest group it can select.
                IndexGroup group = value.group();
                IndexGroup evalGroup = selection.root.data(RootData.class).evalGroup;
                if (selection.dynamic && evalGroup != null && !evalGroup.isEmpty())
                    group = evalGroup;
                this.compute(selection, group, true);
            }
            if (selection.dynamic && !selection.hasFlag(SelectionFlag.DYNAMIC_MASK)) {
                selection.masses = Arrays.copyOf(selection.originalMasses, selection.originalMasses.length);
                selection.charges = Arrays.copyOf(selection.originalCharges, selection.originalCharges.length);
            } else {
                selection.masses = selection.originalMasses;
                selection.charges = selection.originalCharges;
            }
            Logger.INSTANCE.belowLevel(this, 2)
                    .append("Selection ")
                    .append(selection.name)
                    .append(" has ")
                    .append(selection.originalMasses.length)
                    .append(" positions")
                    .newline();
        }
    }

    /** Update the masses and charges for the positions selected in the current frame. */
    void refresh(Selection selection) {
        if (!selection.dynamic || selection.hasFlag(SelectionFlag.DYNAMIC_MASK))
            return;
        SelectionValue value = selection.root.child(0).getValue();
        if (value.type == ValueType.POS_VALUE)
            this.compute(selection, value.positions(), false);
        else
            this.compute(selection, value.group(), false);
    }

    void compute(Selection selection, IndexGroup group, boolean original) {
        double[] masses = new double[group.size()];
        double[] charges = new double[group.size()];
        for (int i = 0; i < group.size(); i++) {
            int atom = group.get(i);
            masses[i] = this.topology == null ? 1 : this.topology.mass(atom);
            charges[i] = this.topology == null ? 0 : this.topology.charge(atom);
        }
        this.store(selection, masses, charges, original);
    }

    void compute(Selection selection, PositionSet positions, boolean original) {
        double[] masses = new double[positions.count()];
        double[] charges = new double[positions.count()];
        for (int b = 0; b < positions.count(); b++) {
            if (this.topology == null) {
                masses[b] = 1;
                continue;
            }
            for (int atom: positions.atomsOf(b)) {
                masses[b] += this.topology.mass(atom);
                charges[b] += this.topology.charge(atom);
            }
        }
        this.store(selection, masses, charges, original);
    }

    void store(Selection selection, double[] masses, double[] charges, boolean original) {
        if (original) {
            selection.originalMasses = masses;
            selection.originalCharges = charges;
        } else {
            selection.masses = masses;
            selection.charges = charges;
        }
    }
}
