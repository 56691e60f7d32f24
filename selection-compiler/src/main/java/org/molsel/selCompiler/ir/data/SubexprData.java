package org.molsel.selCompiler.ir.data;

import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.value.IndexGroup;

/** Payload of a shared subexpression: the group it has already been evaluated for. */
public final class SubexprData extends ElementData {
    public final IndexGroup evalGroup = new IndexGroup();
    /** Set when the subexpression was evaluated without a group. */
    public boolean evaluatedWithoutGroup = false;

    @Override
    public ElementType getType() {
        return ElementType.SUBEXPR;
    }

    public boolean notEvaluated() {
        return this.evalGroup.isEmpty() && !this.evaluatedWithoutGroup;
    }

    public void reset() {
        this.evalGroup.clear();
        this.evaluatedWithoutGroup = false;
    }

    @Override
    public String describe() {
        return this.evaluatedWithoutGroup ? "(no group)" : this.evalGroup.size() + " atoms";
    }
}
