package org.molsel.selCompiler.ir.data;

import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.value.IndexGroup;

import javax.annotation.Nullable;

/** Payload of a root: the group the root evaluates its child with. */
public final class RootData extends ElementData {
    /** Evaluation group; null means evaluate without a group, empty means do not evaluate. */
    @Nullable
    public IndexGroup evalGroup = new IndexGroup();

    @Override
    public ElementType getType() {
        return ElementType.ROOT;
    }

    /** True if evaluating the root would not evaluate anything. */
    public boolean skipsEvaluation() {
        return this.evalGroup != null && this.evalGroup.isEmpty();
    }

    @Override
    public String describe() {
        return this.evalGroup == null ? "(no group)" : this.evalGroup.size() + " atoms";
    }
}
