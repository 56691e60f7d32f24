package org.molsel.selCompiler.ir.data;

import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.value.IndexGroup;

import javax.annotation.Nullable;

/** Payload of a constant.  Group constants remember the full group they
 * were computed for; evaluation intersects it with the requested group. */
public final class ConstData extends ElementData {
    @Nullable
    public IndexGroup group;

    public ConstData(@Nullable IndexGroup group) {
        this.group = group;
    }

    public ConstData() {
        this(null);
    }

    @Override
    public ElementType getType() {
        return ElementType.CONST;
    }

    @Override
    public String describe() {
        return this.group == null ? "" : this.group.toString();
    }
}
