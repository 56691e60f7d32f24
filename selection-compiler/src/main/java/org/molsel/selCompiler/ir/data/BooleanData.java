package org.molsel.selCompiler.ir.data;

import org.molsel.selCompiler.ir.ElementType;

public final class BooleanData extends ElementData {
    public final BoolOp op;

    public BooleanData(BoolOp op) {
        this.op = op;
    }

    @Override
    public ElementType getType() {
        return ElementType.BOOLEAN;
    }

    @Override
    public String describe() {
        return this.op.text;
    }
}
