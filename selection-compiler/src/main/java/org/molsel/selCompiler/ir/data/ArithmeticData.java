package org.molsel.selCompiler.ir.data;

import org.molsel.selCompiler.ir.ElementType;

public final class ArithmeticData extends ElementData {
    public final ArithOp op;

    public ArithmeticData(ArithOp op) {
        this.op = op;
    }

    @Override
    public ElementType getType() {
        return ElementType.ARITHMETIC;
    }

    @Override
    public String describe() {
        return this.op.text;
    }
}
