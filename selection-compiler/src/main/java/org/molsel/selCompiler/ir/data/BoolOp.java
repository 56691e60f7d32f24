package org.molsel.selCompiler.ir.data;

public enum BoolOp {
    AND("and"),
    OR("or"),
    NOT("not"),
    XOR("xor");

    public final String text;

    BoolOp(String text) {
        this.text = text;
    }
}
