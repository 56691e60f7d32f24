package org.molsel.selCompiler.ir.data;

public enum ArithOp {
    PLUS("+"),
    MINUS("-"),
    MUL("*"),
    DIV("/"),
    EXP("^"),
    NEG("-");

    public final String text;

    ArithOp(String text) {
        this.text = text;
    }

    public boolean isUnary() {
        return this == NEG;
    }

    public double apply(double left, double right) {
        switch (this) {
            case PLUS:
                return left + right;
            case MINUS:
                return left - right;
            case MUL:
                return left * right;
            case DIV:
                return left / right;
            case EXP:
                return Math.pow(left, right);
            case NEG:
                return -left;
            default:
                throw new IllegalStateException(this.toString());
        }
    }
}
