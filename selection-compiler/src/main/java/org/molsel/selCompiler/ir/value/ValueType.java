package org.molsel.selCompiler.ir.value;

/** Kind of data computed by a selection element. */
public enum ValueType {
    NO_VALUE,
    INT_VALUE,
    REAL_VALUE,
    STR_VALUE,
    POS_VALUE,
    GROUP_VALUE;

    public boolean isScalar() {
        return this == INT_VALUE || this == REAL_VALUE || this == STR_VALUE;
    }

    public boolean isNumeric() {
        return this == INT_VALUE || this == REAL_VALUE;
    }
}
