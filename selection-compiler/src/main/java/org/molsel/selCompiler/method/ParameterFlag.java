package org.molsel.selCompiler.method;

public enum ParameterFlag {
    /** One value per atom of the evaluation group. */
    ATOMVAL,
    /** The number of values is not fixed. */
    VARNUM,
    /** The value changes from frame to frame. */
    DYNAMIC
}
