package org.molsel.selCompiler.method;

/** Properties declared by a selection method. */
public enum MethodFlag {
    /** The result depends on the frame even if all parameters are static. */
    DYNAMIC,
    /** The method produces a single value for the whole group. */
    SINGLEVAL,
    /** The number of values is computed by the method. */
    VARNUMVAL,
    /** The method produces strings. */
    CHARVAL,
    /** The method transforms positions instead of selecting atoms. */
    MODIFIER
}
