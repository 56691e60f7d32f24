package org.molsel.selCompiler.compiler.annotation;

/** Facts the compiler establishes about an element. */
public enum CompilerFlag {
    /** The element is evaluated once for the maximal group. */
    FULLEVAL,
    /** The value does not depend on the frame. */
    STATIC,
    /** The evaluation group is known before the first frame. */
    STATICEVAL,
    /** The element is evaluated for the largest possible group. */
    EVALMAX,
    /** gmin and gmax are owned by the annotation. */
    MINMAXALLOC,
    /** gmin and gmax are computed during analysis. */
    DOMINMAX,
    /** Subexpression (or reference to one) with a single reference. */
    SIMPLESUBEXPR,
    /** Subexpression evaluated for several groups. */
    COMMONSUBEXPR
}
