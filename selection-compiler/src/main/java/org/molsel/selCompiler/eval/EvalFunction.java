package org.molsel.selCompiler.eval;

/** Production evaluation function of an element. */
public enum EvalFunction {
    /** The element is not evaluated. */
    NONE,
    ROOT,
    /** Intersect a constant group with the evaluation group. */
    STATIC,
    METHOD,
    MODIFIER,
    ARITHMETIC,
    NOT,
    AND,
    OR,
    /** Shared subexpression, evaluated incrementally for growing groups. */
    SUBEXPR,
    /** Subexpression with a single reference, evaluated in place. */
    SUBEXPR_SIMPLE,
    /** Subexpression evaluated once per frame for a fixed group. */
    SUBEXPR_STATICEVAL,
    SUBEXPRREF,
    SUBEXPRREF_SIMPLE
}
