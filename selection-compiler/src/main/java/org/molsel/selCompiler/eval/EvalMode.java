package org.molsel.selCompiler.eval;

public enum EvalMode {
    /** Compile-time evaluation; elements are dispatched to the analyzer. */
    ANALYSIS,
    /** Per-frame evaluation using the compiled evaluation functions. */
    PRODUCTION
}
