package org.molsel.selCompiler.compiler;

/** Options of a user-visible selection. */
public enum SelectionFlag {
    /** Positions of a dynamic selection keep their identity; only a mask changes. */
    DYNAMIC_MASK,
    EVALUATE_VELOCITIES,
    EVALUATE_FORCES
}
