package org.molsel.selCompiler.eval;

import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.value.IndexGroup;

import javax.annotation.Nullable;

/** Receives evaluation requests made in {@link EvalMode#ANALYSIS} mode. */
public interface IElementAnalyzer {
    void analyze(SelElement element, @Nullable IndexGroup group);

    /** False if the element must be skipped in the current analysis walk. */
    boolean isEnabled(SelElement element);
}
