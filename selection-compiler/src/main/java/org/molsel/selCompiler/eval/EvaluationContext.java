package org.molsel.selCompiler.eval;

import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.method.Frame;
import org.molsel.selCompiler.method.Topology;
import org.molsel.util.Utilities;

import javax.annotation.Nullable;

/** Everything an evaluation needs besides the element itself. */
public final class EvaluationContext {
    public final EvalMode mode;
    public final MemoryPool pool;
    /** Group of all atoms. */
    public final IndexGroup all;
    @Nullable
    public final Topology topology;
    @Nullable
    private Frame frame;
    @Nullable
    private final IElementAnalyzer analyzer;

    EvaluationContext(EvalMode mode, MemoryPool pool, IndexGroup all,
                      @Nullable Topology topology, @Nullable IElementAnalyzer analyzer) {
        this.mode = mode;
        this.pool = pool;
        this.all = all;
        this.topology = topology;
        this.analyzer = analyzer;
    }

    public static EvaluationContext forAnalysis(MemoryPool pool, IndexGroup all,
                                                @Nullable Topology topology, IElementAnalyzer analyzer) {
        return new EvaluationContext(EvalMode.ANALYSIS, pool, all, topology, analyzer);
    }

    public static EvaluationContext forProduction(MemoryPool pool, IndexGroup all, @Nullable Topology topology) {
        return new EvaluationContext(EvalMode.PRODUCTION, pool, all, topology, null);
    }

    public IElementAnalyzer getAnalyzer() {
        return Utilities.enforceNotNull(this.analyzer, "No analyzer in " + this.mode + " mode");
    }

    public void setFrame(@Nullable Frame frame) {
        this.frame = frame;
    }

    public Frame getFrame() {
        return Utilities.enforceNotNull(this.frame, "Evaluation requires a frame");
    }

    @Nullable
    public Frame getFrameOrNull() {
        return this.frame;
    }
}
