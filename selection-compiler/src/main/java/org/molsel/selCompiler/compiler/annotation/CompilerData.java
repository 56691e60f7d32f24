package org.molsel.selCompiler.compiler.annotation;

import org.molsel.selCompiler.eval.EvalFunction;
import org.molsel.selCompiler.ir.value.IndexGroup;

import javax.annotation.Nullable;
import java.util.EnumSet;

/** Compile-time annotation of one element. */
public final class CompilerData {
    public final EnumSet<CompilerFlag> flags = EnumSet.noneOf(CompilerFlag.class);
    /** Evaluation function the element will use after compilation. */
    public EvalFunction evaluator;
    /** Atoms that are always selected, for dynamic group-valued elements. */
    @Nullable
    public IndexGroup gmin;
    /** Atoms that may be selected. */
    @Nullable
    public IndexGroup gmax;
    /** Set when the element must be skipped by the current analysis walk. */
    public boolean analysisDisabled = false;

    public CompilerData(EvalFunction evaluator) {
        this.evaluator = evaluator;
    }

    public boolean has(CompilerFlag flag) {
        return this.flags.contains(flag);
    }

    public void set(CompilerFlag flag, boolean value) {
        if (value)
            this.flags.add(flag);
        else
            this.flags.remove(flag);
    }

    @Override
    public String toString() {
        return this.flags + " " + this.evaluator
                + (this.gmin != null ? " gmin=" + this.gmin : "")
                + (this.gmax != null ? " gmax=" + this.gmax : "");
    }
}
