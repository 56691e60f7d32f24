package org.molsel.selCompiler.compiler.visitors;

import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.util.IWritesLogs;

/** A compiler pass that transforms a whole forest in place. */
public interface IForestPass extends IWritesLogs {
    void apply(SelectionForest forest);

    /** Name of the pass */
    default String getName() {
        return this.getClass().getSimpleName();
    }
}
