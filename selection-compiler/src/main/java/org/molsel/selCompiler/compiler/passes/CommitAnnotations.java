package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.ICompilerComponent;
import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.visitors.IForestPass;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.util.Logger;

/** Installs the planned evaluation functions of all annotated elements. */
public class CommitAnnotations implements IForestPass, ICompilerComponent {
    final SelectionCompiler compiler;

    public CommitAnnotations(SelectionCompiler compiler) {
        this.compiler = compiler;
    }

    @Override
    public SelectionCompiler compiler() {
        return this.compiler;
    }

    @Override
    public void apply(SelectionForest forest) {
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Committing ")
                .append(this.compiler.annotations().size())
                .append(" annotations")
                .newline();
        this.compiler.annotations().commit();
    }
}
