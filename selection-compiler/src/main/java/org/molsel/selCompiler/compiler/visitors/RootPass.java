package org.molsel.selCompiler.compiler.visitors;

import org.molsel.selCompiler.compiler.ICompilerComponent;
import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;

import java.util.List;

/** A pass that processes each root of the forest independently, in order. */
public abstract class RootPass implements IForestPass, ICompilerComponent {
    protected final SelectionCompiler compiler;

    protected RootPass(SelectionCompiler compiler) {
        this.compiler = compiler;
    }

    @Override
    public SelectionCompiler compiler() {
        return this.compiler;
    }

    public abstract void processRoot(SelElement root);

    @Override
    public void apply(SelectionForest forest) {
        for (SelElement root: List.copyOf(forest.roots()))
            this.processRoot(root);
    }

    @Override
    public String toString() {
        return this.getName();
    }
}
