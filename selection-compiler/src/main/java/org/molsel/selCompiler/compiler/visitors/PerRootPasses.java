package org.molsel.selCompiler.compiler.visitors;

import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.util.Linq;
import org.molsel.util.Logger;

import java.util.Arrays;
import java.util.List;

/** Runs a sequence of root passes on the first root, then on the second root, etc.
 * Later roots can rely on all passes having completed for earlier roots. */
public class PerRootPasses implements IForestPass {
    public final List<RootPass> passes;
    final String name;

    public PerRootPasses(String name, RootPass... passes) {
        this.name = name;
        this.passes = Arrays.asList(passes);
    }

    @Override
    public void apply(SelectionForest forest) {
        Logger.INSTANCE.belowLevel(this, 2)
                .append(this.name)
                .append(" running ")
                .join(", ", Linq.map(this.passes, RootPass::getName))
                .newline();
        for (SelElement root: List.copyOf(forest.roots())) {
            for (RootPass pass: this.passes)
                pass.processRoot(root);
        }
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public String toString() {
        return this.name;
    }
}
