package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.annotation.CompilerFlag;
import org.molsel.selCompiler.compiler.visitors.RootPass;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.data.RootData;

/** Roots that do not hold a shared subexpression are analyzed for all atoms. */
public class InitEvaluationGroups extends RootPass {
    public InitEvaluationGroups(SelectionCompiler compiler) {
        super(compiler);
    }

    @Override
    public void processRoot(SelElement root) {
        SelElement child = root.child(0);
        if (!child.is(ElementType.SUBEXPR)
                || this.compiler.annotations().get(child).has(CompilerFlag.FULLEVAL))
            root.data(RootData.class).evalGroup = this.compiler.forest.all;
    }
}
