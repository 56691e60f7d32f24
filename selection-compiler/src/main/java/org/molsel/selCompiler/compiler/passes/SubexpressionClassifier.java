package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.annotation.CompilerData;
import org.molsel.selCompiler.compiler.annotation.CompilerFlag;
import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.RootPass;
import org.molsel.selCompiler.ir.ElementFlag;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;

/**
 * Classifies subexpressions as simple (a single reference) or common
 * (several references evaluated for different groups).  Elements evaluated
 * for the group of a common subexpression are common as well.
 */
public class SubexpressionClassifier extends RootPass {
    public SubexpressionClassifier(SelectionCompiler compiler) {
        super(compiler);
    }

    void classify(SelElement element) {
        CompilerData cd = this.compiler.annotations().get(element);
        if (element.is(ElementType.SUBEXPR)) {
            if (this.compiler.forest.refCount(element) == 2)
                cd.flags.add(CompilerFlag.SIMPLESUBEXPR);
            else if (!cd.has(CompilerFlag.FULLEVAL))
                cd.flags.add(CompilerFlag.COMMONSUBEXPR);
        } else if (element.is(ElementType.SUBEXPRREF)
                && this.compiler.forest.refCount(element.refTarget()) == 2) {
            cd.flags.add(CompilerFlag.SIMPLESUBEXPR);
        }

        boolean descend = !element.is(ElementType.SUBEXPRREF)
                || (cd.has(CompilerFlag.COMMONSUBEXPR) && this.compiler.forest.refCount(element.refTarget()) > 2);
        if (!descend)
            return;
        for (SelElement child: Descent.children(element, true)) {
            CompilerData childData = this.compiler.annotations().get(child);
            if (childData.has(CompilerFlag.COMMONSUBEXPR))
                continue;
            if (!element.is(ElementType.EXPRESSION) || child.hasFlag(ElementFlag.ATOMVAL))
                childData.set(CompilerFlag.COMMONSUBEXPR, cd.has(CompilerFlag.COMMONSUBEXPR));
            this.classify(child);
        }
    }

    @Override
    public void processRoot(SelElement root) {
        this.classify(root);
    }
}
