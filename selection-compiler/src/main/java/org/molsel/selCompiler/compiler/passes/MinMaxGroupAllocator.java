package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.annotation.CompilerData;
import org.molsel.selCompiler.compiler.annotation.CompilerFlag;
import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.RootPass;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.ir.value.ValueType;

/**
 * Creates the minimal and maximal evaluation groups of all elements with a value.
 * Static groups are their own bounds; subexpressions evaluated in place
 * share the bounds of their body.
 */
public class MinMaxGroupAllocator extends RootPass {
    public MinMaxGroupAllocator(SelectionCompiler compiler) {
        super(compiler);
    }

    void allocate(SelElement element) {
        for (SelElement child: Descent.children(element, false))
            this.allocate(child);
        if (element.is(ElementType.ROOT) || element.getValueType() == ValueType.NO_VALUE)
            return;
        CompilerData cd = this.compiler.annotations().get(element);
        if (element.getValueType() == ValueType.GROUP_VALUE && cd.has(CompilerFlag.STATIC)) {
            IndexGroup group = element.getValue().group();
            cd.gmin = group;
            cd.gmax = group;
        } else if (element.is(ElementType.SUBEXPR)
                && (cd.has(CompilerFlag.SIMPLESUBEXPR) || cd.has(CompilerFlag.FULLEVAL))) {
            CompilerData body = this.compiler.annotations().get(element.child(0));
            cd.gmin = body.gmin;
            cd.gmax = body.gmax;
        } else {
            cd.flags.add(CompilerFlag.MINMAXALLOC);
            cd.flags.add(CompilerFlag.DOMINMAX);
            cd.gmin = new IndexGroup();
            cd.gmax = new IndexGroup();
        }
    }

    @Override
    public void processRoot(SelElement root) {
        this.allocate(root);
    }
}
