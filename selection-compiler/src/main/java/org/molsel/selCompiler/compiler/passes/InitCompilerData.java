package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.annotation.CompilerAnnotations;
import org.molsel.selCompiler.compiler.annotation.CompilerData;
import org.molsel.selCompiler.compiler.annotation.CompilerFlag;
import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.RootPass;
import org.molsel.selCompiler.ir.ElementFlag;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.data.BoolOp;
import org.molsel.selCompiler.ir.data.BooleanData;

/**
 * Creates the compiler annotation of every element and sets the flags that
 * only depend on the structure of the tree.
 * Subexpressions used as a whole (not per atom) by a method, or directly by a
 * root, must be evaluated once for their maximal group.
 */
public class InitCompilerData extends RootPass {
    public InitCompilerData(SelectionCompiler compiler) {
        super(compiler);
    }

    CompilerAnnotations annotations() {
        return this.compiler.annotations();
    }

    void initialize(SelElement element) {
        CompilerData cd = this.annotations().create(element);
        cd.flags.add(CompilerFlag.STATICEVAL);
        if (!element.isDynamic())
            cd.flags.add(CompilerFlag.STATIC);
        if (element.is(ElementType.SUBEXPR))
            cd.flags.add(CompilerFlag.EVALMAX);

        if (element.is(ElementType.EXPRESSION) || element.is(ElementType.MODIFIER)) {
            for (SelElement child: element.children()) {
                if (child.is(ElementType.SUBEXPRREF) && !child.hasFlag(ElementFlag.ATOMVAL))
                    this.annotations().get(child.refTarget()).flags.add(CompilerFlag.FULLEVAL);
            }
        } else if (element.is(ElementType.ROOT) && element.hasChildren()
                && element.child(0).is(ElementType.SUBEXPRREF)) {
            this.annotations().get(element.child(0).refTarget()).flags.add(CompilerFlag.FULLEVAL);
        }

        for (SelElement child: Descent.children(element, false))
            this.initialize(child);

        if (element.is(ElementType.BOOLEAN)) {
            BoolOp op = element.data(BooleanData.class).op;
            for (SelElement child: element.children()) {
                if (op == BoolOp.AND) {
                    this.annotations().get(child).flags.add(CompilerFlag.EVALMAX);
                } else if (child.is(ElementType.BOOLEAN) && child.data(BooleanData.class).op == BoolOp.NOT) {
                    this.annotations().get(child.child(0)).flags.add(CompilerFlag.EVALMAX);
                }
            }
        } else if (element.is(ElementType.EXPRESSION) || element.is(ElementType.MODIFIER)
                || element.is(ElementType.SUBEXPR)) {
            for (SelElement child: element.children())
                this.annotations().get(child).flags.add(CompilerFlag.EVALMAX);
        }
    }

    @Override
    public void processRoot(SelElement root) {
        this.initialize(root);
    }
}
