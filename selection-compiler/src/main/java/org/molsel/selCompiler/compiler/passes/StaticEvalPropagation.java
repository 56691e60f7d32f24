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
 * Clears STATICEVAL on the elements whose evaluation group depends on the frame.
 * Operands of a boolean that follow its first dynamic operand are evaluated
 * for what the previous operands left, so they do not have a static group.
 */
public class StaticEvalPropagation extends RootPass {
    public StaticEvalPropagation(SelectionCompiler compiler) {
        super(compiler);
    }

    static boolean isMethod(SelElement element) {
        return element.is(ElementType.EXPRESSION) || element.is(ElementType.MODIFIER);
    }

    void propagate(SelElement element) {
        // Subexpressions evaluated for their full group always keep a static group.
        if (element.is(ElementType.SUBEXPRREF)
                && this.compiler.annotations().get(element.refTarget()).has(CompilerFlag.FULLEVAL))
            return;
        CompilerData cd = this.compiler.annotations().get(element);
        if (!cd.has(CompilerFlag.STATICEVAL)) {
            for (SelElement child: Descent.children(element, true)) {
                CompilerData childData = this.compiler.annotations().get(child);
                if (!isMethod(element) || child.hasFlag(ElementFlag.ATOMVAL)) {
                    if (childData.has(CompilerFlag.STATICEVAL)) {
                        childData.flags.remove(CompilerFlag.STATICEVAL);
                        this.propagate(child);
                    }
                }
                // Per-atom parameters of a method evaluated for a dynamic group change every frame.
                if (element.isDynamic() && isMethod(element) && child.hasFlag(ElementFlag.ATOMVAL)) {
                    child.flags.add(ElementFlag.DYNAMIC);
                    childData.flags.remove(CompilerFlag.STATIC);
                }
            }
        } else {
            if (element.is(ElementType.BOOLEAN)) {
                boolean afterDynamic = false;
                for (SelElement child: element.children()) {
                    if (afterDynamic)
                        this.compiler.annotations().get(child).flags.remove(CompilerFlag.STATICEVAL);
                    else if (child.isDynamic())
                        afterDynamic = true;
                }
            }
            for (SelElement child: Descent.children(element, true))
                this.propagate(child);
        }
    }

    @Override
    public void processRoot(SelElement root) {
        this.propagate(root);
    }
}
