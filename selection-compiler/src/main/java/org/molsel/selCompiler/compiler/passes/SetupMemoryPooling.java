package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.RootPass;
import org.molsel.selCompiler.ir.ElementFlag;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;

/**
 * Marks the elements whose value is only needed while the parent is evaluated:
 * dynamic operands of boolean expressions, non-constant operands of arithmetic
 * that have several values, and the bodies of subexpressions referenced more than once.
 * Those elements take their storage from the memory pool.
 */
public class SetupMemoryPooling extends RootPass {
    public SetupMemoryPooling(SelectionCompiler compiler) {
        super(compiler);
    }

    boolean usesPool(SelElement parent, SelElement child) {
        if (parent.is(ElementType.BOOLEAN))
            return child.isDynamic();
        if (parent.is(ElementType.ARITHMETIC))
            return !child.is(ElementType.CONST) && !child.hasFlag(ElementFlag.SINGLEVAL);
        if (parent.is(ElementType.SUBEXPR))
            return this.compiler.forest.refCount(parent) > 2;
        return false;
    }

    void setup(SelElement element) {
        for (SelElement child: Descent.children(element, false)) {
            if (this.usesPool(element, child)) {
                child.mempool = this.compiler.pool;
                // A reference used once shares its storage with the subexpression body.
                SelElement subexpr = child.subexprBelow();
                if (child.is(ElementType.SUBEXPRREF) && subexpr != null
                        && this.compiler.forest.refCount(subexpr) == 2 && subexpr.hasChildren())
                    subexpr.child(0).mempool = this.compiler.pool;
            }
            this.setup(child);
        }
    }

    @Override
    public void processRoot(SelElement root) {
        this.setup(root);
    }
}
