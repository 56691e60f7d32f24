package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.visitors.IForestPass;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.util.Logger;

import java.util.List;

/**
 * Removes the roots of subexpressions that are only referenced by their own root.
 * Roots are scanned from last to first: removing a root releases the
 * references it contains, which may leave an earlier subexpression unused.
 */
public class RemoveUnusedSubexpressions implements IForestPass {
    @Override
    public void apply(SelectionForest forest) {
        List<SelElement> roots = forest.roots();
        for (int i = roots.size() - 1; i >= 0; i--) {
            SelElement root = roots.get(i);
            if (!root.hasChildren())
                continue;
            SelElement child = root.child(0);
            if (child.is(ElementType.SUBEXPR) && forest.refCount(child) == 1) {
                Logger.INSTANCE.belowLevel(this, 2)
                        .append("Removing unused ")
                        .append(child.getDisplayName())
                        .newline();
                forest.removeRoot(root);
            }
        }
    }
}
