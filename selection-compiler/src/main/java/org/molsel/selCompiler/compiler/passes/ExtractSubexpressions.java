package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.IForestPass;
import org.molsel.selCompiler.ir.ElementFlag;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.util.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves every referenced expression into a subexpression owned by a root of
 * its own.  The new roots are inserted before the root that uses them, nested
 * subexpressions before the subexpressions that contain them, so that each
 * subexpression is evaluated before its first use.
 *
 * <p>A reference is extracted if its target is not a subexpression yet, or is
 * a subexpression without a name; named subexpressions are variables, or
 * were extracted when first reached.
 */
public class ExtractSubexpressions implements IForestPass {
    int counter;

    @Override
    public void apply(SelectionForest forest) {
        this.counter = 0;
        List<SelElement> result = new ArrayList<>();
        for (SelElement root: List.copyOf(forest.roots())) {
            this.extract(forest, root, result);
            result.add(root);
        }
        forest.roots().clear();
        forest.roots().addAll(result);
    }

    static boolean needsExtraction(SelElement child) {
        if (!child.is(ElementType.SUBEXPRREF))
            return false;
        SelElement target = child.refTarget();
        return !target.is(ElementType.SUBEXPR) || target.getName() == null;
    }

    /** Append to 'roots' the roots created for the subexpressions below 'element'. */
    void extract(SelectionForest forest, SelElement element, List<SelElement> roots) {
        for (SelElement child: Descent.children(element, true)) {
            this.extract(forest, child, roots);
            if (!needsExtraction(child))
                continue;
            SelElement target = child.refTarget();
            SelElement subexpr;
            if (target.is(ElementType.SUBEXPR)) {
                subexpr = target;
            } else {
                subexpr = forest.subexpr(target, null);
                forest.retarget(child, subexpr);
            }
            subexpr.setName("SubExpr " + ++this.counter);
            subexpr.flags.remove(ElementFlag.DYNAMIC);
            subexpr.flags.removeAll(ElementFlag.VALUE_FLAGS);
            for (ElementFlag flag: child.flags)
                if (flag == ElementFlag.DYNAMIC || ElementFlag.VALUE_FLAGS.contains(flag))
                    subexpr.flags.add(flag);
            SelElement root = forest.root(null, subexpr);
            roots.add(root);
            Logger.INSTANCE.belowLevel(this, 2)
                    .append("Extracted ")
                    .append(subexpr.getDisplayName())
                    .append(" with ")
                    .append(forest.refCount(subexpr))
                    .append(" references")
                    .newline();
        }
    }
}
