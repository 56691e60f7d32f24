package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.RootPass;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Reorders the operands of dynamic boolean expressions so that static
 * operands come first.  The relative order of the static operands does
 * not change, and neither does that of the dynamic ones.
 */
public class StaticFirstReorder extends RootPass {
    public StaticFirstReorder(SelectionCompiler compiler) {
        super(compiler);
    }

    void reorder(SelElement element) {
        for (SelElement child: Descent.children(element, false))
            this.reorder(child);
        if (!element.is(ElementType.BOOLEAN) || !element.isDynamic())
            return;
        List<SelElement> staticChildren = new ArrayList<>();
        List<SelElement> dynamicChildren = new ArrayList<>();
        for (SelElement child: element.children()) {
            if (child.isDynamic())
                dynamicChildren.add(child);
            else
                staticChildren.add(child);
        }
        element.children().clear();
        element.children().addAll(staticChildren);
        element.children().addAll(dynamicChildren);
    }

    @Override
    public void processRoot(SelElement root) {
        this.reorder(root);
    }
}
