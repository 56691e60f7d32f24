package org.molsel.selCompiler.compiler.visitors;

import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;

import java.util.List;

/**
 * Structural descent over selection elements, shared by the recursive passes.
 * Every walk states whether it crosses reference edges: when it does, the
 * target of a SUBEXPRREF is treated as the reference's only child.
 */
public final class Descent {
    private Descent() {}

    public static List<SelElement> children(SelElement element, boolean crossReferences) {
        if (element.is(ElementType.SUBEXPRREF))
            return crossReferences ? List.of(element.refTarget()) : List.of();
        return element.children();
    }
}
