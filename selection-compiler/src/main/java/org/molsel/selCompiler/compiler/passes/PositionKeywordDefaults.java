package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.ICompilerComponent;
import org.molsel.selCompiler.compiler.Selection;
import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.SelectionFlag;
import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.IForestPass;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.selCompiler.ir.data.MethodData;
import org.molsel.selCompiler.method.PositionFlag;
import org.molsel.util.Logger;

import javax.annotation.Nullable;

/**
 * Gives a position type to the position keywords that have none.
 * Keywords reached directly from a selection use the selection default;
 * keywords used as method parameters use the reference default.
 */
public class PositionKeywordDefaults implements IForestPass, ICompilerComponent {
    final SelectionCompiler compiler;

    public PositionKeywordDefaults(SelectionCompiler compiler) {
        this.compiler = compiler;
    }

    @Override
    public SelectionCompiler compiler() {
        return this.compiler;
    }

    @Override
    public void apply(SelectionForest forest) {
        for (Selection selection: this.compiler.getSelections())
            this.initialize(selection.root, selection);
    }

    void initialize(SelElement element, @Nullable Selection selection) {
        if (element.is(ElementType.EXPRESSION)) {
            MethodData data = element.data(MethodData.class);
            if (data.method.isPositionKeyword() && data.positionType == null) {
                if (selection != null) {
                    data.positionType = this.compiler.options.positions.selectionPositions;
                    data.positionFlags.add(PositionFlag.COMPLMAX);
                    if (selection.hasFlag(SelectionFlag.DYNAMIC_MASK))
                        data.positionFlags.add(PositionFlag.MASKONLY);
                    if (selection.hasFlag(SelectionFlag.EVALUATE_VELOCITIES))
                        data.positionFlags.add(PositionFlag.VELOCITIES);
                    if (selection.hasFlag(SelectionFlag.EVALUATE_FORCES))
                        data.positionFlags.add(PositionFlag.FORCES);
                } else {
                    data.positionType = this.compiler.options.positions.referencePositions;
                    data.positionFlags.add(PositionFlag.COMPLWHOLE);
                }
                Logger.INSTANCE.belowLevel(this, 2)
                        .append("Position type of ")
                        .append(element.getDisplayName())
                        .append(" set to ")
                        .append(data.positionType)
                        .newline();
            }
        }
        // Below anything else than these the positions feed a method.
        if (!element.is(ElementType.ROOT) && !element.is(ElementType.MODIFIER)
                && !element.is(ElementType.SUBEXPRREF) && !element.is(ElementType.SUBEXPR))
            selection = null;
        for (SelElement child: Descent.children(element, true))
            this.initialize(child, selection);
    }
}
