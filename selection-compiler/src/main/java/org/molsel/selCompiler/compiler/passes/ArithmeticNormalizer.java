package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.errors.InternalCompilerError;
import org.molsel.selCompiler.compiler.errors.UnsupportedExpressionException;
import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.RootPass;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.value.ValueType;

/** Converts integer constants to reals within arithmetic expressions. */
public class ArithmeticNormalizer extends RootPass {
    public ArithmeticNormalizer(SelectionCompiler compiler) {
        super(compiler);
    }

    void normalize(SelElement element) {
        for (SelElement child: Descent.children(element, false))
            this.normalize(child);
        if (!element.is(ElementType.ARITHMETIC))
            return;
        for (SelElement child: element.children()) {
            ValueType type = child.getValueType();
            if (type == ValueType.INT_VALUE) {
                if (!child.is(ElementType.CONST))
                    throw new UnsupportedExpressionException(
                            "Non-constant integer expressions not implemented in arithmetic evaluation", child);
                child.setValue(child.getValue().toReal());
            } else if (type != ValueType.REAL_VALUE) {
                throw new InternalCompilerError("Non-numerical value in arithmetic expression", child);
            }
        }
    }

    @Override
    public void processRoot(SelElement root) {
        this.normalize(root);
    }
}
