package org.molsel.selCompiler.compiler.errors;

import org.molsel.selCompiler.ir.SelElement;

/** Exception thrown when the compiler encounters a legal expression
 * that it cannot evaluate, e.g., XOR or arithmetic over per-frame integers. */
public class UnsupportedExpressionException extends BaseCompilerException {
    public static final String KIND = "Unsupported expression";

    public UnsupportedExpressionException(String message) {
        super(message, null);
    }

    public UnsupportedExpressionException(String message, SelElement element) {
        super(describe(message, element), element);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
