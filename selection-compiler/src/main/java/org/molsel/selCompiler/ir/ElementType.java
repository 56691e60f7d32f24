package org.molsel.selCompiler.ir;

/** The variant of a selection element.  Derived from the element payload. */
public enum ElementType {
    CONST,
    EXPRESSION,
    BOOLEAN,
    ARITHMETIC,
    ROOT,
    SUBEXPR,
    SUBEXPRREF,
    GROUPREF,
    MODIFIER
}
