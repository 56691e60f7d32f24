package org.molsel.selCompiler.ir.data;

import org.molsel.selCompiler.ir.ElementType;
import org.molsel.util.ICastable;

/** Variant-specific payload of a selection element.
 * Replacing the payload changes the element type while keeping its identity. */
public abstract class ElementData implements ICastable {
    public abstract ElementType getType();

    /** Short description used in tree dumps. */
    public String describe() {
        return "";
    }
}
