package org.molsel.selCompiler.ir;

import java.util.EnumSet;

/** Structural properties of an element, set when the tree is built and
 * maintained by the compiler. */
public enum ElementFlag {
    /** The value may change from frame to frame. */
    DYNAMIC,
    /** The element computes a single value. */
    SINGLEVAL,
    /** The element computes one value per atom of its evaluation group. */
    ATOMVAL,
    /** The number of values is decided by the element itself. */
    VARNUMVAL,
    /** The value store is owned by the element. */
    ALLOCVAL,
    /** The data inside the value store is owned by the element. */
    ALLOCDATA,
    /** The method frame initialization hook must be called. */
    INITFRAME,
    /** The element has already been evaluated for the current frame. */
    EVALFRAME,
    /** The method has been initialized. */
    METHODINIT,
    /** The method output has been initialized. */
    OUTINIT;

    /** Flags that describe the shape of a value. */
    public static final EnumSet<ElementFlag> VALUE_FLAGS = EnumSet.of(SINGLEVAL, ATOMVAL, VARNUMVAL);
}
