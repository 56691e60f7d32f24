package org.molsel.selCompiler.method;

import org.molsel.selCompiler.ir.value.SelectionValue;
import org.molsel.selCompiler.ir.value.ValueType;

import java.util.EnumSet;

/** A formal parameter of a selection method together with the value bound to it. */
public final class MethodParameter {
    public final String name;
    public final EnumSet<ParameterFlag> flags;
    /** Value seen by the method; may alias the storage of the element that computes it. */
    public final SelectionValue value;

    public MethodParameter(String name, ValueType type, EnumSet<ParameterFlag> flags) {
        this.name = name;
        this.flags = flags;
        this.value = new SelectionValue(type);
    }

    public MethodParameter(String name, ValueType type) {
        this(name, type, EnumSet.noneOf(ParameterFlag.class));
    }

    public boolean isAtomValued() {
        return this.flags.contains(ParameterFlag.ATOMVAL);
    }

    public ValueType getType() {
        return this.value.type;
    }

    @Override
    public String toString() {
        return this.name;
    }
}
