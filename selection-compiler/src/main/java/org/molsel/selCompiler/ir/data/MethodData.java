package org.molsel.selCompiler.ir.data;

import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.method.MethodParameter;
import org.molsel.selCompiler.method.PositionCalculation;
import org.molsel.selCompiler.method.PositionFlag;
import org.molsel.selCompiler.method.SelectionMethod;
import org.molsel.selCompiler.ir.value.PositionSet;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/** Payload of an invocation of a selection method, either an expression or a modifier. */
public final class MethodData extends ElementData {
    public final SelectionMethod method;
    public final boolean modifier;
    public final List<MethodParameter> params;
    /** Per-invocation state created by the method. */
    @Nullable
    public Object state;
    /** Position calculation used to feed methods that work on positions. */
    @Nullable
    public PositionCalculation positionCalculation;
    @Nullable
    public PositionSet positions;
    /** Position type of a position keyword; null until assigned. */
    @Nullable
    public String positionType;
    public final EnumSet<PositionFlag> positionFlags = EnumSet.noneOf(PositionFlag.class);

    public MethodData(SelectionMethod method, boolean modifier, List<MethodParameter> params) {
        this.method = method;
        this.modifier = modifier;
        this.params = new ArrayList<>(params);
    }

    @Override
    public ElementType getType() {
        return this.modifier ? ElementType.MODIFIER : ElementType.EXPRESSION;
    }

    @Override
    public String describe() {
        String result = this.method.getName();
        if (this.positionType != null)
            result += " " + this.positionType;
        return result;
    }
}
