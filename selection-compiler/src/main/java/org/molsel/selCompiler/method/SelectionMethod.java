package org.molsel.selCompiler.method;

import org.molsel.selCompiler.compiler.errors.InternalCompilerError;
import org.molsel.selCompiler.eval.EvaluationContext;
import org.molsel.selCompiler.ir.data.MethodData;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.ir.value.PositionSet;
import org.molsel.selCompiler.ir.value.SelectionValue;
import org.molsel.selCompiler.ir.value.ValueType;

import javax.annotation.Nullable;
import java.util.EnumSet;

/**
 * A selection method: a keyword or predicate whose semantics are provided
 * outside the compiler.  The compiler only calls the hooks below.
 * Parameter values are found in {@link MethodData#params}.
 */
public interface SelectionMethod {
    String getName();

    ValueType getType();

    EnumSet<MethodFlag> getFlags();

    /** True for the keyword that converts a group to positions of a configurable type. */
    default boolean isPositionKeyword() {
        return false;
    }

    /** Called once, or for every new group if some parameter is per-atom. */
    default void init(@Nullable Topology topology, MethodData data) {}

    default boolean hasOutInit() {
        return false;
    }

    /** Fix the shape of the output value. */
    default void outInit(@Nullable Topology topology, SelectionValue out, MethodData data) {}

    default boolean hasInitFrame() {
        return false;
    }

    /** Called before the first evaluation in a frame. */
    default void initFrame(EvaluationContext context, MethodData data) {}

    /** Evaluate for the atoms in 'group'. */
    default void update(EvaluationContext context, MethodData data, IndexGroup group, SelectionValue out) {
        throw new InternalCompilerError("Method " + this.getName() + " cannot be evaluated for a group");
    }

    default boolean hasUpdate() {
        return true;
    }

    /** True if the method is evaluated for positions instead of atoms. */
    default boolean updatesPositions() {
        return false;
    }

    default void updatePositions(EvaluationContext context, MethodData data, PositionSet positions, SelectionValue out) {
        throw new InternalCompilerError("Method " + this.getName() + " cannot be evaluated for positions");
    }
}
