package org.molsel.selCompiler.eval;

import org.molsel.selCompiler.compiler.errors.InternalCompilerError;
import org.molsel.selCompiler.compiler.errors.UnsupportedExpressionException;
import org.molsel.selCompiler.ir.ElementFlag;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.selCompiler.ir.data.ArithOp;
import org.molsel.selCompiler.ir.data.ArithmeticData;
import org.molsel.selCompiler.ir.data.ConstData;
import org.molsel.selCompiler.ir.data.MethodData;
import org.molsel.selCompiler.ir.data.RootData;
import org.molsel.selCompiler.ir.data.SubexprData;
import org.molsel.selCompiler.ir.data.SubexprRefData;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.ir.value.SelectionValue;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.selCompiler.method.Frame;
import org.molsel.util.IWritesLogs;
import org.molsel.util.Logger;
import org.molsel.util.Utilities;

import javax.annotation.Nullable;

/**
 * Evaluates selection elements.  Which code runs for an element is decided
 * by the mode of the context: in {@link EvalMode#PRODUCTION} mode the
 * element's {@link EvalFunction} is used; in {@link EvalMode#ANALYSIS}
 * mode every evaluation request goes to the analyzer, which in turn calls
 * {@link #evaluateWith} to run the function it has planned for the element.
 */
public final class SelectionEvaluator implements IWritesLogs {
    public final EvaluationContext context;

    public SelectionEvaluator(EvaluationContext context) {
        this.context = context;
    }

    public MemoryPool pool() {
        return this.context.pool;
    }

    /** True if evaluating the element would do anything. */
    public boolean hasEvaluator(SelElement element) {
        if (this.context.mode == EvalMode.ANALYSIS)
            return this.context.getAnalyzer().isEnabled(element);
        return element.evaluator != EvalFunction.NONE;
    }

    public void evaluate(SelElement element, @Nullable IndexGroup group) {
        if (this.context.mode == EvalMode.ANALYSIS)
            this.context.getAnalyzer().analyze(element, group);
        else
            this.evaluateWith(element.evaluator, element, group);
    }

    public void evaluateWith(EvalFunction function, SelElement element, @Nullable IndexGroup group) {
        switch (function) {
            case NONE:
                break;
            case ROOT:
                this.evaluateRoot(element);
                break;
            case STATIC:
                this.evaluateStatic(element, group);
                break;
            case METHOD:
                this.evaluateMethod(element, group);
                break;
            case MODIFIER:
                this.evaluateModifier(element, group);
                break;
            case ARITHMETIC:
                this.evaluateArithmetic(element, group);
                break;
            case NOT:
                this.evaluateNot(element, this.nonNull(group, element));
                break;
            case AND:
                this.evaluateAnd(element, this.nonNull(group, element));
                break;
            case OR:
                this.evaluateOr(element, this.nonNull(group, element));
                break;
            case SUBEXPR:
                this.evaluateSubexpr(element, group);
                break;
            case SUBEXPR_SIMPLE:
                this.evaluateSubexprSimple(element, group);
                break;
            case SUBEXPR_STATICEVAL:
                this.evaluateSubexprStaticEval(element, group);
                break;
            case SUBEXPRREF:
                this.evaluateSubexprRef(element, group);
                break;
            case SUBEXPRREF_SIMPLE:
                this.evaluateSubexprRefSimple(element, group);
                break;
        }
    }

    IndexGroup nonNull(@Nullable IndexGroup group, SelElement element) {
        return Utilities.enforceNotNull(group, "Element " + element + " evaluated without a group");
    }

    void evaluateRoot(SelElement root) {
        RootData data = root.data(RootData.class);
        SelElement child = root.child(0);
        if (data.skipsEvaluation() || !this.hasEvaluator(child))
            return;
        this.evaluate(child, data.evalGroup);
    }

    void evaluateStatic(SelElement element, @Nullable IndexGroup group) {
        ConstData data = element.data(ConstData.class);
        IndexGroup constant = Utilities.enforceNotNull(data.group, "Constant without a group " + element);
        SelectionValue value = element.getValue();
        if (group == null)
            value.group().copyFrom(constant);
        else
            IndexGroup.intersection(value.group(), constant, group);
        value.setCount(1);
    }

    /** Evaluate the parameter values of a method.  Values that are not
     * per-atom are only evaluated once in each frame. */
    public void evaluateMethodParams(SelElement element, @Nullable IndexGroup group) {
        for (SelElement child: element.children()) {
            if (!this.hasEvaluator(child) || child.hasFlag(ElementFlag.EVALFRAME))
                continue;
            if (child.hasFlag(ElementFlag.ATOMVAL)) {
                this.evaluate(child, group);
            } else {
                child.flags.add(ElementFlag.EVALFRAME);
                this.evaluate(child, null);
            }
        }
    }

    void initFrame(SelElement element, MethodData data) {
        if (element.flags.remove(ElementFlag.INITFRAME))
            data.method.initFrame(this.context, data);
    }

    void evaluateMethod(SelElement element, @Nullable IndexGroup group) {
        this.evaluateMethodParams(element, group);
        MethodData data = element.data(MethodData.class);
        this.initFrame(element, data);
        IndexGroup actual = group == null ? this.context.all : group;
        if (data.positionCalculation != null) {
            Frame frame = this.context.getFrame();
            data.positionCalculation.update(frame, actual,
                    Utilities.enforceNotNull(data.positions, "Positions not initialized for " + element));
            data.method.updatePositions(this.context, data, data.positions, element.getValue());
        } else {
            data.method.update(this.context, data, actual, element.getValue());
        }
    }

    void evaluateModifier(SelElement element, @Nullable IndexGroup group) {
        this.evaluateMethodParams(element, group);
        MethodData data = element.data(MethodData.class);
        this.initFrame(element, data);
        SelElement input = element.child(0);
        if (input.getValueType() != ValueType.POS_VALUE)
            throw new UnsupportedExpressionException("Non-position valued modifiers not implemented", element);
        data.method.updatePositions(this.context, data, input.getValue().positions(), element.getValue());
    }

    void evaluateArithmetic(SelElement element, @Nullable IndexGroup group) {
        ArithOp op = element.data(ArithmeticData.class).op;
        boolean single = element.hasFlag(ElementFlag.SINGLEVAL);
        int count = single || group == null ? 1 : group.size();
        for (SelElement child: element.children()) {
            if (this.hasEvaluator(child)) {
                this.pool().reserve(child, count);
                this.evaluate(child, group);
            }
        }
        SelElement left = element.child(0);
        @Nullable SelElement right = op.isUnary() ? null : element.child(1);
        SelectionValue value = element.getValue();
        value.reserve(count);
        value.setCount(count);
        double[] out = value.reals();
        double[] leftValues = left.getValue().reals();
        double[] rightValues = right == null ? null : right.getValue().reals();
        boolean leftSingle = left.hasFlag(ElementFlag.SINGLEVAL);
        boolean rightSingle = right == null || right.hasFlag(ElementFlag.SINGLEVAL);
        for (int i = 0, i1 = 0, i2 = 0; i < count; i++) {
            double r = rightValues == null ? 0 : rightValues[i2];
            out[i] = op.apply(leftValues[i1], r);
            if (!leftSingle)
                i1++;
            if (!rightSingle)
                i2++;
        }
        for (int i = element.children().size() - 1; i >= 0; i--)
            this.pool().release(element.child(i));
    }

    void evaluateNot(SelElement element, IndexGroup group) {
        SelElement child = element.child(0);
        if (this.hasEvaluator(child)) {
            this.pool().reserve(child, group.size());
            this.evaluate(child, group);
        }
        IndexGroup.difference(element.getValue().group(), group, child.getValue().group());
        element.getValue().setCount(1);
        this.pool().release(child);
    }

    void evaluateAnd(SelElement element, IndexGroup group) {
        IndexGroup out = element.getValue().group();
        int start = 0;
        // A first operand without evaluation function was folded into the group.
        if (!this.hasEvaluator(element.child(0)))
            start = 1;
        SelElement first = element.child(start);
        this.pool().reserve(first, group.size());
        this.evaluate(first, group);
        out.copyFrom(first.getValue().group());
        this.pool().release(first);
        for (int i = start + 1; i < element.children().size() && !out.isEmpty(); i++) {
            SelElement child = element.child(i);
            this.pool().reserve(child, out.size());
            this.evaluate(child, out);
            IndexGroup.intersection(out, out, child.getValue().group());
            this.pool().release(child);
        }
        element.getValue().setCount(1);
    }

    /** Each operand is only evaluated for the atoms not selected by the previous ones,
     * so the partial results are disjoint. */
    void evaluateOr(SelElement element, IndexGroup group) {
        IndexGroup out = element.getValue().group();
        IndexGroup remaining = this.pool().borrowGroup(group.size());
        IndexGroup selected = this.pool().borrowGroup(group.size());
        IndexGroup spare = this.pool().borrowGroup(group.size());
        SelElement first = element.child(0);
        if (this.hasEvaluator(first)) {
            this.pool().reserve(first, group.size());
            this.evaluate(first, group);
            IndexGroup.partition(out, remaining, group, first.getValue().group());
            this.pool().release(first);
        } else {
            IndexGroup.partition(out, remaining, group, first.getValue().group());
        }
        for (int i = 1; i < element.children().size() && !remaining.isEmpty(); i++) {
            SelElement child = element.child(i);
            this.pool().reserve(child, remaining.size());
            this.evaluate(child, remaining);
            IndexGroup.partition(selected, spare, remaining, child.getValue().group());
            this.pool().release(child);
            IndexGroup.merge(out, out, selected);
            IndexGroup swap = remaining;
            remaining = spare;
            spare = swap;
        }
        this.pool().returnGroup();
        this.pool().returnGroup();
        this.pool().returnGroup();
        element.getValue().setCount(1);
    }

    /** Copy the value computed by 'source' into 'target'. */
    static void copyValue(SelectionValue target, SelectionValue source) {
        if (target.hasStore() && source.hasStore() && target.getStore() == source.getStore()) {
            target.setCount(source.getCount());
            return;
        }
        switch (target.type) {
            case GROUP_VALUE:
                target.group().copyFrom(source.group());
                break;
            case POS_VALUE:
                target.positions().copyFrom(source.positions());
                break;
            case INT_VALUE:
                target.reserve(source.getCount());
                System.arraycopy(source.ints(), 0, target.ints(), 0, source.getCount());
                break;
            case REAL_VALUE:
                target.reserve(source.getCount());
                System.arraycopy(source.reals(), 0, target.reals(), 0, source.getCount());
                break;
            case STR_VALUE:
                target.reserve(source.getCount());
                System.arraycopy(source.strings(), 0, target.strings(), 0, source.getCount());
                break;
            default:
                break;
        }
        target.setCount(source.getCount());
    }

    void evaluateSubexprSimple(SelElement element, @Nullable IndexGroup group) {
        SelElement child = element.child(0);
        if (this.hasEvaluator(child))
            this.evaluate(child, group);
        element.getValue().setCount(child.getValue().getCount());
    }

    void evaluateSubexprStaticEval(SelElement element, @Nullable IndexGroup group) {
        SubexprData data = element.data(SubexprData.class);
        if (!data.notEvaluated())
            return;
        SelElement child = element.child(0);
        if (this.hasEvaluator(child))
            this.evaluate(child, group);
        element.getValue().setCount(child.getValue().getCount());
        if (group == null)
            data.evaluatedWithoutGroup = true;
        else
            data.evalGroup.copyFrom(group);
    }

    /**
     * Evaluate a subexpression shared by several references.  The first call
     * in a frame evaluates it for the requested group; later calls only
     * evaluate the atoms that were not covered yet and merge the results.
     * A body folded into a constant is not evaluated, and holds its whole value.
     */
    void evaluateSubexpr(SelElement element, @Nullable IndexGroup group) {
        SubexprData data = element.data(SubexprData.class);
        SelElement child = element.child(0);
        IndexGroup actual = group == null ? this.context.all : group;
        SelectionValue value = element.getValue();
        SelectionValue childValue = child.getValue();
        Utilities.enforce(!value.hasStore() || !childValue.hasStore() || value.getStore() != childValue.getStore(),
                "Shared subexpression " + element + " uses the storage of its body");
        if (data.notEvaluated()) {
            this.pool().reserve(child, actual.size());
            if (this.hasEvaluator(child)) {
                this.evaluate(child, actual);
                copyValue(value, child.getValue());
            } else if (value.type == ValueType.GROUP_VALUE) {
                IndexGroup.intersection(value.group(), childValue.group(), actual);
                value.setCount(1);
            } else {
                copyValue(value, childValue);
            }
            this.pool().release(child);
            data.evalGroup.copyFrom(actual);
            return;
        }
        IndexGroup missing = this.pool().borrowGroup(actual.size());
        IndexGroup.difference(missing, actual, data.evalGroup);
        if (!missing.isEmpty()) {
            this.pool().reserve(child, missing.size());
            if (this.hasEvaluator(child))
                this.evaluate(child, missing);
            childValue = child.getValue();
            switch (value.type) {
                case GROUP_VALUE: {
                    IndexGroup added = this.pool().borrowGroup(missing.size());
                    IndexGroup.intersection(added, childValue.group(), missing);
                    IndexGroup.merge(value.group(), value.group(), added);
                    this.pool().returnGroup();
                    value.setCount(1);
                    break;
                }
                case POS_VALUE:
                    throw new UnsupportedExpressionException(
                            "Position subexpressions evaluated for several groups not implemented", element);
                default:
                    if (element.hasFlag(ElementFlag.ATOMVAL))
                        interleave(value, data.evalGroup, childValue, missing);
                    else
                        copyValue(value, childValue);
                    break;
            }
            this.pool().release(child);
            IndexGroup.merge(data.evalGroup, data.evalGroup, missing);
        }
        this.pool().returnGroup();
    }

    /** Merge per-atom values for the disjoint groups 'old' and 'added',
     * keeping the values ordered by atom index. */
    static void interleave(SelectionValue value, IndexGroup old, SelectionValue added, IndexGroup addedGroup) {
        int total = old.size() + addedGroup.size();
        value.reserve(total);
        int i = old.size() - 1;
        int j = addedGroup.size() - 1;
        for (int k = total - 1; k >= 0; k--) {
            boolean fromAdded = i < 0 || (j >= 0 && addedGroup.get(j) > old.get(i));
            switch (value.type) {
                case INT_VALUE:
                    value.ints()[k] = fromAdded ? added.ints()[j] : value.ints()[i];
                    break;
                case REAL_VALUE:
                    value.reals()[k] = fromAdded ? added.reals()[j] : value.reals()[i];
                    break;
                case STR_VALUE:
                    value.strings()[k] = fromAdded ? added.strings()[j] : value.strings()[i];
                    break;
                default:
                    throw new InternalCompilerError("Cannot interleave values of type " + value.type);
            }
            if (fromAdded)
                j--;
            else
                i--;
        }
        value.setCount(total);
    }

    void setParameterCount(SelElement element) {
        SubexprRefData data = element.data(SubexprRefData.class);
        if (data.param != null)
            data.param.value.setCount(element.getValue().getCount());
    }

    void evaluateSubexprRef(SelElement element, @Nullable IndexGroup group) {
        SelElement target = element.refTarget();
        if (group != null && this.hasEvaluator(target))
            this.evaluate(target, group);
        SelectionValue value = element.getValue();
        SelectionValue source = target.getValue();
        switch (value.type) {
            case GROUP_VALUE:
                if (group == null)
                    value.group().copyFrom(source.group());
                else
                    IndexGroup.intersection(value.group(), source.group(), group);
                value.setCount(1);
                break;
            case POS_VALUE:
                if (group != null)
                    throw new UnsupportedExpressionException(
                            "Position subexpression references with a group not implemented", element);
                copyValue(value, source);
                break;
            case INT_VALUE:
            case REAL_VALUE:
            case STR_VALUE:
                if (group == null || !element.hasFlag(ElementFlag.ATOMVAL)) {
                    copyValue(value, source);
                } else {
                    this.extractValues(value, source, target.data(SubexprData.class).evalGroup, group);
                }
                break;
            default:
                break;
        }
        this.setParameterCount(element);
    }

    /** Pick the values for the atoms of 'group' from values computed for 'computedFor'. */
    void extractValues(SelectionValue value, SelectionValue source, IndexGroup computedFor, IndexGroup group) {
        value.reserve(group.size());
        for (int i = 0, j = 0; i < group.size(); i++, j++) {
            while (computedFor.get(j) < group.get(i))
                j++;
            switch (value.type) {
                case INT_VALUE:
                    value.ints()[i] = source.ints()[j];
                    break;
                case REAL_VALUE:
                    value.reals()[i] = source.reals()[j];
                    break;
                default:
                    value.strings()[i] = source.strings()[j];
                    break;
            }
        }
        value.setCount(group.size());
    }

    /** The reference shares its storage with the subexpression and its body;
     * the subexpression is evaluated in place. */
    void evaluateSubexprRefSimple(SelElement element, @Nullable IndexGroup group) {
        SelElement target = element.refTarget();
        if (group != null) {
            SelectionValue value = element.getValue();
            if (value.hasStore()) {
                target.getValue().setStore(value.getStore());
                if (target.hasChildren())
                    target.child(0).getValue().setStore(value.getStore());
            }
            if (this.hasEvaluator(target))
                this.evaluate(target, group);
        }
        element.getValue().setCount(target.getValue().getCount());
        this.setParameterCount(element);
    }

    /**
     * Evaluate all roots of a compiled forest for one frame.
     */
    public static void evaluateFrame(SelectionForest forest, EvaluationContext context, Frame frame) {
        Utilities.enforce(context.mode == EvalMode.PRODUCTION, "Frame evaluation requires production mode");
        context.setFrame(frame);
        SelectionEvaluator evaluator = new SelectionEvaluator(context);
        Logger.INSTANCE.belowLevel(evaluator, 1)
                .append("Evaluating frame at time ")
                .appendSupplier(() -> Double.toString(frame.time))
                .newline();
        for (SelElement root: forest.roots())
            clearFrameFlags(root);
        for (SelElement root: forest.roots()) {
            SelElement child = root.child(0);
            if (child.is(ElementType.SUBEXPR) && child.evaluator != EvalFunction.NONE) {
                child.data(SubexprData.class).reset();
                if (child.getValueType() == ValueType.GROUP_VALUE && child.getValue().hasStore())
                    child.getValue().group().clear();
            }
        }
        for (SelElement root: forest.roots()) {
            if (root.evaluator != EvalFunction.NONE)
                evaluator.evaluate(root, null);
        }
    }

    static void clearFrameFlags(SelElement element) {
        element.flags.remove(ElementFlag.EVALFRAME);
        if (element.isDynamic() && (element.is(ElementType.EXPRESSION) || element.is(ElementType.MODIFIER))
                && element.data(MethodData.class).method.hasInitFrame())
            element.flags.add(ElementFlag.INITFRAME);
        for (SelElement child: element.children())
            clearFrameFlags(child);
    }
}
