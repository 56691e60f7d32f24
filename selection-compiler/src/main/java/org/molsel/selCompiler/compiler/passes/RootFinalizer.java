package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.annotation.CompilerData;
import org.molsel.selCompiler.compiler.annotation.CompilerFlag;
import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.RootPass;
import org.molsel.selCompiler.eval.EvalFunction;
import org.molsel.selCompiler.ir.ElementFlag;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.data.MethodData;
import org.molsel.selCompiler.ir.data.RootData;
import org.molsel.selCompiler.ir.data.SubexprData;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.ir.value.PositionSet;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.selCompiler.method.PositionCalculation;
import org.molsel.selCompiler.method.PositionFlag;
import org.molsel.selCompiler.method.PositionType;
import org.molsel.util.Logger;

import java.util.EnumSet;

/**
 * Prepares each root for production evaluation: chooses the group the root
 * evaluates its expression with, settles the storage of subexpressions, and
 * creates the position calculations of methods that work on positions.
 */
public class RootFinalizer extends RootPass {
    public RootFinalizer(SelectionCompiler compiler) {
        super(compiler);
    }

    CompilerData annotation(SelElement element) {
        return this.compiler.annotations().get(element);
    }

    void initializeRoot(SelElement root) {
        SelElement expression = root.child(0);
        CompilerData rootData = this.annotation(root);
        CompilerData cd = this.annotation(expression);
        // Subexpressions without a static group are evaluated by their references,
        // and so are subexpressions with a single reference.
        if (expression.is(ElementType.SUBEXPR)
                && (!cd.has(CompilerFlag.STATICEVAL)
                    || (cd.has(CompilerFlag.SIMPLESUBEXPR) && !cd.has(CompilerFlag.FULLEVAL)))) {
            rootData.evaluator = EvalFunction.NONE;
        }
        RootData data = root.data(RootData.class);
        IndexGroup all = this.compiler.forest.all;
        if (rootData.evaluator != EvalFunction.NONE) {
            if (expression.hasFlag(ElementFlag.VARNUMVAL)
                    || (expression.hasFlag(ElementFlag.SINGLEVAL) && expression.getValueType() != ValueType.GROUP_VALUE))
                data.evalGroup = null;
            else if (cd.gmax == null || cd.gmax.size() == all.size())
                data.evalGroup = all;
            else
                data.evalGroup = cd.gmax.copy();
        } else {
            data.evalGroup = new IndexGroup();
        }
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Root ")
                .append(root.getDisplayName())
                .append(" evaluates ")
                .append(expression.getDisplayName())
                .append(" ")
                .append(data.describe())
                .newline();
    }

    void postprocessSubexpressions(SelElement element) {
        for (SelElement child: Descent.children(element, false))
            this.postprocessSubexpressions(child);

        CompilerData cd = this.annotation(element);
        if (element.is(ElementType.SUBEXPR) && this.compiler.forest.refCount(element) > 2
                && cd.has(CompilerFlag.STATICEVAL) && !cd.has(CompilerFlag.FULLEVAL)) {
            // The group is static, so the subexpression is evaluated once per frame.
            element.data(SubexprData.class).reset();
            element.evaluator = EvalFunction.SUBEXPR_STATICEVAL;
            cd.evaluator = EvalFunction.SUBEXPR_STATICEVAL;
            SelElement body = element.child(0);
            body.mempool = null;
            StoragePlanner.alias(body, element);
            body.flags.removeAll(StoragePlanner.ALLOC_FLAGS);
        }
        if (element.is(ElementType.SUBEXPRREF) && cd.has(CompilerFlag.SIMPLESUBEXPR)) {
            SelElement target = element.refTarget();
            if (target.hasChildren() && target.child(0).hasFlag(ElementFlag.ALLOCVAL))
                StoragePlanner.moveOwnership(target.child(0), element);
        }
        if (element.is(ElementType.SUBEXPR) && !cd.has(CompilerFlag.SIMPLESUBEXPR)
                && cd.has(CompilerFlag.FULLEVAL)) {
            element.flags.add(ElementFlag.ALLOCVAL);
            StoragePlanner.moveOwnership(element.child(0), element);
        }
    }

    /** Methods evaluated for positions get a calculation sized for their maximal group. */
    void initializePositions(SelElement element, PositionType type) {
        if (element.is(ElementType.EXPRESSION)) {
            MethodData data = element.data(MethodData.class);
            if (data.method.updatesPositions() && (!data.method.hasUpdate() || type != PositionType.ATOM)) {
                CompilerData cd = this.annotation(element);
                EnumSet<PositionFlag> flags = EnumSet.noneOf(PositionFlag.class);
                if (!cd.has(CompilerFlag.STATICEVAL))
                    flags.add(PositionFlag.DYNAMIC);
                PositionCalculation calculation = data.positionCalculation;
                if (calculation == null) {
                    flags.add(PositionFlag.COMPLWHOLE);
                    calculation = this.compiler.positionCalculations.create(type, flags);
                    data.positionCalculation = calculation;
                } else {
                    calculation.setFlags(flags);
                }
                calculation.setMaxIndex(cd.gmax != null ? cd.gmax : this.compiler.forest.all);
                data.positions = new PositionSet();
                calculation.initPositions(data.positions);
            }
        }
        for (SelElement child: Descent.children(element, false))
            this.initializePositions(child, type);
    }

    @Override
    public void processRoot(SelElement root) {
        this.initializeRoot(root);
        this.postprocessSubexpressions(root);
        this.initializePositions(root,
                PositionType.fromString(this.compiler.options.positions.referencePositions));
    }
}
