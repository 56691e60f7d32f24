/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.ICompilerComponent;
import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.annotation.CompilerAnnotations;
import org.molsel.selCompiler.compiler.annotation.CompilerData;
import org.molsel.selCompiler.compiler.annotation.CompilerFlag;
import org.molsel.selCompiler.compiler.errors.InternalCompilerError;
import org.molsel.selCompiler.compiler.errors.UnsupportedExpressionException;
import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.IForestPass;
import org.molsel.selCompiler.eval.EvalFunction;
import org.molsel.selCompiler.eval.EvaluationContext;
import org.molsel.selCompiler.eval.IElementAnalyzer;
import org.molsel.selCompiler.eval.SelectionEvaluator;
import org.molsel.selCompiler.ir.ElementFlag;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.selCompiler.ir.data.BoolOp;
import org.molsel.selCompiler.ir.data.BooleanData;
import org.molsel.selCompiler.ir.data.ConstData;
import org.molsel.selCompiler.ir.data.MethodData;
import org.molsel.selCompiler.ir.data.SubexprData;
import org.molsel.selCompiler.ir.data.SubexprRefData;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.ir.value.SelectionValue;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.selCompiler.method.MethodFlag;
import org.molsel.selCompiler.method.MethodParameter;
import org.molsel.selCompiler.method.ParameterFlag;
import org.molsel.util.Linq;
import org.molsel.util.Logger;
import org.molsel.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Evaluates the forest once at compile time.  Static elements are folded into
 * constants; dynamic elements get their minimal and maximal groups, and every
 * value is sized for the largest group it can be evaluated for.
 *
 * <p>The evaluator runs in analysis mode, so every evaluation request made by
 * an element for its children comes back to {@link #analyze}.
 *
 * <p>Common subexpressions are evaluated for several groups, which are only
 * known once all their references have been analyzed.  In the first walk they
 * are treated as dynamic; a second walk evaluates each of them for its maximal
 * group and folds what is static.
 */
public class StaticAnalyzer implements IForestPass, IElementAnalyzer, ICompilerComponent {
    final SelectionCompiler compiler;
    /** Elements treated as dynamic in the current walk. */
    final Set<SelElement> forcedDynamic = Collections.newSetFromMap(new IdentityHashMap<>());
    @Nullable
    SelectionEvaluator evaluator;

    public StaticAnalyzer(SelectionCompiler compiler) {
        this.compiler = compiler;
    }

    @Override
    public SelectionCompiler compiler() {
        return this.compiler;
    }

    CompilerAnnotations annotations() {
        return this.compiler.annotations();
    }

    SelectionForest forest() {
        return this.compiler.forest;
    }

    SelectionEvaluator evaluator() {
        return Utilities.enforceNotNull(this.evaluator, "Analysis has not started");
    }

    @Override
    public void apply(SelectionForest forest) {
        EvaluationContext context = EvaluationContext.forAnalysis(
                this.compiler.pool, forest.all, this.compiler.topology, this);
        this.evaluator = new SelectionEvaluator(context);

        for (SelElement root: List.copyOf(forest.roots())) {
            SelElement expression = root.child(0);
            if (this.annotations().get(expression).has(CompilerFlag.COMMONSUBEXPR))
                this.forceDynamic(expression);
            this.analyze(root, null);
        }
        // References to folded subexpressions are gone.
        new RemoveUnusedSubexpressions().apply(forest);

        this.forcedDynamic.clear();
        for (SelElement root: List.copyOf(forest.roots())) {
            SelElement expression = root.child(0);
            CompilerData cd = this.annotations().get(expression);
            if (!cd.has(CompilerFlag.COMMONSUBEXPR))
                continue;
            Logger.INSTANCE.belowLevel(this, 2)
                    .append("Analyzing common subexpression ")
                    .append(expression.getDisplayName())
                    .append(" for ")
                    .append(cd.gmax == null ? 0 : cd.gmax.size())
                    .append(" atoms")
                    .newline();
            boolean doMinMax = cd.has(CompilerFlag.DOMINMAX);
            expression.data(SubexprData.class).reset();
            // The bounds are final; they must not be recomputed from the maximal group.
            cd.flags.remove(CompilerFlag.DOMINMAX);
            this.analyze(expression, cd.gmax);
            cd.set(CompilerFlag.DOMINMAX, doMinMax);
        }
        // Subexpressions only used by static parts of common subexpressions.
        new RemoveUnusedSubexpressions().apply(forest);
        this.evaluator = null;
    }

    /** Treat a subtree as dynamic.  Parameters evaluated once per frame are not affected. */
    void forceDynamic(SelElement element) {
        this.forcedDynamic.add(element);
        for (SelElement child: Descent.children(element, true)) {
            if (element.is(ElementType.EXPRESSION) && child.is(ElementType.SUBEXPRREF)
                    && !child.hasFlag(ElementFlag.ATOMVAL))
                continue;
            this.forceDynamic(child);
        }
    }

    boolean isStatic(SelElement element) {
        CompilerData cd = this.annotations().getOrNull(element);
        return cd != null && cd.has(CompilerFlag.STATIC) && !this.forcedDynamic.contains(element);
    }

    @Override
    public boolean isEnabled(SelElement element) {
        CompilerData cd = this.annotations().getOrNull(element);
        return cd != null && !cd.analysisDisabled && element.evaluator != EvalFunction.NONE;
    }

    /** Run the evaluation function planned for the element. */
    void evaluate(SelElement element, @Nullable IndexGroup group) {
        this.evaluator().evaluateWith(this.annotations().get(element).evaluator, element, group);
    }

    @Override
    public void analyze(SelElement element, @Nullable IndexGroup group) {
        CompilerData cd = this.annotations().get(element);
        Logger.INSTANCE.belowLevel(this, 3)
                .append("Analyzing ")
                .append(element.toString())
                .append(group == null ? "" : " for " + group.size() + " atoms")
                .newline();
        if (!element.is(ElementType.ROOT) && group != null)
            StoragePlanner.allocate(element, group.size(), false);

        boolean doMinMax = cd.has(CompilerFlag.DOMINMAX);
        if (!element.is(ElementType.SUBEXPR) && doMinMax) {
            Utilities.enforceNotNull(cd.gmin, "No minimal group").clear();
            Utilities.enforceNotNull(cd.gmax, "No maximal group").clear();
        }

        switch (element.getType()) {
            case CONST:
                if (element.getValueType() == ValueType.GROUP_VALUE && cd.evaluator != EvalFunction.NONE)
                    this.evaluate(element, group);
                break;
            case EXPRESSION:
            case MODIFIER:
                this.analyzeMethod(element, cd, group, doMinMax);
                break;
            case BOOLEAN:
                if (!element.isDynamic()) {
                    this.evaluate(element, group);
                    if (this.isStatic(element))
                        this.makeStatic(element);
                } else {
                    this.evaluateStaticPart(element, this.nonNull(group, element));
                    SelElement first = element.child(0);
                    // The static part may select fewer atoms than 'group'.
                    if (element.data(BooleanData.class).op == BoolOp.AND && first.is(ElementType.CONST))
                        this.evaluate(element, first.getValue().group());
                    else
                        this.evaluate(element, group);
                    this.evaluateMinMax(element, this.nonNull(group, element));
                }
                break;
            case ARITHMETIC:
                this.evaluate(element, group);
                if (!element.isDynamic()) {
                    if (this.isStatic(element))
                        this.makeStatic(element);
                } else if (doMinMax && group != null) {
                    Utilities.enforceNotNull(cd.gmax, "No maximal group").copyFrom(group);
                }
                break;
            case ROOT:
                this.evaluate(element, group);
                break;
            case SUBEXPR:
                this.analyzeSubexpression(element, cd, group, doMinMax);
                break;
            case SUBEXPRREF:
                this.analyzeReference(element, cd, group, doMinMax);
                break;
            case GROUPREF:
                throw new InternalCompilerError("Unresolved group reference in compilation", element);
        }

        if (doMinMax && cd.gmin != null && cd.gmax != null) {
            cd.gmin.squeeze();
            cd.gmax.squeeze();
            cd.gmin.setName(null);
            cd.gmax.setName(null);
        }

        // During analysis the value of a dynamic group is its bound.
        // Subexpressions and negations have already computed theirs.
        if (element.getValueType() == ValueType.GROUP_VALUE && element.isDynamic()
                && !element.is(ElementType.SUBEXPR) && !isNegation(element)) {
            IndexGroup bound = cd.has(CompilerFlag.EVALMAX) ? cd.gmax : cd.gmin;
            if (bound != null)
                element.getValue().group().copyFrom(bound);
        }
    }

    static boolean isNegation(SelElement element) {
        return element.is(ElementType.BOOLEAN) && element.data(BooleanData.class).op == BoolOp.NOT;
    }

    IndexGroup nonNull(@Nullable IndexGroup group, SelElement element) {
        return Utilities.enforceNotNull(group, "Element " + element + " analyzed without a group");
    }

    void analyzeMethod(SelElement element, CompilerData cd, @Nullable IndexGroup group, boolean doMinMax) {
        this.evaluator().evaluateMethodParams(element, group);
        this.initMethod(element, group == null ? this.forest().all.size() : group.size());
        if (!element.isDynamic()) {
            this.evaluate(element, group);
            if (this.isStatic(element))
                this.makeStatic(element);
        } else {
            // Modifiers are evaluated to obtain the output for the maximal selection.
            if (element.is(ElementType.MODIFIER))
                this.evaluate(element, group);
            if (doMinMax && group != null)
                Utilities.enforceNotNull(cd.gmax, "No maximal group").copyFrom(group);
        }
    }

    void analyzeSubexpression(SelElement element, CompilerData cd, @Nullable IndexGroup group, boolean doMinMax) {
        SelElement body = element.child(0);
        SubexprData data = element.data(SubexprData.class);
        if (cd.has(CompilerFlag.SIMPLESUBEXPR) || cd.has(CompilerFlag.FULLEVAL)) {
            this.evaluate(element, group);
            StoragePlanner.alias(element, body);
        } else if (data.notEvaluated()) {
            this.evaluate(element, group);
            if (doMinMax)
                this.copyBounds(cd, this.annotations().get(body));
        } else {
            int missing = group == null ? 0 : IndexGroup.differenceSize(group, data.evalGroup);
            if (missing > 0)
                StoragePlanner.allocate(element, missing + data.evalGroup.size(), false);
            this.evaluate(element, group);
            if (missing > 0 && doMinMax) {
                CompilerData bodyData = this.annotations().get(body);
                if (cd.gmin != null && bodyData.gmin != null)
                    IndexGroup.union(cd.gmin, cd.gmin, bodyData.gmin);
                if (cd.gmax != null && bodyData.gmax != null)
                    IndexGroup.union(cd.gmax, cd.gmax, bodyData.gmax);
            }
        }
    }

    void copyBounds(CompilerData to, CompilerData from) {
        if (to.gmin != null && from.gmin != null)
            to.gmin.copyFrom(from.gmin);
        if (to.gmax != null && from.gmax != null)
            to.gmax.copyFrom(from.gmax);
    }

    void analyzeReference(SelElement element, CompilerData cd, @Nullable IndexGroup group, boolean doMinMax) {
        SelElement target = element.refTarget();
        CompilerData targetData = this.annotations().get(target);
        boolean simple = cd.has(CompilerFlag.SIMPLESUBEXPR);
        if (group == null && !simple) {
            // The subexpression has already been evaluated by its root.
            int size = targetData.gmax == null ? 0 : targetData.gmax.size();
            StoragePlanner.allocate(element, size, true);
        }
        this.evaluate(element, group);
        if (simple && target.hasChildren() && target.child(0).hasFlag(ElementFlag.ALLOCVAL))
            StoragePlanner.alias(element, target.child(0));
        this.storeParameterValue(element);
        if (!element.isDynamic()) {
            if (this.isStatic(element))
                this.makeStatic(element);
        } else if (doMinMax) {
            if (simple || group == null) {
                this.copyBounds(cd, targetData);
            } else {
                IndexGroup gmin = Utilities.enforceNotNull(cd.gmin, "No minimal group");
                IndexGroup gmax = Utilities.enforceNotNull(cd.gmax, "No maximal group");
                IndexGroup.intersection(gmin, Utilities.enforceNotNull(targetData.gmin, "No minimal group"), group);
                IndexGroup.intersection(gmax, Utilities.enforceNotNull(targetData.gmax, "No maximal group"), group);
            }
        }
    }

    /** Let a parameter with a variable number of values see the value of the reference. */
    void storeParameterValue(SelElement element) {
        MethodParameter param = element.data(SubexprRefData.class).param;
        if (param == null)
            return;
        if (!param.flags.contains(ParameterFlag.VARNUM) && !param.flags.contains(ParameterFlag.ATOMVAL))
            return;
        SelectionValue value = element.getValue();
        if (value.type.isScalar() && value.hasStore())
            param.value.setStore(value.getStore());
    }

    /**
     * Initialize a method and the shape of its output.  Methods with per-atom
     * parameters are initialized again for every group, since the parameter
     * values change with the group.
     */
    void initMethod(SelElement element, int size) {
        MethodData data = element.data(MethodData.class);
        boolean atomValued = Linq.any(element.children(), c -> c.hasFlag(ElementFlag.ATOMVAL));
        if (atomValued || !element.hasFlag(ElementFlag.METHODINIT)) {
            element.flags.add(ElementFlag.METHODINIT);
            data.method.init(this.compiler.topology, data);
        }
        if (!atomValued && element.hasFlag(ElementFlag.OUTINIT))
            return;
        element.flags.add(ElementFlag.OUTINIT);
        SelectionValue value = element.getValue();
        if (data.method.hasOutInit()) {
            data.method.outInit(this.compiler.topology, value, data);
            if (value.type != ValueType.POS_VALUE && value.type != ValueType.GROUP_VALUE)
                StoragePlanner.allocate(element, size, true);
        } else {
            StoragePlanner.allocate(element, size, true);
            if (element.isDynamic() && value.type != ValueType.GROUP_VALUE && value.type != ValueType.POS_VALUE)
                value.setCount(size);
            if (data.method.getFlags().contains(MethodFlag.CHARVAL)) {
                if (value.type != ValueType.STR_VALUE)
                    throw new InternalCompilerError("Char-valued selection method in non-string element", element);
                element.flags.add(ElementFlag.ALLOCDATA);
                if (value.hasStore()) {
                    String[] strings = value.strings();
                    for (int i = 0; i < size && i < strings.length; i++) {
                        if (strings[i] == null)
                            strings[i] = "";
                    }
                }
            }
        }
        if (element.isDynamic() && value.type == ValueType.REAL_VALUE && value.hasStore()) {
            double[] reals = value.reals();
            Arrays.fill(reals, 0, Math.min(value.getCount(), reals.length), 0.0);
        }
    }

    /**
     * Evaluate the static operands of a dynamic boolean, which precede the
     * dynamic ones.  Several static operands are replaced by one constant.
     * The static operand is not analyzed again; production evaluation
     * intersects it with the evaluation group, unless the group cannot
     * change or the expression is a negation, which will be folded itself.
     */
    void evaluateStaticPart(SelElement element, IndexGroup group) {
        List<SelElement> children = element.children();
        int last = 0;
        while (last + 1 < children.size() && this.isStatic(children.get(last + 1)))
            last++;
        if (!this.isStatic(children.get(0)))
            return;

        CompilerData cd = this.annotations().get(element);
        SelElement child;
        if (last > 0) {
            List<SelElement> rest = new ArrayList<>(children.subList(last + 1, children.size()));
            List<SelElement> prefix = new ArrayList<>(children.subList(0, last + 1));
            children.subList(last + 1, children.size()).clear();
            this.evaluate(element, group);
            for (SelElement operand: prefix) {
                this.forgetAnnotations(operand);
                this.forest().release(operand);
            }
            child = this.forest().constGroup(element.getValue().group(), null);
            CompilerData childData = this.annotations().create(child);
            childData.flags.add(CompilerFlag.STATIC);
            childData.set(CompilerFlag.STATICEVAL, cd.has(CompilerFlag.STATICEVAL));
            childData.gmin = child.getValue().group();
            childData.gmax = child.getValue().group();
            children.clear();
            children.add(child);
            children.addAll(rest);
            Logger.INSTANCE.belowLevel(this, 2)
                    .append("Folded ")
                    .append(prefix.size())
                    .append(" static operands of ")
                    .append(element.toString())
                    .newline();
        } else {
            child = children.get(0);
            if (this.isEnabled(child))
                this.evaluator().evaluate(child, group);
        }

        CompilerData childData = this.annotations().get(child);
        childData.analysisDisabled = true;
        BoolOp op = element.data(BooleanData.class).op;
        if (op == BoolOp.NOT || (op == BoolOp.OR && cd.has(CompilerFlag.STATICEVAL))) {
            childData.evaluator = EvalFunction.NONE;
        } else {
            childData.evaluator = EvalFunction.STATIC;
            IndexGroup constant = child.getValue().group().copy();
            constant.squeeze();
            child.data(ConstData.class).group = constant;
        }
    }

    /** Compute the bounds of a dynamic boolean from the bounds of its operands. */
    void evaluateMinMax(SelElement element, IndexGroup group) {
        CompilerData cd = this.annotations().get(element);
        IndexGroup gmin = Utilities.enforceNotNull(cd.gmin, "No minimal group");
        IndexGroup gmax = Utilities.enforceNotNull(cd.gmax, "No maximal group");
        SelElement first = element.child(0);
        CompilerData firstData = this.annotations().get(first);
        BoolOp op = element.data(BooleanData.class).op;
        if (op != BoolOp.NOT && this.isStatic(first)) {
            if (!first.is(ElementType.CONST) || first.getValueType() != ValueType.GROUP_VALUE || first.isDynamic())
                throw new InternalCompilerError("Static part of boolean expression is not a static constant", element);
        }
        switch (op) {
            case NOT:
                IndexGroup.difference(gmax, group, Utilities.enforceNotNull(firstData.gmin, "No minimal group"));
                IndexGroup.difference(gmin, group, Utilities.enforceNotNull(firstData.gmax, "No maximal group"));
                break;
            case AND: {
                this.copyBounds(cd, firstData);
                for (int i = 1; i < element.children().size() && !gmax.isEmpty(); i++) {
                    CompilerData childData = this.annotations().get(element.child(i));
                    IndexGroup.intersection(gmin, gmin, Utilities.enforceNotNull(childData.gmin, "No minimal group"));
                    IndexGroup.intersection(gmax, gmax, Utilities.enforceNotNull(childData.gmax, "No maximal group"));
                }
                // The other operands may restrict the static part.
                if (this.isStatic(first) && first.getValue().group().size() > gmax.size())
                    this.replaceStaticPart(first, gmax);
                break;
            }
            case OR: {
                this.copyBounds(cd, firstData);
                for (int i = 1; i < element.children().size() && gmin.size() < group.size(); i++) {
                    CompilerData childData = this.annotations().get(element.child(i));
                    // Each operand is analyzed for the atoms the previous ones did not select.
                    IndexGroup.merge(gmin, gmin, Utilities.enforceNotNull(childData.gmin, "No minimal group"));
                    IndexGroup.union(gmax, gmax, Utilities.enforceNotNull(childData.gmax, "No maximal group"));
                }
                // The other operands may always select atoms outside the static part.
                if (this.isStatic(first) && first.getValue().group().size() < gmin.size())
                    this.replaceStaticPart(first, gmin);
                break;
            }
            default:
                throw new UnsupportedExpressionException("xor expressions not implemented", element);
        }
    }

    void replaceStaticPart(SelElement constant, IndexGroup group) {
        IndexGroup value = constant.getValue().group();
        value.copyFrom(group);
        value.squeeze();
        ConstData data = constant.data(ConstData.class);
        if (data.group != null && !data.group.isEmpty()) {
            data.group.copyFrom(group);
            data.group.squeeze();
        }
    }

    /** Remove the annotations of an owned subtree that is being discarded. */
    void forgetAnnotations(SelElement element) {
        for (SelElement child: element.children())
            this.forgetAnnotations(child);
        this.annotations().remove(element);
    }

    /** Discard the subexpressions that are only used inside 'element'.
     * They keep their root until unused subexpressions are removed. */
    void releaseSubexpressionMemory(SelElement element) {
        if (element.is(ElementType.SUBEXPR)) {
            if (this.forest().refCount(element) == 2) {
                for (SelElement child: List.copyOf(element.children())) {
                    this.releaseSubexpressionMemory(child);
                    this.forgetAnnotations(child);
                    this.forest().release(child);
                }
                element.children().clear();
                element.setName(null);
                this.annotations().remove(element);
            }
        } else {
            for (SelElement child: Descent.children(element, true))
                this.releaseSubexpressionMemory(child);
        }
    }

    /**
     * Turn an evaluated element into a constant holding its value.
     * The element keeps its identity, so its parent does not change.
     */
    void makeStatic(SelElement element) {
        CompilerData cd = this.annotations().get(element);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Folding ")
                .append(element.toString())
                .append(" to a constant")
                .newline();
        if (element.is(ElementType.SUBEXPRREF) && cd.has(CompilerFlag.SIMPLESUBEXPR)) {
            SelElement target = element.refTarget();
            if (target.hasChildren()) {
                SelElement body = target.child(0);
                if (body.hasFlag(ElementFlag.ALLOCVAL) || body.hasFlag(ElementFlag.ALLOCDATA)) {
                    StoragePlanner.alias(element, body);
                    StoragePlanner.moveOwnership(body, element);
                }
            }
        }
        this.releaseSubexpressionMemory(element);
        SelectionValue value = element.getValue();
        value.detachFromPool();
        element.mempool = null;
        for (SelElement child: element.children())
            this.forgetAnnotations(child);
        // Releases the target of a reference, which is reached through the payload.
        this.forest().release(element);
        element.setName(null);
        boolean group = value.type == ValueType.GROUP_VALUE;
        element.setData(new ConstData(group ? value.group().copy() : null));
        cd.evaluator = EvalFunction.NONE;
        cd.analysisDisabled = true;
        if (group && !cd.has(CompilerFlag.MINMAXALLOC)) {
            cd.gmin = value.group();
            cd.gmax = value.group();
        }
    }
}
