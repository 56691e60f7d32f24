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

package org.molsel.selCompiler.ir;

import org.molsel.selCompiler.ir.data.ArithOp;
import org.molsel.selCompiler.ir.data.ArithmeticData;
import org.molsel.selCompiler.ir.data.BoolOp;
import org.molsel.selCompiler.ir.data.BooleanData;
import org.molsel.selCompiler.ir.data.ConstData;
import org.molsel.selCompiler.ir.data.ElementData;
import org.molsel.selCompiler.ir.data.GroupRefData;
import org.molsel.selCompiler.ir.data.MethodData;
import org.molsel.selCompiler.ir.data.RootData;
import org.molsel.selCompiler.ir.data.SubexprData;
import org.molsel.selCompiler.ir.data.SubexprRefData;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.ir.value.SelectionValue;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.selCompiler.method.MethodFlag;
import org.molsel.selCompiler.method.MethodParameter;
import org.molsel.selCompiler.method.SelectionMethod;
import org.molsel.util.IIndentStream;
import org.molsel.util.Linq;
import org.molsel.util.ToIndentableString;
import org.molsel.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * The ordered list of roots of a selection collection, together with the
 * reference counts of all shared subexpressions.  A subexpression is counted
 * once for the root that owns it and once for every reference pointing to it.
 * All elements are created through this class so that the counts stay consistent.
 */
public final class SelectionForest implements ToIndentableString {
    private final List<SelElement> roots = new ArrayList<>();
    private final Map<SelElement, Integer> refCounts = new IdentityHashMap<>();
    /** The group of all atoms. */
    public final IndexGroup all;

    public SelectionForest(int atomCount) {
        this.all = IndexGroup.range(atomCount);
        this.all.setName("all");
    }

    /** Roots in evaluation order.  The list can be edited by compiler passes. */
    public List<SelElement> roots() {
        return this.roots;
    }

    public SelElement addRoot(SelElement root) {
        Utilities.enforce(root.is(ElementType.ROOT), "Not a root: " + root);
        this.roots.add(root);
        return root;
    }

    public int refCount(SelElement subexpr) {
        Utilities.enforce(subexpr.is(ElementType.SUBEXPR), "Not a subexpression: " + subexpr);
        return this.refCounts.getOrDefault(subexpr, 0);
    }

    public void incrementReference(SelElement subexpr) {
        this.refCounts.put(subexpr, this.refCount(subexpr) + 1);
    }

    void link(SelElement child) {
        if (child.is(ElementType.SUBEXPR))
            this.incrementReference(child);
    }

    /** Point a reference to a new target, which takes over the ownership the
     * reference had of its old target. */
    public void retarget(SelElement ref, SelElement target) {
        ref.data(SubexprRefData.class).retarget(target);
        this.link(target);
    }

    /**
     * Drop an element: its owned subtree is destroyed and every reference
     * it contains releases its target.  A subexpression is only destroyed
     * when its last reference is released.
     */
    public void release(SelElement element) {
        if (element.is(ElementType.SUBEXPR)) {
            int count = this.refCount(element) - 1;
            if (count > 0) {
                this.refCounts.put(element, count);
                return;
            }
            this.refCounts.remove(element);
        }
        if (element.is(ElementType.SUBEXPRREF))
            this.release(element.refTarget());
        for (SelElement child: element.children())
            this.release(child);
        element.children().clear();
    }

    /** Remove a root from the forest and release it. */
    public void removeRoot(SelElement root) {
        boolean removed = this.roots.remove(root);
        Utilities.enforce(removed, "Root not in forest " + root);
        this.release(root);
    }

    // Element factories

    static EnumSet<ElementFlag> inherited(SelElement element) {
        EnumSet<ElementFlag> result = EnumSet.noneOf(ElementFlag.class);
        for (ElementFlag flag: element.flags)
            if (flag == ElementFlag.DYNAMIC || ElementFlag.VALUE_FLAGS.contains(flag))
                result.add(flag);
        return result;
    }

    static boolean anyDynamic(List<SelElement> elements) {
        return Linq.any(elements, SelElement::isDynamic);
    }

    public SelElement create(ElementData data, ValueType type, EnumSet<ElementFlag> flags, List<SelElement> children) {
        SelElement result = new SelElement(data, type, flags, children);
        for (SelElement child: children)
            this.link(child);
        return result;
    }

    public SelElement root(@Nullable String name, SelElement child) {
        SelElement result = this.create(new RootData(), ValueType.NO_VALUE,
                EnumSet.noneOf(ElementFlag.class), List.of(child));
        result.setName(name);
        return result;
    }

    /** A subexpression without any reference; the caller links it to a root or references. */
    public SelElement subexpr(SelElement child, @Nullable String name) {
        SelElement result = this.create(new SubexprData(), child.getValueType(), inherited(child), List.of(child));
        result.setName(name);
        return result;
    }

    public SelElement subexprRef(SelElement target, @Nullable MethodParameter param) {
        EnumSet<ElementFlag> flags = inherited(target);
        if (param != null && param.isAtomValued()) {
            flags.removeAll(ElementFlag.VALUE_FLAGS);
            flags.add(ElementFlag.ATOMVAL);
        }
        SelElement result = this.create(new SubexprRefData(target, param), target.getValueType(), flags, List.of());
        if (param != null)
            param.value.setStore(result.getValue().getStore());
        this.link(target);
        return result;
    }

    /** A constant group coming from an external named group. */
    public SelElement constGroup(IndexGroup group, @Nullable String name) {
        SelElement result = this.create(new ConstData(group.copy()), ValueType.GROUP_VALUE,
                EnumSet.of(ElementFlag.SINGLEVAL), List.of());
        result.getValue().group().copyFrom(group);
        result.getValue().setCount(1);
        result.setName(name);
        return result;
    }

    public SelElement constInt(int... values) {
        SelElement result = this.create(new ConstData(), ValueType.INT_VALUE, constFlags(values.length), List.of());
        SelectionValue value = result.getValue();
        value.reserve(values.length);
        System.arraycopy(values, 0, value.ints(), 0, values.length);
        value.setCount(values.length);
        return result;
    }

    public SelElement constReal(double... values) {
        SelElement result = this.create(new ConstData(), ValueType.REAL_VALUE, constFlags(values.length), List.of());
        SelectionValue value = result.getValue();
        value.reserve(values.length);
        System.arraycopy(values, 0, value.reals(), 0, values.length);
        value.setCount(values.length);
        return result;
    }

    public SelElement constString(String... values) {
        SelElement result = this.create(new ConstData(), ValueType.STR_VALUE, constFlags(values.length), List.of());
        SelectionValue value = result.getValue();
        value.reserve(values.length);
        System.arraycopy(values, 0, value.strings(), 0, values.length);
        value.setCount(values.length);
        return result;
    }

    static EnumSet<ElementFlag> constFlags(int count) {
        return EnumSet.of(count == 1 ? ElementFlag.SINGLEVAL : ElementFlag.VARNUMVAL);
    }

    static EnumSet<ElementFlag> methodFlags(SelectionMethod method, List<SelElement> children) {
        EnumSet<ElementFlag> flags = EnumSet.noneOf(ElementFlag.class);
        if (method.getFlags().contains(MethodFlag.DYNAMIC) || anyDynamic(children))
            flags.add(ElementFlag.DYNAMIC);
        ValueType type = method.getType();
        if (method.getFlags().contains(MethodFlag.SINGLEVAL)
                || type == ValueType.GROUP_VALUE || type == ValueType.POS_VALUE)
            flags.add(ElementFlag.SINGLEVAL);
        else if (method.getFlags().contains(MethodFlag.VARNUMVAL))
            flags.add(ElementFlag.VARNUMVAL);
        else
            flags.add(ElementFlag.ATOMVAL);
        return flags;
    }

    /**
     * An invocation of a method.  Constant parameter values are stored in the
     * parameters; each child is a reference (or constant) supplying one parameter.
     */
    public SelElement expression(SelectionMethod method, List<MethodParameter> params, SelElement... children) {
        List<SelElement> list = Arrays.asList(children);
        return this.create(new MethodData(method, false, params), method.getType(),
                methodFlags(method, list), list);
    }

    /** A modifier; the first child supplies the positions to transform. */
    public SelElement modifier(SelectionMethod method, List<MethodParameter> params, SelElement... children) {
        List<SelElement> list = Arrays.asList(children);
        return this.create(new MethodData(method, true, params), method.getType(),
                methodFlags(method, list), list);
    }

    public SelElement booleanOp(BoolOp op, SelElement... children) {
        List<SelElement> list = Arrays.asList(children);
        Utilities.enforce(op != BoolOp.NOT || list.size() == 1, "NOT has exactly one operand");
        EnumSet<ElementFlag> flags = EnumSet.of(ElementFlag.SINGLEVAL);
        if (anyDynamic(list))
            flags.add(ElementFlag.DYNAMIC);
        return this.create(new BooleanData(op), ValueType.GROUP_VALUE, flags, list);
    }

    public SelElement arithmetic(ArithOp op, SelElement... children) {
        List<SelElement> list = Arrays.asList(children);
        Utilities.enforce(list.size() == (op.isUnary() ? 1 : 2), "Wrong operand count for " + op);
        EnumSet<ElementFlag> flags = EnumSet.noneOf(ElementFlag.class);
        if (anyDynamic(list))
            flags.add(ElementFlag.DYNAMIC);
        if (Linq.any(list, c -> !c.hasFlag(ElementFlag.SINGLEVAL)))
            flags.add(ElementFlag.ATOMVAL);
        else
            flags.add(ElementFlag.SINGLEVAL);
        return this.create(new ArithmeticData(op), ValueType.REAL_VALUE, flags, list);
    }

    public SelElement groupRef(String name) {
        return this.create(new GroupRefData(name), ValueType.GROUP_VALUE,
                EnumSet.of(ElementFlag.SINGLEVAL), List.of());
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        for (SelElement root: this.roots) {
            builder.append(root);
            builder.newline();
        }
        return builder;
    }

    @Override
    public String toString() {
        return this.toIndentedString();
    }
}
