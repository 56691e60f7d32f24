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

import org.molsel.selCompiler.eval.EvalFunction;
import org.molsel.selCompiler.eval.MemoryPool;
import org.molsel.selCompiler.ir.data.ElementData;
import org.molsel.selCompiler.ir.data.SubexprRefData;
import org.molsel.selCompiler.ir.value.SelectionValue;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.util.ICastable;
import org.molsel.util.IHasId;
import org.molsel.util.IIndentStream;
import org.molsel.util.ToIndentableString;
import org.molsel.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * A node of a selection expression tree.
 * The identity of an element is stable: when the compiler folds an element
 * to a constant it replaces the payload, so handles held elsewhere stay valid.
 * Children are owned, except for the target of a SUBEXPRREF, which is
 * reached through the payload.
 */
public final class SelElement implements ICastable, IHasId, ToIndentableString {
    static long crtId = 0;
    final long id;
    private ElementData data;
    @Nullable
    private String name;
    public final EnumSet<ElementFlag> flags;
    private SelectionValue value;
    private final List<SelElement> children;
    /** Function used to evaluate the element for each frame. */
    public EvalFunction evaluator = EvalFunction.NONE;
    /** Pool that provides the value storage during evaluation, if any. */
    @Nullable
    public MemoryPool mempool;

    SelElement(ElementData data, ValueType type, EnumSet<ElementFlag> flags, List<SelElement> children) {
        this.id = crtId++;
        this.data = data;
        this.flags = EnumSet.noneOf(ElementFlag.class);
        this.flags.addAll(flags);
        this.value = new SelectionValue(type);
        if (type != ValueType.NO_VALUE) {
            this.flags.add(ElementFlag.ALLOCVAL);
            if (type == ValueType.GROUP_VALUE || type == ValueType.POS_VALUE)
                this.flags.add(ElementFlag.ALLOCDATA);
        }
        this.children = new ArrayList<>(children);
    }

    /** Reset the id counter; used by tests. */
    public static void reset() {
        crtId = 0;
    }

    @Override
    public long getId() {
        return this.id;
    }

    public ElementType getType() {
        return this.data.getType();
    }

    public boolean is(ElementType type) {
        return this.getType() == type;
    }

    public ElementData getData() {
        return this.data;
    }

    public <T extends ElementData> T data(Class<T> clazz) {
        return this.data.to(clazz);
    }

    /** Replace the payload, changing the variant of the element. */
    public void setData(ElementData data) {
        this.data = data;
    }

    @Nullable
    public String getName() {
        return this.name;
    }

    public void setName(@Nullable String name) {
        this.name = name;
    }

    public String getDisplayName() {
        return this.name != null ? this.name : ("#" + this.id);
    }

    public SelectionValue getValue() {
        return this.value;
    }

    public void setValue(SelectionValue value) {
        this.value = value;
    }

    public ValueType getValueType() {
        return this.value.type;
    }

    public boolean isDynamic() {
        return this.flags.contains(ElementFlag.DYNAMIC);
    }

    public boolean hasFlag(ElementFlag flag) {
        return this.flags.contains(flag);
    }

    /** Owned children; a reference's target is not included. */
    public List<SelElement> children() {
        return this.children;
    }

    public SelElement child(int index) {
        Utilities.enforce(index < this.children.size(), "Element " + this.getDisplayName() + " has no child " + index);
        return this.children.get(index);
    }

    public boolean hasChildren() {
        return !this.children.isEmpty();
    }

    /** The element a SUBEXPRREF points to. */
    public SelElement refTarget() {
        return this.data(SubexprRefData.class).getTarget();
    }

    /** For roots and references: the subexpression below, or null if there is none. */
    @Nullable
    public SelElement subexprBelow() {
        SelElement below;
        if (this.is(ElementType.SUBEXPRREF))
            below = this.refTarget();
        else if (this.is(ElementType.ROOT) && this.hasChildren())
            below = this.child(0);
        else
            return null;
        return below.is(ElementType.SUBEXPR) ? below : null;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.getType().toString());
        String description = this.data.describe();
        if (!description.isEmpty())
            builder.append(" ").append(description);
        if (this.name != null)
            builder.append(" \"").append(this.name).append("\"");
        builder.append(" ").append(this.flags.toString());
        if (this.value.type != ValueType.NO_VALUE)
            builder.append(" ").append(this.value.type.toString());
        if (this.children.isEmpty())
            return builder;
        builder.increase();
        boolean first = true;
        for (SelElement child: this.children) {
            if (!first)
                builder.newline();
            first = false;
            child.toString(builder);
        }
        return builder.decrease();
    }

    @Override
    public String toString() {
        return this.getType() + " " + this.getDisplayName();
    }
}
