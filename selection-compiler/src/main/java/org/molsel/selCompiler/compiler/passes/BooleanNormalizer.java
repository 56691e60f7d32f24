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

import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.RootPass;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.data.BoolOp;
import org.molsel.selCompiler.ir.data.BooleanData;
import org.molsel.util.Logger;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Simplifies boolean expressions: removes double negations and merges
 * nested operations of the same kind, e.g., (A or B) or C becomes a single
 * OR with three operands.  Sibling order is preserved.  References are not
 * followed; each subexpression is normalized from its own root.
 */
public class BooleanNormalizer extends RootPass {
    public BooleanNormalizer(SelectionCompiler compiler) {
        super(compiler);
    }

    @Nullable
    static BoolOp booleanOp(SelElement element) {
        if (!element.is(ElementType.BOOLEAN))
            return null;
        return element.data(BooleanData.class).op;
    }

    static boolean isDoubleNegation(SelElement element) {
        return booleanOp(element) == BoolOp.NOT && booleanOp(element.child(0)) == BoolOp.NOT;
    }

    void normalize(SelElement element) {
        List<SelElement> children = Descent.children(element, false);
        for (int i = 0; i < children.size(); i++) {
            SelElement child = children.get(i);
            this.normalize(child);
            while (isDoubleNegation(child)) {
                SelElement inner = child.child(0).child(0);
                Logger.INSTANCE.belowLevel(this, 3)
                        .append("Removing double negation of ")
                        .append(inner.toString())
                        .newline();
                // The negations are discarded without releasing the operand.
                child.child(0).children().clear();
                child.children().clear();
                children.set(i, inner);
                child = inner;
            }
        }

        BoolOp op = booleanOp(element);
        if (op == null || op == BoolOp.NOT)
            return;
        for (int i = 0; i < children.size(); ) {
            SelElement child = children.get(i);
            if (booleanOp(child) == op) {
                List<SelElement> operands = List.copyOf(child.children());
                child.children().clear();
                children.remove(i);
                children.addAll(i, operands);
                i += operands.size();
            } else {
                i++;
            }
        }
    }

    @Override
    public void processRoot(SelElement root) {
        this.normalize(root);
    }
}
