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

package org.molsel.selCompiler.compiler;

import org.molsel.selCompiler.compiler.annotation.CompilerData;
import org.molsel.selCompiler.eval.EvalFunction;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.selCompiler.ir.data.ArithOp;
import org.molsel.selCompiler.ir.data.BoolOp;
import org.molsel.selCompiler.ir.data.ConstData;
import org.molsel.selCompiler.ir.data.RootData;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.ir.value.ValueType;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

/** Compiles and evaluates complete selections. */
public class CompilerTests {
    final SelectionCompiler compiler = SelectionFixtures.compiler();
    final SelectionForest forest = this.compiler.forest;

    SelElement atoms(String name, int... atoms) {
        return this.forest.expression(new SelectionFixtures.AtomSet(name, atoms), List.of());
    }

    SelElement below(double limit) {
        return this.forest.expression(new SelectionFixtures.XBelow(limit), List.of());
    }

    CompilerData data(SelElement element) {
        return this.compiler.annotations().get(element);
    }

    static IndexGroup value(Selection selection) {
        return selection.root.child(0).getValue().group();
    }

    /** The bounds of a dynamic boolean always contain the value computed for a frame. */
    void checkBounds(SelElement element, CompilerData cd) {
        IndexGroup value = element.getValue().group();
        Assert.assertNotNull(cd.gmin);
        Assert.assertNotNull(cd.gmax);
        Assert.assertTrue(cd.gmin + " not in " + value, cd.gmin.isSubsetOf(value));
        Assert.assertTrue(value + " not in " + cd.gmax, value.isSubsetOf(cd.gmax));
    }

    @Test
    public void staticAndDynamic() {
        SelElement a = this.atoms("a", 1, 2, 3);
        SelElement b = this.below(5);
        SelElement and = this.forest.booleanOp(BoolOp.AND, a, b);
        Selection selection = this.compiler.addSelection("s", and);
        this.compiler.compileForest();

        Assert.assertSame(and, selection.root.child(0));
        Assert.assertTrue(and.isDynamic());
        Assert.assertTrue(and.is(ElementType.BOOLEAN));
        SelElement first = and.child(0);
        Assert.assertTrue(first.is(ElementType.CONST));
        Assert.assertEquals("{1,2,3}", first.data(ConstData.class).group.toString());
        Assert.assertSame(b, and.child(1));

        CompilerData cd = this.data(and);
        Assert.assertNotNull(cd.gmax);
        Assert.assertTrue(cd.gmax.isSubsetOf(IndexGroup.of(1, 2, 3)));
        Assert.assertNotNull(cd.gmin);
        Assert.assertTrue(cd.gmin.isEmpty());
        Assert.assertEquals("{1,2,3}", selection.root.data(RootData.class).evalGroup.toString());
        Assert.assertTrue(selection.isDynamic());

        this.compiler.evaluate(SelectionFixtures.frame(0));
        Assert.assertEquals("{1,2,3}", value(selection).toString());
        this.checkBounds(and, cd);
        this.compiler.evaluate(SelectionFixtures.frame(2.5));
        Assert.assertEquals("{1,2}", value(selection).toString());
        this.checkBounds(and, cd);
        this.compiler.evaluate(SelectionFixtures.frame(10));
        Assert.assertTrue(value(selection).isEmpty());
    }

    @Test
    public void staticPrefixIsFolded() {
        SelElement b = this.below(4);
        SelElement and = this.forest.booleanOp(BoolOp.AND,
                this.atoms("a", 1, 2, 3, 6), b, this.atoms("c", 2, 3, 4, 6));
        Selection selection = this.compiler.addSelection("s", and);
        this.compiler.compileForest();

        Assert.assertEquals(2, and.children().size());
        SelElement first = and.child(0);
        Assert.assertTrue(first.is(ElementType.CONST));
        Assert.assertEquals(ValueType.GROUP_VALUE, first.getValueType());
        Assert.assertSame(b, and.child(1));
        Assert.assertTrue(this.data(and).gmax.isSubsetOf(IndexGroup.of(2, 3, 6)));

        this.compiler.evaluate(SelectionFixtures.frame(0));
        Assert.assertEquals("{2,3}", value(selection).toString());
        this.compiler.evaluate(SelectionFixtures.frame(-3));
        Assert.assertEquals("{2,3,6}", value(selection).toString());
    }

    @Test
    public void staticOrIsFolded() {
        SelElement or = this.forest.booleanOp(BoolOp.OR, this.atoms("a", 1, 2), this.atoms("b", 2, 5));
        Selection selection = this.compiler.addSelection("s", or);
        this.compiler.compileForest();

        SelElement result = selection.root.child(0);
        Assert.assertTrue(result.is(ElementType.CONST));
        Assert.assertFalse(result.isDynamic());
        Assert.assertEquals("{1,2,5}", result.getValue().group().toString());
        Assert.assertFalse(selection.isDynamic());

        this.compiler.evaluate(SelectionFixtures.frame(3));
        Assert.assertEquals("{1,2,5}", value(selection).toString());
    }

    @Test
    public void staticMethodIsInitializedOnce() {
        SelectionFixtures.AtomSet method = new SelectionFixtures.AtomSet("a", 0, 4, 8);
        Selection selection = this.compiler.addSelection("s",
                this.forest.expression(method, List.of()));
        this.compiler.compileForest();
        Assert.assertEquals(1, method.initCalls);
        Assert.assertEquals(1, method.updateCalls);
        Assert.assertTrue(selection.root.child(0).is(ElementType.CONST));

        this.compiler.evaluate(SelectionFixtures.frame(0));
        this.compiler.evaluate(SelectionFixtures.frame(1));
        Assert.assertEquals(1, method.updateCalls);
        Assert.assertEquals("{0,4,8}", value(selection).toString());
    }

    @Test
    public void orBounds() {
        SelElement b = this.below(3);
        SelElement or = this.forest.booleanOp(BoolOp.OR, this.atoms("a", 1, 2), b);
        Selection selection = this.compiler.addSelection("s", or);
        this.compiler.compileForest();

        CompilerData cd = this.data(or);
        Assert.assertEquals("{1,2}", String.valueOf(cd.gmin));
        Assert.assertNotNull(cd.gmax);
        Assert.assertEquals(SelectionFixtures.ATOMS, cd.gmax.size());
        Assert.assertEquals(EvalFunction.NONE, or.child(0).evaluator);

        this.compiler.evaluate(SelectionFixtures.frame(0));
        Assert.assertEquals("{0,1,2}", value(selection).toString());
        this.checkBounds(or, cd);
        this.compiler.evaluate(SelectionFixtures.frame(-2));
        Assert.assertEquals("{0,1,2,3,4}", value(selection).toString());
        this.checkBounds(or, cd);
        this.compiler.evaluate(SelectionFixtures.frame(20));
        Assert.assertEquals("{1,2}", value(selection).toString());
        this.checkBounds(or, cd);
    }

    @Test
    public void notBounds() {
        SelElement not = this.forest.booleanOp(BoolOp.NOT, this.below(3));
        Selection selection = this.compiler.addSelection("s", not);
        this.compiler.compileForest();

        CompilerData cd = this.data(not);
        Assert.assertNotNull(cd.gmin);
        Assert.assertTrue(cd.gmin.isEmpty());
        Assert.assertNotNull(cd.gmax);
        Assert.assertEquals(SelectionFixtures.ATOMS, cd.gmax.size());

        this.compiler.evaluate(SelectionFixtures.frame(0));
        Assert.assertEquals("{3,4,5,6,7,8,9}", value(selection).toString());
        this.checkBounds(not, cd);
    }

    @Test
    public void nestedBooleanBounds() {
        // (a or x < 2) and not (x < 7)
        SelElement or = this.forest.booleanOp(BoolOp.OR, this.atoms("a", 5, 8, 9), this.below(2));
        SelElement not = this.forest.booleanOp(BoolOp.NOT, this.below(7));
        SelElement and = this.forest.booleanOp(BoolOp.AND, or, not);
        Selection selection = this.compiler.addSelection("s", and);
        this.compiler.compileForest();

        for (double shift = -6; shift <= 6; shift += 1.5) {
            this.compiler.evaluate(SelectionFixtures.frame(shift));
            IndexGroup expected = new IndexGroup();
            for (int i = 0; i < SelectionFixtures.ATOMS; i++) {
                double x = i + shift;
                boolean inOr = i == 5 || i == 8 || i == 9 || x < 2;
                if (inOr && !(x < 7))
                    expected.add(i);
            }
            Assert.assertEquals("shift " + shift, expected.toString(), value(selection).toString());
            this.checkBounds(and, this.data(and));
        }
    }

    @Test
    public void arithmeticConstantIsFolded() {
        SelElement sum = this.forest.arithmetic(ArithOp.PLUS, this.forest.constInt(1), this.forest.constReal(2.5));
        SelElement root = this.forest.addRoot(this.forest.root("sum", sum));
        this.compiler.createPasses().apply(this.forest);

        SelElement result = root.child(0);
        Assert.assertTrue(result.is(ElementType.CONST));
        Assert.assertEquals(ValueType.REAL_VALUE, result.getValueType());
        Assert.assertEquals(1, result.getValue().getCount());
        Assert.assertEquals(3.5, result.getValue().reals()[0], 1e-12);
        Assert.assertFalse(result.hasChildren());
    }

    @Test
    public void compileOnlyOnce() {
        this.compiler.addSelection("s", this.atoms("a", 1));
        this.compiler.compileForest();
        Assert.assertTrue(this.compiler.isCompiled());
        Assert.assertThrows(RuntimeException.class, this.compiler::compile);
        Assert.assertThrows(RuntimeException.class, () -> this.compiler.addSelection("t", this.atoms("b", 2)));
    }

    @Test
    public void evaluateRequiresCompilation() {
        this.compiler.addSelection("s", this.below(1));
        Assert.assertThrows(RuntimeException.class, () -> this.compiler.evaluate(SelectionFixtures.frame(0)));
    }

    @Test
    public void compileDropsCompilerData() {
        SelElement and = this.forest.booleanOp(BoolOp.AND, this.atoms("a", 1, 2, 3), this.below(3));
        Selection selection = this.compiler.addSelection("s", and);
        this.compiler.compile();
        Assert.assertEquals(0, this.compiler.annotations().size());
        Assert.assertNull(this.compiler.annotations().getOrNull(and));

        this.compiler.evaluate(SelectionFixtures.frame(0));
        Assert.assertEquals("{1,2}", value(selection).toString());

        SelectionCompiler kept = SelectionFixtures.compiler();
        SelElement other = kept.forest.booleanOp(BoolOp.AND,
                kept.forest.expression(new SelectionFixtures.AtomSet("a", 1, 2, 3), List.of()),
                kept.forest.expression(new SelectionFixtures.XBelow(3), List.of()));
        kept.addSelection("s", other);
        kept.compileForest();
        Assert.assertNotNull(kept.annotations().getOrNull(other));
    }
}
