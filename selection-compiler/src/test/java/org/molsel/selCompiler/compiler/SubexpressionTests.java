package org.molsel.selCompiler.compiler;

import org.molsel.selCompiler.compiler.annotation.CompilerFlag;
import org.molsel.selCompiler.compiler.passes.ExtractSubexpressions;
import org.molsel.selCompiler.compiler.passes.RemoveUnusedSubexpressions;
import org.molsel.selCompiler.eval.EvalFunction;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.selCompiler.ir.data.BoolOp;
import org.molsel.selCompiler.ir.data.RootData;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.selCompiler.method.MethodParameter;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

/** Shared subexpressions: extraction, pruning, classification and evaluation. */
public class SubexpressionTests {
    final SelectionCompiler compiler = SelectionFixtures.compiler();
    final SelectionForest forest = this.compiler.forest;

    SelElement atoms(String name, int... atoms) {
        return this.forest.expression(new SelectionFixtures.AtomSet(name, atoms), List.of());
    }

    SelElement below(SelectionFixtures.XBelow method) {
        return this.forest.expression(method, List.of());
    }

    SelElement ref(SelElement subexpr) {
        return this.forest.subexprRef(subexpr, null);
    }

    /** Selects atoms from their index and their x coordinate in a frame. */
    interface AtomTest {
        boolean test(int atom, double x);
    }

    static String expected(double shift, AtomTest test) {
        IndexGroup result = new IndexGroup();
        for (int i = 0; i < SelectionFixtures.ATOMS; i++)
            if (test.test(i, i + shift))
                result.add(i);
        return result.toString();
    }

    static String value(Selection selection) {
        return selection.root.child(0).getValue().group().toString();
    }

    SelElement sameResidue(SelElement subexpr) {
        MethodParameter param = new MethodParameter("group", ValueType.GROUP_VALUE);
        return this.forest.expression(new SelectionFixtures.SameResidue(), List.of(param),
                this.forest.subexprRef(subexpr, param));
    }

    @Test
    public void parameterUsedTwiceIsExtracted() {
        SelElement body = this.below(new SelectionFixtures.XBelow(3));
        SelElement subexpr = this.forest.subexpr(body, null);
        SelElement first = this.sameResidue(subexpr);
        SelElement second = this.sameResidue(subexpr);
        SelElement root1 = this.forest.addRoot(this.forest.root("s1", first));
        SelElement root2 = this.forest.addRoot(this.forest.root("s2", second));
        Assert.assertEquals(2, this.forest.refCount(subexpr));

        new ExtractSubexpressions().apply(this.forest);
        Assert.assertEquals(3, this.forest.roots().size());
        Assert.assertSame(subexpr, this.forest.roots().get(0).child(0));
        Assert.assertEquals(3, this.forest.refCount(subexpr));
        Assert.assertNotNull(subexpr.getName());
        Assert.assertSame(subexpr, first.child(0).refTarget());
        Assert.assertSame(subexpr, second.child(0).refTarget());
        Assert.assertSame(root1, this.forest.roots().get(1));

        // Dropping one use leaves a single reference.
        this.forest.removeRoot(root2);
        Assert.assertEquals(2, this.forest.refCount(subexpr));
        Assert.assertTrue(second.children().isEmpty());

        this.compiler.createPasses().apply(this.forest);
        Assert.assertEquals(2, this.forest.roots().size());
        SelElement ref = first.child(0);
        Assert.assertEquals(EvalFunction.SUBEXPR_SIMPLE, subexpr.evaluator);
        Assert.assertEquals(EvalFunction.SUBEXPRREF_SIMPLE, ref.evaluator);
        Assert.assertTrue(this.compiler.annotations().get(subexpr).has(CompilerFlag.SIMPLESUBEXPR));
        Assert.assertTrue(this.compiler.annotations().get(ref).has(CompilerFlag.SIMPLESUBEXPR));
        // The reference, the subexpression and its body share one value.
        Assert.assertSame(ref.getValue().getStore(), subexpr.getValue().getStore());
        Assert.assertSame(ref.getValue().getStore(), body.getValue().getStore());
    }

    @Test
    public void simpleParameterIsEvaluated() {
        SelElement body = this.below(new SelectionFixtures.XBelow(3));
        SelElement subexpr = this.forest.subexpr(body, null);
        SelElement same = this.sameResidue(subexpr);
        Selection selection = this.compiler.addSelection("s", same);
        this.compiler.compile();

        Assert.assertEquals(EvalFunction.SUBEXPR_SIMPLE, subexpr.evaluator);
        this.compiler.evaluate(SelectionFixtures.frame(0));
        // Atoms 0, 1, 2 are in residues 0 and 1.
        Assert.assertEquals("{0,1,2,3}", selection.root.child(0).getValue().group().toString());
        this.compiler.evaluate(SelectionFixtures.frame(-4));
        Assert.assertEquals("{0,1,2,3,4,5,6,7}", selection.root.child(0).getValue().group().toString());
    }

    @Test
    public void unusedVariableIsRemoved() {
        this.compiler.addVariable("unused", this.below(new SelectionFixtures.XBelow(2)));
        SelElement used = this.compiler.addVariable("used", this.atoms("a", 1, 2));
        Selection selection = this.compiler.addSelection("s",
                this.forest.booleanOp(BoolOp.AND, this.forest.subexprRef(used, null),
                        this.below(new SelectionFixtures.XBelow(5))));
        Assert.assertEquals(3, this.forest.roots().size());
        new RemoveUnusedSubexpressions().apply(this.forest);
        Assert.assertEquals(2, this.forest.roots().size());
        Assert.assertSame(used, this.forest.roots().get(0).child(0));
        Assert.assertSame(selection.root, this.forest.roots().get(1));
    }

    @Test
    public void nestedUnusedSubexpressionsAreRemoved() {
        SelElement inner = this.compiler.addVariable("inner", this.atoms("a", 1, 2));
        this.compiler.addVariable("outer", this.forest.booleanOp(BoolOp.NOT, this.forest.subexprRef(inner, null)));
        Assert.assertEquals(2, this.forest.refCount(inner));
        new RemoveUnusedSubexpressions().apply(this.forest);
        Assert.assertTrue(this.forest.roots().isEmpty());
    }

    @Test
    public void staticVariableIsFoldedIntoItsUses() {
        SelElement v = this.compiler.addVariable("v", this.atoms("a", 0, 1, 2, 3));
        Selection s1 = this.compiler.addSelection("s1", this.forest.booleanOp(BoolOp.AND,
                this.forest.subexprRef(v, null), this.below(new SelectionFixtures.XBelow(2))));
        Selection s2 = this.compiler.addSelection("s2", this.forest.booleanOp(BoolOp.OR,
                this.forest.subexprRef(v, null), this.atoms("b", 8)));
        Assert.assertEquals(3, this.forest.refCount(v));
        this.compiler.compile();

        Assert.assertEquals(2, this.forest.roots().size());
        SelElement folded = s2.root.child(0);
        Assert.assertTrue(folded.is(ElementType.CONST));
        Assert.assertEquals("{0,1,2,3,8}", folded.getValue().group().toString());
        Assert.assertTrue(s1.root.child(0).child(0).is(ElementType.CONST));

        this.compiler.evaluate(SelectionFixtures.frame(0));
        Assert.assertEquals("{0,1}", s1.root.child(0).getValue().group().toString());
        Assert.assertEquals("{0,1,2,3,8}", s2.root.child(0).getValue().group().toString());
    }

    @Test
    public void commonSubexpressionWithStaticGroup() {
        SelectionFixtures.XBelow method = new SelectionFixtures.XBelow(4);
        SelElement v = this.compiler.addVariable("v", this.below(method));
        Selection s1 = this.compiler.addSelection("s1", this.forest.booleanOp(BoolOp.AND,
                this.atoms("a", 0, 1, 2), this.forest.subexprRef(v, null)));
        Selection s2 = this.compiler.addSelection("s2", this.forest.booleanOp(BoolOp.AND,
                this.atoms("b", 2, 3, 4, 5), this.forest.subexprRef(v, null)));
        this.compiler.compileForest();

        Assert.assertEquals(3, this.forest.refCount(v));
        Assert.assertTrue(this.compiler.annotations().get(v).has(CompilerFlag.COMMONSUBEXPR));
        Assert.assertEquals(EvalFunction.SUBEXPR_STATICEVAL, v.evaluator);
        SelElement variableRoot = this.forest.roots().get(0);
        Assert.assertSame(v, variableRoot.child(0));
        Assert.assertEquals(EvalFunction.ROOT, variableRoot.evaluator);
        Assert.assertEquals("{0,1,2,3,4,5}", variableRoot.data(RootData.class).evalGroup.toString());
        Assert.assertEquals(0, method.updateCalls);

        this.compiler.evaluate(SelectionFixtures.frame(0));
        Assert.assertEquals("{0,1,2}", s1.root.child(0).getValue().group().toString());
        Assert.assertEquals("{2,3}", s2.root.child(0).getValue().group().toString());
        Assert.assertEquals(1, method.updateCalls);

        this.compiler.evaluate(SelectionFixtures.frame(2));
        Assert.assertEquals("{0,1}", s1.root.child(0).getValue().group().toString());
        Assert.assertTrue(s2.root.child(0).getValue().group().isEmpty());
        Assert.assertEquals(2, method.updateCalls);
    }

    @Test
    public void commonSubexpressionEvaluatedIncrementally() {
        SelectionFixtures.XBelow method = new SelectionFixtures.XBelow(4);
        SelElement v = this.compiler.addVariable("v", this.below(method));
        Selection s1 = this.compiler.addSelection("s1", this.forest.booleanOp(BoolOp.OR,
                this.below(new SelectionFixtures.XBelow(1)), this.forest.subexprRef(v, null)));
        Selection s2 = this.compiler.addSelection("s2", this.forest.booleanOp(BoolOp.AND,
                this.atoms("b", 2, 3, 4, 5), this.forest.subexprRef(v, null)));
        this.compiler.compile();

        Assert.assertEquals(EvalFunction.SUBEXPR, v.evaluator);
        Assert.assertEquals(EvalFunction.NONE, this.forest.roots().get(0).evaluator);

        this.compiler.evaluate(SelectionFixtures.frame(0));
        Assert.assertEquals("{0,1,2,3}", s1.root.child(0).getValue().group().toString());
        Assert.assertEquals("{2,3}", s2.root.child(0).getValue().group().toString());

        this.compiler.evaluate(SelectionFixtures.frame(-2));
        Assert.assertEquals("{0,1,2,3,4,5}", s1.root.child(0).getValue().group().toString());
        Assert.assertEquals("{2,3,4,5}", s2.root.child(0).getValue().group().toString());
    }

    @Test
    public void variableUsedDirectlyAndInsideAnother() {
        SelElement v0 = this.compiler.addVariable("v0", this.below(new SelectionFixtures.XBelow(5)));
        SelElement v1 = this.compiler.addVariable("v1", this.forest.booleanOp(BoolOp.OR,
                this.atoms("a", 0, 6, 7), this.ref(v0),
                this.forest.booleanOp(BoolOp.AND, this.atoms("b", 5), this.ref(v0))));
        Selection s1 = this.compiler.addSelection("s1", this.ref(v1));
        Selection s2 = this.compiler.addSelection("s2", this.ref(v0));
        this.compiler.compile();

        // A selection made of the variable alone evaluates it for all atoms.
        Assert.assertEquals(EvalFunction.SUBEXPR_STATICEVAL, v0.evaluator);
        for (double shift: new double[] { 0, -8, 3, 2.5, 20 }) {
            this.compiler.evaluate(SelectionFixtures.frame(shift));
            Assert.assertEquals("shift " + shift, expected(shift, (i, x) -> x < 5), value(s2));
            Assert.assertEquals("shift " + shift,
                    expected(shift, (i, x) -> i == 0 || i == 6 || i == 7 || x < 5), value(s1));
        }
    }

    @Test
    public void repeatedVariableInsideDisjunction() {
        SelElement v0 = this.compiler.addVariable("v0", this.atoms("a", 1, 2, 4, 5, 6, 8));
        SelElement v1 = this.compiler.addVariable("v1", this.forest.booleanOp(BoolOp.OR,
                this.forest.booleanOp(BoolOp.OR,
                        this.below(new SelectionFixtures.XBelow(7)), this.ref(v0), this.atoms("b", 1, 3, 5, 7)),
                this.below(new SelectionFixtures.XBelow(6)), this.ref(v0)));
        Selection s1 = this.compiler.addSelection("s1", this.forest.booleanOp(BoolOp.AND,
                this.atoms("c", 0, 1, 2, 3, 4, 5), this.ref(v1)));
        Selection s2 = this.compiler.addSelection("s2", this.forest.booleanOp(BoolOp.NOT, this.ref(v0)));
        Selection s3 = this.compiler.addSelection("s3", this.forest.booleanOp(BoolOp.AND,
                this.ref(v1), this.forest.booleanOp(BoolOp.NOT, this.ref(v0))));
        this.compiler.compile();

        AtomTest inV0 = (i, x) -> i == 1 || i == 2 || i == 4 || i == 5 || i == 6 || i == 8;
        AtomTest inV1 = (i, x) -> x < 7 || inV0.test(i, x) || i == 1 || i == 3 || i == 5 || i == 7;
        for (double shift = -10; shift <= 10; shift += 1.25) {
            this.compiler.evaluate(SelectionFixtures.frame(shift));
            Assert.assertEquals("shift " + shift,
                    expected(shift, (i, x) -> i <= 5 && inV1.test(i, x)), value(s1));
            Assert.assertEquals("shift " + shift, expected(shift, (i, x) -> !inV0.test(i, x)), value(s2));
            Assert.assertEquals("shift " + shift,
                    expected(shift, (i, x) -> inV1.test(i, x) && !inV0.test(i, x)), value(s3));
        }
    }

    @Test
    public void commonSubexpressionWithThreeReferences() {
        SelectionFixtures.AtomSet core = new SelectionFixtures.AtomSet("core", 0, 1, 2, 3, 4, 5, 6);
        SelectionFixtures.XBelow dynamic = new SelectionFixtures.XBelow(4);
        SelElement v = this.compiler.addVariable("v", this.forest.booleanOp(BoolOp.AND,
                this.forest.expression(core, List.of()), this.below(dynamic)));
        int[][] groups = { { 0, 1, 2 }, { 1, 2, 3 }, { 2, 3, 4 } };
        Selection[] selections = new Selection[groups.length];
        for (int k = 0; k < groups.length; k++) {
            // The reference follows a dynamic operand, so it only sees part of the atoms.
            selections[k] = this.compiler.addSelection("s" + k, this.forest.booleanOp(BoolOp.AND,
                    this.atoms("g" + k, groups[k]), this.below(new SelectionFixtures.XBelow(9)), this.ref(v)));
        }
        Assert.assertEquals(4, this.forest.refCount(v));
        this.compiler.compile();

        Assert.assertEquals(EvalFunction.SUBEXPR, v.evaluator);
        Assert.assertEquals(EvalFunction.NONE, this.forest.roots().get(0).evaluator);
        Assert.assertTrue(v.child(0).child(0).is(ElementType.CONST));
        int coreUpdates = core.updateCalls;
        Assert.assertTrue(coreUpdates > 0);

        for (double shift: new double[] { 0, -2, 2 }) {
            int before = dynamic.updateCalls;
            this.compiler.evaluate(SelectionFixtures.frame(shift));
            // Each reference evaluates the variable only for the atoms the previous ones did not cover.
            Assert.assertEquals("shift " + shift, before + groups.length, dynamic.updateCalls);
            Assert.assertEquals(coreUpdates, core.updateCalls);
            for (int k = 0; k < groups.length; k++) {
                int[] group = groups[k];
                Assert.assertEquals("shift " + shift + " s" + k, expected(shift, (i, x) -> {
                    boolean inGroup = false;
                    for (int atom: group)
                        inGroup |= atom == i;
                    return inGroup && x < 9 && i <= 6 && x < 4;
                }), value(selections[k]));
            }
        }
    }
}
