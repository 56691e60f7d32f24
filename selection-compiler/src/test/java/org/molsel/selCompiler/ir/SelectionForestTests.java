package org.molsel.selCompiler.ir;

import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.ir.data.BoolOp;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class SelectionForestTests {
    final SelectionForest forest = new SelectionForest(6);

    @Test
    public void referencesAreCounted() {
        SelElement body = this.forest.constGroup(IndexGroup.of(1, 2), "g");
        SelElement subexpr = this.forest.subexpr(body, "v");
        this.forest.addRoot(this.forest.root(null, subexpr));
        Assert.assertEquals(1, this.forest.refCount(subexpr));

        SelElement ref1 = this.forest.subexprRef(subexpr, null);
        SelElement ref2 = this.forest.subexprRef(subexpr, null);
        SelElement not = this.forest.booleanOp(BoolOp.NOT, ref1);
        SelElement root = this.forest.addRoot(this.forest.root("s", this.forest.booleanOp(BoolOp.OR, not, ref2)));
        Assert.assertEquals(3, this.forest.refCount(subexpr));
        Assert.assertSame(subexpr, ref1.refTarget());

        this.forest.removeRoot(root);
        Assert.assertEquals(1, this.forest.refCount(subexpr));
        Assert.assertTrue(not.children().isEmpty());
        Assert.assertSame(body, subexpr.child(0));
        Assert.assertEquals(1, this.forest.roots().size());
    }

    @Test
    public void retargetMovesOwnership() {
        SelElement first = this.forest.subexpr(this.forest.constGroup(IndexGroup.of(1), null), null);
        SelElement second = this.forest.subexpr(this.forest.constGroup(IndexGroup.of(2), null), null);
        SelElement ref = this.forest.subexprRef(first, null);
        this.forest.retarget(ref, second);
        Assert.assertSame(second, ref.refTarget());
        Assert.assertEquals(1, this.forest.refCount(second));
    }

    @Test
    public void descentStopsAtReferences() {
        SelElement body = this.forest.constGroup(IndexGroup.of(3), null);
        SelElement subexpr = this.forest.subexpr(body, null);
        SelElement ref = this.forest.subexprRef(subexpr, null);
        Assert.assertTrue(Descent.children(ref, false).isEmpty());
        Assert.assertEquals(List.of(subexpr), Descent.children(ref, true));
        Assert.assertEquals(List.of(body), Descent.children(subexpr, false));
    }

    @Test
    public void flagsFollowOperands() {
        SelElement constant = this.forest.constGroup(IndexGroup.of(1, 2), null);
        Assert.assertTrue(constant.hasFlag(ElementFlag.SINGLEVAL));
        Assert.assertFalse(constant.isDynamic());
        Assert.assertEquals("{1,2}", constant.getValue().group().toString());
        SelElement values = this.forest.constReal(1.0, 2.0);
        Assert.assertTrue(values.hasFlag(ElementFlag.VARNUMVAL));
        Assert.assertEquals(2, values.getValue().getCount());
    }
}
