package org.molsel.selCompiler.compiler;

import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.data.BoolOp;
import org.junit.Assert;
import org.junit.Test;

import java.util.EnumSet;
import java.util.List;

public class MassChargeTests {
    static final double EPSILON = 1e-12;

    static SelElement atoms(SelectionCompiler compiler, int... atoms) {
        return compiler.forest.expression(new SelectionFixtures.AtomSet("a", atoms), List.of());
    }

    static SelElement staticAndDynamic(SelectionCompiler compiler) {
        return compiler.forest.booleanOp(BoolOp.AND, atoms(compiler, 1, 2, 3),
                compiler.forest.expression(new SelectionFixtures.XBelow(5), List.of()));
    }

    @Test
    public void staticSelection() {
        SelectionCompiler compiler = SelectionFixtures.compiler();
        Selection selection = compiler.addSelection("s", atoms(compiler, 0, 4, 8));
        compiler.compile();
        Assert.assertFalse(selection.isDynamic());
        Assert.assertArrayEquals(new double[] { 1, 5, 9 }, selection.getOriginalMasses(), EPSILON);
        Assert.assertArrayEquals(new double[] { 0.5, 0.5, 0.5 }, selection.getOriginalCharges(), EPSILON);
        Assert.assertTrue(selection.sharesMassArrays());
        compiler.evaluate(SelectionFixtures.frame(0));
        Assert.assertTrue(selection.sharesMassArrays());
    }

    @Test
    public void dynamicSelectionFollowsFrames() {
        SelectionCompiler compiler = SelectionFixtures.compiler();
        Selection selection = compiler.addSelection("s", staticAndDynamic(compiler));
        compiler.compile();
        Assert.assertTrue(selection.isDynamic());
        Assert.assertFalse(selection.sharesMassArrays());
        Assert.assertArrayEquals(new double[] { 2, 3, 4 }, selection.getOriginalMasses(), EPSILON);

        compiler.evaluate(SelectionFixtures.frame(2.5));
        Assert.assertArrayEquals(new double[] { 2, 3 }, selection.getMasses(), EPSILON);
        Assert.assertArrayEquals(new double[] { -0.5, 0.5 }, selection.getCharges(), EPSILON);
        Assert.assertArrayEquals(new double[] { 2, 3, 4 }, selection.getOriginalMasses(), EPSILON);

        compiler.evaluate(SelectionFixtures.frame(0));
        Assert.assertArrayEquals(new double[] { 2, 3, 4 }, selection.getMasses(), EPSILON);
    }

    @Test
    public void dynamicMaskKeepsMaximalArrays() {
        SelectionCompiler compiler = SelectionFixtures.compiler();
        Selection selection = compiler.addSelection("s", staticAndDynamic(compiler),
                EnumSet.of(SelectionFlag.DYNAMIC_MASK));
        compiler.compile();
        Assert.assertTrue(selection.isDynamic());
        Assert.assertTrue(selection.sharesMassArrays());
        compiler.evaluate(SelectionFixtures.frame(2.5));
        Assert.assertTrue(selection.sharesMassArrays());
        Assert.assertEquals(3, selection.getMasses().length);
    }

    @Test
    public void withoutTopology() {
        SelectionCompiler compiler = new SelectionCompiler(new CompilerOptions(), null, 6);
        Selection selection = compiler.addSelection("s", atoms(compiler, 1, 5));
        compiler.compile();
        Assert.assertArrayEquals(new double[] { 1, 1 }, selection.getOriginalMasses(), EPSILON);
        Assert.assertArrayEquals(new double[] { 0, 0 }, selection.getOriginalCharges(), EPSILON);
    }
}
