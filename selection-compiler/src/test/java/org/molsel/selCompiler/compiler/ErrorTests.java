package org.molsel.selCompiler.compiler;

import org.molsel.selCompiler.compiler.errors.BaseCompilerException;
import org.molsel.selCompiler.compiler.errors.CompilationError;
import org.molsel.selCompiler.compiler.errors.InternalCompilerError;
import org.molsel.selCompiler.compiler.errors.UnsupportedExpressionException;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.selCompiler.ir.data.ArithOp;
import org.molsel.selCompiler.ir.data.BoolOp;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.selCompiler.method.MethodFlag;
import org.molsel.selCompiler.method.PositionType;
import org.molsel.selCompiler.method.SelectionMethod;
import org.junit.Assert;
import org.junit.Test;

import java.util.EnumSet;
import java.util.List;

public class ErrorTests {
    final SelectionCompiler compiler = SelectionFixtures.compiler();
    final SelectionForest forest = this.compiler.forest;

    SelElement atoms(String name, int... atoms) {
        return this.forest.expression(new SelectionFixtures.AtomSet(name, atoms), List.of());
    }

    <T extends BaseCompilerException> T compileFails(Class<T> clazz, String message) {
        T ex = Assert.assertThrows(clazz, this.compiler::compile);
        Assert.assertTrue(ex.getMessage(), ex.getMessage().contains(message));
        return ex;
    }

    @Test
    public void xorIsNotImplemented() {
        SelElement xor = this.forest.booleanOp(BoolOp.XOR, this.atoms("a", 1), this.atoms("b", 2));
        this.compiler.addSelection("s", xor);
        UnsupportedExpressionException ex = this.compileFails(
                UnsupportedExpressionException.class, "xor expressions not implemented");
        Assert.assertSame(xor, ex.element);
        Assert.assertEquals(UnsupportedExpressionException.KIND, ex.getErrorKind());
    }

    @Test
    public void unresolvedGroupReference() {
        this.compiler.addSelection("s", this.forest.booleanOp(BoolOp.AND,
                this.forest.groupRef("protein"), this.atoms("a", 1)));
        InternalCompilerError ex = this.compileFails(
                InternalCompilerError.class, "Unresolved group reference in compilation");
        Assert.assertEquals(InternalCompilerError.KIND, ex.getErrorKind());
    }

    @Test
    public void nonConstantIntegerArithmetic() {
        SelElement count = this.forest.expression(new CountMethod(), List.of());
        this.compiler.addSelection("s", this.forest.arithmetic(ArithOp.NEG, count));
        this.compileFails(UnsupportedExpressionException.class,
                "Non-constant integer expressions not implemented in arithmetic evaluation");
    }

    @Test
    public void charValuedMethodMustHaveStringType() {
        this.compiler.addSelection("s", this.forest.expression(new SelectionFixtures.BrokenCharMethod(), List.of()));
        this.compileFails(InternalCompilerError.class, "Char-valued selection method in non-string element");
    }

    @Test
    public void unknownPositionType() {
        CompilationError ex = Assert.assertThrows(CompilationError.class, () -> PositionType.fromString("res_xyz"));
        Assert.assertTrue(ex.getMessage().contains("res_xyz"));
    }

    @Test
    public void notTakesOneOperand() {
        Assert.assertThrows(InternalCompilerError.class,
                () -> this.forest.booleanOp(BoolOp.NOT, this.atoms("a", 1), this.atoms("b", 2)));
    }

    static final class CountMethod implements SelectionMethod {
        @Override
        public String getName() {
            return "count";
        }

        @Override
        public ValueType getType() {
            return ValueType.INT_VALUE;
        }

        @Override
        public EnumSet<MethodFlag> getFlags() {
            return EnumSet.of(MethodFlag.SINGLEVAL);
        }
    }
}
