package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.CompilerOptions;
import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.SelectionFixtures;
import org.molsel.selCompiler.compiler.SelectionFlag;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.data.MethodData;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.selCompiler.method.MethodParameter;
import org.molsel.selCompiler.method.PositionFlag;
import org.junit.Assert;
import org.junit.Test;

import java.util.EnumSet;
import java.util.List;

public class PositionKeywordDefaultsTests {
    final SelectionCompiler compiler;

    public PositionKeywordDefaultsTests() {
        CompilerOptions options = CompilerOptions.parse("--spost", "res_com", "--rpost", "mol_cog");
        this.compiler = new SelectionCompiler(options, SelectionFixtures.topology());
    }

    SelElement keyword() {
        return this.compiler.forest.expression(new SelectionFixtures.PositionKeyword(), List.of());
    }

    static MethodData data(SelElement element) {
        return element.data(MethodData.class);
    }

    @Test
    public void selectionPositions() {
        SelElement keyword = this.keyword();
        this.compiler.addSelection("s", keyword,
                EnumSet.of(SelectionFlag.DYNAMIC_MASK, SelectionFlag.EVALUATE_FORCES));
        new PositionKeywordDefaults(this.compiler).apply(this.compiler.forest);
        Assert.assertEquals("res_com", data(keyword).positionType);
        Assert.assertEquals(EnumSet.of(PositionFlag.COMPLMAX, PositionFlag.MASKONLY, PositionFlag.FORCES),
                data(keyword).positionFlags);
        Assert.assertTrue(keyword.getData().describe().contains("res_com"));
    }

    @Test
    public void selectionThroughVariable() {
        SelElement keyword = this.keyword();
        SelElement variable = this.compiler.addVariable("v", keyword);
        this.compiler.addSelection("s", this.compiler.forest.subexprRef(variable, null),
                EnumSet.of(SelectionFlag.EVALUATE_VELOCITIES));
        new PositionKeywordDefaults(this.compiler).apply(this.compiler.forest);
        Assert.assertEquals("res_com", data(keyword).positionType);
        Assert.assertEquals(EnumSet.of(PositionFlag.COMPLMAX, PositionFlag.VELOCITIES), data(keyword).positionFlags);
    }

    @Test
    public void methodArgumentsUseReferencePositions() {
        SelElement keyword = this.keyword();
        SelElement subexpr = this.compiler.forest.subexpr(keyword, null);
        MethodParameter param = new MethodParameter("positions", ValueType.POS_VALUE);
        SelElement same = this.compiler.forest.expression(new SelectionFixtures.SameResidue(), List.of(param),
                this.compiler.forest.subexprRef(subexpr, param));
        this.compiler.addSelection("s", same);
        new PositionKeywordDefaults(this.compiler).apply(this.compiler.forest);
        Assert.assertEquals("mol_cog", data(keyword).positionType);
        Assert.assertEquals(EnumSet.of(PositionFlag.COMPLWHOLE), data(keyword).positionFlags);
    }

    @Test
    public void explicitTypeIsKept() {
        SelElement keyword = this.keyword();
        data(keyword).positionType = "atom";
        this.compiler.addSelection("s", keyword);
        new PositionKeywordDefaults(this.compiler).apply(this.compiler.forest);
        Assert.assertEquals("atom", data(keyword).positionType);
        Assert.assertTrue(data(keyword).positionFlags.isEmpty());
    }
}
