package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.errors.InternalCompilerError;
import org.molsel.selCompiler.compiler.errors.UnsupportedExpressionException;
import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.RootPass;
import org.molsel.selCompiler.eval.EvalFunction;
import org.molsel.selCompiler.ir.ElementFlag;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.selCompiler.ir.data.BooleanData;
import org.molsel.selCompiler.ir.data.MethodData;
import org.molsel.selCompiler.ir.value.ValueType;

/** Chooses the production evaluation function of every element. */
public class InitEvaluationFunctions extends RootPass {
    public InitEvaluationFunctions(SelectionCompiler compiler) {
        super(compiler);
    }

    void initialize(SelElement element) {
        for (SelElement child: Descent.children(element, false))
            this.initialize(child);
        element.evaluator = this.select(element);
    }

    EvalFunction select(SelElement element) {
        SelectionForest forest = this.compiler.forest;
        switch (element.getType()) {
            case CONST:
                return element.getValueType() == ValueType.GROUP_VALUE ? EvalFunction.STATIC : EvalFunction.NONE;
            case EXPRESSION: {
                MethodData data = element.data(MethodData.class);
                if (!element.isDynamic() && data.method.hasInitFrame())
                    element.flags.add(ElementFlag.INITFRAME);
                return EvalFunction.METHOD;
            }
            case ARITHMETIC:
                return EvalFunction.ARITHMETIC;
            case MODIFIER:
                return element.getValueType() != ValueType.NO_VALUE ? EvalFunction.MODIFIER : EvalFunction.NONE;
            case BOOLEAN:
                switch (element.data(BooleanData.class).op) {
                    case NOT:
                        return EvalFunction.NOT;
                    case AND:
                        return EvalFunction.AND;
                    case OR:
                        return EvalFunction.OR;
                    default:
                        throw new UnsupportedExpressionException("xor expressions not implemented", element);
                }
            case ROOT:
                return EvalFunction.ROOT;
            case SUBEXPR:
                return forest.refCount(element) == 2 ? EvalFunction.SUBEXPR_SIMPLE : EvalFunction.SUBEXPR;
            case SUBEXPRREF: {
                SelElement target = element.refTarget();
                element.setName(target.getName());
                return forest.refCount(target) == 2 ? EvalFunction.SUBEXPRREF_SIMPLE : EvalFunction.SUBEXPRREF;
            }
            case GROUPREF:
                throw new InternalCompilerError("Unresolved group reference in compilation", element);
            default:
                throw new InternalCompilerError("Unexpected element type " + element.getType(), element);
        }
    }

    @Override
    public void processRoot(SelElement root) {
        this.initialize(root);
    }
}
