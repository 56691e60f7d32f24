package org.molsel.selCompiler.compiler.passes;

import org.molsel.selCompiler.compiler.SelectionCompiler;
import org.molsel.selCompiler.compiler.annotation.CompilerData;
import org.molsel.selCompiler.compiler.annotation.CompilerFlag;
import org.molsel.selCompiler.compiler.visitors.Descent;
import org.molsel.selCompiler.compiler.visitors.RootPass;
import org.molsel.selCompiler.eval.EvalFunction;
import org.molsel.selCompiler.ir.ElementFlag;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.value.SelectionValue;
import org.molsel.selCompiler.ir.value.ValueStore;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.selCompiler.ir.data.SubexprRefData;
import org.molsel.util.Logger;

import java.util.EnumSet;

/**
 * Decides which elements share a value store.
 * A subexpression with a single reference, its body and the reference all
 * use one store; a subexpression evaluated once for its full group uses the
 * store of its body.
 */
public class StoragePlanner extends RootPass {
    static final EnumSet<ElementFlag> ALLOC_FLAGS = EnumSet.of(ElementFlag.ALLOCVAL, ElementFlag.ALLOCDATA);

    public StoragePlanner(SelectionCompiler compiler) {
        super(compiler);
    }

    /**
     * Size the value of an element for an evaluation group of 'size' atoms.
     * Elements using the memory pool get their storage when evaluated.
     * Elements with a variable number of values are only sized if
     * 'childEvaluated' is set, from the value of the element computing them.
     */
    public static void allocate(SelElement element, int size, boolean childEvaluated) {
        if (element.mempool != null)
            return;
        int count;
        if (element.hasFlag(ElementFlag.SINGLEVAL)) {
            count = 1;
        } else if (element.hasFlag(ElementFlag.ATOMVAL)) {
            count = size;
        } else {
            if (!childEvaluated)
                return;
            SelElement source = element;
            if (element.is(ElementType.SUBEXPRREF))
                source = element.refTarget().child(0);
            else if (element.is(ElementType.SUBEXPR))
                source = element.child(0);
            SelectionValue value = source.getValue();
            count = value.type == ValueType.POS_VALUE ? value.positions().count() : value.getCount();
        }
        SelectionValue value = element.getValue();
        if (value.type == ValueType.POS_VALUE) {
            size = count;
            count = 1;
        }
        if (value.type.isScalar() && (element.hasFlag(ElementFlag.ALLOCVAL) || !value.hasStore()))
            value.reserve(count);
        if (element.hasFlag(ElementFlag.ALLOCDATA)) {
            if (value.type == ValueType.GROUP_VALUE)
                value.group().reserve(size);
            else if (value.type == ValueType.POS_VALUE)
                value.positions().reserve(size);
        }
    }

    /** Move the store ownership flags from 'from' to 'to', which shares its store. */
    static void moveOwnership(SelElement from, SelElement to) {
        for (ElementFlag flag: ALLOC_FLAGS)
            if (from.flags.remove(flag))
                to.flags.add(flag);
        if (!from.getValue().hasStore())
            return;
        from.getValue().releaseOwnership();
        alias(to, from);
        to.getValue().takeOwnership();
    }

    /** Make 'element' use the store of 'source'. */
    static void alias(SelElement element, SelElement source) {
        if (source.getValue().hasStore())
            element.getValue().setStore(source.getValue().getStore());
    }

    void plan(SelElement element) {
        for (SelElement child: Descent.children(element, false))
            this.plan(child);

        CompilerData cd = this.compiler.annotations().get(element);
        if (element.is(ElementType.SUBEXPR)) {
            SelElement body = element.child(0);
            if (this.compiler.forest.refCount(element) == 2) {
                element.flags.removeAll(ALLOC_FLAGS);
                alias(element, body);
            } else if (cd.has(CompilerFlag.FULLEVAL)) {
                element.evaluator = EvalFunction.SUBEXPR_STATICEVAL;
                cd.evaluator = EvalFunction.SUBEXPR_STATICEVAL;
                body.mempool = null;
                element.flags.removeAll(ALLOC_FLAGS);
                alias(element, body);
            }
        } else if (element.is(ElementType.SUBEXPRREF)
                && this.compiler.forest.refCount(element.refTarget()) == 2) {
            SelElement target = element.refTarget();
            SelElement body = target.child(0);
            if (element.data(SubexprRefData.class).param != null) {
                // The parameter value already aliases the store of the reference.
                ValueStore store = element.getValue().getStore();
                target.getValue().setStore(store);
                body.flags.removeAll(ALLOC_FLAGS);
                if (element.hasFlag(ElementFlag.ALLOCDATA))
                    body.flags.add(ElementFlag.ALLOCDATA);
                body.getValue().setStore(store);
                body.getValue().takeOwnership();
            } else {
                alias(element, body);
            }
            element.flags.removeAll(ALLOC_FLAGS);
        }
        Logger.INSTANCE.belowLevel(this, 3)
                .append("Storage of ")
                .append(element.toString())
                .append(" ")
                .append(element.flags.toString())
                .newline();
    }

    @Override
    public void processRoot(SelElement root) {
        this.plan(root);
    }
}
