package org.molsel.selCompiler.ir.data;

import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.method.MethodParameter;

import javax.annotation.Nullable;

/**
 * Payload of a subexpression reference.  The target is a handle: once
 * subexpressions are extracted it is a SUBEXPR element owned by a root,
 * and the reference only accounts for one reference count.  Before
 * extraction the target may be a plain expression owned by the reference.
 */
public final class SubexprRefData extends ElementData {
    private SelElement target;
    /** Method parameter receiving the value, if this is a parameter value. */
    @Nullable
    public final MethodParameter param;

    public SubexprRefData(SelElement target, @Nullable MethodParameter param) {
        this.target = target;
        this.param = param;
    }

    public SelElement getTarget() {
        return this.target;
    }

    /** Only the forest may re-point references, since it maintains reference counts. */
    public void retarget(SelElement target) {
        this.target = target;
    }

    @Override
    public ElementType getType() {
        return ElementType.SUBEXPRREF;
    }

    @Override
    public String describe() {
        String result = "-> " + this.target.getDisplayName();
        if (this.param != null)
            result += " param " + this.param.name;
        return result;
    }
}
