package org.molsel.selCompiler.ir.data;

import org.molsel.selCompiler.ir.ElementType;

/** An index group reference that has not been resolved. */
public final class GroupRefData extends ElementData {
    public final String groupName;

    public GroupRefData(String groupName) {
        this.groupName = groupName;
    }

    @Override
    public ElementType getType() {
        return ElementType.GROUPREF;
    }

    @Override
    public String describe() {
        return this.groupName;
    }
}
