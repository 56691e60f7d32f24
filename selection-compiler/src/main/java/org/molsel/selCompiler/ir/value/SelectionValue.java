package org.molsel.selCompiler.ir.value;

import org.molsel.util.Utilities;

import javax.annotation.Nullable;

/**
 * The value computed by a selection element: a type, a number of
 * values, and a store.  The store is either owned by this value, or shared
 * with another value (aliasing), or borrowed from a memory pool.
 */
public final class SelectionValue {
    public final ValueType type;
    /** Number of values currently stored.  For groups and positions this is 1. */
    private int count;
    @Nullable
    private ValueStore store;
    private boolean owned;

    public SelectionValue(ValueType type) {
        this.type = type;
        this.count = 0;
        this.store = type == ValueType.NO_VALUE ? null : new ValueStore(type);
        this.owned = true;
    }

    public int getCount() {
        return this.count;
    }

    public void setCount(int count) {
        this.count = count;
    }

    public boolean hasStore() {
        return this.store != null;
    }

    public ValueStore getStore() {
        return Utilities.enforceNotNull(this.store, "Value of type " + this.type + " has no store");
    }

    public boolean ownsStore() {
        return this.owned;
    }

    public boolean isPooled() {
        return this.store != null && this.store.isPooled();
    }

    /** Alias the store of another value; the store is not owned. */
    public void setStore(@Nullable ValueStore store) {
        Utilities.enforce(store == null || store.type == this.type,
                "Aliasing a " + this.type + " to a store of type " + (store == null ? "" : store.type));
        this.store = store;
        this.owned = false;
    }

    /** Install a store which this value owns. */
    public void setOwnedStore(ValueStore store) {
        this.setStore(store);
        this.owned = true;
    }

    /** Declare the currently aliased store to be owned by this value. */
    public void takeOwnership() {
        this.owned = true;
    }

    public void releaseOwnership() {
        this.owned = false;
    }

    /** Ensure that the store can hold 'count' values.
     * Aliased stores grow as well, since all aliases share the same buffer. */
    public void reserve(int count) {
        if (this.store == null)
            this.store = new ValueStore(this.type);
        this.store.reserve(count);
    }

    public int capacity() {
        return this.store == null ? 0 : this.store.capacity();
    }

    /** Replace a pooled store with an owned copy of its data. */
    public void detachFromPool() {
        if (this.store != null && this.store.isPooled()) {
            this.store = this.store.copy(this.count);
            this.owned = true;
        }
    }

    public int[] ints() {
        return this.getStore().ints;
    }

    public double[] reals() {
        return this.getStore().reals;
    }

    public String[] strings() {
        return this.getStore().strings;
    }

    public IndexGroup group() {
        Utilities.enforce(this.type == ValueType.GROUP_VALUE, "Value is not a group: " + this.type);
        return this.getStore().group();
    }

    public PositionSet positions() {
        Utilities.enforce(this.type == ValueType.POS_VALUE, "Value is not a position: " + this.type);
        return this.getStore().positions();
    }

    /** Convert integer data to reals; used when promoting constants. */
    public SelectionValue toReal() {
        Utilities.enforce(this.type == ValueType.INT_VALUE);
        SelectionValue result = new SelectionValue(ValueType.REAL_VALUE);
        result.reserve(this.count);
        for (int i = 0; i < this.count; i++)
            result.reals()[i] = this.ints()[i];
        result.count = this.count;
        return result;
    }

    @Override
    public String toString() {
        if (this.store == null)
            return this.type.toString();
        StringBuilder builder = new StringBuilder();
        switch (this.type) {
            case GROUP_VALUE:
                return this.group().toString();
            case POS_VALUE:
                return this.positions().toString();
            case INT_VALUE:
            case REAL_VALUE:
            case STR_VALUE:
                builder.append("[");
                for (int i = 0; i < this.count; i++) {
                    if (i > 0)
                        builder.append(",");
                    if (this.type == ValueType.INT_VALUE)
                        builder.append(this.ints()[i]);
                    else if (this.type == ValueType.REAL_VALUE)
                        builder.append(this.reals()[i]);
                    else
                        builder.append(this.strings()[i]);
                }
                builder.append("]");
                return builder.toString();
            default:
                return this.type.toString();
        }
    }
}
