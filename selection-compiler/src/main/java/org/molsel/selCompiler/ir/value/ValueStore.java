package org.molsel.selCompiler.ir.value;

import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * The buffer holding the data of a value.
 * Several values can share the same store; they then alias each other,
 * and growing the store is visible through every alias.
 */
public final class ValueStore {
    final ValueType type;
    int[] ints;
    double[] reals;
    String[] strings;
    @Nullable
    IndexGroup group;
    @Nullable
    PositionSet positions;
    /** True if the store was borrowed from a memory pool. */
    final boolean pooled;

    public ValueStore(ValueType type, boolean pooled) {
        this.type = type;
        this.pooled = pooled;
        this.ints = new int[0];
        this.reals = new double[0];
        this.strings = new String[0];
        if (type == ValueType.GROUP_VALUE)
            this.group = new IndexGroup();
        else if (type == ValueType.POS_VALUE)
            this.positions = new PositionSet();
    }

    public ValueStore(ValueType type) {
        this(type, false);
    }

    public boolean isPooled() {
        return this.pooled;
    }

    public ValueType getType() {
        return this.type;
    }

    public int capacity() {
        switch (this.type) {
            case INT_VALUE:
                return this.ints.length;
            case REAL_VALUE:
                return this.reals.length;
            case STR_VALUE:
                return this.strings.length;
            case GROUP_VALUE:
                return this.group().capacity();
            case POS_VALUE:
                return this.positions().capacity();
            default:
                return 0;
        }
    }

    public void reserve(int count) {
        switch (this.type) {
            case INT_VALUE:
                if (this.ints.length < count)
                    this.ints = Arrays.copyOf(this.ints, count);
                break;
            case REAL_VALUE:
                if (this.reals.length < count)
                    this.reals = Arrays.copyOf(this.reals, count);
                break;
            case STR_VALUE:
                if (this.strings.length < count)
                    this.strings = Arrays.copyOf(this.strings, count);
                break;
            case GROUP_VALUE:
                this.group().reserve(count);
                break;
            case POS_VALUE:
                this.positions().reserve(count);
                break;
            default:
                break;
        }
    }

    public IndexGroup group() {
        if (this.group == null)
            this.group = new IndexGroup();
        return this.group;
    }

    public PositionSet positions() {
        if (this.positions == null)
            this.positions = new PositionSet();
        return this.positions;
    }

    /** A fresh non-pooled store holding a copy of the first 'count' values. */
    public ValueStore copy(int count) {
        ValueStore result = new ValueStore(this.type, false);
        result.ints = Arrays.copyOf(this.ints, Math.min(count, this.ints.length));
        result.reals = Arrays.copyOf(this.reals, Math.min(count, this.reals.length));
        result.strings = Arrays.copyOf(this.strings, Math.min(count, this.strings.length));
        if (this.group != null)
            result.group = this.group.copy();
        if (this.positions != null)
            result.positions().copyFrom(this.positions);
        return result;
    }
}
