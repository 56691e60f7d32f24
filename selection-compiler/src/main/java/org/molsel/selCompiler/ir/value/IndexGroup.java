/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.molsel.selCompiler.ir.value;

import org.molsel.util.IIndentStream;
import org.molsel.util.ToIndentableString;
import org.molsel.util.Utilities;

import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * A sorted set of non-negative element indices without duplicates.
 * The group is mutable: binary operations write into a destination group,
 * which may be one of the operands.  Storage grows on demand and is only
 * released by {@link #squeeze()}.
 */
public final class IndexGroup implements ToIndentableString {
    static final int[] EMPTY = new int[0];

    private int[] index;
    private int size;
    @Nullable
    private String name;

    public IndexGroup() {
        this.index = EMPTY;
        this.size = 0;
    }

    public IndexGroup(int capacity) {
        this.index = capacity == 0 ? EMPTY : new int[capacity];
        this.size = 0;
    }

    /** Create a group from indices that must already be sorted and unique. */
    public static IndexGroup of(int... indices) {
        IndexGroup result = new IndexGroup(indices.length);
        System.arraycopy(indices, 0, result.index, 0, indices.length);
        result.size = indices.length;
        Utilities.enforce(result.isSorted(), "Indices are not sorted or contain duplicates");
        return result;
    }

    /** The group containing 0..count-1. */
    public static IndexGroup range(int count) {
        IndexGroup result = new IndexGroup(count);
        for (int i = 0; i < count; i++)
            result.index[i] = i;
        result.size = count;
        return result;
    }

    public int size() {
        return this.size;
    }

    public boolean isEmpty() {
        return this.size == 0;
    }

    public int capacity() {
        return this.index.length;
    }

    public int get(int i) {
        Utilities.enforce(i < this.size);
        return this.index[i];
    }

    @Nullable
    public String getName() {
        return this.name;
    }

    public void setName(@Nullable String name) {
        this.name = name;
    }

    public int[] toArray() {
        return Arrays.copyOf(this.index, this.size);
    }

    /** Grow the storage so that it can hold at least 'capacity' indices. */
    public void reserve(int capacity) {
        if (this.index.length >= capacity)
            return;
        this.index = Arrays.copyOf(this.index, capacity);
    }

    /** Release the capacity not used by the contents. */
    public void squeeze() {
        if (this.index.length != this.size)
            this.index = this.size == 0 ? EMPTY : Arrays.copyOf(this.index, this.size);
    }

    public void clear() {
        this.size = 0;
    }

    /** Append an index, which must be larger than all existing ones. */
    public void add(int value) {
        Utilities.enforce(value >= 0 && (this.size == 0 || this.index[this.size - 1] < value),
                "Index " + value + " added out of order");
        if (this.size == this.index.length)
            this.reserve(Math.max(4, this.index.length * 2));
        this.index[this.size++] = value;
    }

    /** Position of 'value' in the group, or a negative number if absent. */
    public int indexOf(int value) {
        int result = Arrays.binarySearch(this.index, 0, this.size, value);
        return Math.max(result, -1);
    }

    public boolean contains(int value) {
        return this.indexOf(value) >= 0;
    }

    public boolean isSorted() {
        for (int i = 0; i < this.size; i++) {
            if (this.index[i] < 0)
                return false;
            if (i > 0 && this.index[i - 1] >= this.index[i])
                return false;
        }
        return true;
    }

    public boolean isSubsetOf(IndexGroup other) {
        if (this.size > other.size)
            return false;
        int j = 0;
        for (int i = 0; i < this.size; i++) {
            while (j < other.size && other.index[j] < this.index[i])
                j++;
            if (j == other.size || other.index[j] != this.index[i])
                return false;
        }
        return true;
    }

    /** Replace the contents with those of 'source'; the name is kept. */
    public void copyFrom(IndexGroup source) {
        if (source == this)
            return;
        this.reserve(source.size);
        System.arraycopy(source.index, 0, this.index, 0, source.size);
        this.size = source.size;
    }

    /** A fresh copy with exactly the needed capacity. */
    public IndexGroup copy() {
        IndexGroup result = new IndexGroup(this.size);
        result.copyFrom(this);
        result.name = this.name;
        return result;
    }

    /** dest = a ∩ b.  'dest' may be one of the operands. */
    public static void intersection(IndexGroup dest, IndexGroup a, IndexGroup b) {
        dest.reserve(Math.min(a.size, b.size));
        int[] ai = a.index, bi = b.index;
        int k = 0;
        for (int i = 0, j = 0; i < a.size && j < b.size; ) {
            if (ai[i] < bi[j]) {
                i++;
            } else if (ai[i] > bi[j]) {
                j++;
            } else {
                dest.index[k++] = ai[i];
                i++;
                j++;
            }
        }
        dest.size = k;
    }

    /** dest = a - b.  'dest' may be 'a'. */
    public static void difference(IndexGroup dest, IndexGroup a, IndexGroup b) {
        Utilities.enforce(dest != b || a == b);
        if (a == b) {
            dest.size = 0;
            return;
        }
        dest.reserve(a.size);
        int[] ai = a.index, bi = b.index;
        int k = 0;
        int j = 0;
        for (int i = 0; i < a.size; i++) {
            while (j < b.size && bi[j] < ai[i])
                j++;
            if (j < b.size && bi[j] == ai[i])
                continue;
            dest.index[k++] = ai[i];
        }
        dest.size = k;
    }

    /** Size of a - b, without computing it. */
    public static int differenceSize(IndexGroup a, IndexGroup b) {
        int count = 0;
        int j = 0;
        for (int i = 0; i < a.size; i++) {
            while (j < b.size && b.index[j] < a.index[i])
                j++;
            if (j == b.size || b.index[j] != a.index[i])
                count++;
        }
        return count;
    }

    /** dest = a ∪ b.  'dest' may be one of the operands. */
    public static void union(IndexGroup dest, IndexGroup a, IndexGroup b) {
        int total = a.size + differenceSize(b, a);
        fillBackwards(dest, a, b, total, false);
    }

    /** dest = a ∪ b for disjoint a and b.  'dest' may be one of the operands. */
    public static void merge(IndexGroup dest, IndexGroup a, IndexGroup b) {
        fillBackwards(dest, a, b, a.size + b.size, true);
    }

    private static void fillBackwards(IndexGroup dest, IndexGroup a, IndexGroup b, int total, boolean disjoint) {
        int asize = a.size, bsize = b.size;
        dest.reserve(total);
        int[] ai = a.index, bi = b.index, di = dest.index;
        int i = asize - 1, j = bsize - 1, k = total - 1;
        while (j >= 0) {
            if (i < 0 || bi[j] > ai[i]) {
                di[k--] = bi[j--];
            } else if (bi[j] == ai[i]) {
                Utilities.enforce(!disjoint, "Merged groups are not disjoint");
                di[k--] = bi[j--];
                i--;
            } else {
                di[k--] = ai[i--];
            }
        }
        if (di != ai) {
            while (i >= 0)
                di[k--] = ai[i--];
        }
        dest.size = total;
    }

    /**
     * Split g in two: dest1 = g ∩ src and dest2 = g - src.
     * The destinations must be different from the inputs.
     */
    public static void partition(IndexGroup dest1, IndexGroup dest2, IndexGroup g, IndexGroup src) {
        Utilities.enforce(dest1 != dest2 && dest1 != g && dest2 != g && dest1 != src && dest2 != src);
        dest1.reserve(g.size);
        dest2.reserve(g.size);
        int k1 = 0, k2 = 0;
        int j = 0;
        for (int i = 0; i < g.size; i++) {
            while (j < src.size && src.index[j] < g.index[i])
                j++;
            if (j < src.size && src.index[j] == g.index[i])
                dest1.index[k1++] = g.index[i];
            else
                dest2.index[k2++] = g.index[i];
        }
        dest1.size = k1;
        dest2.size = k2;
    }

    public boolean sameContents(IndexGroup other) {
        if (this.size != other.size)
            return false;
        for (int i = 0; i < this.size; i++)
            if (this.index[i] != other.index[i])
                return false;
        return true;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.toString());
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("{");
        for (int i = 0; i < this.size; i++) {
            if (i > 0)
                builder.append(",");
            builder.append(this.index[i]);
        }
        builder.append("}");
        return builder.toString();
    }
}
