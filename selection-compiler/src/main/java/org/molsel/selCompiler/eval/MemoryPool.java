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

package org.molsel.selCompiler.eval;

import org.molsel.selCompiler.compiler.errors.InternalCompilerError;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.selCompiler.ir.value.ValueStore;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.util.IWritesLogs;
import org.molsel.util.Logger;
import org.molsel.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Scratch storage for element values that are only needed while the parent
 * element is being evaluated.  Allocations are released in LIFO order.
 * Buffers are recycled, so a borrowed store never retains its contents.
 * The pool tracks the peak number of values in use; the compiler reserves
 * that amount once compilation is complete.
 */
public final class MemoryPool implements IWritesLogs {
    static final class Allocation {
        @Nullable
        final SelElement element;
        final ValueStore store;
        final int size;

        Allocation(@Nullable SelElement element, ValueStore store, int size) {
            this.element = element;
            this.store = store;
            this.size = size;
        }
    }

    private final Deque<Allocation> allocations = new ArrayDeque<>();
    private final Map<ValueType, Deque<ValueStore>> free = new EnumMap<>(ValueType.class);
    private int currentSize = 0;
    private int maxSize = 0;
    private int reservedSize = 0;

    ValueStore take(ValueType type, int size) {
        Deque<ValueStore> stores = this.free.get(type);
        ValueStore store = (stores == null || stores.isEmpty()) ? new ValueStore(type, true) : stores.pop();
        store.reserve(size);
        this.currentSize += size;
        this.maxSize = Math.max(this.maxSize, this.currentSize);
        return store;
    }

    void give(Allocation allocation) {
        this.currentSize -= allocation.size;
        this.free.computeIfAbsent(allocation.store.getType(), k -> new ArrayDeque<>()).push(allocation.store);
    }

    /** Give the element a pooled store able to hold 'count' values, if the element uses the pool. */
    public void reserve(SelElement element, int count) {
        if (element.mempool == null)
            return;
        Utilities.enforce(element.mempool == this, "Element uses a different pool");
        ValueType type = element.getValueType();
        if (type != ValueType.INT_VALUE && type != ValueType.REAL_VALUE && type != ValueType.GROUP_VALUE)
            throw new InternalCompilerError("Memory pooling not implemented for requested type " + type, element);
        ValueStore store = this.take(type, count);
        this.allocations.push(new Allocation(element, store, count));
        element.getValue().setStore(store);
    }

    /** Return the store given to the element by {@link #reserve}. */
    public void release(SelElement element) {
        Allocation top = this.allocations.peek();
        if (top == null || top.element != element) {
            Utilities.enforce(element.mempool == null || !element.getValue().isPooled(),
                    "Memory pool release out of order for " + element);
            return;
        }
        this.allocations.pop();
        this.give(top);
        if (element.getValue().hasStore() && element.getValue().getStore() == top.store)
            element.getValue().setStore(null);
    }

    /** Borrow a temporary group. */
    public IndexGroup borrowGroup(int capacity) {
        ValueStore store = this.take(ValueType.GROUP_VALUE, capacity);
        store.group().clear();
        this.allocations.push(new Allocation(null, store, capacity));
        return store.group();
    }

    /** Return the most recently borrowed temporary group. */
    public void returnGroup() {
        Allocation top = this.allocations.peek();
        Utilities.enforce(top != null && top.element == null, "Memory pool temporary returned out of order");
        this.allocations.pop();
        this.give(top);
    }

    /** Reserve the peak demand seen so far. */
    public void reservePeak() {
        this.reservedSize = this.maxSize;
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Reserved pool size ")
                .append(this.reservedSize)
                .newline();
    }

    public int getMaxSize() {
        return this.maxSize;
    }

    public int getReservedSize() {
        return this.reservedSize;
    }

    public int getCurrentSize() {
        return this.currentSize;
    }
}
