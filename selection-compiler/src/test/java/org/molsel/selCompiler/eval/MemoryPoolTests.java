package org.molsel.selCompiler.eval;

import org.molsel.selCompiler.compiler.errors.InternalCompilerError;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.junit.Assert;
import org.junit.Test;

public class MemoryPoolTests {
    static SelElement pooledGroup(SelectionForest forest, MemoryPool pool) {
        SelElement result = forest.constGroup(IndexGroup.of(1), null);
        result.mempool = pool;
        return result;
    }

    @Test
    public void reserveAndRelease() {
        SelectionForest forest = new SelectionForest(8);
        MemoryPool pool = new MemoryPool();
        SelElement first = pooledGroup(forest, pool);
        SelElement second = pooledGroup(forest, pool);

        pool.reserve(first, 5);
        Assert.assertTrue(first.getValue().isPooled());
        pool.reserve(second, 3);
        Assert.assertEquals(8, pool.getCurrentSize());
        pool.release(second);
        Assert.assertFalse(second.getValue().hasStore());
        pool.release(first);
        Assert.assertEquals(0, pool.getCurrentSize());
        Assert.assertEquals(8, pool.getMaxSize());

        pool.reservePeak();
        Assert.assertEquals(8, pool.getReservedSize());
    }

    @Test
    public void storesAreRecycled() {
        SelectionForest forest = new SelectionForest(8);
        MemoryPool pool = new MemoryPool();
        SelElement element = pooledGroup(forest, pool);
        pool.reserve(element, 4);
        Object store = element.getValue().getStore();
        pool.release(element);
        pool.reserve(element, 2);
        Assert.assertSame(store, element.getValue().getStore());
        pool.release(element);
        Assert.assertEquals(4, pool.getMaxSize());
    }

    @Test
    public void elementsWithoutPoolAreIgnored() {
        SelectionForest forest = new SelectionForest(8);
        MemoryPool pool = new MemoryPool();
        SelElement element = forest.constGroup(IndexGroup.of(1, 2), null);
        Object store = element.getValue().getStore();
        pool.reserve(element, 6);
        pool.release(element);
        Assert.assertSame(store, element.getValue().getStore());
        Assert.assertEquals(0, pool.getMaxSize());
    }

    @Test
    public void temporaryGroups() {
        MemoryPool pool = new MemoryPool();
        IndexGroup group = pool.borrowGroup(10);
        Assert.assertTrue(group.isEmpty());
        group.add(3);
        Assert.assertEquals(10, pool.getCurrentSize());
        pool.returnGroup();
        Assert.assertEquals(0, pool.getCurrentSize());
        Assert.assertThrows(InternalCompilerError.class, pool::returnGroup);
    }

    @Test
    public void unsupportedType() {
        SelectionForest forest = new SelectionForest(8);
        MemoryPool pool = new MemoryPool();
        SelElement element = forest.constString("CA");
        element.mempool = pool;
        Assert.assertThrows(InternalCompilerError.class, () -> pool.reserve(element, 1));
    }
}
