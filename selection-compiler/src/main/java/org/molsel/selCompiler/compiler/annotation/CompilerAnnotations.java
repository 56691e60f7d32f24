package org.molsel.selCompiler.compiler.annotation;

import org.molsel.selCompiler.eval.EvalFunction;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.util.Utilities;

import javax.annotation.Nullable;
import java.util.IdentityHashMap;
import java.util.Map;

/** Compiler annotations of all elements of a forest.
 * The map lives only as long as one compilation. */
public final class CompilerAnnotations {
    private final Map<SelElement, CompilerData> data = new IdentityHashMap<>();

    /** Annotate an element; the planned evaluation function starts as the current one. */
    public CompilerData create(SelElement element) {
        CompilerData result = new CompilerData(element.evaluator);
        this.data.put(element, result);
        return result;
    }

    public CompilerData get(SelElement element) {
        return Utilities.getExists(this.data, element);
    }

    @Nullable
    public CompilerData getOrNull(SelElement element) {
        return this.data.get(element);
    }

    public boolean has(SelElement element) {
        return this.data.containsKey(element);
    }

    public void remove(SelElement element) {
        this.data.remove(element);
    }

    /** Install the planned evaluation function of each element. */
    public void commit() {
        for (Map.Entry<SelElement, CompilerData> entry: this.data.entrySet()) {
            EvalFunction function = entry.getValue().evaluator;
            entry.getKey().evaluator = function;
        }
    }

    public int size() {
        return this.data.size();
    }
}
