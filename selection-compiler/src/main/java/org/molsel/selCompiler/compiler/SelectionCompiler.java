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

package org.molsel.selCompiler.compiler;

import org.molsel.selCompiler.compiler.annotation.CompilerAnnotations;
import org.molsel.selCompiler.compiler.backend.ForestJsonWriter;
import org.molsel.selCompiler.compiler.backend.ForestPrinter;
import org.molsel.selCompiler.compiler.passes.ArithmeticNormalizer;
import org.molsel.selCompiler.compiler.passes.BooleanNormalizer;
import org.molsel.selCompiler.compiler.passes.CommitAnnotations;
import org.molsel.selCompiler.compiler.passes.ExtractSubexpressions;
import org.molsel.selCompiler.compiler.passes.InitCompilerData;
import org.molsel.selCompiler.compiler.passes.InitEvaluationFunctions;
import org.molsel.selCompiler.compiler.passes.InitEvaluationGroups;
import org.molsel.selCompiler.compiler.passes.MinMaxGroupAllocator;
import org.molsel.selCompiler.compiler.passes.PositionKeywordDefaults;
import org.molsel.selCompiler.compiler.passes.RemoveUnusedSubexpressions;
import org.molsel.selCompiler.compiler.passes.RootFinalizer;
import org.molsel.selCompiler.compiler.passes.SetupMemoryPooling;
import org.molsel.selCompiler.compiler.passes.StaticAnalyzer;
import org.molsel.selCompiler.compiler.passes.StaticEvalPropagation;
import org.molsel.selCompiler.compiler.passes.StaticFirstReorder;
import org.molsel.selCompiler.compiler.passes.StoragePlanner;
import org.molsel.selCompiler.compiler.passes.SubexpressionClassifier;
import org.molsel.selCompiler.compiler.visitors.Passes;
import org.molsel.selCompiler.compiler.visitors.PerRootPasses;
import org.molsel.selCompiler.eval.EvaluationContext;
import org.molsel.selCompiler.eval.MemoryPool;
import org.molsel.selCompiler.eval.SelectionEvaluator;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.selCompiler.method.Frame;
import org.molsel.selCompiler.method.PositionCalculationCollection;
import org.molsel.selCompiler.method.Topology;
import org.molsel.util.IWritesLogs;
import org.molsel.util.Logger;
import org.molsel.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

/**
 * Compiles a collection of selections into a forest that can be evaluated
 * once per frame.  Elements are built by the caller through {@link #forest},
 * the way a parser would build them, and registered with {@link #addSelection}
 * and {@link #addVariable}.  {@link #compile} can be called once.
 */
public class SelectionCompiler implements IWritesLogs {
    public final CompilerOptions options;
    @Nullable
    public final Topology topology;
    public final SelectionForest forest;
    public final MemoryPool pool;
    public final PositionCalculationCollection positionCalculations;
    final List<Selection> selections;
    /** Annotations of the current compilation; empty outside of it. */
    private CompilerAnnotations annotations;
    private boolean compiled;

    public SelectionCompiler(CompilerOptions options, @Nullable Topology topology, int atomCount) {
        Utilities.enforce(topology == null || topology.atomCount() == atomCount,
                "Topology does not match the number of atoms");
        this.options = options;
        this.topology = topology;
        this.forest = new SelectionForest(atomCount);
        this.pool = new MemoryPool();
        this.positionCalculations = new PositionCalculationCollection(topology);
        this.selections = new ArrayList<>();
        this.annotations = new CompilerAnnotations();
        this.compiled = false;
    }

    public SelectionCompiler(CompilerOptions options, Topology topology) {
        this(options, topology, topology.atomCount());
    }

    /** Register a selection; 'expression' becomes the only child of a new root. */
    public Selection addSelection(String name, SelElement expression, EnumSet<SelectionFlag> flags) {
        Utilities.enforce(!this.compiled, "Selections cannot be added after compilation");
        SelElement root = this.forest.addRoot(this.forest.root(name, expression));
        Selection result = new Selection(name, root, flags);
        this.selections.add(result);
        return result;
    }

    public Selection addSelection(String name, SelElement expression) {
        return this.addSelection(name, expression, EnumSet.noneOf(SelectionFlag.class));
    }

    /**
     * Register a named variable.  The result is the subexpression holding the
     * value; uses of the variable are references built with
     * {@link SelectionForest#subexprRef}.  Variables must be added before
     * the selections that use them.
     */
    public SelElement addVariable(String name, SelElement expression) {
        Utilities.enforce(!this.compiled, "Variables cannot be added after compilation");
        SelElement subexpr = this.forest.subexpr(expression, name);
        this.forest.addRoot(this.forest.root(null, subexpr));
        return subexpr;
    }

    public List<Selection> getSelections() {
        return Collections.unmodifiableList(this.selections);
    }

    public CompilerAnnotations annotations() {
        return this.annotations;
    }

    public boolean isCompiled() {
        return this.compiled;
    }

    /** The pass pipeline; each stage sees the results of all stages before it. */
    Passes createPasses() {
        Passes result = new Passes("Compiler",
                new PositionKeywordDefaults(this),
                new RemoveUnusedSubexpressions(),
                new ExtractSubexpressions(),
                new PerRootPasses("Prepare",
                        new BooleanNormalizer(this),
                        new StaticFirstReorder(this),
                        new ArithmeticNormalizer(this),
                        new InitEvaluationFunctions(this),
                        new SetupMemoryPooling(this),
                        new InitCompilerData(this)),
                // Needs the full-evaluation flags set by the references of every root.
                new PerRootPasses("StaticEval",
                        new StaticEvalPropagation(this)),
                new PerRootPasses("Classify",
                        new SubexpressionClassifier(this),
                        new StoragePlanner(this)),
                new MinMaxGroupAllocator(this),
                new InitEvaluationGroups(this),
                new StaticAnalyzer(this),
                new RootFinalizer(this),
                new CommitAnnotations(this));
        return result;
    }

    /** Compile all registered selections.  On an exception the forest must be discarded.
     * The compiler annotations are dropped once the compiled forest has been dumped. */
    public void compile() {
        this.compileForest();
        this.annotations = new CompilerAnnotations();
    }

    /** Compile, keeping the annotations of the compilation available through {@link #annotations()}. */
    void compileForest() {
        Utilities.enforce(!this.compiled, "Selections are already compiled");
        this.annotations = new CompilerAnnotations();
        Passes passes = this.createPasses();
        passes.apply(this.forest);
        this.pool.reservePeak();
        new MassChargeCalculator(this.topology).initialize(this.selections);
        this.compiled = true;
        this.dump();
    }

    void dump() {
        if (this.getDebugLevel() < this.options.debug.dumpLevel)
            return;
        if (this.options.debug.json) {
            String json = new ForestJsonWriter(this.annotations).toJsonString(this.forest);
            Logger.INSTANCE.belowLevel(this, this.options.debug.dumpLevel)
                    .append(json)
                    .newline();
        } else {
            Logger.INSTANCE.belowLevel(this, this.options.debug.dumpLevel)
                    .append("Compiled forest")
                    .increase()
                    .append(new ForestPrinter(this.annotations).print(this.forest))
                    .decrease()
                    .newline();
        }
    }

    /** A fresh context for evaluating the compiled forest. */
    public EvaluationContext productionContext() {
        return EvaluationContext.forProduction(this.pool, this.forest.all, this.topology);
    }

    /** Evaluate all selections for a frame. */
    public void evaluate(Frame frame) {
        Utilities.enforce(this.compiled, "Selections must be compiled before evaluation");
        SelectionEvaluator.evaluateFrame(this.forest, this.productionContext(), frame);
        MassChargeCalculator calculator = new MassChargeCalculator(this.topology);
        for (Selection selection: this.selections)
            calculator.refresh(selection);
    }

    @Override
    public String toString() {
        return "SelectionCompiler{" +
                "selections=" + this.selections +
                ", compiled=" + this.compiled +
                '}';
    }
}
