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

package org.molsel.selCompiler.compiler.visitors;

import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.util.IWritesLogs;
import org.molsel.util.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** A sequence of forest passes; logs the duration of each, and the
 * forest after each pass at higher logging levels. */
public class Passes implements IWritesLogs, IForestPass {
    public final List<IForestPass> passes;
    final String name;

    public Passes(String name, IForestPass... passes) {
        this.name = name;
        this.passes = new ArrayList<>(Arrays.asList(passes));
    }

    public void add(IForestPass pass) {
        this.passes.add(pass);
    }

    @Override
    public void apply(SelectionForest forest) {
        long begin = System.currentTimeMillis();
        Logger.INSTANCE.belowLevel(this, 2)
                .append(this.name)
                .append(" starting ")
                .append(this.passes.size())
                .append(" passes")
                .increase();
        for (IForestPass pass: this.passes) {
            long start = System.currentTimeMillis();
            pass.apply(forest);
            long end = System.currentTimeMillis();
            Logger.INSTANCE.belowLevel(this, 1)
                    .append(pass.getName())
                    .append(" took ")
                    .append(end - start)
                    .append("ms")
                    .newline();
            Logger.INSTANCE.belowLevel(this, 3)
                    .append(forest)
                    .newline();
        }
        long finish = System.currentTimeMillis();
        Logger.INSTANCE.belowLevel(this, 2)
                .decrease()
                .append(this.name)
                .append(" took ")
                .append(finish - begin)
                .append("ms.")
                .newline();
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public String toString() {
        return this.name + " " + this.passes.size() + " passes";
    }
}
