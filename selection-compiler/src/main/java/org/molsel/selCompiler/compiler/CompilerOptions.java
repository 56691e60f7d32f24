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

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;
import org.molsel.selCompiler.compiler.errors.CompilationError;
import org.molsel.selCompiler.method.PositionType;
import org.molsel.util.Logger;

import java.util.HashMap;
import java.util.Map;

/** Options for the selection compiler.  They can be parsed from a command line. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions {
    /** Default position types. */
    @SuppressWarnings("CanBeFinal")
    public static class Positions {
        @Parameter(names = "--spost", description = "Default position type for selections")
        public String selectionPositions = PositionType.ATOM.text;
        @Parameter(names = "--rpost", description = "Default position type for reference positions")
        public String referencePositions = PositionType.ATOM.text;

        public void validate() {
            PositionType.fromString(this.selectionPositions);
            PositionType.fromString(this.referencePositions);
        }

        @Override
        public String toString() {
            return "Positions{" +
                    "selectionPositions=" + this.selectionPositions +
                    ", referencePositions=" + this.referencePositions +
                    '}';
        }
    }

    /** Debugging output. */
    @SuppressWarnings("CanBeFinal")
    public static class Debug {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "--dump", description = "Print the compiled forest at this logging level of the compiler")
        public int dumpLevel = 1;
        @Parameter(names = "--json", description = "Dump the compiled forest as JSON instead of text")
        public boolean json = false;

        @Override
        public String toString() {
            return "Debug{" +
                    "loggingLevel=" + this.loggingLevel +
                    ", dumpLevel=" + this.dumpLevel +
                    ", json=" + this.json +
                    '}';
        }
    }

    @ParametersDelegate
    public Positions positions = new Positions();
    @ParametersDelegate
    public Debug debug = new Debug();
    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;

    public static CompilerOptions parse(String... args) {
        CompilerOptions options = new CompilerOptions();
        JCommander commander = JCommander.newBuilder()
                .addObject(options)
                .build();
        commander.setProgramName("selection-compiler");
        try {
            commander.parse(args);
        } catch (ParameterException ex) {
            throw new CompilationError(ex.getMessage());
        }
        options.validate();
        return options;
    }

    public void validate() {
        this.positions.validate();
    }

    /** Install the logging levels requested with -T. */
    public void applyLoggingLevels() {
        for (Map.Entry<String, String> entry: this.debug.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                throw new CompilationError("-T option must be followed by 'class=number'; could not parse " + entry);
            }
        }
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "positions=" + this.positions +
                ", debug=" + this.debug +
                '}';
    }
}
