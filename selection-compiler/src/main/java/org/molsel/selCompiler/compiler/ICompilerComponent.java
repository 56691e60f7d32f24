package org.molsel.selCompiler.compiler;

/** Interface implemented by classes that are part of a compiler. */
public interface ICompilerComponent {
    SelectionCompiler compiler();
}
