package org.molsel.selCompiler.compiler.backend;

import org.molsel.selCompiler.compiler.annotation.CompilerAnnotations;
import org.molsel.selCompiler.compiler.annotation.CompilerData;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.selCompiler.ir.value.ValueType;
import org.molsel.util.IIndentStream;
import org.molsel.util.IndentStream;

/** Renders a compiled forest as indented text, one element per line. */
public class ForestPrinter {
    final CompilerAnnotations annotations;

    public ForestPrinter(CompilerAnnotations annotations) {
        this.annotations = annotations;
    }

    public String print(SelectionForest forest) {
        StringBuilder builder = new StringBuilder();
        IIndentStream stream = new IndentStream(builder);
        for (SelElement root: forest.roots()) {
            this.print(stream, root, forest);
            stream.newline();
        }
        return builder.toString();
    }

    void print(IIndentStream stream, SelElement element, SelectionForest forest) {
        stream.append(element.getType().toString());
        String description = element.getData().describe();
        if (!description.isEmpty())
            stream.append(" ").append(description);
        if (element.getName() != null)
            stream.append(" \"").append(element.getName()).append("\"");
        stream.append(" ").append(element.flags.toString())
                .append(" ").append(element.evaluator.toString());
        if (element.getValueType() != ValueType.NO_VALUE)
            stream.append(" ").append(element.getValueType().toString());
        switch (element.getType()) {
            case SUBEXPR:
                stream.append(" refs=").append(forest.refCount(element));
                break;
            case SUBEXPRREF:
                stream.append(" refs=").append(forest.refCount(element.refTarget()));
                break;
            default:
                break;
        }
        if (element.mempool != null)
            stream.append(" pooled");
        CompilerData cd = this.annotations.getOrNull(element);
        if (cd != null)
            stream.append(" {").append(cd.toString()).append("}");
        if (!element.hasChildren())
            return;
        stream.increase();
        boolean first = true;
        for (SelElement child: element.children()) {
            if (!first)
                stream.newline();
            first = false;
            this.print(stream, child, forest);
        }
        stream.decrease();
    }
}
