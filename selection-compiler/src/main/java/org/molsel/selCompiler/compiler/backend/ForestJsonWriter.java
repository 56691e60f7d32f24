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

package org.molsel.selCompiler.compiler.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.molsel.selCompiler.compiler.annotation.CompilerAnnotations;
import org.molsel.selCompiler.compiler.annotation.CompilerData;
import org.molsel.selCompiler.compiler.annotation.CompilerFlag;
import org.molsel.selCompiler.compiler.errors.InternalCompilerError;
import org.molsel.selCompiler.ir.ElementFlag;
import org.molsel.selCompiler.ir.ElementType;
import org.molsel.selCompiler.ir.SelElement;
import org.molsel.selCompiler.ir.SelectionForest;
import org.molsel.selCompiler.ir.value.IndexGroup;
import org.molsel.util.Utilities;

import javax.annotation.Nullable;

/**
 * Serializes a compiled forest as JSON.  References are written as the id
 * of their target, so shared subexpressions appear once.
 */
public class ForestJsonWriter {
    final CompilerAnnotations annotations;
    final ObjectMapper mapper;

    public ForestJsonWriter(CompilerAnnotations annotations) {
        this.annotations = annotations;
        this.mapper = Utilities.deterministicObjectMapper();
    }

    public ObjectNode toJson(SelectionForest forest) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("atoms", forest.all.size());
        ArrayNode roots = result.putArray("roots");
        for (SelElement root: forest.roots())
            roots.add(this.toJson(root, forest));
        return result;
    }

    ObjectNode toJson(SelElement element, SelectionForest forest) {
        ObjectNode node = this.mapper.createObjectNode();
        node.put("id", element.getId());
        node.put("type", element.getType().toString());
        node.put("value", element.getValueType().toString());
        node.put("evaluator", element.evaluator.toString());
        String description = element.getData().describe();
        if (!description.isEmpty())
            node.put("description", description);
        if (element.getName() != null)
            node.put("name", element.getName());
        ArrayNode flags = node.putArray("flags");
        for (ElementFlag flag: element.flags)
            flags.add(flag.toString());
        if (element.is(ElementType.SUBEXPR))
            node.put("refCount", forest.refCount(element));
        if (element.is(ElementType.SUBEXPRREF))
            node.put("target", element.refTarget().getId());
        CompilerData cd = this.annotations.getOrNull(element);
        if (cd != null) {
            ObjectNode compiler = node.putObject("compiler");
            ArrayNode cflags = compiler.putArray("flags");
            for (CompilerFlag flag: cd.flags)
                cflags.add(flag.toString());
            this.putGroup(compiler, "gmin", cd.gmin);
            this.putGroup(compiler, "gmax", cd.gmax);
        }
        if (element.hasChildren()) {
            ArrayNode children = node.putArray("children");
            for (SelElement child: element.children())
                children.add(this.toJson(child, forest));
        }
        return node;
    }

    void putGroup(ObjectNode node, String field, @Nullable IndexGroup group) {
        if (group == null)
            return;
        ArrayNode array = node.putArray(field);
        for (int i = 0; i < group.size(); i++)
            array.add(group.get(i));
    }

    public String toJsonString(SelectionForest forest) {
        try {
            return this.mapper.writerWithDefaultPrettyPrinter().writeValueAsString(this.toJson(forest));
        } catch (JsonProcessingException ex) {
            throw new InternalCompilerError("Could not serialize forest: " + ex.getMessage());
        }
    }
}
