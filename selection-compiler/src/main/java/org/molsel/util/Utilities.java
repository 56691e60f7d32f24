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

package org.molsel.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jetbrains.annotations.Contract;
import org.molsel.selCompiler.compiler.errors.InternalCompilerError;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

public class Utilities {
    private Utilities() {}

    static String getCurrentStackTrace() {
        StringBuilder builder = new StringBuilder();
        StackTraceElement[] trace = Thread.currentThread().getStackTrace();
        // Skip getStackTrace, this method and the enforce caller
        for (int i = 3; i < trace.length; i++) {
            builder.append("\tat ").append(trace[i]).append(System.lineSeparator());
        }
        return builder.toString();
    }

    /** A custom version of assert.  We would like to use assert,
     * but it is compiled out in release.
     * @param expression  When this expression is false, this function throws. */
    @Contract("false -> fail")
    public static void enforce(boolean expression) {
        if (!expression) {
            throw new InternalCompilerError(
                    "Assertion failed" + System.lineSeparator() + getCurrentStackTrace());
        }
    }

    /** A custom version of assert.
     * @param expression  When this expression is false, this function throws.
     * @param message     Message for exception when expression is false */
    @Contract("false, _ -> fail")
    public static void enforce(boolean expression, String message) {
        if (!expression)
            throw new InternalCompilerError(message + System.lineSeparator() + getCurrentStackTrace());
    }

    @Contract("null, _ -> fail")
    public static <T> T enforceNotNull(@Nullable T value, String message) {
        if (value == null)
            throw new InternalCompilerError(message + System.lineSeparator() + getCurrentStackTrace());
        return value;
    }

    public static ObjectMapper deterministicObjectMapper() {
        return JsonMapper
                .builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY, true)
                .build();
    }

    /** Add single quotes around a string. */
    /** Get a value that must exist in a map. */
    public static <K, V> V getExists(Map<K, V> map, K key) {
        V result = map.get(key);
        if (result == null)
            throw new InternalCompilerError("Key '" + key + "' does not exist in map");
        return result;
    }

    public static <T> T last(List<T> data) {
        if (data.isEmpty())
            throw new InternalCompilerError("Last of empty list");
        return data.get(data.size() - 1);
    }
}
