/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.uplc.ast;

import net.minidev.json.JSONValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON view of terms and programs for logs and diagnostics.
 * <p>
 * Composite terms become single-key maps keyed by the variant ({@code lambda},
 * {@code apply}, {@code delay}, {@code force}, {@code con}, {@code builtin}),
 * variables become {@code {"var": binder}} and the error term is the string
 * {@code "error"}.
 */
public class TermJson {

    private TermJson() {
        // only static methods
    }

    public static String toJson(Term<?> term) {
        return JSONValue.toJSONString(toMap(term));
    }

    public static String toJson(Program<?> program) {
        return JSONValue.toJSONString(toMap(program));
    }

    public static Map<String, Object> toMap(Program<?> program) {
        Map<String, Object> map = new LinkedHashMap<>(2);
        map.put("version", program.version().toString());
        map.put("term", toMap(program.term()));
        return map;
    }

    public static Object toMap(Term<?> term) {
        return switch (term.type()) {
            case VAR -> single("var", binder(((Term.Var<?>) term).name()));
            case DELAY -> single("delay", toMap(((Term.Delay<?>) term).term()));
            case LAMBDA -> {
                Term.Lambda<?> lambda = (Term.Lambda<?>) term;
                yield single("lambda", pair(binder(lambda.parameterName()), toMap(lambda.body())));
            }
            case APPLY -> {
                Term.Apply<?> apply = (Term.Apply<?>) term;
                yield single("apply", pair(toMap(apply.function()), toMap(apply.argument())));
            }
            case CONSTANT -> single("con", constant(((Term.Const<?>) term).value()));
            case FORCE -> single("force", toMap(((Term.Force<?>) term).term()));
            case ERROR -> "error";
            case BUILTIN -> single("builtin", ((Term.Builtin<?>) term).function().text);
        };
    }

    /**
     * A bare index is a number, every other form is a {@code [text, number]}
     * pair so that text containing underscores stays unambiguous.
     */
    public static Object binder(Binder binder) {
        if (binder instanceof DeBruijn d) {
            return d.index();
        }
        if (binder instanceof Name n) {
            return pair(n.text(), n.unique().value());
        }
        NamedDeBruijn named = binder instanceof FakeNamedDeBruijn f ? f.toNamed() : (NamedDeBruijn) binder;
        return pair(named.text(), named.index().index());
    }

    public static List<Object> constant(Constant constant) {
        Object value = switch (constant.type()) {
            case INTEGER -> ((Constant.Int) constant).value();
            case BYTE_STRING, CHAR, UNIT -> constant.toString();
            case STRING -> ((Constant.Str) constant).value();
            case BOOL -> ((Constant.Bool) constant).value();
        };
        return pair(constant.type().text, value);
    }

    private static Map<String, Object> single(String key, Object value) {
        return Collections.singletonMap(key, value);
    }

    private static List<Object> pair(Object first, Object second) {
        List<Object> list = new ArrayList<>(2);
        list.add(first);
        list.add(second);
        return list;
    }

}
