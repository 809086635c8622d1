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

import io.uplc.builtins.DefaultFunction;

import java.util.List;

/**
 * Untyped Plutus Core term. {@code B} is the form variables and lambda
 * parameters take: {@link Name}, {@link NamedDeBruijn}, {@link DeBruijn} or
 * {@link FakeNamedDeBruijn}. Each composite term owns its children; terms are
 * never shared between trees.
 */
public sealed interface Term<B extends Binder> permits Term.Var, Term.Delay, Term.Lambda, Term.Apply, Term.Const, Term.Force, Term.Error, Term.Builtin {

    TermType type();

    /**
     * Immediate subterms in evaluation order, empty for leaves.
     */
    List<Term<B>> children();

    static <B extends Binder> Var<B> var(B name) {
        return new Var<>(name);
    }

    static <B extends Binder> Delay<B> delay(Term<B> term) {
        return new Delay<>(term);
    }

    static <B extends Binder> Lambda<B> lambda(B parameterName, Term<B> body) {
        return new Lambda<>(parameterName, body);
    }

    static <B extends Binder> Apply<B> apply(Term<B> function, Term<B> argument) {
        return new Apply<>(function, argument);
    }

    static <B extends Binder> Const<B> constant(Constant value) {
        return new Const<>(value);
    }

    static <B extends Binder> Force<B> force(Term<B> term) {
        return new Force<>(term);
    }

    static <B extends Binder> Error<B> error() {
        return new Error<>();
    }

    static <B extends Binder> Builtin<B> builtin(DefaultFunction function) {
        return new Builtin<>(function);
    }

    private static <T> T required(T value, String what) {
        if (value == null) {
            throw new IllegalArgumentException(what + " is null");
        }
        return value;
    }

    record Var<B extends Binder>(B name) implements Term<B> {

        public Var {
            required(name, "var name");
        }

        @Override
        public TermType type() {
            return TermType.VAR;
        }

        @Override
        public List<Term<B>> children() {
            return List.of();
        }

    }

    record Delay<B extends Binder>(Term<B> term) implements Term<B> {

        public Delay {
            required(term, "delayed term");
        }

        @Override
        public TermType type() {
            return TermType.DELAY;
        }

        @Override
        public List<Term<B>> children() {
            return List.of(term);
        }

    }

    record Lambda<B extends Binder>(B parameterName, Term<B> body) implements Term<B> {

        public Lambda {
            required(parameterName, "lambda parameter");
            required(body, "lambda body");
        }

        @Override
        public TermType type() {
            return TermType.LAMBDA;
        }

        @Override
        public List<Term<B>> children() {
            return List.of(body);
        }

    }

    record Apply<B extends Binder>(Term<B> function, Term<B> argument) implements Term<B> {

        public Apply {
            required(function, "applied function");
            required(argument, "apply argument");
        }

        @Override
        public TermType type() {
            return TermType.APPLY;
        }

        @Override
        public List<Term<B>> children() {
            return List.of(function, argument);
        }

    }

    record Const<B extends Binder>(Constant value) implements Term<B> {

        public Const {
            required(value, "constant");
        }

        @Override
        public TermType type() {
            return TermType.CONSTANT;
        }

        @Override
        public List<Term<B>> children() {
            return List.of();
        }

    }

    record Force<B extends Binder>(Term<B> term) implements Term<B> {

        public Force {
            required(term, "forced term");
        }

        @Override
        public TermType type() {
            return TermType.FORCE;
        }

        @Override
        public List<Term<B>> children() {
            return List.of(term);
        }

    }

    record Error<B extends Binder>() implements Term<B> {

        @Override
        public TermType type() {
            return TermType.ERROR;
        }

        @Override
        public List<Term<B>> children() {
            return List.of();
        }

    }

    record Builtin<B extends Binder>(DefaultFunction function) implements Term<B> {

        public Builtin {
            required(function, "builtin function");
        }

        @Override
        public TermType type() {
            return TermType.BUILTIN;
        }

        @Override
        public List<Term<B>> children() {
            return List.of();
        }

    }

}
