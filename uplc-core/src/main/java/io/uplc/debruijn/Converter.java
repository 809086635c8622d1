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
package io.uplc.debruijn;

import io.uplc.ast.Binder;
import io.uplc.ast.DeBruijn;
import io.uplc.ast.FakeNamedDeBruijn;
import io.uplc.ast.Name;
import io.uplc.ast.NamedDeBruijn;
import io.uplc.ast.Program;
import io.uplc.ast.Term;
import io.uplc.ast.TermJson;
import io.uplc.ast.Unique;
import io.uplc.ast.UniqueAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Rewrites terms from one variable form into another.
 * <p>
 * Conversions between names and indices walk the tree depth first with a
 * {@link Scope} of the enclosing lambdas: a lambda pushes its parameter for
 * the duration of its body and a variable is resolved by counting entries
 * from the top. The remaining conversions only relabel each binder since an
 * index already says which lambda it refers to.
 * <p>
 * One converter is one session: names it invents draw from its own
 * {@link UniqueAllocator}, so do not share an instance between threads.
 */
public class Converter {

    static final Logger logger = LoggerFactory.getLogger(Converter.class);

    /**
     * Prefix of the text given to names invented for index-only lambdas.
     */
    public static final String FAKE_NAME_PREFIX = "i_";

    private final UniqueAllocator allocator;

    public Converter() {
        this(new UniqueAllocator());
    }

    public Converter(UniqueAllocator allocator) {
        if (allocator == null) {
            throw new IllegalArgumentException("unique allocator is null");
        }
        this.allocator = allocator;
    }

    //=== names to indices =====================================================

    public Term<NamedDeBruijn> nameToNamedDeBruijn(Term<Name> term) {
        trace("name -> named de bruijn", term);
        return rewrite(term, Scope.empty(), new ScopeRules<Name, NamedDeBruijn, Unique>() {
            @Override
            public Unique enter(Name param) {
                return param.unique();
            }

            @Override
            public NamedDeBruijn parameter(Name param, Unique entry) {
                return new NamedDeBruijn(param.text(), DeBruijn.BINDER);
            }

            @Override
            public NamedDeBruijn resolve(Name name, Scope<Unique> scope) {
                return new NamedDeBruijn(name.text(), indexOf(name, scope));
            }
        });
    }

    public Term<DeBruijn> nameToDeBruijn(Term<Name> term) {
        trace("name -> de bruijn", term);
        return rewrite(term, Scope.empty(), new ScopeRules<Name, DeBruijn, Unique>() {
            @Override
            public Unique enter(Name param) {
                return param.unique();
            }

            @Override
            public DeBruijn parameter(Name param, Unique entry) {
                return DeBruijn.BINDER;
            }

            @Override
            public DeBruijn resolve(Name name, Scope<Unique> scope) {
                return indexOf(name, scope);
            }
        });
    }

    //=== indices to names =====================================================

    public Term<Name> namedDeBruijnToName(Term<NamedDeBruijn> term) {
        trace("named de bruijn -> name", term);
        return rewrite(term, Scope.empty(), new ScopeRules<NamedDeBruijn, Name, Name>() {
            @Override
            public Name enter(NamedDeBruijn param) {
                return new Name(param.text(), allocator.fresh());
            }

            @Override
            public Name parameter(NamedDeBruijn param, Name entry) {
                return entry;
            }

            @Override
            public Name resolve(NamedDeBruijn name, Scope<Name> scope) {
                return nameAt(name.index(), scope);
            }
        });
    }

    public Term<Name> deBruijnToName(Term<DeBruijn> term) {
        trace("de bruijn -> name", term);
        return rewrite(term, Scope.empty(), new ScopeRules<DeBruijn, Name, Name>() {
            @Override
            public Name enter(DeBruijn param) {
                Unique unique = allocator.fresh();
                return new Name(FAKE_NAME_PREFIX + unique, unique);
            }

            @Override
            public Name parameter(DeBruijn param, Name entry) {
                return entry;
            }

            @Override
            public Name resolve(DeBruijn index, Scope<Name> scope) {
                return nameAt(index, scope);
            }
        });
    }

    //=== relabelling only =====================================================

    public Term<DeBruijn> namedDeBruijnToDeBruijn(Term<NamedDeBruijn> term) {
        return relabel(term, NamedDeBruijn::toDeBruijn);
    }

    public Term<NamedDeBruijn> deBruijnToNamedDeBruijn(Term<DeBruijn> term) {
        return relabel(term, DeBruijn::toNamed);
    }

    public Term<FakeNamedDeBruijn> namedDeBruijnToFakeNamedDeBruijn(Term<NamedDeBruijn> term) {
        return relabel(term, FakeNamedDeBruijn::new);
    }

    public Term<NamedDeBruijn> fakeNamedDeBruijnToNamedDeBruijn(Term<FakeNamedDeBruijn> term) {
        return relabel(term, FakeNamedDeBruijn::toNamed);
    }

    //=== programs =============================================================

    public Program<NamedDeBruijn> nameToNamedDeBruijn(Program<Name> program) {
        return program.withTerm(nameToNamedDeBruijn(program.term()));
    }

    public Program<DeBruijn> nameToDeBruijn(Program<Name> program) {
        return program.withTerm(nameToDeBruijn(program.term()));
    }

    public Program<Name> namedDeBruijnToName(Program<NamedDeBruijn> program) {
        return program.withTerm(namedDeBruijnToName(program.term()));
    }

    public Program<Name> deBruijnToName(Program<DeBruijn> program) {
        return program.withTerm(deBruijnToName(program.term()));
    }

    public Program<DeBruijn> namedDeBruijnToDeBruijn(Program<NamedDeBruijn> program) {
        return program.withTerm(namedDeBruijnToDeBruijn(program.term()));
    }

    public Program<NamedDeBruijn> deBruijnToNamedDeBruijn(Program<DeBruijn> program) {
        return program.withTerm(deBruijnToNamedDeBruijn(program.term()));
    }

    public Program<FakeNamedDeBruijn> namedDeBruijnToFakeNamedDeBruijn(Program<NamedDeBruijn> program) {
        return program.withTerm(namedDeBruijnToFakeNamedDeBruijn(program.term()));
    }

    public Program<NamedDeBruijn> fakeNamedDeBruijnToNamedDeBruijn(Program<FakeNamedDeBruijn> program) {
        return program.withTerm(fakeNamedDeBruijnToNamedDeBruijn(program.term()));
    }

    //=== engine ===============================================================

    /**
     * How one scope aware conversion treats binders. {@code E} is what the
     * scope records per enclosing lambda.
     */
    interface ScopeRules<A extends Binder, C extends Binder, E> {

        E enter(A param);

        C parameter(A param, E entry);

        C resolve(A name, Scope<E> scope);

    }

    static <A extends Binder, C extends Binder, E> Term<C> rewrite(Term<A> term, Scope<E> scope, ScopeRules<A, C, E> rules) {
        return switch (term.type()) {
            case VAR -> Term.var(rules.resolve(((Term.Var<A>) term).name(), scope));
            case DELAY -> Term.delay(rewrite(((Term.Delay<A>) term).term(), scope, rules));
            case LAMBDA -> {
                Term.Lambda<A> lambda = (Term.Lambda<A>) term;
                E entry = rules.enter(lambda.parameterName());
                C param = rules.parameter(lambda.parameterName(), entry);
                yield Term.lambda(param, rewrite(lambda.body(), scope.push(entry), rules));
            }
            case APPLY -> {
                Term.Apply<A> apply = (Term.Apply<A>) term;
                Term<C> function = rewrite(apply.function(), scope, rules);
                yield Term.apply(function, rewrite(apply.argument(), scope, rules));
            }
            case CONSTANT -> Term.constant(((Term.Const<A>) term).value());
            case FORCE -> Term.force(rewrite(((Term.Force<A>) term).term(), scope, rules));
            case ERROR -> Term.error();
            case BUILTIN -> Term.builtin(((Term.Builtin<A>) term).function());
        };
    }

    static <A extends Binder, C extends Binder> Term<C> relabel(Term<A> term, Function<A, C> label) {
        return switch (term.type()) {
            case VAR -> Term.var(label.apply(((Term.Var<A>) term).name()));
            case DELAY -> Term.delay(relabel(((Term.Delay<A>) term).term(), label));
            case LAMBDA -> {
                Term.Lambda<A> lambda = (Term.Lambda<A>) term;
                yield Term.lambda(label.apply(lambda.parameterName()), relabel(lambda.body(), label));
            }
            case APPLY -> {
                Term.Apply<A> apply = (Term.Apply<A>) term;
                Term<C> function = relabel(apply.function(), label);
                yield Term.apply(function, relabel(apply.argument(), label));
            }
            case CONSTANT -> Term.constant(((Term.Const<A>) term).value());
            case FORCE -> Term.force(relabel(((Term.Force<A>) term).term(), label));
            case ERROR -> Term.error();
            case BUILTIN -> Term.builtin(((Term.Builtin<A>) term).function());
        };
    }

    private static DeBruijn indexOf(Name name, Scope<Unique> scope) {
        int index = scope.indexOf(name.unique()::equals);
        if (index == 0) {
            logger.debug("free unique {} at scope depth {}", name, scope.depth());
            throw new FreeUniqueException(name);
        }
        return DeBruijn.of(index);
    }

    private static Name nameAt(DeBruijn index, Scope<Name> scope) {
        Name name = scope.lookup(index.index());
        if (name == null) {
            logger.debug("free index {} at scope depth {}", index, scope.depth());
            throw new FreeIndexException(index, scope.depth());
        }
        return name;
    }

    private static void trace(String direction, Term<?> term) {
        if (logger.isTraceEnabled()) {
            logger.trace("{}: {}", direction, TermJson.toJson(term));
        }
    }

}
