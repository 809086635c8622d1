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

import io.uplc.ast.DeBruijn;
import io.uplc.ast.FakeNamedDeBruijn;
import io.uplc.ast.Name;
import io.uplc.ast.NamedDeBruijn;
import io.uplc.ast.Program;
import io.uplc.ast.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Entry points for converting whole terms and programs. Every call runs in
 * a fresh {@link Converter} session.
 * <p>
 * Conversions recurse once per level of nesting. When a stack size is set,
 * each conversion runs on its own thread created with that stack size, so
 * deeply nested programs do not overflow the caller's stack.
 */
public class Conversions {

    static final Logger logger = LoggerFactory.getLogger(Conversions.class);

    /**
     * Stack size in bytes for conversion threads. Can be configured via system
     * property "uplc.converter.stackSize". Default is 0, which converts on the
     * calling thread.
     */
    public static final long STACK_SIZE = Long.parseLong(System.getProperty("uplc.converter.stackSize", "0"));

    public static final Conversions DEFAULT = new Conversions(STACK_SIZE);

    private final long stackSize;

    public Conversions(long stackSize) {
        if (stackSize < 0) {
            throw new IllegalArgumentException("negative stack size: " + stackSize);
        }
        this.stackSize = stackSize;
    }

    public long getStackSize() {
        return stackSize;
    }

    /**
     * @throws FreeUniqueException if a variable is not bound by an enclosing lambda
     */
    public Program<NamedDeBruijn> nameToNamedDeBruijn(Program<Name> program) {
        return convert(program, Converter::nameToNamedDeBruijn);
    }

    /**
     * @throws FreeUniqueException if a variable is not bound by an enclosing lambda
     */
    public Program<DeBruijn> nameToDeBruijn(Program<Name> program) {
        return convert(program, Converter::nameToDeBruijn);
    }

    /**
     * @throws FreeIndexException if an index points past the outermost lambda
     */
    public Program<Name> namedDeBruijnToName(Program<NamedDeBruijn> program) {
        return convert(program, Converter::namedDeBruijnToName);
    }

    /**
     * @throws FreeIndexException if an index points past the outermost lambda
     */
    public Program<Name> deBruijnToName(Program<DeBruijn> program) {
        return convert(program, Converter::deBruijnToName);
    }

    public Program<DeBruijn> namedDeBruijnToDeBruijn(Program<NamedDeBruijn> program) {
        return convert(program, Converter::namedDeBruijnToDeBruijn);
    }

    public Program<NamedDeBruijn> deBruijnToNamedDeBruijn(Program<DeBruijn> program) {
        return convert(program, Converter::deBruijnToNamedDeBruijn);
    }

    public Program<FakeNamedDeBruijn> namedDeBruijnToFakeNamedDeBruijn(Program<NamedDeBruijn> program) {
        return convert(program, Converter::namedDeBruijnToFakeNamedDeBruijn);
    }

    public Program<NamedDeBruijn> fakeNamedDeBruijnToNamedDeBruijn(Program<FakeNamedDeBruijn> program) {
        return convert(program, Converter::fakeNamedDeBruijnToNamedDeBruijn);
    }

    public Term<NamedDeBruijn> nameToNamedDeBruijn(Term<Name> term) {
        return convert(term, Converter::nameToNamedDeBruijn);
    }

    public Term<DeBruijn> nameToDeBruijn(Term<Name> term) {
        return convert(term, Converter::nameToDeBruijn);
    }

    public Term<Name> namedDeBruijnToName(Term<NamedDeBruijn> term) {
        return convert(term, Converter::namedDeBruijnToName);
    }

    public Term<Name> deBruijnToName(Term<DeBruijn> term) {
        return convert(term, Converter::deBruijnToName);
    }

    public Term<DeBruijn> namedDeBruijnToDeBruijn(Term<NamedDeBruijn> term) {
        return convert(term, Converter::namedDeBruijnToDeBruijn);
    }

    public Term<NamedDeBruijn> deBruijnToNamedDeBruijn(Term<DeBruijn> term) {
        return convert(term, Converter::deBruijnToNamedDeBruijn);
    }

    public Term<FakeNamedDeBruijn> namedDeBruijnToFakeNamedDeBruijn(Term<NamedDeBruijn> term) {
        return convert(term, Converter::namedDeBruijnToFakeNamedDeBruijn);
    }

    public Term<NamedDeBruijn> fakeNamedDeBruijnToNamedDeBruijn(Term<FakeNamedDeBruijn> term) {
        return convert(term, Converter::fakeNamedDeBruijnToNamedDeBruijn);
    }

    private interface Conversion<T, R> {

        R apply(Converter converter, T input);

    }

    private <T, R> R convert(T input, Conversion<T, R> conversion) {
        return run(converter -> conversion.apply(converter, input));
    }

    <R> R run(Function<Converter, R> task) {
        Converter converter = new Converter();
        if (stackSize == 0) {
            return task.apply(converter);
        }
        Object[] result = new Object[1];
        Throwable[] failure = new Throwable[1];
        Thread thread = new Thread(null, () -> {
            try {
                result[0] = task.apply(converter);
            } catch (Throwable t) {
                failure[0] = t;
            }
        }, "uplc-converter", stackSize);
        logger.debug("converting on thread {} with stack size {}", thread.getName(), stackSize);
        thread.start();
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while converting", e);
        }
        if (failure[0] instanceof RuntimeException re) {
            throw re;
        }
        if (failure[0] instanceof Error err) {
            throw err;
        }
        if (failure[0] != null) {
            throw new IllegalStateException("conversion failed", failure[0]);
        }
        @SuppressWarnings("unchecked")
        R converted = (R) result[0];
        return converted;
    }

}
