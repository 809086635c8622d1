package io.uplc.debruijn;

import io.uplc.ast.DeBruijn;
import io.uplc.ast.FakeNamedDeBruijn;
import io.uplc.ast.Name;
import io.uplc.ast.NamedDeBruijn;
import io.uplc.ast.Program;
import io.uplc.ast.Term;
import io.uplc.ast.Version;
import org.junit.jupiter.api.Test;

import static io.uplc.ast.TermUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ConversionsTest {

    static final Version VERSION = new Version(1, 1, 0);

    static final long LARGE_STACK = 512L * 1024 * 1024;

    static Program<Name> program() {
        return new Program<>(VERSION, ConverterTest.twice());
    }

    @Test
    void testDefaultRunsOnCallingThread() {
        assertEquals(0, Conversions.DEFAULT.getStackSize());
        assertThrows(IllegalArgumentException.class, () -> new Conversions(-1));
    }

    @Test
    void testProgramVersionIsCarried() {
        Conversions conversions = Conversions.DEFAULT;
        Program<NamedDeBruijn> named = conversions.nameToNamedDeBruijn(program());
        Program<DeBruijn> indices = conversions.nameToDeBruijn(program());
        Program<FakeNamedDeBruijn> fake = conversions.namedDeBruijnToFakeNamedDeBruijn(named);
        assertEquals(VERSION, named.version());
        assertEquals(VERSION, indices.version());
        assertEquals(VERSION, fake.version());
        assertEquals(VERSION, conversions.namedDeBruijnToName(named).version());
        assertEquals(VERSION, conversions.deBruijnToName(indices).version());
        assertEquals(VERSION, conversions.deBruijnToNamedDeBruijn(indices).version());
        assertEquals(indices, conversions.namedDeBruijnToDeBruijn(named));
        assertEquals(named, conversions.fakeNamedDeBruijnToNamedDeBruijn(fake));
    }

    @Test
    void testTermEntryPoints() {
        Conversions conversions = Conversions.DEFAULT;
        Term<DeBruijn> indices = conversions.nameToDeBruijn(lam("x", 0, lam("y", 1, var("x", 0))));
        assertEquals(lam(lam(var(2))), indices);
        Term<NamedDeBruijn> named = conversions.deBruijnToNamedDeBruijn(indices);
        assertEquals(indices, conversions.namedDeBruijnToDeBruijn(named));
        assertEquals(named, conversions.fakeNamedDeBruijnToNamedDeBruijn(conversions.namedDeBruijnToFakeNamedDeBruijn(named)));
        match(conversions.deBruijnToName(indices), "{ 'lambda': [['i_0', 0], { 'lambda': [['i_1', 1], { 'var': ['i_0', 0] }] }] }");
        match(conversions.namedDeBruijnToName(named), "{ 'lambda': [['i', 0], { 'lambda': [['i', 1], { 'var': ['i', 0] }] }] }");
        match(conversions.nameToNamedDeBruijn(lam("x", 0, var("x", 0))), "{ 'lambda': [['x', 0], { 'var': ['x', 1] }] }");
    }

    @Test
    void testEachCallIsAFreshSession() {
        Conversions conversions = Conversions.DEFAULT;
        Term<Name> first = conversions.deBruijnToName(lam(var(1)));
        Term<Name> second = conversions.deBruijnToName(lam(var(1)));
        assertEquals(first, second);
    }

    @Test
    void testErrorsOnDedicatedThread() {
        Conversions conversions = new Conversions(1024 * 1024);
        assertThrows(FreeUniqueException.class, () -> conversions.nameToDeBruijn(new Program<>(VERSION, var("x", 0))));
        FreeIndexException e = assertThrows(FreeIndexException.class, () -> conversions.deBruijnToName(lam(var(2))));
        assertEquals(1, e.getDepth());
        assertEquals(lam(var(1)), conversions.nameToDeBruijn(lam("x", 0, var("x", 0))));
    }

    @Test
    void testWorkerFailureIsRethrown() {
        Conversions conversions = new Conversions(1024 * 1024);
        OutOfMemoryError oom = assertThrows(OutOfMemoryError.class, () -> conversions.run(converter -> {
            throw new OutOfMemoryError("simulated");
        }));
        assertEquals("simulated", oom.getMessage());
        AssertionError error = assertThrows(AssertionError.class, () -> conversions.run(converter -> {
            throw new AssertionError("broken");
        }));
        assertEquals("broken", error.getMessage());
    }

    @Test
    void testDeeplyNestedProgram() {
        int depth = 50_000;
        // depth lambdas, the innermost body refers to the outermost binder
        Term<Name> term = var("x", 0);
        for (int i = depth - 1; i >= 0; i--) {
            term = lam("x", i, term);
        }
        Conversions conversions = new Conversions(LARGE_STACK);
        Program<DeBruijn> indices = conversions.nameToDeBruijn(new Program<>(VERSION, term));
        assertEquals(VERSION, indices.version());
        Term<DeBruijn> body = indices.term();
        for (int i = 0; i < depth; i++) {
            body = ((Term.Lambda<DeBruijn>) body).body();
        }
        assertEquals(var(depth), body);
        Term<Name> names = conversions.deBruijnToName(indices.term());
        Name outermost = ((Term.Lambda<Name>) names).parameterName();
        for (int i = 0; i < depth; i++) {
            names = ((Term.Lambda<Name>) names).body();
        }
        assertEquals(Term.var(outermost), names);
    }

}
