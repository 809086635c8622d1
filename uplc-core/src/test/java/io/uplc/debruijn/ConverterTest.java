package io.uplc.debruijn;

import io.uplc.ast.Constant;
import io.uplc.ast.DeBruijn;
import io.uplc.ast.FakeNamedDeBruijn;
import io.uplc.ast.Name;
import io.uplc.ast.NamedDeBruijn;
import io.uplc.ast.Term;
import io.uplc.ast.Unique;
import io.uplc.ast.UniqueAllocator;
import io.uplc.builtins.DefaultFunction;
import org.junit.jupiter.api.Test;

import static io.uplc.ast.TermUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ConverterTest {

    // (lam f (lam x [f (force (delay x))]))
    static Term<Name> twice() {
        return lam("f", 0, lam("x", 1, Term.apply(var("f", 0), Term.force(Term.delay(var("x", 1))))));
    }

    static boolean alphaEquivalent(Term<Name> a, Term<Name> b) {
        return new Converter().nameToDeBruijn(a).equals(new Converter().nameToDeBruijn(b));
    }

    @Test
    void testIdentity() {
        Term<NamedDeBruijn> result = new Converter().nameToNamedDeBruijn(lam("x", 0, var("x", 0)));
        assertEquals(Term.lambda(NamedDeBruijn.of("x", 0), Term.var(NamedDeBruijn.of("x", 1))), result);
        match(result, "{ 'lambda': [['x', 0], { 'var': ['x', 1] }] }");
    }

    @Test
    void testOuterBinder() {
        Term<Name> term = lam("x", 0, lam("y", 1, var("x", 0)));
        assertEquals(lam(lam(var(2))), new Converter().nameToDeBruijn(term));
        match(new Converter().nameToNamedDeBruijn(term), "{ 'lambda': [['x', 0], { 'lambda': [['y', 0], { 'var': ['x', 2] }] }] }");
    }

    @Test
    void testResolutionUsesUniqueNotText() {
        // same text, different bindings
        Term<Name> term = lam("x", 0, lam("x", 1, Term.apply(var("x", 0), var("x", 1))));
        assertEquals(lam(lam(Term.apply(var(2), var(1)))), new Converter().nameToDeBruijn(term));
        // different text, same binding
        Term<Name> renamed = lam("x", 0, var("whatever", 0));
        assertEquals(lam(var(1)), new Converter().nameToDeBruijn(renamed));
    }

    @Test
    void testShadowingResolvesToInnermost() {
        Term<Name> term = lam("x", 0, lam("x", 0, var("x", 0)));
        assertEquals(lam(lam(var(1))), new Converter().nameToDeBruijn(term));
    }

    @Test
    void testScopeEndsWithLambda() {
        // [(lam x x) (lam y x)] : the second x is free
        Term<Name> term = Term.apply(lam("x", 0, var("x", 0)), lam("y", 1, var("x", 0)));
        FreeUniqueException e = assertThrows(FreeUniqueException.class, () -> new Converter().nameToDeBruijn(term));
        assertEquals(Unique.of(0), e.getUnique());
        assertEquals("x", e.getName().text());
    }

    @Test
    void testFreeUnique() {
        Term<Name> term = lam("x", 0, var("y", 7));
        FreeUniqueException e = assertThrows(FreeUniqueException.class, () -> new Converter().nameToNamedDeBruijn(term));
        assertEquals(Name.of("y", 7), e.getName());
        assertEquals("Free Unique: y 7", e.getMessage());
        assertThrows(FreeUniqueException.class, () -> new Converter().nameToDeBruijn(var("y", 7)));
    }

    @Test
    void testFreeIndex() {
        Term<DeBruijn> term = lam(lam(var(5)));
        FreeIndexException e = assertThrows(FreeIndexException.class, () -> new Converter().deBruijnToName(term));
        assertEquals(DeBruijn.of(5), e.getIndex());
        assertEquals(2, e.getDepth());
        assertEquals("Free Index: 5", e.getMessage());
        Term<NamedDeBruijn> named = Term.lambda(NamedDeBruijn.of("x", 0), Term.var(NamedDeBruijn.of("x", 2)));
        assertThrows(FreeIndexException.class, () -> new Converter().namedDeBruijnToName(named));
    }

    @Test
    void testIndexZeroIsNotAReference() {
        FreeIndexException e = assertThrows(FreeIndexException.class, () -> new Converter().deBruijnToName(lam(var(0))));
        assertEquals(0, e.getIndex().index());
        assertEquals(1, e.getDepth());
    }

    @Test
    void testIndexAtScopeDepthIsBound() {
        Term<Name> result = new Converter().deBruijnToName(lam(lam(lam(var(3)))));
        Term.Lambda<Name> outer = (Term.Lambda<Name>) result;
        Term.Lambda<Name> middle = (Term.Lambda<Name>) outer.body();
        Term.Lambda<Name> inner = (Term.Lambda<Name>) middle.body();
        assertEquals(Term.var(outer.parameterName()), inner.body());
    }

    @Test
    void testDeBruijnToNameInventsNames() {
        Term<Name> result = new Converter().deBruijnToName(lam(lam(Term.apply(var(1), var(2)))));
        match(result, "{ 'lambda': [['i_0', 0], { 'lambda': [['i_1', 1], { 'apply': [{ 'var': ['i_1', 1] }, { 'var': ['i_0', 0] }] }] }] }");
    }

    @Test
    void testConverterSessionThreadsAllocator() {
        UniqueAllocator allocator = new UniqueAllocator(Unique.of(10));
        Converter converter = new Converter(allocator);
        Term<Name> first = converter.deBruijnToName(lam(var(1)));
        Term<Name> second = converter.deBruijnToName(lam(var(1)));
        assertEquals(Name.of("i_10", 10), ((Term.Lambda<Name>) first).parameterName());
        assertEquals(Name.of("i_11", 11), ((Term.Lambda<Name>) second).parameterName());
        assertEquals(Unique.of(12), allocator.current());
        // a fresh session starts over
        Term<Name> other = new Converter().deBruijnToName(lam(var(1)));
        assertEquals(Name.of("i_0", 0), ((Term.Lambda<Name>) other).parameterName());
    }

    @Test
    void testNamedDeBruijnToNameKeepsText() {
        Term<NamedDeBruijn> term = Term.lambda(NamedDeBruijn.of("f", 0),
                Term.lambda(NamedDeBruijn.of("x", 0), Term.apply(Term.var(NamedDeBruijn.of("f", 2)), Term.var(NamedDeBruijn.of("x", 1)))));
        match(new Converter().namedDeBruijnToName(term), "{ 'lambda': [['f', 0], { 'lambda': [['x', 1], { 'apply': [{ 'var': ['f', 0] }, { 'var': ['x', 1] }] }] }] }");
    }

    @Test
    void testAllVariantsSurvive() {
        Term<Name> term = lam("x", 3, Term.apply(
                Term.apply(Term.builtin(DefaultFunction.ADD_INTEGER), Term.constant(Constant.integer(1))),
                Term.force(Term.delay(Term.apply(var("x", 3), Term.error())))));
        Term<DeBruijn> expected = lam(Term.apply(
                Term.apply(Term.builtin(DefaultFunction.ADD_INTEGER), Term.constant(Constant.integer(1))),
                Term.force(Term.delay(Term.apply(var(1), Term.error())))));
        assertEquals(expected, new Converter().nameToDeBruijn(term));
    }

    @Test
    void testClosedTermsNeedNoScope() {
        Term<Name> term = Term.apply(Term.builtin(DefaultFunction.TRACE), Term.constant(Constant.string("hi")));
        assertEquals(Term.apply(Term.builtin(DefaultFunction.TRACE), Term.constant(Constant.string("hi"))), new Converter().nameToDeBruijn(term));
        assertEquals(Term.<Name>error(), new Converter().deBruijnToName(Term.error()));
    }

    @Test
    void testNameRoundTripIsAlphaEquivalent() {
        Converter converter = new Converter();
        Term<Name> viaNamed = converter.namedDeBruijnToName(converter.nameToNamedDeBruijn(twice()));
        assertTrue(alphaEquivalent(twice(), viaNamed));
        Term<Name> viaIndex = converter.deBruijnToName(converter.nameToDeBruijn(twice()));
        assertTrue(alphaEquivalent(twice(), viaIndex));
        assertFalse(alphaEquivalent(twice(), lam("f", 0, lam("x", 1, Term.apply(var("x", 1), Term.force(Term.delay(var("f", 0))))))));
    }

    @Test
    void testNamedToDeBruijnAndBack() {
        Converter converter = new Converter();
        Term<NamedDeBruijn> named = converter.nameToNamedDeBruijn(twice());
        Term<DeBruijn> indices = converter.namedDeBruijnToDeBruijn(named);
        assertEquals(converter.nameToDeBruijn(twice()), indices);
        Term<NamedDeBruijn> back = converter.deBruijnToNamedDeBruijn(indices);
        match(back, "{ 'lambda': [['i', 0], { 'lambda': [['i', 0], { 'apply': [{ 'var': ['i', 2] }, { 'force': { 'delay': { 'var': ['i', 1] } } }] }] }] }");
        assertEquals(indices, converter.namedDeBruijnToDeBruijn(back));
        assertEquals(back, converter.deBruijnToNamedDeBruijn(converter.namedDeBruijnToDeBruijn(back)));
    }

    @Test
    void testFakeNamedIsTransparent() {
        Converter converter = new Converter();
        Term<NamedDeBruijn> named = converter.nameToNamedDeBruijn(twice());
        Term<FakeNamedDeBruijn> fake = converter.namedDeBruijnToFakeNamedDeBruijn(named);
        assertEquals(named, converter.fakeNamedDeBruijnToNamedDeBruijn(fake));
        assertEquals(fake, converter.namedDeBruijnToFakeNamedDeBruijn(converter.fakeNamedDeBruijnToNamedDeBruijn(fake)));
        Term.Lambda<FakeNamedDeBruijn> lambda = (Term.Lambda<FakeNamedDeBruijn>) fake;
        assertEquals(NamedDeBruijn.of("f", 0), lambda.parameterName().toNamed());
    }

    @Test
    void testRelabellingKeepsInvalidIndices() {
        Term<DeBruijn> free = lam(var(9));
        Converter converter = new Converter();
        assertEquals(free, converter.namedDeBruijnToDeBruijn(converter.deBruijnToNamedDeBruijn(free)));
    }

    @Test
    void testInputIsNotModified() {
        Term<Name> input = twice();
        new Converter().nameToNamedDeBruijn(input);
        assertEquals(twice(), input);
    }

}
