package io.uplc.debruijn;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScopeTest {

    @Test
    void testEmpty() {
        Scope<String> scope = Scope.empty();
        assertTrue(scope.isEmpty());
        assertEquals(0, scope.depth());
        assertNull(scope.lookup(1));
        assertEquals(0, scope.indexOf("x"::equals));
        assertThrows(IllegalStateException.class, scope::pop);
        assertEquals("[]", scope.toString());
    }

    @Test
    void testLookupCountsFromTop() {
        Scope<String> scope = Scope.<String>empty().push("a").push("b").push("c");
        assertEquals(3, scope.depth());
        assertEquals("c", scope.peek());
        assertEquals("c", scope.lookup(1));
        assertEquals("b", scope.lookup(2));
        assertEquals("a", scope.lookup(3));
        assertNull(scope.lookup(4));
        assertNull(scope.lookup(0));
        assertEquals("[c, b, a]", scope.toString());
    }

    @Test
    void testIndexOfFindsInnermost() {
        Scope<String> scope = Scope.<String>empty().push("x").push("y").push("x");
        assertEquals(1, scope.indexOf("x"::equals));
        assertEquals(2, scope.indexOf("y"::equals));
        assertEquals(0, scope.indexOf("z"::equals));
        assertEquals(2, scope.pop().indexOf("x"::equals));
    }

    @Test
    void testPushLeavesOriginalUntouched() {
        Scope<String> outer = Scope.<String>empty().push("a");
        Scope<String> inner = outer.push("b");
        assertEquals(1, outer.depth());
        assertEquals("a", outer.lookup(1));
        assertSame(outer, inner.pop());
        assertThrows(IllegalArgumentException.class, () -> outer.push(null));
    }

}
