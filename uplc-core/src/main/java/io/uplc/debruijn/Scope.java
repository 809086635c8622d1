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

import java.util.function.Predicate;

/**
 * Immutable stack of the binders enclosing the current position, innermost
 * on top. Pushing returns a new scope and leaves this one untouched, so a
 * scope can be handed to the conversion of a subterm and simply dropped
 * afterwards.
 * <p>
 * Lookups count from the top starting at 1, which is exactly the de Bruijn
 * index of a variable bound by that entry.
 */
public final class Scope<E> {

    private static final Scope<?> EMPTY = new Scope<>(null, null, 0);

    private final E entry;
    private final Scope<E> parent;
    private final int depth;

    private Scope(E entry, Scope<E> parent, int depth) {
        this.entry = entry;
        this.parent = parent;
        this.depth = depth;
    }

    @SuppressWarnings("unchecked")
    public static <E> Scope<E> empty() {
        return (Scope<E>) EMPTY;
    }

    public Scope<E> push(E entry) {
        if (entry == null) {
            throw new IllegalArgumentException("scope entry is null");
        }
        return new Scope<>(entry, this, depth + 1);
    }

    public Scope<E> pop() {
        if (depth == 0) {
            throw new IllegalStateException("pop on empty scope");
        }
        return parent;
    }

    public E peek() {
        return entry;
    }

    public int depth() {
        return depth;
    }

    public boolean isEmpty() {
        return depth == 0;
    }

    /**
     * Entry {@code index} binders out from the top, or null when the index
     * is below 1 or deeper than this scope.
     */
    public E lookup(int index) {
        if (index < 1 || index > depth) {
            return null;
        }
        Scope<E> temp = this;
        for (int i = 1; i < index; i++) {
            temp = temp.parent;
        }
        return temp.entry;
    }

    /**
     * Distance from the top to the first entry that matches, counting the
     * top as 1. Returns 0 when nothing matches.
     */
    public int indexOf(Predicate<? super E> match) {
        int index = 1;
        for (Scope<E> temp = this; temp.depth > 0; temp = temp.parent) {
            if (match.test(temp.entry)) {
                return index;
            }
            index++;
        }
        return 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (Scope<E> temp = this; temp.depth > 0; temp = temp.parent) {
            if (temp != this) {
                sb.append(", ");
            }
            sb.append(temp.entry);
        }
        return sb.append("]").toString();
    }

}
