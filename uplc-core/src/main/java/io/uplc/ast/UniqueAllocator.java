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

/**
 * Mutable counter that mints fresh {@link Unique} values for a single
 * interning or conversion session. Never share one instance between
 * sessions that run concurrently.
 */
public class UniqueAllocator {

    private Unique current;

    public UniqueAllocator() {
        this(Unique.of(0));
    }

    public UniqueAllocator(Unique start) {
        if (start == null) {
            throw new IllegalArgumentException("start unique is null");
        }
        this.current = start;
    }

    /**
     * The next unique that {@link #fresh()} will hand out.
     */
    public Unique current() {
        return current;
    }

    public void increment() {
        current = current.next();
    }

    /**
     * Returns the current unique and advances the counter.
     */
    public Unique fresh() {
        Unique result = current;
        increment();
        return result;
    }

    @Override
    public String toString() {
        return "UniqueAllocator@" + current;
    }

}
