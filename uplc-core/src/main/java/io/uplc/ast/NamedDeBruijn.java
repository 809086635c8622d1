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
 * De Bruijn index with a label kept for display. The label plays no part in
 * resolution.
 */
public record NamedDeBruijn(String text, DeBruijn index) implements Binder {

    /**
     * Label attached when an index has no text of its own.
     */
    public static final String FAKE_TEXT = "i";

    public NamedDeBruijn {
        if (text == null) {
            throw new IllegalArgumentException("named de bruijn text is null");
        }
        if (index == null) {
            throw new IllegalArgumentException("named de bruijn index is null for: " + text);
        }
    }

    public static NamedDeBruijn of(String text, int index) {
        return new NamedDeBruijn(text, DeBruijn.of(index));
    }

    public DeBruijn toDeBruijn() {
        return index;
    }

    @Override
    public String toString() {
        return text + "_" + index;
    }

}
