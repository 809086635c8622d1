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
 * De Bruijn index. At a use site the innermost enclosing lambda is 1; lambda
 * parameters themselves carry 0.
 */
public record DeBruijn(int index) implements Binder {

    public static final DeBruijn BINDER = new DeBruijn(0);

    public DeBruijn {
        if (index < 0) {
            throw new IllegalArgumentException("negative de bruijn index: " + index);
        }
    }

    public static DeBruijn of(int index) {
        return index == 0 ? BINDER : new DeBruijn(index);
    }

    public NamedDeBruijn toNamed() {
        return new NamedDeBruijn(NamedDeBruijn.FAKE_TEXT, this);
    }

    public FakeNamedDeBruijn toFakeNamed() {
        return new FakeNamedDeBruijn(toNamed());
    }

    @Override
    public String toString() {
        return String.valueOf(index);
    }

}
