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
package io.uplc.builtins;

/**
 * Thrown when a tag or textual spelling matches no builtin function.
 */
public class UnknownBuiltinException extends RuntimeException {

    private final Integer tag;
    private final String text;

    public UnknownBuiltinException(int tag) {
        super("Default Function not found - " + tag);
        this.tag = tag;
        this.text = null;
    }

    public UnknownBuiltinException(String text) {
        super("Default Function not found - " + text);
        this.tag = null;
        this.text = text;
    }

    /**
     * The offending tag, or null when the lookup was by text.
     */
    public Integer getTag() {
        return tag;
    }

    public String getText() {
        return text;
    }

}
