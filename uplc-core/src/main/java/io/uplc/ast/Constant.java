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

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Literal value held by a constant term. All variants are immutable.
 */
public sealed interface Constant permits Constant.Int, Constant.Bytes, Constant.Str, Constant.Char, Constant.Unit, Constant.Bool {

    Unit UNIT = new Unit();
    Bool TRUE = new Bool(true);
    Bool FALSE = new Bool(false);

    ConstantType type();

    static Int integer(long value) {
        return new Int(BigInteger.valueOf(value));
    }

    static Int integer(BigInteger value) {
        return new Int(value);
    }

    static Bytes bytes(byte... value) {
        return new Bytes(value);
    }

    static Str string(String value) {
        return new Str(value);
    }

    static Char character(int codePoint) {
        return new Char(codePoint);
    }

    static Bool bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    record Int(BigInteger value) implements Constant {

        public Int {
            if (value == null) {
                throw new IllegalArgumentException("integer constant is null");
            }
        }

        @Override
        public ConstantType type() {
            return ConstantType.INTEGER;
        }

        @Override
        public String toString() {
            return value.toString();
        }

    }

    record Bytes(byte[] value) implements Constant {

        public Bytes {
            if (value == null) {
                throw new IllegalArgumentException("bytestring constant is null");
            }
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        public int length() {
            return value.length;
        }

        @Override
        public ConstantType type() {
            return ConstantType.BYTE_STRING;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            return o instanceof Bytes b && Arrays.equals(value, b.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "#" + HexFormat.of().formatHex(value);
        }

    }

    record Str(String value) implements Constant {

        public Str {
            if (value == null) {
                throw new IllegalArgumentException("string constant is null");
            }
        }

        @Override
        public ConstantType type() {
            return ConstantType.STRING;
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }

    }

    record Char(int codePoint) implements Constant {

        public Char {
            if (!Character.isValidCodePoint(codePoint)) {
                throw new IllegalArgumentException("invalid char code point: " + codePoint);
            }
        }

        @Override
        public ConstantType type() {
            return ConstantType.CHAR;
        }

        @Override
        public String toString() {
            return "'" + Character.toString(codePoint) + "'";
        }

    }

    record Unit() implements Constant {

        @Override
        public ConstantType type() {
            return ConstantType.UNIT;
        }

        @Override
        public String toString() {
            return "()";
        }

    }

    record Bool(boolean value) implements Constant {

        @Override
        public ConstantType type() {
            return ConstantType.BOOL;
        }

        @Override
        public String toString() {
            return value ? "True" : "False";
        }

    }

}
