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

import java.util.HashMap;
import java.util.Map;

/**
 * Builtin functions of Untyped Plutus Core.
 * <p>
 * The tag of each function is part of the on-chain binary format: tags are
 * never reassigned or reused, new functions only ever get new tags. This is
 * why the later secp256k1 and data functions sit out of sequence.
 */
public enum DefaultFunction {

    // integers
    ADD_INTEGER(0),
    SUBTRACT_INTEGER(1),
    MULTIPLY_INTEGER(2),
    DIVIDE_INTEGER(3),
    QUOTIENT_INTEGER(4),
    REMAINDER_INTEGER(5),
    MOD_INTEGER(6),
    EQUALS_INTEGER(7),
    LESS_THAN_INTEGER(8),
    LESS_THAN_EQUALS_INTEGER(9),
    // bytestrings
    APPEND_BYTE_STRING(10),
    CONS_BYTE_STRING(11),
    SLICE_BYTE_STRING(12),
    LENGTH_OF_BYTE_STRING(13),
    INDEX_BYTE_STRING(14),
    EQUALS_BYTE_STRING(15),
    LESS_THAN_BYTE_STRING(16),
    LESS_THAN_EQUALS_BYTE_STRING(17),
    // hashes and signatures
    SHA2_256(18, "sha2_256"),
    SHA3_256(19),
    BLAKE2B_256(20),
    VERIFY_SIGNATURE(21),
    VERIFY_ECDSA_SECP256K1_SIGNATURE(52),
    VERIFY_SCHNORR_SECP256K1_SIGNATURE(53),
    // strings
    APPEND_STRING(22),
    EQUALS_STRING(23),
    ENCODE_UTF8(24),
    DECODE_UTF8(25),
    // bool
    IF_THEN_ELSE(26),
    // unit
    CHOOSE_UNIT(27),
    // tracing
    TRACE(28),
    // pairs
    FST_PAIR(29),
    SND_PAIR(30),
    // lists
    CHOOSE_LIST(31),
    MK_CONS(32),
    HEAD_LIST(33),
    TAIL_LIST(34),
    NULL_LIST(35),
    // data
    CHOOSE_DATA(36),
    CONSTR_DATA(37),
    MAP_DATA(38),
    LIST_DATA(39),
    I_DATA(40),
    B_DATA(41),
    UN_CONSTR_DATA(42),
    UN_MAP_DATA(43),
    UN_LIST_DATA(44),
    UN_I_DATA(45),
    UN_B_DATA(46),
    EQUALS_DATA(47),
    SERIALISE_DATA(51),
    // data constructors
    MK_PAIR_DATA(48),
    MK_NIL_DATA(49),
    MK_NIL_PAIR_DATA(50);

    public static final int MAX_TAG = 53;

    private static final DefaultFunction[] BY_TAG = new DefaultFunction[MAX_TAG + 1];
    private static final Map<String, DefaultFunction> BY_TEXT = new HashMap<>();

    static {
        for (DefaultFunction fn : values()) {
            if (BY_TAG[fn.tag] != null) {
                throw new IllegalStateException("duplicate builtin tag " + fn.tag + ": " + BY_TAG[fn.tag] + ", " + fn);
            }
            BY_TAG[fn.tag] = fn;
            BY_TEXT.put(fn.text, fn);
        }
    }

    public final int tag;
    public final String text;

    DefaultFunction(int tag) {
        this.tag = tag;
        this.text = lowerCamel(name());
    }

    DefaultFunction(int tag, String text) {
        this.tag = tag;
        this.text = text;
    }

    /**
     * Decodes a builtin from its on-chain tag.
     *
     * @throws UnknownBuiltinException if no builtin has the tag
     */
    public static DefaultFunction fromTag(int tag) {
        DefaultFunction fn = tag >= 0 && tag <= MAX_TAG ? BY_TAG[tag] : null;
        if (fn == null) {
            throw new UnknownBuiltinException(tag);
        }
        return fn;
    }

    /**
     * Looks a builtin up by its textual spelling, as used by the textual syntax.
     *
     * @throws UnknownBuiltinException if no builtin is spelled that way
     */
    public static DefaultFunction fromText(String text) {
        DefaultFunction fn = BY_TEXT.get(text);
        if (fn == null) {
            throw new UnknownBuiltinException(text);
        }
        return fn;
    }

    static String lowerCamel(String constant) {
        StringBuilder sb = new StringBuilder(constant.length());
        boolean upper = false;
        for (char c : constant.toCharArray()) {
            if (c == '_') {
                upper = sb.length() > 0;
            } else if (upper) {
                sb.append(Character.toUpperCase(c));
                upper = false;
            } else {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return text;
    }

}
