/*
 * SingleByteCharset.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of Ripple, a forward-only XML event reader.
 *
 * Ripple is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Ripple is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Ripple.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.ripple.encoding;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.util.HashMap;
import java.util.Map;

/**
 * Table-driven charset for single-byte encodings the JDK does not ship.
 *
 * <p>Bytes 0x00-0x7F always map to ASCII. The upper half is given by a
 * 128-entry table; U+FFFF marks an unmapped byte.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class SingleByteCharset extends Charset {

    private static final char UNMAPPED = '\uFFFF';

    /** Latin-6 (Nordic). 0x80-0x9F are the C1 controls. */
    static final SingleByteCharset ISO_8859_10 = new SingleByteCharset(
            "ISO-8859-10", new String[] { "latin6" },
            c1Controls() +
            "\u00A0\u0104\u0112\u0122\u012A\u0128\u0136\u00A7\u013B\u0110\u0160\u0166\u017D\u00AD\u016A\u014A" +
            "\u00B0\u0105\u0113\u0123\u012B\u0129\u0137\u00B7\u013C\u0111\u0161\u0167\u017E\u2015\u016B\u014B" +
            "\u0100\u00C1\u00C2\u00C3\u00C4\u00C5\u00C6\u012E\u010C\u00C9\u0118\u00CB\u0116\u00CD\u00CE\u00CF" +
            "\u00D0\u0145\u014C\u00D3\u00D4\u00D5\u00D6\u0168\u00D8\u0172\u00DA\u00DB\u00DC\u00DD\u00DE\u00DF" +
            "\u0101\u00E1\u00E2\u00E3\u00E4\u00E5\u00E6\u012F\u010D\u00E9\u0119\u00EB\u0117\u00ED\u00EE\u00EF" +
            "\u00F0\u0146\u014D\u00F3\u00F4\u00F5\u00F6\u0169\u00F8\u0173\u00FA\u00FB\u00FC\u00FD\u00FE\u0138");

    /** Latin-8 (Celtic). */
    static final SingleByteCharset ISO_8859_14 = new SingleByteCharset(
            "ISO-8859-14", new String[] { "latin8" },
            c1Controls() +
            "\u00A0\u1E02\u1E03\u00A3\u010A\u010B\u1E0A\u00A7\u1E80\u00A9\u1E82\u1E0B\u1EF2\u00AD\u00AE\u0178" +
            "\u1E1E\u1E1F\u0120\u0121\u1E40\u1E41\u00B6\u1E56\u1E81\u1E57\u1E83\u1E60\u1EF3\u1E84\u1E85\u1E61" +
            "\u00C0\u00C1\u00C2\u00C3\u00C4\u00C5\u00C6\u00C7\u00C8\u00C9\u00CA\u00CB\u00CC\u00CD\u00CE\u00CF" +
            "\u0174\u00D1\u00D2\u00D3\u00D4\u00D5\u00D6\u1E6A\u00D8\u00D9\u00DA\u00DB\u00DC\u00DD\u0176\u00DF" +
            "\u00E0\u00E1\u00E2\u00E3\u00E4\u00E5\u00E6\u00E7\u00E8\u00E9\u00EA\u00EB\u00EC\u00ED\u00EE\u00EF" +
            "\u0175\u00F1\u00F2\u00F3\u00F4\u00F5\u00F6\u1E6B\u00F8\u00F9\u00FA\u00FB\u00FC\u00FD\u0177\u00FF");

    /** Maps 0x80-0xFF onto the private use range U+F780-U+F7FF. */
    static final SingleByteCharset X_USER_DEFINED = new SingleByteCharset(
            "x-user-defined", new String[0], range(0xF780));

    private final char[] table;
    private final Map<Character,Byte> reverse;

    SingleByteCharset(String name, String[] aliases, String upperHalf) {
        super(name, aliases);
        if (upperHalf.length() != 128) {
            throw new IllegalArgumentException("Upper half table must have 128 entries: " + name);
        }
        table = new char[256];
        reverse = new HashMap<>();
        for (int i = 0; i < 0x80; i++) {
            table[i] = (char) i;
        }
        for (int i = 0; i < 0x80; i++) {
            char c = upperHalf.charAt(i);
            table[0x80 + i] = c;
            if (c != UNMAPPED) {
                reverse.put(Character.valueOf(c), Byte.valueOf((byte) (0x80 + i)));
            }
        }
    }

    private static String c1Controls() {
        return range(0x80).substring(0, 0x20);
    }

    private static String range(int start) {
        StringBuilder buf = new StringBuilder(128);
        for (int i = 0; i < 0x80; i++) {
            buf.append((char) (start + i));
        }
        return buf.toString();
    }

    @Override
    public boolean contains(Charset cs) {
        return equals(cs) || "US-ASCII".equals(cs.name());
    }

    @Override
    public CharsetDecoder newDecoder() {
        return new TableDecoder();
    }

    @Override
    public CharsetEncoder newEncoder() {
        return new TableEncoder();
    }

    private class TableDecoder extends CharsetDecoder {

        TableDecoder() {
            super(SingleByteCharset.this, 1.0f, 1.0f);
        }

        @Override
        protected CoderResult decodeLoop(ByteBuffer in, CharBuffer out) {
            while (in.hasRemaining()) {
                char c = table[in.get(in.position()) & 0xFF];
                if (c == UNMAPPED) {
                    return CoderResult.unmappableForLength(1);
                }
                if (!out.hasRemaining()) {
                    return CoderResult.OVERFLOW;
                }
                out.put(c);
                in.position(in.position() + 1);
            }
            return CoderResult.UNDERFLOW;
        }

    }

    private class TableEncoder extends CharsetEncoder {

        TableEncoder() {
            super(SingleByteCharset.this, 1.0f, 1.0f);
        }

        @Override
        public boolean canEncode(char c) {
            return c < 0x80 || reverse.containsKey(Character.valueOf(c));
        }

        @Override
        protected CoderResult encodeLoop(CharBuffer in, ByteBuffer out) {
            while (in.hasRemaining()) {
                char c = in.get(in.position());
                byte b;
                if (c < 0x80) {
                    b = (byte) c;
                } else {
                    Byte mapped = reverse.get(Character.valueOf(c));
                    if (mapped == null) {
                        return Character.isSurrogate(c)
                                ? CoderResult.malformedForLength(1)
                                : CoderResult.unmappableForLength(1);
                    }
                    b = mapped.byteValue();
                }
                if (!out.hasRemaining()) {
                    return CoderResult.OVERFLOW;
                }
                out.put(b);
                in.position(in.position() + 1);
            }
            return CoderResult.UNDERFLOW;
        }

    }

}
