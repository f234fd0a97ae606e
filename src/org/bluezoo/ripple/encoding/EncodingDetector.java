/*
 * EncodingDetector.java
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

/**
 * Detects the encoding of a document from its first bytes.
 *
 * <p>The following signatures are recognized:
 * <table class="striped">
 * <caption>Signatures</caption>
 * <thead>
 * <tr><th>Bytes</th><th>Encoding</th><th>BOM length</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>{@code EF BB BF}</td><td>UTF-8</td><td>3</td></tr>
 * <tr><td>{@code FE FF}</td><td>UTF-16BE</td><td>2</td></tr>
 * <tr><td>{@code FF FE}</td><td>UTF-16LE</td><td>2</td></tr>
 * <tr><td>{@code 3C 00 3F 00}</td><td>UTF-16LE</td><td>0</td></tr>
 * <tr><td>{@code 00 3C 00 3F}</td><td>UTF-16BE</td><td>0</td></tr>
 * <tr><td>{@code 3C 3F 78 6D}</td><td>UTF-8</td><td>0</td></tr>
 * </tbody>
 * </table>
 *
 * <p>If nothing matches, {@link #detect(ByteBuffer)} returns null and the
 * caller should assume UTF-8 with no BOM.
 *
 * <p>All methods are stateless and thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class EncodingDetector {

    // Prevent instantiation
    private EncodingDetector() {
    }

    /**
     * Inspects the bytes between the buffer's position and its limit.
     * The buffer position is not changed.
     *
     * @param data the document prefix
     * @return the detected encoding and BOM length, or null if no
     *         signature matched
     */
    public static Detection detect(ByteBuffer data) {
        int p = data.position();
        int n = data.remaining();
        if (n >= 3 && b(data, p) == 0xEF && b(data, p + 1) == 0xBB && b(data, p + 2) == 0xBF) {
            return new Detection(Encoding.UTF_8, 3);
        }
        if (n >= 2) {
            int b0 = b(data, p);
            int b1 = b(data, p + 1);
            if (b0 == 0xFE && b1 == 0xFF) {
                return new Detection(Encoding.UTF_16BE, 2);
            }
            if (b0 == 0xFF && b1 == 0xFE) {
                return new Detection(Encoding.UTF_16LE, 2);
            }
        }
        if (n >= 4) {
            int b0 = b(data, p);
            int b1 = b(data, p + 1);
            int b2 = b(data, p + 2);
            int b3 = b(data, p + 3);
            if (b0 == 0x3C && b1 == 0x00 && b2 == 0x3F && b3 == 0x00) {
                return new Detection(Encoding.UTF_16LE, 0);
            }
            if (b0 == 0x00 && b1 == 0x3C && b2 == 0x00 && b3 == 0x3F) {
                return new Detection(Encoding.UTF_16BE, 0);
            }
            if (b0 == 0x3C && b1 == 0x3F && b2 == 0x78 && b3 == 0x6D) {
                return new Detection(Encoding.UTF_8, 0);
            }
        }
        return null;
    }

    /**
     * Convenience for {@link #detect(ByteBuffer)} on an array.
     */
    public static Detection detect(byte[] data) {
        return detect(ByteBuffer.wrap(data));
    }

    private static int b(ByteBuffer data, int index) {
        return data.get(index) & 0xFF;
    }

    /**
     * The result of encoding detection.
     */
    public static final class Detection {

        private final Encoding encoding;
        private final int bomLength;

        Detection(Encoding encoding, int bomLength) {
            this.encoding = encoding;
            this.bomLength = bomLength;
        }

        public Encoding getEncoding() {
            return encoding;
        }

        /**
         * Returns the number of bytes occupied by the byte order mark,
         * or 0 if the encoding was recognized from the markup itself.
         */
        public int getBomLength() {
            return bomLength;
        }

        /**
         * Chooses the byte layout of the markup that follows the BOM.
         *
         * <p>UTF-16 signatures without a BOM always select 16-bit units.
         * After a UTF-16 BOM, 16-bit units are used unless the next two
         * bytes are {@code '<'} followed by a non-NUL ASCII byte, in which
         * case the markup is laid out one byte per character (and a
         * declaration may still name the real encoding). Text such as
         * {@code U+4E2D} also encodes as two printable ASCII bytes, so
         * only markup selects the narrow layout.
         *
         * @param data the document prefix, positioned at the start of the
         *        document (including the BOM)
         * @return the layout
         */
        public ByteLayout getLayout(ByteBuffer data) {
            ByteLayout wide;
            switch (encoding) {
                case UTF_16LE:
                    wide = ByteLayout.UTF16LE;
                    break;
                case UTF_16BE:
                    wide = ByteLayout.UTF16BE;
                    break;
                default:
                    return ByteLayout.SINGLE;
            }
            if (bomLength == 0) {
                return wide;
            }
            int p = data.position() + bomLength;
            if (data.limit() - p >= 2 && b(data, p) == '<' && isAsciiMarkupByte(b(data, p + 1))) {
                return ByteLayout.SINGLE;
            }
            return wide;
        }

        private static boolean isAsciiMarkupByte(int b) {
            return b > 0x00 && b < 0x80;
        }

        @Override
        public boolean equals(Object other) {
            if (!(other instanceof Detection)) {
                return false;
            }
            Detection o = (Detection) other;
            return encoding == o.encoding && bomLength == o.bomLength;
        }

        @Override
        public int hashCode() {
            return encoding.hashCode() * 31 + bomLength;
        }

        @Override
        public String toString() {
            return "(" + encoding + ", " + bomLength + ")";
        }

    }

}
