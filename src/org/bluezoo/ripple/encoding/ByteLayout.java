/*
 * ByteLayout.java
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
 * How the ASCII markup characters of a document are laid out in bytes.
 *
 * <p>Markup delimiters ({@code < > ? ! / = " '} and whitespace) are all
 * 7-bit ASCII, so the tokenizer never needs to decode in order to find
 * token boundaries. It only needs to know how wide a code unit is and in
 * which order its bytes appear:
 * <ul>
 * <li>SINGLE: one byte per unit. Used for UTF-8 and every legacy encoding.</li>
 * <li>UTF16LE: two bytes per unit, low byte first.</li>
 * <li>UTF16BE: two bytes per unit, high byte first.</li>
 * </ul>
 *
 * <p>The layout is chosen once, when the document starts, and does not
 * change when a declaration later switches the decoder.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum ByteLayout {

    SINGLE(1),
    UTF16LE(2),
    UTF16BE(2);

    /** Number of bytes per code unit */
    public final int width;

    ByteLayout(int width) {
        this.width = width;
    }

    /**
     * Reads the code unit starting at the given absolute index.
     * The caller must ensure that {@code width} bytes are available.
     *
     * @param data the buffer to read from
     * @param index the absolute byte index of the unit
     * @return the unit value (0-255 for SINGLE, 0-65535 otherwise)
     */
    public int unitAt(ByteBuffer data, int index) {
        switch (this) {
            case UTF16LE:
                return (data.get(index) & 0xFF) | ((data.get(index + 1) & 0xFF) << 8);
            case UTF16BE:
                return ((data.get(index) & 0xFF) << 8) | (data.get(index + 1) & 0xFF);
            default:
                return data.get(index) & 0xFF;
        }
    }

}
