/*
 * Escapes.java
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

package org.bluezoo.ripple;

import java.text.MessageFormat;

/**
 * Expands the predefined entity references and character references
 * in decoded text.
 *
 * <p>Only {@code &lt; &gt; &amp; &apos; &quot;} and numeric character
 * references ({@code &#60;}, {@code &#x3C;}) are understood; the reader
 * does not process DTDs, so any other entity reference is an error.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Escapes {

    // Prevent instantiation
    private Escapes() {
    }

    /**
     * Returns the text with all references expanded.
     *
     * @param text decoded text
     * @return the unescaped text (the same instance if it contains no
     *         {@code &})
     * @throws DecodeException if a reference is unterminated, unknown, or
     *         names an invalid code point
     */
    public static String unescape(String text) throws DecodeException {
        int amp = text.indexOf('&');
        if (amp < 0) {
            return text;
        }
        StringBuilder buf = new StringBuilder(text.length());
        int start = 0;
        while (amp >= 0) {
            buf.append(text, start, amp);
            int semi = text.indexOf(';', amp + 1);
            if (semi < 0) {
                String msg = MessageFormat.format(EventReader.L10N.getString("err.unterminated_reference"), amp);
                throw new DecodeException(msg, null, amp);
            }
            String name = text.substring(amp + 1, semi);
            if (name.startsWith("#")) {
                buf.appendCodePoint(parseCharacterReference(name, amp));
            } else {
                buf.append(resolvePredefined(name, amp));
            }
            start = semi + 1;
            amp = text.indexOf('&', start);
        }
        buf.append(text, start, text.length());
        return buf.toString();
    }

    private static char resolvePredefined(String name, int offset) throws DecodeException {
        switch (name) {
            case "lt":
                return '<';
            case "gt":
                return '>';
            case "amp":
                return '&';
            case "apos":
                return '\'';
            case "quot":
                return '"';
            default:
                String msg = MessageFormat.format(EventReader.L10N.getString("err.unknown_entity"), name);
                throw new DecodeException(msg, null, offset);
        }
    }

    private static int parseCharacterReference(String name, int offset) throws DecodeException {
        boolean hex = name.startsWith("#x");
        String digits = name.substring(hex ? 2 : 1);
        if (digits.isEmpty() || digits.charAt(0) == '+' || digits.charAt(0) == '-') {
            throw invalidCharacterReference(name, offset, null);
        }
        int codePoint;
        try {
            codePoint = Integer.parseInt(digits, hex ? 16 : 10);
        } catch (NumberFormatException e) {
            throw invalidCharacterReference(name, offset, e);
        }
        if (codePoint == 0 || codePoint > Character.MAX_CODE_POINT
                || (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
            throw invalidCharacterReference(name, offset, null);
        }
        return codePoint;
    }

    private static DecodeException invalidCharacterReference(String name, int offset, Throwable cause) {
        String msg = MessageFormat.format(EventReader.L10N.getString("err.invalid_char_ref"), name);
        return new DecodeException(msg, null, offset, cause);
    }

}
