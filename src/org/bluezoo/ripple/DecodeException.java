/*
 * DecodeException.java
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

import org.bluezoo.ripple.encoding.Encoding;

/**
 * Exception thrown when an event payload cannot be turned into text.
 *
 * <p>This happens when the bytes are invalid for the active encoding,
 * or when an entity reference cannot be expanded. It never affects the
 * reader: callers that do not decode a payload never see it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DecodeException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Encoding encoding;
    private final int offset;

    /**
     * Creates a new decode exception.
     *
     * @param message the error message
     * @param encoding the encoding in effect, or null
     * @param offset the offset of the offending input within the payload
     *        (in bytes for encoding errors, in characters for entity
     *        errors), or -1
     */
    public DecodeException(String message, Encoding encoding, int offset) {
        super(message);
        this.encoding = encoding;
        this.offset = offset;
    }

    /**
     * Creates a new decode exception with a cause.
     *
     * @param message the error message
     * @param encoding the encoding in effect, or null
     * @param offset the offset of the offending input, or -1
     * @param cause the underlying cause
     */
    public DecodeException(String message, Encoding encoding, int offset, Throwable cause) {
        super(message, cause);
        this.encoding = encoding;
        this.offset = offset;
    }

    /**
     * Returns the encoding that was in effect, or null if the error was
     * not an encoding error.
     */
    public Encoding getEncoding() {
        return encoding;
    }

    public int getOffset() {
        return offset;
    }

}
