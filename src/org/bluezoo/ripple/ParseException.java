/*
 * ParseException.java
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

/**
 * Exception thrown when markup cannot be delimited.
 *
 * <p>When thrown by {@link EventReader#next()} this exception is terminal:
 * the reader enters its failed state and every subsequent call rethrows
 * the same instance. When thrown by {@link StartTag#getAttributes()} it
 * only concerns that tag.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final long position;

    /**
     * Creates a new parse exception.
     *
     * @param message the error message
     * @param position the byte offset in the source at which the error
     *        was detected, or -1 if unknown
     */
    public ParseException(String message, long position) {
        super(message);
        this.position = position;
    }

    /**
     * Creates a new parse exception with a cause.
     *
     * @param message the error message
     * @param position the byte offset, or -1 if unknown
     * @param cause the underlying cause
     */
    public ParseException(String message, long position, Throwable cause) {
        super(message, cause);
        this.position = position;
    }

    /**
     * Returns the byte offset in the source (including any BOM) at which
     * the error was detected, or -1 if unknown.
     */
    public long getPosition() {
        return position;
    }

}
