/*
 * ReaderState.java
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
 * Lifecycle of an {@link EventReader}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
enum ReaderState {

    /**
     * Nothing has been read. The next call examines the start of the
     * document for a byte order mark.
     */
    INITIAL,

    /**
     * Reading tokens.
     */
    SCANNING,

    /**
     * The document has been read completely. Every call returns
     * end-of-file.
     */
    EOF,

    /**
     * A fatal parse error occurred. Every call rethrows it.
     */
    FAILED;

}
