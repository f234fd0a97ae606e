/*
 * EventType.java
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
 * The lexical units reported by an {@link EventReader}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum EventType {

    /**
     * XML declaration ({@code <?xml ...?>}).
     * Reported as a {@link Declaration}.
     */
    DECLARATION,

    /**
     * Start tag ({@code <name ...>}).
     * Reported as a {@link StartTag}.
     */
    START_TAG,

    /**
     * End tag ({@code </name>}).
     * Reported as an {@link EndTag}.
     */
    END_TAG,

    /**
     * Empty-element tag ({@code <name .../>}).
     * Reported as a {@link StartTag}.
     */
    EMPTY_TAG,

    /**
     * Character data between markup, with references unexpanded.
     */
    TEXT,

    /**
     * The content of a CDATA section, without the delimiters.
     */
    CDATA,

    /**
     * The content of a comment, without the delimiters.
     */
    COMMENT,

    /**
     * Processing instruction other than the XML declaration.
     * Reported as a {@link ProcessingInstruction}.
     */
    PROCESSING_INSTRUCTION,

    /**
     * The content of a document type declaration following the
     * {@code DOCTYPE} keyword, internal subset included.
     */
    DOCTYPE,

    /**
     * End of the document. Once reported, it is reported for every
     * subsequent call.
     */
    END_OF_FILE

}
