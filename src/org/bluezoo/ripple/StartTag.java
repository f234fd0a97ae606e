/*
 * StartTag.java
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

import java.nio.ByteBuffer;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.bluezoo.ripple.encoding.ByteLayout;

/**
 * A start tag or empty-element tag.
 *
 * <p>The payload is everything between {@code <} and {@code >} (or
 * {@code />}): the element name followed by the unparsed attribute list.
 * Attributes are only parsed when {@link #getAttributes()} is called.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StartTag extends Event {

    private final int nameLength;

    StartTag(EventType type, ByteBuffer raw, int nameLength, Decoder decoder, ByteLayout layout, long position) {
        super(type, raw, decoder, layout, position);
        this.nameLength = nameLength;
    }

    /**
     * Indicates whether this is an empty-element tag ({@code <name/>}).
     */
    public boolean isEmptyElement() {
        return type == EventType.EMPTY_TAG;
    }

    /**
     * Returns the undecoded element name.
     */
    public ByteBuffer getRawName() {
        return raw.slice(0, nameLength);
    }

    /**
     * Returns the undecoded attribute list, including the whitespace that
     * separates it from the name.
     */
    public ByteBuffer getRawAttributes() {
        return raw.slice(nameLength, raw.limit() - nameLength);
    }

    /**
     * Decodes the element name.
     *
     * @throws DecodeException if the name is not valid in the active encoding
     */
    public String getName() throws DecodeException {
        return decoder.decode(raw.slice(0, nameLength));
    }

    /**
     * Parses the attribute list.
     *
     * <p>Values may be double-quoted, single-quoted or unquoted. Duplicate
     * names are not detected.
     *
     * @return the attributes in document order
     * @throws ParseException if the attribute list is malformed
     */
    public List<Attribute> getAttributes() throws ParseException {
        int w = layout.width;
        int end = raw.limit() - (raw.limit() % w);
        int i = skipWhitespace(nameLength, end);
        if (i >= end) {
            return Collections.emptyList();
        }
        List<Attribute> attributes = new ArrayList<>();
        while (i < end) {
            int nameStart = i;
            while (i < end && !isWhitespace(unit(i)) && unit(i) != '=') {
                i += w;
            }
            int nameEnd = i;
            if (nameEnd == nameStart) {
                throw error("err.expected_attribute_name", i);
            }
            i = skipWhitespace(i, end);
            if (i >= end || unit(i) != '=') {
                throw error("err.expected_eq", i);
            }
            i = skipWhitespace(i + w, end);
            if (i >= end) {
                throw error("err.expected_attribute_value", i);
            }
            int valueStart;
            int valueEnd;
            int quote = unit(i);
            if (quote == '"' || quote == '\'') {
                i += w;
                valueStart = i;
                while (i < end && unit(i) != quote) {
                    i += w;
                }
                if (i >= end) {
                    throw error("err.unterminated_attribute_value", valueStart);
                }
                valueEnd = i;
                i += w;
            } else {
                valueStart = i;
                while (i < end && !isWhitespace(unit(i))) {
                    i += w;
                }
                valueEnd = i;
            }
            attributes.add(new Attribute(raw.slice(nameStart, nameEnd - nameStart),
                    raw.slice(valueStart, valueEnd - valueStart), decoder));
            i = skipWhitespace(i, end);
        }
        return attributes;
    }

    /**
     * Returns the first attribute with the given name, or null.
     *
     * @param name the attribute name
     * @return the attribute, or null if not present
     * @throws ParseException if the attribute list is malformed
     * @throws DecodeException if an attribute name cannot be decoded
     */
    public Attribute getAttribute(String name) throws ParseException, DecodeException {
        for (Attribute attribute : getAttributes()) {
            if (name.equals(attribute.getName())) {
                return attribute;
            }
        }
        return null;
    }

    /**
     * Creates the end tag implied by an empty-element tag.
     */
    EndTag toEndTag() {
        return new EndTag(raw.slice(0, nameLength), decoder, layout, position);
    }

    @Override
    Event withRaw(ByteBuffer payload) {
        return new StartTag(type, payload, nameLength, decoder, layout, position);
    }

    private int unit(int index) {
        return layout.unitAt(raw, index);
    }

    private int skipWhitespace(int i, int end) {
        while (i < end && isWhitespace(unit(i))) {
            i += layout.width;
        }
        return i;
    }

    static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private ParseException error(String key, int offset) {
        // payload starts one unit after '<'
        long at = position + layout.width + offset;
        String msg = MessageFormat.format(EventReader.L10N.getString(key), at);
        return new ParseException(msg, at);
    }

}
