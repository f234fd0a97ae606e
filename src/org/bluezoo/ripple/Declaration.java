/*
 * Declaration.java
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
import java.util.HashMap;
import java.util.Map;

import org.bluezoo.ripple.encoding.ByteLayout;

/**
 * An XML declaration ({@code <?xml version="1.0" encoding="..."?>}).
 *
 * <p>The payload is the content between {@code <?} and {@code ?>}. The
 * pseudo-attributes are read when the event is created, directly from the
 * bytes: declarations contain only 7-bit ASCII, so no decoder is needed.
 * Pseudo-attributes may appear in any order and each is optional; parsing
 * stops quietly at the first malformed one.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Declaration extends Event {

    private final Map<String,String> attributes;

    Declaration(ByteBuffer raw, Decoder decoder, ByteLayout layout, long position) {
        this(raw, parsePseudoAttributes(raw, layout), decoder, layout, position);
    }

    private Declaration(ByteBuffer raw, Map<String,String> attributes, Decoder decoder, ByteLayout layout,
            long position) {
        super(EventType.DECLARATION, raw, decoder, layout, position);
        this.attributes = attributes;
    }

    /**
     * Returns the {@code version} pseudo-attribute, or null.
     */
    public String getVersion() {
        return attributes.get("version");
    }

    /**
     * Returns the {@code encoding} label as declared, or null.
     */
    public String getEncoding() {
        return attributes.get("encoding");
    }

    /**
     * Returns the standalone flag, or null if not declared.
     */
    public Boolean getStandalone() {
        String val = attributes.get("standalone");
        return (val == null) ? null : Boolean.valueOf("yes".equals(val));
    }

    @Override
    Event withRaw(ByteBuffer payload) {
        return new Declaration(payload, attributes, decoder, layout, position);
    }

    /**
     * Reads {@code name="value"} pairs following the {@code xml} target.
     */
    static Map<String,String> parsePseudoAttributes(ByteBuffer raw, ByteLayout layout) {
        Map<String,String> attributes = new HashMap<>();
        int w = layout.width;
        int end = raw.limit() - (raw.limit() % w);
        int i = 3 * w; // "xml"
        while (true) {
            while (i < end && StartTag.isWhitespace(layout.unitAt(raw, i))) {
                i += w;
            }
            if (i >= end) {
                return attributes;
            }
            StringBuilder name = new StringBuilder();
            while (i < end) {
                int c = layout.unitAt(raw, i);
                if (c == '=' || StartTag.isWhitespace(c)) {
                    break;
                }
                name.append((char) c);
                i += w;
            }
            while (i < end && StartTag.isWhitespace(layout.unitAt(raw, i))) {
                i += w;
            }
            if (i >= end || layout.unitAt(raw, i) != '=') {
                return attributes;
            }
            i += w;
            while (i < end && StartTag.isWhitespace(layout.unitAt(raw, i))) {
                i += w;
            }
            if (i >= end) {
                return attributes;
            }
            int quote = layout.unitAt(raw, i);
            if (quote != '"' && quote != '\'') {
                return attributes;
            }
            i += w;
            StringBuilder value = new StringBuilder();
            while (true) {
                if (i >= end) {
                    return attributes;
                }
                int c = layout.unitAt(raw, i);
                i += w;
                if (c == quote) {
                    break;
                }
                value.append((char) c);
            }
            attributes.put(name.toString(), value.toString());
        }
    }

}
