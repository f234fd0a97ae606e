/*
 * EndTag.java
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

import org.bluezoo.ripple.encoding.ByteLayout;

/**
 * An end tag. The payload is the element name, with any whitespace
 * before the closing {@code >} removed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class EndTag extends Event {

    EndTag(ByteBuffer raw, Decoder decoder, ByteLayout layout, long position) {
        super(EventType.END_TAG, raw, decoder, layout, position);
    }

    public ByteBuffer getRawName() {
        return raw.duplicate();
    }

    /**
     * Decodes the element name.
     *
     * @throws DecodeException if the name is not valid in the active encoding
     */
    public String getName() throws DecodeException {
        return decode();
    }

    @Override
    Event withRaw(ByteBuffer payload) {
        return new EndTag(payload, decoder, layout, position);
    }

}
