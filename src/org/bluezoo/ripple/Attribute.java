/*
 * Attribute.java
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

/**
 * An attribute of a {@link StartTag}.
 *
 * <p>Like the tag it came from, an attribute views the reader's buffer
 * and is only valid until the next event is read, unless the tag was
 * copied.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Attribute {

    private final ByteBuffer rawName;
    private final ByteBuffer rawValue;
    private final Decoder decoder;

    Attribute(ByteBuffer rawName, ByteBuffer rawValue, Decoder decoder) {
        this.rawName = rawName;
        this.rawValue = rawValue;
        this.decoder = decoder;
    }

    public ByteBuffer getRawName() {
        return rawName.duplicate();
    }

    /**
     * Returns the undecoded value, without quotes.
     */
    public ByteBuffer getRawValue() {
        return rawValue.duplicate();
    }

    public String getName() throws DecodeException {
        return decoder.decode(rawName);
    }

    /**
     * Decodes the value without expanding references.
     */
    public String getLiteralValue() throws DecodeException {
        return decoder.decode(rawValue);
    }

    /**
     * Decodes the value and expands entity and character references.
     */
    public String getValue() throws DecodeException {
        return Escapes.unescape(decoder.decode(rawValue));
    }

    @Override
    public String toString() {
        return "Attribute[" + rawName.remaining() + "=" + rawValue.remaining() + " bytes]";
    }

}
