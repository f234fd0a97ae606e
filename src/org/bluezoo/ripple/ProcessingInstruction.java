/*
 * ProcessingInstruction.java
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
 * A processing instruction. The payload is the content between
 * {@code <?} and {@code ?>}: the target, then the data.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ProcessingInstruction extends Event {

    private final int targetLength;

    ProcessingInstruction(ByteBuffer raw, int targetLength, Decoder decoder, ByteLayout layout, long position) {
        super(EventType.PROCESSING_INSTRUCTION, raw, decoder, layout, position);
        this.targetLength = targetLength;
    }

    public ByteBuffer getRawTarget() {
        return raw.slice(0, targetLength);
    }

    /**
     * Returns the undecoded data, without the whitespace that separates
     * it from the target.
     */
    public ByteBuffer getRawData() {
        int w = layout.width;
        int end = raw.limit() - (raw.limit() % w);
        int i = targetLength;
        while (i < end && StartTag.isWhitespace(layout.unitAt(raw, i))) {
            i += w;
        }
        return raw.slice(i, raw.limit() - i);
    }

    public String getTarget() throws DecodeException {
        return decoder.decode(getRawTarget());
    }

    public String getData() throws DecodeException {
        return decoder.decode(getRawData());
    }

    @Override
    Event withRaw(ByteBuffer payload) {
        return new ProcessingInstruction(payload, targetLength, decoder, layout, position);
    }

}
