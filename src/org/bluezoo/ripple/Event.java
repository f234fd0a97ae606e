/*
 * Event.java
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
 * A lexical unit of an XML document.
 *
 * <p>Events carry their payload as undecoded bytes. No decoding happens
 * until {@link #decode()} is called, and it uses the decoder of the reader
 * that produced the event as it stands at the time of the call.
 *
 * <h3>Validity</h3>
 * <p>The payload of an event returned by {@link EventReader#next()} is a
 * read-only view of the reader's buffer. The next call to {@code next()}
 * may move or overwrite those bytes. Use {@link #copy()} to keep an event,
 * or {@link EventReader#next(ByteBuffer)} to have the payload placed in a
 * buffer you own.
 *
 * <p>Text, CDATA, comment and document type events are instances of this
 * class; the other types have their own subclasses.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Event {

    /**
     * The end-of-file event.
     */
    public static final Event END_OF_FILE = new Event(EventType.END_OF_FILE, null, null, ByteLayout.SINGLE, -1L);

    final EventType type;
    final ByteBuffer raw;
    final Decoder decoder;
    final ByteLayout layout;
    final long position;

    Event(EventType type, ByteBuffer raw, Decoder decoder, ByteLayout layout, long position) {
        this.type = type;
        this.raw = raw;
        this.decoder = decoder;
        this.layout = layout;
        this.position = position;
    }

    public EventType getType() {
        return type;
    }

    /**
     * Returns the byte offset in the source (including any BOM) of the
     * first byte of this token, or -1 for {@link #END_OF_FILE}.
     */
    public long getPosition() {
        return position;
    }

    /**
     * Returns the undecoded payload as a read-only buffer, or null for
     * {@link #END_OF_FILE}.
     */
    public ByteBuffer getRawBytes() {
        return (raw == null) ? null : raw.duplicate();
    }

    /**
     * Returns the payload length in bytes.
     */
    public int length() {
        return (raw == null) ? 0 : raw.remaining();
    }

    /**
     * Returns the decoder of the reader that produced this event.
     */
    public Decoder getDecoder() {
        return decoder;
    }

    /**
     * Decodes the payload using the reader's active encoding.
     *
     * @return the payload as text
     * @throws DecodeException if the payload is not valid in the active
     *         encoding
     * @throws UnsupportedOperationException for {@link #END_OF_FILE}
     */
    public String decode() throws DecodeException {
        if (raw == null) {
            throw new UnsupportedOperationException(EventReader.L10N.getString("err.no_payload"));
        }
        return decoder.decode(raw);
    }

    /**
     * Decodes the payload and expands entity and character references.
     * Meaningful for {@link EventType#TEXT} events.
     *
     * @return the unescaped text
     * @throws DecodeException if the payload cannot be decoded or contains
     *         an invalid reference
     */
    public String decodeAndUnescape() throws DecodeException {
        return Escapes.unescape(decode());
    }

    /**
     * Returns an equivalent event whose payload no longer refers to the
     * reader's buffer.
     */
    public Event copy() {
        if (raw == null) {
            return this;
        }
        ByteBuffer owned = ByteBuffer.allocate(raw.remaining());
        owned.put(raw.duplicate());
        owned.flip();
        return withRaw(owned.asReadOnlyBuffer());
    }

    /**
     * Appends the payload to the caller's buffer and returns an event
     * viewing it.
     *
     * @throws java.nio.BufferOverflowException if the buffer has
     *         insufficient space
     */
    Event copyInto(ByteBuffer scratch) {
        if (raw == null) {
            return this;
        }
        int start = scratch.position();
        scratch.put(raw.duplicate());
        ByteBuffer view = scratch.duplicate();
        view.limit(scratch.position());
        view.position(start);
        return withRaw(view.slice().asReadOnlyBuffer());
    }

    /**
     * Creates the same event over a different payload buffer.
     * Subclasses override this to carry their own fields.
     */
    Event withRaw(ByteBuffer payload) {
        return new Event(type, payload, decoder, layout, position);
    }

    @Override
    public String toString() {
        if (raw == null) {
            return type.name();
        }
        return type.name() + "[" + raw.remaining() + " bytes @" + position + "]";
    }

}
