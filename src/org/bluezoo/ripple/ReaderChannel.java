/*
 * ReaderChannel.java
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

import java.io.IOException;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ReadableByteChannel;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Presents a character stream as a channel of UTF-8 bytes.
 * Unpaired surrogates are replaced.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class ReaderChannel implements ReadableByteChannel {

    private static final int CHUNK = 4096;

    private final Reader in;
    private final CharsetEncoder encoder;
    private final CharBuffer chars;
    private final ByteBuffer pending;
    private boolean eof;
    private boolean done;
    private boolean open = true;

    ReaderChannel(Reader in) {
        this.in = in;
        encoder = StandardCharsets.UTF_8.newEncoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
        chars = CharBuffer.allocate(CHUNK);
        chars.flip();
        // a char never needs more than 3 bytes, so encoding never overflows
        pending = ByteBuffer.allocate(CHUNK * 3);
        pending.flip();
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        if (!open) {
            throw new ClosedChannelException();
        }
        while (!pending.hasRemaining()) {
            if (done) {
                return -1;
            }
            refill();
        }
        int count = Math.min(dst.remaining(), pending.remaining());
        ByteBuffer chunk = pending.duplicate();
        chunk.limit(chunk.position() + count);
        dst.put(chunk);
        pending.position(pending.position() + count);
        return count;
    }

    private void refill() throws IOException {
        chars.compact();
        if (in.read(chars) < 0) {
            eof = true;
        }
        chars.flip();
        pending.clear();
        encoder.encode(chars, pending, eof);
        if (eof) {
            encoder.flush(pending);
            done = true;
        }
        pending.flip();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() throws IOException {
        open = false;
        in.close();
    }

}
