/*
 * Decoder.java
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
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.MalformedInputException;
import java.nio.charset.UnmappableCharacterException;
import java.text.MessageFormat;

import org.bluezoo.ripple.encoding.Encoding;

/**
 * Transcodes event payloads using the active encoding of a document.
 *
 * <p>Every document starts with a UTF-8 decoder. The encoding detected
 * from the byte order mark is installed before the first token is read;
 * after that the encoding may be replaced exactly once, by the first XML
 * declaration of the document. A decoder created for a text source is
 * pinned to UTF-8 and can never be replaced.
 *
 * <p>Decoding is a pure function of the bytes and the encoding in effect
 * at the time of the call. Malformed and unmappable input is always
 * reported, never replaced.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Decoder {

    private Encoding encoding = Encoding.UTF_8;
    private final boolean pinned;
    private boolean overridden;

    Decoder(boolean pinned) {
        this.pinned = pinned;
    }

    /**
     * Returns the active encoding.
     */
    public Encoding getEncoding() {
        return encoding;
    }

    /**
     * Indicates whether this decoder is fixed to UTF-8 because the
     * document was supplied as text.
     */
    public boolean isPinned() {
        return pinned;
    }

    /**
     * Indicates whether a declaration has already replaced the encoding.
     */
    public boolean isOverridden() {
        return overridden;
    }

    /**
     * Installs the encoding detected from the start of the document.
     */
    void detected(Encoding detected) {
        if (pinned) {
            throw new IllegalStateException(EventReader.L10N.getString("err.pinned_decoder"));
        }
        encoding = detected;
    }

    /**
     * Replaces the encoding as directed by an XML declaration.
     *
     * @throws IllegalStateException if the decoder is pinned or has
     *         already been overridden
     */
    void override(Encoding declared) {
        if (pinned) {
            throw new IllegalStateException(EventReader.L10N.getString("err.pinned_decoder"));
        }
        if (overridden) {
            throw new IllegalStateException(EventReader.L10N.getString("err.decoder_overridden"));
        }
        encoding = declared;
        overridden = true;
    }

    /**
     * Decodes the bytes between the buffer's position and limit.
     * The buffer itself is not modified.
     *
     * @param bytes the payload
     * @return the decoded text
     * @throws DecodeException if the bytes are not valid in the active
     *         encoding
     */
    public String decode(ByteBuffer bytes) throws DecodeException {
        Encoding enc = encoding;
        ByteBuffer in = bytes.duplicate();
        int start = in.position();
        CharsetDecoder decoder = enc.getCharset().newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(in).toString();
        } catch (MalformedInputException e) {
            int offset = in.position() - start;
            String msg = MessageFormat.format(EventReader.L10N.getString("err.malformed_input"),
                    enc, offset, e.getInputLength());
            throw new DecodeException(msg, enc, offset, e);
        } catch (UnmappableCharacterException e) {
            int offset = in.position() - start;
            String msg = MessageFormat.format(EventReader.L10N.getString("err.unmappable_input"),
                    enc, offset, e.getInputLength());
            throw new DecodeException(msg, enc, offset, e);
        } catch (CharacterCodingException e) {
            String msg = MessageFormat.format(EventReader.L10N.getString("err.malformed_input"),
                    enc, -1, -1);
            throw new DecodeException(msg, enc, -1, e);
        }
    }

    /**
     * Decodes a byte array.
     *
     * @param bytes the payload
     * @return the decoded text
     * @throws DecodeException if the bytes are not valid in the active
     *         encoding
     */
    public String decode(byte[] bytes) throws DecodeException {
        return decode(ByteBuffer.wrap(bytes));
    }

    @Override
    public String toString() {
        return "Decoder[" + encoding + (pinned ? ", pinned" : "") + "]";
    }

}
