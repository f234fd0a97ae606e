/*
 * EventReader.java
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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UnsupportedEncodingException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.ripple.encoding.ByteLayout;
import org.bluezoo.ripple.encoding.Encoding;
import org.bluezoo.ripple.encoding.EncodingDetector;

/**
 * Forward-only reader producing lexical XML events from bytes.
 *
 * <p>The reader finds token boundaries by comparing ASCII delimiters
 * against the raw bytes and never decodes while scanning. Each call to
 * {@link #next()} consumes exactly one token. Events are views of the
 * reader's buffer and are only valid until the following call.
 *
 * <h3>Encoding</h3>
 * <p>Every document starts out as UTF-8. On the first call to
 * {@code next()} the start of the document is examined for a byte order
 * mark (or the UTF-16 layout of {@code <?}), which is skipped and selects
 * the initial encoding. The first XML declaration of the document may then
 * replace the encoding once; later declarations are reported but have no
 * effect. Readers created from text ({@link #fromString(String)},
 * {@link #fromReader(Reader)}) are pinned to UTF-8.
 *
 * <h3>Errors</h3>
 * <p>Unterminated or malformed markup raises a {@link ParseException}.
 * The reader then stays failed: every later call throws the same
 * exception. An unknown or unsupported declared encoding is not an error
 * of the token stream; it is logged and available from
 * {@link #getEncodingError()}.
 *
 * <p>A reader is not thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class EventReader implements Closeable {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.ripple.L10N");

    private static final Logger LOGGER = Logger.getLogger(EventReader.class.getName());

    /**
     * Remove whitespace from both ends of text events, and drop text
     * events that contain only whitespace.
     */
    public static final String FEATURE_TRIM_TEXT = "http://www.nongnu.org/ripple/features/trim-text";

    /** Remove leading whitespace from text events. */
    public static final String FEATURE_TRIM_TEXT_START = "http://www.nongnu.org/ripple/features/trim-text-start";

    /** Remove trailing whitespace from text events. */
    public static final String FEATURE_TRIM_TEXT_END = "http://www.nongnu.org/ripple/features/trim-text-end";

    /**
     * Report {@code <a/>} as a start tag followed by an end tag.
     */
    public static final String FEATURE_EXPAND_EMPTY_ELEMENTS =
        "http://www.nongnu.org/ripple/features/expand-empty-elements";

    private static final int DEFAULT_CAPACITY = 8192;

    private final ReadableByteChannel source;
    private final Decoder decoder;

    private ByteBuffer buffer;
    private int pos; // start of the next token
    private int end; // end of valid data
    private long consumed; // bytes discarded by compaction
    private boolean exhausted;

    private ReaderState state = ReaderState.INITIAL;
    private ParseException failure;
    private ByteLayout layout = ByteLayout.SINGLE;
    private int bomLength;
    private boolean declarationSeen;
    private UnsupportedEncodingException encodingError;
    private Event pendingEnd;

    private boolean trimTextStart;
    private boolean trimTextEnd;
    private boolean expandEmptyElements;

    private EventReader(ByteBuffer data, ReadableByteChannel source, boolean pinned) {
        this.source = source;
        this.decoder = new Decoder(pinned);
        if (source == null) {
            buffer = data;
            end = data.limit();
            exhausted = true;
        } else {
            buffer = ByteBuffer.allocate(DEFAULT_CAPACITY);
        }
    }

    // -- Factories --

    /**
     * Creates a reader over a complete document in memory.
     */
    public static EventReader fromBytes(byte[] bytes) {
        return fromBuffer(ByteBuffer.wrap(bytes));
    }

    /**
     * Creates a reader over the remaining bytes of a buffer.
     * The buffer's content must not change while the reader is in use.
     */
    public static EventReader fromBuffer(ByteBuffer bytes) {
        return new EventReader(bytes.slice().asReadOnlyBuffer(), null, false);
    }

    /**
     * Creates a reader that pulls bytes from a stream as it needs them.
     * Closing the reader closes the stream.
     */
    public static EventReader fromStream(InputStream in) {
        return fromChannel(Channels.newChannel(in));
    }

    /**
     * Creates a reader that pulls bytes from a channel as it needs them.
     * The channel should be in blocking mode.
     * Closing the reader closes the channel.
     */
    public static EventReader fromChannel(ReadableByteChannel channel) {
        return new EventReader(null, channel, false);
    }

    /**
     * Creates a reader over a document that is already text.
     * The reader is pinned to UTF-8; a leading U+FEFF is skipped.
     */
    public static EventReader fromString(String text) {
        ByteBuffer data = ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
        return new EventReader(data.asReadOnlyBuffer(), null, true);
    }

    /**
     * Creates a reader over a character stream.
     * The reader is pinned to UTF-8; a leading U+FEFF is skipped.
     * Closing the event reader closes the character stream.
     */
    public static EventReader fromReader(Reader in) {
        return new EventReader(null, new ReaderChannel(in), true);
    }

    // -- Accessors --

    /**
     * Returns the encoding currently used to decode payloads.
     */
    public Encoding getEncoding() {
        return decoder.getEncoding();
    }

    public Decoder getDecoder() {
        return decoder;
    }

    /**
     * Returns the error recorded when the first declaration named an
     * encoding that could not be used, or null.
     */
    public UnsupportedEncodingException getEncodingError() {
        return encodingError;
    }

    /**
     * Indicates whether an XML declaration has been read.
     */
    public boolean isDeclarationSeen() {
        return declarationSeen;
    }

    /**
     * Returns the byte offset of the next token in the source, counting
     * the byte order mark.
     */
    public long getPosition() {
        return consumed + pos;
    }

    ReaderState getState() {
        return state;
    }

    // -- Configuration --

    /**
     * Sets a feature.
     *
     * @param name the feature URI
     * @param value the feature value
     * @throws IllegalArgumentException if the feature is not recognized
     */
    public void setFeature(String name, boolean value) {
        if (FEATURE_TRIM_TEXT.equals(name)) {
            trimTextStart = value;
            trimTextEnd = value;
        } else if (FEATURE_TRIM_TEXT_START.equals(name)) {
            trimTextStart = value;
        } else if (FEATURE_TRIM_TEXT_END.equals(name)) {
            trimTextEnd = value;
        } else if (FEATURE_EXPAND_EMPTY_ELEMENTS.equals(name)) {
            expandEmptyElements = value;
        } else {
            throw unknownFeature(name);
        }
    }

    /**
     * Returns the value of a feature.
     *
     * @param name the feature URI
     * @throws IllegalArgumentException if the feature is not recognized
     */
    public boolean getFeature(String name) {
        if (FEATURE_TRIM_TEXT.equals(name)) {
            return trimTextStart && trimTextEnd;
        } else if (FEATURE_TRIM_TEXT_START.equals(name)) {
            return trimTextStart;
        } else if (FEATURE_TRIM_TEXT_END.equals(name)) {
            return trimTextEnd;
        } else if (FEATURE_EXPAND_EMPTY_ELEMENTS.equals(name)) {
            return expandEmptyElements;
        }
        throw unknownFeature(name);
    }

    public void setTrimText(boolean trimText) {
        setFeature(FEATURE_TRIM_TEXT, trimText);
    }

    public void setExpandEmptyElements(boolean expandEmptyElements) {
        setFeature(FEATURE_EXPAND_EMPTY_ELEMENTS, expandEmptyElements);
    }

    private static IllegalArgumentException unknownFeature(String name) {
        String msg = MessageFormat.format(L10N.getString("err.unknown_feature"), name);
        return new IllegalArgumentException(msg);
    }

    // -- Event stream --

    /**
     * Reads the next event.
     *
     * <p>The returned event, and any buffer obtained from it, is only valid
     * until the next call to this method.
     *
     * @return the next event, or {@link Event#END_OF_FILE} once the
     *         document is exhausted
     * @throws ParseException if the markup is unterminated or malformed;
     *         the same exception is thrown by every later call
     * @throws IOException if the underlying source fails
     */
    public Event next() throws ParseException, IOException {
        switch (state) {
            case FAILED:
                throw failure;
            case EOF:
                return Event.END_OF_FILE;
            case INITIAL:
                start();
                state = ReaderState.SCANNING;
                break;
            default:
                break;
        }
        if (pendingEnd != null) {
            Event event = pendingEnd;
            pendingEnd = null;
            return event;
        }
        try {
            Event event;
            do {
                if (!available(1)) {
                    state = ReaderState.EOF;
                    return Event.END_OF_FILE;
                }
                event = readToken();
            } while (event == null);
            if (event.type == EventType.DECLARATION) {
                applyDeclaredEncoding((Declaration) event);
            }
            return event;
        } catch (ParseException e) {
            state = ReaderState.FAILED;
            failure = e;
            throw e;
        }
    }

    /**
     * Reads the next event and places its payload in the given buffer.
     *
     * <p>The payload is appended at the buffer's position, which is
     * advanced past it. The returned event views that region of the
     * buffer and stays valid until the caller overwrites it.
     *
     * @param scratch the buffer to receive the payload
     * @return the next event
     * @throws java.nio.BufferOverflowException if the payload does not fit;
     *         the event is consumed nonetheless
     * @throws ParseException if the markup is unterminated or malformed
     * @throws IOException if the underlying source fails
     */
    public Event next(ByteBuffer scratch) throws ParseException, IOException {
        return next().copyInto(scratch);
    }

    /**
     * Closes the underlying source, if any.
     */
    @Override
    public void close() throws IOException {
        if (source != null) {
            source.close();
        }
    }

    // -- Detection and declaration handling --

    private void start() throws IOException {
        available(4);
        ByteBuffer prefix = buffer.duplicate();
        prefix.position(pos);
        prefix.limit(end);
        EncodingDetector.Detection detection = EncodingDetector.detect(prefix);
        if (detection == null) {
            return;
        }
        Encoding detected = detection.getEncoding();
        if (decoder.isPinned()) {
            if (detected == Encoding.UTF_8) {
                bomLength = detection.getBomLength();
            }
        } else {
            decoder.detected(detected);
            layout = detection.getLayout(prefix);
            bomLength = detection.getBomLength();
        }
        pos += bomLength;
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = L10N.getString("fine.detected_encoding");
            LOGGER.fine(MessageFormat.format(msg, decoder.getEncoding(), bomLength, layout));
        }
    }

    private void applyDeclaredEncoding(Declaration declaration) {
        if (declarationSeen) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = L10N.getString("fine.declaration_ignored");
                LOGGER.fine(MessageFormat.format(msg, declaration.getEncoding(), decoder.getEncoding()));
            }
            return;
        }
        declarationSeen = true;
        String label = declaration.getEncoding();
        if (label == null || decoder.isPinned()) {
            return;
        }
        Encoding declared = Encoding.forLabel(label);
        if (declared == null || !declared.isSupported()) {
            recordEncodingError("err.unsupported_encoding", label);
            return;
        }
        Encoding current = decoder.getEncoding();
        if (declared.isUtf16()) {
            if (current.isUtf16()) {
                // byte order mark takes precedence
                return;
            }
        } else if (layout != ByteLayout.SINGLE) {
            recordEncodingError("err.incompatible_encoding", label);
            return;
        }
        decoder.override(declared);
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = L10N.getString("fine.encoding_switched");
            LOGGER.fine(MessageFormat.format(msg, current, declared));
        }
    }

    private void recordEncodingError(String key, String label) {
        String msg = MessageFormat.format(L10N.getString(key), label, decoder.getEncoding());
        encodingError = new UnsupportedEncodingException(msg);
        LOGGER.warning(msg);
    }

    // -- Tokenizer --

    /**
     * Reads one token at pos. Returns null if the token was text that the
     * trim settings removed entirely.
     */
    private Event readToken() throws ParseException, IOException {
        if (available(layout.width) && unit(0) == '<') {
            return readMarkup();
        }
        return readText();
    }

    private Event readText() throws IOException {
        int w = layout.width;
        int i = 0;
        while (available(i + w) && unit(i) != '<') {
            i += w;
        }
        if (!available(i + w)) {
            // include any trailing partial unit
            i = end - pos;
        }
        int start = 0;
        int stop = i;
        if (trimTextStart) {
            while (start + w <= stop && StartTag.isWhitespace(unit(start))) {
                start += w;
            }
        }
        if (trimTextEnd && (stop - start) % w == 0) {
            while (stop - w >= start && StartTag.isWhitespace(unit(stop - w))) {
                stop -= w;
            }
        }
        long at = getPosition();
        Event event = null;
        if (stop > start) {
            event = new Event(EventType.TEXT, slice(start, stop), decoder, layout, at);
        }
        pos += i;
        return event;
    }

    private Event readMarkup() throws ParseException, IOException {
        int w = layout.width;
        if (!available(2 * w)) {
            throw fatal("err.unterminated_markup");
        }
        switch (unit(w)) {
            case '?':
                return readProcessingInstruction();
            case '!':
                return readBang();
            case '/':
                return readEndTag();
            default:
                return readStartTag();
        }
    }

    private Event readProcessingInstruction() throws ParseException, IOException {
        int w = layout.width;
        int start = 2 * w;
        int close = find(start, "?>");
        if (close < 0) {
            throw fatal("err.unterminated_pi");
        }
        int t = start;
        while (t < close && !StartTag.isWhitespace(unit(t))) {
            t += w;
        }
        int targetLength = t - start;
        boolean xml = targetLength == 3 * w && matches(start, "xml");
        ByteBuffer raw = slice(start, close);
        long at = getPosition();
        pos += close + 2 * w;
        if (xml) {
            return new Declaration(raw, decoder, layout, at);
        }
        return new ProcessingInstruction(raw, targetLength, decoder, layout, at);
    }

    private Event readBang() throws ParseException, IOException {
        int w = layout.width;
        if (available(4 * w) && matches(2 * w, "--")) {
            return readDelimited(EventType.COMMENT, 4 * w, "-->", "err.unterminated_comment");
        }
        if (available(9 * w) && matches(2 * w, "[CDATA[")) {
            return readDelimited(EventType.CDATA, 9 * w, "]]>", "err.unterminated_cdata");
        }
        if (available(9 * w) && matchesIgnoreCase(2 * w, "DOCTYPE")) {
            return readDoctype();
        }
        if (!available(9 * w)) {
            throw fatal("err.unterminated_markup");
        }
        throw fatal("err.malformed_markup");
    }

    private Event readDelimited(EventType type, int start, String delimiter, String unterminated)
            throws ParseException, IOException {
        int close = find(start, delimiter);
        if (close < 0) {
            throw fatal(unterminated);
        }
        Event event = new Event(type, slice(start, close), decoder, layout, getPosition());
        pos += close + delimiter.length() * layout.width;
        return event;
    }

    /**
     * Reads {@code <!DOCTYPE ...>}. Quoted literals and an internal subset
     * in brackets may contain {@code >}.
     */
    private Event readDoctype() throws ParseException, IOException {
        int w = layout.width;
        int i = 9 * w;
        int quote = 0;
        int depth = 0;
        while (true) {
            if (!available(i + w)) {
                throw fatal("err.unterminated_doctype");
            }
            int c = unit(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '[') {
                depth++;
            } else if (c == ']') {
                if (depth > 0) {
                    depth--;
                }
            } else if (c == '>' && depth == 0) {
                break;
            }
            i += w;
        }
        int start = 9 * w;
        while (start < i && StartTag.isWhitespace(unit(start))) {
            start += w;
        }
        Event event = new Event(EventType.DOCTYPE, slice(start, i), decoder, layout, getPosition());
        pos += i + w;
        return event;
    }

    private Event readEndTag() throws ParseException, IOException {
        int w = layout.width;
        int close = find(2 * w, ">");
        if (close < 0) {
            throw fatal("err.unterminated_tag");
        }
        int nameEnd = close;
        while (nameEnd > 2 * w && StartTag.isWhitespace(unit(nameEnd - w))) {
            nameEnd -= w;
        }
        Event event = new EndTag(slice(2 * w, nameEnd), decoder, layout, getPosition());
        pos += close + w;
        return event;
    }

    private Event readStartTag() throws ParseException, IOException {
        int w = layout.width;
        int i = w;
        int quote = 0;
        while (true) {
            if (!available(i + w)) {
                throw fatal("err.unterminated_tag");
            }
            int c = unit(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                break;
            }
            i += w;
        }
        int close = i;
        boolean empty = close > w && unit(close - w) == '/';
        int contentEnd = empty ? close - w : close;
        int n = w;
        while (n < contentEnd && !StartTag.isWhitespace(unit(n))) {
            n += w;
        }
        int nameLength = n - w;
        if (nameLength == 0) {
            throw fatal("err.empty_tag_name");
        }
        EventType type = (empty && !expandEmptyElements) ? EventType.EMPTY_TAG : EventType.START_TAG;
        StartTag tag = new StartTag(type, slice(w, contentEnd), nameLength, decoder, layout, getPosition());
        pos += close + w;
        if (empty && expandEmptyElements) {
            pendingEnd = tag.toEndTag();
        }
        return tag;
    }

    // -- Buffer access --

    /**
     * Returns the code unit at the given offset from pos.
     */
    private int unit(int offset) {
        return layout.unitAt(buffer, pos + offset);
    }

    /**
     * Ensures that count bytes starting at pos are buffered, reading from
     * the source if necessary.
     *
     * @return false if the source ends first
     */
    private boolean available(int count) throws IOException {
        while (end - pos < count) {
            if (!fill()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Finds the first occurrence of an ASCII delimiter at or after the
     * given offset from pos.
     *
     * @return the offset of the delimiter, or -1 if the source ends first
     */
    private int find(int from, String delimiter) throws IOException {
        int w = layout.width;
        int length = delimiter.length() * w;
        for (int i = from; available(i + length); i += w) {
            if (matches(i, delimiter)) {
                return i;
            }
        }
        return -1;
    }

    private boolean matches(int offset, String s) {
        int w = layout.width;
        for (int k = 0; k < s.length(); k++) {
            if (unit(offset + k * w) != s.charAt(k)) {
                return false;
            }
        }
        return true;
    }

    private boolean matchesIgnoreCase(int offset, String s) {
        int w = layout.width;
        for (int k = 0; k < s.length(); k++) {
            int c = unit(offset + k * w);
            if (c >= 'a' && c <= 'z') {
                c -= 'a' - 'A';
            }
            if (c != s.charAt(k)) {
                return false;
            }
        }
        return true;
    }

    private ByteBuffer slice(int from, int to) {
        return buffer.slice(pos + from, to - from).asReadOnlyBuffer();
    }

    /**
     * Reads more bytes from the source. Bytes before pos are discarded
     * first; if the buffer is still full, its capacity is doubled.
     *
     * @return false if there is no source or it has ended
     */
    private boolean fill() throws IOException {
        if (exhausted) {
            return false;
        }
        if (pos > 0) {
            buffer.limit(end);
            buffer.position(pos);
            buffer.compact();
            consumed += pos;
            end -= pos;
            pos = 0;
        }
        if (end == buffer.capacity()) {
            ByteBuffer larger = ByteBuffer.allocate(buffer.capacity() * 2);
            buffer.position(0);
            buffer.limit(end);
            larger.put(buffer);
            buffer = larger;
        }
        buffer.limit(buffer.capacity());
        buffer.position(end);
        int count;
        do {
            count = source.read(buffer);
        } while (count == 0);
        if (count < 0) {
            exhausted = true;
            return false;
        }
        end += count;
        return true;
    }

    private ParseException fatal(String key) {
        long at = getPosition();
        String msg = MessageFormat.format(L10N.getString(key), at);
        return new ParseException(msg, at);
    }

}
