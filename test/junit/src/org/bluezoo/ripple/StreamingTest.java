/*
 * StreamingTest.java
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

import org.junit.Test;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.channels.Channels;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.bluezoo.ripple.encoding.Encoding;

import static org.junit.Assert.*;

/**
 * Tests for readers that pull their input incrementally.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StreamingTest {

    private static final String DOCUMENT = "<?xml version=\"1.0\" encoding=\"KOI8-R\"?>\n"
            + "<!DOCTYPE catalog>\n"
            + "<catalog xmlns=\"urn:example\">\n"
            + "  <!-- entries -->\n"
            + "  <entry id='1' name=\"first\"><![CDATA[a < b]]></entry>\n"
            + "  <?render mode=\"fast\"?>\n"
            + "  <entry id='2'/>\n"
            + "</catalog>\n";

    /**
     * Delivers at most one byte per read.
     */
    static class TrickleInputStream extends ByteArrayInputStream {

        boolean closed;

        TrickleInputStream(byte[] buf) {
            super(buf);
        }

        @Override
        public synchronized int read(byte[] b, int off, int len) {
            return super.read(b, off, Math.min(len, 1));
        }

        @Override
        public synchronized int available() {
            return 0;
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }

    }

    /**
     * Reads all events, decoding each payload before the next call.
     */
    private static List<String> events(EventReader reader) throws Exception {
        List<String> events = new ArrayList<>();
        Event event;
        while ((event = reader.next()).getType() != EventType.END_OF_FILE) {
            events.add(event.getType() + "@" + event.getPosition() + ":" + event.decode()
                    + "/" + reader.getEncoding());
        }
        events.add(event.getType() + "@" + reader.getPosition());
        return events;
    }

    private static byte[] bytes(String text, Charset charset) {
        return text.getBytes(charset);
    }

    @Test
    public void testOneByteAtATime() throws Exception {
        byte[] doc = bytes(DOCUMENT, Charset.forName("KOI8-R"));
        List<String> expected = events(EventReader.fromBytes(doc));
        List<String> actual = events(EventReader.fromStream(new TrickleInputStream(doc)));
        assertEquals(expected, actual);
        assertEquals(19, expected.size());
    }

    @Test
    public void testUtf16BomOneByteAtATime() throws Exception {
        byte[] body = bytes("<a>\u0416</a>", StandardCharsets.UTF_16LE);
        byte[] doc = new byte[body.length + 2];
        doc[0] = (byte) 0xFF;
        doc[1] = (byte) 0xFE;
        System.arraycopy(body, 0, doc, 2, body.length);

        EventReader reader = EventReader.fromStream(new TrickleInputStream(doc));
        assertEquals("a", ((StartTag) reader.next()).getName());
        assertSame(Encoding.UTF_16LE, reader.getEncoding());
        Event text = reader.next();
        assertEquals(8, text.getPosition());
        assertEquals("\u0416", text.decode());
        assertEquals(EventType.END_TAG, reader.next().getType());
        assertSame(Event.END_OF_FILE, reader.next());
    }

    @Test
    public void testTokensLargerThanBuffer() throws Exception {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 5000; i++) {
            text.append("line ").append(i).append('\n');
        }
        StringBuilder comment = new StringBuilder();
        for (int i = 0; i < 20000; i++) {
            comment.append((char) ('a' + (i % 26)));
        }
        String xml = "<doc><!--" + comment + "-->" + text + "<end attr=\"" + comment + "\"/></doc>";
        byte[] doc = bytes(xml, StandardCharsets.UTF_8);

        EventReader reader = EventReader.fromChannel(Channels.newChannel(new ByteArrayInputStream(doc)));
        assertEquals(EventType.START_TAG, reader.next().getType());
        assertEquals(comment.toString(), reader.next().decode());
        Event body = reader.next();
        assertEquals(EventType.TEXT, body.getType());
        assertEquals(text.toString(), body.decode());
        StartTag end = (StartTag) reader.next();
        assertEquals(comment.toString(), end.getAttribute("attr").getValue());
        assertEquals(EventType.END_TAG, reader.next().getType());
        assertSame(Event.END_OF_FILE, reader.next());
        assertEquals(doc.length, reader.getPosition());
    }

    @Test
    public void testCopySurvivesCompaction() throws Exception {
        StringBuilder filler = new StringBuilder();
        for (int i = 0; i < 10000; i++) {
            filler.append('x');
        }
        byte[] doc = bytes("<first/>" + filler + "<last/>", StandardCharsets.UTF_8);
        EventReader reader = EventReader.fromStream(new TrickleInputStream(doc));
        StartTag first = (StartTag) reader.next().copy();
        reader.next();
        reader.next();
        assertEquals("first", first.getName());
    }

    @Test
    public void testCharacterStream() throws Exception {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 3000; i++) {
            text.append("\uD83D\uDE00");
        }
        String xml = "\uFEFF<aa>" + text + "</aa>";
        EventReader reader = EventReader.fromReader(new StringReader(xml));
        assertEquals(EventType.START_TAG, reader.next().getType());
        assertEquals(7, reader.getPosition());
        assertEquals(text.toString(), reader.next().decode());
        assertEquals(EventType.END_TAG, reader.next().getType());
        assertSame(Event.END_OF_FILE, reader.next());
        assertSame(Encoding.UTF_8, reader.getEncoding());
    }

    @Test
    public void testCloseClosesStream() throws Exception {
        TrickleInputStream in = new TrickleInputStream(bytes("<a/>", StandardCharsets.UTF_8));
        EventReader reader = EventReader.fromStream(in);
        reader.next();
        reader.close();
        assertTrue(in.closed);
    }

    @Test
    public void testIOExceptionPropagates() throws Exception {
        InputStream failing = new InputStream() {
            private int count;

            @Override
            public int read() throws IOException {
                if (count++ < 3) {
                    return '<';
                }
                throw new IOException("connection reset");
            }
        };
        EventReader reader = EventReader.fromStream(failing);
        try {
            reader.next();
            fail("Expected IOException");
        } catch (IOException e) {
            assertEquals("connection reset", e.getMessage());
        }
    }

}
