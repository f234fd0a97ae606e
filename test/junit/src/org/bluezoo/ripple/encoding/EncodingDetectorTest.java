/*
 * EncodingDetectorTest.java
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

package org.bluezoo.ripple.encoding;

import org.junit.Test;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link EncodingDetector}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class EncodingDetectorTest {

    private static final String XML = "<?xml version=\"1.0\"?>\n<project name=\"project-name\">\n</project>\n";

    private static byte[] bytes(int... values) {
        byte[] b = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            b[i] = (byte) values[i];
        }
        return b;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] c = new byte[a.length + b.length];
        System.arraycopy(a, 0, c, 0, a.length);
        System.arraycopy(b, 0, c, a.length, b.length);
        return c;
    }

    private static EncodingDetector.Detection detection(Encoding encoding, int bomLength) {
        return new EncodingDetector.Detection(encoding, bomLength);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Byte order marks
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testUtf8Bom() {
        byte[] doc = concat(bytes(0xEF, 0xBB, 0xBF), XML.getBytes(StandardCharsets.UTF_8));
        assertEquals(detection(Encoding.UTF_8, 3), EncodingDetector.detect(doc));
    }

    @Test
    public void testUtf16BeBom() {
        byte[] doc = concat(bytes(0xFE, 0xFF), XML.getBytes(StandardCharsets.UTF_16BE));
        assertEquals(detection(Encoding.UTF_16BE, 2), EncodingDetector.detect(doc));
    }

    @Test
    public void testUtf16LeBom() {
        byte[] doc = concat(bytes(0xFF, 0xFE), XML.getBytes(StandardCharsets.UTF_16LE));
        assertEquals(detection(Encoding.UTF_16LE, 2), EncodingDetector.detect(doc));
    }

    @Test
    public void testBomOnly() {
        assertEquals(detection(Encoding.UTF_16LE, 2), EncodingDetector.detect(bytes(0xFF, 0xFE)));
        assertEquals(detection(Encoding.UTF_16BE, 2), EncodingDetector.detect(bytes(0xFE, 0xFF)));
        assertEquals(detection(Encoding.UTF_8, 3), EncodingDetector.detect(bytes(0xEF, 0xBB, 0xBF)));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // No byte order mark
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testAsciiDeclaration() {
        assertEquals(detection(Encoding.UTF_8, 0), EncodingDetector.detect(XML.getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    public void testUtf16LeWithoutBom() {
        assertEquals(detection(Encoding.UTF_16LE, 0),
                EncodingDetector.detect(XML.getBytes(StandardCharsets.UTF_16LE)));
    }

    @Test
    public void testUtf16BeWithoutBom() {
        assertEquals(detection(Encoding.UTF_16BE, 0),
                EncodingDetector.detect(XML.getBytes(StandardCharsets.UTF_16BE)));
    }

    @Test
    public void testNoSignature() {
        assertNull(EncodingDetector.detect("<project/>".getBytes(StandardCharsets.US_ASCII)));
        assertNull(EncodingDetector.detect("text".getBytes(StandardCharsets.US_ASCII)));
        assertNull(EncodingDetector.detect(new byte[0]));
    }

    @Test
    public void testTruncatedBom() {
        assertNull(EncodingDetector.detect(bytes(0xEF, 0xBB)));
        assertNull(EncodingDetector.detect(bytes(0xFE)));
        assertNull(EncodingDetector.detect(bytes(0xFF)));
    }

    @Test
    public void testPositionRespected() {
        ByteBuffer buf = ByteBuffer.wrap(concat(bytes('x', 0xFF, 0xFE), XML.getBytes(StandardCharsets.UTF_16LE)));
        buf.position(1);
        assertEquals(detection(Encoding.UTF_16LE, 2), EncodingDetector.detect(buf));
        assertEquals(1, buf.position());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Layout
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testLayoutAfterUtf16Bom() {
        ByteBuffer doc = ByteBuffer.wrap(concat(bytes(0xFF, 0xFE), XML.getBytes(StandardCharsets.UTF_16LE)));
        assertEquals(ByteLayout.UTF16LE, EncodingDetector.detect(doc).getLayout(doc));

        doc = ByteBuffer.wrap(concat(bytes(0xFE, 0xFF), XML.getBytes(StandardCharsets.UTF_16BE)));
        assertEquals(ByteLayout.UTF16BE, EncodingDetector.detect(doc).getLayout(doc));
    }

    @Test
    public void testLayoutAsciiAfterUtf16Bom() {
        ByteBuffer doc = ByteBuffer.wrap(concat(bytes(0xFF, 0xFE),
                "<?xml encoding='windows-1251'?>".getBytes(StandardCharsets.US_ASCII)));
        EncodingDetector.Detection detection = EncodingDetector.detect(doc);
        assertEquals(Encoding.UTF_16LE, detection.getEncoding());
        assertEquals(ByteLayout.SINGLE, detection.getLayout(doc));
    }

    @Test
    public void testLayoutCjkTextAfterUtf16Bom() {
        // U+4E2D is 2D 4E in UTF-16LE and 4E 2D in UTF-16BE
        ByteBuffer doc = ByteBuffer.wrap(concat(bytes(0xFF, 0xFE), "\u4E2D<a/>".getBytes(StandardCharsets.UTF_16LE)));
        assertEquals(ByteLayout.UTF16LE, EncodingDetector.detect(doc).getLayout(doc));

        doc = ByteBuffer.wrap(concat(bytes(0xFE, 0xFF), "\u4E2D<a/>".getBytes(StandardCharsets.UTF_16BE)));
        assertEquals(ByteLayout.UTF16BE, EncodingDetector.detect(doc).getLayout(doc));
    }

    @Test
    public void testLayoutWithoutBom() {
        ByteBuffer doc = ByteBuffer.wrap(XML.getBytes(StandardCharsets.UTF_16BE));
        assertEquals(ByteLayout.UTF16BE, EncodingDetector.detect(doc).getLayout(doc));
        doc = ByteBuffer.wrap(XML.getBytes(StandardCharsets.UTF_8));
        assertEquals(ByteLayout.SINGLE, EncodingDetector.detect(doc).getLayout(doc));
    }

    @Test
    public void testUnitAt() {
        ByteBuffer le = ByteBuffer.wrap(bytes(0x3C, 0x00, 0x30, 0x04));
        assertEquals('<', ByteLayout.UTF16LE.unitAt(le, 0));
        assertEquals(0x0430, ByteLayout.UTF16LE.unitAt(le, 2));
        ByteBuffer be = ByteBuffer.wrap(bytes(0x00, 0x3C, 0x04, 0x30));
        assertEquals('<', ByteLayout.UTF16BE.unitAt(be, 0));
        assertEquals(0x0430, ByteLayout.UTF16BE.unitAt(be, 2));
        assertEquals(0xFF, ByteLayout.SINGLE.unitAt(ByteBuffer.wrap(bytes(0xFF)), 0));
    }

}
