/*
 * DeclarationEncodingTest.java
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
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import org.bluezoo.ripple.encoding.Encoding;

import static org.junit.Assert.*;

/**
 * Tests for how byte order marks and XML declarations select the
 * encoding of a document.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DeclarationEncodingTest {

    private static byte[] withPrefix(int b0, int b1, String ascii) {
        byte[] body = ascii.getBytes(StandardCharsets.US_ASCII);
        byte[] doc = new byte[body.length + 2];
        doc[0] = (byte) b0;
        doc[1] = (byte) b1;
        System.arraycopy(body, 0, doc, 2, body.length);
        return doc;
    }

    @Test
    public void testBomOverriddenByDeclaration() throws Exception {
        EventReader reader = EventReader.fromBytes(withPrefix(0xFF, 0xFE, "<?xml encoding='windows-1251'?>"));
        assertSame(Encoding.UTF_8, reader.getEncoding());

        Declaration decl = (Declaration) reader.next();
        assertEquals("windows-1251", decl.getEncoding());
        assertSame(Encoding.WINDOWS_1251, reader.getEncoding());
        assertTrue(reader.getDecoder().isOverridden());

        assertSame(Event.END_OF_FILE, reader.next());
        assertSame(Encoding.WINDOWS_1251, reader.getEncoding());
    }

    @Test
    public void testBomFollowedByCjkText() throws Exception {
        String doc = "\u4E2D<a/>";
        byte[] le = doc.getBytes(StandardCharsets.UTF_16LE);
        byte[] be = doc.getBytes(StandardCharsets.UTF_16BE);
        assertCjkDocument(concat(new byte[] { (byte) 0xFF, (byte) 0xFE }, le), Encoding.UTF_16LE);
        assertCjkDocument(concat(new byte[] { (byte) 0xFE, (byte) 0xFF }, be), Encoding.UTF_16BE);
    }

    private static void assertCjkDocument(byte[] doc, Encoding expected) throws Exception {
        EventReader reader = EventReader.fromBytes(doc);
        Event text = reader.next();
        assertEquals(EventType.TEXT, text.getType());
        assertEquals("\u4E2D", text.decode());
        assertSame(expected, reader.getEncoding());
        StartTag tag = (StartTag) reader.next();
        assertEquals(EventType.EMPTY_TAG, tag.getType());
        assertEquals("a", tag.getName());
        assertSame(Event.END_OF_FILE, reader.next());
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] c = new byte[a.length + b.length];
        System.arraycopy(a, 0, c, 0, a.length);
        System.arraycopy(b, 0, c, a.length, b.length);
        return c;
    }

    @Test
    public void testBomEncodingVisibleBeforeDeclaration() throws Exception {
        EventReader reader = EventReader.fromBytes(
                withPrefix(0xFF, 0xFE, "<!--c--><?xml encoding='windows-1251'?>"));
        assertEquals(EventType.COMMENT, reader.next().getType());
        assertSame(Encoding.UTF_16LE, reader.getEncoding());
        assertEquals(EventType.DECLARATION, reader.next().getType());
        assertSame(Encoding.WINDOWS_1251, reader.getEncoding());
    }

    @Test
    public void testOnlyFirstDeclarationChangesEncoding() throws Exception {
        EventReader reader = EventReader.fromBytes(
                "<?xml encoding='UTF-16'?><?xml encoding='windows-1251'?>".getBytes(StandardCharsets.US_ASCII));

        assertEquals(EventType.DECLARATION, reader.next().getType());
        assertSame(Encoding.UTF_16LE, reader.getEncoding());

        Declaration second = (Declaration) reader.next();
        assertEquals("windows-1251", second.getEncoding());
        assertSame(Encoding.UTF_16LE, reader.getEncoding());
        assertNull(reader.getEncodingError());
    }

    @Test
    public void testEucKrAcceptsUnifiedHangul() throws Exception {
        byte[] head = "<?xml encoding='EUC-KR'?><a>".getBytes(StandardCharsets.US_ASCII);
        byte[] tail = "</a>".getBytes(StandardCharsets.US_ASCII);
        // U+B620 lies outside KS X 1001 and is encoded 8C 63
        byte[] doc = concat(concat(head, new byte[] { (byte) 0x8C, (byte) 0x63 }), tail);

        EventReader reader = EventReader.fromBytes(doc);
        assertEquals(EventType.DECLARATION, reader.next().getType());
        assertSame(Encoding.EUC_KR, reader.getEncoding());
        assertEquals(EventType.START_TAG, reader.next().getType());
        Event text = reader.next();
        assertEquals(EventType.TEXT, text.getType());
        assertEquals("\uB620", text.decode());
        assertEquals(EventType.END_TAG, reader.next().getType());
        assertSame(Event.END_OF_FILE, reader.next());
    }

    @Test
    public void testDeclarationWithoutEncodingCounts() throws Exception {
        EventReader reader = EventReader.fromBytes(
                "<?xml version='1.0'?><?xml encoding='koi8-r'?>".getBytes(StandardCharsets.US_ASCII));
        reader.next();
        assertTrue(reader.isDeclarationSeen());
        assertSame(Encoding.UTF_8, reader.getEncoding());
        reader.next();
        assertSame(Encoding.UTF_8, reader.getEncoding());
    }

    @Test
    public void testTextSourceIgnoresDeclaration() throws Exception {
        EventReader reader = EventReader.fromString("<?xml encoding='UTF-16'?>");
        assertSame(Encoding.UTF_8, reader.getEncoding());
        Declaration decl = (Declaration) reader.next();
        assertEquals("UTF-16", decl.getEncoding());
        assertSame(Encoding.UTF_8, reader.getEncoding());
        assertTrue(reader.getDecoder().isPinned());
        assertFalse(reader.getDecoder().isOverridden());
        assertNull(reader.getEncodingError());
    }

    @Test
    public void testCharacterStreamIgnoresDeclaration() throws Exception {
        EventReader reader = EventReader.fromReader(
                new StringReader("\uFEFF<?xml version='1.0' encoding='windows-1251'?><a>\u0416</a>"));
        assertEquals(EventType.DECLARATION, reader.next().getType());
        assertSame(Encoding.UTF_8, reader.getEncoding());
        reader.next();
        assertEquals("\u0416", reader.next().decode());
        reader.close();
    }

    @Test
    public void testUnsupportedLabel() throws Exception {
        EventReader reader = EventReader.fromBytes(
                "<?xml version='1.0' encoding='bogus'?><a/><?xml encoding='koi8-r'?>"
                .getBytes(StandardCharsets.US_ASCII));

        Declaration decl = (Declaration) reader.next();
        assertEquals("bogus", decl.getEncoding());
        assertSame(Encoding.UTF_8, reader.getEncoding());
        assertNotNull(reader.getEncodingError());
        assertTrue(reader.getEncodingError().getMessage().contains("bogus"));

        assertEquals(EventType.EMPTY_TAG, reader.next().getType());
        // the first declaration has been processed, even though it failed
        assertEquals(EventType.DECLARATION, reader.next().getType());
        assertSame(Encoding.UTF_8, reader.getEncoding());
    }

    @Test
    public void testUtf16LabelKeepsBomByteOrder() throws Exception {
        byte[] body = "<?xml version=\"1.0\" encoding=\"UTF-16\"?><a/>".getBytes(StandardCharsets.UTF_16BE);
        byte[] doc = new byte[body.length + 2];
        doc[0] = (byte) 0xFE;
        doc[1] = (byte) 0xFF;
        System.arraycopy(body, 0, doc, 2, body.length);

        EventReader reader = EventReader.fromBytes(doc);
        Declaration decl = (Declaration) reader.next();
        assertEquals("UTF-16", decl.getEncoding());
        assertSame(Encoding.UTF_16BE, reader.getEncoding());
        assertEquals("a", ((StartTag) reader.next()).getName());
    }

    @Test
    public void testSingleByteLabelIncompatibleWithWideLayout() throws Exception {
        byte[] doc = "<?xml encoding='windows-1251'?><a/>".getBytes(StandardCharsets.UTF_16LE);
        EventReader reader = EventReader.fromBytes(doc);
        assertEquals(EventType.DECLARATION, reader.next().getType());
        assertSame(Encoding.UTF_16LE, reader.getEncoding());
        assertNotNull(reader.getEncodingError());
        assertEquals("a", ((StartTag) reader.next()).getName());
    }

    @Test
    public void testPseudoAttributes() throws Exception {
        EventReader reader = EventReader.fromBytes(
                "<?xml encoding = \"KOI8-R\" version='1.1' standalone='yes'?>".getBytes(StandardCharsets.US_ASCII));
        Declaration decl = (Declaration) reader.next();
        assertEquals("1.1", decl.getVersion());
        assertEquals("KOI8-R", decl.getEncoding());
        assertEquals(Boolean.TRUE, decl.getStandalone());
        assertSame(Encoding.KOI8_R, reader.getEncoding());
    }

    @Test
    public void testStandaloneNo() throws Exception {
        Declaration decl = (Declaration) EventReader.fromString("<?xml version='1.0' standalone='no'?>").next();
        assertEquals(Boolean.FALSE, decl.getStandalone());
    }

    @Test
    public void testMalformedPseudoAttributesIgnored() throws Exception {
        Declaration decl = (Declaration) EventReader.fromString("<?xml version='1.0' encoding=utf-8?>").next();
        assertEquals("1.0", decl.getVersion());
        assertNull(decl.getEncoding());
    }

    @Test
    public void testDecodeUsesEncodingInEffect() throws Exception {
        byte[] ascii = "<?xml encoding='windows-1251'?><a>".getBytes(StandardCharsets.US_ASCII);
        byte[] doc = new byte[ascii.length + 1];
        System.arraycopy(ascii, 0, doc, 0, ascii.length);
        doc[ascii.length] = (byte) 0xC6;
        EventReader reader = EventReader.fromBytes(doc);
        reader.next();
        reader.next();
        assertEquals("\u0416", reader.next().decode());
    }

    @Test(expected = IllegalStateException.class)
    public void testDecoderReplacedOnlyOnce() {
        Decoder decoder = new Decoder(false);
        decoder.override(Encoding.KOI8_R);
        decoder.override(Encoding.WINDOWS_1251);
    }

    @Test(expected = IllegalStateException.class)
    public void testPinnedDecoderCannotChange() {
        new Decoder(true).override(Encoding.KOI8_R);
    }

}
