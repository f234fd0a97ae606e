/*
 * Encoding.java
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

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The closed set of character encodings understood by the reader.
 *
 * <p>Each encoding has a canonical name, a set of case-insensitive labels
 * by which it may be named in an XML declaration, and a Java
 * {@link Charset} used to transcode byte payloads. The labels follow the
 * names commonly used on the web platform, so that for example
 * {@code latin1} and {@code us-ascii} both name {@link #WINDOWS_1252}.
 *
 * <p>Three encodings have no charset in the JDK ({@code ISO-8859-10},
 * {@code ISO-8859-14} and {@code x-user-defined}); these are provided by
 * {@link SingleByteCharset}.
 *
 * <h3>Label resolution</h3>
 * <p>{@link #forLabel(String)} is the only way to go from a declared label
 * to an encoding. An unlabelled {@code "UTF-16"} resolves to
 * {@link #UTF_16LE}.
 *
 * @see EncodingDetector
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum Encoding {

    // ===== Unicode =====

    UTF_8("UTF-8", Family.UNICODE, "UTF-8",
            "unicode-1-1-utf-8", "unicode11utf8", "unicode20utf8", "utf8",
            "x-unicode20utf8"),
    UTF_16LE("UTF-16LE", Family.UNICODE, "UTF-16LE",
            "utf-16", "csunicode", "iso-10646-ucs-2", "ucs-2", "unicode",
            "unicodefeff"),
    UTF_16BE("UTF-16BE", Family.UNICODE, "UTF-16BE",
            "unicodefffe"),

    // ===== Legacy multi-byte =====

    BIG5("Big5", Family.MULTI_BYTE, "Big5-HKSCS",
            "big5-hkscs", "cn-big5", "csbig5", "x-x-big5"),
    EUC_JP("EUC-JP", Family.MULTI_BYTE, "EUC-JP",
            "cseucpkdfmtjapanese", "x-euc-jp"),
    // Unified Hangul Code, the superset labelled EUC-KR in practice
    EUC_KR("EUC-KR", Family.MULTI_BYTE, "x-windows-949",
            "cseuckr", "csksc56011987", "iso-ir-149", "korean",
            "ks_c_5601-1987", "ks_c_5601-1989", "ksc5601", "ksc_5601",
            "windows-949"),
    GB18030("GB18030", Family.MULTI_BYTE, "GB18030"),
    GBK("GBK", Family.MULTI_BYTE, "GBK",
            "chinese", "csgb2312", "csiso58gb231280", "gb2312", "gb_2312",
            "gb_2312-80", "iso-ir-58", "x-gbk"),
    ISO_2022_JP("ISO-2022-JP", Family.MULTI_BYTE, "ISO-2022-JP",
            "csiso2022jp"),
    SHIFT_JIS("Shift_JIS", Family.MULTI_BYTE, "windows-31j",
            "csshiftjis", "ms932", "ms_kanji", "shift-jis", "sjis",
            "windows-31j", "x-sjis"),

    // ===== Legacy single-byte =====

    IBM866("IBM866", Family.SINGLE_BYTE, "IBM866",
            "866", "cp866", "csibm866"),
    ISO_8859_2("ISO-8859-2", Family.SINGLE_BYTE, "ISO-8859-2",
            "csisolatin2", "iso-ir-101", "iso8859-2", "iso88592", "iso_8859-2",
            "iso_8859-2:1987", "l2", "latin2"),
    ISO_8859_3("ISO-8859-3", Family.SINGLE_BYTE, "ISO-8859-3",
            "csisolatin3", "iso-ir-109", "iso8859-3", "iso88593", "iso_8859-3",
            "iso_8859-3:1988", "l3", "latin3"),
    ISO_8859_4("ISO-8859-4", Family.SINGLE_BYTE, "ISO-8859-4",
            "csisolatin4", "iso-ir-110", "iso8859-4", "iso88594", "iso_8859-4",
            "iso_8859-4:1988", "l4", "latin4"),
    ISO_8859_5("ISO-8859-5", Family.SINGLE_BYTE, "ISO-8859-5",
            "csisolatincyrillic", "cyrillic", "iso-ir-144", "iso8859-5",
            "iso88595", "iso_8859-5", "iso_8859-5:1988"),
    ISO_8859_6("ISO-8859-6", Family.SINGLE_BYTE, "ISO-8859-6",
            "arabic", "asmo-708", "csiso88596e", "csiso88596i",
            "csisolatinarabic", "ecma-114", "iso-8859-6-e", "iso-8859-6-i",
            "iso-ir-127", "iso8859-6", "iso88596", "iso_8859-6",
            "iso_8859-6:1987"),
    ISO_8859_7("ISO-8859-7", Family.SINGLE_BYTE, "ISO-8859-7",
            "csisolatingreek", "ecma-118", "elot_928", "greek", "greek8",
            "iso-ir-126", "iso8859-7", "iso88597", "iso_8859-7",
            "iso_8859-7:1987", "sun_eu_greek"),
    ISO_8859_8("ISO-8859-8", Family.SINGLE_BYTE, "ISO-8859-8",
            "csiso88598e", "csisolatinhebrew", "hebrew", "iso-8859-8-e",
            "iso-ir-138", "iso8859-8", "iso88598", "iso_8859-8",
            "iso_8859-8:1988", "visual"),
    // Logical-order Hebrew: same code points as ISO-8859-8
    ISO_8859_8_I("ISO-8859-8-I", Family.SINGLE_BYTE, "ISO-8859-8",
            "csiso88598i", "logical"),
    ISO_8859_10("ISO-8859-10", Family.SINGLE_BYTE, null,
            "csisolatin6", "iso-ir-157", "iso8859-10", "iso885910", "l6",
            "latin6"),
    ISO_8859_13("ISO-8859-13", Family.SINGLE_BYTE, "ISO-8859-13",
            "iso8859-13", "iso885913"),
    ISO_8859_14("ISO-8859-14", Family.SINGLE_BYTE, null,
            "iso8859-14", "iso885914"),
    ISO_8859_15("ISO-8859-15", Family.SINGLE_BYTE, "ISO-8859-15",
            "csisolatin9", "iso8859-15", "iso885915", "iso_8859-15", "l9"),
    ISO_8859_16("ISO-8859-16", Family.SINGLE_BYTE, "ISO-8859-16"),
    KOI8_R("KOI8-R", Family.SINGLE_BYTE, "KOI8-R",
            "cskoi8r", "koi", "koi8", "koi8_r"),
    KOI8_U("KOI8-U", Family.SINGLE_BYTE, "KOI8-U",
            "koi8-ru"),
    MACINTOSH("macintosh", Family.SINGLE_BYTE, "x-MacRoman",
            "csmacintosh", "mac", "x-mac-roman"),
    WINDOWS_874("windows-874", Family.SINGLE_BYTE, "x-windows-874",
            "dos-874", "iso-8859-11", "iso8859-11", "iso885911", "tis-620"),
    WINDOWS_1250("windows-1250", Family.SINGLE_BYTE, "windows-1250",
            "cp1250", "x-cp1250"),
    WINDOWS_1251("windows-1251", Family.SINGLE_BYTE, "windows-1251",
            "cp1251", "x-cp1251"),
    WINDOWS_1252("windows-1252", Family.SINGLE_BYTE, "windows-1252",
            "ansi_x3.4-1968", "ascii", "cp1252", "cp819", "csisolatin1",
            "ibm819", "iso-8859-1", "iso-ir-100", "iso8859-1", "iso88591",
            "iso_8859-1", "iso_8859-1:1987", "l1", "latin1", "us-ascii",
            "x-cp1252"),
    WINDOWS_1253("windows-1253", Family.SINGLE_BYTE, "windows-1253",
            "cp1253", "x-cp1253"),
    WINDOWS_1254("windows-1254", Family.SINGLE_BYTE, "windows-1254",
            "cp1254", "csisolatin5", "iso-8859-9", "iso-ir-148", "iso8859-9",
            "iso88599", "iso_8859-9", "iso_8859-9:1989", "l5", "latin5",
            "x-cp1254"),
    WINDOWS_1255("windows-1255", Family.SINGLE_BYTE, "windows-1255",
            "cp1255", "x-cp1255"),
    WINDOWS_1256("windows-1256", Family.SINGLE_BYTE, "windows-1256",
            "cp1256", "x-cp1256"),
    WINDOWS_1257("windows-1257", Family.SINGLE_BYTE, "windows-1257",
            "cp1257", "x-cp1257"),
    WINDOWS_1258("windows-1258", Family.SINGLE_BYTE, "windows-1258",
            "cp1258", "x-cp1258"),
    X_MAC_CYRILLIC("x-mac-cyrillic", Family.SINGLE_BYTE, "x-MacCyrillic",
            "x-mac-ukrainian"),
    X_USER_DEFINED("x-user-defined", Family.SINGLE_BYTE, null);

    /**
     * Broad classification of an encoding.
     */
    public enum Family {
        /** UTF-8 and the two UTF-16 byte orders. */
        UNICODE,
        /** Legacy CJK encodings using more than one byte per character. */
        MULTI_BYTE,
        /** Legacy encodings mapping each byte to one character. */
        SINGLE_BYTE
    }

    private static final Map<String,Encoding> LABELS;

    static {
        Map<String,Encoding> labels = new HashMap<>();
        for (Encoding encoding : values()) {
            labels.put(encoding.canonicalName.toLowerCase(Locale.ROOT), encoding);
            for (String alias : encoding.aliases) {
                labels.put(alias, encoding);
            }
        }
        LABELS = Collections.unmodifiableMap(labels);
    }

    private final String canonicalName;
    private final Family family;
    private final String charsetName;
    private final String[] aliases;

    /** Resolved lazily: some runtimes are linked without jdk.charsets. */
    private volatile Charset charset;

    Encoding(String name, Family family, String charsetName, String... aliases) {
        this.canonicalName = name;
        this.family = family;
        this.charsetName = charsetName;
        this.aliases = aliases;
    }

    /**
     * Returns the canonical name of this encoding, e.g. {@code windows-1251}.
     */
    public String getName() {
        return canonicalName;
    }

    public Family getFamily() {
        return family;
    }

    /**
     * Returns true for {@link #UTF_16LE} and {@link #UTF_16BE}.
     */
    public boolean isUtf16() {
        return this == UTF_16LE || this == UTF_16BE;
    }

    /**
     * Returns the Java charset that transcodes this encoding.
     *
     * @return the charset
     * @throws UnsupportedCharsetException if the running JDK does not
     *         provide it
     */
    public Charset getCharset() {
        Charset cs = charset;
        if (cs == null) {
            switch (this) {
                case UTF_8:
                    cs = StandardCharsets.UTF_8;
                    break;
                case UTF_16LE:
                    cs = StandardCharsets.UTF_16LE;
                    break;
                case UTF_16BE:
                    cs = StandardCharsets.UTF_16BE;
                    break;
                case ISO_8859_10:
                    cs = SingleByteCharset.ISO_8859_10;
                    break;
                case ISO_8859_14:
                    cs = SingleByteCharset.ISO_8859_14;
                    break;
                case X_USER_DEFINED:
                    cs = SingleByteCharset.X_USER_DEFINED;
                    break;
                default:
                    cs = Charset.forName(charsetName);
            }
            charset = cs;
        }
        return cs;
    }

    /**
     * Indicates whether the running JDK can transcode this encoding.
     */
    public boolean isSupported() {
        try {
            getCharset();
            return true;
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return false;
        }
    }

    /**
     * Resolves a declared encoding label.
     *
     * <p>Leading and trailing ASCII whitespace is ignored and the
     * comparison is case-insensitive.
     *
     * @param label the label, e.g. from the {@code encoding} pseudo-attribute
     *        of an XML declaration
     * @return the encoding, or null if the label is not recognized
     */
    public static Encoding forLabel(String label) {
        if (label == null) {
            return null;
        }
        int start = 0;
        int end = label.length();
        while (start < end && isAsciiWhitespace(label.charAt(start))) {
            start++;
        }
        while (end > start && isAsciiWhitespace(label.charAt(end - 1))) {
            end--;
        }
        return LABELS.get(label.substring(start, end).toLowerCase(Locale.ROOT));
    }

    private static boolean isAsciiWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    @Override
    public String toString() {
        return canonicalName;
    }

}
