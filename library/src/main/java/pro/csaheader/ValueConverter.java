/*
 * Copyright (c) 2025 The csaheader authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package pro.csaheader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Turns the raw bytes of one item into a typed value according to its {@link VR}.
 * <p>
 * Results are {@link String}, {@link Long}, {@link Double}, {@code byte[]} (opaque VRs) or null.
 */
public final class ValueConverter {
    private static final Logger logger = LoggerFactory.getLogger(ValueConverter.class);

    // How fixed width numeric VRs (SS, US, SL, UL, FL, FD) are stored in items
    public enum NumericEncoding {
        // Little-endian binary of exactly the VR width
        BINARY,
        // NUL terminated ASCII text, as written by syngo scanners
        TEXT
    }

    private ValueConverter() {}

    public static Object convert(VR vr, byte[] raw) {
        return convert(vr, raw, NumericEncoding.BINARY);
    }

    public static Object convert(VR vr, byte[] raw, NumericEncoding encoding) {
        Objects.requireNonNull(vr, "vr");
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(encoding, "encoding");
        return switch (vr.kind()) {
            case STRING -> text(raw);
            case INTEGER_STRING -> integer(text(raw));
            case DECIMAL_STRING -> decimal(text(raw));
            case SIGNED, UNSIGNED -> encoding == NumericEncoding.TEXT ? integer(text(raw)) : binaryInteger(vr, raw);
            case FLOAT -> encoding == NumericEncoding.TEXT ? decimal(text(raw)) : binaryFloat(vr, raw);
            case OPAQUE -> raw.clone();
        };
    }

    // ISO-8859-1, cut at the first NUL, trailing whitespace removed. Null if nothing is left.
    public static String text(byte[] raw) {
        int len = 0;
        while (len < raw.length && raw[len] != 0) {
            len++;
        }
        var s = new String(raw, 0, len, StandardCharsets.ISO_8859_1).stripTrailing();
        return s.isEmpty() ? null : s;
    }

    static Long integer(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Long.parseLong(text.strip());
        } catch (NumberFormatException e) {
            logger.debug("Not an integer: \"{}\"", text);
            return null;
        }
    }

    static Double decimal(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Double.parseDouble(text.strip());
        } catch (NumberFormatException e) {
            logger.debug("Not a decimal: \"{}\"", text);
            return null;
        }
    }

    private static ByteBuffer fixed(VR vr, byte[] raw) {
        if (raw.length != vr.width()) {
            throw new SizeMismatchException("%s payload must be %d bytes, got %d".formatted(vr, vr.width(), raw.length));
        }
        return ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static Long binaryInteger(VR vr, byte[] raw) {
        var buf = fixed(vr, raw);
        return switch (vr) {
            case SS -> (long) buf.getShort();
            case US -> (long) (buf.getShort() & 0xFFFF);
            case SL -> (long) buf.getInt();
            case UL -> buf.getInt() & 0xFFFFFFFFL;
            default -> throw new IllegalArgumentException("Not an integer VR: " + vr);
        };
    }

    private static Double binaryFloat(VR vr, byte[] raw) {
        var buf = fixed(vr, raw);
        return switch (vr) {
            case FL -> (double) buf.getFloat();
            case FD -> buf.getDouble();
            default -> throw new IllegalArgumentException("Not a floating point VR: " + vr);
        };
    }
}
