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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Bounds checked sequential reader over a byte array.
 * <p>
 * Every read is checked before any byte is returned, a read that does not fit fails with
 * {@link OutOfBoundsException} and leaves the position where it was. Multi-byte integers are
 * little-endian. The buffer is borrowed, never modified, and an instance is meant for a single decode.
 */
public final class Unpacker {
    private final byte[] buffer;
    private int position;

    public Unpacker(byte[] buffer) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
    }

    public int position() {
        return position;
    }

    public int length() {
        return buffer.length;
    }

    public int remaining() {
        return buffer.length - position;
    }

    public byte[] read(int n) {
        var result = peek(n);
        position += n;
        return result;
    }

    public byte[] peek(int n) {
        check(n);
        return Arrays.copyOfRange(buffer, position, position + n);
    }

    public void skip(int n) {
        check(n);
        position += n;
    }

    public void seek(int offset) {
        if (offset < 0 || offset > buffer.length) {
            throw new OutOfBoundsException("Can't seek to %d, buffer has %d bytes".formatted(offset, buffer.length), position);
        }
        position = offset;
    }

    // Signed 32 bit little-endian
    public int int32() {
        check(4);
        int v = (buffer[position] & 0xFF)
                | (buffer[position + 1] & 0xFF) << 8
                | (buffer[position + 2] & 0xFF) << 16
                | (buffer[position + 3] & 0xFF) << 24;
        position += 4;
        return v;
    }

    // Fixed width ISO-8859-1 field, cut at the first NUL
    public String string(int n) {
        var raw = read(n);
        int len = 0;
        while (len < raw.length && raw[len] != 0) {
            len++;
        }
        return new String(raw, 0, len, StandardCharsets.ISO_8859_1);
    }

    private void check(int n) {
        if (n < 0) {
            throw new OutOfBoundsException("Negative read length %d".formatted(n), position);
        }
        if (n > remaining()) {
            throw new OutOfBoundsException("Can't read %d bytes, only %d remaining".formatted(n, remaining()), position);
        }
    }
}
