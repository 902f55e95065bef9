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

// The two binary framings of a CSA tag stream
public enum CSAType {
    // Legacy, the stream starts directly with the tag count
    TYPE_1,
    // Starts with the SV10 marker
    TYPE_2;

    static final byte[] MARKER = "SV10".getBytes(StandardCharsets.US_ASCII);

    // Buffers shorter than the marker are reported as TYPE_1, decoding them fails later
    public static CSAType of(byte[] raw) {
        if (raw.length >= MARKER.length && Arrays.equals(raw, 0, MARKER.length, MARKER, 0, MARKER.length)) {
            return TYPE_2;
        }
        return TYPE_1;
    }
}
