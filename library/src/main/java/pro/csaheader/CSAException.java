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

/**
 * Root exception class for all CSA decoding errors.
 * <p>
 * Any of these aborts the decode of the whole header, partial results are never returned.
 */
@SuppressWarnings("serial")
public class CSAException extends RuntimeException {

    /**
     * Byte offset into the buffer where the problem was found, or -1 if not applicable.
     */
    public final int offset;

    /**
     * Zero based index of the tag being decoded, or -1 if not applicable.
     */
    public final int tagIndex;

    /**
     * Name of the tag being decoded, or null if not yet known.
     */
    public final String tagName;

    public CSAException(String message, int offset) {
        this(message, offset, -1, null, null);
    }

    public CSAException(String message, int offset, int tagIndex, String tagName, Throwable cause) {
        super(message + context(offset, tagIndex, tagName), cause);
        this.offset = offset;
        this.tagIndex = tagIndex;
        this.tagName = tagName;
    }

    static String context(int offset, int tagIndex, String tagName) {
        var sb = new StringBuilder();
        if (offset >= 0) {
            sb.append(" at offset ").append(offset);
        }
        if (tagIndex >= 0) {
            sb.append(sb.length() == 0 ? " in" : ",").append(" tag #").append(tagIndex);
            if (tagName != null && !tagName.isEmpty()) {
                sb.append(" (").append(tagName).append(')');
            }
        }
        return sb.toString();
    }
}
