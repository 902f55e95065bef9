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

// DICOM elements that carry CSA data
public enum CSAElement {
    IMAGE_HEADER_INFO(0x0029, 0x1010, "CSA Image Header Info", true),
    SERIES_HEADER_INFO(0x0029, 0x1020, "CSA Series Header Info", true),
    // XA enhanced images: plain XProtocol text inside the shared functional groups, not a tag stream
    XA_PROTOCOL(0x0021, 0x1019, "MR Protocol", false);

    private final int group;
    private final int element;
    private final String description;
    private final boolean binary;

    CSAElement(int group, int element, String description, boolean binary) {
        this.group = group;
        this.element = element;
        this.description = description;
        this.binary = binary;
    }

    public int group() {
        return group;
    }

    public int element() {
        return element;
    }

    public String description() {
        return description;
    }

    // True for CSA tag streams, false for protocol text
    public boolean isBinary() {
        return binary;
    }

    @Override
    public String toString() {
        return "(%04X,%04X) %s".formatted(group, element, description);
    }
}
