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
import pro.csaheader.ValueConverter.NumericEncoding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decodes the tag stream of a CSA header element.
 * <p>
 * Layout, all integers little-endian:
 * <pre>
 * TYPE_2 only: "SV10" marker, 4 unused bytes
 * tag count (int32), separator (int32)
 * per tag:  name (64 bytes, NUL padded), VM (int32), VR (4 bytes), syngo data type (int32),
 *           item count (int32), check bit (int32, 77 or 205)
 * per item: 4 x int32 length fields, payload, padding up to a 4 byte boundary
 * </pre>
 * The payload length is the second length field for TYPE_2. TYPE_1 stores the first field biased by
 * the item count of the first tag.
 */
public final class TagDecoder {
    private static final Logger logger = LoggerFactory.getLogger(TagDecoder.class);

    static final Set<Integer> CHECK_BITS = Set.of(77, 205);
    static final int NAME_LENGTH = 64;
    static final int VR_LENGTH = 4;
    // Smallest possible tag record: name, VM, VR, data type, item count, check bit
    static final int MIN_TAG_LENGTH = NAME_LENGTH + 4 + VR_LENGTH + 4 + 4 + 4;
    static final int ALIGNMENT = 4;

    private final Unpacker unpacker;
    private final NumericEncoding encoding;
    private CSAType type;
    private int firstTagItems;

    private TagDecoder(byte[] raw, NumericEncoding encoding) {
        this.unpacker = new Unpacker(raw);
        this.encoding = Objects.requireNonNull(encoding, "encoding");
    }

    public static ParsedHeader decode(byte[] raw) {
        return decode(raw, NumericEncoding.BINARY);
    }

    public static ParsedHeader decode(byte[] raw, NumericEncoding encoding) {
        Objects.requireNonNull(raw, "raw");
        return new TagDecoder(raw, encoding).decode();
    }

    private ParsedHeader decode() {
        type = Arrays.equals(unpacker.peek(CSAType.MARKER.length), CSAType.MARKER) ? CSAType.TYPE_2 : CSAType.TYPE_1;
        if (type == CSAType.TYPE_2) {
            unpacker.skip(CSAType.MARKER.length + 4);
        }
        int countOffset = unpacker.position();
        int count = unpacker.int32();
        unpacker.int32(); // separator
        if (count < 0 || count > unpacker.remaining() / MIN_TAG_LENGTH) {
            throw new MalformedHeaderException("Implausible tag count %d for %d remaining bytes".formatted(count, unpacker.remaining()), countOffset);
        }
        logger.debug("{} header with {} tags in {} bytes", type, count, unpacker.length());

        var tags = new LinkedHashMap<String, CSATag>();
        for (int i = 0; i < count; i++) {
            var tag = tag(i, count);
            if (tags.containsKey(tag.name())) {
                logger.debug("Duplicate tag {}, keeping the later value", tag.name());
            }
            tags.put(tag.name(), tag);
        }
        if (unpacker.remaining() > 0) {
            logger.trace("{} trailing bytes after last tag", unpacker.remaining());
        }
        return new ParsedHeader(type, tags);
    }

    private CSATag tag(int index, int count) {
        int start = unpacker.position();
        String name = null;
        try {
            name = unpacker.string(NAME_LENGTH);
            int vm = unpacker.int32();
            var vrCode = unpacker.string(VR_LENGTH).strip();
            int syngoDataType = unpacker.int32();
            int items = unpacker.int32();
            int checkBitOffset = unpacker.position();
            int checkBit = unpacker.int32();
            if (!CHECK_BITS.contains(checkBit)) {
                throw new InvalidCheckBitException(checkBit, checkBitOffset, index, name);
            }
            if (vm < 0 || items < 0) {
                throw new MalformedHeaderException("Negative VM (%d) or item count (%d)".formatted(vm, items), start, index, name);
            }
            if (index == 0) {
                firstTagItems = items;
            }
            var vr = VR.of(vrCode);
            var values = items(index, name, vr, vm, items);
            logger.trace("#{} {} {} VM={} items={} values={}", index, name, vrCode, vm, items, values.size());
            return new CSATag(name, vrCode, vr, vm, syngoDataType, values);
        } catch (OutOfBoundsException e) {
            throw new TruncatedStreamException("Stream declares %d tags but ends inside tag #%d".formatted(count, index), e.offset, index, name, e);
        }
    }

    // Reads every physical item, converts only the first VM of them
    private List<Object> items(int index, String name, VR vr, int vm, int items) {
        var values = new ArrayList<Object>(Math.min(vm, items));
        for (int i = 0; i < items; i++) {
            int start = unpacker.position();
            int x0 = unpacker.int32();
            int x1 = unpacker.int32();
            unpacker.int32();
            unpacker.int32();
            int length = type == CSAType.TYPE_2 ? x1 : x0 - firstTagItems;
            if (length < 0) {
                throw new MalformedHeaderException("Negative length %d of item %d".formatted(length, i), start, index, name);
            }
            if (i < vm) {
                var payload = unpacker.read(length);
                values.add(length == 0 ? null : convert(vr, payload, start, index, name));
            } else {
                unpacker.skip(length);
            }
            unpacker.skip((ALIGNMENT - length % ALIGNMENT) % ALIGNMENT);
        }
        return values;
    }

    private Object convert(VR vr, byte[] payload, int offset, int index, String name) {
        try {
            return ValueConverter.convert(vr, payload, encoding);
        } catch (SizeMismatchException e) {
            throw new SizeMismatchException(e.getMessage(), offset, index, name, e);
        }
    }
}
