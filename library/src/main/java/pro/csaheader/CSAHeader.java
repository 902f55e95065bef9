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
import pro.csaheader.ascconv.Ascconv;
import pro.csaheader.ascconv.AscconvParser;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for decoding a CSA header element.
 * <pre>
 * ParsedHeader header = CSAHeader.parse(bytes);
 * header.get("B_value").map(CSATag::value);
 * </pre>
 * Fixed width numeric VRs (SS, US, SL, UL, FL, FD) are read as little-endian binary by default. Headers written
 * by syngo scanners store them as text, decode those with
 * <pre>
 * CSAHeader.parse(bytes, new CSAOptions().with(CSAOptions.NUMERIC_ENCODING, NumericEncoding.TEXT));
 * </pre>
 * With the binary default such items fail with {@link SizeMismatchException}.
 * The tag stream is decoded with {@link TagDecoder}. If it contains the protocol tag
 * ({@code MrPhoenixProtocol} unless configured otherwise) with a text or opaque value, that value is replaced
 * with the protocol tree decoded by {@link AscconvParser}.
 * <p>
 * Protocol text passed here instead of a tag stream fails with a {@link CSAException}, usually
 * {@link MalformedHeaderException} or {@link InvalidCheckBitException}. Telling the two apart is up to the
 * caller, who knows which element the bytes came from; see {@link CSAElement#isBinary()}.
 */
public final class CSAHeader {
    private static final Logger logger = LoggerFactory.getLogger(CSAHeader.class);

    private final byte[] raw;
    private final CSAOptions options;
    private final CSAType type;

    public CSAHeader(byte[] raw) {
        this(raw, new CSAOptions());
    }

    public CSAHeader(byte[] raw, CSAOptions options) {
        this.raw = Objects.requireNonNull(raw, "raw");
        this.options = Objects.requireNonNull(options, "options");
        this.type = CSAType.of(raw);
    }

    public static ParsedHeader parse(byte[] raw) {
        return new CSAHeader(raw).read();
    }

    public static ParsedHeader parse(byte[] raw, CSAOptions options) {
        return new CSAHeader(raw, options).read();
    }

    // Decodes a tag stream element, empty if the source does not have it
    public static Optional<ParsedHeader> read(ElementSource source, CSAElement element, CSAOptions options) {
        if (!element.isBinary()) {
            throw new IllegalArgumentException(element + " is not a CSA tag stream");
        }
        return source.element(element).map(bytes -> parse(bytes, options));
    }

    public static Optional<ParsedHeader> read(ElementSource source, CSAElement element) {
        return read(source, element, new CSAOptions());
    }

    // XProtocol text of XA enhanced images
    public static Optional<Ascconv> readProtocol(ElementSource source) {
        return source.element(CSAElement.XA_PROTOCOL).map(AscconvParser::parse);
    }

    public CSAType type() {
        return type;
    }

    public boolean isType2() {
        return type == CSAType.TYPE_2;
    }

    public int size() {
        return raw.length;
    }

    public CSAOptions options() {
        return options;
    }

    public ParsedHeader read() {
        var header = TagDecoder.decode(raw, options.get(CSAOptions.NUMERIC_ENCODING));
        if (!options.get(CSAOptions.DECODE_PROTOCOL)) {
            return header;
        }
        var name = options.get(CSAOptions.PROTOCOL_TAG);
        var tag = header.get(name);
        if (tag.isEmpty()) {
            return header;
        }
        var text = protocolText(tag.get().value());
        if (text == null) {
            logger.debug("{} has no text value, leaving it as is", name);
            return header;
        }
        var protocol = AscconvParser.parse(text);
        logger.debug("Decoded {} with {} assignments", name, protocol.assignments());
        return header.withProtocol(tag.get().withValues(List.of(protocol.root())), protocol);
    }

    // Scanners usually store the protocol with VR UN, so opaque bytes are read as text too
    private static String protocolText(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof byte[] bytes) {
            return ValueConverter.text(bytes);
        }
        return null;
    }
}
