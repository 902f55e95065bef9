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

import pro.csaheader.ascconv.Ascconv;

import java.util.*;
import java.util.stream.Stream;

/**
 * Decoded CSA header: tags by name, iterated in the order they appear in the stream.
 * <p>
 * When the header carried a protocol tag that was decoded, the tag holds the protocol tree as its only value
 * and {@link #protocol()} gives the full decode result.
 */
public final class ParsedHeader implements Iterable<CSATag> {
    private final CSAType type;
    private final Map<String, CSATag> tags;
    private final Ascconv protocol;

    ParsedHeader(CSAType type, LinkedHashMap<String, CSATag> tags) {
        this(type, tags, null);
    }

    private ParsedHeader(CSAType type, LinkedHashMap<String, CSATag> tags, Ascconv protocol) {
        this.type = Objects.requireNonNull(type, "type");
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        this.protocol = protocol;
    }

    // Same header with one tag replaced in place by its decoded protocol
    ParsedHeader withProtocol(CSATag tag, Ascconv decoded) {
        var copy = new LinkedHashMap<>(tags);
        copy.put(tag.name(), tag);
        return new ParsedHeader(type, copy, decoded);
    }

    public CSAType type() {
        return type;
    }

    public Optional<CSATag> get(String name) {
        return Optional.ofNullable(tags.get(name));
    }

    public boolean contains(String name) {
        return tags.containsKey(name);
    }

    public List<String> names() {
        return List.copyOf(tags.keySet());
    }

    public Map<String, CSATag> asMap() {
        return tags;
    }

    public Optional<Ascconv> protocol() {
        return Optional.ofNullable(protocol);
    }

    public int size() {
        return tags.size();
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    public Stream<CSATag> stream() {
        return tags.values().stream();
    }

    @Override
    public Iterator<CSATag> iterator() {
        return tags.values().iterator();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ParsedHeader other
                && type == other.type
                && List.copyOf(tags.values()).equals(List.copyOf(other.tags.values()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, List.copyOf(tags.values()));
    }

    @Override
    public String toString() {
        return "ParsedHeader{" + type + ", " + tags.size() + " tags: " + String.join(", ", tags.keySet()) + "}";
    }
}
