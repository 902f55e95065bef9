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
package pro.csaheader.ascconv;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Left hand side of an ASCCONV assignment, like {@code sSliceArray.asSlice[0].dThickness}.
 * <p>
 * Each dot separated part is a {@link Segment}: a key with zero or more array indices.
 */
public record ProtocolPath(List<Segment> segments) {
    private static final Pattern SEGMENT = Pattern.compile("([A-Za-z_]\\w*)((?:\\[\\s*\\d+\\s*])*)");
    private static final Pattern INDEX = Pattern.compile("\\[\\s*(\\d+)\\s*]");

    // Largest array index accepted, arrays grow with placeholders up to the index
    public static final int MAX_INDEX = 65535;

    public ProtocolPath {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Path must have at least one segment");
        }
        segments = List.copyOf(segments);
    }

    public record Segment(String key, List<Integer> indices) {
        public Segment {
            indices = List.copyOf(indices);
        }

        public boolean isIndexed() {
            return !indices.isEmpty();
        }

        @Override
        public String toString() {
            var sb = new StringBuilder(key);
            indices.forEach(i -> sb.append('[').append(i).append(']'));
            return sb.toString();
        }
    }

    // Empty if the text is not a well formed path
    public static Optional<ProtocolPath> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        var result = new ArrayList<Segment>();
        for (String part : text.trim().split("\\.", -1)) {
            var m = SEGMENT.matcher(part.trim());
            if (!m.matches()) {
                return Optional.empty();
            }
            var indices = new ArrayList<Integer>();
            var im = INDEX.matcher(m.group(2));
            while (im.find()) {
                try {
                    int index = Integer.parseInt(im.group(1));
                    if (index > MAX_INDEX) {
                        return Optional.empty();
                    }
                    indices.add(index);
                } catch (NumberFormatException e) {
                    // Index beyond int range can not address anything
                    return Optional.empty();
                }
            }
            result.add(new Segment(m.group(1), indices));
        }
        return Optional.of(new ProtocolPath(result));
    }

    public Segment last() {
        return segments.get(segments.size() - 1);
    }

    // Read-only lookup, never creates nodes
    public Optional<ProtocolNode> resolve(ProtocolNode root) {
        ProtocolNode current = root;
        for (var segment : segments) {
            if (!(current instanceof ProtocolNode.Block block)) {
                return Optional.empty();
            }
            var child = block.get(segment.key());
            if (child.isEmpty()) {
                return Optional.empty();
            }
            current = child.get();
            for (int index : segment.indices()) {
                if (!(current instanceof ProtocolNode.Sequence sequence)) {
                    return Optional.empty();
                }
                var item = sequence.get(index);
                if (item.isEmpty()) {
                    return Optional.empty();
                }
                current = item.get();
            }
        }
        return Optional.of(current);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (var s : segments) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(s);
        }
        return sb.toString();
    }
}
