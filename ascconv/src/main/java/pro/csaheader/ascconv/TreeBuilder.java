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

// Walks a path from the root block, creating blocks and growing arrays as needed
final class TreeBuilder {
    private TreeBuilder() {}

    // False if the path runs into a node of the wrong kind, the tree is then left as is apart from placeholders
    static boolean put(ProtocolNode.Block root, ProtocolPath path, ProtocolNode value) {
        var segments = path.segments();
        var block = root;
        for (int s = 0; s < segments.size(); s++) {
            var segment = segments.get(s);
            boolean lastSegment = s == segments.size() - 1;
            var existing = block.get(segment.key()).orElse(null);

            if (!segment.isIndexed()) {
                if (lastSegment) {
                    final var target = block;
                    return replace(existing, () -> target.put(segment.key(), value));
                }
                if (existing == null) {
                    var child = new ProtocolNode.Block();
                    block.put(segment.key(), child);
                    block = child;
                } else if (existing instanceof ProtocolNode.Block b) {
                    block = b;
                } else {
                    return false;
                }
                continue;
            }

            var sequence = sequenceAt(existing);
            if (sequence == null) {
                return false;
            }
            if (sequence != existing) {
                block.put(segment.key(), sequence);
            }
            var indices = segment.indices();
            for (int i = 0; i < indices.size(); i++) {
                int index = indices.get(i);
                var slot = sequence.slot(index);
                boolean lastIndex = i == indices.size() - 1;
                if (lastIndex && lastSegment) {
                    final var target = sequence;
                    return replace(slot, () -> target.set(index, value));
                }
                if (lastIndex) {
                    if (!(slot instanceof ProtocolNode.Block b)) {
                        return false;
                    }
                    block = b;
                } else {
                    var inner = sequenceAt(slot);
                    if (inner == null) {
                        return false;
                    }
                    if (inner != slot) {
                        sequence.set(index, inner);
                    }
                    sequence = inner;
                }
            }
        }
        // Unreachable, the last segment always returns
        return false;
    }

    // Existing sequence, or a new one in place of nothing or a placeholder
    private static ProtocolNode.Sequence sequenceAt(ProtocolNode node) {
        if (node == null || node.isPlaceholder()) {
            return new ProtocolNode.Sequence();
        }
        return node instanceof ProtocolNode.Sequence s ? s : null;
    }

    // Leaves and placeholders may be overwritten, populated containers not
    private static boolean replace(ProtocolNode existing, Runnable assignment) {
        if (existing == null || existing instanceof ProtocolNode.Value || existing.isPlaceholder()) {
            assignment.run();
            return true;
        }
        return false;
    }
}
