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

import java.util.*;

// A node of a decoded protocol tree: a scalar, an array or a block of named children
public sealed interface ProtocolNode permits ProtocolNode.Value, ProtocolNode.Sequence, ProtocolNode.Block {

    // Plain Java rendering: String/Long/Double, List and LinkedHashMap
    Object toObject();

    // Empty blocks fill the gaps of sparse arrays
    default boolean isPlaceholder() {
        return false;
    }

    default Optional<ProtocolNode> path(String path) {
        return ProtocolPath.parse(path).flatMap(p -> p.resolve(this));
    }

    static Value of(String value) {
        return new Value(value);
    }

    static Value of(long value) {
        return new Value(value);
    }

    static Value of(double value) {
        return new Value(value);
    }

    record Value(Object value) implements ProtocolNode {
        public Value {
            Objects.requireNonNull(value, "value");
            if (!(value instanceof String || value instanceof Long || value instanceof Double)) {
                throw new IllegalArgumentException("Unsupported leaf type: " + value.getClass().getName());
            }
        }

        @Override
        public Object toObject() {
            return value;
        }

        @Override
        public String toString() {
            return value instanceof String s ? '"' + s + '"' : value.toString();
        }
    }

    final class Sequence implements ProtocolNode {
        private final List<ProtocolNode> items = new ArrayList<>();

        public Sequence() {
        }

        public Sequence(Collection<? extends ProtocolNode> items) {
            items.forEach(i -> this.items.add(Objects.requireNonNull(i, "item")));
        }

        public List<ProtocolNode> items() {
            return Collections.unmodifiableList(items);
        }

        public Optional<ProtocolNode> get(int index) {
            if (index < 0 || index >= items.size()) {
                return Optional.empty();
            }
            return Optional.of(items.get(index));
        }

        public int size() {
            return items.size();
        }

        // Grows the array with placeholders so that index is addressable
        ProtocolNode slot(int index) {
            while (items.size() <= index) {
                items.add(new Block());
            }
            return items.get(index);
        }

        void set(int index, ProtocolNode node) {
            slot(index);
            items.set(index, Objects.requireNonNull(node, "node"));
        }

        @Override
        public Object toObject() {
            var result = new ArrayList<>(items.size());
            for (var item : items) {
                result.add(item.toObject());
            }
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Sequence other && items.equals(other.items);
        }

        @Override
        public int hashCode() {
            return items.hashCode();
        }

        @Override
        public String toString() {
            return items.toString();
        }
    }

    final class Block implements ProtocolNode {
        private final Map<String, ProtocolNode> entries = new LinkedHashMap<>();

        public Optional<ProtocolNode> get(String key) {
            return Optional.ofNullable(entries.get(key));
        }

        public Map<String, ProtocolNode> entries() {
            return Collections.unmodifiableMap(entries);
        }

        public Set<String> keys() {
            return Collections.unmodifiableSet(entries.keySet());
        }

        public int size() {
            return entries.size();
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        void put(String key, ProtocolNode node) {
            entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(node, "node"));
        }

        @Override
        public boolean isPlaceholder() {
            return entries.isEmpty();
        }

        @Override
        public Object toObject() {
            var result = new LinkedHashMap<String, Object>();
            for (var e : entries.entrySet()) {
                result.put(e.getKey(), e.getValue().toObject());
            }
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Block other && entries.equals(other.entries);
        }

        @Override
        public int hashCode() {
            return entries.hashCode();
        }

        @Override
        public String toString() {
            return entries.toString();
        }
    }
}
