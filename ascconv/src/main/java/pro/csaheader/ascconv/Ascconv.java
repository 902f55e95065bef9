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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Decoded ASCCONV protocol.
 *
 * @param root          assignments as a tree
 * @param firstLineInfo {@code key=value} words of the {@code ### ASCCONV BEGIN ... ###} marker, empty without one
 * @param assignments   number of lines that were assigned into the tree
 */
public record Ascconv(ProtocolNode.Block root, Map<String, String> firstLineInfo, int assignments) {

    public Ascconv {
        Objects.requireNonNull(root, "root");
        firstLineInfo = Collections.unmodifiableMap(new LinkedHashMap<>(firstLineInfo));
    }

    public Optional<ProtocolNode> get(String path) {
        return root.path(path);
    }

    // Number of slices (tiles) in a mosaic
    public OptionalLong sliceCount() {
        var node = get("sSliceArray.lSize");
        if (node.isPresent() && node.get() instanceof ProtocolNode.Value v && v.value() instanceof Long n) {
            return OptionalLong.of(n);
        }
        return OptionalLong.empty();
    }
}
