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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One decoded CSA tag.
 *
 * @param name          tag name, unique within a header
 * @param vrCode        VR code as found in the stream
 * @param vr            value representation, {@link VR#UN} for codes outside the known set
 * @param vm            declared value multiplicity
 * @param syngoDataType numeric data type code, carries the same information as the VR
 * @param values        decoded values in stream order, may contain nulls
 */
public record CSATag(String name, String vrCode, VR vr, int vm, int syngoDataType, List<Object> values) {

    public CSATag {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(vrCode, "vrCode");
        Objects.requireNonNull(vr, "vr");
        // List.copyOf() does not allow nulls
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    // Null when there are no values, the value itself when there is one, all values otherwise
    public Object value() {
        return switch (values.size()) {
            case 0 -> null;
            case 1 -> values.get(0);
            default -> values;
        };
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    // Opaque values are byte arrays, compared by content
    @Override
    public boolean equals(Object obj) {
        return obj instanceof CSATag other
                && name.equals(other.name)
                && vrCode.equals(other.vrCode)
                && vr == other.vr
                && vm == other.vm
                && syngoDataType == other.syngoDataType
                && Arrays.deepEquals(values.toArray(), other.values.toArray());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(name, vrCode, vr, vm, syngoDataType) + Arrays.deepHashCode(values.toArray());
    }

    public CSATag withValues(List<Object> replacement) {
        return new CSATag(name, vrCode, vr, vm, syngoDataType, replacement);
    }
}
