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

import java.util.*;

/**
 * Immutable set of decoder options. Unset options fall back to their defaults.
 * <pre>
 * var options = new CSAOptions().with(CSAOptions.NUMERIC_ENCODING, NumericEncoding.TEXT);
 * </pre>
 */
public final class CSAOptions {
    private static final Logger logger = LoggerFactory.getLogger(CSAOptions.class);

    public static final CSAOption<NumericEncoding> NUMERIC_ENCODING = CSAOption.of("csa.numeric.encoding", NumericEncoding.class, NumericEncoding.BINARY);
    public static final CSAOption<Boolean> DECODE_PROTOCOL = CSAOption.of("csa.protocol.decode", Boolean.class, true);
    public static final CSAOption<String> PROTOCOL_TAG = CSAOption.of("csa.protocol.tag", String.class, "MrPhoenixProtocol");

    public static final List<CSAOption<?>> KNOWN = List.of(NUMERIC_ENCODING, DECODE_PROTOCOL, PROTOCOL_TAG);

    private final Map<CSAOption<?>, Object> values;

    public CSAOptions() {
        this.values = Map.of();
    }

    private CSAOptions(Map<CSAOption<?>, Object> values) {
        // .copyOf() assures that there are no null values
        this.values = Map.copyOf(values);
    }

    public <V> CSAOptions with(CSAOption<V> key, V value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot set null value for option '" + key.name() + "'");
        }
        var newValues = new HashMap<>(values);
        newValues.put(key, key.type().cast(value));
        return new CSAOptions(newValues);
    }

    public <V> CSAOptions without(CSAOption<V> key) {
        if (!values.containsKey(key)) {
            return this;
        }
        var newValues = new HashMap<>(values);
        newValues.remove(key);
        return new CSAOptions(newValues);
    }

    // Always returns non-null: either the explicit override or the default value
    public <V> V get(CSAOption<V> key) {
        var value = values.get(key);
        return value != null ? key.type().cast(value) : key.defaultValue();
    }

    // Returns empty Optional when using default, present Optional when explicitly set
    public <V> Optional<V> valueOf(CSAOption<V> key) {
        return Optional.ofNullable(values.get(key)).map(key.type()::cast);
    }

    // Values set in other win
    public CSAOptions merge(CSAOptions other) {
        var newValues = new HashMap<>(this.values);
        newValues.putAll(other.values);
        return new CSAOptions(newValues);
    }

    // Picks up known options by name, other keys are ignored
    public static CSAOptions fromProperties(Properties properties) {
        var result = new HashMap<CSAOption<?>, Object>();
        for (var option : KNOWN) {
            var text = properties.getProperty(option.name());
            if (text != null) {
                result.put(option, option.parse(text));
            }
        }
        for (var key : properties.stringPropertyNames()) {
            if (key.startsWith("csa.") && KNOWN.stream().noneMatch(o -> o.name().equals(key))) {
                logger.warn("Unknown option {} ignored", key);
            }
        }
        return new CSAOptions(result);
    }

    public Set<CSAOption<?>> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof CSAOptions other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("CSAOptions{");
        for (var option : KNOWN) {
            if (values.containsKey(option)) {
                sb.append(option.name()).append('=').append(values.get(option)).append(';');
            }
        }
        return sb.append('}').toString();
    }
}
