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

import java.util.Objects;

/**
 * A typed decoder option with a default value.
 *
 * @param name         key used in properties files
 * @param type         value type, one of Boolean, Integer, String or an enum
 * @param defaultValue value used when the option is not set
 */
public record CSAOption<V>(String name, Class<V> type, V defaultValue) {
    public CSAOption {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(defaultValue, "Must have a sane default value!");
    }

    public static <T> CSAOption<T> of(String name, Class<T> type, T defaultValue) {
        return new CSAOption<>(name, type, defaultValue);
    }

    // Converts the textual form found in properties files
    V parse(String text) {
        var s = text.trim();
        Object result;
        if (type == Boolean.class) {
            if (!s.equalsIgnoreCase("true") && !s.equalsIgnoreCase("false")) {
                throw new IllegalArgumentException("Option '%s' must be true or false, not '%s'".formatted(name, s));
            }
            result = Boolean.valueOf(s);
        } else if (type == Integer.class) {
            try {
                result = Integer.valueOf(s);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Option '%s' must be an integer, not '%s'".formatted(name, s), e);
            }
        } else if (type == String.class) {
            result = s;
        } else if (type.isEnum()) {
            result = parseEnum(s);
        } else {
            throw new IllegalStateException("Unsupported option type " + type.getName());
        }
        return type.cast(result);
    }

    private Object parseEnum(String s) {
        for (V constant : type.getEnumConstants()) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(s)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Option '%s' has no value '%s'".formatted(name, s));
    }
}
