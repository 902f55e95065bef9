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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import pro.csaheader.ascconv.ProtocolNode;

import java.util.HexFormat;
import java.util.List;
import java.util.Map;

// JSON rendering of decoded headers: {"name": {"VR": .., "VM": .., "value": ..}, ...} in stream order
public final class CSAJson {
    private static final ObjectMapper json = new ObjectMapper();
    private static final ObjectMapper pretty = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private CSAJson() {}

    public static ObjectNode toTree(ParsedHeader header) {
        var result = nodes.objectNode();
        for (var tag : header) {
            var entry = result.putObject(tag.name());
            entry.put("VR", tag.vrCode());
            entry.put("VM", tag.vm());
            entry.set("value", node(tag.value()));
        }
        return result;
    }

    public static String toJson(ParsedHeader header) {
        return write(json, toTree(header));
    }

    public static String toPrettyJson(ParsedHeader header) {
        return write(pretty, toTree(header));
    }

    private static String write(ObjectMapper mapper, JsonNode tree) {
        try {
            return mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            // A tree of plain nodes always serializes
            throw new IllegalStateException("Could not serialize header", e);
        }
    }

    // Opaque values are rendered as uppercase hex
    static JsonNode node(Object value) {
        if (value == null) {
            return nodes.nullNode();
        } else if (value instanceof String s) {
            return nodes.textNode(s);
        } else if (value instanceof Long l) {
            return nodes.numberNode(l);
        } else if (value instanceof Double d) {
            return nodes.numberNode(d);
        } else if (value instanceof Boolean b) {
            return nodes.booleanNode(b);
        } else if (value instanceof byte[] bytes) {
            return nodes.textNode(HexFormat.of().withUpperCase().formatHex(bytes));
        } else if (value instanceof ProtocolNode protocol) {
            return node(protocol.toObject());
        } else if (value instanceof List<?> list) {
            ArrayNode array = nodes.arrayNode();
            list.forEach(item -> array.add(node(item)));
            return array;
        } else if (value instanceof Map<?, ?> map) {
            ObjectNode object = nodes.objectNode();
            map.forEach((k, v) -> object.set(String.valueOf(k), node(v)));
            return object;
        }
        throw new IllegalArgumentException("Can't render " + value.getClass().getName());
    }
}
