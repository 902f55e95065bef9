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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Recursive descent parser for the right hand side of an ASCCONV assignment.
 * <p>
 * Grammar:
 * <pre>
 * literal := string | list | number
 * string  := '"' chars '"' | '""' chars '""'
 * list    := '[' scalar (','? scalar)* ']' | '{' scalar (','? scalar)* '}'
 * scalar  := string | number
 * number  := ('+' | '-')? ( '0x' hexdigits | decimal )
 * </pre>
 * Anything the grammar does not accept is kept as the raw trimmed text. Nothing is evaluated.
 */
public final class Literal {
    private static final Logger logger = LoggerFactory.getLogger(Literal.class);

    private final String text;
    private int pos;

    private Literal(String text) {
        this.text = text;
    }

    public static ProtocolNode parse(String text) {
        var trimmed = text.trim();
        var quoted = unquote(trimmed);
        if (quoted != null) {
            return ProtocolNode.of(quoted);
        }
        try {
            var parser = new Literal(trimmed);
            var result = parser.literal();
            parser.whitespace();
            if (parser.pos != trimmed.length()) {
                throw parser.error("trailing characters");
            }
            return result;
        } catch (SyntaxException e) {
            logger.trace("Keeping raw text for {}: {}", trimmed, e.getMessage());
            return ProtocolNode.of(trimmed);
        }
    }

    // Doubled quotes are the form used inside XProtocol strings
    static String unquote(String s) {
        if (s.length() >= 4 && s.startsWith("\"\"") && s.endsWith("\"\"")) {
            return s.substring(2, s.length() - 2);
        }
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            return s.substring(1, s.length() - 1);
        }
        return null;
    }

    private ProtocolNode literal() {
        whitespace();
        if (pos >= text.length()) {
            throw error("empty literal");
        }
        char c = text.charAt(pos);
        if (c == '[') {
            return list(']');
        } else if (c == '{') {
            return list('}');
        }
        return scalar();
    }

    private ProtocolNode.Sequence list(char close) {
        pos++;
        var items = new ArrayList<ProtocolNode>();
        while (true) {
            whitespace();
            if (pos >= text.length()) {
                throw error("unterminated list");
            }
            if (text.charAt(pos) == close) {
                pos++;
                return new ProtocolNode.Sequence(items);
            }
            if (!items.isEmpty() && text.charAt(pos) == ',') {
                pos++;
                whitespace();
            }
            items.add(scalar());
        }
    }

    private ProtocolNode scalar() {
        whitespace();
        if (pos < text.length() && text.charAt(pos) == '"') {
            return string();
        }
        return number();
    }

    private ProtocolNode string() {
        int start = pos;
        boolean doubled = text.startsWith("\"\"", pos);
        if (doubled && endsItem(start + 2)) {
            // Plain empty string, not an opening doubled quote
            pos = start + 2;
            return ProtocolNode.of("");
        }
        var delimiter = doubled ? "\"\"" : "\"";
        int end = text.indexOf(delimiter, start + delimiter.length());
        if (end < 0) {
            throw error("unterminated string");
        }
        pos = end + delimiter.length();
        return ProtocolNode.of(text.substring(start + delimiter.length(), end));
    }

    private ProtocolNode number() {
        int start = pos;
        boolean negative = false;
        if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
            negative = text.charAt(pos) == '-';
            pos++;
        }
        if (text.startsWith("0x", pos) || text.startsWith("0X", pos)) {
            pos += 2;
            int digits = pos;
            while (pos < text.length() && Character.digit(text.charAt(pos), 16) >= 0) {
                pos++;
            }
            if (pos == digits) {
                throw error("hex literal without digits");
            }
            try {
                long v = Long.parseUnsignedLong(text.substring(digits, pos), 16);
                return ProtocolNode.of(negative ? -v : v);
            } catch (NumberFormatException e) {
                throw error("hex literal out of range");
            }
        }
        int mantissa = pos;
        boolean fraction = false;
        boolean exponent = false;
        digits();
        if (pos < text.length() && text.charAt(pos) == '.') {
            fraction = true;
            pos++;
            digits();
        }
        // A lone sign or dot is not a number
        if (pos == mantissa || (fraction && pos == mantissa + 1)) {
            throw error("number expected");
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            exponent = true;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            int exp = pos;
            digits();
            if (pos == exp) {
                throw error("exponent without digits");
            }
        }
        var token = text.substring(start, pos);
        if (!fraction && !exponent) {
            try {
                return ProtocolNode.of(Long.parseLong(token));
            } catch (NumberFormatException e) {
                logger.trace("Integer {} does not fit a long, using double", token);
            }
        }
        return ProtocolNode.of(Double.parseDouble(token));
    }

    private boolean endsItem(int at) {
        if (at >= text.length()) {
            return true;
        }
        char c = text.charAt(at);
        return Character.isWhitespace(c) || c == ',' || c == ']' || c == '}';
    }

    private void digits() {
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
    }

    private void whitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private SyntaxException error(String message) {
        return new SyntaxException(message + " at " + pos);
    }

    @SuppressWarnings("serial")
    private static final class SyntaxException extends RuntimeException {
        SyntaxException(String message) {
            super(message, null, false, false);
        }
    }
}
