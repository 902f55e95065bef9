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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Stateless decoder of ASCCONV text, plain or embedded in XProtocol
public final class AscconvParser {
    private static final Logger logger = LoggerFactory.getLogger(AscconvParser.class);

    static final Pattern BEGIN = Pattern.compile("###\\s*ASCCONV\\s+BEGIN(.*?)###");
    static final Pattern END = Pattern.compile("###\\s*ASCCONV\\s+END\\s*###");
    static final Pattern ASSIGNMENT = Pattern.compile("^\\s*([A-Za-z_][\\w.\\[\\]\\s]*?)\\s*=\\s*(.+?)\\s*$");

    private AscconvParser() {}

    public static Ascconv parse(byte[] text) {
        return parse(new String(text, StandardCharsets.ISO_8859_1));
    }

    public static Ascconv parse(String text) {
        Objects.requireNonNull(text, "text");
        var root = new ProtocolNode.Block();
        var info = new LinkedHashMap<String, String>();
        int assigned = 0;
        int skipped = 0;
        for (var region : regions(text, info)) {
            for (String line : region.split("\\R")) {
                if (assign(root, line)) {
                    assigned++;
                } else if (!line.isBlank()) {
                    skipped++;
                }
            }
        }
        logger.debug("ASCCONV: {} assignments, {} lines skipped", assigned, skipped);
        return new Ascconv(root, info, assigned);
    }

    // Text between BEGIN and END markers, or the whole text without markers
    static List<String> regions(String text, Map<String, String> info) {
        var result = new ArrayList<String>();
        Matcher begin = BEGIN.matcher(text);
        int from = 0;
        while (begin.find(from)) {
            if (info.isEmpty()) {
                info.putAll(firstLineInfo(begin.group(1)));
            }
            Matcher end = END.matcher(text);
            if (end.find(begin.end())) {
                result.add(text.substring(begin.end(), end.start()));
                from = end.end();
            } else {
                logger.debug("ASCCONV END marker missing, reading to end of text");
                result.add(text.substring(begin.end()));
                from = text.length();
            }
        }
        if (result.isEmpty()) {
            result.add(text);
        }
        return result;
    }

    static Map<String, String> firstLineInfo(String words) {
        var result = new LinkedHashMap<String, String>();
        for (String word : words.trim().split("\\s+")) {
            int eq = word.indexOf('=');
            if (eq > 0) {
                result.put(word.substring(0, eq), word.substring(eq + 1));
            }
        }
        return result;
    }

    // Applies one line to the tree. Returns false when the line carries no assignment.
    static boolean assign(ProtocolNode.Block root, String line) {
        var content = stripComment(line);
        if (content.isBlank()) {
            return false;
        }
        var m = ASSIGNMENT.matcher(content);
        if (!m.matches()) {
            return false;
        }
        var path = ProtocolPath.parse(m.group(1));
        if (path.isEmpty()) {
            logger.warn("Skipping {}: not a valid path", m.group(1));
            return false;
        }
        var value = Literal.parse(m.group(2));
        if (!TreeBuilder.put(root, path.get(), value)) {
            logger.warn("Skipping {}: conflicts with an earlier assignment", path.get());
            return false;
        }
        return true;
    }

    // # starts a comment unless inside a quoted string, "" counts as one quote
    static String stripComment(String line) {
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    i++;
                }
                quoted = !quoted;
            } else if (c == '#' && !quoted) {
                return line.substring(0, i);
            }
        }
        return line;
    }
}
