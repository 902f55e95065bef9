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

import java.util.HashMap;
import java.util.Map;

/**
 * Value representations that can appear in a CSA tag.
 * <p>
 * The set is closed: any code not listed here, as well as the explicit {@code UN}, is treated as opaque
 * binary and handed out as raw bytes.
 */
public enum VR {
    AE(Kind.STRING),
    AS(Kind.STRING),
    CS(Kind.STRING),
    DA(Kind.STRING),
    DT(Kind.STRING),
    LO(Kind.STRING),
    LT(Kind.STRING),
    PN(Kind.STRING),
    SH(Kind.STRING),
    ST(Kind.STRING),
    TM(Kind.STRING),
    UI(Kind.STRING),
    UT(Kind.STRING),
    SS(Kind.SIGNED, 2),
    US(Kind.UNSIGNED, 2),
    SL(Kind.SIGNED, 4),
    UL(Kind.UNSIGNED, 4),
    FL(Kind.FLOAT, 4),
    FD(Kind.FLOAT, 8),
    IS(Kind.INTEGER_STRING),
    DS(Kind.DECIMAL_STRING),
    UN(Kind.OPAQUE);

    public enum Kind {
        STRING, SIGNED, UNSIGNED, FLOAT, INTEGER_STRING, DECIMAL_STRING, OPAQUE
    }

    private static final Map<String, VR> codes;

    static {
        var m = new HashMap<String, VR>();
        for (VR vr : values()) {
            m.put(vr.name(), vr);
        }
        codes = Map.copyOf(m);
    }

    private final Kind kind;
    private final int width;

    VR(Kind kind) {
        this(kind, 0);
    }

    VR(Kind kind, int width) {
        this.kind = kind;
        this.width = width;
    }

    public Kind kind() {
        return kind;
    }

    // Payload width in bytes for fixed width numeric VRs, 0 otherwise
    public int width() {
        return width;
    }

    public boolean isFixedWidth() {
        return width > 0;
    }

    public static VR of(String code) {
        if (code == null) {
            return UN;
        }
        return codes.getOrDefault(code.trim(), UN);
    }
}
