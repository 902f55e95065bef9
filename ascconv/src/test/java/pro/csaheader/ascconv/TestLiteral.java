package pro.csaheader.ascconv;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.List;

public class TestLiteral {

    static Object value(String text) {
        return Literal.parse(text).toObject();
    }

    @Test
    public void testIntegers() {
        Assert.assertEquals(value("3"), 3L);
        Assert.assertEquals(value("  -42 "), -42L);
        Assert.assertEquals(value("+7"), 7L);
        Assert.assertEquals(value("51130001"), 51130001L);
    }

    @Test
    public void testHex() {
        Assert.assertEquals(value("0x4"), 4L);
        Assert.assertEquals(value("0x1"), 1L);
        Assert.assertEquals(value("0XfF"), 255L);
        Assert.assertEquals(value("-0x10"), -16L);
        Assert.assertEquals(value("0xFFFFFFFF"), 4294967295L);
    }

    @Test
    public void testDecimals() {
        Assert.assertEquals(value("1.5"), 1.5);
        Assert.assertEquals(value("-0.01623302609"), -0.01623302609);
        Assert.assertEquals(value(".5"), 0.5);
        Assert.assertEquals(value("1e3"), 1000.0);
        Assert.assertEquals(value("534.113952637"), 534.113952637);
    }

    @Test
    public void testHugeIntegerBecomesDouble() {
        Assert.assertEquals(value("123456789012345678901234567890"), Double.parseDouble("123456789012345678901234567890"));
    }

    @Test
    public void testStrings() {
        Assert.assertEquals(value("\"N4_VB17\""), "N4_VB17");
        Assert.assertEquals(value("\"\"N4_VB17\"\""), "N4_VB17");
        Assert.assertEquals(value("\"\""), "");
        Assert.assertEquals(value("\"with spaces inside\""), "with spaces inside");
    }

    @Test
    public void testLists() {
        Assert.assertEquals(value("[1, 2, 3]"), List.of(1L, 2L, 3L));
        Assert.assertEquals(value("{ 1.5 -2 0x3 }"), List.of(1.5, -2L, 3L));
        Assert.assertEquals(value("[]"), List.of());
        Assert.assertEquals(value("[\"a\", \"b\"]"), List.of("a", "b"));
        Assert.assertEquals(value("[\"\", 1]"), List.of("", 1L));
    }

    @Test
    public void testFallbackToRawText() {
        Assert.assertEquals(value("abc"), "abc");
        Assert.assertEquals(value("1 + 2"), "1 + 2");
        Assert.assertEquals(value("0x"), "0x");
        Assert.assertEquals(value("[1, 2"), "[1, 2");
        Assert.assertEquals(value("-"), "-");
        Assert.assertEquals(value("1.5d"), "1.5d");
    }
}
