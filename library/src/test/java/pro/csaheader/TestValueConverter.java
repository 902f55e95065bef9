package pro.csaheader;

import org.testng.Assert;
import org.testng.annotations.Test;
import pro.csaheader.ValueConverter.NumericEncoding;

import static pro.csaheader.CSAFixture.le;
import static pro.csaheader.CSAFixture.text;

public class TestValueConverter {

    @Test
    public void testStrings() {
        Assert.assertEquals(ValueConverter.convert(VR.LO, text("SIEMENS")), "SIEMENS");
        Assert.assertEquals(ValueConverter.convert(VR.CS, "ORIGINAL \0junk".getBytes()), "ORIGINAL");
        Assert.assertNull(ValueConverter.convert(VR.SH, text("  ")));
        Assert.assertEquals(ValueConverter.convert(VR.PN, new byte[]{(byte) 0xE9}), "é");
    }

    @Test
    public void testNumericStrings() {
        Assert.assertEquals(ValueConverter.convert(VR.IS, text(" 64 ")), 64L);
        Assert.assertEquals(ValueConverter.convert(VR.DS, text("-0.5")), -0.5);
        Assert.assertEquals(ValueConverter.convert(VR.DS, text("1e-3")), 0.001);
    }

    @Test
    public void testBadNumericTextIsNull() {
        Assert.assertNull(ValueConverter.convert(VR.IS, text("12a")));
        Assert.assertNull(ValueConverter.convert(VR.IS, text("1.5")));
        Assert.assertNull(ValueConverter.convert(VR.DS, text("abc")));
        Assert.assertNull(ValueConverter.convert(VR.DS, new byte[]{0, 0}));
    }

    @Test
    public void testBinaryIntegers() {
        Assert.assertEquals(ValueConverter.convert(VR.SS, le(2, -2)), -2L);
        Assert.assertEquals(ValueConverter.convert(VR.US, le(2, 0x8000)), 32768L);
        Assert.assertEquals(ValueConverter.convert(VR.SL, le(4, Integer.MIN_VALUE)), (long) Integer.MIN_VALUE);
        Assert.assertEquals(ValueConverter.convert(VR.UL, new byte[]{0, 0, 0, (byte) 0x80}), 2147483648L);
    }

    @Test
    public void testBinaryFloats() {
        Assert.assertEquals(ValueConverter.convert(VR.FL, le(0.25f)), 0.25);
        Assert.assertEquals(ValueConverter.convert(VR.FD, le(-1234.5)), -1234.5);
    }

    @Test
    public void testWidthMismatch() {
        var e = Assert.expectThrows(SizeMismatchException.class, () -> ValueConverter.convert(VR.US, new byte[3]));
        Assert.assertTrue(e.getMessage().startsWith("US payload must be 2 bytes, got 3"));
        Assert.assertEquals(e.offset, -1);
        Assert.assertThrows(SizeMismatchException.class, () -> ValueConverter.convert(VR.FD, le(1.0f)));
        Assert.assertThrows(SizeMismatchException.class, () -> ValueConverter.convert(VR.SL, new byte[0]));
    }

    @Test
    public void testTextEncoding() {
        Assert.assertEquals(ValueConverter.convert(VR.US, text("512"), NumericEncoding.TEXT), 512L);
        Assert.assertEquals(ValueConverter.convert(VR.SL, text("-7"), NumericEncoding.TEXT), -7L);
        Assert.assertEquals(ValueConverter.convert(VR.FD, text("2.5"), NumericEncoding.TEXT), 2.5);
        Assert.assertNull(ValueConverter.convert(VR.FL, text("x"), NumericEncoding.TEXT));
        // Not affected by the encoding
        Assert.assertEquals(ValueConverter.convert(VR.LO, text("a"), NumericEncoding.TEXT), "a");
    }

    @Test
    public void testOpaqueIsCopied() {
        var raw = new byte[]{1, 0, 2};
        var value = (byte[]) ValueConverter.convert(VR.UN, raw);
        Assert.assertEquals(value, raw);
        Assert.assertNotSame(value, raw);
    }
}
