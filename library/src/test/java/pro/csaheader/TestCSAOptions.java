package pro.csaheader;

import org.testng.Assert;
import org.testng.annotations.Test;
import pro.csaheader.ValueConverter.NumericEncoding;

import java.util.Optional;
import java.util.Properties;

public class TestCSAOptions {

    @Test
    public void testDefaults() {
        var options = new CSAOptions();
        Assert.assertTrue(options.isEmpty());
        Assert.assertEquals(options.get(CSAOptions.NUMERIC_ENCODING), NumericEncoding.BINARY);
        Assert.assertTrue(options.get(CSAOptions.DECODE_PROTOCOL));
        Assert.assertEquals(options.get(CSAOptions.PROTOCOL_TAG), "MrPhoenixProtocol");
        Assert.assertEquals(options.valueOf(CSAOptions.PROTOCOL_TAG), Optional.empty());
    }

    @Test
    public void testWithIsImmutable() {
        var base = new CSAOptions();
        var text = base.with(CSAOptions.NUMERIC_ENCODING, NumericEncoding.TEXT);
        Assert.assertEquals(text.get(CSAOptions.NUMERIC_ENCODING), NumericEncoding.TEXT);
        Assert.assertEquals(base.get(CSAOptions.NUMERIC_ENCODING), NumericEncoding.BINARY);
        Assert.assertEquals(text.without(CSAOptions.NUMERIC_ENCODING), base);
        Assert.assertSame(base.without(CSAOptions.DECODE_PROTOCOL), base);
    }

    @Test
    public void testNullRejected() {
        Assert.assertThrows(IllegalArgumentException.class, () -> new CSAOptions().with(CSAOptions.PROTOCOL_TAG, null));
        Assert.assertThrows(NullPointerException.class, () -> CSAOption.of("x", String.class, null));
    }

    @Test
    public void testMergeOtherWins() {
        var a = new CSAOptions().with(CSAOptions.DECODE_PROTOCOL, false).with(CSAOptions.PROTOCOL_TAG, "A");
        var b = new CSAOptions().with(CSAOptions.PROTOCOL_TAG, "B");
        var merged = a.merge(b);
        Assert.assertFalse(merged.get(CSAOptions.DECODE_PROTOCOL));
        Assert.assertEquals(merged.get(CSAOptions.PROTOCOL_TAG), "B");
        Assert.assertEquals(merged.keys().size(), 2);
    }

    @Test
    public void testFromProperties() {
        var p = new Properties();
        p.setProperty("csa.numeric.encoding", "text");
        p.setProperty("csa.protocol.decode", " FALSE ");
        p.setProperty("csa.unknown", "1");
        p.setProperty("other", "x");
        var options = CSAOptions.fromProperties(p);
        Assert.assertEquals(options.get(CSAOptions.NUMERIC_ENCODING), NumericEncoding.TEXT);
        Assert.assertFalse(options.get(CSAOptions.DECODE_PROTOCOL));
        Assert.assertEquals(options.valueOf(CSAOptions.PROTOCOL_TAG), Optional.empty());
        Assert.assertEquals(options.toString(), "CSAOptions{csa.numeric.encoding=TEXT;csa.protocol.decode=false;}");
    }

    @Test
    public void testBadPropertyValues() {
        var p = new Properties();
        p.setProperty("csa.protocol.decode", "yes");
        Assert.assertThrows(IllegalArgumentException.class, () -> CSAOptions.fromProperties(p));
        p.setProperty("csa.protocol.decode", "true");
        p.setProperty("csa.numeric.encoding", "ascii");
        Assert.assertThrows(IllegalArgumentException.class, () -> CSAOptions.fromProperties(p));
    }

    @Test
    public void testIntegerOption() {
        var option = CSAOption.of("csa.test.limit", Integer.class, 10);
        Assert.assertEquals(option.parse(" 42"), Integer.valueOf(42));
        Assert.assertThrows(IllegalArgumentException.class, () -> option.parse("4x"));
    }
}
