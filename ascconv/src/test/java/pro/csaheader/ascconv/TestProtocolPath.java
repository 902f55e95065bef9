package pro.csaheader.ascconv;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Optional;

public class TestProtocolPath {

    @Test
    public void testSegments() {
        var path = ProtocolPath.parse("sSliceArray.asSlice[0].sPosition").orElseThrow();
        Assert.assertEquals(path.segments().size(), 3);
        Assert.assertEquals(path.segments().get(0), new ProtocolPath.Segment("sSliceArray", List.of()));
        Assert.assertEquals(path.segments().get(1), new ProtocolPath.Segment("asSlice", List.of(0)));
        Assert.assertEquals(path.last().key(), "sPosition");
        Assert.assertFalse(path.last().isIndexed());
        Assert.assertEquals(path.toString(), "sSliceArray.asSlice[0].sPosition");
    }

    @Test
    public void testRepeatedIndices() {
        var path = ProtocolPath.parse("adFree[1][ 2 ]").orElseThrow();
        Assert.assertEquals(path.last().indices(), List.of(1, 2));
        Assert.assertEquals(path.toString(), "adFree[1][2]");
    }

    @Test
    public void testMalformed() {
        Assert.assertEquals(ProtocolPath.parse(""), Optional.empty());
        Assert.assertEquals(ProtocolPath.parse("a..b"), Optional.empty());
        Assert.assertEquals(ProtocolPath.parse("a.b["), Optional.empty());
        Assert.assertEquals(ProtocolPath.parse("1abc"), Optional.empty());
        Assert.assertEquals(ProtocolPath.parse("a[-1]"), Optional.empty());
        Assert.assertEquals(ProtocolPath.parse("a[99999999999]"), Optional.empty());
    }

    @Test
    public void testIndexLimit() {
        Assert.assertEquals(ProtocolPath.parse("a[65535]").orElseThrow().last().indices(), List.of(ProtocolPath.MAX_INDEX));
        Assert.assertEquals(ProtocolPath.parse("a[65536]"), Optional.empty());
        Assert.assertEquals(ProtocolPath.parse("a[0][2147483646]"), Optional.empty());
    }

    @Test
    public void testResolveDoesNotCreate() {
        var root = new ProtocolNode.Block();
        Assert.assertTrue(root.path("a.b[3]").isEmpty());
        Assert.assertTrue(root.isEmpty());

        root.put("a", ProtocolNode.of("leaf"));
        Assert.assertTrue(root.path("a.b").isEmpty());
        Assert.assertTrue(root.path("a[0]").isEmpty());
        Assert.assertEquals(root.path("a"), Optional.of(ProtocolNode.of("leaf")));
    }

    @Test
    public void testValueRejectsOtherTypes() {
        Assert.assertThrows(IllegalArgumentException.class, () -> new ProtocolNode.Value(1));
        Assert.assertThrows(NullPointerException.class, () -> new ProtocolNode.Value(null));
    }
}
