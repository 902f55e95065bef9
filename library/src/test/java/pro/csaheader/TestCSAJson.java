package pro.csaheader;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.testng.Assert;
import org.testng.annotations.Test;

import static pro.csaheader.CSAFixture.text;

public class TestCSAJson {

    static ParsedHeader header() {
        return CSAHeader.parse(CSAFixture.type2()
                .tag("EchoLinePosition", 1, "IS", text("64"))
                .tag("SliceNormalVector", 3, "DS", text("0"), text("0.5"), text("1"))
                .tag("UsedChannelMask", 0, "UL")
                .tag("Blob", 1, "UN", new byte[]{(byte) 0xCA, (byte) 0xFE})
                .tag("MrPhoenixProtocol", 1, "UN", text("sSliceArray.asSlice[1].dThickness = 3\nsSliceArray.lSize = 2"))
                .build());
    }

    @Test
    public void testTree() {
        var tree = CSAJson.toTree(header());
        Assert.assertEquals(tree.size(), 5);
        Assert.assertEquals(tree.fieldNames().next(), "EchoLinePosition");

        var echo = tree.get("EchoLinePosition");
        Assert.assertEquals(echo.get("VR").asText(), "IS");
        Assert.assertEquals(echo.get("VM").asInt(), 1);
        Assert.assertEquals(echo.get("value").asLong(), 64L);

        var vector = tree.get("SliceNormalVector").get("value");
        Assert.assertTrue(vector.isArray());
        Assert.assertEquals(vector.get(1).asDouble(), 0.5);

        Assert.assertTrue(tree.get("UsedChannelMask").get("value").isNull());
        Assert.assertEquals(tree.get("Blob").get("value").asText(), "CAFE");

        var protocol = tree.get("MrPhoenixProtocol").get("value");
        Assert.assertEquals(protocol.get("sSliceArray").get("lSize").asLong(), 2L);
        var slices = protocol.get("sSliceArray").get("asSlice");
        Assert.assertEquals(slices.size(), 2);
        Assert.assertEquals(slices.get(0).size(), 0);
        Assert.assertEquals(slices.get(1).get("dThickness").asLong(), 3L);
    }

    @Test
    public void testJsonText() throws Exception {
        var json = CSAJson.toJson(header());
        Assert.assertTrue(json.startsWith("{\"EchoLinePosition\":{\"VR\":\"IS\",\"VM\":1,\"value\":64}"));
        var parsed = new ObjectMapper().readTree(json);
        Assert.assertEquals(parsed.get("SliceNormalVector").get("value").get(2).asDouble(), 1.0);
        Assert.assertEquals(parsed.get("Blob").get("value").asText(), "CAFE");
        Assert.assertTrue(CSAJson.toPrettyJson(header()).contains("\n"));
    }

    @Test
    public void testUnsupportedValue() {
        Assert.assertThrows(IllegalArgumentException.class, () -> CSAJson.node(new Object()));
    }
}
