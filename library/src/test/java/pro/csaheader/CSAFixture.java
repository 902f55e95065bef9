package pro.csaheader;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

// Builds synthetic CSA tag streams
final class CSAFixture {
    record Tag(String name, int vm, String vr, int checkBit, List<byte[]> items) {
    }

    private final CSAType type;
    private final List<Tag> tags = new ArrayList<>();
    private Integer count;

    private CSAFixture(CSAType type) {
        this.type = type;
    }

    static CSAFixture type1() {
        return new CSAFixture(CSAType.TYPE_1);
    }

    static CSAFixture type2() {
        return new CSAFixture(CSAType.TYPE_2);
    }

    CSAFixture tag(String name, int vm, String vr, byte[]... items) {
        return tag(name, vm, vr, 77, items);
    }

    CSAFixture tag(String name, int vm, String vr, int checkBit, byte[]... items) {
        tags.add(new Tag(name, vm, vr, checkBit, Arrays.asList(items)));
        return this;
    }

    // Overrides the declared tag count
    CSAFixture count(int count) {
        this.count = count;
        return this;
    }

    // Offset of the first tag record
    int start() {
        return type == CSAType.TYPE_2 ? 16 : 8;
    }

    byte[] build() {
        var out = new ByteArrayOutputStream();
        if (type == CSAType.TYPE_2) {
            out.writeBytes("SV10".getBytes(StandardCharsets.US_ASCII));
            out.writeBytes(new byte[]{4, 3, 2, 1});
        }
        int32(out, count == null ? tags.size() : count);
        int32(out, 77);
        int bias = tags.isEmpty() ? 0 : tags.get(0).items().size();
        for (var tag : tags) {
            out.writeBytes(Arrays.copyOf(tag.name().getBytes(StandardCharsets.ISO_8859_1), 64));
            int32(out, tag.vm());
            out.writeBytes(Arrays.copyOf(tag.vr().getBytes(StandardCharsets.ISO_8859_1), 4));
            int32(out, 6);
            int32(out, tag.items().size());
            int32(out, tag.checkBit());
            for (var item : tag.items()) {
                int len = item.length;
                int32(out, type == CSAType.TYPE_2 ? len : len + bias);
                int32(out, len);
                int32(out, 77);
                int32(out, len);
                out.writeBytes(item);
                out.writeBytes(new byte[(4 - len % 4) % 4]);
            }
        }
        return out.toByteArray();
    }

    // NUL terminated text, the way scanners write items
    static byte[] text(String value) {
        return (value + "\0").getBytes(StandardCharsets.ISO_8859_1);
    }

    static byte[] le(int size, long value) {
        var buf = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(value);
        return Arrays.copyOf(buf.array(), size);
    }

    static byte[] le(double value) {
        return ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putDouble(value).array();
    }

    static byte[] le(float value) {
        return ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putFloat(value).array();
    }

    static void int32(ByteArrayOutputStream out, int v) {
        out.write(v);
        out.write(v >> 8);
        out.write(v >> 16);
        out.write(v >> 24);
    }

    static void put32(byte[] buffer, int offset, int v) {
        ByteBuffer.wrap(buffer).order(ByteOrder.LITTLE_ENDIAN).putInt(offset, v);
    }
}
