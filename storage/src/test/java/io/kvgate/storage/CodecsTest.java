// file: storage/src/test/java/io/kvgate/storage/CodecsTest.java
package io.kvgate.storage;

import io.kvgate.core.Bytes;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CodecsTest {

    record Point(int x, int y, List<String> labels) {
    }

    @Test
    void oid_keys_sort_numerically() {
        KeyCodec<Long> oid = KeyCodecs.oid();
        assertTrue(Bytes.compare(oid.encode(255L), oid.encode(256L)) < 0);
        assertTrue(Bytes.compare(oid.encode(1L), oid.encode(1L << 40)) < 0);
        assertEquals(8, oid.encode(7L).length);
        assertEquals(1L << 40, oid.decode(oid.encode(1L << 40)));
    }

    @Test
    void uuid_string_keys_group_by_uuid() {
        KeyCodec<KeyCodecs.UuidString> codec = KeyCodecs.uuidString();
        UUID a = UUID.fromString("00000000-0000-0000-0000-00000000000a");
        UUID b = UUID.fromString("00000000-0000-0000-0000-00000000000b");

        byte[] aZ = codec.encode(new KeyCodecs.UuidString(a, "zzz"));
        byte[] bA = codec.encode(new KeyCodecs.UuidString(b, "aaa"));
        assertTrue(Bytes.compare(aZ, bA) < 0);
        assertEquals(19, aZ.length);

        KeyCodecs.UuidString back = codec.decode(aZ);
        assertEquals(a, back.uuid());
        assertEquals("zzz", back.string());
        assertEquals("", codec.decode(KeyCodecs.uuidBytes(a)).string());
    }

    @Test
    void fixed_width_decoders_reject_wrong_lengths() {
        assertThrows(IllegalStateException.class, () -> KeyCodecs.uuid().decode(new byte[15]));
        assertThrows(IllegalStateException.class, () -> KeyCodecs.oid().decode(new byte[9]));
        assertThrows(IllegalStateException.class, () -> KeyCodecs.uuidUuid().decode(new byte[16]));
        assertThrows(IllegalStateException.class, () -> KeyCodecs.uuidString().decode(new byte[3]));
    }

    @Test
    void bytes_codec_copies() {
        byte[] raw = {1, 2, 3};
        byte[] encoded = KeyCodecs.bytes().encode(raw);
        raw[0] = 9;
        assertArrayEquals(new byte[] {1, 2, 3}, encoded);
    }

    @Test
    void json_values_keep_structure() {
        ValueCodec<Point> codec = ValueCodecs.json(Point.class);
        byte[] json = codec.encode(new Point(3, -4, List.of("origin", "grid")));
        assertTrue(Bytes.display(json).contains("\"labels\":[\"origin\",\"grid\"]"), Bytes.display(json));

        Point p = codec.decode(json);
        assertEquals(-4, p.y());
        assertEquals(List.of("origin", "grid"), p.labels());
        assertThrows(IllegalStateException.class, () -> codec.decode(Bytes.utf8("{not json")));
    }

    @Test
    void zlib_detects_corrupt_and_truncated_input() {
        byte[] plain = Bytes.utf8("hello hello hello hello hello");
        byte[] packed = Compression.ZLIB.compress(plain);
        assertEquals(0x78, packed[0] & 0xFF, "zlib header");
        assertArrayEquals(plain, Compression.ZLIB.uncompress(packed));

        assertThrows(IllegalStateException.class, () -> Compression.ZLIB.uncompress(new byte[] {1, 2, 3}));
        byte[] cut = Arrays.copyOf(packed, packed.length / 2);
        assertThrows(IllegalStateException.class, () -> Compression.ZLIB.uncompress(cut));
    }

    @Test
    void empty_values_survive_every_compression() {
        for (Compression c : Compression.values()) {
            assertEquals(0, c.uncompress(c.compress(new byte[0])).length, c.name());
        }
    }

    @Test
    void cbor_values_bind_like_json() {
        ValueCodec<Point> codec = ValueCodecs.cbor(Point.class);
        byte[] packed = codec.encode(new Point(3, -4, List.of("origin")));
        assertEquals(0xA0, packed[0] & 0xE0, "CBOR map");

        Point p = codec.decode(packed);
        assertEquals(new Point(3, -4, List.of("origin")), p);
        assertThrows(IllegalStateException.class, () -> codec.decode(new byte[] {(byte) 0xFF}));
    }

    @Test
    void uuid_set_is_stored_in_byte_order() {
        UUID low = UUID.fromString("00000000-0000-0000-0000-000000000001");
        UUID high = UUID.fromString("ffffffff-0000-0000-0000-000000000000");
        ValueCodec<Set<UUID>> codec = ValueCodecs.uuidSet();

        byte[] a = codec.encode(new LinkedHashSet<>(List.of(high, low)));
        byte[] b = codec.encode(new LinkedHashSet<>(List.of(low, high)));
        assertArrayEquals(a, b);
        assertEquals(32, a.length);
        assertEquals(List.of(low, high), List.copyOf(codec.decode(a)));

        assertTrue(codec.decode(new byte[0]).isEmpty());
        assertThrows(IllegalStateException.class, () -> codec.decode(new byte[17]));
    }
}
