// file: core/src/test/java/io/kvgate/core/KeyRangeTest.java
package io.kvgate.core;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static io.kvgate.core.Bytes.utf8;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Focus:
 *  - range end derivation for single / prefix / explicit ranges,
 *  - prefix membership: every key with the prefix falls in [start, end),
 *  - rejection of inputs that cannot produce a correct range.
 */
class KeyRangeTest {

    @Test
    void single_key_has_no_range_end() {
        KeyRange r = KeyRange.single(utf8("foo"));
        assertEquals(KeyRange.Mode.SINGLE, r.mode());
        assertNull(r.resolveEnd());
        assertTrue(r.contains(utf8("foo")));
        assertFalse(r.contains(utf8("foo/")));
    }

    @Test
    void prefix_end_is_last_byte_incremented() {
        KeyRange r = KeyRange.prefix(utf8("k/"));
        assertArrayEquals(utf8("k0"), r.resolveEnd());
        assertTrue(r.contains(utf8("k/a")));
        assertTrue(r.contains(utf8("k/")));
        assertFalse(r.contains(utf8("k0")));
        assertFalse(r.contains(utf8("j/zzz")));
    }

    @Test
    void every_key_with_prefix_lies_inside_derived_range() {
        Random rnd = new Random(42);
        for (int i = 0; i < 500; i++) {
            byte[] prefix = new byte[1 + rnd.nextInt(6)];
            rnd.nextBytes(prefix);
            if ((prefix[prefix.length - 1] & 0xFF) == 0xFF) {
                prefix[prefix.length - 1] = 0x7F;
            }
            byte[] suffix = new byte[rnd.nextInt(8)];
            rnd.nextBytes(suffix);
            byte[] key = Bytes.concat(prefix, suffix);

            KeyRange r = KeyRange.prefix(prefix);
            byte[] end = r.resolveEnd();
            assertArrayEquals(Bytes.incrementLastByte(prefix), end);
            assertTrue(Bytes.compare(key, prefix) >= 0, "key below prefix");
            assertTrue(Bytes.compare(key, end) < 0, "key not below end");
        }
    }

    @Test
    void prefix_rejects_empty_key_and_trailing_ff() {
        assertThrows(IllegalArgumentException.class, () -> KeyRange.prefix(new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> KeyRange.prefix(new byte[] {0x61, (byte) 0xFF}));
    }

    @Test
    void explicit_range_returns_its_end() {
        KeyRange r = KeyRange.range(utf8("a"), utf8("c"));
        assertArrayEquals(utf8("c"), r.resolveEnd());
        assertTrue(r.contains(utf8("b")));
        assertFalse(r.contains(utf8("c")));
    }

    @Test
    void of_rejects_range_end_together_with_prefix() {
        assertThrows(IllegalArgumentException.class,
                () -> KeyRange.of(utf8("a"), utf8("b"), true));
        assertEquals(KeyRange.Mode.PREFIX, KeyRange.of(utf8("a"), null, true).mode());
        assertEquals(KeyRange.Mode.RANGE, KeyRange.of(utf8("a"), utf8("b"), false).mode());
        assertEquals(KeyRange.Mode.SINGLE, KeyRange.of(utf8("a"), null, false).mode());
    }

    @Test
    void null_inputs_rejected() {
        assertThrows(NullPointerException.class, () -> KeyRange.single(null));
        assertThrows(NullPointerException.class, () -> KeyRange.range(utf8("a"), null));
    }

    @Test
    void all_keys_range_contains_everything() {
        KeyRange all = KeyRange.all();
        assertArrayEquals(new byte[] {0}, all.resolveEnd());
        assertTrue(all.contains(new byte[] {0}));
        assertTrue(all.contains(new byte[] {(byte) 0xFF, 0x01}));

        KeyRange from = KeyRange.from(utf8("m"));
        assertTrue(from.contains(utf8("zzz")));
        assertFalse(from.contains(utf8("a")));
    }

    @Test
    void ranges_are_immutable_against_caller_arrays() {
        byte[] key = utf8("abc");
        KeyRange r = KeyRange.single(key);
        key[0] = 'x';
        assertArrayEquals(utf8("abc"), r.start());
        assertEquals(KeyRange.single(utf8("abc")), r);
    }

    @Test
    void carry_increment_overflows_to_null() {
        assertArrayEquals(new byte[] {0x00, 0x02}, Bytes.increment(new byte[] {0x00, 0x01}));
        assertArrayEquals(new byte[] {0x01, 0x00}, Bytes.increment(new byte[] {0x00, (byte) 0xFF}));
        assertNull(Bytes.increment(new byte[] {(byte) 0xFF, (byte) 0xFF}));
    }
}
