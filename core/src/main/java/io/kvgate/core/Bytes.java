// file: core/src/main/java/io/kvgate/core/Bytes.java
package io.kvgate.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Byte-string helpers shared by key ranges, codecs and the test emulator.
 *
 * Keys in the store are ordered as unsigned byte strings, so every comparison
 * here treats bytes as 0..255.
 */
public final class Bytes {

    private static final HexFormat HEX = HexFormat.of();

    private Bytes() {
        // utility
    }

    /**
     * Increment the last byte of {@code key} by one.
     * <p>
     * This is the range end the store expects for a prefix scan. It is only
     * correct when the key is non-empty and its last byte is not 0xFF; both
     * cases are rejected rather than silently producing a wrong range.
     */
    public static byte[] incrementLastByte(byte[] key) {
        if (key.length == 0) {
            throw new IllegalArgumentException("cannot derive a prefix range end for an empty key");
        }
        int last = key[key.length - 1] & 0xFF;
        if (last == 0xFF) {
            throw new IllegalArgumentException("cannot derive a prefix range end for a key ending in 0xFF");
        }
        byte[] out = Arrays.copyOf(key, key.length);
        out[out.length - 1] = (byte) (last + 1);
        return out;
    }

    /**
     * Treat {@code key} as a big-endian unsigned integer and add one, carrying
     * into higher bytes. Returns null if every byte is 0xFF (overflow).
     */
    public static byte[] increment(byte[] key) {
        byte[] out = Arrays.copyOf(key, key.length);
        for (int i = out.length - 1; i >= 0; i--) {
            int b = (out[i] & 0xFF) + 1;
            out[i] = (byte) b;
            if (b <= 0xFF) {
                return out;
            }
        }
        return null;
    }

    /** Lexicographic unsigned comparison. */
    public static int compare(byte[] a, byte[] b) {
        return Arrays.compareUnsigned(a, b);
    }

    public static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (prefix.length > bytes.length) {
            return false;
        }
        return Arrays.equals(bytes, 0, prefix.length, prefix, 0, prefix.length);
    }

    public static byte[] concat(byte[] a, byte[] b) {
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    public static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Render bytes for logs and toString(): printable ASCII as text,
     * anything else as hex.
     */
    public static String display(byte[] bytes) {
        if (bytes == null) {
            return "null";
        }
        for (byte b : bytes) {
            if (b < 0x20 || b > 0x7E) {
                return "0x" + HEX.formatHex(bytes);
            }
        }
        return new String(bytes, StandardCharsets.US_ASCII);
    }
}
