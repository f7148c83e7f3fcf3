// file: storage/src/main/java/io/kvgate/storage/KeyCodecs.java
package io.kvgate.storage;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * Stock key encodings. All fixed-width parts are big-endian so byte order
 * matches numeric order.
 *
 * <pre>
 *   string      UTF-8 bytes
 *   uuid        16 bytes (msb, lsb)
 *   oid         8 bytes, unsigned 64-bit
 *   uuidString  16 bytes uuid ++ UTF-8 bytes
 *   uuidUuid    16 bytes ++ 16 bytes
 *   bytes       as is
 * </pre>
 */
public final class KeyCodecs {

    /** Composite key: a uuid followed by a string, ordered by uuid first. */
    public record UuidString(UUID uuid, String string) {
        public UuidString {
            Objects.requireNonNull(uuid, "uuid");
            Objects.requireNonNull(string, "string");
        }
    }

    /** Composite key of two uuids. */
    public record UuidPair(UUID first, UUID second) {
        public UuidPair {
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(second, "second");
        }
    }

    private static final KeyCodec<String> STRING = new KeyCodec<>() {
        @Override
        public byte[] encode(String key) {
            return key.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String decode(byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    };

    private static final KeyCodec<UUID> UUIDS = new KeyCodec<>() {
        @Override
        public byte[] encode(UUID key) {
            return uuidBytes(key);
        }

        @Override
        public UUID decode(byte[] bytes) {
            expectLength(bytes, 16, "uuid");
            return readUuid(ByteBuffer.wrap(bytes));
        }
    };

    private static final KeyCodec<Long> OIDS = new KeyCodec<>() {
        @Override
        public byte[] encode(Long key) {
            return ByteBuffer.allocate(8).putLong(key).array();
        }

        @Override
        public Long decode(byte[] bytes) {
            expectLength(bytes, 8, "oid");
            return ByteBuffer.wrap(bytes).getLong();
        }
    };

    private static final KeyCodec<UuidString> UUID_STRING = new KeyCodec<>() {
        @Override
        public byte[] encode(UuidString key) {
            byte[] s = key.string().getBytes(StandardCharsets.UTF_8);
            return ByteBuffer.allocate(16 + s.length).put(uuidBytes(key.uuid())).put(s).array();
        }

        @Override
        public UuidString decode(byte[] bytes) {
            if (bytes.length < 16) {
                throw new IllegalStateException("uuid+string key too short: " + bytes.length + " bytes");
            }
            ByteBuffer b = ByteBuffer.wrap(bytes);
            UUID uuid = readUuid(b);
            return new UuidString(uuid, new String(bytes, 16, bytes.length - 16, StandardCharsets.UTF_8));
        }
    };

    private static final KeyCodec<UuidPair> UUID_UUID = new KeyCodec<>() {
        @Override
        public byte[] encode(UuidPair key) {
            return ByteBuffer.allocate(32).put(uuidBytes(key.first())).put(uuidBytes(key.second())).array();
        }

        @Override
        public UuidPair decode(byte[] bytes) {
            expectLength(bytes, 32, "uuid+uuid");
            ByteBuffer b = ByteBuffer.wrap(bytes);
            return new UuidPair(readUuid(b), readUuid(b));
        }
    };

    private static final KeyCodec<byte[]> BYTES = new KeyCodec<>() {
        @Override
        public byte[] encode(byte[] key) {
            return Arrays.copyOf(key, key.length);
        }

        @Override
        public byte[] decode(byte[] bytes) {
            return Arrays.copyOf(bytes, bytes.length);
        }
    };

    private KeyCodecs() {
    }

    public static KeyCodec<String> string() {
        return STRING;
    }

    public static KeyCodec<UUID> uuid() {
        return UUIDS;
    }

    public static KeyCodec<Long> oid() {
        return OIDS;
    }

    public static KeyCodec<UuidString> uuidString() {
        return UUID_STRING;
    }

    public static KeyCodec<UuidPair> uuidUuid() {
        return UUID_UUID;
    }

    public static KeyCodec<byte[]> bytes() {
        return BYTES;
    }

    static byte[] uuidBytes(UUID uuid) {
        return ByteBuffer.allocate(16)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .array();
    }

    static UUID readUuid(ByteBuffer b) {
        return new UUID(b.getLong(), b.getLong());
    }

    static void expectLength(byte[] bytes, int expected, String what) {
        if (bytes.length != expected) {
            throw new IllegalStateException(what + " must be " + expected + " bytes, was " + bytes.length);
        }
    }
}
