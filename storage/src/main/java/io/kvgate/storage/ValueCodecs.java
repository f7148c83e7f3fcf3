// file: storage/src/main/java/io/kvgate/storage/ValueCodecs.java
package io.kvgate.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import io.kvgate.core.Bytes;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Stock value encodings. {@link #json(Class)} and {@link #cbor(Class)} cover
 * records and POJOs.
 *
 * <pre>
 *   uuidSet   16 bytes per member, ascending by encoded bytes
 * </pre>
 */
public final class ValueCodecs {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper CBOR = new CBORMapper();

    private static final ValueCodec<String> STRING = new ValueCodec<>() {
        @Override
        public byte[] encode(String value) {
            return value.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String decode(byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    };

    private static final ValueCodec<UUID> UUIDS = new ValueCodec<>() {
        @Override
        public byte[] encode(UUID value) {
            return KeyCodecs.uuidBytes(value);
        }

        @Override
        public UUID decode(byte[] bytes) {
            KeyCodecs.expectLength(bytes, 16, "uuid");
            return KeyCodecs.readUuid(ByteBuffer.wrap(bytes));
        }
    };

    private static final ValueCodec<Long> OIDS = new ValueCodec<>() {
        @Override
        public byte[] encode(Long value) {
            return ByteBuffer.allocate(8).putLong(value).array();
        }

        @Override
        public Long decode(byte[] bytes) {
            KeyCodecs.expectLength(bytes, 8, "oid");
            return ByteBuffer.wrap(bytes).getLong();
        }
    };

    private static final ValueCodec<byte[]> BYTES = new ValueCodec<>() {
        @Override
        public byte[] encode(byte[] value) {
            return Arrays.copyOf(value, value.length);
        }

        @Override
        public byte[] decode(byte[] bytes) {
            return Arrays.copyOf(bytes, bytes.length);
        }
    };

    private static final ValueCodec<Set<UUID>> UUID_SET = new ValueCodec<>() {
        @Override
        public byte[] encode(Set<UUID> value) {
            TreeSet<byte[]> members = new TreeSet<>(Bytes::compare);
            for (UUID u : value) {
                members.add(KeyCodecs.uuidBytes(u));
            }
            ByteBuffer b = ByteBuffer.allocate(16 * members.size());
            members.forEach(b::put);
            return b.array();
        }

        @Override
        public Set<UUID> decode(byte[] bytes) {
            if (bytes.length % 16 != 0) {
                throw new IllegalStateException("uuid set must be a multiple of 16 bytes, was " + bytes.length);
            }
            ByteBuffer b = ByteBuffer.wrap(bytes);
            Set<UUID> out = new LinkedHashSet<>();
            while (b.hasRemaining()) {
                out.add(KeyCodecs.readUuid(b));
            }
            return Collections.unmodifiableSet(out);
        }
    };

    private ValueCodecs() {
    }

    public static ValueCodec<String> string() {
        return STRING;
    }

    public static ValueCodec<UUID> uuid() {
        return UUIDS;
    }

    public static ValueCodec<Long> oid() {
        return OIDS;
    }

    public static ValueCodec<byte[]> bytes() {
        return BYTES;
    }

    public static ValueCodec<Set<UUID>> uuidSet() {
        return UUID_SET;
    }

    public static <V> ValueCodec<V> json(Class<V> type) {
        return json(MAPPER, type);
    }

    /** Binary CBOR through Jackson; same data binding as {@link #json(Class)}, smaller values. */
    public static <V> ValueCodec<V> cbor(Class<V> type) {
        return mapped(CBOR, type);
    }

    /** JSON via the given mapper; use this to register modules or naming strategies. */
    public static <V> ValueCodec<V> json(ObjectMapper mapper, Class<V> type) {
        return mapped(mapper, type);
    }

    private static <V> ValueCodec<V> mapped(ObjectMapper mapper, Class<V> type) {
        return new ValueCodec<>() {
            @Override
            public byte[] encode(V value) {
                try {
                    return mapper.writeValueAsBytes(value);
                } catch (IOException e) {
                    throw new IllegalArgumentException("cannot serialize " + type.getSimpleName(), e);
                }
            }

            @Override
            public V decode(byte[] bytes) {
                try {
                    return mapper.readValue(bytes, type);
                } catch (IOException e) {
                    throw new IllegalStateException("stored value is not a valid " + type.getSimpleName(), e);
                }
            }
        };
    }
}
