// file: storage/src/main/java/io/kvgate/storage/Compression.java
package io.kvgate.storage;

import org.xerial.snappy.Snappy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Value compression applied by a {@link PersistentMap} after encoding and
 * before the bytes reach the store. Keys are never compressed, so range
 * order is unaffected.
 */
public enum Compression {
    NONE {
        @Override
        public byte[] compress(byte[] bytes) {
            return bytes;
        }

        @Override
        public byte[] uncompress(byte[] bytes) {
            return bytes;
        }
    },

    /** zlib stream format (RFC 1950), as produced by {@link Deflater} with default settings. */
    ZLIB {
        @Override
        public byte[] compress(byte[] bytes) {
            Deflater deflater = new Deflater();
            try {
                deflater.setInput(bytes);
                deflater.finish();
                ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, bytes.length / 2));
                byte[] chunk = new byte[4096];
                while (!deflater.finished()) {
                    int n = deflater.deflate(chunk);
                    out.write(chunk, 0, n);
                }
                return out.toByteArray();
            } finally {
                deflater.end();
            }
        }

        @Override
        public byte[] uncompress(byte[] bytes) {
            Inflater inflater = new Inflater();
            try {
                inflater.setInput(bytes);
                ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length * 2);
                byte[] chunk = new byte[4096];
                while (!inflater.finished()) {
                    int n = inflater.inflate(chunk);
                    if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                        throw new IllegalStateException("truncated zlib value (" + bytes.length + " bytes)");
                    }
                    out.write(chunk, 0, n);
                }
                return out.toByteArray();
            } catch (DataFormatException e) {
                throw new IllegalStateException("corrupt zlib value", e);
            } finally {
                inflater.end();
            }
        }
    },

    SNAPPY {
        @Override
        public byte[] compress(byte[] bytes) {
            try {
                return Snappy.compress(bytes);
            } catch (IOException e) {
                throw new RuntimeException("snappy compression failed", e);
            }
        }

        @Override
        public byte[] uncompress(byte[] bytes) {
            try {
                return Snappy.uncompress(bytes);
            } catch (IOException e) {
                throw new IllegalStateException("corrupt snappy value", e);
            }
        }
    };

    public abstract byte[] compress(byte[] bytes);

    public abstract byte[] uncompress(byte[] bytes);
}
