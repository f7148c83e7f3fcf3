// file: client/src/main/java/io/kvgate/client/watch/WatchChunkDecoder.java
package io.kvgate.client.watch;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Reassembles newline-delimited messages from arbitrarily split network buffers.
 * Not thread-safe; one instance per stream, fed from one thread at a time.
 */
public final class WatchChunkDecoder {
    private static final byte SEP = '\n';

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    /**
     * Append {@code buf} and return every message it completed, in order.
     * Blank lines are dropped; a trailing partial message is kept for the next call.
     */
    public List<byte[]> feed(ByteBuffer buf) {
        List<byte[]> out = new ArrayList<>();
        while (buf.hasRemaining()) {
            byte b = buf.get();
            if (b == SEP) {
                flushLine(out);
            } else {
                pending.write(b);
            }
        }
        return out;
    }

    public List<byte[]> feed(byte[] bytes) {
        return feed(ByteBuffer.wrap(bytes));
    }

    /** Bytes buffered after the last separator. */
    public int pendingBytes() {
        return pending.size();
    }

    private void flushLine(List<byte[]> out) {
        byte[] line = pending.toByteArray();
        pending.reset();
        if (!isBlank(line)) {
            out.add(line);
        }
    }

    private static boolean isBlank(byte[] line) {
        for (byte b : line) {
            if (b != ' ' && b != '\t' && b != '\r') {
                return false;
            }
        }
        return true;
    }
}
