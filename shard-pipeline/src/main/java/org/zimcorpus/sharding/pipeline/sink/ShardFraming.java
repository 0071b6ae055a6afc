package org.zimcorpus.sharding.pipeline.sink;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.EOFException;
import java.io.IOException;

/**
 * Record framing inside a decompressed shard: a 4 byte unsigned big-endian length followed by
 * that many payload bytes. No header, separator or trailer.
 */
public final class ShardFraming {

    /** Largest payload a Java array can hold, and so the largest frame we read back. */
    static final long MAX_FRAME_LENGTH = Integer.MAX_VALUE - 8L;

    private ShardFraming() {}

    public static void writeFrame(DataOutput out, byte[] payload) throws IOException {
        // DataOutput.writeInt is big-endian; payload lengths never exceed 2^31 - 1
        out.writeInt(payload.length);
        out.write(payload);
    }

    /**
     * Read the payload that follows an already consumed length prefix.
     *
     * @throws EOFException if the stream ends before {@code length} bytes were read
     */
    public static byte[] readPayload(DataInput in, long length) throws IOException {
        if (length > MAX_FRAME_LENGTH) {
            throw new IOException("Frame of " + length + " bytes exceeds the supported maximum");
        }
        byte[] payload = new byte[(int) length];
        in.readFully(payload);
        return payload;
    }

    public static long toUnsignedLength(int prefix) {
        return Integer.toUnsignedLong(prefix);
    }
}
