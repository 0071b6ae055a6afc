package org.zimcorpus.sharding.pipeline.sink;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Reads the framed payloads back out of a gzip shard file, in the order they were written.
 */
public class ShardReader implements Closeable {

    private final Path path;
    private final DataInputStream in;
    private int documentsRead;

    public ShardReader(Path path) throws IOException {
        this.path = path;
        var fileStream = Files.newInputStream(path);
        try {
            this.in = new DataInputStream(new BufferedInputStream(new GZIPInputStream(fileStream)));
        } catch (IOException e) {
            fileStream.close();
            throw e;
        }
    }

    /**
     * @return the next payload, or {@code null} once the stream ends cleanly on a frame boundary
     * @throws EOFException if the file ends inside a length prefix or a payload
     */
    public byte[] next() throws IOException {
        int first = in.read();
        if (first < 0) {
            return null;
        }
        try {
            int prefix = (first << 24) | (in.readUnsignedByte() << 16) | (in.readUnsignedByte() << 8)
                | in.readUnsignedByte();
            byte[] payload = ShardFraming.readPayload(in, ShardFraming.toUnsignedLength(prefix));
            documentsRead++;
            return payload;
        } catch (EOFException e) {
            var abrupt = new EOFException(path + " ended abruptly after " + documentsRead + " documents.");
            abrupt.initCause(e);
            throw abrupt;
        }
    }

    public int getDocumentsRead() {
        return documentsRead;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    public static List<byte[]> readAll(Path path) throws IOException {
        try (var reader = new ShardReader(path)) {
            List<byte[]> payloads = new ArrayList<>();
            byte[] payload;
            while ((payload = reader.next()) != null) {
                payloads.add(payload);
            }
            return payloads;
        }
    }

    public static int countDocuments(Path path) throws IOException {
        try (var reader = new ShardReader(path)) {
            while (reader.next() != null) {
                // only counting
            }
            return reader.getDocumentsRead();
        }
    }
}
