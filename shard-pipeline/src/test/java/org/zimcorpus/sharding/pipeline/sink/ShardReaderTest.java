package org.zimcorpus.sharding.pipeline.sink;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class ShardReaderTest {

    @TempDir
    Path tempDir;

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private Path gzipFile(String name, byte[] content) throws IOException {
        Path path = tempDir.resolve(name);
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(path))) {
            out.write(content);
        }
        return path;
    }

    @Test
    void frameIsBigEndianLengthFollowedByPayload() throws IOException {
        var sink = new GzipShardSink(tempDir, 4);
        try (ShardOutput output = sink.openShard(1)) {
            output.writeRecord(utf8("<p>a</p>"));
            output.writeRecord(new byte[0]);
            output.writeRecord(utf8("é"));
        }

        byte[] decompressed;
        try (var in = new GZIPInputStream(Files.newInputStream(tempDir.resolve("0001.htmls.gz")))) {
            decompressed = in.readAllBytes();
        }
        var expected = new ByteArrayOutputStream();
        expected.write(new byte[] {0, 0, 0, 8});
        expected.write(utf8("<p>a</p>"));
        expected.write(new byte[] {0, 0, 0, 0});
        expected.write(new byte[] {0, 0, 0, 2});
        expected.write(utf8("é"));
        assertArrayEquals(expected.toByteArray(), decompressed);
    }

    @Test
    void readsPayloadsBackInOrder() throws IOException {
        var sink = new GzipShardSink(tempDir, 2);
        try (ShardOutput output = sink.openShard(3)) {
            output.writeRecord(utf8("first"));
            output.writeRecord(utf8("second"));
        }

        Path shard = tempDir.resolve("03.htmls.gz");
        var payloads = ShardReader.readAll(shard);
        assertEquals(2, payloads.size());
        assertEquals("first", new String(payloads.get(0), StandardCharsets.UTF_8));
        assertEquals("second", new String(payloads.get(1), StandardCharsets.UTF_8));
        assertEquals(2, ShardReader.countDocuments(shard));
    }

    @Test
    void reopeningShardTruncatesIt() throws IOException {
        var sink = new GzipShardSink(tempDir, 4);
        try (ShardOutput output = sink.openShard(1)) {
            output.writeRecord(utf8("old one"));
            output.writeRecord(utf8("old two"));
        }
        try (ShardOutput output = sink.openShard(1)) {
            output.writeRecord(utf8("new"));
        }

        assertEquals(1, ShardReader.countDocuments(sink.pathOf(1)));
    }

    @Test
    void emptyStreamHasNoDocuments() throws IOException {
        assertEquals(0, ShardReader.countDocuments(gzipFile("empty.htmls.gz", new byte[0])));
    }

    @Test
    void truncatedLengthPrefixIsReported() throws IOException {
        var content = new ByteArrayOutputStream();
        var data = new DataOutputStream(content);
        ShardFraming.writeFrame(data, utf8("complete"));
        data.write(new byte[] {0, 0});
        Path path = gzipFile("prefix.htmls.gz", content.toByteArray());

        var failure = assertThrows(EOFException.class, () -> ShardReader.readAll(path));
        assertTrue(failure.getMessage().endsWith("ended abruptly after 1 documents."), failure.getMessage());
    }

    @Test
    void truncatedPayloadIsReported() throws IOException {
        var content = new ByteArrayOutputStream();
        var data = new DataOutputStream(content);
        data.writeInt(100);
        data.write(utf8("too short"));
        Path path = gzipFile("payload.htmls.gz", content.toByteArray());

        var failure = assertThrows(EOFException.class, () -> ShardReader.countDocuments(path));
        assertTrue(failure.getMessage().contains("after 0 documents"));
    }

    @Test
    void oversizedFrameIsRejected() throws IOException {
        var content = new ByteArrayOutputStream();
        new DataOutputStream(content).writeInt(0xFFFFFFFF);
        Path path = gzipFile("huge.htmls.gz", content.toByteArray());

        var failure = assertThrows(IOException.class, () -> ShardReader.readAll(path));
        assertTrue(failure.getMessage().contains("4294967295"));
    }
}
