package org.zimcorpus.sharding.pipeline.sink;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.GZIPOutputStream;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes every shard as a gzip compressed file of framed records into one output directory.
 * The directory must exist; it is created by the caller during setup.
 */
@Slf4j
public class GzipShardSink implements ShardSink {

    private static final int BUFFER_SIZE = 64 * 1024;

    @Getter
    private final Path outputDirectory;
    private final int zeroPaddingWidth;

    public GzipShardSink(Path outputDirectory, int zeroPaddingWidth) {
        if (zeroPaddingWidth < 1) {
            throw new IllegalArgumentException("zeroPaddingWidth must be positive, got " + zeroPaddingWidth);
        }
        this.outputDirectory = outputDirectory;
        this.zeroPaddingWidth = zeroPaddingWidth;
    }

    public Path pathOf(int shardId) {
        return outputDirectory.resolve(ShardNaming.fileName(shardId, zeroPaddingWidth));
    }

    @Override
    public ShardOutput openShard(int shardId) throws IOException {
        Path path = pathOf(shardId);
        log.debug("Opening shard file {}", path);
        var fileStream = Files.newOutputStream(path,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
        try {
            var gzip = new GZIPOutputStream(new BufferedOutputStream(fileStream, BUFFER_SIZE), BUFFER_SIZE);
            return new GzipShardOutput(path, new DataOutputStream(gzip));
        } catch (IOException e) {
            fileStream.close();
            throw e;
        }
    }

    private static class GzipShardOutput implements ShardOutput {
        private final Path path;
        private final DataOutputStream out;

        GzipShardOutput(Path path, DataOutputStream out) {
            this.path = path;
            this.out = out;
        }

        @Override
        public String location() {
            return path.toString();
        }

        @Override
        public void writeRecord(byte[] payload) throws IOException {
            ShardFraming.writeFrame(out, payload);
        }

        @Override
        public void close() throws IOException {
            out.close();
        }
    }
}
