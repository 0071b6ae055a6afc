package org.zimcorpus.sharding.pipeline;

import java.io.IOException;

import org.zimcorpus.sharding.pipeline.ir.Batch;
import org.zimcorpus.sharding.pipeline.ir.ShardSummary;
import org.zimcorpus.sharding.pipeline.sink.ShardOutput;
import org.zimcorpus.sharding.pipeline.sink.ShardSink;
import org.zimcorpus.sharding.pipeline.source.RecordSource;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns one batch into one shard: resolves each index through this writer's private source, in
 * batch order, and appends the payload to a freshly opened shard output which is closed before
 * returning. A record that cannot be resolved or a shard that cannot be written fails the run.
 */
@Slf4j
@RequiredArgsConstructor
public class ShardWriter {
    private final RecordSource source;
    private final ShardSink sink;

    public ShardSummary write(Batch batch) {
        if (batch.isTermination()) {
            throw new IllegalArgumentException("The termination marker is never written");
        }
        log.debug("Writing shard {} with {} documents", batch.shardId(), batch.size());

        String location = "shard " + batch.shardId();
        long payloadBytes = 0;
        try (ShardOutput output = sink.openShard(batch.shardId())) {
            location = output.location();
            for (long index : batch.indices()) {
                byte[] payload = resolve(batch, index);
                output.writeRecord(payload);
                payloadBytes += payload.length;
            }
        } catch (IOException e) {
            throw new CouldNotWriteShard(batch.shardId(), location, e);
        }

        log.atDebug().setMessage("Closed {} ({} documents, {} bytes)")
            .addArgument(location)
            .addArgument(batch::size)
            .addArgument(payloadBytes)
            .log();
        return new ShardSummary(batch.shardId(), location, batch.size(), payloadBytes);
    }

    private byte[] resolve(Batch batch, long index) {
        try {
            return source.resolve(index);
        } catch (IOException | RuntimeException e) {
            throw new CouldNotResolveRecord(batch.shardId(), index, e);
        }
    }

    public static class CouldNotResolveRecord extends ExtractionException {
        private final int shardId;
        private final long index;

        public CouldNotResolveRecord(int shardId, long index, Exception cause) {
            super("Could not resolve record " + index + " for shard " + shardId, cause);
            this.shardId = shardId;
            this.index = index;
        }

        public int getShardId() {
            return shardId;
        }

        public long getIndex() {
            return index;
        }
    }

    public static class CouldNotWriteShard extends ExtractionException {
        private final int shardId;

        public CouldNotWriteShard(int shardId, String location, Exception cause) {
            super("Could not write shard " + shardId + " to " + location, cause);
            this.shardId = shardId;
        }

        public int getShardId() {
            return shardId;
        }
    }
}
