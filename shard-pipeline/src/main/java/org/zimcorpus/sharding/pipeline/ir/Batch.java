package org.zimcorpus.sharding.pipeline.ir;

import java.util.List;
import java.util.Objects;

/**
 * A numbered group of record indices destined for one output shard.
 *
 * <p>Shard ids start at 1. The only batch with id 0 is {@link #TERMINATION}, the in-band marker a
 * {@link org.zimcorpus.sharding.pipeline.BatchQueue} hands out once production has ended and the
 * queue is drained. Apart from the marker a batch is never empty.
 *
 * @param shardId the shard this batch is written to
 * @param indices record indices in archive scan order
 */
public record Batch(int shardId, List<Long> indices) {

    public static final Batch TERMINATION = new Batch(0, List.of());

    public Batch {
        Objects.requireNonNull(indices, "indices must not be null");
        indices = List.copyOf(indices);
        if (shardId < 0) {
            throw new IllegalArgumentException("shardId must be >= 0, got " + shardId);
        }
        if (shardId == 0 && !indices.isEmpty()) {
            throw new IllegalArgumentException("shardId 0 is reserved for the termination marker");
        }
        if (shardId > 0 && indices.isEmpty()) {
            throw new IllegalArgumentException("Batch for shard " + shardId + " has no indices");
        }
    }

    public boolean isTermination() {
        return shardId == 0;
    }

    public int size() {
        return indices.size();
    }
}
