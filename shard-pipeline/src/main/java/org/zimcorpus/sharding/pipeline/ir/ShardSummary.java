package org.zimcorpus.sharding.pipeline.ir;

/**
 * Emitted by a writer after a shard has been fully written and closed.
 */
public record ShardSummary(
    int shardId,
    String location,
    int documents,
    long payloadBytes
) {}
