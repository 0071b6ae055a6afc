package org.zimcorpus.sharding.pipeline.sink;

import java.io.IOException;

/**
 * Port for persisting shards (gzip files on disk, in-memory collector for tests).
 *
 * <p>Safe for concurrent use as long as each shard id is opened by one writer only, which the
 * batch queue guarantees.
 */
public interface ShardSink {

    /** Open a fresh output for the shard, replacing anything previously stored under its name. */
    ShardOutput openShard(int shardId) throws IOException;
}
