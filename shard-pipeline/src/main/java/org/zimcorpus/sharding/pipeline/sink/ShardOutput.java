package org.zimcorpus.sharding.pipeline.sink;

import java.io.Closeable;
import java.io.IOException;

/**
 * One open shard. Records are framed in the order they are written; {@link #close()} flushes
 * everything to the backing store.
 */
public interface ShardOutput extends Closeable {

    /** Where the shard ends up, for logging and reporting. */
    String location();

    void writeRecord(byte[] payload) throws IOException;
}
