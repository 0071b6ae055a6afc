package org.zimcorpus.sharding.pipeline.source;

import java.io.IOException;
import java.util.stream.Stream;

import org.zimcorpus.sharding.pipeline.ir.RecordEntry;

/**
 * Port for reading an archive. Instances are not thread safe: the scanner and every writer open
 * their own through a {@link RecordSourceFactory}.
 */
public interface RecordSource extends AutoCloseable {

    /**
     * Stream every entry of the archive in ascending index order. The stream is lazy and can be
     * consumed once; read failures during iteration surface as {@link java.io.UncheckedIOException}.
     */
    Stream<RecordEntry> entries() throws IOException;

    /**
     * Read the raw payload of an entry previously observed through {@link #entries()} on a source
     * over the same archive.
     */
    byte[] resolve(long index) throws IOException;

    @Override
    default void close() throws Exception {
        // Default no-op for sources that don't hold resources
    }
}
