package org.zimcorpus.sharding.pipeline.source;

import java.io.IOException;

/**
 * Opens independent {@link RecordSource} handles onto one archive.
 */
@FunctionalInterface
public interface RecordSourceFactory {

    RecordSource open() throws IOException;
}
