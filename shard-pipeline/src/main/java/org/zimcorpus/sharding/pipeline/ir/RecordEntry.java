package org.zimcorpus.sharding.pipeline.ir;

/**
 * Metadata of one archive entry, as yielded by a sequential scan. The payload is not carried here;
 * it is resolved later by index from a {@link org.zimcorpus.sharding.pipeline.source.RecordSource}.
 */
public record RecordEntry(
    long index,
    String title,
    String namespace,
    boolean redirect,
    boolean deleted
) {}
