package org.zimcorpus.sharding.pipeline.filter;

import java.util.Optional;

import org.zimcorpus.sharding.pipeline.ir.RecordEntry;

/**
 * Pure keep/drop decision over record metadata. Implementations must not touch payloads and must
 * be safe to call from the scanning thread without synchronization.
 */
@FunctionalInterface
public interface RecordFilter {

    /** Returns the first reason the entry is rejected for, or empty if it is kept. */
    Optional<DropReason> rejectionOf(RecordEntry entry);

    default boolean accepts(RecordEntry entry) {
        return rejectionOf(entry).isEmpty();
    }
}
