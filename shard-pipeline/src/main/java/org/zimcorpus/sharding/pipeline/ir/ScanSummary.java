package org.zimcorpus.sharding.pipeline.ir;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.zimcorpus.sharding.pipeline.filter.DropReason;

/**
 * Counters collected by the scanner over its single pass.
 *
 * @param recordsScanned every entry the source yielded
 * @param recordsKept entries that passed all rejection predicates
 * @param batchesProduced batches pushed to the queue, equal to the highest shard id
 * @param dropped rejected entries per reason
 */
public record ScanSummary(
    long recordsScanned,
    long recordsKept,
    int batchesProduced,
    Map<DropReason, Long> dropped
) {
    public ScanSummary {
        var copy = new EnumMap<DropReason, Long>(DropReason.class);
        copy.putAll(dropped);
        dropped = Collections.unmodifiableMap(copy);
    }

    public long droppedFor(DropReason reason) {
        return dropped.getOrDefault(reason, 0L);
    }
}
