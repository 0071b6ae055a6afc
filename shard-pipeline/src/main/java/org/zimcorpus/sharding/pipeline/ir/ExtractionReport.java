package org.zimcorpus.sharding.pipeline.ir;

import java.util.List;

/**
 * Outcome of a completed extraction run. Shards are ordered by shard id.
 */
public record ExtractionReport(
    ScanSummary scan,
    List<ShardSummary> shards
) {
    public ExtractionReport {
        shards = List.copyOf(shards);
    }

    public long documentsWritten() {
        return shards.stream().mapToLong(ShardSummary::documents).sum();
    }
}
