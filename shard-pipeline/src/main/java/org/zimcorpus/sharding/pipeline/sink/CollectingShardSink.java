package org.zimcorpus.sharding.pipeline.sink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An in-memory ShardSink for exercising the pipeline without touching the file system.
 *
 * <p>Payloads become visible only once their shard is closed, matching what a reader of the gzip
 * files would see. Opening a shard id twice is recorded so tests can assert it never happens.
 */
public class CollectingShardSink implements ShardSink {

    private final Map<Integer, List<byte[]>> closedShards = new ConcurrentHashMap<>();
    private final Map<Integer, Integer> openCounts = new ConcurrentHashMap<>();

    @Override
    public ShardOutput openShard(int shardId) {
        openCounts.merge(shardId, 1, Integer::sum);
        return new ShardOutput() {
            private final List<byte[]> payloads = new ArrayList<>();

            @Override
            public String location() {
                return "memory://shard/" + shardId;
            }

            @Override
            public void writeRecord(byte[] payload) {
                payloads.add(payload.clone());
            }

            @Override
            public void close() {
                closedShards.put(shardId, Collections.unmodifiableList(payloads));
            }
        };
    }

    /** Closed shards keyed and ordered by shard id. */
    public SortedMap<Integer, List<byte[]>> getShards() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(closedShards));
    }

    public int timesOpened(int shardId) {
        return openCounts.getOrDefault(shardId, 0);
    }
}
