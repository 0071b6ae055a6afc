package org.zimcorpus.sharding.pipeline.sink;

import java.util.Locale;

/**
 * File names of shards: the shard id left-padded with zeroes, followed by {@link #SUFFIX}.
 * Ids with more digits than the width are written in full. Digits are always ASCII.
 */
public final class ShardNaming {

    public static final String SUFFIX = ".htmls.gz";

    private ShardNaming() {}

    public static String fileName(int shardId, int zeroPaddingWidth) {
        if (zeroPaddingWidth < 1) {
            throw new IllegalArgumentException("zeroPaddingWidth must be positive, got " + zeroPaddingWidth);
        }
        return String.format(Locale.ROOT, "%0" + zeroPaddingWidth + "d", shardId) + SUFFIX;
    }
}
