package org.zimcorpus.sharding.pipeline;

import org.zimcorpus.sharding.pipeline.filter.ExclusionRules;
import org.zimcorpus.sharding.pipeline.filter.Language;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Values the engine runs with. Unset values fall back to the defaults below.
 */
@Getter
@ToString
public class ExtractionConfig {
    public static final int DEFAULT_DOCUMENTS_PER_SHARD = 2500;
    public static final int DEFAULT_THREAD_COUNT = 10;
    public static final int DEFAULT_ZERO_PADDING_WIDTH = 4;

    /** Batch size, and so the number of documents in every shard but the last. */
    private final int documentsPerShard;
    /** Number of writer threads, also the capacity of the batch queue. */
    private final int threadCount;
    private final int zeroPaddingWidth;
    private final ExclusionRules exclusionRules;

    @Builder
    private ExtractionConfig(
        Integer documentsPerShard,
        Integer threadCount,
        Integer zeroPaddingWidth,
        ExclusionRules exclusionRules
    ) {
        this.documentsPerShard = requirePositive("documentsPerShard",
            documentsPerShard != null ? documentsPerShard : DEFAULT_DOCUMENTS_PER_SHARD);
        this.threadCount = requirePositive("threadCount",
            threadCount != null ? threadCount : DEFAULT_THREAD_COUNT);
        this.zeroPaddingWidth = requirePositive("zeroPaddingWidth",
            zeroPaddingWidth != null ? zeroPaddingWidth : DEFAULT_ZERO_PADDING_WIDTH);
        this.exclusionRules = exclusionRules != null ? exclusionRules : ExclusionRules.forLanguage(Language.HU);
    }

    public static ExtractionConfig defaults() {
        return builder().build();
    }

    private static int requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }
}
