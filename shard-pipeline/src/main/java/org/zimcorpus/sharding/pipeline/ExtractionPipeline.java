package org.zimcorpus.sharding.pipeline;

import java.util.Comparator;

import org.zimcorpus.sharding.pipeline.ir.ExtractionReport;
import org.zimcorpus.sharding.pipeline.ir.ScanSummary;
import org.zimcorpus.sharding.pipeline.ir.ShardSummary;
import org.zimcorpus.sharding.pipeline.sink.ShardSink;
import org.zimcorpus.sharding.pipeline.source.RecordSource;
import org.zimcorpus.sharding.pipeline.source.RecordSourceFactory;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Wires an archive to a shard sink: one scanner thread feeding a bounded {@link BatchQueue}
 * (capacity = thread count) that {@code threadCount} writer threads drain.
 *
 * <p>The run completes once the scanner has finished its pass and every writer has observed the
 * termination marker. Any failure fails the whole run; nothing is retried or skipped.
 */
@Slf4j
public class ExtractionPipeline {

    private final RecordSourceFactory sourceFactory;
    private final ShardSink sink;
    private final ExtractionConfig config;

    public ExtractionPipeline(RecordSourceFactory sourceFactory, ShardSink sink, ExtractionConfig config) {
        this.sourceFactory = sourceFactory;
        this.sink = sink;
        this.config = config;
    }

    /**
     * Cold Mono of the whole run; subscription starts the scanner and the writers.
     */
    public Mono<ExtractionReport> execute() {
        return Mono.defer(() -> {
            var queue = new BatchQueue(config.getThreadCount());
            var scanner = new ArchiveScanner(queue, config.getExclusionRules(), config.getDocumentsPerShard());
            var writerPool = new ShardWriterPool(queue, sourceFactory, sink, config.getThreadCount());
            log.info("Starting extraction with {}", config);

            Mono<ScanSummary> scan = Mono.using(
                () -> Schedulers.newSingle("archiveScanner"),
                scheduler -> scan(scanner, queue, scheduler),
                Scheduler::dispose
            );
            var shards = writerPool.run()
                .collectSortedList(Comparator.comparingInt(ShardSummary::shardId));

            return Mono.zip(scan, shards, ExtractionReport::new)
                .onErrorMap(ExtractionPipeline::isCancellationOfAnotherFailure, Throwable::getCause)
                .onErrorMap(ExtractionPipeline::isUnexpected,
                    e -> new ExtractionException("Extraction failed unexpectedly: " + e, e))
                .doOnSuccess(report -> log.info("Extraction finished: {} documents in {} shards",
                    report.documentsWritten(), report.shards().size()));
        });
    }

    /** Run to completion on the calling thread, rethrowing the failure of the run if any. */
    public ExtractionReport run() {
        return execute().block();
    }

    private Mono<ScanSummary> scan(ArchiveScanner scanner, BatchQueue queue, Scheduler scheduler) {
        return Mono.fromCallable(() -> {
                try (RecordSource source = openForScan()) {
                    return scanner.scan(source);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new BatchQueue.ExtractionCancelledException("Scanner was interrupted", e);
                }
            })
            .doOnError(e -> {
                log.error("Scanner failed", e);
                queue.cancel(e);
            })
            .subscribeOn(scheduler);
    }

    /**
     * A thread stopped by the queue cancellation can report before the thread whose failure caused
     * it; report the original failure instead.
     */
    private static boolean isCancellationOfAnotherFailure(Throwable error) {
        return error instanceof BatchQueue.ExtractionCancelledException
            && error.getCause() != null
            && !(error.getCause() instanceof InterruptedException);
    }

    /** Anything that escaped the scanner and writers without being classified. */
    private static boolean isUnexpected(Throwable error) {
        return error instanceof Exception && !(error instanceof ExtractionException);
    }

    private RecordSource openForScan() {
        try {
            return sourceFactory.open();
        } catch (Exception e) {
            throw new ArchiveScanner.CouldNotScanArchive("Could not open the archive for scanning", e);
        }
    }
}
