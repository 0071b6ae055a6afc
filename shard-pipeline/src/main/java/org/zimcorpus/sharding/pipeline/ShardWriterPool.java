package org.zimcorpus.sharding.pipeline;

import org.zimcorpus.sharding.pipeline.ir.Batch;
import org.zimcorpus.sharding.pipeline.ir.ShardSummary;
import org.zimcorpus.sharding.pipeline.sink.ShardSink;
import org.zimcorpus.sharding.pipeline.source.RecordSource;
import org.zimcorpus.sharding.pipeline.source.RecordSourceFactory;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SynchronousSink;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Runs {@code threadCount} writers, each on its own thread with its own {@link RecordSource}.
 * A writer pops batches until it receives the termination marker.
 *
 * <p>The returned Flux emits one {@link ShardSummary} per shard, in completion order, and completes
 * once every writer has terminated. The first writer failure cancels the queue, so the scanner and
 * the remaining writers stop, and is propagated as the error of the Flux.
 */
@Slf4j
public class ShardWriterPool {
    private static final int WORKER_TTL_SECONDS = 60;

    private final BatchQueue queue;
    private final RecordSourceFactory sourceFactory;
    private final ShardSink sink;
    private final int threadCount;

    public ShardWriterPool(BatchQueue queue, RecordSourceFactory sourceFactory, ShardSink sink, int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be positive, got " + threadCount);
        }
        this.queue = queue;
        this.sourceFactory = sourceFactory;
        this.sink = sink;
        this.threadCount = threadCount;
    }

    public Flux<ShardSummary> run() {
        return Flux.using(
            () -> Schedulers.newBoundedElastic(threadCount, Integer.MAX_VALUE, "shardWriter", WORKER_TTL_SECONDS),
            scheduler -> Flux.range(1, threadCount)
                .flatMap(workerId -> runWorker(workerId, scheduler), threadCount),
            Scheduler::dispose
        );
    }

    Flux<ShardSummary> runWorker(int workerId, Scheduler scheduler) {
        return Flux.using(
                () -> openSource(workerId),
                source -> {
                    var writer = new ShardWriter(source, sink);
                    return Flux.<ShardSummary>generate(emitter -> writeNext(workerId, writer, emitter));
                },
                source -> closeSource(workerId, source)
            )
            .doOnError(e -> {
                log.error("Writer {} failed", workerId, e);
                queue.cancel(e);
            })
            .doOnComplete(() -> log.debug("Writer {} received the termination marker, exiting", workerId))
            .subscribeOn(scheduler);
    }

    private void writeNext(int workerId, ShardWriter writer, SynchronousSink<ShardSummary> emitter) {
        Batch batch;
        try {
            batch = queue.pop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.error(new BatchQueue.ExtractionCancelledException(
                "Writer " + workerId + " was interrupted while waiting for work", e));
            return;
        }
        if (batch.isTermination()) {
            emitter.complete();
            return;
        }
        log.trace("Writer {} took shard {}", workerId, batch.shardId());
        emitter.next(writer.write(batch));
    }

    private RecordSource openSource(int workerId) {
        try {
            return sourceFactory.open();
        } catch (Exception e) {
            throw new CouldNotOpenRecordSource("Writer " + workerId + " could not open the archive", e);
        }
    }

    private void closeSource(int workerId, RecordSource source) {
        try {
            source.close();
        } catch (Exception e) {
            log.warn("Writer {} failed to close its record source: {}", workerId, e.getMessage());
        }
    }

    public static class CouldNotOpenRecordSource extends ExtractionException {
        public CouldNotOpenRecordSource(String message, Exception cause) {
            super(message, cause);
        }
    }
}
