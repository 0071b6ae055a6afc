package org.zimcorpus.sharding.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import org.zimcorpus.sharding.pipeline.filter.DropReason;
import org.zimcorpus.sharding.pipeline.filter.RecordFilter;
import org.zimcorpus.sharding.pipeline.ir.Batch;
import org.zimcorpus.sharding.pipeline.ir.RecordEntry;
import org.zimcorpus.sharding.pipeline.ir.ScanSummary;
import org.zimcorpus.sharding.pipeline.source.RecordSource;

import lombok.extern.slf4j.Slf4j;

/**
 * The single producer of a run. Walks the archive once, drops entries the filter rejects and
 * pushes the indices of the rest to the queue in batches of {@code documentsPerShard}, numbering
 * them 1, 2, 3... in scan order. The last batch may be smaller.
 *
 * <p>Production is marked finished exactly once when the scan ends, whether it produced batches,
 * none, or failed, so that writers always terminate.
 */
@Slf4j
public class ArchiveScanner {

    static final int PROGRESS_INTERVAL = 1000;

    private final BatchQueue queue;
    private final RecordFilter filter;
    private final int documentsPerShard;

    public ArchiveScanner(BatchQueue queue, RecordFilter filter, int documentsPerShard) {
        if (documentsPerShard < 1) {
            throw new IllegalArgumentException("documentsPerShard must be positive, got " + documentsPerShard);
        }
        this.queue = queue;
        this.filter = filter;
        this.documentsPerShard = documentsPerShard;
    }

    public ScanSummary scan(RecordSource source) throws InterruptedException {
        try {
            return scanEntries(source);
        } finally {
            queue.markProductionFinished();
        }
    }

    private ScanSummary scanEntries(RecordSource source) throws InterruptedException {
        long scanned = 0;
        long kept = 0;
        int nextShardId = 1;
        Map<DropReason, Long> dropped = new EnumMap<>(DropReason.class);
        List<Long> buffer = new ArrayList<>(documentsPerShard);

        try (Stream<RecordEntry> entries = openEntries(source)) {
            Iterator<RecordEntry> iterator = entries.iterator();
            while (iterator.hasNext()) {
                RecordEntry entry = iterator.next();
                scanned++;

                Optional<DropReason> rejection = filter.rejectionOf(entry);
                if (rejection.isPresent()) {
                    dropped.merge(rejection.get(), 1L, Long::sum);
                    log.atDebug().setMessage("Dropping {} article {}")
                        .addArgument(() -> rejection.get().description())
                        .addArgument(entry::title)
                        .log();
                    continue;
                }

                if (++kept % PROGRESS_INTERVAL == 0) {
                    log.info("At the {}th document.", kept);
                }
                log.trace("Keeping article {} ({})", entry.title(), entry.index());
                buffer.add(entry.index());
                if (buffer.size() == documentsPerShard) {
                    queue.push(new Batch(nextShardId++, buffer));
                    buffer = new ArrayList<>(documentsPerShard);
                }
            }
        } catch (UncheckedIOException e) {
            throw new CouldNotScanArchive("Could not read the archive after " + scanned + " entries", e);
        } catch (ExtractionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CouldNotScanArchive("Unexpected failure while scanning the archive after "
                + scanned + " entries", e);
        }

        if (!buffer.isEmpty()) {
            queue.push(new Batch(nextShardId++, buffer));
        }

        var summary = new ScanSummary(scanned, kept, nextShardId - 1, dropped);
        log.info("Scan finished: {} entries scanned, {} kept in {} batches, dropped {}",
            scanned, kept, summary.batchesProduced(), summary.dropped());
        return summary;
    }

    private static Stream<RecordEntry> openEntries(RecordSource source) {
        try {
            return source.entries();
        } catch (IOException | RuntimeException e) {
            throw new CouldNotScanArchive("Could not read the archive entries", e);
        }
    }

    public static class CouldNotScanArchive extends ExtractionException {
        public CouldNotScanArchive(String message, Exception cause) {
            super(message, cause);
        }
    }
}
