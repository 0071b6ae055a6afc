package org.zimcorpus.sharding.pipeline;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.zimcorpus.sharding.pipeline.ir.Batch;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded FIFO hand-off between the single scanner and the writer threads.
 *
 * <p>{@link #push(Batch)} blocks while {@code capacity} batches are pending. {@link #pop()} blocks
 * until a batch is pending or production has finished; once finished and drained it returns
 * {@link Batch#TERMINATION} to every caller. Each batch is handed to exactly one consumer, in the
 * order it was pushed.
 *
 * <p>All state is guarded by one lock with two conditions: {@code notFull} for the producer and
 * {@code batchOrTermination} for the consumers. Waits always re-check their predicate.
 *
 * <p>A consumer that has received the termination marker must stop polling.
 */
@Slf4j
public class BatchQueue {

    private final int capacity;
    private final Deque<Batch> pending;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition batchOrTermination = lock.newCondition();

    private boolean productionFinished;
    private Throwable cancellationCause;
    private int waitingProducers;

    public BatchQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.pending = new ArrayDeque<>(capacity);
    }

    /**
     * Enqueue a batch, waiting for a free slot if the queue is full.
     *
     * @throws ExtractionCancelledException if the queue was cancelled before or while waiting
     * @throws IllegalStateException if production was already marked finished
     */
    public void push(Batch batch) throws InterruptedException {
        Objects.requireNonNull(batch, "batch must not be null");
        if (batch.isTermination()) {
            throw new IllegalArgumentException("The termination marker is produced by the queue itself");
        }
        lock.lockInterruptibly();
        try {
            if (productionFinished) {
                throw new IllegalStateException("Production already finished, cannot push shard " + batch.shardId());
            }
            while (pending.size() >= capacity && cancellationCause == null) {
                log.atTrace().setMessage("Queue full ({} pending), shard {} waits for a free slot")
                    .addArgument(pending::size)
                    .addArgument(batch::shardId)
                    .log();
                waitingProducers++;
                try {
                    notFull.await();
                } finally {
                    waitingProducers--;
                }
            }
            if (cancellationCause != null) {
                throw new ExtractionCancelledException(
                    "Queue cancelled before shard " + batch.shardId() + " could be queued", cancellationCause);
            }
            pending.addLast(batch);
            batchOrTermination.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the oldest pending batch, or the termination marker once production has finished and
     * nothing is pending.
     */
    public Batch pop() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty() && !productionFinished && cancellationCause == null) {
                batchOrTermination.await();
            }
            if (cancellationCause == null && !pending.isEmpty()) {
                Batch head = pending.removeFirst();
                notFull.signal();
                return head;
            }
            // Pass the wake-up on so the next idle consumer observes termination as well
            batchOrTermination.signal();
            return Batch.TERMINATION;
        } finally {
            lock.unlock();
        }
    }

    /** Idempotent. Wakes every waiting consumer so they can drain the queue and terminate. */
    public void markProductionFinished() {
        lock.lock();
        try {
            if (!productionFinished) {
                log.debug("Production finished with {} batches pending", pending.size());
            }
            productionFinished = true;
            batchOrTermination.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Abort the run: pending batches are discarded, consumers receive the termination marker and
     * the producer fails on its next or current push. Only the first cause is kept.
     */
    public void cancel(Throwable cause) {
        lock.lock();
        try {
            if (cancellationCause == null) {
                cancellationCause = cause;
                log.atWarn().setMessage("Cancelling batch queue, discarding {} pending batches")
                    .addArgument(pending.size())
                    .setCause(cause)
                    .log();
                pending.clear();
            }
            notFull.signalAll();
            batchOrTermination.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isProductionFinished() {
        lock.lock();
        try {
            return productionFinished;
        } finally {
            lock.unlock();
        }
    }

    public boolean isCancelled() {
        lock.lock();
        try {
            return cancellationCause != null;
        } finally {
            lock.unlock();
        }
    }

    /** True while a producer is suspended in {@link #push(Batch)} waiting for a free slot. */
    public boolean hasWaitingProducer() {
        lock.lock();
        try {
            return waitingProducers > 0;
        } finally {
            lock.unlock();
        }
    }

    public static class ExtractionCancelledException extends ExtractionException {
        public ExtractionCancelledException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
