package com.ckpt.worker;

import com.ckpt.shared.SnapshotRecord;
import com.ckpt.shared.StrategyType;
import com.ckpt.store.SnapshotKeys;
import com.ckpt.store.SnapshotStore;
import com.ckpt.store.SnapshotStoreException;
import com.ckpt.store.StorageWriteException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Takes and restores snapshots for one worker. The state image is captured on
 * the caller's thread; serialization and the two store writes (image first,
 * then the record that points at it) run on a single writer thread, so the
 * worker's records land in a total order.
 */
public class SnapshotEngine {

    private static final Logger log = LoggerFactory.getLogger(SnapshotEngine.class);

    private final String workerId;
    private final StrategyType strategy;
    private final WorkerState state;
    private final SnapshotStore store;
    private final StateSerializer serializer;
    private final RetryPolicy retryPolicy;
    private final List<WorkerFailureHandler> failureHandlers = new CopyOnWriteArrayList<>();
    private final LongSupplier clock;
    private final ExecutorService writer;
    private final AtomicInteger pending = new AtomicInteger(0);

    private volatile long lastSequence;
    private volatile boolean sequenceSeeded;
    private volatile SnapshotRecord lastRecord;

    public SnapshotEngine(String workerId, StrategyType strategy, WorkerState state, SnapshotStore store,
                          StateSerializer serializer, RetryPolicy retryPolicy,
                          WorkerFailureHandler failureHandler, LongSupplier clock) {
        this.workerId = SnapshotRecord.validateWorkerId(workerId);
        this.strategy = strategy;
        this.state = state;
        this.store = store;
        this.serializer = serializer;
        this.retryPolicy = retryPolicy;
        this.failureHandlers.add(failureHandler);
        this.clock = clock;
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ckpt-writer-" + workerId);
            t.setDaemon(true);
            return t;
        });
    }

    // A local trigger is rejected while another snapshot is being written; barriers queue behind it
    public CompletableFuture<SnapshotRecord> takeSnapshot(SnapshotTrigger trigger) {
        if (trigger.isCoordinated()) {
            if (strategy != StrategyType.COORDINATED) {
                throw new IllegalArgumentException("Worker " + workerId + " runs " + strategy +
                        " and cannot serve " + trigger);
            }
            pending.incrementAndGet();
        } else if (!pending.compareAndSet(0, 1)) {
            throw new SnapshotInProgressException(workerId);
        }

        long startedAt = clock.getAsLong();
        StateImage image = state.capture(startedAt);
        CompletableFuture<SnapshotRecord> result = new CompletableFuture<>();
        try {
            writer.execute(() -> write(trigger, image, startedAt, result));
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            result.completeExceptionally(new IllegalStateException("Snapshot engine for " + workerId + " is shut down", e));
        }
        return result;
    }

    private void write(SnapshotTrigger trigger, StateImage image, long startedAt,
                       CompletableFuture<SnapshotRecord> result) {
        try {
            seedSequence();
            long generation = trigger.isCoordinated() ? trigger.getEpoch() : lastSequence + 1;
            byte[] bytes;
            try {
                bytes = serializer.serialize(image);
            } catch (SerializationException e) {
                log.error("Worker {} failed to serialize its state for {}", workerId, trigger, e);
                for (WorkerFailureHandler handler : failureHandlers) {
                    handler.onFatalError(workerId, e);
                }
                result.completeExceptionally(e);
                return;
            }

            String imageKey = SnapshotKeys.imageKey(strategy, workerId, generation);
            putWithRetry(imageKey, bytes);
            SnapshotRecord record = new SnapshotRecord(workerId, strategy, generation, clock.getAsLong(),
                    imageKey, bytes.length, Checksums.crc32c(bytes), image.getOffsets());
            putWithRetry(SnapshotKeys.recordKey(strategy, workerId, generation),
                    record.encode().getBytes(StandardCharsets.UTF_8));

            lastSequence = Math.max(lastSequence, generation);
            lastRecord = record;
            log.info("Worker {} wrote snapshot {} ({} bytes) in {} ms", workerId, generation, bytes.length,
                    clock.getAsLong() - startedAt);
            result.complete(record);
        } catch (StorageWriteException e) {
            log.warn("Worker {} gave up writing snapshot for {} after {} attempts; keeping sequence {}",
                    workerId, trigger, e.getAttempts(), lastSequence, e);
            result.completeExceptionally(e);
        } catch (RuntimeException e) {
            log.error("Worker {} failed snapshot for {}", workerId, trigger, e);
            result.completeExceptionally(e);
        } finally {
            pending.decrementAndGet();
        }
    }

    // A restarted worker continues after the highest generation it ever wrote
    private void seedSequence() {
        if (sequenceSeeded) {
            return;
        }
        long highest = 0;
        for (String key : store.list(SnapshotKeys.recordPrefix(strategy, workerId))) {
            highest = Math.max(highest, SnapshotKeys.generationOf(key));
        }
        lastSequence = Math.max(lastSequence, highest);
        sequenceSeeded = true;
        if (highest > 0) {
            log.info("Worker {} resumes its snapshot sequence after {}", workerId, highest);
        }
    }

    private void putWithRetry(String key, byte[] bytes) {
        SnapshotStoreException lastFailure = null;
        for (int attempt = 1; attempt <= retryPolicy.getMaxAttempts(); attempt++) {
            try {
                store.put(key, bytes);
                return;
            } catch (SnapshotStoreException e) {
                lastFailure = e;
                log.debug("Attempt {} to write {} failed: {}", attempt, key, e.getMessage());
            }
            if (attempt < retryPolicy.getMaxAttempts()) {
                try {
                    Thread.sleep(retryPolicy.backoffFor(attempt));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StorageWriteException(key, attempt, e);
                }
            }
        }
        throw new StorageWriteException(key, retryPolicy.getMaxAttempts(), lastFailure);
    }

    public StateImage restore(SnapshotRecord record) {
        byte[] bytes = store.get(record.getStorageKey());
        if (bytes.length != record.getSize()) {
            throw new SnapshotCorruptedException("Image " + record.getStorageKey() + " has " + bytes.length +
                    " bytes, record says " + record.getSize());
        }
        long checksum = Checksums.crc32c(bytes);
        if (checksum != record.getChecksum()) {
            throw new SnapshotCorruptedException("Image " + record.getStorageKey() + " checksum " + checksum +
                    " does not match record checksum " + record.getChecksum());
        }
        StateImage image = serializer.deserialize(bytes);
        state.install(image);
        lastSequence = Math.max(lastSequence, record.getGeneration());
        lastRecord = record;
        log.info("Worker {} restored snapshot {} with offsets {}", workerId, record.getGeneration(),
                image.getOffsets());
        return image;
    }

    public void addFailureHandler(WorkerFailureHandler handler) {
        failureHandlers.add(handler);
    }

    public boolean isSnapshotInProgress() {
        return pending.get() > 0;
    }

    public long lastSequence() {
        return lastSequence;
    }

    public SnapshotRecord lastRecord() {
        return lastRecord;
    }

    public String getWorkerId() {
        return workerId;
    }

    public StrategyType getStrategy() {
        return strategy;
    }

    public void shutdown() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
