package com.ckpt.coordination;

import com.ckpt.shared.CkptConfig;
import com.ckpt.shared.EpochStatus;
import com.ckpt.shared.ManifestEntry;
import com.ckpt.shared.SnapshotRecord;
import com.ckpt.shared.StrategyType;
import com.ckpt.store.ManifestStore;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

/**
 * Drives coordinated epochs. One epoch is in flight at a time: it asks every
 * ALIVE worker for a snapshot and completes once each of them has either
 * acknowledged or been declared DEAD. A completed epoch is published to the
 * manifest before listeners hear about it.
 */
@Singleton
public class EpochManager implements LivenessListener {

    private static final Logger log = LoggerFactory.getLogger(EpochManager.class);

    private final ManifestStore manifestStore;
    private final HeartbeatMonitor monitor;
    private final long stallWarnMs;
    private final LongSupplier clock;
    private final Map<String, WorkerChannel> channels = new LinkedHashMap<>();
    private final List<EpochListener> listeners = new CopyOnWriteArrayList<>();

    private EpochState state = EpochState.IDLE;
    private long currentEpoch = -1;
    private long startedAt;
    private Set<String> required = new TreeSet<>();
    private final Set<String> pending = new TreeSet<>();
    private final Map<String, SnapshotRecord> acks = new LinkedHashMap<>();

    @Inject
    public EpochManager(ManifestStore manifestStore, HeartbeatMonitor monitor, CkptConfig config) {
        this(manifestStore, monitor, config.getEpochStallWarnMs(), System::currentTimeMillis);
    }

    public EpochManager(ManifestStore manifestStore, HeartbeatMonitor monitor, long stallWarnMs, LongSupplier clock) {
        this.manifestStore = manifestStore;
        this.monitor = monitor;
        this.stallWarnMs = stallWarnMs;
        this.clock = clock;
    }

    public void addListener(EpochListener listener) {
        listeners.add(listener);
    }

    public synchronized void registerChannel(WorkerChannel channel) {
        channels.put(channel.getWorkerId(), channel);
    }

    public void removeChannel(String workerId) {
        synchronized (this) {
            channels.remove(workerId);
        }
        onWorkerDead(workerId);
    }

    // Empty when an epoch is already in flight or no registered worker is ALIVE
    public OptionalLong triggerEpoch() {
        long epoch;
        List<WorkerChannel> targets = new ArrayList<>();
        synchronized (this) {
            if (state.isInFlight()) {
                warnIfStalled();
                return OptionalLong.empty();
            }
            Set<String> alive = monitor.aliveWorkers();
            alive.retainAll(channels.keySet());
            if (alive.isEmpty()) {
                log.debug("No ALIVE workers, skipping epoch");
                return OptionalLong.empty();
            }
            epoch = manifestStore.reserveNextEpoch();
            currentEpoch = epoch;
            startedAt = clock.getAsLong();
            required = new TreeSet<>(alive);
            pending.clear();
            pending.addAll(alive);
            acks.clear();
            state = EpochState.SNAPSHOT_REQUESTED;
            for (String workerId : alive) {
                targets.add(channels.get(workerId));
            }
        }

        log.info("Epoch {} started, waiting on {}", epoch, targets.size());
        for (WorkerChannel channel : targets) {
            try {
                channel.requestSnapshot(epoch);
            } catch (RuntimeException e) {
                log.warn("Failed to send barrier for epoch {} to {}: {}", epoch, channel.getWorkerId(), e.getMessage());
            }
        }

        synchronized (this) {
            if (state == EpochState.SNAPSHOT_REQUESTED && currentEpoch == epoch) {
                state = EpochState.COLLECTING_ACKS;
            }
        }
        return OptionalLong.of(epoch);
    }

    public boolean acknowledge(SnapshotRecord record) {
        ManifestEntry completed;
        synchronized (this) {
            if (!state.isInFlight() || record.getStrategy() != StrategyType.COORDINATED
                    || record.getGeneration() != currentEpoch || !required.contains(record.getWorkerId())) {
                log.debug("Ignoring ack {} (epoch {} is {})", record, currentEpoch, state);
                return false;
            }
            acks.put(record.getWorkerId(), record);
            pending.remove(record.getWorkerId());
            completed = completeIfSettled();
        }
        notifyListeners(completed);
        return true;
    }

    @Override
    public void onWorkerDead(String workerId) {
        ManifestEntry completed;
        synchronized (this) {
            if (!state.isInFlight() || !pending.remove(workerId)) {
                return;
            }
            log.info("Epoch {} no longer waits on {}", currentEpoch, workerId);
            completed = completeIfSettled();
        }
        notifyListeners(completed);
    }

    public void reportFailure(String workerId, long epoch, String reason) {
        log.warn("Worker {} failed to snapshot epoch {}: {}", workerId, epoch, reason);
    }

    private ManifestEntry completeIfSettled() {
        if (!pending.isEmpty()) {
            return null;
        }
        if (acks.isEmpty()) {
            state = EpochState.INCOMPLETE;
            log.warn("Epoch {} abandoned, every required worker died before acknowledging", currentEpoch);
            ManifestEntry abandoned = new ManifestEntry(currentEpoch, EpochStatus.INCOMPLETE, clock.getAsLong(), List.of());
            try {
                manifestStore.publish(abandoned);
            } catch (RuntimeException e) {
                log.error("Failed to record abandoned epoch {}", currentEpoch, e);
            }
            return abandoned;
        }
        ManifestEntry entry = new ManifestEntry(currentEpoch, EpochStatus.COMPLETE, clock.getAsLong(), acks.values());
        try {
            manifestStore.publish(entry);
        } catch (RuntimeException e) {
            state = EpochState.INCOMPLETE;
            log.error("Failed to publish epoch {}, abandoning it", currentEpoch, e);
            return new ManifestEntry(currentEpoch, EpochStatus.INCOMPLETE, entry.getCreatedAt(), List.of());
        }
        state = EpochState.COMPLETE;
        log.info("Epoch {} complete with {} of {} required workers in {} ms", currentEpoch, acks.size(),
                required.size(), entry.getCreatedAt() - startedAt);
        return entry;
    }

    private void notifyListeners(ManifestEntry settled) {
        if (settled == null) {
            return;
        }
        for (EpochListener listener : listeners) {
            try {
                if (settled.isComplete()) {
                    listener.onEpochComplete(settled);
                } else {
                    listener.onEpochAbandoned(settled.getEpoch());
                }
            } catch (RuntimeException e) {
                log.error("Epoch listener failed for epoch {}", settled.getEpoch(), e);
            }
        }
    }

    private void warnIfStalled() {
        long stalled = stalledForMillis();
        if (stalled > stallWarnMs) {
            log.warn("Epoch {} stalled for {} ms, still waiting on {}", currentEpoch, stalled, pending);
        }
    }

    public synchronized long stalledForMillis() {
        return state.isInFlight() ? clock.getAsLong() - startedAt : 0;
    }

    public synchronized EpochState state() {
        return state;
    }

    public synchronized long currentEpoch() {
        return currentEpoch;
    }

    public synchronized Set<String> requiredWorkers() {
        return Set.copyOf(required);
    }

    public synchronized Set<String> pendingWorkers() {
        return Set.copyOf(pending);
    }

    public synchronized Set<String> acknowledgedWorkers() {
        return Set.copyOf(acks.keySet());
    }
}
