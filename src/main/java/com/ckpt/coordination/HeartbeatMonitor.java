package com.ckpt.coordination;

import com.ckpt.shared.CkptConfig;
import com.ckpt.shared.SnapshotRecord;
import com.ckpt.shared.WorkerLivenessState;
import com.ckpt.shared.WorkerStatus;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

/**
 * Tracks the last heartbeat of every worker. A worker silent for more than
 * half the limit is SUSPECT; silent for strictly more than the limit it is
 * DEAD, and listeners are told once per transition.
 */
@Singleton
public class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final long heartbeatLimitMs;
    private final LongSupplier clock;
    private final Map<String, WorkerLivenessState> workers = new LinkedHashMap<>();
    private final List<LivenessListener> listeners = new CopyOnWriteArrayList<>();

    @Inject
    public HeartbeatMonitor(CkptConfig config) {
        this(config.getHeartbeatLimitMs(), System::currentTimeMillis);
    }

    public HeartbeatMonitor(long heartbeatLimitMs, LongSupplier clock) {
        if (heartbeatLimitMs <= 0) {
            throw new IllegalArgumentException("heartbeatLimitMs must be > 0");
        }
        this.heartbeatLimitMs = heartbeatLimitMs;
        this.clock = clock;
    }

    public void addListener(LivenessListener listener) {
        listeners.add(listener);
    }

    public synchronized void register(String workerId) {
        SnapshotRecord.validateWorkerId(workerId);
        WorkerLivenessState previous = workers.get(workerId);
        if (previous == null) {
            workers.put(workerId, new WorkerLivenessState(workerId, clock.getAsLong(), WorkerStatus.ALIVE));
            log.info("Registered worker {}", workerId);
        }
    }

    public void heartbeat(String workerId) {
        WorkerStatus previous;
        synchronized (this) {
            WorkerLivenessState current = workers.get(workerId);
            if (current == null) {
                register(workerId);
                return;
            }
            previous = current.getStatus();
            workers.put(workerId, current.withHeartbeat(clock.getAsLong()));
        }
        if (previous != WorkerStatus.ALIVE) {
            log.info("Worker {} is alive again (was {})", workerId, previous);
            for (LivenessListener listener : listeners) {
                listener.onWorkerAlive(workerId);
            }
        }
    }

    public synchronized void deregister(String workerId) {
        if (workers.remove(workerId) != null) {
            log.info("Deregistered worker {}", workerId);
        }
    }

    public List<String> scan() {
        List<String> dead = new ArrayList<>();
        synchronized (this) {
            long now = clock.getAsLong();
            for (WorkerLivenessState state : List.copyOf(workers.values())) {
                long silentFor = now - state.getLastHeartbeat();
                if (silentFor > heartbeatLimitMs) {
                    if (state.getStatus() != WorkerStatus.DEAD) {
                        workers.put(state.getWorkerId(), state.withStatus(WorkerStatus.DEAD));
                        dead.add(state.getWorkerId());
                        log.info("Worker {} declared DEAD after {} ms without a heartbeat",
                                state.getWorkerId(), silentFor);
                    }
                } else if (silentFor > heartbeatLimitMs / 2 && state.getStatus() == WorkerStatus.ALIVE) {
                    workers.put(state.getWorkerId(), state.withStatus(WorkerStatus.SUSPECT));
                    log.debug("Worker {} is SUSPECT, silent for {} ms", state.getWorkerId(), silentFor);
                }
            }
        }
        for (String workerId : dead) {
            for (LivenessListener listener : listeners) {
                try {
                    listener.onWorkerDead(workerId);
                } catch (RuntimeException e) {
                    log.error("Liveness listener failed for dead worker {}", workerId, e);
                }
            }
        }
        return dead;
    }

    public synchronized WorkerStatus status(String workerId) {
        WorkerLivenessState state = workers.get(workerId);
        return state == null ? null : state.getStatus();
    }

    public synchronized Set<String> aliveWorkers() {
        Set<String> alive = new TreeSet<>();
        for (WorkerLivenessState state : workers.values()) {
            if (state.getStatus() == WorkerStatus.ALIVE) {
                alive.add(state.getWorkerId());
            }
        }
        return alive;
    }

    public synchronized Map<String, WorkerLivenessState> livenessTable() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(workers));
    }

    public long getHeartbeatLimitMs() {
        return heartbeatLimitMs;
    }
}
