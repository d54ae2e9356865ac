package com.ckpt.worker;

import com.ckpt.coordination.CoordinatorChannel;
import com.ckpt.coordination.WorkerChannel;
import com.ckpt.log.EventLog;
import com.ckpt.log.LogEvent;
import com.ckpt.recovery.WorkerRecoveryPlan;
import com.ckpt.shared.CheckpointException;
import com.ckpt.shared.SnapshotRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

public class Worker implements WorkerChannel {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);
    private static final long POLL_TIMEOUT_MS = 200;

    private final String workerId;
    private final Set<Integer> partitions;
    private final EventLog eventLog;
    private final EventProcessor processor;
    private final WorkerState state;
    private final SnapshotEngine engine;
    private final SnapshotSchedule schedule;
    private final CoordinatorChannel coordinator;
    private final long heartbeatIntervalMs;
    private final Map<Integer, AtomicBoolean> activePartitions = new ConcurrentHashMap<>();
    private final Map<Integer, Thread> partitionThreads = new ConcurrentHashMap<>();
    private final AtomicInteger eventsProcessed = new AtomicInteger(0);
    private ScheduledExecutorService heartbeats;
    private volatile boolean running;

    public Worker(String workerId, Set<Integer> partitions, EventLog eventLog, EventProcessor processor,
                  WorkerState state, SnapshotEngine engine, SnapshotSchedule schedule,
                  CoordinatorChannel coordinator, long heartbeatIntervalMs) {
        this.workerId = SnapshotRecord.validateWorkerId(workerId);
        this.partitions = new TreeSet<>(partitions);
        this.eventLog = eventLog;
        this.processor = processor;
        this.state = state;
        this.engine = engine;
        this.schedule = schedule;
        this.coordinator = coordinator;
        this.heartbeatIntervalMs = heartbeatIntervalMs;
        engine.addFailureHandler((id, cause) -> haltAfterFatalError(cause));
    }

    @Override
    public String getWorkerId() {
        return workerId;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        coordinator.register(workerId, this);
        heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ckpt-heartbeat-" + workerId);
            t.setDaemon(true);
            return t;
        });
        heartbeats.scheduleAtFixedRate(this::sendHeartbeat, 0, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
        startProcessing();
        schedule.start();
        log.info("Worker {} started on partitions {}", workerId, partitions);
    }

    public void stop() {
        if (halt()) {
            coordinator.deregister(workerId);
            log.info("Worker {} stopped after {} events", workerId, eventsProcessed.get());
        }
    }

    // Like a process crash: no deregistration, so the monitor eventually declares the worker DEAD
    public void crash() {
        if (halt()) {
            log.warn("Worker {} halted without deregistering", workerId);
        }
    }

    // Runs on the snapshot writer thread, which halt() waits for, so the halt is handed off
    private void haltAfterFatalError(Throwable cause) {
        Thread halter = new Thread(() -> {
            if (halt()) {
                log.error("Worker {} halted after a fatal error; heartbeats stopped", workerId, cause);
            }
        }, "ckpt-halt-" + workerId);
        halter.setDaemon(true);
        halter.start();
    }

    private synchronized boolean halt() {
        if (!running) {
            return false;
        }
        running = false;
        schedule.stop();
        heartbeats.shutdownNow();
        stopProcessing();
        engine.shutdown();
        return true;
    }

    @Override
    public void requestSnapshot(long epoch) {
        if (!running) {
            log.debug("Worker {} is not running, ignoring barrier for epoch {}", workerId, epoch);
            return;
        }
        schedule.onBarrierRequest(epoch);
    }

    @Override
    public synchronized void restore(WorkerRecoveryPlan plan) {
        if (!plan.getWorkerId().equals(workerId)) {
            throw new IllegalArgumentException("Plan for " + plan.getWorkerId() + " sent to " + workerId);
        }
        boolean wasProcessing = !partitionThreads.isEmpty();
        stopProcessing();
        try {
            if (plan.isFresh()) {
                state.install(StateImage.empty());
                log.info("Worker {} restarting from an empty state", workerId);
            } else {
                engine.restore(plan.getRecord().get());
            }
        } catch (CheckpointException e) {
            log.error("Worker {} failed to restore {}", workerId, plan, e);
            throw e;
        }
        if (wasProcessing && running) {
            startProcessing();
        }
    }

    public SnapshotEngine getEngine() {
        return engine;
    }

    public WorkerState getState() {
        return state;
    }

    public Set<Integer> getPartitions() {
        return partitions;
    }

    public int getEventsProcessed() {
        return eventsProcessed.get();
    }

    public boolean isRunning() {
        return running;
    }

    private void sendHeartbeat() {
        try {
            coordinator.heartbeat(workerId);
        } catch (RuntimeException e) {
            log.warn("Worker {} failed to send heartbeat: {}", workerId, e.getMessage());
        }
    }

    private void startProcessing() {
        for (int partitionId : partitions) {
            AtomicBoolean active = new AtomicBoolean(true);
            activePartitions.put(partitionId, active);
            Thread thread = new Thread(
                    () -> processLoop(partitionId, active),
                    "ckpt-worker-" + workerId + "-p" + partitionId
            );
            thread.setDaemon(true);
            partitionThreads.put(partitionId, thread);
            thread.start();
        }
    }

    private void stopProcessing() {
        for (AtomicBoolean active : activePartitions.values()) {
            active.set(false);
        }
        for (int partitionId : Set.copyOf(partitionThreads.keySet())) {
            Thread thread = partitionThreads.remove(partitionId);
            if (thread != null) {
                thread.interrupt();
                try {
                    thread.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        activePartitions.clear();
    }

    private void processLoop(int partitionId, AtomicBoolean active) {
        while (active.get()) {
            try {
                LogEvent event = eventLog.poll(partitionId, state.offsetFor(partitionId),
                        POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (event == null || !active.get()) {
                    continue;
                }
                state.apply(event, processor);
                eventsProcessed.incrementAndGet();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
