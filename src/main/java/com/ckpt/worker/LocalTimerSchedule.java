package com.ckpt.worker;

import com.ckpt.coordination.CoordinatorChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

// Reports to the coordinator go through a separate thread, best effort
public class LocalTimerSchedule implements SnapshotSchedule {

    private static final Logger log = LoggerFactory.getLogger(LocalTimerSchedule.class);

    private final SnapshotEngine engine;
    private final CoordinatorChannel coordinator;
    private final long intervalMs;
    private volatile ScheduledExecutorService timer;
    private volatile ExecutorService notifier;

    public LocalTimerSchedule(SnapshotEngine engine, CoordinatorChannel coordinator, long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.engine = engine;
        this.coordinator = coordinator;
        this.intervalMs = intervalMs;
    }

    @Override
    public synchronized void start() {
        String workerId = engine.getWorkerId();
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ckpt-timer-" + workerId);
            t.setDaemon(true);
            return t;
        });
        notifier = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ckpt-notify-" + workerId);
            t.setDaemon(true);
            return t;
        });
        timer.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    void tick() {
        if (engine.isSnapshotInProgress()) {
            log.debug("Worker {} skips timer tick, snapshot still in progress", engine.getWorkerId());
            return;
        }
        try {
            engine.takeSnapshot(SnapshotTrigger.localTimer()).thenAccept(record -> {
                ExecutorService target = notifier;
                if (target == null || target.isShutdown()) {
                    return;
                }
                target.execute(() -> {
                    try {
                        coordinator.reportLocalSnapshot(record);
                    } catch (RuntimeException e) {
                        log.debug("Worker {} could not report snapshot {}: {}", record.getWorkerId(),
                                record.getGeneration(), e.getMessage());
                    }
                });
            });
        } catch (SnapshotInProgressException e) {
            log.debug("Worker {} skips timer tick: {}", engine.getWorkerId(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Worker {} timer tick failed", engine.getWorkerId(), e);
        }
    }

    @Override
    public void onBarrierRequest(long epoch) {
        log.warn("Worker {} runs uncoordinated, ignoring barrier request for epoch {}",
                engine.getWorkerId(), epoch);
    }

    @Override
    public synchronized void stop() {
        if (timer != null) {
            timer.shutdownNow();
        }
        if (notifier != null) {
            notifier.shutdownNow();
        }
    }
}
