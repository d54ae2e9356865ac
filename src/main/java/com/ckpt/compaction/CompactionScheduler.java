package com.ckpt.compaction;

import com.ckpt.shared.CkptConfig;
import com.ckpt.strategy.CheckpointStrategy;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

// Fixed-delay runs plus on-demand ones after each epoch; queued requests are folded together
@Singleton
public class CompactionScheduler {

    private static final Logger log = LoggerFactory.getLogger(CompactionScheduler.class);

    private final Compactor compactor;
    private final long intervalMs;
    private final AtomicBoolean runQueued = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;
    private volatile CompactionReport lastReport = CompactionReport.empty();

    @Inject
    public CompactionScheduler(CheckpointStrategy strategy, CkptConfig config) {
        this(strategy.compactor(), TimeUnit.SECONDS.toMillis(config.getCompactionIntervalSeconds()));
    }

    public CompactionScheduler(Compactor compactor, long intervalMs) {
        this.compactor = compactor;
        this.intervalMs = intervalMs;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ckpt-compactor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void requestRun() {
        if (scheduler == null || scheduler.isShutdown()) {
            return;
        }
        if (runQueued.compareAndSet(false, true)) {
            scheduler.execute(() -> {
                runQueued.set(false);
                runOnce();
            });
        }
    }

    CompactionReport runOnce() {
        try {
            lastReport = compactor.compact();
        } catch (RuntimeException e) {
            log.warn("Compaction run failed, will retry on the next run", e);
        }
        return lastReport;
    }

    public CompactionReport getLastReport() {
        return lastReport;
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduler.shutdownNow();
            }
        }
    }
}
