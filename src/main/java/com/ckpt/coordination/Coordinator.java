package com.ckpt.coordination;

import com.ckpt.compaction.CompactionScheduler;
import com.ckpt.recovery.RecoveryManager;
import com.ckpt.recovery.RecoveryPoint;
import com.ckpt.shared.CkptConfig;
import com.ckpt.shared.ManifestEntry;
import com.ckpt.shared.SnapshotRecord;
import com.ckpt.store.ManifestStore;
import com.ckpt.strategy.CheckpointStrategy;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Cluster-side half of checkpointing. Every inbound message, heartbeat scan
 * and epoch tick runs as a task on the single {@code ckpt-coordinator} thread,
 * so liveness and epoch state are only ever touched from there.
 */
@Singleton
public class Coordinator implements CoordinatorChannel {

    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private final CkptConfig config;
    private final HeartbeatMonitor monitor;
    private final EpochManager epochManager;
    private final ManifestStore manifestStore;
    private final CheckpointStrategy strategy;
    private final CompactionScheduler compactionScheduler;
    private final Map<String, WorkerChannel> channels = new LinkedHashMap<>();
    private final Map<String, SnapshotRecord> localSnapshots = new LinkedHashMap<>();
    private final ScheduledExecutorService executor;
    private boolean started;

    @Inject
    public Coordinator(CkptConfig config, HeartbeatMonitor monitor, EpochManager epochManager,
                       ManifestStore manifestStore, CheckpointStrategy strategy,
                       CompactionScheduler compactionScheduler) {
        this.config = config;
        this.monitor = monitor;
        this.epochManager = epochManager;
        this.manifestStore = manifestStore;
        this.strategy = strategy;
        this.compactionScheduler = compactionScheduler;
        this.executor = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "ckpt-coordinator");
            t.setDaemon(true);
            return t;
        });
        monitor.addListener(new LivenessListener() {
            @Override
            public void onWorkerDead(String workerId) {
                epochManager.onWorkerDead(workerId);
                strategy.recoveryManager().markForRecovery(workerId);
            }

            @Override
            public void onWorkerAlive(String workerId) {
                restoreIfPending(workerId);
            }
        });
        epochManager.addListener(new EpochListener() {
            @Override
            public void onEpochComplete(ManifestEntry entry) {
                compactionScheduler.requestRun();
            }
        });
    }

    public boolean initializeStore() {
        manifestStore.load();
        return manifestStore.initialize();
    }

    // Throws RecoveryInconsistencyException when the store holds no usable state
    public synchronized RecoveryPoint start() {
        if (started) {
            throw new IllegalStateException("Coordinator already started");
        }
        manifestStore.load();
        RecoveryPoint point = strategy.recoveryManager().selectRecoveryPoint();
        log.info("Starting {} coordinator at {}", strategy.type(), point);

        executor.scheduleAtFixedRate(guarded("heartbeat scan", monitor::scan),
                config.getHeartbeatCheckIntervalMs(), config.getHeartbeatCheckIntervalMs(), TimeUnit.MILLISECONDS);
        if (strategy.usesEpochs()) {
            long periodMs = TimeUnit.SECONDS.toMillis(config.getSnapshotFrequencySeconds());
            executor.scheduleAtFixedRate(guarded("epoch tick", epochManager::triggerEpoch),
                    periodMs, periodMs, TimeUnit.MILLISECONDS);
        }
        compactionScheduler.start();
        started = true;
        return point;
    }

    public synchronized void stop() {
        compactionScheduler.stop();
        executor.shutdown();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @Override
    public void register(String workerId, WorkerChannel channel) {
        submit("register " + workerId, () -> {
            channels.put(workerId, channel);
            epochManager.registerChannel(channel);
            monitor.heartbeat(workerId);
        });
    }

    @Override
    public void heartbeat(String workerId) {
        submit("heartbeat " + workerId, () -> monitor.heartbeat(workerId));
    }

    @Override
    public void acknowledge(SnapshotRecord record) {
        submit("ack " + record.getWorkerId(), () -> epochManager.acknowledge(record));
    }

    @Override
    public void reportSnapshotFailure(String workerId, long epoch, String reason) {
        submit("failure " + workerId, () -> epochManager.reportFailure(workerId, epoch, reason));
    }

    @Override
    public void reportLocalSnapshot(SnapshotRecord record) {
        submit("local snapshot " + record.getWorkerId(), () -> {
            localSnapshots.put(record.getWorkerId(), record);
            log.debug("Worker {} reported local snapshot {}", record.getWorkerId(), record.getGeneration());
        });
    }

    @Override
    public void deregister(String workerId) {
        submit("deregister " + workerId, () -> {
            channels.remove(workerId);
            monitor.deregister(workerId);
            epochManager.removeChannel(workerId);
        });
    }

    public OptionalLong triggerEpoch() {
        return call(epochManager::triggerEpoch);
    }

    public RecoveryPoint recoverAll() {
        return call(() -> strategy.recoveryManager().recover(new ArrayList<>(channels.values())));
    }

    public RecoveryPoint recoveryPoint() {
        return strategy.recoveryManager().selectRecoveryPoint();
    }

    // Waits until every message submitted before this call has been handled
    public void flush() {
        call(() -> null);
    }

    public Map<String, SnapshotRecord> latestLocalSnapshots() {
        return call(() -> Map.copyOf(localSnapshots));
    }

    public List<String> registeredWorkers() {
        return call(() -> List.copyOf(channels.keySet()));
    }

    public HeartbeatMonitor getHeartbeatMonitor() {
        return monitor;
    }

    public EpochManager getEpochManager() {
        return epochManager;
    }

    public ManifestStore getManifestStore() {
        return manifestStore;
    }

    public CheckpointStrategy getStrategy() {
        return strategy;
    }

    private void restoreIfPending(String workerId) {
        RecoveryManager recoveryManager = strategy.recoveryManager();
        WorkerChannel channel = channels.get(workerId);
        if (channel == null || !recoveryManager.needsRecovery(workerId)) {
            return;
        }
        try {
            recoveryManager.recover(channel);
        } catch (RuntimeException e) {
            log.error("Failed to restore reconnected worker {}", workerId, e);
        }
    }

    private Runnable guarded(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Coordinator task '{}' failed", name, e);
            }
        };
    }

    private void submit(String name, Runnable task) {
        try {
            executor.execute(guarded(name, task));
        } catch (RejectedExecutionException e) {
            log.debug("Coordinator stopped, dropping {}", name);
        }
    }

    private <T> T call(Callable<T> task) {
        try {
            Future<T> future = executor.submit(task);
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for the coordinator", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Coordinator task failed", e.getCause());
        }
    }
}
