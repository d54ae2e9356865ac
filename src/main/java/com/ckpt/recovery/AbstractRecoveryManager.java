package com.ckpt.recovery;

import com.ckpt.coordination.WorkerChannel;
import com.ckpt.store.SnapshotStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public abstract class AbstractRecoveryManager implements RecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(AbstractRecoveryManager.class);

    protected final SnapshotStore store;
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    protected AbstractRecoveryManager(SnapshotStore store) {
        this.store = store;
    }

    @Override
    public WorkerRecoveryPlan planFor(String workerId) {
        return selectRecoveryPoint().planFor(workerId);
    }

    @Override
    public RecoveryPoint recover(Collection<? extends WorkerChannel> channels) {
        RecoveryPoint point = selectRecoveryPoint();
        log.info("Recovering {} workers to {}", channels.size(), point);
        for (WorkerChannel channel : channels) {
            deliver(channel, point.planFor(channel.getWorkerId()));
        }
        return point;
    }

    @Override
    public WorkerRecoveryPlan recover(WorkerChannel channel) {
        WorkerRecoveryPlan plan = planFor(channel.getWorkerId());
        deliver(channel, plan);
        return plan;
    }

    private void deliver(WorkerChannel channel, WorkerRecoveryPlan plan) {
        channel.restore(plan);
        pending.remove(channel.getWorkerId());
        log.info("Worker {} restored: {}", channel.getWorkerId(), plan);
    }

    @Override
    public void markForRecovery(String workerId) {
        if (pending.add(workerId)) {
            log.info("Worker {} marked for recovery", workerId);
        }
    }

    @Override
    public boolean needsRecovery(String workerId) {
        return pending.contains(workerId);
    }

    @Override
    public Set<String> pendingRecovery() {
        return Set.copyOf(pending);
    }

    protected boolean exists(String key) {
        return store.list(key).contains(key);
    }
}
