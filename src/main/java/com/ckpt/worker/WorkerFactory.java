package com.ckpt.worker;

import com.ckpt.coordination.CoordinatorChannel;
import com.ckpt.log.EventLog;
import com.ckpt.shared.CkptConfig;
import com.ckpt.store.SnapshotStore;
import com.ckpt.strategy.CheckpointStrategy;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import java.util.Set;
import java.util.TreeSet;

@Singleton
public class WorkerFactory {

    private final EventLog eventLog;
    private final SnapshotStore store;
    private final CoordinatorChannel coordinator;
    private final CheckpointStrategy strategy;
    private final WorkerFailureHandler failureHandler;
    private final CkptConfig config;

    @Inject
    public WorkerFactory(EventLog eventLog, SnapshotStore store, CoordinatorChannel coordinator,
                         CheckpointStrategy strategy, WorkerFailureHandler failureHandler, CkptConfig config) {
        this.eventLog = eventLog;
        this.store = store;
        this.coordinator = coordinator;
        this.strategy = strategy;
        this.failureHandler = failureHandler;
        this.config = config;
    }

    public Worker create(String workerId, Set<Integer> partitions, EventProcessor processor) {
        WorkerState state = new WorkerState();
        SnapshotEngine engine = new SnapshotEngine(workerId, strategy.type(), state, store, new StateSerializer(),
                RetryPolicy.from(config), failureHandler, System::currentTimeMillis);
        SnapshotSchedule schedule = strategy.newSchedule(engine, coordinator);
        return new Worker(workerId, partitions, eventLog, processor, state, engine, schedule, coordinator,
                config.getHeartbeatSendIntervalMs());
    }

    public Set<Integer> partitionsFor(int index, int workerCount) {
        if (workerCount <= 0 || index < 0 || index >= workerCount) {
            throw new IllegalArgumentException("Invalid worker index " + index + " of " + workerCount);
        }
        Set<Integer> owned = new TreeSet<>();
        for (int p = index; p < eventLog.partitionCount(); p += workerCount) {
            owned.add(p);
        }
        return owned;
    }
}
