package com.ckpt.worker;

import com.ckpt.coordination.CoordinatorChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;

public class BarrierSchedule implements SnapshotSchedule {

    private static final Logger log = LoggerFactory.getLogger(BarrierSchedule.class);

    private final SnapshotEngine engine;
    private final CoordinatorChannel coordinator;

    public BarrierSchedule(SnapshotEngine engine, CoordinatorChannel coordinator) {
        this.engine = engine;
        this.coordinator = coordinator;
    }

    @Override
    public void start() {
    }

    @Override
    public void onBarrierRequest(long epoch) {
        String workerId = engine.getWorkerId();
        engine.takeSnapshot(SnapshotTrigger.coordinated(epoch)).whenComplete((record, error) -> {
            if (error == null) {
                coordinator.acknowledge(record);
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            log.warn("Worker {} could not snapshot epoch {}: {}", workerId, epoch, cause.getMessage());
            coordinator.reportSnapshotFailure(workerId, epoch, cause.getMessage());
        });
    }

    @Override
    public void stop() {
    }
}
