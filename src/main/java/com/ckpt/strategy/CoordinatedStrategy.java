package com.ckpt.strategy;

import com.ckpt.compaction.Compactor;
import com.ckpt.compaction.CoordinatedCompactor;
import com.ckpt.coordination.CoordinatorChannel;
import com.ckpt.recovery.CoordinatedRecoveryManager;
import com.ckpt.recovery.RecoveryManager;
import com.ckpt.shared.StrategyType;
import com.ckpt.worker.BarrierSchedule;
import com.ckpt.worker.SnapshotEngine;
import com.ckpt.worker.SnapshotSchedule;

import com.google.inject.Inject;
import com.google.inject.Singleton;

@Singleton
public class CoordinatedStrategy implements CheckpointStrategy {

    private final CoordinatedCompactor compactor;
    private final CoordinatedRecoveryManager recoveryManager;

    @Inject
    public CoordinatedStrategy(CoordinatedCompactor compactor, CoordinatedRecoveryManager recoveryManager) {
        this.compactor = compactor;
        this.recoveryManager = recoveryManager;
    }

    @Override
    public StrategyType type() {
        return StrategyType.COORDINATED;
    }

    @Override
    public SnapshotSchedule newSchedule(SnapshotEngine engine, CoordinatorChannel coordinator) {
        return new BarrierSchedule(engine, coordinator);
    }

    @Override
    public Compactor compactor() {
        return compactor;
    }

    @Override
    public RecoveryManager recoveryManager() {
        return recoveryManager;
    }
}
