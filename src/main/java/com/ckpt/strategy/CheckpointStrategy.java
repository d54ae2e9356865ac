package com.ckpt.strategy;

import com.ckpt.compaction.Compactor;
import com.ckpt.coordination.CoordinatorChannel;
import com.ckpt.recovery.RecoveryManager;
import com.ckpt.shared.StrategyType;
import com.ckpt.worker.SnapshotEngine;
import com.ckpt.worker.SnapshotSchedule;

public interface CheckpointStrategy {

    StrategyType type();

    SnapshotSchedule newSchedule(SnapshotEngine engine, CoordinatorChannel coordinator);

    Compactor compactor();

    RecoveryManager recoveryManager();

    default boolean usesEpochs() {
        return type() == StrategyType.COORDINATED;
    }
}
