package com.ckpt.strategy;

import com.ckpt.compaction.Compactor;
import com.ckpt.compaction.UncoordinatedCompactor;
import com.ckpt.coordination.CoordinatorChannel;
import com.ckpt.recovery.RecoveryManager;
import com.ckpt.recovery.UncoordinatedRecoveryManager;
import com.ckpt.shared.CkptConfig;
import com.ckpt.shared.StrategyType;
import com.ckpt.worker.LocalTimerSchedule;
import com.ckpt.worker.SnapshotEngine;
import com.ckpt.worker.SnapshotSchedule;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import java.util.concurrent.TimeUnit;

@Singleton
public class UncoordinatedStrategy implements CheckpointStrategy {

    private final UncoordinatedCompactor compactor;
    private final UncoordinatedRecoveryManager recoveryManager;
    private final long snapshotIntervalMs;

    @Inject
    public UncoordinatedStrategy(UncoordinatedCompactor compactor, UncoordinatedRecoveryManager recoveryManager,
                                 CkptConfig config) {
        this(compactor, recoveryManager, TimeUnit.SECONDS.toMillis(config.getSnapshotFrequencySeconds()));
    }

    public UncoordinatedStrategy(UncoordinatedCompactor compactor, UncoordinatedRecoveryManager recoveryManager,
                                 long snapshotIntervalMs) {
        this.compactor = compactor;
        this.recoveryManager = recoveryManager;
        this.snapshotIntervalMs = snapshotIntervalMs;
    }

    @Override
    public StrategyType type() {
        return StrategyType.UNCOORDINATED;
    }

    @Override
    public SnapshotSchedule newSchedule(SnapshotEngine engine, CoordinatorChannel coordinator) {
        return new LocalTimerSchedule(engine, coordinator, snapshotIntervalMs);
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
