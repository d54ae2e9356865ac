package com.ckpt.worker;

import com.ckpt.shared.StrategyType;

public final class SnapshotTrigger {

    private static final SnapshotTrigger LOCAL_TIMER = new SnapshotTrigger(StrategyType.UNCOORDINATED, -1);

    private final StrategyType kind;
    private final long epoch;

    private SnapshotTrigger(StrategyType kind, long epoch) {
        this.kind = kind;
        this.epoch = epoch;
    }

    public static SnapshotTrigger coordinated(long epoch) {
        if (epoch <= 0) {
            throw new IllegalArgumentException("epoch must be > 0, got " + epoch);
        }
        return new SnapshotTrigger(StrategyType.COORDINATED, epoch);
    }

    public static SnapshotTrigger localTimer() {
        return LOCAL_TIMER;
    }

    public StrategyType getKind() {
        return kind;
    }

    public boolean isCoordinated() {
        return kind == StrategyType.COORDINATED;
    }

    public long getEpoch() {
        if (!isCoordinated()) {
            throw new IllegalStateException("Local timer triggers carry no epoch");
        }
        return epoch;
    }

    @Override
    public String toString() {
        return isCoordinated() ? "coordinated(epoch=" + epoch + ")" : "localTimer";
    }
}
