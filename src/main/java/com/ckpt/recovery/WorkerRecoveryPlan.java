package com.ckpt.recovery;

import com.ckpt.shared.SnapshotRecord;

import java.util.Map;
import java.util.Optional;

public final class WorkerRecoveryPlan {

    private final String workerId;
    private final SnapshotRecord record;

    private WorkerRecoveryPlan(String workerId, SnapshotRecord record) {
        this.workerId = SnapshotRecord.validateWorkerId(workerId);
        this.record = record;
    }

    public static WorkerRecoveryPlan from(SnapshotRecord record) {
        return new WorkerRecoveryPlan(record.getWorkerId(), record);
    }

    public static WorkerRecoveryPlan fresh(String workerId) {
        return new WorkerRecoveryPlan(workerId, null);
    }

    public String getWorkerId() {
        return workerId;
    }

    public boolean isFresh() {
        return record == null;
    }

    public Optional<SnapshotRecord> getRecord() {
        return Optional.ofNullable(record);
    }

    public Map<Integer, Long> getReplayOffsets() {
        return record == null ? Map.of() : record.getOffsets();
    }

    @Override
    public String toString() {
        return isFresh() ? "WorkerRecoveryPlan{" + workerId + ", fresh}"
                : "WorkerRecoveryPlan{" + workerId + ", generation=" + record.getGeneration() +
                ", offsets=" + record.getOffsets() + "}";
    }
}
