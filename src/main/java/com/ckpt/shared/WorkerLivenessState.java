package com.ckpt.shared;

public final class WorkerLivenessState {

    private final String workerId;
    private final long lastHeartbeat;
    private final WorkerStatus status;

    public WorkerLivenessState(String workerId, long lastHeartbeat, WorkerStatus status) {
        this.workerId = workerId;
        this.lastHeartbeat = lastHeartbeat;
        this.status = status;
    }

    public String getWorkerId() {
        return workerId;
    }

    public long getLastHeartbeat() {
        return lastHeartbeat;
    }

    public WorkerStatus getStatus() {
        return status;
    }

    public WorkerLivenessState withHeartbeat(long timestamp) {
        return new WorkerLivenessState(workerId, timestamp, WorkerStatus.ALIVE);
    }

    public WorkerLivenessState withStatus(WorkerStatus newStatus) {
        return new WorkerLivenessState(workerId, lastHeartbeat, newStatus);
    }

    @Override
    public String toString() {
        return "WorkerLivenessState{workerId='" + workerId +
                "', lastHeartbeat=" + lastHeartbeat +
                ", status=" + status + "}";
    }
}
