package com.ckpt.coordination;

public enum EpochState {
    IDLE,
    SNAPSHOT_REQUESTED,
    COLLECTING_ACKS,
    COMPLETE,
    INCOMPLETE;

    public boolean isInFlight() {
        return this == SNAPSHOT_REQUESTED || this == COLLECTING_ACKS;
    }
}
