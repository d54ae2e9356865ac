package com.ckpt.worker;

public interface SnapshotSchedule {

    void start();

    void onBarrierRequest(long epoch);

    void stop();
}
