package com.ckpt.coordination;

public interface LivenessListener {

    void onWorkerDead(String workerId);

    default void onWorkerAlive(String workerId) {
    }
}
