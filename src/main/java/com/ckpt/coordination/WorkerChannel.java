package com.ckpt.coordination;

import com.ckpt.recovery.WorkerRecoveryPlan;

public interface WorkerChannel {

    String getWorkerId();

    void requestSnapshot(long epoch);

    void restore(WorkerRecoveryPlan plan);
}
