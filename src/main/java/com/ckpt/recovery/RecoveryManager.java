package com.ckpt.recovery;

import com.ckpt.coordination.WorkerChannel;

import java.util.Collection;
import java.util.Set;

public interface RecoveryManager {

    RecoveryPoint selectRecoveryPoint();

    WorkerRecoveryPlan planFor(String workerId);

    RecoveryPoint recover(Collection<? extends WorkerChannel> channels);

    WorkerRecoveryPlan recover(WorkerChannel channel);

    void markForRecovery(String workerId);

    boolean needsRecovery(String workerId);

    Set<String> pendingRecovery();
}
