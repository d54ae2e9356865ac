package com.ckpt.recovery;

import com.ckpt.shared.StrategyType;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;

public final class RecoveryPoint {

    private final StrategyType strategy;
    private final long epoch;
    private final Map<String, WorkerRecoveryPlan> plans;

    private RecoveryPoint(StrategyType strategy, long epoch, Map<String, WorkerRecoveryPlan> plans) {
        this.strategy = strategy;
        this.epoch = epoch;
        this.plans = Collections.unmodifiableMap(new TreeMap<>(plans));
    }

    public static RecoveryPoint coordinated(long epoch, Map<String, WorkerRecoveryPlan> plans) {
        return new RecoveryPoint(StrategyType.COORDINATED, epoch, plans);
    }

    public static RecoveryPoint uncoordinated(Map<String, WorkerRecoveryPlan> plans) {
        return new RecoveryPoint(StrategyType.UNCOORDINATED, -1, plans);
    }

    public StrategyType getStrategy() {
        return strategy;
    }

    public OptionalLong getEpoch() {
        return strategy == StrategyType.COORDINATED ? OptionalLong.of(epoch) : OptionalLong.empty();
    }

    public Map<String, WorkerRecoveryPlan> getPlans() {
        return plans;
    }

    public WorkerRecoveryPlan planFor(String workerId) {
        WorkerRecoveryPlan plan = plans.get(workerId);
        return plan != null ? plan : WorkerRecoveryPlan.fresh(workerId);
    }

    @Override
    public String toString() {
        return "RecoveryPoint{strategy=" + strategy +
                (strategy == StrategyType.COORDINATED ? ", epoch=" + epoch : "") +
                ", plans=" + plans.values() + "}";
    }
}
