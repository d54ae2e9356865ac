package com.ckpt.coordination;

import com.ckpt.compaction.CompactionScheduler;
import com.ckpt.compaction.CoordinatedCompactor;
import com.ckpt.compaction.UncoordinatedCompactor;
import com.ckpt.log.InMemoryEventLog;
import com.ckpt.log.ModuloPartitionStrategy;
import com.ckpt.recovery.CoordinatedRecoveryManager;
import com.ckpt.recovery.RecoveryInconsistencyException;
import com.ckpt.recovery.RecoveryPoint;
import com.ckpt.recovery.UncoordinatedRecoveryManager;
import com.ckpt.recovery.WorkerRecoveryPlan;
import com.ckpt.shared.CkptConfig;
import com.ckpt.shared.EpochStatus;
import com.ckpt.shared.SnapshotRecord;
import com.ckpt.shared.StrategyType;
import com.ckpt.shared.WorkerStatus;
import com.ckpt.store.InMemorySnapshotStore;
import com.ckpt.store.ManifestStore;
import com.ckpt.store.SnapshotKeys;
import com.ckpt.strategy.CheckpointStrategy;
import com.ckpt.strategy.CoordinatedStrategy;
import com.ckpt.strategy.UncoordinatedStrategy;
import com.ckpt.worker.BarrierSchedule;
import com.ckpt.worker.LoggingFailureHandler;
import com.ckpt.worker.RetryPolicy;
import com.ckpt.worker.SnapshotEngine;
import com.ckpt.worker.StateSerializer;
import com.ckpt.worker.Worker;
import com.ckpt.worker.WorkerState;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

import static org.junit.Assert.*;

public class CoordinatorTest {

    private AtomicLong clock;
    private InMemorySnapshotStore store;
    private ManifestStore manifestStore;
    private HeartbeatMonitor monitor;
    private Coordinator coordinator;

    @Before
    public void setUp() {
        clock = new AtomicLong(1000);
        store = new InMemorySnapshotStore();
        manifestStore = new ManifestStore(store, clock::get);
        monitor = new HeartbeatMonitor(5000, clock::get);
    }

    @After
    public void tearDown() {
        if (coordinator != null) {
            coordinator.stop();
        }
    }

    private Coordinator coordinator(StrategyType type) {
        CkptConfig config = CkptConfig.builder()
                .strategy(type)
                .snapshotFrequencySeconds(3600)
                .compactionIntervalSeconds(3600)
                .heartbeatCheckIntervalMs(3_600_000)
                .build();
        CheckpointStrategy strategy = type == StrategyType.COORDINATED
                ? new CoordinatedStrategy(new CoordinatedCompactor(manifestStore, store),
                        new CoordinatedRecoveryManager(manifestStore, store))
                : new UncoordinatedStrategy(new UncoordinatedCompactor(store),
                        new UncoordinatedRecoveryManager(manifestStore, store), 3_600_000L);
        EpochManager epochManager = new EpochManager(manifestStore, monitor, 30000, clock::get);
        coordinator = new Coordinator(config, monitor, epochManager, manifestStore, strategy,
                new CompactionScheduler(strategy.compactor(), 3_600_000L));
        return coordinator;
    }

    @Test(expected = RecoveryInconsistencyException.class)
    public void testStartWithoutManifestIsFatal() {
        coordinator(StrategyType.COORDINATED).start();
    }

    @Test
    public void testFreshStoreStartsFromBaseline() {
        Coordinator c = coordinator(StrategyType.COORDINATED);
        assertTrue(c.initializeStore());
        RecoveryPoint point = c.start();
        assertEquals(0, point.getEpoch().getAsLong());
        assertTrue(point.planFor("anyone").isFresh());
    }

    @Test
    public void testEpochCompletesThroughChannel() {
        Coordinator c = coordinator(StrategyType.COORDINATED);
        c.initializeStore();
        c.start();
        AckingChannel a = new AckingChannel("a");
        AckingChannel b = new AckingChannel("b");
        c.register("a", a);
        c.register("b", b);

        long epoch = c.triggerEpoch().getAsLong();
        c.flush();

        assertEquals(1, epoch);
        assertEquals(EpochState.COMPLETE, c.getEpochManager().state());
        assertEquals(EpochStatus.COMPLETE, manifestStore.snapshot().entry(1).get().getStatus());
        assertEquals(1, c.recoveryPoint().getEpoch().getAsLong());
        assertEquals(Map.of(0, 1L), c.recoveryPoint().planFor("a").getReplayOffsets());
    }

    @Test
    public void testReconnectingDeadWorkerIsRestored() {
        Coordinator c = coordinator(StrategyType.COORDINATED);
        c.initializeStore();
        c.start();
        AckingChannel a = new AckingChannel("a");
        c.register("a", a);
        c.triggerEpoch();
        c.flush();

        clock.addAndGet(6000);
        monitor.scan();
        assertEquals(WorkerStatus.DEAD, monitor.status("a"));
        assertTrue(c.getStrategy().recoveryManager().needsRecovery("a"));

        c.heartbeat("a");
        c.flush();

        assertEquals(1, a.restored.size());
        WorkerRecoveryPlan plan = a.restored.get(0);
        assertEquals(1, plan.getRecord().get().getGeneration());
        assertFalse(c.getStrategy().recoveryManager().needsRecovery("a"));
    }

    @Test
    public void testRecoverAllRestoresEveryRegisteredWorker() {
        Coordinator c = coordinator(StrategyType.COORDINATED);
        c.initializeStore();
        c.start();
        AckingChannel a = new AckingChannel("a");
        AckingChannel b = new AckingChannel("b");
        c.register("a", a);
        c.triggerEpoch();
        c.flush();
        c.register("b", b);

        c.recoverAll();

        assertEquals(1, a.restored.get(0).getRecord().get().getGeneration());
        assertTrue(b.restored.get(0).isFresh());
    }

    @Test
    public void testDeregisteredWorkerIsForgotten() {
        Coordinator c = coordinator(StrategyType.COORDINATED);
        c.initializeStore();
        c.start();
        c.register("a", new AckingChannel("a"));
        c.flush();
        assertEquals(List.of("a"), c.registeredWorkers());

        c.deregister("a");
        c.flush();

        assertTrue(c.registeredWorkers().isEmpty());
        assertNull(monitor.status("a"));
        assertFalse(c.triggerEpoch().isPresent());
    }

    @Test
    public void testUncoordinatedCoordinatorTracksLocalSnapshots() {
        Coordinator c = coordinator(StrategyType.UNCOORDINATED);
        c.initializeStore();
        c.start();
        SnapshotRecord record = new SnapshotRecord("a", StrategyType.UNCOORDINATED, 4, 0L,
                SnapshotKeys.imageKey(StrategyType.UNCOORDINATED, "a", 4), 1, 1L, Map.of());

        c.reportLocalSnapshot(record);

        assertEquals(record, c.latestLocalSnapshots().get("a"));
        assertFalse(c.getStrategy().usesEpochs());
    }

    /** Writes a one-byte image and acknowledges every barrier straight away. */
    @Test
    public void testWorkerHaltedBySerializationFailureIsDroppedFromEpoch() throws Exception {
        Coordinator c = coordinator(StrategyType.COORDINATED);
        c.initializeStore();
        c.start();
        InMemoryEventLog eventLog = new InMemoryEventLog(new ModuloPartitionStrategy(), 1);
        WorkerState state = new WorkerState();
        SnapshotEngine engine = new SnapshotEngine("a", StrategyType.COORDINATED, state, store,
                new StateSerializer(), new RetryPolicy(1, 1, 1), new LoggingFailureHandler(), clock::get);
        Worker a = new Worker("a", Set.of(0), eventLog, (event, values) -> values.put(event.getKey(), null),
                state, engine, new BarrierSchedule(engine, c), c, 20);
        AckingChannel b = new AckingChannel("b");
        try {
            a.start();
            c.register("b", b);
            eventLog.appendTo(0, "k", "v");
            waitUntil("event processed", () -> a.getEventsProcessed() == 1);

            long epoch = c.triggerEpoch().getAsLong();
            waitUntil("worker halted", () -> !a.isRunning());
            c.flush();
            assertEquals(EpochState.COLLECTING_ACKS, c.getEpochManager().state());
            assertEquals(Set.of("a"), c.getEpochManager().pendingWorkers());

            clock.addAndGet(6000);
            c.heartbeat("b");
            c.flush();
            monitor.scan();

            assertEquals(WorkerStatus.DEAD, monitor.status("a"));
            assertEquals(EpochState.COMPLETE, c.getEpochManager().state());
            assertEquals(EpochStatus.COMPLETE, manifestStore.snapshot().entry(epoch).get().getStatus());
            assertTrue(c.getStrategy().recoveryManager().needsRecovery("a"));
            assertTrue(c.triggerEpoch().isPresent());
        } finally {
            a.crash();
        }
    }

    private static void waitUntil(String what, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(10);
        }
    }

    class AckingChannel implements WorkerChannel {
        private final String workerId;
        final List<WorkerRecoveryPlan> restored = Collections.synchronizedList(new ArrayList<>());

        AckingChannel(String workerId) {
            this.workerId = workerId;
        }

        @Override
        public String getWorkerId() {
            return workerId;
        }

        @Override
        public void requestSnapshot(long epoch) {
            String imageKey = SnapshotKeys.imageKey(StrategyType.COORDINATED, workerId, epoch);
            store.put(imageKey, new byte[]{1});
            SnapshotRecord record = new SnapshotRecord(workerId, StrategyType.COORDINATED, epoch, clock.get(),
                    imageKey, 1, 1L, Map.of(0, epoch));
            store.put(SnapshotKeys.recordKey(StrategyType.COORDINATED, workerId, epoch),
                    record.encode().getBytes());
            coordinator.acknowledge(record);
        }

        @Override
        public void restore(WorkerRecoveryPlan plan) {
            restored.add(plan);
        }
    }
}
