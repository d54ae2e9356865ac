package com.ckpt.worker;

import com.ckpt.shared.StrategyType;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class BarrierScheduleTest {

    private SnapshotEngineTest.FlakyStore store;
    private SnapshotEngine engine;
    private WorkerTest.TestCoordinator coordinator;
    private BarrierSchedule schedule;

    @Before
    public void setUp() {
        store = new SnapshotEngineTest.FlakyStore();
        engine = new SnapshotEngine("w1", StrategyType.COORDINATED, new WorkerState(), store, new StateSerializer(),
                new RetryPolicy(2, 1, 1), new LoggingFailureHandler(), System::currentTimeMillis);
        coordinator = new WorkerTest.TestCoordinator();
        schedule = new BarrierSchedule(engine, coordinator);
    }

    @After
    public void tearDown() {
        engine.shutdown();
    }

    private void awaitReply() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (coordinator.acks.isEmpty() && coordinator.failures.isEmpty()) {
            if (System.currentTimeMillis() > deadline) {
                fail("No reply from the barrier schedule");
            }
            Thread.sleep(10);
        }
    }

    @Test
    public void testSuccessfulSnapshotIsAcknowledged() throws Exception {
        schedule.onBarrierRequest(3);
        awaitReply();
        assertEquals(3, coordinator.acks.get(0).getGeneration());
        assertTrue(coordinator.failures.isEmpty());
    }

    @Test
    public void testFailedWriteIsReported() throws Exception {
        store.failNextPuts(2);
        schedule.onBarrierRequest(3);
        awaitReply();
        assertEquals(List.of(3L), coordinator.failures);
        assertTrue(coordinator.acks.isEmpty());
    }
}
