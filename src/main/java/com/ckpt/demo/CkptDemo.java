package com.ckpt.demo;

import com.ckpt.CkptModule;
import com.ckpt.coordination.Coordinator;
import com.ckpt.log.InMemoryEventLog;
import com.ckpt.recovery.RecoveryPoint;
import com.ckpt.shared.CkptConfig;
import com.ckpt.shared.ManifestEntry;
import com.ckpt.shared.StrategyType;
import com.ckpt.shared.WorkerLivenessState;
import com.ckpt.store.SnapshotStore;
import com.ckpt.store.StoreType;
import com.ckpt.worker.EventProcessor;
import com.ckpt.worker.Worker;
import com.ckpt.worker.WorkerFactory;

import com.google.inject.Guice;
import com.google.inject.Injector;

import java.util.ArrayList;
import java.util.List;

public class CkptDemo {

    public static void main(String[] args) throws Exception {
        StrategyType strategy = StrategyType.COORDINATED;
        StoreType storeType = StoreType.IN_MEMORY;
        int numPartitions = 6;

        for (String arg : args) {
            if ("--uncoordinated".equals(arg)) {
                strategy = StrategyType.UNCOORDINATED;
            } else if ("--etcd".equals(arg)) {
                storeType = StoreType.ETCD;
            } else if ("--oracle".equals(arg)) {
                storeType = StoreType.ORACLE;
            } else {
                try {
                    numPartitions = Integer.parseInt(arg);
                } catch (NumberFormatException e) {
                    System.err.println("Ignoring unknown argument " + arg);
                }
            }
        }

        CkptConfig config = CkptConfig.builder()
                .strategy(strategy)
                .storeType(storeType)
                .numPartitions(numPartitions)
                .snapshotFrequencySeconds(1)
                .compactionIntervalSeconds(2)
                .heartbeatLimitMs(3000)
                .heartbeatCheckIntervalMs(500)
                .heartbeatSendIntervalMs(500)
                .build();

        System.out.println("=== Checkpointing Demo ===");
        System.out.println("Config: " + config);
        System.out.println();

        // 1. Wire everything and prepare the store
        Injector injector = Guice.createInjector(new CkptModule(config, storeType));
        SnapshotStore store = injector.getInstance(SnapshotStore.class);
        store.initialize();
        Coordinator coordinator = injector.getInstance(Coordinator.class);
        if (coordinator.initializeStore()) {
            System.out.println("Fresh store, wrote baseline manifest");
        }
        RecoveryPoint start = coordinator.start();
        System.out.println("Recovery point at startup: " + start);

        // 2. Start three workers
        WorkerFactory factory = injector.getInstance(WorkerFactory.class);
        List<Worker> workers = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            String workerId = "worker-" + (char) ('A' + i);
            Worker worker = factory.create(workerId, factory.partitionsFor(i, 3), EventProcessor.lastValueWins());
            workers.add(worker);
            worker.start();
        }
        coordinator.recoverAll();

        // 3. Feed the log
        InMemoryEventLog eventLog = injector.getInstance(InMemoryEventLog.class);
        System.out.println("\n--- Appending 100 events ---");
        for (int i = 0; i < 100; i++) {
            eventLog.append("account-" + (i % 20), "balance-" + i);
        }
        Thread.sleep(3000);
        printStatus(coordinator, workers);

        // 4. Crash one worker and let the monitor notice
        System.out.println("\n--- Crashing worker-A ---");
        workers.get(0).crash();
        for (int i = 100; i < 150; i++) {
            eventLog.append("account-" + (i % 20), "balance-" + i);
        }
        Thread.sleep(config.getHeartbeatLimitMs() + 2000);
        printStatus(coordinator, workers);

        // 5. Bring it back; the coordinator restores it from its last snapshot
        System.out.println("\n--- Restarting worker-A ---");
        Worker restarted = factory.create("worker-A", factory.partitionsFor(0, 3), EventProcessor.lastValueWins());
        workers.set(0, restarted);
        restarted.start();
        Thread.sleep(3000);
        printStatus(coordinator, workers);

        System.out.println("\nRecovery point now: " + coordinator.recoveryPoint());

        for (Worker worker : workers) {
            worker.stop();
        }
        coordinator.stop();
        store.close();
        System.out.println("\n=== Demo complete ===");
    }

    private static void printStatus(Coordinator coordinator, List<Worker> workers) {
        for (Worker worker : workers) {
            System.out.println(worker.getWorkerId() + ": running=" + worker.isRunning() +
                    " processed=" + worker.getEventsProcessed() +
                    " offsets=" + worker.getState().offsets() +
                    " lastSnapshot=" + worker.getEngine().lastSequence());
        }
        for (WorkerLivenessState state : coordinator.getHeartbeatMonitor().livenessTable().values()) {
            System.out.println("  " + state);
        }
        for (ManifestEntry entry : coordinator.getManifestStore().snapshot().entries().values()) {
            System.out.println("  manifest " + entry.getEpoch() + " " + entry.getStatus() +
                    " workers=" + entry.getRecords().keySet());
        }
        if (!coordinator.getStrategy().usesEpochs()) {
            System.out.println("  local snapshots: " + coordinator.latestLocalSnapshots().keySet());
        }
    }
}
