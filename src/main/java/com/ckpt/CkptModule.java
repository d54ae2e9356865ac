package com.ckpt;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.ckpt.coordination.Coordinator;
import com.ckpt.coordination.CoordinatorChannel;
import com.ckpt.log.EventLog;
import com.ckpt.log.InMemoryEventLog;
import com.ckpt.log.ModuloPartitionStrategy;
import com.ckpt.log.PartitionStrategy;
import com.ckpt.shared.CkptConfig;
import com.ckpt.store.EtcdSnapshotStore;
import com.ckpt.store.InMemorySnapshotStore;
import com.ckpt.store.OracleSnapshotStore;
import com.ckpt.store.SnapshotStore;
import com.ckpt.store.StoreType;
import com.ckpt.strategy.CheckpointStrategy;
import com.ckpt.strategy.CoordinatedStrategy;
import com.ckpt.strategy.UncoordinatedStrategy;
import com.ckpt.worker.LoggingFailureHandler;
import com.ckpt.worker.WorkerFailureHandler;

public class CkptModule extends AbstractModule {

    private final CkptConfig config;
    private final StoreType storeType;

    public CkptModule(CkptConfig config) {
        this(config, config.getStoreType());
    }

    public CkptModule(CkptConfig config, StoreType storeType) {
        this.config = config;
        this.storeType = storeType;
    }

    @Override
    protected void configure() {
        bind(CkptConfig.class).toInstance(config);
        bind(PartitionStrategy.class).to(ModuloPartitionStrategy.class).in(Singleton.class);
        bind(EventLog.class).to(InMemoryEventLog.class).in(Singleton.class);
        bind(Coordinator.class).in(Singleton.class);
        bind(CoordinatorChannel.class).to(Coordinator.class);
        bind(WorkerFailureHandler.class).to(LoggingFailureHandler.class).in(Singleton.class);

        switch (storeType) {
            case IN_MEMORY -> bind(SnapshotStore.class).to(InMemorySnapshotStore.class).in(Singleton.class);
            case ETCD -> bind(SnapshotStore.class).to(EtcdSnapshotStore.class).in(Singleton.class);
            case ORACLE -> bind(SnapshotStore.class).to(OracleSnapshotStore.class).in(Singleton.class);
        }

        switch (config.getStrategy()) {
            case COORDINATED -> bind(CheckpointStrategy.class).to(CoordinatedStrategy.class);
            case UNCOORDINATED -> bind(CheckpointStrategy.class).to(UncoordinatedStrategy.class);
        }
    }
}
