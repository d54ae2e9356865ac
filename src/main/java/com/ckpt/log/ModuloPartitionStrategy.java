package com.ckpt.log;

import com.google.inject.Inject;

public class ModuloPartitionStrategy implements PartitionStrategy {

    @Inject
    public ModuloPartitionStrategy() {
    }

    @Override
    public int assignPartition(String partitionKey, int numPartitions) {
        return Math.floorMod(partitionKey.hashCode(), numPartitions);
    }
}
