package com.ckpt.log;

public interface PartitionStrategy {

    int assignPartition(String partitionKey, int numPartitions);
}
