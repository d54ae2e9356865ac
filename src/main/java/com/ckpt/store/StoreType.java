package com.ckpt.store;

public enum StoreType {
    IN_MEMORY,
    ETCD,
    ORACLE
}
