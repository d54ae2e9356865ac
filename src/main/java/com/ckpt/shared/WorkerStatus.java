package com.ckpt.shared;

public enum WorkerStatus {
    ALIVE,
    SUSPECT,
    DEAD
}
