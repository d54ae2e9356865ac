package com.ckpt.shared;

public enum EpochStatus {
    COMPLETE,
    INCOMPLETE
}
