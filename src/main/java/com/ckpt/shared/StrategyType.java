package com.ckpt.shared;

public enum StrategyType {
    COORDINATED,
    UNCOORDINATED;

    public String keySegment() {
        return name().toLowerCase();
    }
}
