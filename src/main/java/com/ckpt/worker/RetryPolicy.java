package com.ckpt.worker;

import com.ckpt.shared.CkptConfig;

public final class RetryPolicy {

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;

    public RetryPolicy(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("Invalid backoff range " + initialBackoffMs + ".." + maxBackoffMs);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
    }

    public static RetryPolicy from(CkptConfig config) {
        return new RetryPolicy(config.getSnapshotWriteAttempts(), config.getSnapshotWriteBackoffMs(),
                config.getSnapshotWriteMaxBackoffMs());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long backoffFor(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be > 0");
        }
        long delay = initialBackoffMs;
        for (int i = 1; i < attempt && delay < maxBackoffMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxBackoffMs);
    }

    @Override
    public String toString() {
        return "RetryPolicy{attempts=" + maxAttempts + ", backoff=" + initialBackoffMs + ".." + maxBackoffMs + "ms}";
    }
}
