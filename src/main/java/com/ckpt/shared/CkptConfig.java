package com.ckpt.shared;

import com.ckpt.store.StoreType;

import java.util.Map;

public class CkptConfig {

    private final StrategyType strategy;
    private final long snapshotFrequencySeconds;
    private final long compactionIntervalSeconds;
    private final long heartbeatLimitMs;
    private final long heartbeatCheckIntervalMs;
    private final long heartbeatSendIntervalMs;
    private final long epochStallWarnMs;
    private final int snapshotWriteAttempts;
    private final long snapshotWriteBackoffMs;
    private final long snapshotWriteMaxBackoffMs;
    private final StoreType storeType;
    private final String storeHost;
    private final int storePort;
    private final String storeUser;
    private final String storePassword;
    private final String storeServiceName;
    private final String bucketName;
    private final String eventLogUrl;
    private final int numPartitions;

    private CkptConfig(Builder builder) {
        this.strategy = builder.strategy;
        this.snapshotFrequencySeconds = builder.snapshotFrequencySeconds;
        this.compactionIntervalSeconds = builder.compactionIntervalSeconds;
        this.heartbeatLimitMs = builder.heartbeatLimitMs;
        this.heartbeatCheckIntervalMs = builder.heartbeatCheckIntervalMs;
        this.heartbeatSendIntervalMs = builder.heartbeatSendIntervalMs;
        this.epochStallWarnMs = builder.epochStallWarnMs;
        this.snapshotWriteAttempts = builder.snapshotWriteAttempts;
        this.snapshotWriteBackoffMs = builder.snapshotWriteBackoffMs;
        this.snapshotWriteMaxBackoffMs = builder.snapshotWriteMaxBackoffMs;
        this.storeType = builder.storeType;
        this.storeHost = builder.storeHost;
        this.storePort = builder.storePort;
        this.storeUser = builder.storeUser;
        this.storePassword = builder.storePassword;
        this.storeServiceName = builder.storeServiceName;
        this.bucketName = builder.bucketName;
        this.eventLogUrl = builder.eventLogUrl;
        this.numPartitions = builder.numPartitions;
    }

    public StrategyType getStrategy() {
        return strategy;
    }

    public long getSnapshotFrequencySeconds() {
        return snapshotFrequencySeconds;
    }

    public long getCompactionIntervalSeconds() {
        return compactionIntervalSeconds;
    }

    public long getHeartbeatLimitMs() {
        return heartbeatLimitMs;
    }

    public long getHeartbeatCheckIntervalMs() {
        return heartbeatCheckIntervalMs;
    }

    public long getHeartbeatSendIntervalMs() {
        return heartbeatSendIntervalMs;
    }

    public long getEpochStallWarnMs() {
        return epochStallWarnMs;
    }

    public int getSnapshotWriteAttempts() {
        return snapshotWriteAttempts;
    }

    public long getSnapshotWriteBackoffMs() {
        return snapshotWriteBackoffMs;
    }

    public long getSnapshotWriteMaxBackoffMs() {
        return snapshotWriteMaxBackoffMs;
    }

    public StoreType getStoreType() {
        return storeType;
    }

    public String getStoreHost() {
        return storeHost;
    }

    public int getStorePort() {
        return storePort;
    }

    public String getStoreUser() {
        return storeUser;
    }

    public String getStorePassword() {
        return storePassword;
    }

    public String getStoreServiceName() {
        return storeServiceName;
    }

    public String getBucketName() {
        return bucketName;
    }

    public String getEventLogUrl() {
        return eventLogUrl;
    }

    public int getNumPartitions() {
        return numPartitions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CkptConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        String value;
        if ((value = env.get("CHECKPOINTING_STRATEGY")) != null) {
            builder.strategy(parseEnum(StrategyType.class, "CHECKPOINTING_STRATEGY", value));
        }
        if ((value = env.get("SNAPSHOT_FREQUENCY_SEC")) != null) {
            builder.snapshotFrequencySeconds(parseLong("SNAPSHOT_FREQUENCY_SEC", value));
        }
        if ((value = env.get("COMPACTION_INTERVAL_SEC")) != null) {
            builder.compactionIntervalSeconds(parseLong("COMPACTION_INTERVAL_SEC", value));
        }
        if ((value = env.get("HEARTBEAT_LIMIT")) != null) {
            builder.heartbeatLimitMs(parseLong("HEARTBEAT_LIMIT", value));
        }
        if ((value = env.get("HEARTBEAT_CHECK_INTERVAL")) != null) {
            builder.heartbeatCheckIntervalMs(parseLong("HEARTBEAT_CHECK_INTERVAL", value));
        }
        if ((value = env.get("HEARTBEAT_SEND_INTERVAL")) != null) {
            builder.heartbeatSendIntervalMs(parseLong("HEARTBEAT_SEND_INTERVAL", value));
        }
        if ((value = env.get("EPOCH_STALL_WARN_MS")) != null) {
            builder.epochStallWarnMs(parseLong("EPOCH_STALL_WARN_MS", value));
        }
        if ((value = env.get("SNAPSHOT_WRITE_ATTEMPTS")) != null) {
            builder.snapshotWriteAttempts((int) parseLong("SNAPSHOT_WRITE_ATTEMPTS", value));
        }
        if ((value = env.get("SNAPSHOT_WRITE_BACKOFF_MS")) != null) {
            builder.snapshotWriteBackoffMs(parseLong("SNAPSHOT_WRITE_BACKOFF_MS", value));
        }
        if ((value = env.get("SNAPSHOT_STORE_TYPE")) != null) {
            builder.storeType(parseEnum(StoreType.class, "SNAPSHOT_STORE_TYPE", value));
        }
        if ((value = env.get("SNAPSHOT_STORE_HOST")) != null) {
            builder.storeHost(value);
        }
        if ((value = env.get("SNAPSHOT_STORE_PORT")) != null) {
            builder.storePort((int) parseLong("SNAPSHOT_STORE_PORT", value));
        }
        if ((value = env.get("SNAPSHOT_STORE_USER")) != null) {
            builder.storeUser(value);
        }
        if ((value = env.get("SNAPSHOT_STORE_PASSWORD")) != null) {
            builder.storePassword(value);
        }
        if ((value = env.get("SNAPSHOT_STORE_SERVICE")) != null) {
            builder.storeServiceName(value);
        }
        if ((value = env.get("SNAPSHOT_BUCKET_NAME")) != null) {
            builder.bucketName(value);
        }
        if ((value = env.get("KAFKA_URL")) != null) {
            builder.eventLogUrl(value);
        }
        if ((value = env.get("NUM_PARTITIONS")) != null) {
            builder.numPartitions((int) parseLong("NUM_PARTITIONS", value));
        }
        return builder.build();
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number, got '" + value + "'", e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String name, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + name + ": '" + value + "'", e);
        }
    }

    public static class Builder {
        private StrategyType strategy = StrategyType.COORDINATED;
        private long snapshotFrequencySeconds = 10;
        private long compactionIntervalSeconds = 60;
        private long heartbeatLimitMs = 5000;
        private long heartbeatCheckIntervalMs = 500;
        private long heartbeatSendIntervalMs = 1000;
        private long epochStallWarnMs = 30_000;
        private int snapshotWriteAttempts = 3;
        private long snapshotWriteBackoffMs = 100;
        private long snapshotWriteMaxBackoffMs = 2000;
        private StoreType storeType = StoreType.IN_MEMORY;
        private String storeHost = "localhost";
        private int storePort = 2379;
        private String storeUser = "";
        private String storePassword = "";
        private String storeServiceName = "FREEPDB1";
        private String bucketName = "ckpt-snapshots";
        private String eventLogUrl = "localhost:9092";
        private int numPartitions = 8;

        public Builder strategy(StrategyType strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder snapshotFrequencySeconds(long snapshotFrequencySeconds) {
            this.snapshotFrequencySeconds = snapshotFrequencySeconds;
            return this;
        }

        public Builder compactionIntervalSeconds(long compactionIntervalSeconds) {
            this.compactionIntervalSeconds = compactionIntervalSeconds;
            return this;
        }

        public Builder heartbeatLimitMs(long heartbeatLimitMs) {
            this.heartbeatLimitMs = heartbeatLimitMs;
            return this;
        }

        public Builder heartbeatCheckIntervalMs(long heartbeatCheckIntervalMs) {
            this.heartbeatCheckIntervalMs = heartbeatCheckIntervalMs;
            return this;
        }

        public Builder heartbeatSendIntervalMs(long heartbeatSendIntervalMs) {
            this.heartbeatSendIntervalMs = heartbeatSendIntervalMs;
            return this;
        }

        public Builder epochStallWarnMs(long epochStallWarnMs) {
            this.epochStallWarnMs = epochStallWarnMs;
            return this;
        }

        public Builder snapshotWriteAttempts(int snapshotWriteAttempts) {
            this.snapshotWriteAttempts = snapshotWriteAttempts;
            return this;
        }

        public Builder snapshotWriteBackoffMs(long snapshotWriteBackoffMs) {
            this.snapshotWriteBackoffMs = snapshotWriteBackoffMs;
            return this;
        }

        public Builder snapshotWriteMaxBackoffMs(long snapshotWriteMaxBackoffMs) {
            this.snapshotWriteMaxBackoffMs = snapshotWriteMaxBackoffMs;
            return this;
        }

        public Builder storeType(StoreType storeType) {
            this.storeType = storeType;
            return this;
        }

        public Builder storeHost(String storeHost) {
            this.storeHost = storeHost;
            return this;
        }

        public Builder storePort(int storePort) {
            this.storePort = storePort;
            return this;
        }

        public Builder storeUser(String storeUser) {
            this.storeUser = storeUser;
            return this;
        }

        public Builder storePassword(String storePassword) {
            this.storePassword = storePassword;
            return this;
        }

        public Builder storeServiceName(String storeServiceName) {
            this.storeServiceName = storeServiceName;
            return this;
        }

        public Builder bucketName(String bucketName) {
            this.bucketName = bucketName;
            return this;
        }

        public Builder eventLogUrl(String eventLogUrl) {
            this.eventLogUrl = eventLogUrl;
            return this;
        }

        public Builder numPartitions(int numPartitions) {
            this.numPartitions = numPartitions;
            return this;
        }

        public CkptConfig build() {
            if (strategy == null) {
                throw new IllegalArgumentException("strategy must be set");
            }
            if (storeType == null) {
                throw new IllegalArgumentException("storeType must be set");
            }
            requirePositive("snapshotFrequencySeconds", snapshotFrequencySeconds);
            requirePositive("compactionIntervalSeconds", compactionIntervalSeconds);
            requirePositive("heartbeatLimitMs", heartbeatLimitMs);
            requirePositive("heartbeatCheckIntervalMs", heartbeatCheckIntervalMs);
            requirePositive("heartbeatSendIntervalMs", heartbeatSendIntervalMs);
            requirePositive("epochStallWarnMs", epochStallWarnMs);
            requirePositive("snapshotWriteAttempts", snapshotWriteAttempts);
            requirePositive("numPartitions", numPartitions);
            if (snapshotWriteBackoffMs < 0 || snapshotWriteMaxBackoffMs < snapshotWriteBackoffMs) {
                throw new IllegalArgumentException("snapshot write backoff must satisfy 0 <= backoff <= maxBackoff");
            }
            if (storePort <= 0 || storePort > 65535) {
                throw new IllegalArgumentException("storePort out of range: " + storePort);
            }
            if (bucketName == null || bucketName.isBlank()) {
                throw new IllegalArgumentException("bucketName must not be blank");
            }
            return new CkptConfig(this);
        }

        private static void requirePositive(String name, long value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0, got " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "CkptConfig{strategy=" + strategy +
                ", snapshotFrequencySeconds=" + snapshotFrequencySeconds +
                ", compactionIntervalSeconds=" + compactionIntervalSeconds +
                ", heartbeatLimitMs=" + heartbeatLimitMs +
                ", heartbeatCheckIntervalMs=" + heartbeatCheckIntervalMs +
                ", storeType=" + storeType +
                ", store='" + storeHost + ":" + storePort + "'" +
                ", bucketName='" + bucketName + "'" +
                ", eventLogUrl='" + eventLogUrl + "'}";
    }
}
