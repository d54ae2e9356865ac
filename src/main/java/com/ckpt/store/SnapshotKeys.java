package com.ckpt.store;

import com.ckpt.shared.StrategyType;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Key layout shared by writers, the compactor and recovery.
 *
 * <pre>
 *   snapshots/&lt;strategy&gt;/&lt;workerId&gt;/&lt;generation&gt;.bin   state image
 *   records/&lt;strategy&gt;/&lt;workerId&gt;/&lt;generation&gt;         encoded SnapshotRecord
 *   manifest/epochs/&lt;epoch&gt;                            encoded ManifestEntry
 * </pre>
 *
 * Generations are zero padded so that lexical order is creation order.
 */
public final class SnapshotKeys {

    public static final String SNAPSHOTS = "snapshots/";
    public static final String RECORDS = "records/";
    public static final String MANIFEST_EPOCHS = "manifest/epochs/";
    public static final String MANIFEST_EPOCH_COUNTER = "manifest/last-assigned-epoch";

    private static final String IMAGE_SUFFIX = ".bin";

    private SnapshotKeys() {
    }

    public static String pad(long generation) {
        if (generation < 0) {
            throw new IllegalArgumentException("generation must be >= 0, got " + generation);
        }
        return String.format("%020d", generation);
    }

    public static String imageKey(StrategyType strategy, String workerId, long generation) {
        return imagePrefix(strategy, workerId) + pad(generation) + IMAGE_SUFFIX;
    }

    public static String recordKey(StrategyType strategy, String workerId, long generation) {
        return recordPrefix(strategy, workerId) + pad(generation);
    }

    public static String imagePrefix(StrategyType strategy, String workerId) {
        return SNAPSHOTS + strategy.keySegment() + "/" + workerId + "/";
    }

    public static String recordPrefix(StrategyType strategy, String workerId) {
        return RECORDS + strategy.keySegment() + "/" + workerId + "/";
    }

    public static String recordPrefix(StrategyType strategy) {
        return RECORDS + strategy.keySegment() + "/";
    }

    public static String imagePrefix(StrategyType strategy) {
        return SNAPSHOTS + strategy.keySegment() + "/";
    }

    public static String manifestKey(long epoch) {
        return MANIFEST_EPOCHS + pad(epoch);
    }

    public static long generationOf(String key) {
        String last = key.substring(key.lastIndexOf('/') + 1);
        if (last.endsWith(IMAGE_SUFFIX)) {
            last = last.substring(0, last.length() - IMAGE_SUFFIX.length());
        }
        try {
            return Long.parseLong(last);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Key has no generation segment: " + key, e);
        }
    }

    public static String workerOf(String prefix, String key) {
        String rest = key.substring(prefix.length());
        int slash = rest.indexOf('/');
        return slash < 0 ? rest : rest.substring(0, slash);
    }

    public static Set<String> workersUnder(String prefix, List<String> keys) {
        Set<String> workers = new LinkedHashSet<>();
        for (String key : keys) {
            workers.add(workerOf(prefix, key));
        }
        return workers;
    }
}
