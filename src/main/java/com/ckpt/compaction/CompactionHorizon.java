package com.ckpt.compaction;

import com.ckpt.shared.SnapshotManifest;

import java.util.List;
import java.util.Optional;

/**
 * Boundary for coordinated compaction. With complete epochs c1 < ... < ck the
 * horizon is c(k-1), or c1 when it is the only one; the latest complete epoch
 * and the one before it always survive.
 */
public final class CompactionHorizon {

    private final long horizon;
    private final long latestComplete;

    CompactionHorizon(long horizon, long latestComplete) {
        this.horizon = horizon;
        this.latestComplete = latestComplete;
    }

    public static Optional<CompactionHorizon> of(SnapshotManifest manifest) {
        List<Long> complete = manifest.completeEpochs();
        if (complete.isEmpty()) {
            return Optional.empty();
        }
        long latest = complete.get(complete.size() - 1);
        long horizon = complete.size() == 1 ? latest : complete.get(complete.size() - 2);
        return Optional.of(new CompactionHorizon(horizon, latest));
    }

    public long getHorizon() {
        return horizon;
    }

    public long getLatestComplete() {
        return latestComplete;
    }

    @Override
    public String toString() {
        return "CompactionHorizon{horizon=" + horizon + ", latestComplete=" + latestComplete + "}";
    }
}
