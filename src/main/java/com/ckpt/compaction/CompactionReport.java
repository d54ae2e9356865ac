package com.ckpt.compaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CompactionReport {

    private final List<String> deletedKeys;
    private final List<String> failedKeys;
    private final List<Long> retiredEpochs;

    private CompactionReport(Builder builder) {
        this.deletedKeys = Collections.unmodifiableList(new ArrayList<>(builder.deletedKeys));
        this.failedKeys = Collections.unmodifiableList(new ArrayList<>(builder.failedKeys));
        this.retiredEpochs = Collections.unmodifiableList(new ArrayList<>(builder.retiredEpochs));
    }

    public static CompactionReport empty() {
        return new Builder().build();
    }

    public List<String> getDeletedKeys() {
        return deletedKeys;
    }

    public List<String> getFailedKeys() {
        return failedKeys;
    }

    public List<Long> getRetiredEpochs() {
        return retiredEpochs;
    }

    public boolean isEmpty() {
        return deletedKeys.isEmpty() && failedKeys.isEmpty() && retiredEpochs.isEmpty();
    }

    @Override
    public String toString() {
        return "CompactionReport{deleted=" + deletedKeys.size() + ", failed=" + failedKeys.size() +
                ", retiredEpochs=" + retiredEpochs + "}";
    }

    static class Builder {
        private final List<String> deletedKeys = new ArrayList<>();
        private final List<String> failedKeys = new ArrayList<>();
        private final List<Long> retiredEpochs = new ArrayList<>();

        void deleted(String key) {
            deletedKeys.add(key);
        }

        void failed(String key) {
            failedKeys.add(key);
        }

        void retired(long epoch) {
            retiredEpochs.add(epoch);
        }

        CompactionReport build() {
            return new CompactionReport(this);
        }
    }
}
