package com.ckpt.coordination;

import com.ckpt.shared.ManifestEntry;

public interface EpochListener {

    void onEpochComplete(ManifestEntry entry);

    default void onEpochAbandoned(long epoch) {
    }
}
