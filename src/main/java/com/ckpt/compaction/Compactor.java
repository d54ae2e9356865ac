package com.ckpt.compaction;

public interface Compactor {

    CompactionReport compact();
}
