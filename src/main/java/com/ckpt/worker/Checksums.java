package com.ckpt.worker;

import java.util.zip.CRC32C;

public final class Checksums {

    private Checksums() {
    }

    public static long crc32c(byte[] bytes) {
        CRC32C crc = new CRC32C();
        crc.update(bytes, 0, bytes.length);
        return crc.getValue();
    }
}
