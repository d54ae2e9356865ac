package com.ckpt.worker;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Binary encoding of a {@link StateImage}:
 *
 * <pre>
 *   int magic, short version, long capturedAt,
 *   int offsetCount, { int partition, long offset }*,
 *   int partitionCount, { int partition, int entryCount, { str key, str value }* }*
 * </pre>
 *
 * Strings are a length-prefixed UTF-8 byte run.
 */
public class StateSerializer {

    static final int MAGIC = 0x434B5054;
    static final short VERSION = 1;

    public byte[] serialize(StateImage image) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(MAGIC);
            out.writeShort(VERSION);
            out.writeLong(image.getCapturedAt());
            out.writeInt(image.getOffsets().size());
            for (Map.Entry<Integer, Long> entry : image.getOffsets().entrySet()) {
                out.writeInt(entry.getKey());
                out.writeLong(entry.getValue());
            }
            out.writeInt(image.getPartitions().size());
            for (Map.Entry<Integer, Map<String, String>> partition : image.getPartitions().entrySet()) {
                out.writeInt(partition.getKey());
                out.writeInt(partition.getValue().size());
                for (Map.Entry<String, String> entry : partition.getValue().entrySet()) {
                    if (entry.getKey() == null || entry.getValue() == null) {
                        throw new SerializationException("Partition " + partition.getKey() +
                                " holds a null key or value");
                    }
                    writeString(out, entry.getKey());
                    writeString(out, entry.getValue());
                }
            }
        } catch (IOException e) {
            throw new SerializationException("Failed to serialize state image", e);
        }
        return bytes.toByteArray();
    }

    public StateImage deserialize(byte[] data) {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            int magic = in.readInt();
            if (magic != MAGIC) {
                throw new SerializationException("Not a state image (magic " + Integer.toHexString(magic) + ")");
            }
            short version = in.readShort();
            if (version != VERSION) {
                throw new SerializationException("Unsupported state image version " + version);
            }
            long capturedAt = in.readLong();
            int offsetCount = in.readInt();
            Map<Integer, Long> offsets = new TreeMap<>();
            for (int i = 0; i < offsetCount; i++) {
                offsets.put(in.readInt(), in.readLong());
            }
            int partitionCount = in.readInt();
            Map<Integer, Map<String, String>> partitions = new TreeMap<>();
            for (int i = 0; i < partitionCount; i++) {
                int partitionId = in.readInt();
                int entryCount = in.readInt();
                Map<String, String> values = new TreeMap<>();
                for (int j = 0; j < entryCount; j++) {
                    values.put(readString(in), readString(in));
                }
                partitions.put(partitionId, values);
            }
            return new StateImage(partitions, offsets, capturedAt);
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize state image", e);
        }
    }

    private static void writeString(DataOutputStream out, String value) throws IOException {
        byte[] encoded = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(encoded.length);
        out.write(encoded);
    }

    private static String readString(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length < 0) {
            throw new IOException("Negative string length " + length);
        }
        byte[] encoded = new byte[length];
        in.readFully(encoded);
        return new String(encoded, StandardCharsets.UTF_8);
    }
}
