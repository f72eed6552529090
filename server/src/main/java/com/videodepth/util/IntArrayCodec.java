package com.videodepth.util;

import java.nio.ByteBuffer;
import java.nio.IntBuffer;

public class IntArrayCodec {

    public static byte[] toBytes(int[] values) {
        if (values == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Integer.BYTES);
        buffer.asIntBuffer().put(values);
        return buffer.array();
    }

    public static int[] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        if (bytes.length % Integer.BYTES != 0) {
            throw new IllegalArgumentException("Blob length " + bytes.length + " is not a multiple of " + Integer.BYTES);
        }
        IntBuffer buffer = ByteBuffer.wrap(bytes).asIntBuffer();
        int[] values = new int[buffer.remaining()];
        buffer.get(values);
        return values;
    }
}
