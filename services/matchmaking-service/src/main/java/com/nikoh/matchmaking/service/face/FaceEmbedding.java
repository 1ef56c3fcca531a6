package com.nikoh.matchmaking.service.face;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Immutable face descriptor of {@value #DIMENSION} floats.
 * Persisted as little-endian float32 values.
 */
public final class FaceEmbedding {

    public static final int DIMENSION = 512;

    private final float[] values;

    private FaceEmbedding(float[] values) {
        this.values = values;
    }

    public static FaceEmbedding of(float[] values) {
        if (values == null || values.length != DIMENSION) {
            throw new IllegalArgumentException("Face embedding must have " + DIMENSION + " values, got "
                    + (values == null ? "null" : values.length));
        }
        return new FaceEmbedding(values.clone());
    }

    public static FaceEmbedding fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != DIMENSION * Float.BYTES) {
            throw new IllegalArgumentException("Serialized face embedding must be "
                    + DIMENSION * Float.BYTES + " bytes");
        }
        float[] values = new float[DIMENSION];
        ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(values);
        return new FaceEmbedding(values);
    }

    public byte[] toBytes() {
        ByteBuffer buffer = ByteBuffer.allocate(DIMENSION * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(values);
        return buffer.array();
    }

    public float[] values() {
        return values.clone();
    }

    public double norm() {
        double sum = 0.0;
        for (float value : values) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }

    /**
     * Unit length copy; a zero vector stays zero
     */
    public FaceEmbedding normalized() {
        double norm = norm();
        if (norm == 0.0) {
            return this;
        }
        float[] unit = new float[DIMENSION];
        for (int i = 0; i < DIMENSION; i++) {
            unit[i] = (float) (values[i] / norm);
        }
        return new FaceEmbedding(unit);
    }

    double dot(FaceEmbedding other) {
        double sum = 0.0;
        for (int i = 0; i < DIMENSION; i++) {
            sum += (double) values[i] * other.values[i];
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FaceEmbedding)) return false;
        return Arrays.equals(values, ((FaceEmbedding) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }
}
