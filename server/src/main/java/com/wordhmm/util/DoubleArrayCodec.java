package com.wordhmm.util;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;

/**
 * Raw IEEE-754 encoding of double arrays, so stored values reload bit for bit.
 */
public class DoubleArrayCodec {

    public static byte[] toBytes(double[] values) {
        if (values == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES);
        buffer.asDoubleBuffer().put(values);
        return buffer.array();
    }

    public static double[] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        DoubleBuffer buffer = ByteBuffer.wrap(bytes).asDoubleBuffer();
        double[] values = new double[buffer.remaining()];
        buffer.get(values);
        return values;
    }

    /**
     * Row-major encoding of a rectangular matrix. The column count is not stored.
     */
    public static byte[] matrixToBytes(double[][] matrix) {
        if (matrix == null) {
            return null;
        }
        int cols = matrix.length == 0 ? 0 : matrix[0].length;
        ByteBuffer buffer = ByteBuffer.allocate(matrix.length * cols * Double.BYTES);
        DoubleBuffer doubles = buffer.asDoubleBuffer();
        for (double[] row : matrix) {
            if (row.length != cols) {
                throw new IllegalArgumentException("Matrix rows must all have " + cols + " columns");
            }
            doubles.put(row);
        }
        return buffer.array();
    }

    public static double[][] matrixFromBytes(byte[] bytes, int cols) {
        if (bytes == null) {
            return null;
        }
        double[] flat = fromBytes(bytes);
        if (cols <= 0) {
            if (flat.length != 0) {
                throw new IllegalArgumentException("Non-empty matrix needs a positive column count");
            }
            return new double[0][];
        }
        if (flat.length % cols != 0) {
            throw new IllegalArgumentException(flat.length + " values do not fill rows of " + cols);
        }
        double[][] matrix = new double[flat.length / cols][cols];
        for (int r = 0; r < matrix.length; r++) {
            System.arraycopy(flat, r * cols, matrix[r], 0, cols);
        }
        return matrix;
    }
}
