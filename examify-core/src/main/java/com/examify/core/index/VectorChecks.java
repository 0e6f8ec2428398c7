package com.examify.core.index;

final class VectorChecks {

    private VectorChecks() {}

    static void requireDimension(float[] vector, int dimension) {
        if (vector == null || vector.length != dimension) {
            throw new IllegalArgumentException(String.format(
                "Vector dimension %d does not match index dimension %d",
                vector == null ? 0 : vector.length, dimension));
        }
    }

    static String toVectorLiteral(float[] vector) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(vector[i]);
        }
        return sb.append(']').toString();
    }
}
