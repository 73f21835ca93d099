package io.fnative.descale;

/**
 * Sparse row-banded matrix resampling a line of {@code cols} samples to {@code rows} samples.
 * <p>
 * Output sample {@code i} sits at {@code left + (i + 0.5) * width / rows - 0.5} in source
 * coordinates, where {@code [left, left + width)} is the active source window. When shrinking,
 * the kernel is stretched by the scale factor. Taps past either edge fold onto the edge sample.
 * Every row sums to one.
 */
final class ResampleMatrix {
    final int rows;
    final int cols;
    final int[] offset;
    final double[][] weights;

    private ResampleMatrix(int rows, int cols, int[] offset, double[][] weights) {
        this.rows = rows;
        this.cols = cols;
        this.offset = offset;
        this.weights = weights;
    }

    static ResampleMatrix build(int srcSize, int dstSize, double srcLeft, double srcWidth, Kernel kernel) {
        if (srcSize <= 0 || dstSize <= 0) throw new IllegalArgumentException("sizes must be positive: " + srcSize + " -> " + dstSize);
        if (!(srcWidth > 0)) throw new IllegalArgumentException("source window must be positive: " + srcWidth);
        double scale = dstSize / srcWidth;
        double stretch = Math.min(1.0, scale);
        double support = kernel.support() / stretch;

        int[] offset = new int[dstSize];
        double[][] weights = new double[dstSize][];
        for (int i = 0; i < dstSize; i++) {
            double pos = srcLeft + (i + 0.5) / scale - 0.5;
            int first = (int) Math.ceil(pos - support);
            int last = (int) Math.floor(pos + support);
            int lo = clamp(first, srcSize);
            int hi = clamp(last, srcSize);
            double[] w = new double[hi - lo + 1];
            double sum = 0;
            for (int k = first; k <= last; k++) {
                double v = kernel.weight((k - pos) * stretch);
                w[clamp(k, srcSize) - lo] += v;
                sum += v;
            }
            if (sum == 0) throw new IllegalStateException("kernel " + kernel.name() + " has no weight at output " + i);
            for (int k = 0; k < w.length; k++) w[k] /= sum;
            offset[i] = lo;
            weights[i] = w;
        }
        return new ResampleMatrix(dstSize, srcSize, offset, weights);
    }

    double[] apply(double[] src) {
        double[] dst = new double[rows];
        for (int i = 0; i < rows; i++) {
            double acc = 0;
            double[] w = weights[i];
            int o = offset[i];
            for (int k = 0; k < w.length; k++) acc += w[k] * src[o + k];
            dst[i] = acc;
        }
        return dst;
    }

    /** Transpose product {@code Aᵀ y}. */
    double[] applyTransposed(double[] y) {
        double[] out = new double[cols];
        for (int i = 0; i < rows; i++) {
            double[] w = weights[i];
            int o = offset[i];
            for (int k = 0; k < w.length; k++) out[o + k] += w[k] * y[i];
        }
        return out;
    }

    /** Widest distance between two columns touched by one row. */
    int bandwidth() {
        int bw = 0;
        for (double[] w : weights) bw = Math.max(bw, w.length - 1);
        return bw;
    }

    private static int clamp(int k, int size) {
        return Math.min(Math.max(k, 0), size - 1);
    }
}
