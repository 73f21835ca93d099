package io.fnative.descale;

/**
 * Cholesky factorisation of a symmetric positive definite band matrix, stored as its lower band.
 */
final class BandedCholesky {
    private final int n;
    private final int bw;
    private final double[][] l; // l[i][d] = L(i, i - d)

    /**
     * @param band lower band of the matrix, {@code band[i][d] = M(i, i - d)} for {@code d <= bw}; consumed
     */
    BandedCholesky(double[][] band, int bw) {
        this.n = band.length;
        this.bw = bw;
        this.l = band;
        for (int i = 0; i < n; i++) {
            for (int j = Math.max(0, i - bw); j <= i; j++) {
                double sum = l[i][i - j];
                for (int k = Math.max(0, i - bw); k < j; k++) {
                    sum -= l[i][i - k] * l[j][j - k];
                }
                if (i == j) {
                    if (!(sum > 0)) throw new ArithmeticException("matrix not positive definite at row " + i);
                    l[i][0] = Math.sqrt(sum);
                } else {
                    l[i][i - j] = sum / l[j][0];
                }
            }
        }
    }

    /** Builds the normal matrix {@code AᵀA + ridge·I} of a resampling matrix and factorises it. */
    static BandedCholesky normalOf(ResampleMatrix a, double ridge) {
        int bw = a.bandwidth();
        double[][] band = new double[a.cols][bw + 1];
        for (int r = 0; r < a.rows; r++) {
            double[] w = a.weights[r];
            int o = a.offset[r];
            for (int p = 0; p < w.length; p++) {
                for (int q = 0; q <= p; q++) {
                    band[o + p][p - q] += w[p] * w[q];
                }
            }
        }
        for (int i = 0; i < band.length; i++) band[i][0] += ridge;
        return new BandedCholesky(band, bw);
    }

    double[] solve(double[] b) {
        double[] z = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = b[i];
            for (int k = Math.max(0, i - bw); k < i; k++) sum -= l[i][i - k] * z[k];
            z[i] = sum / l[i][0];
        }
        double[] x = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            double sum = z[i];
            for (int k = i + 1; k <= Math.min(n - 1, i + bw); k++) sum -= l[k][k - i] * x[k];
            x[i] = sum / l[i][0];
        }
        return x;
    }
}
