package io.fnative.descale;

/**
 * Candidate source heights to evaluate.
 */
public final class SrcHeights {
    private SrcHeights() {}

    /** {@code min, min + step, ...} up to and including the last value not above {@code baseHeight}. */
    public static double[] range(double min, int baseHeight, double step) {
        if (!(step > 0.0)) throw new IllegalArgumentException("step length must be > 0: " + step);
        if (!(min < baseHeight - step)) {
            throw new IllegalArgumentException("minimum source height " + min + " must be below base height " + baseHeight + " minus one step");
        }
        int count = (int) Math.floor((baseHeight - min) / step) + 1;
        double[] out = new double[count];
        for (int n = 0; n < count; n++) out[n] = min + n * step;
        return out;
    }
}
