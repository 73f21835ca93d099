package io.fnative.descale;

/**
 * Error between a frame and the same frame descaled to a candidate geometry and upscaled back.
 */
public final class RescaleError {
    /** Border excluded from the average, in pixels. */
    public static final int CROP = 10;

    private RescaleError() {}

    /**
     * Mean of {@code |rescaled - frame|} over the frame without its border, where differences at or
     * below {@code threshold} count as zero.
     */
    public static double compute(LumaFrame frame, CroppingArgs args, Kernel kernel, double threshold) {
        int w = frame.width();
        int h = frame.height();
        if (w <= 2 * CROP || h <= 2 * CROP) {
            throw new IllegalArgumentException("frame " + w + "x" + h + " too small for a " + CROP + " pixel border");
        }
        double[] plane = rescale(frame, args, kernel);
        double sum = 0;
        for (int y = CROP; y < h - CROP; y++) {
            for (int x = CROP; x < w - CROP; x++) {
                double d = Math.abs(plane[y * w + x] - frame.get(x, y));
                if (d > threshold) sum += d;
            }
        }
        return sum / ((double) (w - 2 * CROP) * (h - 2 * CROP));
    }

    static double[] rescale(LumaFrame frame, CroppingArgs args, Kernel kernel) {
        int w = frame.width();
        int h = frame.height();
        double[] plane = frame.copy();
        if (args.width().isPresent()) {
            Rescaler rx = new Rescaler(w, args.horizontal(), kernel);
            for (int y = 0; y < h; y++) {
                double[] row = new double[w];
                System.arraycopy(plane, y * w, row, 0, w);
                System.arraycopy(rx.rescale(row), 0, plane, y * w, w);
            }
        }
        if (args.height().isPresent()) {
            Rescaler ry = new Rescaler(h, args.vertical(), kernel);
            double[] col = new double[h];
            for (int x = 0; x < w; x++) {
                for (int y = 0; y < h; y++) col[y] = plane[y * w + x];
                double[] out = ry.rescale(col);
                for (int y = 0; y < h; y++) plane[y * w + x] = out[y];
            }
        }
        return plane;
    }
}
