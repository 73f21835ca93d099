package io.fnative.descale;

/**
 * Descales one axis to a lower resolution by least squares against the upscale and upscales the
 * result back, so that {@code rescale(y) = A (AᵀA)⁻¹ Aᵀ y}.
 */
final class Rescaler {
    static final double RIDGE = 1e-9;

    private final ResampleMatrix upscale;
    private final BandedCholesky normal;

    /**
     * @param fullSize  samples along the axis at the original resolution
     * @param axis      descaled size and the window of it that maps onto the full axis
     */
    Rescaler(int fullSize, Axis axis, Kernel kernel) {
        this.upscale = ResampleMatrix.build(axis.size(), fullSize, axis.srcOffset(), axis.srcSize(), kernel);
        this.normal = BandedCholesky.normalOf(upscale, RIDGE);
    }

    double[] descale(double[] line) {
        return normal.solve(upscale.applyTransposed(line));
    }

    double[] rescale(double[] line) {
        return upscale.apply(descale(line));
    }
}
