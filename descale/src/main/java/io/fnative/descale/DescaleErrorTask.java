package io.fnative.descale;

import io.fnative.core.IndexedTask;

/**
 * Rescale error of one frame for candidate {@code srcHeights[index]}.
 */
public class DescaleErrorTask implements IndexedTask<Double> {
    private final LumaFrame frame;
    private final double[] srcHeights;
    private final int baseHeight;
    private final int baseWidth;
    private final DescaleMode mode;
    private final Kernel kernel;
    private final double threshold;

    public DescaleErrorTask(LumaFrame frame, double[] srcHeights, int baseHeight, int baseWidth, DescaleMode mode, Kernel kernel, double threshold) {
        this.frame = frame;
        this.srcHeights = srcHeights;
        this.baseHeight = baseHeight;
        this.baseWidth = baseWidth;
        this.mode = mode;
        this.kernel = kernel;
        this.threshold = threshold;
    }

    @Override
    public Double compute(long index) {
        CroppingArgs args = DescaleCropping.args(frame.width(), frame.height(), srcHeights[(int) index], baseHeight, baseWidth, mode);
        return RescaleError.compute(frame, args, kernel, threshold);
    }
}
