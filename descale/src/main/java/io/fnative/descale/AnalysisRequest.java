package io.fnative.descale;

import io.fnative.config.SchedulerConfig;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * Everything one error-curve run needs. {@code baseWidth <= 0} means derive it from the frame;
 * {@code retries} is the number of extra attempts for a candidate that failed transiently.
 * Equality compares the candidate heights by content.
 */
public record AnalysisRequest(
        Path input,
        int frameNo,
        int baseHeight,
        int baseWidth,
        double[] srcHeights,
        String kernel,
        double b,
        double c,
        int taps,
        DescaleMode mode,
        double threshold,
        int threads,
        int retries,
        SchedulerConfig scheduler
) {
    public AnalysisRequest {
        if (retries < 0) throw new IllegalArgumentException("retries must be >= 0: " + retries);
    }

    public static int defaultThreads() {
        String fromEnv = System.getenv().getOrDefault("FNATIVE_THREADS", String.valueOf(Runtime.getRuntime().availableProcessors()));
        return Integer.parseInt(System.getProperty("fnative.threads", fromEnv));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalysisRequest r)) return false;
        return frameNo == r.frameNo && baseHeight == r.baseHeight && baseWidth == r.baseWidth
                && Double.compare(b, r.b) == 0 && Double.compare(c, r.c) == 0 && taps == r.taps
                && Double.compare(threshold, r.threshold) == 0 && threads == r.threads && retries == r.retries
                && Objects.equals(input, r.input) && Arrays.equals(srcHeights, r.srcHeights)
                && Objects.equals(kernel, r.kernel) && mode == r.mode && Objects.equals(scheduler, r.scheduler);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(input, frameNo, baseHeight, baseWidth, kernel, b, c, taps, mode, threshold, threads, retries, scheduler)
                + Arrays.hashCode(srcHeights);
    }

    @Override
    public String toString() {
        return "AnalysisRequest[input=" + input + ", frameNo=" + frameNo + ", baseHeight=" + baseHeight
                + ", baseWidth=" + baseWidth + ", srcHeights=" + srcHeights.length + " candidates"
                + ", kernel=" + kernel + ", b=" + b + ", c=" + c + ", taps=" + taps + ", mode=" + mode
                + ", threshold=" + threshold + ", threads=" + threads + ", retries=" + retries
                + ", scheduler=" + scheduler + "]";
    }
}
