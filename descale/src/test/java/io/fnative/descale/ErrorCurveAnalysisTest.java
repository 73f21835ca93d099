package io.fnative.descale;

import com.codahale.metrics.MetricRegistry;
import io.fnative.config.SchedulerConfig;
import io.fnative.core.IndexedTask;
import io.fnative.error.ComputationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorCurveAnalysisTest {
    @TempDir
    Path dir;

    private AnalysisRequest request(double[] heights, SchedulerConfig scheduler) {
        return request(heights, scheduler, 0);
    }

    private AnalysisRequest request(double[] heights, SchedulerConfig scheduler, int retries) {
        return new AnalysisRequest(dir.resolve("frame.png"), 0, 36, 0, heights, "bicubic", 0, 0.5, 3,
                DescaleMode.H, 0, 3, retries, scheduler);
    }

    private static IndexedTask<Double> outOfMemoryOnceAt(long failing, AtomicInteger attempts) {
        return index -> {
            if (index == failing && attempts.incrementAndGet() == 1) throw new OutOfMemoryError("frame buffer");
            return (double) index;
        };
    }

    @Test
    void finds_native_height_and_writes_curve_in_order() throws Exception {
        Kernel kernel = Kernels.bicubic(0, 0.5);
        LumaFrame frame = Frames.upscaledColumns(32, 30, 45, kernel, 5);
        double[] heights = SrcHeights.range(28, 36, 0.5);
        MetricRegistry registry = new MetricRegistry();
        ErrorCurveAnalysis analysis = new ErrorCurveAnalysis(request(heights, SchedulerConfig.defaults().withPrefetch(2)), frame, kernel, registry);
        assertEquals(DescaleCropping.baseWidth(32, 45, 36), analysis.baseWidth());

        List<Long> progress = new ArrayList<>();
        Path out = dir.resolve("curve.csv");
        ErrorCurve curve = analysis.run(out, (done, total) -> {
            assertEquals(heights.length, total);
            progress.add(done);
        });

        assertEquals(heights.length, curve.size());
        assertEquals(30.0, curve.best(1).get(0));
        assertEquals(0.0, curve.errors()[4], 1e-6);
        for (int i = 0; i < progress.size(); i++) assertEquals(i + 1L, progress.get(i).longValue());

        List<String> lines = Files.readAllLines(out);
        assertEquals(heights.length + 1, lines.size());
        assertEquals("28,", lines.get(1).substring(0, 3));
        assertTrue(lines.get(5).startsWith("30,"));
        assertEquals(heights.length, registry.meter("descale.delivered").getCount());
        assertFalse(registry.getGauges().containsKey("descale.outstanding"));
    }

    @Test
    void explicit_base_width_is_kept() {
        Kernel kernel = Kernels.bilinear();
        LumaFrame frame = new LumaFrame(32, 45, new double[32 * 45]);
        AnalysisRequest r = new AnalysisRequest(dir.resolve("f.png"), 0, 36, 30, new double[]{30, 31}, "bilinear", 0, 0.5, 3,
                DescaleMode.WH, 0.015, 1, 0, SchedulerConfig.defaults());
        assertEquals(30, new ErrorCurveAnalysis(r, frame, kernel, new MetricRegistry()).baseWidth());
    }

    @Test
    void transient_failure_is_retried_when_enabled() throws Exception {
        LumaFrame frame = new LumaFrame(32, 45, new double[32 * 45]);
        double[] heights = {28, 29, 30, 31, 32};
        AtomicInteger attempts = new AtomicInteger();
        ErrorCurveAnalysis analysis = new ErrorCurveAnalysis(request(heights, SchedulerConfig.defaults(), 2), frame,
                Kernels.bilinear(), new MetricRegistry());

        ErrorCurve curve = analysis.run(dir.resolve("retried.csv"), (done, total) -> {}, outOfMemoryOnceAt(2, attempts));

        assertEquals(2, attempts.get());
        assertArrayEquals(new double[]{0, 1, 2, 3, 4}, curve.errors());
        assertEquals(heights.length + 1, Files.readAllLines(dir.resolve("retried.csv")).size());
    }

    @Test
    void failure_without_retries_stops_at_its_candidate() throws Exception {
        LumaFrame frame = new LumaFrame(32, 45, new double[32 * 45]);
        double[] heights = {28, 29, 30, 31, 32};
        AtomicInteger attempts = new AtomicInteger();
        ErrorCurveAnalysis analysis = new ErrorCurveAnalysis(request(heights, SchedulerConfig.defaults()), frame,
                Kernels.bilinear(), new MetricRegistry());

        ComputationException e = assertThrows(ComputationException.class,
                () -> analysis.run(dir.resolve("failed.csv"), (done, total) -> {}, outOfMemoryOnceAt(2, attempts)));

        assertEquals(2, e.index());
        assertInstanceOf(OutOfMemoryError.class, e.getCause());
        assertEquals(1, attempts.get());
        assertEquals(List.of("src_height,error", "28,0.0000000000", "29,1.0000000000"), Files.readAllLines(dir.resolve("failed.csv")));
    }

    @Test
    void requests_compare_heights_by_content() {
        AnalysisRequest a = request(new double[]{30, 31}, SchedulerConfig.defaults());
        AnalysisRequest b = request(new double[]{30, 31}, SchedulerConfig.defaults());
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, request(new double[]{30, 32}, SchedulerConfig.defaults()));
        assertNotEquals(a, request(new double[]{30, 31}, SchedulerConfig.defaults(), 1));
        assertThrows(IllegalArgumentException.class, () -> request(new double[]{30}, SchedulerConfig.defaults(), -1));
    }
}
