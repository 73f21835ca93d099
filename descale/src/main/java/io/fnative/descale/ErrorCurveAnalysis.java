package io.fnative.descale;

import com.codahale.metrics.MetricRegistry;
import io.fnative.core.IndexedTask;
import io.fnative.core.WorkSource;
import io.fnative.retry.ExponentialBackoffRetryPolicy;
import io.fnative.runtime.Drain;
import io.fnative.runtime.ReorderScheduler;
import io.fnative.runtime.ReorderSchedulerBuilder;
import io.fnative.source.ExecutorWorkSource;
import io.fnative.source.RetryingWorkSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Computes the rescale error for every candidate height on a worker pool and collects the curve
 * in candidate order, writing each row to CSV as soon as it is next in line.
 */
public class ErrorCurveAnalysis {
    private static final Logger log = LoggerFactory.getLogger(ErrorCurveAnalysis.class);
    static final long RETRY_BASE_MILLIS = 100;
    static final long RETRY_MAX_MILLIS = 2_000;

    /** Called on the consumer thread after each delivered candidate. */
    public interface Progress {
        void update(long done, int total);
    }

    private final AnalysisRequest request;
    private final LumaFrame frame;
    private final Kernel kernel;
    private final MetricRegistry registry;
    private final int baseWidth;

    public ErrorCurveAnalysis(AnalysisRequest request, LumaFrame frame, Kernel kernel, MetricRegistry registry) {
        this.request = request;
        this.frame = frame;
        this.kernel = kernel;
        this.registry = registry;
        this.baseWidth = request.baseWidth() > 0
                ? request.baseWidth()
                : DescaleCropping.baseWidth(frame.width(), frame.height(), request.baseHeight());
    }

    public int baseWidth() { return baseWidth; }

    /**
     * @throws io.fnative.error.ComputationException when a candidate could not be evaluated
     */
    public ErrorCurve run(Path output, Progress progress) throws Exception {
        DescaleErrorTask task = new DescaleErrorTask(frame, request.srcHeights(), request.baseHeight(), baseWidth,
                request.mode(), kernel, request.threshold());
        return run(output, progress, task);
    }

    ErrorCurve run(Path output, Progress progress, IndexedTask<Double> task) throws Exception {
        double[] heights = request.srcHeights();
        double[] errors = new double[heights.length];
        log.info("frame {}x{}: {} candidates {}..{}, base {}x{}, kernel {}, mode {}",
                frame.width(), frame.height(), heights.length, heights[0], heights[heights.length - 1],
                baseWidth, request.baseHeight(), kernel, request.mode());

        try (ExecutorWorkSource<Double> pool = ExecutorWorkSource.bounded(task, heights.length, request.threads());
             ErrorCurveCsvSink csv = new ErrorCurveCsvSink(output, heights)) {
            WorkSource<Double> source = pool;
            if (request.retries() > 0) {
                source = new RetryingWorkSource<>(pool,
                        ExponentialBackoffRetryPolicy.withRetries(request.retries(), RETRY_BASE_MILLIS, RETRY_MAX_MILLIS));
            }
            ReorderScheduler<Double> scheduler = new ReorderSchedulerBuilder<Double>()
                    .source(source)
                    .config(request.scheduler())
                    .name("descale")
                    .metrics(registry)
                    .build();
            log.debug("scheduler prefetch={} backlog={} retries={}", scheduler.prefetch(), scheduler.backlog(), request.retries());
            Drain.to(scheduler, (index, error) -> {
                errors[(int) index] = error;
                csv.accept(index, error);
                progress.update(index + 1, heights.length);
            });
        }
        log.info("wrote {}", output);
        return new ErrorCurve(heights, errors);
    }
}
