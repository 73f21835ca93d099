package io.fnative.descale;

import com.codahale.metrics.ConsoleReporter;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.fnative.config.SchedulerConfig;
import io.fnative.error.ComputationException;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * CLI to find the native fractional resolution of upscaled material.
 */
@CommandLine.Command(name = "getfnative", mixinStandardHelpOptions = true,
        description = "Find the native fractional resolution of upscaled material (mostly anime)")
public final class GetFnativeMain implements Callable<Integer> {
    @CommandLine.Option(names = {"--frame", "-f"}, description = "Frame to analyse when the input is a directory of frames", defaultValue = "0")
    int frameNo;

    @CommandLine.Option(names = {"--kernel", "-k"}, description = "Resize kernel: bilinear, bicubic, lanczos, spline16, spline36, spline64", defaultValue = "bicubic")
    String kernel;

    @CommandLine.Option(names = {"--bicubic-b", "-b"}, description = "B parameter of bicubic resize", defaultValue = "0", converter = FractionConverter.class)
    double b;

    @CommandLine.Option(names = {"--bicubic-c", "-c"}, description = "C parameter of bicubic resize", defaultValue = "1/2", converter = FractionConverter.class)
    double c;

    @CommandLine.Option(names = {"--lanczos-taps", "-t"}, description = "Taps parameter of lanczos resize", defaultValue = "3")
    int taps;

    @CommandLine.Option(names = {"--base-height", "-bh"}, description = "Base integer height before cropping", required = true)
    int baseHeight;

    @CommandLine.Option(names = {"--base-width", "-bw"}, description = "Base integer width before cropping; default derived from the aspect ratio")
    Integer baseWidth;

    @CommandLine.Option(names = {"--min-src-height", "-min"}, description = "Minimum native height to consider", defaultValue = "720", converter = FractionConverter.class)
    double minSrcHeight;

    @CommandLine.Option(names = {"--step-length", "-sl"}, description = "Step between candidate heights", defaultValue = "0.25", converter = FractionConverter.class)
    double step;

    @CommandLine.Option(names = {"--threshold", "-thr"}, description = "Differences at or below this are ignored", defaultValue = "0.015", converter = FractionConverter.class)
    double threshold;

    @CommandLine.Option(names = {"--mode", "-m"}, description = "wh (default), w (width only) or h (height only)", defaultValue = "wh")
    String mode;

    @CommandLine.Option(names = {"--save-dir", "-dir"}, description = "Output directory; default getfnative_results next to the input")
    Path saveDir;

    @CommandLine.Option(names = "--prefetch", description = "Candidates computed at once; default worker threads")
    Integer prefetch;

    @CommandLine.Option(names = "--backlog", description = "Candidates buffered ahead of the writer; default 3x prefetch")
    Integer backlog;

    @CommandLine.Option(names = "--threads", description = "Worker threads; default available processors")
    Integer threads;

    @CommandLine.Option(names = "--retries", description = "Extra attempts for a candidate that failed transiently, e.g. out of memory", defaultValue = "0")
    int retries;

    @CommandLine.Option(names = "--metrics", description = "Print scheduler metrics when done")
    boolean printMetrics;

    @CommandLine.Parameters(index = "0", description = "Image file, or directory of frame images")
    Path input;

    public static void main(String[] args) {
        int code = new CommandLine(new GetFnativeMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        long start = System.nanoTime();
        AnalysisRequest request;
        try {
            SchedulerConfig scheduler = SchedulerConfig.fromEnv();
            if (prefetch != null) scheduler = scheduler.withPrefetch(prefetch);
            if (backlog != null) scheduler = scheduler.withBacklog(backlog);
            request = new AnalysisRequest(input, frameNo, baseHeight, baseWidth == null ? 0 : baseWidth,
                    SrcHeights.range(minSrcHeight, baseHeight, step), kernel, b, c, taps, DescaleMode.parse(mode),
                    threshold, threads == null ? AnalysisRequest.defaultThreads() : threads, retries, scheduler);
            Kernels.named(kernel, b, c, taps);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        }

        Injector injector = Guice.createInjector(new DescaleModule(request));
        ErrorCurveAnalysis analysis;
        try {
            analysis = injector.getInstance(ErrorCurveAnalysis.class);
        } catch (ProvisionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            System.err.println("Cannot load " + input + ": " + cause.getMessage());
            return cause instanceof IllegalArgumentException ? 2 : 1;
        }
        if (baseWidth == null) System.out.println("Using base width " + analysis.baseWidth() + ".");

        Path dir = saveDir == null ? OutputPaths.defaultDir(input) : saveDir;
        ErrorCurve curve;
        try {
            Files.createDirectories(dir);
            Path out = OutputPaths.nextFree(dir, frameNo, baseHeight, "csv");
            curve = analysis.run(out, (done, total) -> System.out.print("\r" + done + "/" + total));
            System.out.println();
            System.out.println("Saved error curve to " + out);
        } catch (ComputationException e) {
            System.out.println();
            System.err.println("Failed at src_height " + request.srcHeights()[(int) e.index()] + ": " + e.getCause());
            return 1;
        } catch (IOException e) {
            System.err.println("Cannot write results to " + dir + ": " + e.getMessage());
            return 1;
        }

        List<Double> best = curve.best(5);
        System.out.println("Best candidates: " + best);
        if (printMetrics) {
            ConsoleReporter.forRegistry(injector.getInstance(MetricRegistry.class))
                    .convertDurationsTo(TimeUnit.MILLISECONDS)
                    .build()
                    .report();
        }
        System.out.println(String.format(Locale.ROOT, "Done in %.2fs", (System.nanoTime() - start) / 1e9));
        return 0;
    }
}
