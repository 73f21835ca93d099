package io.fnative.descale;

import io.fnative.core.Sink;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;

/**
 * Appends one {@code src_height,error} row per delivered candidate. Lines end in {@code \n} on every platform.
 */
public class ErrorCurveCsvSink implements Sink<Double> {
    static final String HEADER = "src_height,error\n";

    private final Path file;
    private final double[] srcHeights;

    public ErrorCurveCsvSink(Path file, double[] srcHeights) throws IOException {
        this.file = file;
        this.srcHeights = srcHeights;
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        Files.writeString(file, HEADER, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }

    @Override
    public void accept(long index, Double error) throws IOException {
        String row = String.format(Locale.ROOT, "%s,%.10f\n", format(srcHeights[(int) index]), error);
        Files.writeString(file, row, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    }

    public Path file() { return file; }

    static String format(double h) {
        return h == Math.rint(h) ? String.valueOf((long) h) : String.valueOf(h);
    }
}
