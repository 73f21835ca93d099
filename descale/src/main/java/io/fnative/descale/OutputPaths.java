package io.fnative.descale;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Result file naming: {@code getfnative-f<frame>-bh<baseHeight>-<n>.<ext>} with the first unused n.
 */
public final class OutputPaths {
    public static final String DEFAULT_DIR = "getfnative_results";

    private OutputPaths() {}

    /** Directory results go to when none is given: next to the input. */
    public static Path defaultDir(Path input) {
        Path parent = input.toAbsolutePath().getParent();
        return (parent == null ? input.toAbsolutePath() : parent).resolve(DEFAULT_DIR);
    }

    public static Path nextFree(Path dir, int frameNo, int baseHeight, String ext) {
        String stem = "getfnative-f" + frameNo + "-bh" + baseHeight;
        int n = 1;
        while (Files.exists(dir.resolve(stem + "-" + n + "." + ext))) n++;
        return dir.resolve(stem + "-" + n + "." + ext);
    }
}
