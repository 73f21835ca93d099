package io.fnative.descale;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class OutputPathsTest {
    @TempDir
    Path dir;

    @Test
    void picks_first_unused_number() throws Exception {
        Path first = OutputPaths.nextFree(dir, 3, 720, "csv");
        assertEquals(dir.resolve("getfnative-f3-bh720-1.csv"), first);
        Files.createFile(first);
        assertEquals(dir.resolve("getfnative-f3-bh720-2.csv"), OutputPaths.nextFree(dir, 3, 720, "csv"));
        assertEquals(dir.resolve("getfnative-f3-bh810-1.csv"), OutputPaths.nextFree(dir, 3, 810, "csv"));
    }

    @Test
    void default_dir_sits_next_to_input() {
        Path input = dir.resolve("show/ep01.png");
        assertEquals(dir.resolve("show/getfnative_results"), OutputPaths.defaultDir(input));
    }
}
