package io.fnative.descale;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GetFnativeMainTest {
    @TempDir
    Path dir;

    private Path writeFrame() throws Exception {
        LumaFrame frame = Frames.upscaledColumns(32, 30, 45, Kernels.bicubic(0, 0.5), 9);
        BufferedImage img = new BufferedImage(frame.width(), frame.height(), BufferedImage.TYPE_BYTE_GRAY);
        for (int y = 0; y < frame.height(); y++) {
            for (int x = 0; x < frame.width(); x++) {
                int v = (int) Math.round(frame.get(x, y) * 255);
                img.getRaster().setSample(x, y, 0, Math.max(0, Math.min(255, v)));
            }
        }
        Path file = dir.resolve("clip/frame.png");
        Files.createDirectories(file.getParent());
        ImageIO.write(img, "png", file.toFile());
        return file;
    }

    private static int run(String... args) {
        return new CommandLine(new GetFnativeMain()).execute(args);
    }

    @Test
    void writes_numbered_curves_next_to_input() throws Exception {
        Path input = writeFrame();
        String[] args = {"-bh", "36", "-min", "28", "-sl", "1", "-m", "h", "--threads", "2", "--prefetch", "2", input.toString()};
        assertEquals(0, run(args));
        assertEquals(0, run(args));

        Path results = input.getParent().resolve("getfnative_results");
        List<String> lines = Files.readAllLines(results.resolve("getfnative-f0-bh36-1.csv"));
        assertEquals(10, lines.size());
        assertEquals("src_height,error", lines.get(0));
        assertTrue(Files.exists(results.resolve("getfnative-f0-bh36-2.csv")));
    }

    @Test
    void save_dir_and_fraction_options() throws Exception {
        Path input = writeFrame();
        Path out = dir.resolve("out");
        assertEquals(0, run("-bh", "36", "-min", "30", "-sl", "3/2", "-k", "lanczos", "-t", "2", "-dir", out.toString(),
                "--threads", "1", "--retries", "2", "--metrics", input.toString()));
        assertEquals(6, Files.readAllLines(out.resolve("getfnative-f0-bh36-1.csv")).size());
    }

    @Test
    void bad_arguments_exit_with_usage_code() throws Exception {
        Path input = writeFrame();
        assertEquals(2, run("-bh", "36", "-k", "point", input.toString()));
        assertEquals(2, run("-bh", "36", "-min", "40", input.toString()));
        assertEquals(2, run("-bh", "36", "-b", "x", input.toString()));
        assertEquals(2, run(input.toString()));
        assertEquals(2, run("-bh", "36", "-min", "28", "--retries", "-1", input.toString()));
        assertEquals(2, run("-bh", "36", "-min", "28", "-f", "3", input.toString()));
    }

    @Test
    void unreadable_input_fails() {
        assertEquals(1, run("-bh", "36", "-min", "28", dir.resolve("missing.png").toString()));
    }
}
