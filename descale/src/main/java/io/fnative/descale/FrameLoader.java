package io.fnative.descale;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads the frame to analyse: a single image file, or the n-th image (by file name) of a directory.
 */
public final class FrameLoader {
    static final Set<String> EXTENSIONS = Set.of("png", "jpg", "jpeg", "bmp", "gif");

    private FrameLoader() {}

    public static LumaFrame load(Path input, int frameNo) throws IOException {
        if (frameNo < 0) throw new IllegalArgumentException("frame must be >= 0: " + frameNo);
        Path file;
        if (Files.isDirectory(input)) {
            List<Path> frames = list(input);
            if (frameNo >= frames.size()) {
                throw new IllegalArgumentException("frame " + frameNo + " out of range, " + input + " holds " + frames.size() + " frames");
            }
            file = frames.get(frameNo);
        } else {
            if (!isImage(input)) throw new IllegalArgumentException("unsupported input " + input + ", expected one of " + EXTENSIONS);
            if (frameNo != 0) throw new IllegalArgumentException("frame " + frameNo + " out of range, " + input + " is a single frame");
            file = input;
        }
        BufferedImage img = ImageIO.read(file.toFile());
        if (img == null) throw new IOException("no image reader for " + file);
        return LumaFrame.of(img);
    }

    static List<Path> list(Path dir) throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile).filter(FrameLoader::isImage).sorted().collect(Collectors.toList());
        }
    }

    static boolean isImage(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
