package io.fnative.descale;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;

/**
 * Single-plane floating point frame in [0, 1], row major. Treated as read-only once built.
 */
public final class LumaFrame {
    private static final double KR = 0.2126;
    private static final double KB = 0.0722;

    private final int width;
    private final int height;
    private final double[] data;

    public LumaFrame(int width, int height, double[] data) {
        if (width <= 0 || height <= 0) throw new IllegalArgumentException("empty frame " + width + "x" + height);
        if (data.length != width * height) throw new IllegalArgumentException("expected " + width * height + " samples, got " + data.length);
        this.width = width;
        this.height = height;
        this.data = data;
    }

    /** Grey images are taken as they are; colour images are reduced to BT.709 luma. */
    public static LumaFrame of(BufferedImage img) {
        int w = img.getWidth();
        int h = img.getHeight();
        double[] out = new double[w * h];
        Raster raster = img.getRaster();
        boolean grey = raster.getNumBands() <= 2 && !(img.getColorModel() instanceof IndexColorModel);
        if (grey) {
            double max = (1L << img.getColorModel().getComponentSize(0)) - 1;
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) out[y * w + x] = raster.getSampleDouble(x, y, 0) / max;
            }
        } else {
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    int rgb = img.getRGB(x, y);
                    double r = ((rgb >> 16) & 0xff) / 255.0;
                    double g = ((rgb >> 8) & 0xff) / 255.0;
                    double b = (rgb & 0xff) / 255.0;
                    out[y * w + x] = KR * r + (1 - KR - KB) * g + KB * b;
                }
            }
        }
        return new LumaFrame(w, h, out);
    }

    public int width() { return width; }
    public int height() { return height; }

    public double get(int x, int y) { return data[y * width + x]; }

    double[] copy() { return data.clone(); }
}
