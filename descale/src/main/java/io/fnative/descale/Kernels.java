package io.fnative.descale;

import java.util.Locale;

/**
 * Resampling kernels understood by the descaler, matching the zimg definitions.
 */
public final class Kernels {
    private Kernels() {}

    /**
     * @param name one of bilinear, bicubic, lanczos, spline16, spline36, spline64 (case-insensitive)
     * @param b    bicubic B
     * @param c    bicubic C
     * @param taps lanczos taps
     */
    public static Kernel named(String name, double b, double c, int taps) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "bilinear": return bilinear();
            case "bicubic": return bicubic(b, c);
            case "lanczos": return lanczos(taps);
            case "spline16": return spline16();
            case "spline36": return spline36();
            case "spline64": return spline64();
            default: throw new IllegalArgumentException("invalid kernel specified: " + name);
        }
    }

    public static Kernel bilinear() {
        return of("bilinear", 1, x -> Math.max(0.0, 1.0 - Math.abs(x)));
    }

    /** Mitchell-Netravali family; b=0, c=1/2 is Catmull-Rom. */
    public static Kernel bicubic(double b, double c) {
        double p0 = (6 - 2 * b) / 6;
        double p2 = (-18 + 12 * b + 6 * c) / 6;
        double p3 = (12 - 9 * b - 6 * c) / 6;
        double q0 = (8 * b + 24 * c) / 6;
        double q1 = (-12 * b - 48 * c) / 6;
        double q2 = (6 * b + 30 * c) / 6;
        double q3 = (-b - 6 * c) / 6;
        return of(String.format(Locale.ROOT, "bicubic(b=%s,c=%s)", b, c), 2, v -> {
            double x = Math.abs(v);
            if (x < 1) return p0 + x * x * (p2 + x * p3);
            if (x < 2) return q0 + x * (q1 + x * (q2 + x * q3));
            return 0.0;
        });
    }

    public static Kernel lanczos(int taps) {
        if (taps < 1) throw new IllegalArgumentException("lanczos taps must be >= 1: " + taps);
        return of("lanczos(taps=" + taps + ")", taps, v -> {
            double x = Math.abs(v);
            return x < taps ? sinc(x) * sinc(x / taps) : 0.0;
        });
    }

    public static Kernel spline16() {
        return of("spline16", 2, v -> {
            double x = Math.abs(v);
            if (x < 1) return ((x - 9.0 / 5.0) * x - 1.0 / 5.0) * x + 1.0;
            if (x < 2) {
                x -= 1.0;
                return ((-1.0 / 3.0 * x + 4.0 / 5.0) * x - 7.0 / 15.0) * x;
            }
            return 0.0;
        });
    }

    public static Kernel spline36() {
        return of("spline36", 3, v -> {
            double x = Math.abs(v);
            if (x < 1) return ((13.0 / 11.0 * x - 453.0 / 209.0) * x - 3.0 / 209.0) * x + 1.0;
            if (x < 2) {
                x -= 1.0;
                return ((-6.0 / 11.0 * x + 270.0 / 209.0) * x - 156.0 / 209.0) * x;
            }
            if (x < 3) {
                x -= 2.0;
                return ((1.0 / 11.0 * x - 45.0 / 209.0) * x + 26.0 / 209.0) * x;
            }
            return 0.0;
        });
    }

    public static Kernel spline64() {
        return of("spline64", 4, v -> {
            double x = Math.abs(v);
            if (x < 1) return ((49.0 / 41.0 * x - 6387.0 / 2911.0) * x - 3.0 / 2911.0) * x + 1.0;
            if (x < 2) {
                x -= 1.0;
                return ((-24.0 / 41.0 * x + 4032.0 / 2911.0) * x - 2328.0 / 2911.0) * x;
            }
            if (x < 3) {
                x -= 2.0;
                return ((6.0 / 41.0 * x - 1008.0 / 2911.0) * x + 582.0 / 2911.0) * x;
            }
            if (x < 4) {
                x -= 3.0;
                return ((-1.0 / 41.0 * x + 168.0 / 2911.0) * x - 97.0 / 2911.0) * x;
            }
            return 0.0;
        });
    }

    private static double sinc(double x) {
        if (x == 0.0) return 1.0;
        double px = Math.PI * x;
        return Math.sin(px) / px;
    }

    private static Kernel of(String name, double support, java.util.function.DoubleUnaryOperator f) {
        return new Kernel() {
            @Override public double support() { return support; }
            @Override public double weight(double x) { return f.applyAsDouble(x); }
            @Override public String name() { return name; }
            @Override public String toString() { return name; }
        };
    }
}
