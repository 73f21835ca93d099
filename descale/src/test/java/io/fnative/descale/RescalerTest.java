package io.fnative.descale;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class RescalerTest {
    @Test
    void rows_of_resample_matrix_sum_to_one() {
        ResampleMatrix m = ResampleMatrix.build(30, 45, 0.75, 28.5, Kernels.spline36());
        for (double[] row : m.weights) {
            double sum = 0;
            for (double w : row) sum += w;
            assertEquals(1.0, sum, 1e-12);
        }
        assertEquals(45, m.rows);
        assertEquals(30, m.cols);
    }

    @Test
    void descale_recovers_upscaled_line() {
        Kernel k = Kernels.bicubic(0, 0.5);
        double[] x = new double[30];
        Random rnd = new Random(7);
        for (int i = 0; i < x.length; i++) x[i] = rnd.nextDouble();
        double[] y = ResampleMatrix.build(30, 40, 0, 30, k).apply(x);

        Rescaler r = new Rescaler(40, new Axis(30, 30, 0), k);
        assertArrayEquals(x, r.descale(y), 1e-6);
        assertArrayEquals(y, r.rescale(y), 1e-6);
    }

    @Test
    void descale_recovers_fractional_window() {
        Kernel k = Kernels.lanczos(3);
        Axis axis = new Axis(32, 30.5, 0.75);
        double[] x = new double[32];
        for (int i = 0; i < x.length; i++) x[i] = Math.cos(0.3 * i);
        double[] y = ResampleMatrix.build(32, 48, axis.srcOffset(), axis.srcSize(), k).apply(x);
        assertArrayEquals(y, new Rescaler(48, axis, k).rescale(y), 1e-5);
    }

    @Test
    void rescale_of_arbitrary_line_is_a_projection() {
        Kernel k = Kernels.bilinear();
        Rescaler r = new Rescaler(20, new Axis(12, 12, 0), k);
        double[] y = new double[20];
        Random rnd = new Random(3);
        for (int i = 0; i < y.length; i++) y[i] = rnd.nextDouble();
        double[] once = r.rescale(y);
        assertArrayEquals(once, r.rescale(once), 1e-6);
    }
}
