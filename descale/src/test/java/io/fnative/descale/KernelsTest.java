package io.fnative.descale;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class KernelsTest {
    @Test
    void catmull_rom_interpolates() {
        Kernel k = Kernels.bicubic(0, 0.5);
        assertEquals(2, k.support());
        assertEquals(1.0, k.weight(0), 1e-12);
        assertEquals(0.0, k.weight(1), 1e-12);
        assertEquals(0.0, k.weight(-1), 1e-12);
        assertEquals(0.0, k.weight(2.5), 1e-12);
    }

    @Test
    void bilinear_is_a_tent() {
        Kernel k = Kernels.bilinear();
        assertEquals(0.5, k.weight(0.5), 1e-12);
        assertEquals(0.5, k.weight(-0.5), 1e-12);
        assertEquals(0.0, k.weight(1.2), 1e-12);
    }

    @Test
    void lanczos_vanishes_at_integers() {
        Kernel k = Kernels.lanczos(3);
        assertEquals(3, k.support());
        assertEquals(1.0, k.weight(0), 1e-12);
        assertEquals(0.0, k.weight(1), 1e-12);
        assertEquals(0.0, k.weight(2), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> Kernels.lanczos(0));
    }

    @Test
    void splines_interpolate() {
        for (Kernel k : new Kernel[]{Kernels.spline16(), Kernels.spline36(), Kernels.spline64()}) {
            assertEquals(1.0, k.weight(0), 1e-12, k.name());
            assertEquals(0.0, k.weight(1), 1e-12, k.name());
            assertEquals(0.0, k.weight(k.support()), 1e-12, k.name());
        }
    }

    @Test
    void lookup_by_name() {
        assertEquals("spline36", Kernels.named("Spline36", 0, 0.5, 3).name());
        assertEquals("lanczos(taps=4)", Kernels.named("lanczos", 0, 0.5, 4).name());
        assertTrue(Kernels.named("BICUBIC", 1.0 / 3, 1.0 / 3, 3).name().startsWith("bicubic"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Kernels.named("point", 0, 0.5, 3));
        assertTrue(e.getMessage().contains("invalid kernel"));
    }
}
