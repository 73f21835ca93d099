package io.fnative.descale;

/**
 * Separable resampling filter, symmetric around zero.
 */
public interface Kernel {
    /** Radius beyond which the weight is zero, in source samples at unit scale. */
    double support();

    double weight(double x);

    String name();
}
