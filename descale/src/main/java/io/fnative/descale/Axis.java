package io.fnative.descale;

/**
 * One axis of a fractional descale: the integer size to descale to, and the fractional window
 * {@code [srcOffset, srcOffset + srcSize)} of it that covers the full source axis.
 */
public record Axis(int size, double srcSize, double srcOffset) {}
