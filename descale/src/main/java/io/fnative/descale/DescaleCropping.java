package io.fnative.descale;

/**
 * Geometry of a fractional descale. The candidate height is rarely an integer, so the frame is
 * descaled to the nearest integer size of the same parity as the base size, and the fractional
 * source window is centred inside it.
 */
public final class DescaleCropping {
    private DescaleCropping() {}

    /**
     * Width matching {@code height} at the frame's aspect ratio, forced even only when height is even.
     */
    public static int baseWidth(int frameWidth, int frameHeight, int height) {
        int width = (int) Math.ceil((double) height * frameWidth / frameHeight);
        if (height % 2 == 0) width = width / 2 * 2;
        return width;
    }

    public static CroppingArgs args(int frameWidth, int frameHeight, double srcHeight, int baseHeight, int baseWidth, DescaleMode mode) {
        if (baseHeight < srcHeight) {
            throw new IllegalArgumentException("base height " + baseHeight + " is below source height " + srcHeight);
        }
        double srcWidth = srcHeight * frameWidth / frameHeight;
        int croppedWidth = baseWidth - 2 * (int) Math.floor((baseWidth - srcWidth) / 2);
        int croppedHeight = baseHeight - 2 * (int) Math.floor((baseHeight - srcHeight) / 2);
        Axis w = new Axis(croppedWidth, srcWidth, (croppedWidth - srcWidth) / 2);
        Axis h = new Axis(croppedHeight, srcHeight, (croppedHeight - srcHeight) / 2);
        return new CroppingArgs(mode.horizontal() ? w : null, mode.vertical() ? h : null);
    }
}
