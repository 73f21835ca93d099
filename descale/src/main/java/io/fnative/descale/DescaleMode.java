package io.fnative.descale;

import java.util.Locale;

/**
 * Which axes are descaled.
 */
public enum DescaleMode {
    W(true, false),
    H(false, true),
    WH(true, true);

    private final boolean horizontal;
    private final boolean vertical;

    DescaleMode(boolean horizontal, boolean vertical) {
        this.horizontal = horizontal;
        this.vertical = vertical;
    }

    public boolean horizontal() { return horizontal; }
    public boolean vertical() { return vertical; }

    /** Accepts any spelling containing {@code w} and/or {@code h}, e.g. "wh", "hw", "W". */
    public static DescaleMode parse(String s) {
        String m = s.toLowerCase(Locale.ROOT);
        boolean w = m.contains("w");
        boolean h = m.contains("h");
        if (w && h) return WH;
        if (w) return W;
        if (h) return H;
        throw new IllegalArgumentException("mode must be w, h or wh: " + s);
    }
}
