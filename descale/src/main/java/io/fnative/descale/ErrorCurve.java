package io.fnative.descale;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Rescale error per candidate source height. Native resolutions show up as sharp local minima.
 * Equality compares the array contents.
 */
public record ErrorCurve(double[] srcHeights, double[] errors) {
    public ErrorCurve {
        if (srcHeights.length != errors.length) {
            throw new IllegalArgumentException(srcHeights.length + " heights but " + errors.length + " errors");
        }
    }

    public int size() { return srcHeights.length; }

    @Override
    public boolean equals(Object o) {
        return o instanceof ErrorCurve other
                && Arrays.equals(srcHeights, other.srcHeights)
                && Arrays.equals(errors, other.errors);
    }

    @Override
    public int hashCode() { return 31 * Arrays.hashCode(srcHeights) + Arrays.hashCode(errors); }

    @Override
    public String toString() {
        return "ErrorCurve[srcHeights=" + Arrays.toString(srcHeights) + ", errors=" + Arrays.toString(errors) + "]";
    }

    /** Indices of interior local minima, lowest error first. */
    public List<Integer> localMinima() {
        List<Integer> out = new ArrayList<>();
        for (int i = 1; i < errors.length - 1; i++) {
            if (errors[i] < errors[i - 1] && errors[i] < errors[i + 1]) out.add(i);
        }
        out.sort(Comparator.comparingDouble(i -> errors[i]));
        return out;
    }

    /** Up to {@code limit} candidate heights, local minima first, falling back to the global minimum. */
    public List<Double> best(int limit) {
        List<Double> out = new ArrayList<>();
        for (int i : localMinima()) {
            if (out.size() >= limit) break;
            out.add(srcHeights[i]);
        }
        if (out.isEmpty() && errors.length > 0) {
            int min = 0;
            for (int i = 1; i < errors.length; i++) if (errors[i] < errors[min]) min = i;
            out.add(srcHeights[min]);
        }
        return out;
    }
}
