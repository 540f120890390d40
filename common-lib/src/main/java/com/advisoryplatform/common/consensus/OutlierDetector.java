package com.advisoryplatform.common.consensus;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Interquartile-range outlier test over peer confidences.
 *
 * <h3>Algorithm (n ≥ 4)</h3>
 * <ol>
 *   <li>Quartiles by linear interpolation on the sorted sample: position {@code p·(n−1)}.</li>
 *   <li>IQR floored at {@link #MIN_IQR}, so near-identical confidences never produce an outlier.</li>
 *   <li>Fences at {@code Q1 − 1.5·IQR} and {@code Q3 + 1.5·IQR}.</li>
 *   <li>The value furthest beyond its fence is reported; ties go to the first in input order.</li>
 * </ol>
 *
 * <h3>Small samples</h3>
 * <pre>
 *   n &lt; 3  → never an outlier
 *   n = 3  → flagged only when one value is more than 0.5 from the median
 *            and the other two are within 0.1 of each other
 * </pre>
 */
public final class OutlierDetector {

    public static final double FENCE_FACTOR        = 1.5;
    public static final double TRIO_MEDIAN_GAP     = 0.5;
    public static final double TRIO_PAIR_TOLERANCE = 0.1;

    /** Smallest spread the fences are built from; a value must sit 0.075 past Q1 or Q3 to count. */
    public static final double MIN_IQR             = 0.05;

    /** Absorbs floating-point noise at the fence boundary. */
    private static final double EPSILON = 1e-9;

    private OutlierDetector() {}

    /**
     * @param confidences sample in input order; not modified
     * @return index of the outlier in {@code confidences}, or empty
     */
    public static OptionalInt detect(double[] confidences) {
        int n = confidences.length;
        if (n < 3) {
            return OptionalInt.empty();
        }
        if (n == 3) {
            return detectInTrio(confidences);
        }

        double[] sorted = confidences.clone();
        Arrays.sort(sorted);
        double q1  = quantile(sorted, 0.25);
        double q3  = quantile(sorted, 0.75);
        double iqr = Math.max(q3 - q1, MIN_IQR);
        double lowerFence = q1 - FENCE_FACTOR * iqr;
        double upperFence = q3 + FENCE_FACTOR * iqr;

        int    worst       = -1;
        double worstExcess = EPSILON;
        for (int i = 0; i < n; i++) {
            double excess = Math.max(lowerFence - confidences[i], confidences[i] - upperFence);
            if (excess > worstExcess) {
                worst       = i;
                worstExcess = excess;
            }
        }
        return worst < 0 ? OptionalInt.empty() : OptionalInt.of(worst);
    }

    static double quantile(double[] sorted, double p) {
        double position = p * (sorted.length - 1);
        int    lower    = (int) Math.floor(position);
        int    upper    = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    private static OptionalInt detectInTrio(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double median = sorted[1];
        for (int i = 0; i < 3; i++) {
            if (Math.abs(values[i] - median) <= TRIO_MEDIAN_GAP + EPSILON) {
                continue;
            }
            double a = values[(i + 1) % 3];
            double b = values[(i + 2) % 3];
            if (Math.abs(a - b) <= TRIO_PAIR_TOLERANCE + EPSILON) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }
}
