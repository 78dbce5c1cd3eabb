/**
 * 
 */
package hep.afw;

import java.util.Arrays;

/**
 * Per-event weights of one chunk
 */
public final class Weights {
    private Weights() {
    }

    /**
     * One weight per row of {@code events}: 1 for real data, the normalization factor
     * for simulation.
     */
    public static double[] of(final Events events, final Normalization normalization, final boolean renormalizeLimited) {
        final double[] w = new double[events.rows()];
        Arrays.fill(w, normalization.factor(renormalizeLimited));
        return w;
    }
}
