/**
 * 
 */
package hep.afw;

import java.util.Collections;
import java.util.Set;

/**
 * Declares one histogram of an analysis: how to create its empty accumulator, how to
 * fill it from one chunk and how it is drawn.
 * 
 * {@link #name()} is both the storage key and the plot title and must be unique within
 * one analysis. {@link #create()} must return the same axis schema on every call.
 * {@link #fill} must not modify the events, weights or augmentation it is given, since
 * they are shared with the other histograms of the same chunk.
 */
public interface HistogramSpec {

    String name();

    /**
     * Title with {@code $} math delimiters removed, used for file names
     */
    default String escapedName() {
        return name().replace("$", "");
    }

    Hist create();

    /**
     * @param hist         accumulator of this chunk, from {@link #create()}
     * @param events       selected events of the chunk
     * @param dataset      category to fill, the dataset short name
     * @param weights      one weight per event
     * @param augmentation values shared by every histogram of the chunk
     */
    void fill(Hist hist, Events events, String dataset, double[] weights, Augmentation augmentation)
            throws PipelineException;

    default PlotOptions plotOptions() {
        return PlotOptions.DEFAULT;
    }

    /**
     * Rendering hints
     */
    public static final class PlotOptions {
        public static final PlotOptions DEFAULT = new PlotOptions("Units", 1, Collections.emptySet());

        private final String units;
        private final int rebin;
        private final Set<String> signals;

        /**
         * @param units   bin width units for the y label
         * @param rebin   number of bins merged for display
         * @param signals categories drawn as lines on top of the stack instead of stacked
         */
        public PlotOptions(final String units, final int rebin, final Set<String> signals) {
            if (rebin < 1)
                throw new IllegalArgumentException("rebin " + rebin);
            this.units = units;
            this.rebin = rebin;
            this.signals = Collections.unmodifiableSet(signals);
        }

        public String units() {
            return units;
        }

        public int rebin() {
            return rebin;
        }

        public Set<String> signals() {
            return signals;
        }
    }
}
