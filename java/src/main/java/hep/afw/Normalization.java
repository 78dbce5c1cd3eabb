/**
 * 
 */
package hep.afw;

/**
 * Per-dataset event weight factor, and how chunk limiting affected it.
 * 
 * Real data is never reweighted. A simulated sample is scaled by
 * {@code luminosity * crossSection / declaredEvents}; when only part of its chunks is
 * processed the adjusted factor divides by the processed fraction as well. The fraction
 * comes from the declared entries of the chunks, never from rows that happened to be read.
 */
public final class Normalization {
    /** integrated luminosity of 2022 EE, in pb^-1 */
    public static final double DEFAULT_LUMINOSITY = 26.6717 * 1e3;

    public enum Kind {
        SIMULATED_FULL, SIMULATED_LIMITED, DATA_FULL, DATA_LIMITED;

        public boolean isLimited() {
            return this == SIMULATED_LIMITED || this == DATA_LIMITED;
        }
    }

    private final String dataset;
    private final Kind kind;
    private final double unadjusted;
    private final double adjusted;
    private final double fraction;

    private Normalization(final String dataset, final Kind kind, final double unadjusted, final double adjusted,
            final double fraction) {
        this.dataset = dataset;
        this.kind = kind;
        this.unadjusted = unadjusted;
        this.adjusted = adjusted;
        this.fraction = fraction;
    }

    /**
     * @param dataset    the dataset with all of its chunks
     * @param processed  number of leading chunks that will be processed
     * @param luminosity integrated luminosity in pb^-1
     */
    public static Normalization of(final Dataset dataset, final int processed, final double luminosity) {
        final int total = dataset.chunks().size();
        if (processed < 0 || processed > total)
            throw new IllegalArgumentException("processed chunks " + processed + " of " + total);
        final boolean limited = processed < total;

        long all = 0;
        long kept = 0;
        for (int i = 0; i < total; i++) {
            final long n = dataset.chunks().get(i).declaredEntries();
            all += n;
            if (i < processed)
                kept += n;
        }
        final double fraction = all == 0 ? 1.0 : (double) kept / all;

        if (!dataset.isSimulated())
            return new Normalization(dataset.name(), limited ? Kind.DATA_LIMITED : Kind.DATA_FULL, 1.0, 1.0, fraction);

        final double factor = luminosity * dataset.crossSection() / dataset.declaredEvents();
        if (!limited)
            return new Normalization(dataset.name(), Kind.SIMULATED_FULL, factor, factor, 1.0);
        final double adjusted = fraction > 0 ? factor / fraction : factor;
        return new Normalization(dataset.name(), Kind.SIMULATED_LIMITED, factor, adjusted, fraction);
    }

    public String dataset() {
        return dataset;
    }

    public Kind kind() {
        return kind;
    }

    /** {@code lumi * xsec / nevents}, or 1 for data */
    public double unadjustedFactor() {
        return unadjusted;
    }

    /** unadjusted factor divided by the processed fraction for limited simulation */
    public double adjustedFactor() {
        return adjusted;
    }

    /** declared entries processed over declared entries of the dataset */
    public double fraction() {
        return fraction;
    }

    /**
     * @param renormalizeLimited whether limited simulated samples use the adjusted factor
     */
    public double factor(final boolean renormalizeLimited) {
        return renormalizeLimited ? adjusted : unadjusted;
    }

    @Override
    public String toString() {
        return String.format("%s %s factor=%.6g adjusted=%.6g fraction=%.4f", dataset, kind, unadjusted, adjusted, fraction);
    }
}
