/**
 * 
 */
package hep.afw;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the per-chunk accumulators of every histogram spec, per dataset and then
 * across datasets.
 * 
 * Chunks complete in any order. Partials are parked until every lower chunk index of the
 * same dataset has arrived (or failed) and are then folded left in chunk order, and the
 * datasets are folded in declaration order. The final accumulators are therefore
 * bitwise identical however the chunks were scheduled.
 * 
 * A chunk contributes all of its histograms or none of them: {@link #accept} takes the
 * complete set of one chunk, {@link #fail} records that nothing will come.
 */
public final class Reducer {
    private final Map<String, HistogramSpec> specs = new LinkedHashMap<>();
    private final Map<String, Hist> templates = new LinkedHashMap<>();
    private final Map<String, Slot> slots = new LinkedHashMap<>();

    /** parked marker for a failed chunk */
    private static final Map<String, Hist> FAILED = Collections.emptyMap();

    /**
     * @param specs  histogram specs of the analysis, names unique
     * @param chunks number of scheduled chunks per dataset name, in dataset order
     */
    public Reducer(final List<HistogramSpec> specs, final Map<String, Integer> chunks) {
        for (final HistogramSpec spec : specs) {
            if (this.specs.put(spec.name(), spec) != null)
                throw new IllegalArgumentException("duplicate histogram name " + spec.name());
            templates.put(spec.name(), spec.create());
        }
        for (final Map.Entry<String, Integer> e : chunks.entrySet())
            slots.put(e.getKey(), new Slot(e.getKey(), e.getValue()));
    }

    /**
     * Takes ownership of the accumulators of one chunk. The caller must not touch them
     * afterwards.
     * 
     * @throws PipelineException {@link ErrorCode#SCHEMA_MISMATCH} when an accumulator does
     *                           not match the schema of its spec
     */
    public synchronized void accept(final String dataset, final int chunk, final Map<String, Hist> partial)
            throws PipelineException {
        if (!partial.keySet().equals(specs.keySet()))
            throw new PipelineException(ErrorCode.INTERNAL_ERROR,
                    "chunk " + dataset + "#" + chunk + " delivered " + partial.keySet() + ", expected " + specs.keySet());
        for (final Map.Entry<String, Hist> e : partial.entrySet()) {
            final Hist t = templates.get(e.getKey());
            final Hist h = e.getValue();
            if (!t.name().equals(h.name()) || !t.axis().equals(h.axis()))
                throw new PipelineException(ErrorCode.SCHEMA_MISMATCH, "histogram " + e.getKey() + " of chunk " + dataset
                        + "#" + chunk + " has schema " + h.axis() + ", expected " + t.axis(), e.getKey());
        }
        slot(dataset).park(chunk, partial);
    }

    /**
     * Records that {@code chunk} contributes nothing
     */
    public synchronized void fail(final String dataset, final int chunk) throws PipelineException {
        slot(dataset).park(chunk, FAILED);
    }

    private Slot slot(final String dataset) throws PipelineException {
        final Slot s = slots.get(dataset);
        if (s == null)
            throw new PipelineException(ErrorCode.INTERNAL_ERROR, "unknown dataset " + dataset);
        return s;
    }

    public synchronized boolean isDone() {
        for (final Slot s : slots.values())
            if (!s.isDone())
                return false;
        return true;
    }

    public synchronized int failed(final String dataset) throws PipelineException {
        return slot(dataset).failed;
    }

    /**
     * Final accumulators, frozen, one per spec in declaration order. Every scheduled
     * chunk must have been accepted or failed.
     */
    public synchronized Map<String, Result> results() throws PipelineException {
        int chunks = 0;
        int failed = 0;
        for (final Slot s : slots.values()) {
            if (!s.isDone())
                throw new PipelineException(ErrorCode.INTERNAL_ERROR,
                        "dataset " + s.dataset + " reduced " + s.next + " of " + s.chunks + " chunks");
            chunks += s.chunks;
            failed += s.failed;
        }
        final Map<String, Result> results = new LinkedHashMap<>();
        for (final HistogramSpec spec : specs.values()) {
            final Hist total = spec.create();
            for (final Slot s : slots.values())
                total.merge(s.acc.get(spec.name()));
            results.put(spec.name(), new Result(total.freeze(), chunks, failed));
        }
        return results;
    }

    /**
     * Per dataset: parked partials by chunk index and the running left fold
     */
    private final class Slot {
        private final String dataset;
        private final int chunks;
        private final TreeMap<Integer, Map<String, Hist>> parked = new TreeMap<>();
        private final Map<String, Hist> acc = new LinkedHashMap<>();
        private int next = 0;
        private int failed = 0;

        Slot(final String dataset, final int chunks) {
            this.dataset = dataset;
            this.chunks = chunks;
            for (final HistogramSpec spec : specs.values())
                acc.put(spec.name(), spec.create());
        }

        void park(final int chunk, final Map<String, Hist> partial) throws PipelineException {
            if (chunk < 0 || chunk >= chunks)
                throw new PipelineException(ErrorCode.INTERNAL_ERROR, "chunk " + dataset + "#" + chunk + " out of range");
            if (chunk < next || parked.containsKey(chunk))
                throw new PipelineException(ErrorCode.INTERNAL_ERROR, "chunk " + dataset + "#" + chunk + " reported twice");
            parked.put(chunk, partial);
            while (!parked.isEmpty() && parked.firstKey() == next) {
                final Map<String, Hist> p = parked.remove(next);
                if (p == FAILED) {
                    failed++;
                } else {
                    for (final Map.Entry<String, Hist> e : p.entrySet())
                        acc.get(e.getKey()).merge(e.getValue());
                }
                next++;
            }
        }

        boolean isDone() {
            return next == chunks;
        }
    }

    /**
     * Reduced accumulator of one histogram spec with its completeness
     */
    public static final class Result {
        private final Hist hist;
        private final int chunks;
        private final int failed;

        public Result(final Hist hist, final int chunks, final int failed) {
            this.hist = hist;
            this.chunks = chunks;
            this.failed = failed;
        }

        public String name() {
            return hist.name();
        }

        public Hist hist() {
            return hist;
        }

        /** chunks scheduled */
        public int chunks() {
            return chunks;
        }

        /** chunks that contributed nothing */
        public int failed() {
            return failed;
        }

        public boolean isComplete() {
            return failed == 0;
        }

        /**
         * {@code complete} or {@code partial (N/M failed)}
         */
        public String status() {
            return isComplete() ? "complete" : "partial (" + failed + "/" + chunks + " failed)";
        }

        @Override
        public boolean equals(final Object o) {
            if (!(o instanceof Result))
                return false;
            final Result r = (Result) o;
            return chunks == r.chunks && failed == r.failed && hist.equals(r.hist);
        }

        @Override
        public int hashCode() {
            return hist.hashCode() * 31 + failed;
        }

        @Override
        public String toString() {
            return name() + ": " + status();
        }
    }
}
