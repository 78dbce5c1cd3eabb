/**
 * 
 */
package hep.afw;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one analysis run: the reduced accumulators, what happened to every dataset
 * and how fast it went.
 */
public final class RunReport {
    private final String analysis;
    private final boolean skimmed;
    private final Map<String, Reducer.Result> results;
    private final List<DatasetStatus> datasets;
    private final Metrics metrics;

    RunReport(final String analysis, final boolean skimmed, final Map<String, Reducer.Result> results,
            final List<DatasetStatus> datasets, final Metrics metrics) {
        this.analysis = analysis;
        this.skimmed = skimmed;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.datasets = Collections.unmodifiableList(new ArrayList<>(datasets));
        this.metrics = metrics;
    }

    public String analysis() {
        return analysis;
    }

    /** whether the run read skims and started at the selection */
    public boolean isSkimmed() {
        return skimmed;
    }

    /** one result per histogram spec, in declaration order */
    public Map<String, Reducer.Result> results() {
        return results;
    }

    public Reducer.Result result(final String name) {
        return results.get(name);
    }

    public List<DatasetStatus> datasets() {
        return datasets;
    }

    public DatasetStatus dataset(final String name) {
        for (final DatasetStatus s : datasets)
            if (s.name().equals(name))
                return s;
        return null;
    }

    public Metrics metrics() {
        return metrics;
    }

    public int chunks() {
        int n = 0;
        for (final DatasetStatus s : datasets)
            n += s.processed();
        return n;
    }

    public int failed() {
        int n = 0;
        for (final DatasetStatus s : datasets)
            n += s.failed();
        return n;
    }

    public boolean isComplete() {
        return failed() == 0;
    }

    /**
     * {@code complete} or {@code partial (N/M failed)} over all processed chunks
     */
    public String status() {
        return isComplete() ? "complete" : "partial (" + failed() + "/" + chunks() + " failed)";
    }

    /**
     * Histogram categories filled from real data
     */
    public List<String> dataCategories() {
        final Set<String> data = new LinkedHashSet<>();
        for (final DatasetStatus s : datasets)
            if (!s.isSimulated())
                data.add(s.shortName());
        return new ArrayList<>(data);
    }

    /**
     * What gets saved next to the plots
     */
    public HistCodec.Results toResults() {
        return new HistCodec.Results(analysis, dataCategories(), results);
    }

    public void summary(final Logger logger) {
        logger.log("[RUN] %s %s%s", analysis, status(), skimmed ? " (skimmed)" : "");
        for (final DatasetStatus s : datasets) {
            logger.log("[RUN] %s: %d/%d chunks processed, %d failed, %s", s.name(), s.processed(), s.total(), s.failed(),
                    s.normalization());
            for (final Failure f : s.failures())
                logger.log("[RUN]   %s", f);
        }
        for (final Reducer.Result r : results.values())
            logger.log("[RUN] %s: %s, total %.6g", r.name(), r.status(), r.hist().total());
        logger.log("[RUN] %s", metrics);
    }

    @Override
    public String toString() {
        return "RunReport [analysis=" + analysis + ", status=" + status() + ", " + metrics + "]";
    }

    /**
     * Per dataset chunk accounting
     */
    public static final class DatasetStatus {
        private final Dataset dataset;
        private final int processed;
        private final Normalization normalization;
        private final List<Failure> failures;

        DatasetStatus(final Dataset dataset, final int processed, final Normalization normalization,
                final List<Failure> failures) {
            this.dataset = dataset;
            this.processed = processed;
            this.normalization = normalization;
            final List<Failure> sorted = new ArrayList<>(failures);
            sorted.sort((a, b) -> Integer.compare(a.chunk().index(), b.chunk().index()));
            this.failures = Collections.unmodifiableList(sorted);
        }

        public String name() {
            return dataset.name();
        }

        public String shortName() {
            return dataset.shortName();
        }

        public boolean isSimulated() {
            return dataset.isSimulated();
        }

        /** chunks the dataset has */
        public int total() {
            return dataset.chunks().size();
        }

        /** chunks scheduled after limiting */
        public int processed() {
            return processed;
        }

        public int failed() {
            return failures.size();
        }

        public List<Failure> failures() {
            return failures;
        }

        public Normalization normalization() {
            return normalization;
        }

        public String status() {
            return failures.isEmpty() ? "complete" : "partial (" + failures.size() + "/" + processed + " failed)";
        }
    }

    /**
     * A chunk that contributed nothing, and why
     */
    public static final class Failure {
        private final ChunkRef chunk;
        private final PipelineException error;

        Failure(final ChunkRef chunk, final PipelineException error) {
            this.chunk = chunk;
            this.error = error;
        }

        public ChunkRef chunk() {
            return chunk;
        }

        public ErrorCode code() {
            return error.getErrorCode();
        }

        public PipelineException error() {
            return error;
        }

        @Override
        public String toString() {
            return chunk + " " + error.getMessage();
        }
    }

    public static final class Metrics {
        private final long entries;
        private final long bytes;
        private final long elapsed;

        Metrics(final long entries, final long bytes, final long elapsed) {
            this.entries = entries;
            this.bytes = bytes;
            this.elapsed = elapsed;
        }

        /** rows read from the sources */
        public long entries() {
            return entries;
        }

        /** size of the distinct source files touched */
        public long bytes() {
            return bytes;
        }

        /** wall time in milliseconds */
        public long elapsed() {
            return elapsed;
        }

        public long entriesPerSecond() {
            return IO.StopWatch.ops(entries, elapsed);
        }

        @Override
        public String toString() {
            return String.format("read %,d entries, %s in %,d ms, %,d entries/s", entries, IO.readableBytesSize(bytes),
                    elapsed, entriesPerSecond());
        }
    }
}
