/**
 * 
 */
package hep.afw.skim;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;

import hep.afw.Analysis;
import hep.afw.ChunkExecutor;
import hep.afw.ChunkRef;
import hep.afw.ChunkScheduler;
import hep.afw.Dataset;
import hep.afw.Datasets;
import hep.afw.ErrorCode;
import hep.afw.Events;
import hep.afw.IO;
import hep.afw.Logger;
import hep.afw.Minifier;
import hep.afw.PipelineException;
import hep.afw.RunConfig;
import hep.afw.Stage;
import hep.afw.StagePipeline;

/**
 * Writes skims: object definition, preselection and minification of every chunk, then
 * one record per chunk in the store.
 * 
 * Datasets that already have records are left alone unless skip-existing is off, in which
 * case their records are removed before any chunk is skimmed again. With a
 * baseline store, chunks are written as diffs against the baseline records of the same
 * chunks where possible.
 */
public final class SkimWriter {
    private final Analysis analysis;
    private final SkimStore store;
    private final SkimStore baseline;
    private final ChunkScheduler scheduler;
    private final RunConfig config;
    private final Logger logger;

    /**
     * @param baseline store of an earlier skim run, or null
     */
    public SkimWriter(final Analysis analysis, final SkimStore store, final SkimStore baseline,
            final ChunkScheduler scheduler, final RunConfig config, final Logger logger) {
        this.analysis = analysis;
        this.store = store;
        this.baseline = baseline;
        this.scheduler = scheduler;
        this.config = config;
        this.logger = logger == null ? new Logger.NullLogger() : logger;
    }

    /**
     * @throws PipelineException a fatal error, or the first chunk failure when bad chunks
     *                           are not skipped
     */
    public Summary write(final List<Dataset> datasets) throws PipelineException {
        Analysis.validate(analysis);
        if (store.locality() == SkimStore.Locality.NODE_LOCAL && !scheduler.isSingleNode())
            throw new PipelineException(ErrorCode.STORAGE_LOCALITY,
                    "node-local skims at " + store.root() + " with a multi-node scheduler");
        store.check();

        final StagePipeline pipeline = analysis.pipeline()
                .only(Stage.Phase.OBJECT_DEFINITION, Stage.Phase.PRESELECTION)
                .logger(logger);
        final Minifier minifier = analysis.minifier();
        final IO.StopWatch watch = new IO.StopWatch();

        logger.log("[SKIM ] %s -> %s%s", analysis.name(), store, baseline == null ? "" : ", baseline " + baseline.root());
        Datasets.summary(logger, datasets, false);

        final List<String> written = new ArrayList<>();
        final List<String> skipped = new ArrayList<>();
        final BlockingQueue<Done> queue = new LinkedBlockingQueue<>();
        final List<Future<?>> futures = new ArrayList<>();
        int scheduled = 0;
        for (final Dataset d : datasets) {
            if (store.hasRecords(d.name())) {
                if (config.skipExisting()) {
                    logger.error("[SKIM ] output directory already exists, skipping: %s", store.directory(d.name()));
                    skipped.add(d.name());
                    continue;
                }
                if (baseline != null && baseline.directory(d.name()).getAbsoluteFile()
                        .equals(store.directory(d.name()).getAbsoluteFile()))
                    throw new PipelineException(ErrorCode.INVALID_CONFIGURATION,
                            "baseline of " + d.name() + " is the skim being overwritten: " + store.directory(d.name()));
                final int cleared = store.clear(d.name());
                logger.log("[SKIM ] overwriting skims of %s, cleared %d records", d.name(), cleared);
            } else if (store.directory(d.name()).isDirectory()) {
                logger.log("[SKIM ] empty output directory, continuing: %s", store.directory(d.name()));
            }
            written.add(d.name());
            for (final ChunkRef c : d.chunks()) {
                futures.add(scheduler.submit(() -> {
                    queue.add(skim(pipeline, minifier, c));
                    return null;
                }));
                scheduled++;
            }
        }

        final List<Failure> failures = new ArrayList<>();
        long rowsIn = 0;
        long rowsOut = 0;
        int diffs = 0;
        for (int i = 0; i < scheduled; i++) {
            final Done done;
            try {
                done = queue.take();
            } catch (InterruptedException ex) {
                cancel(futures);
                Thread.currentThread().interrupt();
                throw new PipelineException(ErrorCode.CANCELLED, "skim of " + analysis.name() + " interrupted", ex);
            }
            if (done.error != null) {
                if (done.error.isFatal()) {
                    cancel(futures);
                    logger.error("[SKIM ] %s aborted at %s: %s", analysis.name(), done.chunk, done.error.getMessage());
                    throw done.error;
                }
                logger.error("[CHUNK] %s failed: %s", done.chunk, done.error.getMessage());
                if (!config.skipBadChunks()) {
                    cancel(futures);
                    throw done.error;
                }
                failures.add(new Failure(done.chunk, done.error));
                continue;
            }
            rowsIn += done.rowsIn;
            rowsOut += done.record.rows();
            if (done.record.kind() == SkimRecord.Kind.DIFF)
                diffs++;
        }

        final Summary summary = new Summary(written, skipped, scheduled - failures.size(), diffs, failures, rowsIn,
                rowsOut);
        logger.log("[SKIM ] %s: %s in %,d ms", analysis.name(), summary, watch.elapsed());
        for (final Failure f : summary.failures())
            logger.log("[SKIM ]   %s %s", f.chunk(), f.error().getMessage());
        return summary;
    }

    private Done skim(final StagePipeline pipeline, final Minifier minifier, final ChunkRef chunk) {
        try {
            final Events raw = ChunkExecutor.read(chunk);
            final Events minified = minifier.apply(pipeline.apply(raw));
            final SkimRecord record = store.write(chunk, minified, baseline);
            return new Done(chunk, raw.rows(), record, null);
        } catch (PipelineException ex) {
            return new Done(chunk, 0, null, ex);
        } catch (RuntimeException ex) {
            return new Done(chunk, 0, null, new PipelineException(ErrorCode.DATA_ERROR, chunk + ": " + ex, ex));
        }
    }

    private static void cancel(final List<Future<?>> futures) {
        for (final Future<?> f : futures)
            f.cancel(true);
    }

    private static final class Done {
        final ChunkRef chunk;
        final int rowsIn;
        final SkimRecord record;
        final PipelineException error;

        Done(final ChunkRef chunk, final int rowsIn, final SkimRecord record, final PipelineException error) {
            this.chunk = chunk;
            this.rowsIn = rowsIn;
            this.record = record;
            this.error = error;
        }
    }

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

        public PipelineException error() {
            return error;
        }
    }

    /**
     * What a skim run did
     */
    public static final class Summary {
        private final List<String> written;
        private final List<String> skipped;
        private final int records;
        private final int diffs;
        private final List<Failure> failures;
        private final long rowsIn;
        private final long rowsOut;

        Summary(final List<String> written, final List<String> skipped, final int records, final int diffs,
                final List<Failure> failures, final long rowsIn, final long rowsOut) {
            this.written = Collections.unmodifiableList(written);
            this.skipped = Collections.unmodifiableList(skipped);
            this.records = records;
            this.diffs = diffs;
            this.failures = Collections.unmodifiableList(failures);
            this.rowsIn = rowsIn;
            this.rowsOut = rowsOut;
        }

        /** datasets whose chunks were skimmed */
        public List<String> written() {
            return written;
        }

        /** datasets left alone because they already had skims */
        public List<String> skipped() {
            return skipped;
        }

        public int records() {
            return records;
        }

        /** records written as baseline diffs */
        public int diffs() {
            return diffs;
        }

        public List<Failure> failures() {
            return failures;
        }

        public long rowsIn() {
            return rowsIn;
        }

        public long rowsOut() {
            return rowsOut;
        }

        @Override
        public String toString() {
            return String.format("%d datasets, %d skipped, %d records (%d diffs), %d failed, %,d -> %,d rows",
                    written.size(), skipped.size(), records, diffs, failures.size(), rowsIn, rowsOut);
        }
    }
}
