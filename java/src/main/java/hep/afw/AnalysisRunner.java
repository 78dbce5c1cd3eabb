/**
 * 
 */
package hep.afw;

import java.io.File;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Drives an analysis over datasets: schedules one task per chunk, reduces the
 * accumulators and reports what happened.
 * 
 * <pre>
 * try (ChunkScheduler scheduler = new LocalChunkScheduler(config.maxThreads())) {
 *     RunReport report = new AnalysisRunner(config, scheduler, logger).run(analysis, datasets, false);
 *     new Plotter(renderer, logger).save(report, config.outputDirectory(), config.extension());
 * }
 * </pre>
 */
public final class AnalysisRunner {
    private final RunConfig config;
    private final ChunkScheduler scheduler;
    private final Logger logger;

    public AnalysisRunner(final RunConfig config, final ChunkScheduler scheduler, final Logger logger) {
        this.config = config;
        this.scheduler = scheduler;
        this.logger = logger == null ? new Logger.NullLogger() : logger;
    }

    /**
     * @param skimmed the datasets point at skims, which already went through object
     *                definition and preselection
     * @throws PipelineException the first fatal error, or the first chunk failure when bad
     *                           chunks are not skipped
     */
    public RunReport run(final Analysis analysis, final List<Dataset> datasets, final boolean skimmed)
            throws PipelineException {
        Analysis.validate(analysis);
        final IO.StopWatch watch = new IO.StopWatch();

        final StagePipeline pipeline = (skimmed ? analysis.pipeline().only(Stage.Phase.SELECTION) : analysis.pipeline())
                .logger(logger);
        final ChunkExecutor executor = new ChunkExecutor(pipeline, analysis.augmenter(), analysis.histograms(),
                config.renormalizeLimited(), logger);

        logger.log("[RUN] %s over %d datasets, %d threads%s", analysis.name(), datasets.size(), scheduler.parallelism(),
                skimmed ? ", from skims" : "");
        Datasets.summary(logger, datasets, true);

        final Map<String, Integer> chunks = new LinkedHashMap<>();
        final Map<String, Normalization> norms = new LinkedHashMap<>();
        final Set<String> files = new HashSet<>();
        long bytes = 0;
        for (final Dataset d : datasets) {
            final int processed = Datasets.limit(d, config.maxChunks());
            if (chunks.put(d.name(), processed) != null)
                throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "dataset " + d.name() + " listed twice");
            final Normalization n = Normalization.of(d, processed, config.luminosity());
            norms.put(d.name(), n);
            normalization(d, processed, n);
            for (final ChunkRef c : d.chunks().subList(0, processed))
                if (files.add(c.file()))
                    bytes += new File(c.file()).length();
        }

        final Reducer reducer = new Reducer(analysis.histograms(), chunks);
        final BlockingQueue<Done> queue = new LinkedBlockingQueue<>();
        final List<Future<?>> futures = new ArrayList<>();
        int scheduled = 0;
        for (final Dataset d : datasets) {
            final Normalization n = norms.get(d.name());
            for (final ChunkRef c : d.chunks().subList(0, chunks.get(d.name()))) {
                futures.add(scheduler.submit(() -> {
                    queue.add(execute(executor, reducer, d, c, n));
                    return null;
                }));
                scheduled++;
            }
        }

        final Map<String, List<RunReport.Failure>> failures = new LinkedHashMap<>();
        for (final Dataset d : datasets)
            failures.put(d.name(), new ArrayList<>());
        long entries = 0;
        for (int i = 0; i < scheduled; i++) {
            final Done done;
            try {
                done = queue.take();
            } catch (InterruptedException ex) {
                cancel(futures);
                Thread.currentThread().interrupt();
                throw new PipelineException(ErrorCode.CANCELLED, "run " + analysis.name() + " interrupted", ex);
            }
            if (done.fatal != null) {
                cancel(futures);
                logger.error("[RUN] %s aborted at %s: %s", analysis.name(), done.chunk, done.fatal.getMessage());
                throw done.fatal;
            }
            entries += done.outcome.rows();
            if (!done.outcome.isSuccess()) {
                final PipelineException error = done.outcome.error();
                logger.error("[CHUNK] %s failed: %s", done.chunk, error.getMessage());
                if (!config.skipBadChunks()) {
                    cancel(futures);
                    throw error;
                }
                failures.get(done.chunk.dataset()).add(new RunReport.Failure(done.chunk, error));
            }
        }

        final Map<String, Reducer.Result> results = reducer.results();
        final List<RunReport.DatasetStatus> statuses = new ArrayList<>();
        for (final Dataset d : datasets)
            statuses.add(new RunReport.DatasetStatus(d, chunks.get(d.name()), norms.get(d.name()), failures.get(d.name())));
        final RunReport report = new RunReport(analysis.name(), skimmed, results, statuses,
                new RunReport.Metrics(entries, bytes, watch.elapsed()));
        report.summary(logger);
        return report;
    }

    /**
     * Runs one chunk on a worker and hands its accumulators to the reducer
     */
    private static Done execute(final ChunkExecutor executor, final Reducer reducer, final Dataset dataset,
            final ChunkRef chunk, final Normalization normalization) {
        try {
            final ChunkExecutor.Outcome outcome = executor.execute(dataset, chunk, normalization);
            if (outcome.isSuccess())
                reducer.accept(dataset.name(), chunk.index(), outcome.partial());
            else
                reducer.fail(dataset.name(), chunk.index());
            return new Done(chunk, outcome, null);
        } catch (PipelineException ex) {
            return new Done(chunk, null, ex);
        } catch (RuntimeException ex) {
            return new Done(chunk, null, new PipelineException(ErrorCode.INTERNAL_ERROR, chunk + ": " + ex, ex));
        }
    }

    private void normalization(final Dataset d, final int processed, final Normalization n) {
        switch (n.kind()) {
        case SIMULATED_LIMITED:
            logger.log("[NORM] %s simulated, limited to %d/%d chunks (%.4f of declared entries): factor %.6g, adjusted %.6g%s",
                    d.name(), processed, d.chunks().size(), n.fraction(), n.unadjustedFactor(), n.adjustedFactor(),
                    config.renormalizeLimited() ? "" : " (not applied)");
            break;
        case DATA_LIMITED:
            logger.log("[NORM] %s data, limited to %d/%d chunks (%.4f of declared entries): unweighted, not renormalized",
                    d.name(), processed, d.chunks().size(), n.fraction());
            break;
        case SIMULATED_FULL:
            logger.log("[NORM] %s simulated, factor %.6g", d.name(), n.unadjustedFactor());
            break;
        default:
            logger.debug("[NORM] %s data, unweighted", d.name());
            break;
        }
    }

    private static void cancel(final List<Future<?>> futures) {
        for (final Future<?> f : futures)
            f.cancel(true);
    }

    private static final class Done {
        final ChunkRef chunk;
        final ChunkExecutor.Outcome outcome;
        final PipelineException fatal;

        Done(final ChunkRef chunk, final ChunkExecutor.Outcome outcome, final PipelineException fatal) {
            this.chunk = chunk;
            this.outcome = outcome;
            this.fatal = fatal;
        }
    }
}
