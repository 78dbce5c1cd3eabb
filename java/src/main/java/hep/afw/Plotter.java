/**
 * 
 */
package hep.afw;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Saves the results of a run and draws every histogram of the analysis.
 * 
 * Everything lands in {@code <output>/<analysis>/}: the accumulators in
 * {@value HistCodec#RESULTS_FILE} and one {@code <escaped title>.<ext>} per histogram.
 * {@link #replot} starts again from the results file alone.
 */
public final class Plotter {
    private final PlotRenderer renderer;
    private final Logger logger;

    public Plotter(final PlotRenderer renderer, final Logger logger) {
        this.renderer = renderer;
        this.logger = logger == null ? new Logger.NullLogger() : logger;
    }

    public static File directory(final File output, final String analysis) {
        return new File(output, IO.escapeName(analysis));
    }

    /**
     * Writes the results file and renders every histogram
     * 
     * @return the analysis output directory
     */
    public File save(final RunReport report, final List<HistogramSpec> specs, final File output, final String extension)
            throws IOException {
        final HistCodec.Results results = report.toResults();
        final File dir = directory(output, results.analysis());
        HistCodec.write(new File(dir, HistCodec.RESULTS_FILE), results);
        logger.log("[PLOT] saved %d results to %s", results.results().size(), dir);
        render(results, specs, dir, extension);
        return dir;
    }

    /**
     * Renders every histogram of {@code analysis} from a previously saved results file.
     * No event data is touched.
     */
    public HistCodec.Results replot(final Analysis analysis, final File output, final String extension)
            throws IOException {
        final File dir = directory(output, analysis.name());
        final HistCodec.Results results = HistCodec.read(new File(dir, HistCodec.RESULTS_FILE));
        if (!results.analysis().equals(analysis.name()))
            throw new PipelineException(ErrorCode.DATA_ERROR,
                    dir + " holds results of " + results.analysis() + ", not " + analysis.name());
        logger.log("[PLOT] replot %s from %s", analysis.name(), dir);
        render(results, analysis.histograms(), dir, extension);
        return results;
    }

    private void render(final HistCodec.Results results, final List<HistogramSpec> specs, final File dir,
            final String extension) throws IOException {
        if (!renderer.supports(extension))
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "renderer cannot write ." + extension + " files");
        final IO.StopWatch watch = new IO.StopWatch();
        for (final HistogramSpec spec : specs) {
            final Reducer.Result result = results.get(spec.name());
            final File file = new File(dir, spec.escapedName() + "." + extension);
            IO.writeAtomic(file, true, os -> renderer.render(result, spec.plotOptions(), results.dataCategories(), os));
            result.hist().rendered();
            logger.debug("[PLOT] %s -> %s (%s)", spec.name(), file.getName(), result.status());
        }
        logger.log("[PLOT] rendered %d plots in %,d ms", specs.size(), watch.elapsed());
    }
}
