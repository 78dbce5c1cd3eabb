/**
 * Command line entry point
 * 
 */
package hep.afw;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

import hep.afw.skim.SkimStore;
import hep.afw.skim.SkimWriter;
import hep.afw.skim.SkimmedDatasets;

public final class Main {
    private static final String VERSION = "0.1.0";

    static boolean DEBUG = false;

    public static void main(String[] args) {
        try {
            final int result = execute(System.out, args);
            if (result != 0)
                System.exit(result);
        } catch (PipelineException e) {
            System.err.println("Pipeline Error (" + e.getErrorCode() + "): " + e.getMessage());
            if (DEBUG)
                e.printStackTrace();
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (DEBUG)
                e.printStackTrace();
            System.exit(1);
        }
    }

    static int execute(final PrintStream out, final String[] args) throws IOException {
        String command = null;
        String config = null;
        for (int i = 0; i < args.length; i++) {
            final String s = args[i];
            if ("-help".equals(s)) {
                usage(out);
                return 0;
            } else if ("-version".equals(s)) {
                out.println("afw version " + VERSION);
                return 0;
            } else if ("-debug".equals(s)) {
                DEBUG = true;
            } else if (command == null) {
                command = s;
            } else if (config == null) {
                config = s;
            } else {
                throw new IllegalArgumentException("unexpected argument " + s);
            }
        }
        if (command == null) {
            usage(out);
            return 0;
        }
        if (config == null)
            throw new IllegalArgumentException(command + " requires a run configuration file");

        Logger.DefaultLogger.verbose(DEBUG);
        final Logger logger = new Logger.DefaultLogger(command);
        final File file = IO.path(config);
        if (!file.isFile())
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "run configuration not found: " + file);
        logger.log("[MAIN] loading %s", file.getCanonicalPath());
        final RunConfig cfg = RunConfig.parse(file);
        logger.debug("[MAIN] %s", cfg);

        switch (command) {
        case "run":
            return run(cfg, logger);
        case "skim":
            return skim(cfg, logger);
        case "merge-skims":
            return mergeSkims(cfg, logger);
        case "replot":
            return replot(cfg, logger);
        default:
            throw new IllegalArgumentException("unknown command " + command);
        }
    }

    /**
     * Runs the analysis, from skims when the analysis has any, and saves results and plots
     */
    static int run(final RunConfig cfg, final Logger logger) throws IOException {
        final Analysis analysis = cfg.loadAnalysis();
        List<Dataset> datasets = cfg.datasetSource(logger).datasets();
        try (ChunkScheduler scheduler = new LocalChunkScheduler(cfg.maxThreads())) {
            final SkimStore store = SkimStore.of(cfg, analysis.name(), logger);
            final boolean skimmed = store.exists();
            if (skimmed) {
                cfg.validate(scheduler);
                logger.log("[MAIN] reading skims from %s", store.analysisDirectory());
                datasets = SkimmedDatasets.convert(datasets, store, logger);
            } else {
                logger.log("[MAIN] skim directory %s does not exist, running from raw files", store.analysisDirectory());
            }
            final RunReport report = new AnalysisRunner(cfg, scheduler, logger).run(analysis, datasets, skimmed);
            final File dir = new Plotter(new SvgPlotRenderer(cfg.luminosity()), logger).save(report,
                    analysis.histograms(), cfg.outputDirectory(), cfg.extension());
            logger.log("[MAIN] %s %s, output in %s", analysis.name(), report.status(), dir);
            return 0;
        }
    }

    static int skim(final RunConfig cfg, final Logger logger) throws IOException {
        final Analysis analysis = cfg.loadAnalysis();
        final List<Dataset> datasets = cfg.datasetSource(logger).datasets();
        try (ChunkScheduler scheduler = new LocalChunkScheduler(cfg.maxThreads())) {
            cfg.validate(scheduler);
            final SkimStore store = SkimStore.of(cfg, analysis.name(), logger);
            final SkimStore baseline = cfg.baseline() == null ? null
                    : SkimStore.baseline(cfg.baseline(), analysis.name(), logger);
            final SkimWriter.Summary summary = new SkimWriter(analysis, store, baseline, scheduler, cfg, logger)
                    .write(datasets);
            return summary.failures().isEmpty() ? 0 : 2;
        }
    }

    static int mergeSkims(final RunConfig cfg, final Logger logger) throws IOException {
        final Analysis analysis = cfg.loadAnalysis();
        SkimStore.of(cfg, analysis.name(), logger).merge();
        return 0;
    }

    static int replot(final RunConfig cfg, final Logger logger) throws IOException {
        final Analysis analysis = cfg.loadAnalysis();
        new Plotter(new SvgPlotRenderer(cfg.luminosity()), logger).replot(analysis, cfg.outputDirectory(),
                cfg.extension());
        return 0;
    }

    static void usage(final PrintStream out) {
        out.println("Usage: java -jar afw.jar <command> [-debug] <run-config.xml>");
        out.println("Commands:");
        out.println("  run          run the analysis (from skims when they exist) and save results and plots");
        out.println("  skim         write skims of every dataset");
        out.println("  merge-skims  merge skim parts into one file per dataset");
        out.println("  replot       draw the plots again from the saved results");
        out.println("Options:");
        out.println("  -debug       debug logging and stack traces");
        out.println("  -version     print the version");
    }
}
