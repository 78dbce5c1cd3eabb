package hep.afw;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Synthetic events and files shared by the tests
 */
public final class Fixtures {
    public static final Logger LOGGER = new Logger.NullLogger();

    private Fixtures() {
    }

    /**
     * {@code rows} events numbered from {@code start}: jets sorted by decreasing pt,
     * missing transverse energy and a run number
     */
    public static Events events(final long start, final int rows, final long seed) throws PipelineException {
        final Random r = new Random(seed);
        final double[][] jets = new double[rows][];
        final double[] met = new double[rows];
        final long[] run = new long[rows];
        for (int i = 0; i < rows; i++) {
            final double[] pt = new double[r.nextInt(9)];
            for (int j = 0; j < pt.length; j++)
                pt[j] = Math.round((25 + r.nextDouble() * 200) * 100) / 100.0;
            Arrays.sort(pt);
            for (int j = 0; j < pt.length / 2; j++) {
                final double t = pt[j];
                pt[j] = pt[pt.length - 1 - j];
                pt[pt.length - 1 - j] = t;
            }
            jets[i] = pt;
            met[i] = Math.round(r.nextDouble() * 120 * 100) / 100.0;
            run[i] = 362000 + i % 7;
        }
        return Events.of(Events.range(start, start + rows),
                List.of(Column.ofLists("Jet_pt", jets), Column.ofDoubles("MET_pt", met), Column.ofLongs("run", run)));
    }

    public static File write(final File file, final Events events) throws IOException {
        try (EventFile f = EventFile.create(file, Meta.of(events), LOGGER)) {
            f.write(events);
        }
        return file;
    }

    /**
     * Writes {@code rows} generated events to {@code file}, entries numbered from 0
     */
    public static File write(final File file, final int rows, final long seed) throws IOException {
        return write(file, events(0, rows, seed));
    }

    public static RunConfig.Builder config(final File dir) {
        return RunConfig.builder(TestAnalysis.NAME)
                .maxThreads(2)
                .luminosity(1000)
                .skimDirectory(new File(dir, "skims"))
                .outputDirectory(new File(dir, "plots"));
    }
}
