package hep.afw;

import java.util.List;
import java.util.Set;

/**
 * Small analysis over {@link Fixtures#events}: at least two jets, missing energy above
 * 20 GeV. Public with a no-argument constructor so run configurations can name it.
 */
public class TestAnalysis implements Analysis {
    public static final String NAME = "test-analysis";
    public static final String MET = "$p_T^{miss}$";

    private final Analysis composed = Analysis.builder(NAME)
            .objectDefinition(Stage.Kind.REDEFINE, events -> events.with("HT", ht(events)))
            .preselection(Stage.Kind.FILTER, events -> events.filter(atLeast(events.jagged("Jet_pt").counts(), 2)))
            .selection(events -> above(events.doubles("MET_pt"), 20))
            .augmenter(events -> Augmentation.builder().put("selected", (long) events.rows()).build())
            .minifier(Minifier.keep("Jet_pt", "MET_pt", "HT"))
            .histogram(new CommonSpecs.NJet())
            .histogram(new Met())
            .build();

    /**
     * Same stages and specs, but the preselection keeps no event
     */
    public static Analysis rejectingAll() {
        return Analysis.builder(NAME + "-empty")
                .objectDefinition(Stage.Kind.REDEFINE, events -> events.with("HT", ht(events)))
                .preselection(Stage.Kind.FILTER, events -> events.filter(new boolean[events.rows()]))
                .selection(events -> above(events.doubles("MET_pt"), 20))
                .augmenter(events -> Augmentation.builder().put("selected", (long) events.rows()).build())
                .minifier(Minifier.keep("Jet_pt", "MET_pt", "HT"))
                .histogram(new CommonSpecs.NJet())
                .histogram(new Met())
                .build();
    }

    public static double[] ht(final Events events) throws PipelineException {
        final Column jets = events.jagged("Jet_pt");
        final double[] ht = new double[events.rows()];
        for (int r = 0; r < ht.length; r++)
            for (final double pt : jets.list(r))
                ht[r] += pt;
        return ht;
    }

    public static boolean[] atLeast(final int[] counts, final int n) {
        final boolean[] m = new boolean[counts.length];
        for (int i = 0; i < m.length; i++)
            m[i] = counts[i] >= n;
        return m;
    }

    public static boolean[] above(final double[] values, final double cut) {
        final boolean[] m = new boolean[values.length];
        for (int i = 0; i < m.length; i++)
            m[i] = values[i] > cut;
        return m;
    }

    @Override
    public String name() {
        return composed.name();
    }

    @Override
    public Stage objectDefinition() {
        return composed.objectDefinition();
    }

    @Override
    public Stage preselection() {
        return composed.preselection();
    }

    @Override
    public Stage selection() {
        return composed.selection();
    }

    @Override
    public Augmenter augmenter() {
        return composed.augmenter();
    }

    @Override
    public Minifier minifier() {
        return composed.minifier();
    }

    @Override
    public List<HistogramSpec> histograms() {
        return composed.histograms();
    }

    /**
     * Missing transverse energy, 12 bins of 10 GeV; checks the augmentation of its chunk
     */
    static final class Met implements HistogramSpec {
        private static final PlotOptions OPTIONS = new PlotOptions("GeV", 2, Set.of("Signal"));

        @Override
        public String name() {
            return MET;
        }

        @Override
        public Hist create() {
            return new Hist(MET, Axis.regular("met", "MET", 12, 0, 120));
        }

        @Override
        public void fill(final Hist hist, final Events events, final String dataset, final double[] weights,
                final Augmentation augmentation) throws PipelineException {
            if (augmentation.getLong("selected") != events.rows())
                throw PipelineException.data("augmentation counts %d rows, chunk has %d",
                        augmentation.getLong("selected"), events.rows());
            hist.fill(dataset, events.doubles("MET_pt"), weights);
        }

        @Override
        public PlotOptions plotOptions() {
            return OPTIONS;
        }
    }
}
