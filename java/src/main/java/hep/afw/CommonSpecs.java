/**
 * 
 */
package hep.afw;

import java.util.Set;

/**
 * Commonly plotted quantities.
 * 
 * Object collections follow the flat naming of the input files: the transverse momentum
 * of the muons of an event is the list field {@code Muon_pt}, their pseudorapidity
 * {@code Muon_eta} and so on. Specs that pick one object by index fail the chunk with a
 * {@link ErrorCode#DATA_ERROR} when an event has fewer objects.
 */
public final class CommonSpecs {
    /** display rebinning of every common plot */
    public static final int REBIN = 10;

    private CommonSpecs() {
    }

    /**
     * Base of the single-axis specs: one {@code dataset} category axis plus {@code axis}
     */
    public abstract static class Base implements HistogramSpec {
        private final String title;
        private final PlotOptions options;

        protected Base(final String title, final String units, final Set<String> signals) {
            this.title = title;
            this.options = new PlotOptions(units, REBIN, signals);
        }

        @Override
        public String name() {
            return title;
        }

        @Override
        public PlotOptions plotOptions() {
            return options;
        }

        protected abstract Axis axis();

        @Override
        public Hist create() {
            return new Hist(title, axis());
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + " [" + title + "]";
        }
    }

    static double[] pick(final Events events, final String field, final int index) throws PipelineException {
        final Column c = events.jagged(field);
        final double[] v = new double[events.rows()];
        for (int r = 0; r < v.length; r++) {
            if (c.count(r) <= index)
                throw PipelineException.data("%s: event %d has %d objects, index %d requested", field, events.entry(r),
                        c.count(r), index);
            v[r] = c.get(r, index);
        }
        return v;
    }

    /**
     * Number of objects of a collection per event (jet multiplicity by default)
     */
    public static class NJet extends Base {
        private final String field;

        public NJet() {
            this("NJets", "Jet_pt", Set.of());
        }

        public NJet(final String title, final String field, final Set<String> signals) {
            super(title, "GeV", signals);
            this.field = field;
        }

        @Override
        protected Axis axis() {
            final double[] edges = new double[12];
            for (int i = 0; i < edges.length; i++)
                edges[i] = 4 + i;
            return Axis.variable("njet", "Jet multiplicity", edges);
        }

        @Override
        public void fill(final Hist hist, final Events events, final String dataset, final double[] weights,
                final Augmentation augmentation) throws PipelineException {
            final int[] counts = events.jagged(field).counts();
            final double[] v = new double[counts.length];
            for (int i = 0; i < v.length; i++)
                v[i] = counts[i];
            hist.fill(dataset, v, weights);
        }
    }

    /**
     * Transverse momentum of the object at {@code index} of {@code collection}
     */
    public static class Pt extends Base {
        private final String collection;
        private final int index;

        public Pt(final String title, final String collection, final int index) {
            this(title, collection, index, Set.of());
        }

        public Pt(final String title, final String collection, final int index, final Set<String> signals) {
            super(title, "GeV", signals);
            this.collection = collection;
            this.index = index;
        }

        @Override
        protected Axis axis() {
            return Axis.regular("pt", name(), 500, 0, 500);
        }

        @Override
        public void fill(final Hist hist, final Events events, final String dataset, final double[] weights,
                final Augmentation augmentation) throws PipelineException {
            hist.fill(dataset, pick(events, collection + "_pt", index), weights);
        }
    }

    /**
     * Pseudorapidity of the object at {@code index} of {@code collection}
     */
    public static class Eta extends Base {
        private final String collection;
        private final int index;

        public Eta(final String title, final String collection, final int index) {
            this(title, collection, index, Set.of());
        }

        public Eta(final String title, final String collection, final int index, final Set<String> signals) {
            super(title, "Radians", signals);
            this.collection = collection;
            this.index = index;
        }

        @Override
        protected Axis axis() {
            return Axis.regular("eta", name(), 500, -5, 5);
        }

        @Override
        public void fill(final Hist hist, final Events events, final String dataset, final double[] weights,
                final Augmentation augmentation) throws PipelineException {
            hist.fill(dataset, pick(events, collection + "_eta", index), weights);
        }
    }

    /**
     * Invariant mass of two objects, {@code sqrt(2 pt1 pt2 (cosh(deta) - cos(dphi)))}.
     * The order of the two objects does not matter.
     */
    public static class DileptonMass extends Base {
        private final String first;
        private final int firstIndex;
        private final String second;
        private final int secondIndex;

        public DileptonMass(final String title, final String first, final int firstIndex, final String second,
                final int secondIndex) {
            super(title, "GeV", Set.of());
            this.first = first;
            this.firstIndex = firstIndex;
            this.second = second;
            this.secondIndex = secondIndex;
        }

        @Override
        protected Axis axis() {
            return Axis.regular("mass", name(), 500, 0, 1000);
        }

        @Override
        public void fill(final Hist hist, final Events events, final String dataset, final double[] weights,
                final Augmentation augmentation) throws PipelineException {
            final double[] pt1 = pick(events, first + "_pt", firstIndex);
            final double[] eta1 = pick(events, first + "_eta", firstIndex);
            final double[] phi1 = pick(events, first + "_phi", firstIndex);
            final double[] pt2 = pick(events, second + "_pt", secondIndex);
            final double[] eta2 = pick(events, second + "_eta", secondIndex);
            final double[] phi2 = pick(events, second + "_phi", secondIndex);
            final double[] mass = new double[events.rows()];
            for (int i = 0; i < mass.length; i++)
                mass[i] = mass(pt1[i], eta1[i], phi1[i], pt2[i], eta2[i], phi2[i]);
            hist.fill(dataset, mass, weights);
        }

        public static double mass(final double pt1, final double eta1, final double phi1, final double pt2,
                final double eta2, final double phi2) {
            return Math.sqrt(2 * pt1 * pt2 * (Math.cosh(eta1 - eta2) - Math.cos(phi1 - phi2)));
        }
    }

    /**
     * A score between 0 and 1 (for example a b-tagging discriminant) read from a flat
     * per-event field
     */
    public static class Discriminant extends Base {
        private final String field;

        public Discriminant(final String title, final String field) {
            super(title, "Units", Set.of());
            this.field = field;
        }

        @Override
        protected Axis axis() {
            return Axis.regular("score", name(), 500, 0, 1);
        }

        @Override
        public void fill(final Hist hist, final Events events, final String dataset, final double[] weights,
                final Augmentation augmentation) throws PipelineException {
            hist.fill(dataset, events.doubles(field), weights);
        }
    }
}
