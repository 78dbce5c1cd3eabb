/**
 * 
 */
package hep.afw;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * What an analysis declares: its stages, its augmentation, its minification for skims
 * and the histograms it fills.
 * 
 * Implement it directly, or compose one with {@link #builder(String)}. Implementations
 * named in a run configuration are instantiated through a public no-argument constructor.
 */
public interface Analysis {

    /**
     * Analysis name, also used as a directory name for skims and plots
     */
    String name();

    Stage objectDefinition();

    Stage preselection();

    Stage selection();

    default Augmenter augmenter() {
        return Augmenter.NONE;
    }

    Minifier minifier();

    List<HistogramSpec> histograms();

    /**
     * Object definition, preselection and selection in that order
     */
    default StagePipeline pipeline() {
        return new StagePipeline.Builder()
                .add(objectDefinition())
                .add(preselection())
                .add(selection())
                .build();
    }

    /**
     * Checks the declaration: stage phases and unique histogram names
     * 
     * @throws IllegalArgumentException on the first problem
     */
    static void validate(final Analysis analysis) {
        if (analysis.name() == null || analysis.name().isEmpty())
            throw new IllegalArgumentException("analysis name");
        check(analysis.objectDefinition(), Stage.Phase.OBJECT_DEFINITION);
        check(analysis.preselection(), Stage.Phase.PRESELECTION);
        check(analysis.selection(), Stage.Phase.SELECTION);
        final Set<String> names = new HashSet<>();
        for (final HistogramSpec spec : analysis.histograms()) {
            if (!names.add(spec.name()))
                throw new IllegalArgumentException("analysis " + analysis.name() + " declares histogram " + spec.name() + " twice");
        }
    }

    private static void check(final Stage stage, final Stage.Phase phase) {
        if (stage == null || stage.phase() != phase)
            throw new IllegalArgumentException("expected a " + phase + " stage, got " + stage);
    }

    static Builder builder(final String name) {
        return new Builder(name);
    }

    /**
     * Composes an analysis from stages and specs without subclassing
     */
    public static final class Builder {
        private final String name;
        private Stage objectDefinition = Stage.identity(Stage.Phase.OBJECT_DEFINITION);
        private Stage preselection = Stage.identity(Stage.Phase.PRESELECTION);
        private Stage selection = Stage.identity(Stage.Phase.SELECTION);
        private Augmenter augmenter = Augmenter.NONE;
        private Minifier minifier;
        private final List<HistogramSpec> histograms = new ArrayList<>();

        private Builder(final String name) {
            this.name = name;
        }

        public Builder objectDefinition(final Stage.Kind kind, final Stage.Body body) {
            this.objectDefinition = Stage.of("objectDefinition", Stage.Phase.OBJECT_DEFINITION, kind, body);
            return this;
        }

        public Builder preselection(final Stage.Kind kind, final Stage.Body body) {
            this.preselection = Stage.of("preselection", Stage.Phase.PRESELECTION, kind, body);
            return this;
        }

        /**
         * Selection as a pass/fail mask per event
         */
        public Builder selection(final Stage.MaskFunction mask) {
            this.selection = Stage.mask("selection", Stage.Phase.SELECTION, mask);
            return this;
        }

        public Builder selection(final Stage.Kind kind, final Stage.Body body) {
            this.selection = Stage.of("selection", Stage.Phase.SELECTION, kind, body);
            return this;
        }

        public Builder augmenter(final Augmenter augmenter) {
            this.augmenter = augmenter;
            return this;
        }

        public Builder minifier(final Minifier minifier) {
            this.minifier = minifier;
            return this;
        }

        public Builder histogram(final HistogramSpec spec) {
            histograms.add(spec);
            return this;
        }

        public Analysis build() {
            final Analysis a = new Composed(name, objectDefinition, preselection, selection, augmenter, minifier,
                    Collections.unmodifiableList(new ArrayList<>(histograms)));
            validate(a);
            return a;
        }
    }

    final class Composed implements Analysis {
        private final String name;
        private final Stage objectDefinition;
        private final Stage preselection;
        private final Stage selection;
        private final Augmenter augmenter;
        private final Minifier minifier;
        private final List<HistogramSpec> histograms;

        private Composed(final String name, final Stage objectDefinition, final Stage preselection, final Stage selection,
                final Augmenter augmenter, final Minifier minifier, final List<HistogramSpec> histograms) {
            this.name = name;
            this.objectDefinition = objectDefinition;
            this.preselection = preselection;
            this.selection = selection;
            this.augmenter = augmenter;
            this.minifier = minifier;
            this.histograms = histograms;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Stage objectDefinition() {
            return objectDefinition;
        }

        @Override
        public Stage preselection() {
            return preselection;
        }

        @Override
        public Stage selection() {
            return selection;
        }

        @Override
        public Augmenter augmenter() {
            return augmenter;
        }

        @Override
        public Minifier minifier() {
            if (minifier == null)
                throw new IllegalStateException("analysis " + name + " does not declare a minifier");
            return minifier;
        }

        @Override
        public List<HistogramSpec> histograms() {
            return histograms;
        }

        @Override
        public String toString() {
            return "Analysis [" + name + ", histograms=" + histograms.size() + "]";
        }
    }
}
