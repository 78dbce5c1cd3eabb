/**
 * 
 */
package hep.afw;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered stage sequence: object definition, then preselection, then selection.
 * 
 * The order is enforced when the pipeline is composed. The declared {@link Stage.Kind}
 * of every stage is checked on every chunk it runs on; a violation is reported as
 * {@link ErrorCode#STAGE_CONTRACT_VIOLATION} and fails that chunk only.
 */
public final class StagePipeline {
    private final List<Stage> stages;
    private final Logger logger;

    private StagePipeline(final List<Stage> stages, final Logger logger) {
        this.stages = Collections.unmodifiableList(stages);
        this.logger = logger;
    }

    public static StagePipeline of(final Stage... stages) {
        final Builder b = new Builder();
        for (final Stage s : stages)
            b.add(s);
        return b.build();
    }

    public List<Stage> stages() {
        return stages;
    }

    /**
     * Same pipeline restricted to {@code phases}
     */
    public StagePipeline only(final Set<Stage.Phase> phases) {
        final List<Stage> l = new ArrayList<>();
        for (final Stage s : stages)
            if (phases.contains(s.phase()))
                l.add(s);
        return new StagePipeline(l, logger);
    }

    public StagePipeline only(final Stage.Phase first, final Stage.Phase... rest) {
        return only(EnumSet.of(first, rest));
    }

    public StagePipeline logger(final Logger logger) {
        return new StagePipeline(stages, logger);
    }

    public Events apply(final Events events) throws PipelineException {
        Events current = events;
        for (final Stage stage : stages) {
            final Events out;
            try {
                out = stage.apply(current);
            } catch (PipelineException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                throw new PipelineException(ErrorCode.DATA_ERROR, "stage " + stage.name() + ": " + ex, ex);
            }
            check(stage, current, out);
            logger.debug("[STAGE] %s rows %d -> %d", stage.name(), current.rows(), out.rows());
            current = out;
        }
        return current;
    }

    static void check(final Stage stage, final Events in, final Events out) throws PipelineException {
        if (out == null)
            throw violation(stage, "returned no events");
        if (out.rows() > in.rows())
            throw violation(stage, "added rows (" + in.rows() + " -> " + out.rows() + ")");

        final Stage.Kind kind = stage.kind();
        if (!kind.filters()) {
            if (out.rows() != in.rows())
                throw violation(stage, "dropped rows (" + in.rows() + " -> " + out.rows() + ") but is declared " + kind);
            if (!Arrays.equals(in.entries(), out.entries()))
                throw violation(stage, "reordered rows but is declared " + kind);
        } else if (!isSubsequence(out.entries(), in.entries())) {
            throw violation(stage, "reordered or invented rows");
        }

        if (!kind.redefines()) {
            if (!out.names().equals(in.names()))
                throw violation(stage, "changed fields " + in.names() + " -> " + out.names() + " but is declared " + kind);
            for (final Column c : out.columns()) {
                if (c.type() != in.column(c.name()).type())
                    throw violation(stage, "changed the type of " + c.name() + " but is declared " + kind);
            }
        }
    }

    private static boolean isSubsequence(final long[] sub, final long[] seq) {
        int j = 0;
        for (int i = 0; i < sub.length; i++) {
            while (j < seq.length && seq[j] != sub[i])
                j++;
            if (j == seq.length)
                return false;
            j++;
        }
        return true;
    }

    private static PipelineException violation(final Stage stage, final String what) {
        return new PipelineException(ErrorCode.STAGE_CONTRACT_VIOLATION, "stage " + stage.name() + " " + what, stage);
    }

    public static final class Builder {
        private final List<Stage> stages = new ArrayList<>();
        private Logger logger = new Logger.NullLogger();

        public Builder add(final Stage stage) {
            if (!stages.isEmpty()) {
                final Stage last = stages.get(stages.size() - 1);
                if (stage.phase().compareTo(last.phase()) < 0)
                    throw new IllegalArgumentException(
                            "stage " + stage.name() + " (" + stage.phase() + ") cannot follow " + last.name() + " (" + last.phase() + ")");
            }
            stages.add(stage);
            return this;
        }

        public Builder logger(final Logger logger) {
            this.logger = logger;
            return this;
        }

        public StagePipeline build() {
            return new StagePipeline(new ArrayList<>(stages), logger);
        }
    }
}
