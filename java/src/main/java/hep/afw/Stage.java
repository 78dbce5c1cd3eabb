/**
 * 
 */
package hep.afw;

/**
 * A named per-chunk transformation {@code Events -> Events}.
 * 
 * Each stage declares what it may do to its input. {@link StagePipeline} checks the
 * declaration against every output, so a stage that claims to only filter cannot
 * silently rewrite fields.
 */
public final class Stage {

    /**
     * What a stage may change
     */
    public enum Kind {
        /** drops rows, leaves the field set and row order untouched */
        FILTER,
        /** rewrites fields, keeps every row in order */
        REDEFINE,
        /** both */
        FILTER_AND_REDEFINE;

        public boolean filters() {
            return this != REDEFINE;
        }

        public boolean redefines() {
            return this != FILTER;
        }
    }

    /**
     * Pipeline position. Later phases may rely on fields defined by earlier ones.
     */
    public enum Phase {
        OBJECT_DEFINITION, PRESELECTION, SELECTION
    }

    @FunctionalInterface
    public interface Body {
        Events apply(Events events) throws PipelineException;
    }

    @FunctionalInterface
    public interface MaskFunction {
        boolean[] mask(Events events) throws PipelineException;
    }

    private final String name;
    private final Phase phase;
    private final Kind kind;
    private final Body body;

    private Stage(final String name, final Phase phase, final Kind kind, final Body body) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("stage name");
        if (phase == null || kind == null || body == null)
            throw new IllegalArgumentException("stage " + name + " is incomplete");
        this.name = name;
        this.phase = phase;
        this.kind = kind;
        this.body = body;
    }

    public static Stage of(final String name, final Phase phase, final Kind kind, final Body body) {
        return new Stage(name, phase, kind, body);
    }

    public static Stage filter(final String name, final Phase phase, final Body body) {
        return new Stage(name, phase, Kind.FILTER, body);
    }

    public static Stage redefine(final String name, final Phase phase, final Body body) {
        return new Stage(name, phase, Kind.REDEFINE, body);
    }

    /**
     * Filter stage from a per-row pass/fail mask
     */
    public static Stage mask(final String name, final Phase phase, final MaskFunction fn) {
        return new Stage(name, phase, Kind.FILTER, events -> events.filter(fn.mask(events)));
    }

    /**
     * Pass-through stage for analyses without a step in {@code phase}
     */
    public static Stage identity(final Phase phase) {
        return new Stage(phase.name().toLowerCase(), phase, Kind.REDEFINE, events -> events);
    }

    public String name() {
        return name;
    }

    public Phase phase() {
        return phase;
    }

    public Kind kind() {
        return kind;
    }

    public Events apply(final Events events) throws PipelineException {
        return body.apply(events);
    }

    @Override
    public String toString() {
        return "Stage [" + name + ", " + phase + ", " + kind + "]";
    }
}
