/**
 * 
 */
package hep.afw;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Prunes preselected events down to the fields an analysis declares necessary
 * before they are skimmed.
 * 
 * An optional body may derive fields first (for example a compact lepton collection);
 * the result is then projected onto the declared set. Rows are never dropped.
 */
public final class Minifier {
    private final Set<String> necessary;
    private final Stage.Body body;

    private Minifier(final Set<String> necessary, final Stage.Body body) {
        if (necessary.isEmpty())
            throw new IllegalArgumentException("minifier keeps no fields");
        this.necessary = Collections.unmodifiableSet(new LinkedHashSet<>(necessary));
        this.body = body;
    }

    public static Minifier keep(final String... fields) {
        return new Minifier(new LinkedHashSet<>(List.of(fields)), null);
    }

    public static Minifier keep(final Set<String> fields, final Stage.Body body) {
        return new Minifier(fields, body);
    }

    public Set<String> necessary() {
        return necessary;
    }

    public Events apply(final Events events) throws PipelineException {
        Events derived = events;
        if (body != null) {
            try {
                derived = body.apply(events);
            } catch (RuntimeException ex) {
                throw new PipelineException(ErrorCode.DATA_ERROR, "minify: " + ex, ex);
            }
            if (derived == null || derived.rows() != events.rows())
                throw new PipelineException(ErrorCode.STAGE_CONTRACT_VIOLATION,
                        "minify changed the row count " + events.rows() + " -> " + (derived == null ? "null" : derived.rows()));
            if (!Arrays.equals(derived.entries(), events.entries()))
                throw new PipelineException(ErrorCode.STAGE_CONTRACT_VIOLATION, "minify reordered rows");
        }
        final Events out = derived.project(new ArrayList<>(necessary));
        if (!new LinkedHashSet<>(out.names()).equals(necessary))
            throw new PipelineException(ErrorCode.INTERNAL_ERROR, "projection kept " + out.names());
        return out;
    }

    @Override
    public String toString() {
        return "Minifier " + necessary;
    }
}
