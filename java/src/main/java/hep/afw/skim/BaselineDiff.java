/**
 * 
 */
package hep.afw.skim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import hep.afw.Column;
import hep.afw.ErrorCode;
import hep.afw.Events;
import hep.afw.Meta;
import hep.afw.PipelineException;

/**
 * Encodes events as a delta against baseline events of the same chunk.
 * 
 * Rows are matched by entry. A field is taken from the baseline when every row exists
 * there and the baseline holds exactly the same values for it; any other field is
 * stored. {@code reconstruct(baseline, diff(baseline, events))} returns events equal to
 * {@code events}.
 */
public final class BaselineDiff {
    private BaselineDiff() {
    }

    /**
     * Entries and stored fields of a diff, plus the names of the fields taken from the
     * baseline
     */
    public static final class Delta {
        private final Events stored;
        private final List<String> derived;
        private final Meta schema;

        Delta(final Events stored, final List<String> derived, final Meta schema) {
            this.stored = stored;
            this.derived = Collections.unmodifiableList(derived);
            this.schema = schema;
        }

        /** entries of every row, with the fields that are not derived */
        public Events stored() {
            return stored;
        }

        public List<String> derived() {
            return derived;
        }

        /** schema of the complete events */
        public Meta schema() {
            return schema;
        }

        public boolean isEmpty() {
            return derived.isEmpty();
        }
    }

    public static Delta diff(final Events baseline, final Events events) throws PipelineException {
        final int[] index = lookup(baseline, events.entries());
        final boolean complete = index != null;

        final List<String> derived = new ArrayList<>();
        final List<Column> stored = new ArrayList<>();
        for (final Column c : events.columns()) {
            if (complete && baseline.has(c.name()) && baseline.column(c.name()).select(index).equals(c))
                derived.add(c.name());
            else
                stored.add(c);
        }
        return new Delta(Events.of(events.entries(), stored), derived, Meta.of(events));
    }

    public static Events reconstruct(final Events baseline, final Delta delta) throws PipelineException {
        return reconstruct(baseline, delta.schema(), delta.derived(), delta.stored());
    }

    /**
     * @param schema  fields of the result, in order
     * @param derived fields copied from the baseline
     * @param stored  entries of the result and every field not derived
     * @throws PipelineException {@link ErrorCode#RECONSTRUCTION_ERROR} when the baseline
     *                           lacks a row or a field
     */
    public static Events reconstruct(final Events baseline, final Meta schema, final List<String> derived,
            final Events stored) throws PipelineException {
        int[] index = null;
        if (!derived.isEmpty()) {
            index = lookup(baseline, stored.entries());
            if (index == null)
                throw new PipelineException(ErrorCode.RECONSTRUCTION_ERROR, "baseline lacks rows of the diff");
        }
        final List<Column> columns = new ArrayList<>();
        for (final String name : schema.names()) {
            final Column c;
            if (derived.contains(name)) {
                if (!baseline.has(name))
                    throw new PipelineException(ErrorCode.RECONSTRUCTION_ERROR, "baseline lacks field " + name);
                c = baseline.column(name).select(index);
            } else {
                if (!stored.has(name))
                    throw new PipelineException(ErrorCode.RECONSTRUCTION_ERROR, "diff lacks field " + name);
                c = stored.column(name);
            }
            if (c.type() != schema.type(name))
                throw new PipelineException(ErrorCode.RECONSTRUCTION_ERROR, "field " + name + " is "
                        + Column.typename(c.type()) + ", expected " + Column.typename(schema.type(name)));
            columns.add(c);
        }
        return Events.of(stored.entries(), columns);
    }

    /**
     * Baseline row of every entry, or null when one is missing
     */
    private static int[] lookup(final Events baseline, final long[] entries) {
        final Map<Long, Integer> rows = new HashMap<>();
        for (int i = 0; i < baseline.rows(); i++)
            rows.put(baseline.entry(i), i);
        final int[] index = new int[entries.length];
        for (int i = 0; i < entries.length; i++) {
            final Integer r = rows.get(entries[i]);
            if (r == null)
                return null;
            index[i] = r;
        }
        return index;
    }
}
