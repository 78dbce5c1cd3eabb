/**
 * 
 */
package hep.afw;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named values computed once per chunk from the selected events and handed to every
 * histogram fill of that chunk. Immutable.
 */
public final class Augmentation {
    public static final Augmentation EMPTY = new Augmentation(Collections.emptyMap());

    private final Map<String, Object> values;

    private Augmentation(final Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> names() {
        return values.keySet();
    }

    public boolean has(final String name) {
        return values.containsKey(name);
    }

    public <T> T get(final String name, final Class<T> type) throws PipelineException {
        final Object v = values.get(name);
        if (v == null)
            throw PipelineException.data("missing augmentation %s (have %s)", name, values.keySet());
        if (!type.isInstance(v))
            throw PipelineException.data("augmentation %s is %s, not %s", name, v.getClass().getSimpleName(), type.getSimpleName());
        return type.cast(v);
    }

    public double getDouble(final String name) throws PipelineException {
        return get(name, Number.class).doubleValue();
    }

    public long getLong(final String name) throws PipelineException {
        return get(name, Number.class).longValue();
    }

    /**
     * Arrays are handed out as copies so one histogram cannot alter what the next one sees.
     */
    public boolean[] getMask(final String name) throws PipelineException {
        return get(name, boolean[].class).clone();
    }

    public double[] getDoubles(final String name) throws PipelineException {
        return get(name, double[].class).clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof Augmentation))
            return false;
        final Map<String, Object> other = ((Augmentation) o).values;
        if (!values.keySet().equals(other.keySet()))
            return false;
        for (final Map.Entry<String, Object> e : values.entrySet()) {
            if (!Objects.deepEquals(e.getValue(), other.get(e.getKey())))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return values.keySet().hashCode();
    }

    @Override
    public String toString() {
        return "Augmentation " + values.keySet();
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder put(final String name, final Object value) {
            if (value == null)
                throw new IllegalArgumentException("augmentation " + name + " is null");
            if (value instanceof boolean[] b)
                values.put(name, b.clone());
            else if (value instanceof double[] d)
                values.put(name, d.clone());
            else if (value instanceof long[] l)
                values.put(name, l.clone());
            else
                values.put(name, value);
            return this;
        }

        public Augmentation build() {
            return values.isEmpty() ? EMPTY : new Augmentation(new LinkedHashMap<>(values));
        }
    }
}
