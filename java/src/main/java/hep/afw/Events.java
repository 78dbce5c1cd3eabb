/**
 * 
 */
package hep.afw;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable columnar view over the events of one chunk.
 * 
 * Every column has exactly {@link #rows()} rows. {@link #entries()} keeps, for each row,
 * its entry number in the source file of the chunk; filters carry it along, so a row
 * keeps its identity through every stage and into skims.
 */
public final class Events {
    private final int rows;
    private final Map<String, Column> fields;
    private final long[] entries;

    private Events(final int rows, final Map<String, Column> fields, final long[] entries) {
        this.rows = rows;
        this.fields = fields;
        this.entries = entries;
    }

    /**
     * @param entries source entry number per row
     * @param columns columns, each with {@code entries.length} rows
     */
    public static Events of(final long[] entries, final Collection<Column> columns) throws PipelineException {
        final Map<String, Column> m = new LinkedHashMap<>();
        for (final Column c : columns) {
            if (c.rows() != entries.length)
                throw PipelineException.data("column %s has %d rows, expected %d", c.name(), c.rows(), entries.length);
            if (m.put(c.name(), c) != null)
                throw PipelineException.data("duplicate column %s", c.name());
        }
        return new Events(entries.length, m, entries.clone());
    }

    /**
     * Events numbered {@code 0..rows-1}
     */
    public static Events of(final Column... columns) throws PipelineException {
        final int rows = columns.length == 0 ? 0 : columns[0].rows();
        return of(range(0, rows), Arrays.asList(columns));
    }

    public static Events empty() {
        return new Events(0, new LinkedHashMap<>(), new long[0]);
    }

    public static long[] range(final long start, final long stop) {
        final long[] a = new long[(int) (stop - start)];
        for (int i = 0; i < a.length; i++)
            a[i] = start + i;
        return a;
    }

    public int rows() {
        return rows;
    }

    public long[] entries() {
        return entries.clone();
    }

    public long entry(final int row) {
        return entries[row];
    }

    public List<Column> columns() {
        return new ArrayList<>(fields.values());
    }

    public List<String> names() {
        return new ArrayList<>(fields.keySet());
    }

    public boolean has(final String name) {
        return fields.containsKey(name);
    }

    public Column column(final String name) throws PipelineException {
        final Column c = fields.get(name);
        if (c == null)
            throw PipelineException.data("missing field %s (have %s)", name, fields.keySet());
        return c;
    }

    public double[] doubles(final String name) throws PipelineException {
        return flat(name).toDoubles();
    }

    public long[] longs(final String name) throws PipelineException {
        return flat(name).toLongs();
    }

    public boolean[] bools(final String name) throws PipelineException {
        return flat(name).toBools();
    }

    public Column jagged(final String name) throws PipelineException {
        final Column c = column(name);
        if (!c.isList())
            throw PipelineException.data("field %s is %s, not a collection", name, Column.typename(c.type()));
        return c;
    }

    private Column flat(final String name) throws PipelineException {
        final Column c = column(name);
        if (c.isList())
            throw PipelineException.data("field %s is a collection", name);
        return c;
    }

    /**
     * Adds a column or overwrites the one with the same name, keeping its position.
     */
    public Events with(final Column column) throws PipelineException {
        if (column.rows() != rows)
            throw PipelineException.data("column %s has %d rows, expected %d", column.name(), column.rows(), rows);
        final Map<String, Column> m = new LinkedHashMap<>(fields);
        m.put(column.name(), column);
        return new Events(rows, m, entries);
    }

    public Events with(final String name, final double[] values) throws PipelineException {
        return with(Column.ofDoubles(name, values));
    }

    public Events without(final String... names) {
        final Map<String, Column> m = new LinkedHashMap<>(fields);
        for (final String n : names)
            m.remove(n);
        return new Events(rows, m, entries);
    }

    /**
     * Keeps only {@code names}, in the given order.
     */
    public Events project(final Collection<String> names) throws PipelineException {
        final Map<String, Column> m = new LinkedHashMap<>();
        for (final String n : names)
            m.put(n, column(n));
        return new Events(rows, m, entries);
    }

    public Events filter(final boolean[] mask) throws PipelineException {
        if (mask.length != rows)
            throw PipelineException.data("mask has %d rows, expected %d", mask.length, rows);
        int n = 0;
        for (final boolean b : mask)
            if (b)
                n++;
        if (n == rows)
            return this;
        final int[] index = new int[n];
        for (int i = 0, p = 0; i < rows; i++)
            if (mask[i])
                index[p++] = i;
        return select(index);
    }

    /**
     * Row subset by position; the order of {@code index} becomes the new row order.
     */
    public Events select(final int[] index) {
        final Map<String, Column> m = new LinkedHashMap<>();
        for (final Column c : fields.values())
            m.put(c.name(), c.select(index));
        final long[] e = new long[index.length];
        for (int i = 0; i < index.length; i++)
            e[i] = entries[index[i]];
        return new Events(index.length, m, e);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Events))
            return false;
        final Events other = (Events) o;
        return rows == other.rows
                && Arrays.equals(entries, other.entries)
                && names().equals(other.names())
                && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(entries) + fields.hashCode();
    }

    @Override
    public String toString() {
        return "Events [rows=" + rows + ", fields=" + fields.keySet() + "]";
    }
}
