/**
 * 
 */
package hep.afw;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One named, typed column of per-event values
 * 
 * Flat columns hold one value per event. {@link #TYPE_DOUBLE_LIST} columns hold a
 * variable-length collection per event (for example the transverse momenta of every
 * jet) stored as offsets into one flat value array. Columns are immutable.
 */
public final class Column {
    /** Boolean flag per event */
    public static final short TYPE_BOOL = 1;
    /** 64-bit signed integer per event */
    public static final short TYPE_INT64 = 8;
    /** 64-bit floating point per event */
    public static final short TYPE_DOUBLE = 9;
    /** Variable-length list of doubles per event */
    public static final short TYPE_DOUBLE_LIST = 20;

    private final String name;
    private final short type;
    private final int rows;
    private final boolean[] bools;
    private final long[] longs;
    private final double[] doubles;
    private final int[] offsets;

    private Column(final String name, final short type, final int rows, final boolean[] bools, final long[] longs,
            final double[] doubles, final int[] offsets) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("column name");
        this.name = name;
        this.type = type;
        this.rows = rows;
        this.bools = bools;
        this.longs = longs;
        this.doubles = doubles;
        this.offsets = offsets;
    }

    public static Column ofBools(final String name, final boolean[] values) {
        return new Column(name, TYPE_BOOL, values.length, values.clone(), null, null, null);
    }

    public static Column ofLongs(final String name, final long[] values) {
        return new Column(name, TYPE_INT64, values.length, null, values.clone(), null, null);
    }

    public static Column ofDoubles(final String name, final double[] values) {
        return new Column(name, TYPE_DOUBLE, values.length, null, null, values.clone(), null);
    }

    /**
     * @param offsets {@code rows + 1} non-decreasing offsets starting at 0
     * @param values  flat values, {@code values.length == offsets[rows]}
     */
    public static Column ofLists(final String name, final int[] offsets, final double[] values) {
        if (offsets.length == 0 || offsets[0] != 0 || offsets[offsets.length - 1] != values.length)
            throw new IllegalArgumentException("invalid offsets for column " + name);
        for (int i = 1; i < offsets.length; i++) {
            if (offsets[i] < offsets[i - 1])
                throw new IllegalArgumentException("decreasing offsets for column " + name);
        }
        return new Column(name, TYPE_DOUBLE_LIST, offsets.length - 1, null, null, values.clone(), offsets.clone());
    }

    public static Column ofLists(final String name, final double[][] lists) {
        final int[] offsets = new int[lists.length + 1];
        for (int i = 0; i < lists.length; i++)
            offsets[i + 1] = offsets[i] + lists[i].length;
        final double[] values = new double[offsets[lists.length]];
        for (int i = 0; i < lists.length; i++)
            System.arraycopy(lists[i], 0, values, offsets[i], lists[i].length);
        return new Column(name, TYPE_DOUBLE_LIST, lists.length, null, null, values, offsets);
    }

    public String name() {
        return name;
    }

    public short type() {
        return type;
    }

    public int rows() {
        return rows;
    }

    public boolean isList() {
        return type == TYPE_DOUBLE_LIST;
    }

    public boolean getBool(final int row) {
        switch (type) {
            case TYPE_BOOL:
                return bools[row];
            case TYPE_INT64:
                return longs[row] != 0;
            case TYPE_DOUBLE:
                return doubles[row] != 0.0;
            default:
                throw new IllegalStateException("not a flat column: " + name);
        }
    }

    public long getLong(final int row) {
        switch (type) {
            case TYPE_BOOL:
                return bools[row] ? 1L : 0L;
            case TYPE_INT64:
                return longs[row];
            case TYPE_DOUBLE:
                return (long) doubles[row];
            default:
                throw new IllegalStateException("not a flat column: " + name);
        }
    }

    public double getDouble(final int row) {
        switch (type) {
            case TYPE_BOOL:
                return bools[row] ? 1.0 : 0.0;
            case TYPE_INT64:
                return longs[row];
            case TYPE_DOUBLE:
                return doubles[row];
            default:
                throw new IllegalStateException("not a flat column: " + name);
        }
    }

    /** number of elements in the list of {@code row} */
    public int count(final int row) {
        if (type != TYPE_DOUBLE_LIST)
            return 1;
        return offsets[row + 1] - offsets[row];
    }

    /** element {@code i} of the list of {@code row} */
    public double get(final int row, final int i) {
        if (type != TYPE_DOUBLE_LIST)
            throw new IllegalStateException("not a list column: " + name);
        return doubles[offsets[row] + i];
    }

    public double[] list(final int row) {
        if (type != TYPE_DOUBLE_LIST)
            throw new IllegalStateException("not a list column: " + name);
        return Arrays.copyOfRange(doubles, offsets[row], offsets[row + 1]);
    }

    /** per-row values widened to double (flat columns) */
    public double[] toDoubles() {
        if (type == TYPE_DOUBLE)
            return doubles.clone();
        final double[] a = new double[rows];
        for (int i = 0; i < rows; i++)
            a[i] = getDouble(i);
        return a;
    }

    /** per-row values narrowed to long (flat columns) */
    public long[] toLongs() {
        if (type == TYPE_INT64)
            return longs.clone();
        final long[] a = new long[rows];
        for (int i = 0; i < rows; i++)
            a[i] = getLong(i);
        return a;
    }

    public boolean[] toBools() {
        if (type == TYPE_BOOL)
            return bools.clone();
        final boolean[] a = new boolean[rows];
        for (int i = 0; i < rows; i++)
            a[i] = getBool(i);
        return a;
    }

    /** list sizes per row */
    public int[] counts() {
        final int[] a = new int[rows];
        for (int i = 0; i < rows; i++)
            a[i] = count(i);
        return a;
    }

    public int[] offsets() {
        if (type != TYPE_DOUBLE_LIST)
            throw new IllegalStateException("not a list column: " + name);
        return offsets.clone();
    }

    public double[] flatValues() {
        if (type != TYPE_DOUBLE_LIST)
            throw new IllegalStateException("not a list column: " + name);
        return doubles.clone();
    }

    /**
     * Boxed value of one row: Boolean, Long, Double or double[]
     */
    public Object value(final int row) {
        switch (type) {
            case TYPE_BOOL:
                return bools[row];
            case TYPE_INT64:
                return longs[row];
            case TYPE_DOUBLE:
                return doubles[row];
            default:
                return list(row);
        }
    }

    /**
     * Row subset, in the order of {@code index}
     */
    public Column select(final int[] index) {
        switch (type) {
            case TYPE_BOOL: {
                final boolean[] a = new boolean[index.length];
                for (int i = 0; i < index.length; i++)
                    a[i] = bools[index[i]];
                return new Column(name, type, index.length, a, null, null, null);
            }
            case TYPE_INT64: {
                final long[] a = new long[index.length];
                for (int i = 0; i < index.length; i++)
                    a[i] = longs[index[i]];
                return new Column(name, type, index.length, null, a, null, null);
            }
            case TYPE_DOUBLE: {
                final double[] a = new double[index.length];
                for (int i = 0; i < index.length; i++)
                    a[i] = doubles[index[i]];
                return new Column(name, type, index.length, null, null, a, null);
            }
            default: {
                final int[] o = new int[index.length + 1];
                for (int i = 0; i < index.length; i++)
                    o[i + 1] = o[i] + count(index[i]);
                final double[] v = new double[o[index.length]];
                for (int i = 0; i < index.length; i++)
                    System.arraycopy(doubles, offsets[index[i]], v, o[i], o[i + 1] - o[i]);
                return new Column(name, type, index.length, null, null, v, o);
            }
        }
    }

    /**
     * Drops list elements, keeping the row count. {@code keep} is aligned with the flat
     * values of this column, so one mask can be applied to every field of one object
     * collection ({@code Jet_pt}, {@code Jet_eta}, ...).
     */
    public Column keep(final boolean[] keep) {
        if (type != TYPE_DOUBLE_LIST)
            throw new IllegalStateException("not a list column: " + name);
        if (keep.length != doubles.length)
            throw new IllegalArgumentException("element mask length " + keep.length + " != " + doubles.length);
        final int[] o = new int[rows + 1];
        int n = 0;
        for (final boolean k : keep)
            if (k)
                n++;
        final double[] v = new double[n];
        int p = 0;
        for (int r = 0; r < rows; r++) {
            for (int i = offsets[r]; i < offsets[r + 1]; i++) {
                if (keep[i])
                    v[p++] = doubles[i];
            }
            o[r + 1] = p;
        }
        return new Column(name, type, rows, null, null, v, o);
    }

    public Column rename(final String newName) {
        return new Column(newName, type, rows, bools, longs, doubles, offsets);
    }

    public static String typename(final short type) {
        switch (type) {
            case TYPE_BOOL:
                return "bool";
            case TYPE_INT64:
                return "int64";
            case TYPE_DOUBLE:
                return "double";
            case TYPE_DOUBLE_LIST:
                return "double[]";
            default:
                throw new IllegalArgumentException("unknown column type " + type);
        }
    }

    public static short type(final String typename) {
        switch (typename) {
            case "bool":
                return TYPE_BOOL;
            case "int64":
                return TYPE_INT64;
            case "double":
                return TYPE_DOUBLE;
            case "double[]":
                return TYPE_DOUBLE_LIST;
            default:
                throw new IllegalArgumentException("unknown column type " + typename);
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Column))
            return false;
        final Column c = (Column) o;
        return type == c.type && rows == c.rows && name.equals(c.name)
                && Arrays.equals(bools, c.bools)
                && Arrays.equals(longs, c.longs)
                && Arrays.equals(doubles, c.doubles)
                && Arrays.equals(offsets, c.offsets);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(name, type, rows);
        h = 31 * h + Arrays.hashCode(bools);
        h = 31 * h + Arrays.hashCode(longs);
        h = 31 * h + Arrays.hashCode(doubles);
        h = 31 * h + Arrays.hashCode(offsets);
        return h;
    }

    @Override
    public String toString() {
        return "Column [name=" + name + ", type=" + typename(type) + ", rows=" + rows + "]";
    }

    /**
     * Row-by-row column builder used by file readers
     */
    public static final class Builder {
        private final String name;
        private final short type;
        private final List<Object> values = new ArrayList<>();

        public Builder(final String name, final short type) {
            this.name = name;
            this.type = type;
            typename(type);
        }

        public String name() {
            return name;
        }

        /**
         * Appends one row. Numbers are narrowed or widened to the column type;
         * lists accept {@code double[]} or any {@link Iterable} of numbers.
         */
        public Builder add(final Object v) throws PipelineException {
            if (v == null)
                throw PipelineException.data("null value in column %s row %d", name, values.size());
            try {
                switch (type) {
                    case TYPE_BOOL:
                        values.add(v instanceof Boolean b ? b : ((Number) v).longValue() != 0);
                        break;
                    case TYPE_INT64:
                        values.add(((Number) v).longValue());
                        break;
                    case TYPE_DOUBLE:
                        values.add(((Number) v).doubleValue());
                        break;
                    default:
                        values.add(toList(v));
                }
            } catch (ClassCastException ex) {
                throw PipelineException.data("column %s row %d: unexpected value %s", name, values.size(), v);
            }
            return this;
        }

        private static double[] toList(final Object v) {
            if (v instanceof double[] a)
                return a.clone();
            final List<Double> l = new ArrayList<>();
            for (final Object o : (Iterable<?>) v)
                l.add(((Number) o).doubleValue());
            final double[] a = new double[l.size()];
            for (int i = 0; i < a.length; i++)
                a[i] = l.get(i);
            return a;
        }

        public int rows() {
            return values.size();
        }

        public Column create() {
            final int n = values.size();
            switch (type) {
                case TYPE_BOOL: {
                    final boolean[] a = new boolean[n];
                    for (int i = 0; i < n; i++)
                        a[i] = (Boolean) values.get(i);
                    return new Column(name, type, n, a, null, null, null);
                }
                case TYPE_INT64: {
                    final long[] a = new long[n];
                    for (int i = 0; i < n; i++)
                        a[i] = (Long) values.get(i);
                    return new Column(name, type, n, null, a, null, null);
                }
                case TYPE_DOUBLE: {
                    final double[] a = new double[n];
                    for (int i = 0; i < n; i++)
                        a[i] = (Double) values.get(i);
                    return new Column(name, type, n, null, null, a, null);
                }
                default: {
                    final double[][] lists = new double[n][];
                    for (int i = 0; i < n; i++)
                        lists[i] = (double[]) values.get(i);
                    return ofLists(name, lists);
                }
            }
        }
    }
}
