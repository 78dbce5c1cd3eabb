/**
 * 
 */
package hep.afw;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Weighted histogram over a growable string category axis ({@code dataset}) and one
 * numeric {@link Axis}.
 * 
 * Each category stores the sum of weights and the sum of squared weights per bin,
 * flow bins included. Categories are kept sorted, so the layout of a histogram does not
 * depend on the order in which datasets were filled or merged.
 * 
 * <pre>
 * CREATED -> FILLING -> REDUCED -> RENDERED
 * </pre>
 * 
 * Once {@link #freeze() frozen} a histogram rejects every mutation.
 */
public final class Hist {
    public static final String CATEGORY_AXIS = "dataset";

    public enum State {
        CREATED, FILLING, REDUCED, RENDERED
    }

    private final String name;
    private final Axis axis;
    private final TreeMap<String, double[][]> storage = new TreeMap<>();
    private State state = State.CREATED;

    public Hist(final String name, final Axis axis) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("histogram name");
        if (axis == null)
            throw new IllegalArgumentException("histogram " + name + " has no axis");
        this.name = name;
        this.axis = axis;
    }

    /**
     * Rebuilds a histogram from serialized storage
     */
    static Hist restore(final String name, final Axis axis, final Map<String, double[][]> storage, final State state) {
        final Hist h = new Hist(name, axis);
        for (final Map.Entry<String, double[][]> e : storage.entrySet()) {
            final double[][] s = e.getValue();
            if (s.length != 2 || s[0].length != axis.bins() + 2 || s[1].length != axis.bins() + 2)
                throw new IllegalArgumentException("histogram " + name + ": bad storage for " + e.getKey());
            h.storage.put(e.getKey(), new double[][] { s[0].clone(), s[1].clone() });
        }
        h.state = state;
        return h;
    }

    public String name() {
        return name;
    }

    public Axis axis() {
        return axis;
    }

    public State state() {
        return state;
    }

    public boolean isFrozen() {
        return state == State.REDUCED || state == State.RENDERED;
    }

    private void mutable() {
        if (isFrozen())
            throw new IllegalStateException("histogram " + name + " is " + state + " and can no longer change");
    }

    private double[][] slot(final String category) {
        return storage.computeIfAbsent(category, k -> new double[2][axis.bins() + 2]);
    }

    public Hist fill(final String category, final double value, final double weight) {
        mutable();
        final double[][] s = slot(category);
        final int i = axis.index(value);
        s[0][i] += weight;
        s[1][i] += weight * weight;
        state = State.FILLING;
        return this;
    }

    /**
     * Fills one value per event. {@code values} and {@code weights} must be aligned.
     */
    public Hist fill(final String category, final double[] values, final double[] weights) throws PipelineException {
        mutable();
        if (values.length != weights.length)
            throw PipelineException.data("histogram %s: %d values but %d weights", name, values.length, weights.length);
        final double[][] s = slot(category);
        for (int j = 0; j < values.length; j++) {
            final int i = axis.index(values[j]);
            s[0][i] += weights[j];
            s[1][i] += weights[j] * weights[j];
        }
        state = State.FILLING;
        return this;
    }

    /**
     * Adds {@code other} into this histogram, bin by bin.
     * 
     * @throws PipelineException {@link ErrorCode#SCHEMA_MISMATCH} when name or axis differ
     */
    public Hist merge(final Hist other) throws PipelineException {
        mutable();
        if (!name.equals(other.name) || !axis.equals(other.axis))
            throw new PipelineException(ErrorCode.SCHEMA_MISMATCH,
                    "cannot merge " + other.name + " " + other.axis + " into " + name + " " + axis, name);
        for (final Map.Entry<String, double[][]> e : other.storage.entrySet()) {
            final double[][] s = slot(e.getKey());
            final double[][] o = e.getValue();
            for (int i = 0; i < s[0].length; i++) {
                s[0][i] += o[0][i];
                s[1][i] += o[1][i];
            }
        }
        if (state == State.CREATED && !storage.isEmpty())
            state = State.FILLING;
        return this;
    }

    /** CREATED/FILLING -> REDUCED */
    public Hist freeze() {
        if (state == State.RENDERED)
            throw new IllegalStateException("histogram " + name + " is already rendered");
        state = State.REDUCED;
        return this;
    }

    /** REDUCED -> RENDERED */
    public Hist rendered() {
        if (!isFrozen())
            throw new IllegalStateException("histogram " + name + " must be reduced before rendering, is " + state);
        state = State.RENDERED;
        return this;
    }

    public List<String> categories() {
        return new ArrayList<>(storage.keySet());
    }

    public boolean isEmpty() {
        return storage.isEmpty();
    }

    /**
     * @return sum of weights per bin, without flow bins; zeros for an unknown category
     */
    public double[] values(final String category) {
        return inner(category, 0);
    }

    public double[] variances(final String category) {
        return inner(category, 1);
    }

    /**
     * @return sum of weights per storage index, flow bins included
     */
    public double[] valuesWithFlow(final String category) {
        final double[][] s = storage.get(category);
        return s == null ? new double[axis.bins() + 2] : s[0].clone();
    }

    public double[] variancesWithFlow(final String category) {
        final double[][] s = storage.get(category);
        return s == null ? new double[axis.bins() + 2] : s[1].clone();
    }

    private double[] inner(final String category, final int which) {
        final double[][] s = storage.get(category);
        if (s == null)
            return new double[axis.bins()];
        return Arrays.copyOfRange(s[which], 1, axis.bins() + 1);
    }

    /**
     * Bin-wise sum of weights over several categories, without flow bins
     */
    public double[] values(final Collection<String> categories) {
        final double[] v = new double[axis.bins()];
        for (final String c : new TreeSet<>(categories)) {
            final double[] x = values(c);
            for (int i = 0; i < v.length; i++)
                v[i] += x[i];
        }
        return v;
    }

    /** sum of weights of one category over the regular bins */
    public double sum(final String category) {
        double s = 0;
        for (final double v : values(category))
            s += v;
        return s;
    }

    /** sum of weights over every category and bin, flow included */
    public double total() {
        double s = 0;
        for (final double[][] v : storage.values())
            for (final double x : v[0])
                s += x;
        return s;
    }

    /**
     * Histogram restricted to {@code categories}; unknown ones are ignored.
     */
    public Hist project(final Collection<String> categories) {
        final Map<String, double[][]> m = new TreeMap<>();
        for (final String c : categories) {
            final double[][] s = storage.get(c);
            if (s != null)
                m.put(c, s);
        }
        return restore(name, axis, m, state);
    }

    public Hist project(final String category) {
        return project(List.of(category));
    }

    /**
     * Copy with groups of {@code factor} bins merged. Flow bins stay as they are.
     */
    public Hist rebin(final int factor) {
        final Axis rebinned = axis.rebin(factor);
        if (rebinned == axis)
            return copy();
        final Map<String, double[][]> m = new TreeMap<>();
        for (final Map.Entry<String, double[][]> e : storage.entrySet()) {
            final double[][] s = e.getValue();
            final double[][] r = new double[2][rebinned.bins() + 2];
            for (int w = 0; w < 2; w++) {
                r[w][0] = s[w][0];
                r[w][rebinned.bins() + 1] = s[w][axis.bins() + 1];
                for (int i = 0; i < axis.bins(); i++)
                    r[w][i / factor + 1] += s[w][i + 1];
            }
            m.put(e.getKey(), r);
        }
        return restore(name, rebinned, m, state);
    }

    public Hist copy() {
        return restore(name, axis, storage, state);
    }

    /**
     * Structural, bitwise equality of name, axis and storage. The lifecycle state is
     * not part of it.
     */
    @Override
    public boolean equals(final Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Hist))
            return false;
        final Hist h = (Hist) o;
        if (!name.equals(h.name) || !axis.equals(h.axis) || !storage.keySet().equals(h.storage.keySet()))
            return false;
        for (final Map.Entry<String, double[][]> e : storage.entrySet()) {
            if (!Arrays.deepEquals(e.getValue(), h.storage.get(e.getKey())))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + axis.hashCode();
    }

    @Override
    public String toString() {
        return "Hist [name=" + name + ", axis=" + axis + ", categories=" + storage.keySet() + ", state=" + state + "]";
    }
}
