/**
 * 
 */
package hep.afw;

import java.util.Arrays;

/**
 * Numeric histogram axis with an underflow and an overflow bin.
 * 
 * Bin index 0 is underflow, {@code 1..bins()} are the regular bins and
 * {@code bins() + 1} is overflow. Bins are closed below and open above, so a value equal
 * to the upper edge lands in overflow, as does NaN.
 */
public final class Axis {
    public enum Kind {
        REGULAR, VARIABLE
    }

    private final Kind kind;
    private final String name;
    private final String label;
    private final double[] edges;

    private Axis(final Kind kind, final String name, final String label, final double[] edges) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("axis name");
        if (edges.length < 2)
            throw new IllegalArgumentException("axis " + name + " needs at least one bin");
        for (int i = 1; i < edges.length; i++) {
            if (!(edges[i] > edges[i - 1]))
                throw new IllegalArgumentException("axis " + name + " edges must increase: " + Arrays.toString(edges));
        }
        this.kind = kind;
        this.name = name;
        this.label = label == null ? name : label;
        this.edges = edges;
    }

    public static Axis regular(final String name, final String label, final int bins, final double lo, final double hi) {
        if (bins < 1 || !(hi > lo))
            throw new IllegalArgumentException("axis " + name + ": invalid regular binning " + bins + " [" + lo + ", " + hi + ")");
        final double[] e = new double[bins + 1];
        for (int i = 0; i <= bins; i++)
            e[i] = i == bins ? hi : lo + (hi - lo) * i / bins;
        return new Axis(Kind.REGULAR, name, label, e);
    }

    public static Axis variable(final String name, final String label, final double... edges) {
        return new Axis(Kind.VARIABLE, name, label, edges.clone());
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public String label() {
        return label;
    }

    public int bins() {
        return edges.length - 1;
    }

    public double lo() {
        return edges[0];
    }

    public double hi() {
        return edges[edges.length - 1];
    }

    public double[] edges() {
        return edges.clone();
    }

    public double edge(final int i) {
        return edges[i];
    }

    public double width(final int bin) {
        return edges[bin + 1] - edges[bin];
    }

    public double minWidth() {
        double w = Double.MAX_VALUE;
        for (int i = 0; i < bins(); i++)
            w = Math.min(w, width(i));
        return w;
    }

    /**
     * @return storage index of {@code x}, from 0 (underflow) to {@code bins() + 1} (overflow)
     */
    public int index(final double x) {
        if (Double.isNaN(x) || x >= hi())
            return bins() + 1;
        if (x < lo())
            return 0;
        if (kind == Kind.REGULAR) {
            int i = (int) ((x - lo()) / (hi() - lo()) * bins());
            // rounding at the upper bin edges
            if (i >= bins())
                i = bins() - 1;
            else if (x < edges[i])
                i--;
            else if (x >= edges[i + 1])
                i++;
            return i + 1;
        }
        int pos = Arrays.binarySearch(edges, x);
        if (pos < 0)
            pos = -pos - 2;
        return pos + 1;
    }

    /**
     * Merges groups of {@code factor} neighbouring bins. A trailing group with fewer
     * bins is kept as one wider bin.
     */
    public Axis rebin(final int factor) {
        if (factor < 1)
            throw new IllegalArgumentException("rebin factor " + factor);
        if (factor == 1)
            return this;
        final int n = (bins() + factor - 1) / factor;
        final double[] e = new double[n + 1];
        for (int i = 0; i < n; i++)
            e[i] = edges[i * factor];
        e[n] = hi();
        final Kind k = kind == Kind.REGULAR && bins() % factor == 0 ? Kind.REGULAR : Kind.VARIABLE;
        return new Axis(k, name, label, e);
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof Axis))
            return false;
        final Axis a = (Axis) o;
        return kind == a.kind && name.equals(a.name) && label.equals(a.label) && Arrays.equals(edges, a.edges);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + Arrays.hashCode(edges);
    }

    @Override
    public String toString() {
        if (kind == Kind.REGULAR)
            return "Regular(" + bins() + ", " + lo() + ", " + hi() + ", name=" + name + ")";
        return "Variable(" + Arrays.toString(edges) + ", name=" + name + ")";
    }
}
