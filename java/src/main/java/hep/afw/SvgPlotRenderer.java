/**
 * 
 */
package hep.afw;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Data/simulation comparison plot as SVG.
 * 
 * Simulated categories are stacked, the largest yield at the bottom (ties by name),
 * signal categories are drawn as lines on top and data categories are summed and drawn
 * as points with statistical error bars. Incomplete results carry a banner with the
 * number of failed chunks.
 */
public final class SvgPlotRenderer implements PlotRenderer {
    /** CMS 10-color scheme */
    static final String[] PALETTE = { "#3f90da", "#ffa90e", "#bd1f01", "#94a4a2", "#832db6", "#a96b59", "#e76300",
            "#b9ac70", "#717581", "#92dadd" };

    private static final int WIDTH = 800;
    private static final int HEIGHT = 600;
    private static final int LEFT = 90;
    private static final int RIGHT = 770;
    private static final int TOP = 50;
    private static final int BOTTOM = 520;

    private final double luminosity;

    public SvgPlotRenderer() {
        this(Normalization.DEFAULT_LUMINOSITY);
    }

    /**
     * @param luminosity integrated luminosity in pb^-1, shown in the header
     */
    public SvgPlotRenderer(final double luminosity) {
        this.luminosity = luminosity;
    }

    @Override
    public boolean supports(final String extension) {
        return "svg".equalsIgnoreCase(extension);
    }

    @Override
    public void render(final Reducer.Result result, final HistogramSpec.PlotOptions options,
            final List<String> dataCategories, final OutputStream out) throws IOException {
        final Hist hist = result.hist().rebin(options.rebin());
        final Axis axis = hist.axis();
        final int bins = axis.bins();

        final List<String> data = new ArrayList<>();
        final List<String> signals = new ArrayList<>();
        final List<String> stacked = new ArrayList<>();
        for (final String c : hist.categories()) {
            if (dataCategories.contains(c))
                data.add(c);
            else if (options.signals().contains(c))
                signals.add(c);
            else
                stacked.add(c);
        }
        stacked.sort(Comparator.comparingDouble((String c) -> -hist.sum(c)).thenComparing(Comparator.naturalOrder()));

        final double[] dataValues = hist.values(data);
        final double[] dataErrors = new double[bins];
        for (final String c : data) {
            final double[] v = hist.variances(c);
            for (int i = 0; i < bins; i++)
                dataErrors[i] += v[i];
        }
        for (int i = 0; i < bins; i++)
            dataErrors[i] = Math.sqrt(dataErrors[i]);

        final double[][] stack = new double[stacked.size() + 1][bins];
        for (int k = 0; k < stacked.size(); k++) {
            final double[] v = hist.values(stacked.get(k));
            for (int i = 0; i < bins; i++)
                stack[k + 1][i] = stack[k][i] + v[i];
        }

        double ymax = 0;
        for (int i = 0; i < bins; i++) {
            ymax = Math.max(ymax, stack[stacked.size()][i]);
            ymax = Math.max(ymax, dataValues[i] + dataErrors[i]);
        }
        for (final String s : signals)
            for (final double v : hist.values(s))
                ymax = Math.max(ymax, v);
        ymax = ymax > 0 ? ymax * 1.25 : 1.0;

        final Frame f = new Frame(axis.edge(0), axis.edge(bins), ymax);
        final Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        w.write(fmt("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%d\" height=\"%d\" viewBox=\"0 0 %d %d\">\n", WIDTH,
                HEIGHT, WIDTH, HEIGHT));
        w.write(fmt("<title>%s</title>\n", escape(hist.name())));
        w.write(fmt("<rect x=\"0\" y=\"0\" width=\"%d\" height=\"%d\" fill=\"#ffffff\"/>\n", WIDTH, HEIGHT));

        for (int k = 0; k < stacked.size(); k++) {
            final String color = PALETTE[k % PALETTE.length];
            w.write(fmt("<g class=\"stack\" data-category=\"%s\" fill=\"%s\">\n", escape(stacked.get(k)), color));
            for (int i = 0; i < bins; i++) {
                final double lo = stack[k][i];
                final double hi = stack[k + 1][i];
                if (hi <= lo)
                    continue;
                final double x0 = f.x(axis.edge(i));
                final double x1 = f.x(axis.edge(i + 1));
                w.write(fmt("<rect x=\"%.2f\" y=\"%.2f\" width=\"%.2f\" height=\"%.2f\"/>\n", x0, f.y(hi), x1 - x0,
                        f.y(lo) - f.y(hi)));
            }
            w.write("</g>\n");
        }

        for (final String s : signals) {
            final double[] v = hist.values(s);
            final StringBuilder d = new StringBuilder();
            for (int i = 0; i < bins; i++) {
                d.append(i == 0 ? "M" : "L").append(fmt("%.2f %.2f", f.x(axis.edge(i)), f.y(v[i])));
                d.append(fmt("L%.2f %.2f", f.x(axis.edge(i + 1)), f.y(v[i])));
            }
            w.write(fmt("<path class=\"signal\" data-category=\"%s\" d=\"%s\" fill=\"none\" stroke=\"#000000\"/>\n",
                    escape(s), d));
        }

        if (!data.isEmpty()) {
            w.write("<g class=\"data\" fill=\"#000000\" stroke=\"#000000\">\n");
            for (int i = 0; i < bins; i++) {
                if (dataValues[i] <= 0)
                    continue;
                final double x = f.x((axis.edge(i) + axis.edge(i + 1)) / 2);
                w.write(fmt("<line x1=\"%.2f\" y1=\"%.2f\" x2=\"%.2f\" y2=\"%.2f\"/>\n", x, f.y(dataValues[i] + dataErrors[i]),
                        x, f.y(Math.max(0, dataValues[i] - dataErrors[i]))));
                w.write(fmt("<circle cx=\"%.2f\" cy=\"%.2f\" r=\"2.5\"/>\n", x, f.y(dataValues[i])));
            }
            w.write("</g>\n");
        }

        // frame and labels
        w.write(fmt("<rect x=\"%d\" y=\"%d\" width=\"%d\" height=\"%d\" fill=\"none\" stroke=\"#000000\"/>\n", LEFT, TOP,
                RIGHT - LEFT, BOTTOM - TOP));
        for (int t = 0; t <= 4; t++) {
            final double xv = axis.edge(0) + (axis.edge(bins) - axis.edge(0)) * t / 4;
            final double yv = ymax * t / 4;
            w.write(fmt("<text x=\"%.2f\" y=\"%d\" font-size=\"12\" text-anchor=\"middle\">%s</text>\n", f.x(xv),
                    BOTTOM + 16, tick(xv)));
            w.write(fmt("<text x=\"%d\" y=\"%.2f\" font-size=\"12\" text-anchor=\"end\">%s</text>\n", LEFT - 6,
                    f.y(yv) + 4, tick(yv)));
        }
        w.write(fmt("<text x=\"%d\" y=\"%d\" font-size=\"14\" text-anchor=\"end\">%s</text>\n", RIGHT, BOTTOM + 40,
                escape(hist.name())));
        w.write(fmt("<text x=\"20\" y=\"%d\" font-size=\"14\" text-anchor=\"end\" transform=\"rotate(-90 20 %d)\">%s</text>\n",
                TOP, TOP, escape(fmt("Counts / %.0f %s", axis.minWidth(), options.units()))));
        w.write(fmt("<text x=\"%d\" y=\"%d\" font-size=\"16\" font-weight=\"bold\">CMS <tspan font-style=\"italic\" font-weight=\"normal\">Preliminary</tspan></text>\n",
                LEFT, TOP - 10));
        w.write(fmt("<text x=\"%d\" y=\"%d\" font-size=\"14\" text-anchor=\"end\">%.1f fb&#8315;&#185; (13.6 TeV)</text>\n",
                RIGHT, TOP - 10, luminosity / 1e3));

        int row = 0;
        if (!data.isEmpty())
            legend(w, row++, "#000000", "Data");
        for (int k = 0; k < stacked.size(); k++)
            legend(w, row++, PALETTE[k % PALETTE.length], stacked.get(k));
        for (final String s : signals)
            legend(w, row++, "#000000", s);

        if (!result.isComplete())
            w.write(fmt("<text class=\"banner\" x=\"%d\" y=\"%d\" font-size=\"14\" fill=\"#bd1f01\">partial (%d/%d chunks failed)</text>\n",
                    LEFT + 10, TOP + 20, result.failed(), result.chunks()));
        w.write("</svg>\n");
        w.flush();
    }

    private static void legend(final Writer w, final int row, final String color, final String label) throws IOException {
        final int y = TOP + 40 + row * 18;
        w.write(fmt("<rect x=\"%d\" y=\"%d\" width=\"12\" height=\"12\" fill=\"%s\"/>\n", RIGHT - 170, y - 10, color));
        w.write(fmt("<text x=\"%d\" y=\"%d\" font-size=\"12\">%s</text>\n", RIGHT - 152, y, escape(label)));
    }

    private static String tick(final double v) {
        if (v != 0 && (Math.abs(v) >= 1e5 || Math.abs(v) < 1e-2))
            return fmt("%.1e", v);
        final String s = fmt("%.4g", v);
        return s.indexOf('.') < 0 ? s : s.replaceAll("0+$", "").replaceAll("\\.$", "");
    }

    private static String fmt(final String pattern, final Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    static String escape(final String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    /**
     * Maps axis coordinates to the drawing area
     */
    private static final class Frame {
        private final double lo;
        private final double hi;
        private final double ymax;

        Frame(final double lo, final double hi, final double ymax) {
            this.lo = lo;
            this.hi = hi;
            this.ymax = ymax;
        }

        double x(final double v) {
            return LEFT + (v - lo) / (hi - lo) * (RIGHT - LEFT);
        }

        double y(final double v) {
            return BOTTOM - v / ymax * (BOTTOM - TOP);
        }
    }
}
