/**
 * 
 */
package hep.afw;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * Versioned JSON form of reduced accumulators.
 * 
 * <pre>
 * {"version": 1, "name": "NJets", "state": "REDUCED",
 *  "axis": {"kind": "VARIABLE", "name": "njet", "label": "...", "edges": [4.0, 5.0, ...]},
 *  "categories": {"TTBar": {"sumw": [...], "sumw2": [...]}}}
 * </pre>
 * 
 * Bin contents include the flow bins. Doubles are written with their shortest exact
 * decimal form, so decoding restores bitwise identical contents.
 */
public final class HistCodec {
    public static final int VERSION = 1;
    public static final String RESULTS_FILE = "results.json";

    private static final Gson GSON = new GsonBuilder()
            .serializeSpecialFloatingPointValues()
            .setPrettyPrinting()
            .create();

    private HistCodec() {
    }

    public static JsonObject encode(final Hist hist) {
        final JsonObject o = new JsonObject();
        o.addProperty("version", VERSION);
        o.addProperty("name", hist.name());
        o.addProperty("state", hist.state().name());

        final Axis axis = hist.axis();
        final JsonObject a = new JsonObject();
        a.addProperty("kind", axis.kind().name());
        a.addProperty("name", axis.name());
        a.addProperty("label", axis.label());
        a.add("edges", array(axis.edges()));
        o.add("axis", a);

        final JsonObject categories = new JsonObject();
        for (final String c : hist.categories()) {
            final JsonObject s = new JsonObject();
            s.add("sumw", array(hist.valuesWithFlow(c)));
            s.add("sumw2", array(hist.variancesWithFlow(c)));
            categories.add(c, s);
        }
        o.add("categories", categories);
        return o;
    }

    public static Hist decode(final JsonObject o) throws PipelineException {
        version(o);
        try {
            final JsonObject a = o.getAsJsonObject("axis");
            final double[] edges = doubles(a.getAsJsonArray("edges"));
            final Axis axis;
            if (Axis.Kind.valueOf(a.get("kind").getAsString()) == Axis.Kind.REGULAR)
                axis = Axis.regular(a.get("name").getAsString(), a.get("label").getAsString(), edges.length - 1,
                        edges[0], edges[edges.length - 1]);
            else
                axis = Axis.variable(a.get("name").getAsString(), a.get("label").getAsString(), edges);

            final Map<String, double[][]> storage = new TreeMap<>();
            final JsonObject categories = o.getAsJsonObject("categories");
            for (final String c : categories.keySet()) {
                final JsonObject s = categories.getAsJsonObject(c);
                storage.put(c, new double[][] { doubles(s.getAsJsonArray("sumw")), doubles(s.getAsJsonArray("sumw2")) });
            }
            final Hist.State state = o.has("state") ? Hist.State.valueOf(o.get("state").getAsString()) : Hist.State.REDUCED;
            return Hist.restore(o.get("name").getAsString(), axis, storage, state);
        } catch (RuntimeException ex) {
            throw new PipelineException(ErrorCode.DATA_ERROR, "malformed histogram: " + ex.getMessage(), ex);
        }
    }

    private static void version(final JsonObject o) throws PipelineException {
        final JsonElement v = o.get("version");
        if (v == null || !v.isJsonPrimitive() || v.getAsInt() != VERSION)
            throw new PipelineException(ErrorCode.SERIALIZATION_VERSION,
                    "version " + v + " is not supported, expected " + VERSION);
    }

    private static JsonArray array(final double[] values) {
        final JsonArray a = new JsonArray(values.length);
        for (final double v : values)
            a.add(v);
        return a;
    }

    private static double[] doubles(final JsonArray a) {
        final double[] v = new double[a.size()];
        for (int i = 0; i < v.length; i++)
            v[i] = a.get(i).getAsDouble();
        return v;
    }

    /**
     * Everything needed to render an analysis again without any event data
     */
    public static final class Results {
        private final String analysis;
        private final List<String> dataCategories;
        private final Map<String, Reducer.Result> results;

        public Results(final String analysis, final List<String> dataCategories, final Map<String, Reducer.Result> results) {
            this.analysis = analysis;
            this.dataCategories = Collections.unmodifiableList(new ArrayList<>(dataCategories));
            this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        }

        public String analysis() {
            return analysis;
        }

        /** categories filled from real data; every other category is simulated */
        public List<String> dataCategories() {
            return dataCategories;
        }

        public Map<String, Reducer.Result> results() {
            return results;
        }

        public Reducer.Result get(final String name) throws PipelineException {
            final Reducer.Result r = results.get(name);
            if (r == null)
                throw new PipelineException(ErrorCode.DATA_ERROR, "no result for histogram " + name + " in " + analysis);
            return r;
        }
    }

    public static JsonObject encode(final Results results) {
        final JsonObject o = new JsonObject();
        o.addProperty("version", VERSION);
        o.addProperty("analysis", results.analysis());
        final JsonArray data = new JsonArray();
        for (final String c : results.dataCategories())
            data.add(c);
        o.add("data", data);
        final JsonObject r = new JsonObject();
        for (final Reducer.Result result : results.results().values()) {
            final JsonObject e = new JsonObject();
            e.addProperty("status", result.status());
            e.addProperty("chunks", result.chunks());
            e.addProperty("failed", result.failed());
            e.add("hist", encode(result.hist()));
            r.add(result.name(), e);
        }
        o.add("results", r);
        return o;
    }

    public static Results decodeResults(final JsonObject o) throws PipelineException {
        version(o);
        try {
            final List<String> data = new ArrayList<>();
            for (final JsonElement e : o.getAsJsonArray("data"))
                data.add(e.getAsString());
            final Map<String, Reducer.Result> results = new LinkedHashMap<>();
            final JsonObject r = o.getAsJsonObject("results");
            for (final String name : r.keySet()) {
                final JsonObject e = r.getAsJsonObject(name);
                final Hist h = decode(e.getAsJsonObject("hist"));
                if (!h.name().equals(name))
                    throw new PipelineException(ErrorCode.DATA_ERROR, "result " + name + " holds histogram " + h.name());
                results.put(name, new Reducer.Result(h, e.get("chunks").getAsInt(), e.get("failed").getAsInt()));
            }
            return new Results(o.get("analysis").getAsString(), data, results);
        } catch (RuntimeException ex) {
            throw new PipelineException(ErrorCode.DATA_ERROR, "malformed results: " + ex.getMessage(), ex);
        }
    }

    public static void write(final File file, final Results results) throws IOException {
        final JsonObject o = encode(results);
        IO.writeAtomic(file, true, os -> {
            final Writer w = new OutputStreamWriter(os, StandardCharsets.UTF_8);
            GSON.toJson(o, w);
            w.flush();
        });
    }

    public static Results read(final File file) throws IOException {
        if (!file.exists())
            throw new PipelineException(ErrorCode.DATA_ERROR, "no results at " + file);
        try (Reader r = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            return decodeResults(GSON.fromJson(r, JsonObject.class));
        } catch (JsonParseException ex) {
            throw new PipelineException(ErrorCode.DATA_ERROR, "malformed results " + file, ex);
        }
    }
}
