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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * Ordered field schema of an event file or skim record
 * 
 * Stored next to a data file as {@code <file>.desc}:
 * 
 * <pre>
 * {"fields": {"Jet_pt": "double[]", "nJet": "int64", "weight": "double"}}
 * </pre>
 */
public final class Meta {
    public static final String META_NAME_SUFFIX = ".desc";

    private final Map<String, Short> fields;

    public Meta(final Map<String, Short> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Meta of(final Events events) {
        final Map<String, Short> m = new LinkedHashMap<>();
        for (final Column c : events.columns())
            m.put(c.name(), c.type());
        return new Meta(m);
    }

    public Map<String, Short> fields() {
        return fields;
    }

    public List<String> names() {
        return new ArrayList<>(fields.keySet());
    }

    public boolean has(final String name) {
        return fields.containsKey(name);
    }

    public short type(final String name) throws PipelineException {
        final Short t = fields.get(name);
        if (t == null)
            throw PipelineException.data("unknown field %s", name);
        return t;
    }

    public int size() {
        return fields.size();
    }

    public JsonObject toJson() {
        final JsonObject f = new JsonObject();
        for (final Map.Entry<String, Short> e : fields.entrySet())
            f.addProperty(e.getKey(), Column.typename(e.getValue()));
        final JsonObject o = new JsonObject();
        o.add("fields", f);
        return o;
    }

    public static Meta fromJson(final JsonObject o) throws PipelineException {
        final JsonObject f = o.getAsJsonObject("fields");
        if (f == null)
            throw PipelineException.data("schema without fields");
        final Map<String, Short> m = new LinkedHashMap<>();
        try {
            for (final String k : f.keySet())
                m.put(k, Column.type(f.get(k).getAsString()));
        } catch (IllegalArgumentException ex) {
            throw PipelineException.data("schema: %s", ex.getMessage());
        }
        return new Meta(m);
    }

    public static File descriptor(final File file) {
        return new File(file.getPath() + META_NAME_SUFFIX);
    }

    public void write(final File file) throws IOException {
        final Gson gson = new GsonBuilder().setPrettyPrinting().create();
        IO.writeAtomic(descriptor(file), true, os -> {
            final Writer w = new OutputStreamWriter(os, StandardCharsets.UTF_8);
            gson.toJson(toJson(), w);
            w.flush();
        });
    }

    /**
     * @return the sidecar schema of {@code file}, or null when there is none
     */
    public static Meta read(final File file) throws IOException {
        final File desc = descriptor(file);
        if (!desc.exists())
            return null;
        try (Reader r = Files.newBufferedReader(desc.toPath(), StandardCharsets.UTF_8)) {
            return fromJson(new Gson().fromJson(r, JsonObject.class));
        } catch (JsonParseException ex) {
            throw new PipelineException(ErrorCode.DATA_ERROR, "malformed schema " + desc, ex);
        }
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof Meta m && fields.equals(m.fields) && names().equals(m.names());
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("Meta [");
        int i = 0;
        for (final Map.Entry<String, Short> e : fields.entrySet()) {
            if (i++ > 0)
                sb.append(", ");
            sb.append(e.getKey()).append(':').append(Column.typename(e.getValue()));
        }
        return sb.append(']').toString();
    }
}
