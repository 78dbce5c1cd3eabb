/**
 * 
 */
package hep.afw.skim;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import hep.afw.ChunkRef;
import hep.afw.Column;
import hep.afw.ErrorCode;
import hep.afw.Events;
import hep.afw.IO;
import hep.afw.Meta;
import hep.afw.PipelineException;

/**
 * Descriptor of one persisted skim chunk, stored as {@code part-<chunk>.skim.json} next
 * to its data file.
 * 
 * <pre>
 * {
 *   "version": 1,
 *   "kind": "DIFF",
 *   "dataset": "/TTTo2L2Nu/Run3Summer22EE/NANOAODSIM",
 *   "chunk": 3,
 *   "source": {"file": "/data/ttbar_1.jsonl", "start": 1500000, "stop": 2000000},
 *   "rows": 8123,
 *   "data": "part-3.jsonl",
 *   "schema": {"fields": {"Jet_pt": "double[]", "MET_pt": "double"}},
 *   "fingerprint": "9f2c...",
 *   "baseline": {"record": "/eos/skims/v1/dilepton/TTTo2L2Nu_.../part-3.skim.json",
 *                "fingerprint": "41d0...", "derived": ["Jet_pt"]}
 * }
 * </pre>
 * 
 * A FULL record's data file holds the events. A DIFF record's data file holds the rows'
 * entries and the fields that could not be taken from the baseline; the other fields
 * ({@code derived}) are copied from the baseline rows with the same entries.
 */
public final class SkimRecord {
    public static final int VERSION = 1;
    public static final String SUFFIX = ".skim.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public enum Kind {
        FULL, DIFF
    }

    private final Kind kind;
    private final String dataset;
    private final int chunk;
    private final ChunkRef.Source source;
    private final int rows;
    private final String data;
    private final Meta schema;
    private final String fingerprint;
    private final String baselineRecord;
    private final String baselineFingerprint;
    private final List<String> derived;
    private File descriptor;

    private SkimRecord(final Kind kind, final String dataset, final int chunk, final ChunkRef.Source source,
            final int rows, final String data, final Meta schema, final String fingerprint, final String baselineRecord,
            final String baselineFingerprint, final List<String> derived) {
        this.kind = kind;
        this.dataset = dataset;
        this.chunk = chunk;
        this.source = source;
        this.rows = rows;
        this.data = data;
        this.schema = schema;
        this.fingerprint = fingerprint;
        this.baselineRecord = baselineRecord;
        this.baselineFingerprint = baselineFingerprint;
        this.derived = Collections.unmodifiableList(new ArrayList<>(derived));
    }

    static SkimRecord full(final ChunkRef chunk, final Events events, final String data) {
        return new SkimRecord(Kind.FULL, chunk.dataset(), chunk.index(), source(chunk), events.rows(), data,
                Meta.of(events), fingerprint(events), null, null, Collections.emptyList());
    }

    static SkimRecord diff(final ChunkRef chunk, final Events events, final String data, final SkimRecord baseline,
            final List<String> derived) {
        return new SkimRecord(Kind.DIFF, chunk.dataset(), chunk.index(), source(chunk), events.rows(), data,
                Meta.of(events), fingerprint(events), baseline.descriptor().getAbsolutePath(), baseline.fingerprint(),
                derived);
    }

    private static ChunkRef.Source source(final ChunkRef chunk) {
        return new ChunkRef.Source(chunk.file(), chunk.start(), chunk.stop());
    }

    public Kind kind() {
        return kind;
    }

    public String dataset() {
        return dataset;
    }

    /** index of the source chunk within its dataset */
    public int chunk() {
        return chunk;
    }

    /** entries of the source file this record was skimmed from */
    public ChunkRef.Source source() {
        return source;
    }

    public int rows() {
        return rows;
    }

    /** field schema of the complete events, baseline fields included */
    public Meta schema() {
        return schema;
    }

    public String fingerprint() {
        return fingerprint;
    }

    /** descriptor of the baseline record, null for FULL */
    public File baselineRecord() {
        return baselineRecord == null ? null : new File(baselineRecord);
    }

    public String baselineFingerprint() {
        return baselineFingerprint;
    }

    /** fields copied from the baseline, empty for FULL */
    public List<String> derived() {
        return derived;
    }

    /** where this descriptor lives; null until written or read */
    public File descriptor() {
        return descriptor;
    }

    public File dataFile() {
        return new File(descriptor.getAbsoluteFile().getParentFile(), data);
    }

    public static File descriptor(final File dir, final int chunk) {
        return new File(dir, "part-" + chunk + SUFFIX);
    }

    public static boolean isDescriptor(final File file) {
        return file.getName().endsWith(SUFFIX);
    }

    // ---------- JSON ----------

    JsonObject toJson() {
        final JsonObject o = new JsonObject();
        o.addProperty("version", VERSION);
        o.addProperty("kind", kind.name());
        o.addProperty("dataset", dataset);
        o.addProperty("chunk", chunk);
        final JsonObject s = new JsonObject();
        s.addProperty("file", source.file());
        s.addProperty("start", source.start());
        s.addProperty("stop", source.stop());
        o.add("source", s);
        o.addProperty("rows", rows);
        o.addProperty("data", data);
        o.add("schema", schema.toJson());
        o.addProperty("fingerprint", fingerprint);
        if (kind == Kind.DIFF) {
            final JsonObject b = new JsonObject();
            b.addProperty("record", baselineRecord);
            b.addProperty("fingerprint", baselineFingerprint);
            final JsonArray d = new JsonArray();
            for (final String f : derived)
                d.add(f);
            b.add("derived", d);
            o.add("baseline", b);
        }
        return o;
    }

    static SkimRecord fromJson(final JsonObject o) throws PipelineException {
        if (!o.has("version") || o.get("version").getAsInt() != VERSION)
            throw new PipelineException(ErrorCode.SERIALIZATION_VERSION, "skim record version " + o.get("version"));
        try {
            final Kind kind = Kind.valueOf(o.get("kind").getAsString());
            final JsonObject s = o.getAsJsonObject("source");
            final ChunkRef.Source source = new ChunkRef.Source(s.get("file").getAsString(), s.get("start").getAsLong(),
                    s.get("stop").getAsLong());
            String baselineRecord = null;
            String baselineFingerprint = null;
            final List<String> derived = new ArrayList<>();
            if (kind == Kind.DIFF) {
                final JsonObject b = o.getAsJsonObject("baseline");
                baselineRecord = b.get("record").getAsString();
                baselineFingerprint = b.get("fingerprint").getAsString();
                for (final JsonElement e : b.getAsJsonArray("derived"))
                    derived.add(e.getAsString());
            }
            return new SkimRecord(kind, o.get("dataset").getAsString(), o.get("chunk").getAsInt(), source,
                    o.get("rows").getAsInt(), o.get("data").getAsString(), Meta.fromJson(o.getAsJsonObject("schema")),
                    o.get("fingerprint").getAsString(), baselineRecord, baselineFingerprint, derived);
        } catch (RuntimeException ex) {
            throw new PipelineException(ErrorCode.DATA_ERROR, "malformed skim record: " + ex.getMessage(), ex);
        }
    }

    /**
     * Publishes the descriptor. This is the commit point of a skim chunk: data files
     * without a descriptor are ignored.
     */
    void write(final File file) throws IOException {
        final JsonObject o = toJson();
        IO.writeAtomic(file, true, os -> {
            final Writer w = new OutputStreamWriter(os, StandardCharsets.UTF_8);
            GSON.toJson(o, w);
            w.flush();
        });
        this.descriptor = file;
    }

    public static SkimRecord read(final File file) throws IOException {
        if (!file.exists())
            throw new PipelineException(ErrorCode.STORAGE_ERROR, "no skim record " + file);
        try (Reader r = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            final SkimRecord record = fromJson(GSON.fromJson(r, JsonObject.class));
            record.descriptor = file;
            return record;
        } catch (JsonParseException ex) {
            throw new PipelineException(ErrorCode.DATA_ERROR, "malformed skim record " + file, ex);
        }
    }

    /**
     * SHA-256 over entries, field names, types and values, in field order
     */
    public static String fingerprint(final Events events) {
        final MessageDigest md;
        try {
            md = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException(ex);
        }
        final ByteBuffer bb = ByteBuffer.allocate(8);
        long8(md, bb, events.rows());
        for (final long e : events.entries())
            long8(md, bb, e);
        for (final Column c : events.columns()) {
            md.update(c.name().getBytes(StandardCharsets.UTF_8));
            long8(md, bb, c.type());
            switch (c.type()) {
            case Column.TYPE_BOOL:
                for (final boolean v : c.toBools())
                    md.update((byte) (v ? 1 : 0));
                break;
            case Column.TYPE_INT64:
                for (final long v : c.toLongs())
                    long8(md, bb, v);
                break;
            case Column.TYPE_DOUBLE:
                for (final double v : c.toDoubles())
                    long8(md, bb, Double.doubleToLongBits(v));
                break;
            default:
                for (final int o : c.offsets())
                    long8(md, bb, o);
                for (final double v : c.flatValues())
                    long8(md, bb, Double.doubleToLongBits(v));
                break;
            }
        }
        final StringBuilder sb = new StringBuilder();
        for (final byte b : md.digest())
            sb.append(String.format("%02x", b));
        return sb.toString();
    }

    private static void long8(final MessageDigest md, final ByteBuffer bb, final long v) {
        bb.clear();
        bb.putLong(v);
        md.update(bb.array());
    }

    @Override
    public String toString() {
        return "SkimRecord [" + kind + " " + dataset + "#" + chunk + ", rows=" + rows + ", data=" + data + "]";
    }
}
