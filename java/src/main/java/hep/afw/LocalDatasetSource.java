/**
 * 
 */
package hep.afw;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * Datasets listed in a JSON manifest of local event files.
 * 
 * <pre>
 * {
 *   "veto": ["data/broken.jsonl"],
 *   "datasets": [
 *     {"name": "/TTTo2L2Nu/Run3Summer22EE/NANOAODSIM", "shortName": "TTBar", "isData": false,
 *      "xsec": 87.3, "nevents": 1000000, "files": ["data/ttbar_0.parquet", {"path": "data/ttbar_1.parquet", "entries": 500}]},
 *     {"name": "/Muon/Run2022F/NANOAOD", "shortName": "Muon", "isData": true, "files": ["data/muon_f.jsonl"]}
 *   ]
 * }
 * </pre>
 * 
 * Relative paths resolve against the manifest directory. Every file is split into chunks
 * of at most {@code chunkSize} entries. Files with zero entries or listed in
 * {@code veto} are skipped, and datasets left without files are dropped. When a
 * simulated dataset gives no {@code nevents} the sum of its file entries is used.
 */
public final class LocalDatasetSource implements DatasetSource {
    private final File manifest;
    private final long chunkSize;
    private final Logger logger;

    public LocalDatasetSource(final File manifest, final long chunkSize, final Logger logger) {
        if (chunkSize < 1)
            throw new IllegalArgumentException("chunk size " + chunkSize);
        this.manifest = manifest;
        this.chunkSize = chunkSize;
        this.logger = logger != null ? logger : new Logger.NullLogger();
    }

    @Override
    public List<Dataset> datasets() throws IOException {
        final JsonObject root;
        try (Reader r = Files.newBufferedReader(manifest.toPath(), StandardCharsets.UTF_8)) {
            root = new Gson().fromJson(r, JsonObject.class);
        } catch (JsonParseException ex) {
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "malformed manifest " + manifest, ex);
        }
        if (root == null || !root.has("datasets"))
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "manifest " + manifest + " lists no datasets");

        final File base = manifest.getAbsoluteFile().getParentFile();
        final Set<String> veto = new HashSet<>();
        if (root.has("veto")) {
            for (final JsonElement v : root.getAsJsonArray("veto"))
                veto.add(resolve(base, v.getAsString()).getPath());
        }

        final List<Dataset> result = new ArrayList<>();
        for (final JsonElement e : root.getAsJsonArray("datasets")) {
            final Dataset d = dataset(base, veto, e.getAsJsonObject());
            if (d != null)
                result.add(d);
        }
        return result;
    }

    private Dataset dataset(final File base, final Set<String> veto, final JsonObject o) throws IOException {
        final String name = string(o, "name");
        final String shortName = o.has("shortName") ? o.get("shortName").getAsString() : name;
        final boolean isData = o.has("isData") && o.get("isData").getAsBoolean();
        final Dataset.Builder b = Dataset.builder(name).shortName(shortName);

        long entries = 0;
        int files = 0;
        final JsonArray list = o.has("files") ? o.getAsJsonArray("files") : new JsonArray();
        for (final JsonElement f : list) {
            final File file;
            long n;
            if (f.isJsonObject()) {
                file = resolve(base, string(f.getAsJsonObject(), "path"));
                n = f.getAsJsonObject().has("entries") ? f.getAsJsonObject().get("entries").getAsLong() : -1;
            } else {
                file = resolve(base, f.getAsString());
                n = -1;
            }
            if (veto.contains(file.getPath())) {
                logger.error("[DATASET] skipping file due to entry in veto list: %s", file);
                continue;
            }
            if (n < 0) {
                try (EventFile ef = EventFile.open(file, logger)) {
                    n = ef.entries();
                }
            }
            if (n == 0) {
                logger.log("[DATASET] skipping file due to 0 events: %s", file);
                continue;
            }
            for (long start = 0; start < n; start += chunkSize)
                b.chunk(file.getPath(), start, Math.min(n, start + chunkSize));
            entries += n;
            files++;
        }

        if (files == 0) {
            logger.error("[DATASET] dataset %s (short name %s) has zero files!", name, shortName);
            return null;
        }

        if (isData) {
            b.data();
        } else {
            if (!o.has("xsec"))
                throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "simulated dataset " + name + " has no xsec");
            final long nevents = o.has("nevents") ? o.get("nevents").getAsLong() : entries;
            b.simulated(o.get("xsec").getAsDouble(), nevents);
        }
        return b.build();
    }

    private static File resolve(final File base, final String path) {
        final File f = IO.path(path);
        return f.isAbsolute() ? f : new File(base, path);
    }

    private String string(final JsonObject o, final String key) throws PipelineException {
        final JsonElement v = o.get(key);
        if (v == null || !v.isJsonPrimitive())
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "manifest " + manifest + ": missing " + key + " in " + o);
        return v.getAsString();
    }
}
