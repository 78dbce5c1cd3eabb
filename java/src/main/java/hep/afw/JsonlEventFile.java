package hep.afw;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;

/**
 * JSONL event file (using Gson), one event per line:
 * 
 * <pre>
 * {"_entry": 17, "nJet": 5, "Jet_pt": [88.1, 61.0, 45.2, 33.3, 30.9], "MET_pt": 41.7}
 * </pre>
 * 
 * The schema comes from the {@code .desc} sidecar when there is one, otherwise it is
 * inferred from the first lines. Gzip-compressed files are recognized by their magic bytes.
 */
final class JsonlEventFile implements EventFile {
	private static final int SAMPLE_ROWS = 32;

	private final File file;
	private final Logger logger;
	private BufferedWriter writer; // non-null when opened for writing
	private Meta cachedMeta; // lazily resolved for reading
	private long cachedEntries = -1;

	private final Gson gson = new GsonBuilder().serializeSpecialFloatingPointValues().create();

	private JsonlEventFile(final File file, final Meta meta, final Logger logger) {
		this.file = file;
		this.cachedMeta = meta;
		this.logger = (logger != null ? logger : new Logger.NullLogger());
	}

	static JsonlEventFile open(final File file, final Logger logger) throws IOException {
		final JsonlEventFile f = new JsonlEventFile(file, null, logger);
		f.logger.debug("open r %s, file size : %s", file, IO.readableBytesSize(file.length()));
		return f;
	}

	static JsonlEventFile create(final File file, final Meta meta, final Logger logger, final boolean gzip) throws IOException {
		if (meta == null)
			throw new IllegalArgumentException("meta");
		if (meta.has(ENTRY_FIELD))
			throw new IllegalArgumentException(ENTRY_FIELD + " is reserved");
		final JsonlEventFile f = new JsonlEventFile(file, meta, logger);
		f.openWriter(gzip);
		meta.write(file);
		return f;
	}

	@Override
	public void close() throws IOException {
		if (writer != null) {
			try {
				writer.flush();
			} finally {
				try {
					writer.close();
				} finally {
					writer = null;
				}
			}
			logger.debug("closed %s, file size : %s", file, IO.readableBytesSize(file.length()));
		}
	}

	@Override
	public long fileSize() {
		return file.length();
	}

	// --------- metadata ---------

	@Override
	public Meta meta() throws IOException {
		if (cachedMeta != null)
			return cachedMeta;
		final Meta desc = Meta.read(file);
		if (desc != null) {
			cachedMeta = desc;
			return cachedMeta;
		}
		// Infer from first line(s)
		final List<JsonObject> samples = new ArrayList<>();
		try (BufferedReader br = reader()) {
			String line;
			while (samples.size() < SAMPLE_ROWS && (line = br.readLine()) != null) {
				line = line.trim();
				if (line.isEmpty())
					continue;
				samples.add(parse(line, samples.size()));
			}
		}
		if (samples.isEmpty())
			throw new PipelineException(ErrorCode.DATA_ERROR, "empty jsonl without schema: " + file);
		cachedMeta = infer(samples);
		return cachedMeta;
	}

	private Meta infer(final List<JsonObject> samples) throws PipelineException {
		final Map<String, Short> types = new LinkedHashMap<>();
		for (final JsonObject o : samples) {
			for (final Map.Entry<String, JsonElement> e : o.entrySet()) {
				if (ENTRY_FIELD.equals(e.getKey()))
					continue;
				final short t = inferType(e.getKey(), e.getValue());
				final Short prev = types.get(e.getKey());
				if (prev == null || (prev == Column.TYPE_INT64 && t == Column.TYPE_DOUBLE))
					types.put(e.getKey(), t);
				else if (prev != t && !(prev == Column.TYPE_DOUBLE && t == Column.TYPE_INT64))
					throw PipelineException.data("%s: field %s mixes %s and %s", file, e.getKey(),
							Column.typename(prev), Column.typename(t));
			}
		}
		return new Meta(types);
	}

	private short inferType(final String name, final JsonElement v) throws PipelineException {
		if (v.isJsonArray())
			return Column.TYPE_DOUBLE_LIST;
		if (v.isJsonPrimitive()) {
			final JsonPrimitive p = v.getAsJsonPrimitive();
			if (p.isBoolean())
				return Column.TYPE_BOOL;
			if (p.isNumber()) {
				final String s = p.getAsString();
				return s.contains(".") || s.contains("e") || s.contains("E") || s.contains("N") || s.contains("I")
						? Column.TYPE_DOUBLE
						: Column.TYPE_INT64;
			}
		}
		throw PipelineException.data("%s: field %s has unsupported value %s", file, name, v);
	}

	// --------- read ---------

	@Override
	public long entries() throws IOException {
		if (cachedEntries >= 0)
			return cachedEntries;
		long n = 0;
		try (BufferedReader br = reader()) {
			String line;
			while ((line = br.readLine()) != null) {
				if (!line.trim().isEmpty())
					n++;
			}
		}
		cachedEntries = n;
		return n;
	}

	@Override
	public Events read(final long start, final long stop) throws IOException {
		if (writer != null)
			throw new IllegalStateException("writing");
		final Meta m = meta();
		final List<Column.Builder> builders = new ArrayList<>();
		for (final Map.Entry<String, Short> e : m.fields().entrySet())
			builders.add(new Column.Builder(e.getKey(), e.getValue()));
		final List<Long> entries = new ArrayList<>();

		try (BufferedReader br = reader()) {
			String line;
			long row = 0;
			while (row < stop && (line = br.readLine()) != null) {
				line = line.trim();
				if (line.isEmpty())
					continue;
				if (row >= start) {
					final JsonObject o = parse(line, row);
					final JsonElement entry = o.get(ENTRY_FIELD);
					entries.add(entry == null ? row : entry.getAsLong());
					for (final Column.Builder b : builders) {
						final JsonElement v = o.get(b.name());
						if (v == null || v.isJsonNull())
							throw PipelineException.data("%s row %d: missing field %s", file, row, b.name());
						b.add(value(v));
					}
				}
				row++;
			}
		}

		final long[] e = new long[entries.size()];
		for (int i = 0; i < e.length; i++)
			e[i] = entries.get(i);
		final List<Column> columns = new ArrayList<>();
		for (final Column.Builder b : builders)
			columns.add(b.create());
		return Events.of(e, columns);
	}

	private static Object value(final JsonElement v) {
		if (v.isJsonArray()) {
			final JsonArray a = v.getAsJsonArray();
			final double[] d = new double[a.size()];
			for (int i = 0; i < d.length; i++)
				d[i] = a.get(i).getAsDouble();
			return d;
		}
		final JsonPrimitive p = v.getAsJsonPrimitive();
		if (p.isBoolean())
			return p.getAsBoolean();
		return p.getAsNumber();
	}

	private JsonObject parse(final String line, final long row) throws PipelineException {
		try {
			final JsonObject o = gson.fromJson(line, JsonObject.class);
			if (o == null)
				throw PipelineException.data("%s row %d: not an object", file, row);
			return o;
		} catch (JsonParseException | IllegalStateException ex) {
			throw new PipelineException(ErrorCode.DATA_ERROR, file + " row " + row + ": " + ex.getMessage(), ex);
		}
	}

	private BufferedReader reader() throws IOException {
		final InputStream is = new BufferedInputStream(new FileInputStream(file), 1 << 16);
		is.mark(2);
		final int b0 = is.read();
		final int b1 = is.read();
		is.reset();
		final InputStream in = (b0 == 0x1f && b1 == 0x8b) ? new GZIPInputStream(is, 65535) : is;
		return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), 1 << 20);
	}

	// --------- write ---------

	private void openWriter(final boolean gzip) throws IOException {
		final File parent = file.getAbsoluteFile().getParentFile();
		if (!parent.exists() && !parent.mkdirs())
			throw new IOException("cannot create directory " + parent);
		OutputStream os = new FileOutputStream(file);
		if (gzip)
			os = new GZIPOutputStream(os, 8192);
		this.writer = new BufferedWriter(new OutputStreamWriter(os, StandardCharsets.UTF_8));
		logger.debug("open w, file : %s", file);
	}

	@Override
	public void write(final Events events) throws IOException {
		if (writer == null)
			throw new IOException("writer not opened");
		if (!events.names().equals(cachedMeta.names()))
			throw PipelineException.data("%s: writing fields %s, schema has %s", file, events.names(), cachedMeta.names());
		final List<Column> cols = events.columns();
		for (int r = 0; r < events.rows(); r++) {
			final JsonObject o = new JsonObject();
			o.addProperty(ENTRY_FIELD, events.entry(r));
			for (final Column c : cols) {
				if (c.type() != cachedMeta.type(c.name()))
					throw PipelineException.data("%s: field %s is %s, schema has %s", file, c.name(),
							Column.typename(c.type()), Column.typename(cachedMeta.type(c.name())));
				switch (c.type()) {
					case Column.TYPE_BOOL:
						o.addProperty(c.name(), c.getBool(r));
						break;
					case Column.TYPE_INT64:
						o.addProperty(c.name(), c.getLong(r));
						break;
					case Column.TYPE_DOUBLE:
						o.addProperty(c.name(), c.getDouble(r));
						break;
					default: {
						final JsonArray a = new JsonArray(c.count(r));
						for (int i = 0; i < c.count(r); i++)
							a.add(c.get(r, i));
						o.add(c.name(), a);
					}
				}
			}
			writer.write(gson.toJson(o));
			writer.write('\n');
		}
	}
}
