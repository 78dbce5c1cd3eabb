package hep.afw;

import java.io.File;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.avro.Schema;
import org.apache.avro.Schema.Field;
import org.apache.avro.Schema.Type;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.apache.parquet.io.DelegatingPositionOutputStream;
import org.apache.parquet.io.DelegatingSeekableInputStream;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;
import org.apache.parquet.io.SeekableInputStream;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * Parquet event file (using parquet-avro)
 *
 * Flat fields map to Avro {@code boolean}, {@code long} and {@code double}, collections
 * to {@code array<double>}. The field schema is also stored as JSON in the file's
 * key-value metadata, so it survives without a sidecar.
 */
public final class ParquetEventFile implements EventFile {
    static final String SCHEMA_KEY = "afw.schema";

    private final File file;
    private final Logger logger;

    private volatile Meta cachedMeta;
    private volatile Schema avroSchema;

    private ParquetWriter<GenericRecord> writer;

    private final CompressionCodecName compressionCodec;

    private ParquetEventFile(final File file, final Meta meta, final Logger logger,
            final CompressionCodecName compressionCodec) {
        this.file = file;
        this.cachedMeta = meta; // may be null and lazily resolved
        this.logger = (logger != null ? logger : new Logger.NullLogger());
        this.compressionCodec = (compressionCodec != null ? compressionCodec : CompressionCodecName.SNAPPY);
    }

    /** Open Parquet file for reading. */
    public static ParquetEventFile open(final File file, final Logger logger) throws IOException {
        final ParquetEventFile f = new ParquetEventFile(file, null, logger, null);
        f.logger.debug("open r %s, file size : %s", file, IO.readableBytesSize(file.length()));
        return f;
    }

    /**
     * Create Parquet file for writing.
     */
    public static ParquetEventFile create(final File file, final Meta meta, final Logger logger,
            final CompressionCodecName compressionCodec) throws IOException {
        if (meta == null)
            throw new IllegalArgumentException("meta");
        if (meta.has(ENTRY_FIELD))
            throw new IllegalArgumentException(ENTRY_FIELD + " is reserved");
        final ParquetEventFile f = new ParquetEventFile(file, meta, logger, compressionCodec);
        f.openWriter();
        return f;
    }

    // ---------- Lifecycle ----------

    @Override
    public void close() throws IOException {
        if (writer == null)
            return;
        try {
            writer.close();
        } finally {
            writer = null;
        }
        logger.debug("closed %s, file size : %s", file, IO.readableBytesSize(file.length()));
    }

    @Override
    public long fileSize() {
        return file.length();
    }

    @Override
    public long entries() throws IOException {
        try (ParquetFileReader fr = ParquetFileReader.open(new LocalParquetFile(file))) {
            final ParquetMetadata footer = fr.getFooter();
            return footer.getBlocks().stream().mapToLong(b -> b.getRowCount()).sum();
        }
    }

    // ---------- Metadata ----------

    @Override
    public Meta meta() throws IOException {
        if (cachedMeta != null)
            return cachedMeta;

        try (ParquetFileReader fr = ParquetFileReader.open(new LocalParquetFile(file))) {
            final Map<String, String> kv = fr.getFooter().getFileMetaData().getKeyValueMetaData();
            final String schema = kv.get(SCHEMA_KEY);
            if (schema != null) {
                this.cachedMeta = Meta.fromJson(JsonParser.parseString(schema).getAsJsonObject());
                return cachedMeta;
            }
            final String avro = kv.get("parquet.avro.schema");
            if (avro == null)
                throw new PipelineException(ErrorCode.DATA_ERROR, "no schema in " + file);
            this.avroSchema = new Schema.Parser().parse(avro);
            this.cachedMeta = metaFromAvro(avroSchema);
            return cachedMeta;
        }
    }

    // ---------- Read ----------

    @Override
    public Events read(final long start, final long stop) throws IOException {
        if (writer != null)
            throw new IllegalStateException("writing");
        final Meta m = meta();
        final List<Column.Builder> builders = new ArrayList<>();
        for (final Map.Entry<String, Short> e : m.fields().entrySet())
            builders.add(new Column.Builder(e.getKey(), e.getValue()));
        final List<Long> entries = new ArrayList<>();

        try (ParquetReader<GenericRecord> reader = AvroParquetReader.<GenericRecord>builder(new LocalParquetFile(file)).build()) {
            GenericRecord rec;
            long row = 0;
            while (row < stop && (rec = reader.read()) != null) {
                if (row >= start) {
                    final Object entry = rec.getSchema().getField(ENTRY_FIELD) != null ? rec.get(ENTRY_FIELD) : null;
                    entries.add(entry == null ? row : ((Number) entry).longValue());
                    for (final Column.Builder b : builders) {
                        final Object v = rec.get(b.name());
                        if (v == null)
                            throw PipelineException.data("%s row %d: missing field %s", file, row, b.name());
                        b.add(v);
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

    // ---------- Write ----------

    @Override
    public void write(final Events events) throws IOException {
        if (writer == null)
            throw new IOException("writer not opened");
        if (!events.names().equals(cachedMeta.names()))
            throw PipelineException.data("%s: writing fields %s, schema has %s", file, events.names(), cachedMeta.names());
        final List<Column> cols = events.columns();
        for (final Column c : cols) {
            if (c.type() != cachedMeta.type(c.name()))
                throw PipelineException.data("%s: field %s is %s, schema has %s", file, c.name(),
                        Column.typename(c.type()), Column.typename(cachedMeta.type(c.name())));
        }
        for (int r = 0; r < events.rows(); r++) {
            final GenericRecord rec = new GenericData.Record(avroSchema);
            rec.put(ENTRY_FIELD, events.entry(r));
            for (final Column c : cols)
                rec.put(c.name(), toAvroValue(c, r));
            writer.write(rec);
        }
    }

    // ---------- Internals ----------

    private void openWriter() throws IOException {
        this.avroSchema = buildAvroSchema(cachedMeta);

        final JsonObject schema = cachedMeta.toJson();
        final Map<String, String> metadata = new HashMap<>();
        metadata.put(SCHEMA_KEY, schema.toString());
        metadata.put("afw.version", String.valueOf(HistCodec.VERSION));

        this.writer = AvroParquetWriter.<GenericRecord>builder(new LocalParquetFile(file))
                .withSchema(avroSchema)
                .withCompressionCodec(compressionCodec)
                .withExtraMetaData(metadata)
                .build();
        logger.debug("open w, file : %s (%s)", file, compressionCodec);
    }

    private static Schema buildAvroSchema(final Meta meta) {
        final List<Field> fields = new ArrayList<>();
        fields.add(new Field(ENTRY_FIELD, Schema.create(Type.LONG), null, (Object) null));
        for (final Map.Entry<String, Short> e : meta.fields().entrySet())
            fields.add(new Field(e.getKey(), avroType(e.getValue()), null, (Object) null));
        final Schema rec = Schema.createRecord("events", null, ParquetEventFile.class.getPackageName(), false);
        rec.setFields(fields);
        return rec;
    }

    private static Schema avroType(final short type) {
        return switch (type) {
            case Column.TYPE_BOOL -> Schema.create(Type.BOOLEAN);
            case Column.TYPE_INT64 -> Schema.create(Type.LONG);
            case Column.TYPE_DOUBLE -> Schema.create(Type.DOUBLE);
            default -> Schema.createArray(Schema.create(Type.DOUBLE));
        };
    }

    private static Object toAvroValue(final Column c, final int row) {
        switch (c.type()) {
            case Column.TYPE_BOOL:
                return c.getBool(row);
            case Column.TYPE_INT64:
                return c.getLong(row);
            case Column.TYPE_DOUBLE:
                return c.getDouble(row);
            default: {
                final List<Double> l = new ArrayList<>(c.count(row));
                for (int i = 0; i < c.count(row); i++)
                    l.add(c.get(row, i));
                return l;
            }
        }
    }

    private static Meta metaFromAvro(final Schema s) throws PipelineException {
        final Map<String, Short> fields = new LinkedHashMap<>();
        for (final Field f : s.getFields()) {
            if (ENTRY_FIELD.equals(f.name()))
                continue;
            final Schema t = unwrapNullable(f.schema());
            fields.put(f.name(), switch (t.getType()) {
                case BOOLEAN -> Column.TYPE_BOOL;
                case INT, LONG -> Column.TYPE_INT64;
                case FLOAT, DOUBLE -> Column.TYPE_DOUBLE;
                case ARRAY -> Column.TYPE_DOUBLE_LIST;
                default -> throw PipelineException.data("field %s has unsupported type %s", f.name(), t.getType());
            });
        }
        return new Meta(fields);
    }

    private static Schema unwrapNullable(final Schema s) {
        if (s.getType() == Type.UNION) {
            for (Schema e : s.getTypes()) {
                if (e.getType() != Type.NULL)
                    return e;
            }
        }
        return s;
    }

    static CompressionCodecName codec(final String compression) throws PipelineException {
        if (compression == null)
            return CompressionCodecName.SNAPPY;
        try {
            return CompressionCodecName.valueOf(compression.toUpperCase());
        } catch (IllegalArgumentException ex) {
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "unknown parquet compression " + compression, ex);
        }
    }
}

/**
 * Local files for parquet without a Hadoop filesystem
 */
final class LocalParquetFile implements InputFile, OutputFile {
    private final Path path;

    LocalParquetFile(final File file) {
        this.path = file.toPath();
    }

    @Override
    public long getLength() throws IOException {
        return Files.size(path);
    }

    @Override
    public SeekableInputStream newStream() throws IOException {
        final FileChannel ch = FileChannel.open(path, StandardOpenOption.READ);
        return new DelegatingSeekableInputStream(Channels.newInputStream(ch)) {
            @Override
            public long getPos() throws IOException {
                return ch.position();
            }

            @Override
            public void seek(final long newPos) throws IOException {
                ch.position(newPos);
            }
        };
    }

    @Override
    public PositionOutputStream create(final long blockSizeHint) throws IOException {
        if (Files.exists(path))
            throw new IOException("already exists: " + path);
        return createOrOverwrite(blockSizeHint);
    }

    @Override
    public PositionOutputStream createOrOverwrite(final long blockSizeHint) throws IOException {
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        final FileChannel ch = FileChannel.open(path, StandardOpenOption.WRITE, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING);
        return new DelegatingPositionOutputStream(Channels.newOutputStream(ch)) {
            @Override
            public long getPos() throws IOException {
                return ch.position();
            }
        };
    }

    @Override
    public boolean supportsBlockSize() {
        return false;
    }

    @Override
    public long defaultBlockSize() {
        return 0;
    }
}
