/**
 * 
 */
package hep.afw.skim;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import hep.afw.ChunkRef;
import hep.afw.ErrorCode;
import hep.afw.EventFile;
import hep.afw.EventFilePlugin;
import hep.afw.Events;
import hep.afw.IO;
import hep.afw.Logger;
import hep.afw.Meta;
import hep.afw.PipelineException;
import hep.afw.RunConfig;

/**
 * Skim records of one analysis under a skim root:
 * 
 * <pre>
 * &lt;root&gt;/&lt;analysis&gt;/&lt;escaped dataset&gt;/part-&lt;chunk&gt;.jsonl
 * &lt;root&gt;/&lt;analysis&gt;/&lt;escaped dataset&gt;/part-&lt;chunk&gt;.skim.json
 * &lt;root&gt;/&lt;analysis&gt;/merged/&lt;escaped dataset&gt;.jsonl
 * </pre>
 * 
 * Data files are written under a temporary name and renamed into place, and the
 * descriptor is written last. A chunk is persisted at most once per store instance.
 */
public final class SkimStore {
    public static final String MERGED = "merged";

    /**
     * Where skims live with respect to the machines running chunks
     */
    public enum Locality {
        /** a directory only this machine sees */
        NODE_LOCAL("node-local"),
        /** a directory every worker sees */
        SHARED("shared");

        private final String value;

        Locality(final String value) {
            this.value = value;
        }

        public static Locality parse(final String s) {
            for (final Locality l : values())
                if (l.value.equalsIgnoreCase(s) || l.name().equalsIgnoreCase(s))
                    return l;
            throw new IllegalArgumentException("unknown skim storage " + s + ", expected node-local or shared");
        }

        @Override
        public String toString() {
            return value;
        }
    }

    private final File root;
    private final String analysis;
    private final Locality locality;
    private final EventFilePlugin plugin;
    private final String compression;
    private final Logger logger;
    private final Set<String> written = ConcurrentHashMap.newKeySet();

    public SkimStore(final File root, final String analysis, final Locality locality, final String format,
            final String compression, final Logger logger) throws PipelineException {
        this.root = root;
        this.analysis = analysis;
        this.locality = locality;
        this.plugin = EventFile.PluginRegistry.format(format);
        this.compression = compression;
        this.logger = logger == null ? new Logger.NullLogger() : logger;
    }

    public static SkimStore of(final RunConfig config, final String analysis, final Logger logger)
            throws PipelineException {
        return new SkimStore(config.skimDirectory(), analysis, config.storage(), config.skimFormat(),
                config.compression(), logger);
    }

    /**
     * Store of an earlier run under {@code root}, used read-only as baseline
     */
    public static SkimStore baseline(final File root, final String analysis, final Logger logger)
            throws PipelineException {
        return new SkimStore(root, analysis, Locality.SHARED, "jsonl", null, logger);
    }

    public File root() {
        return root;
    }

    public Locality locality() {
        return locality;
    }

    public String analysis() {
        return analysis;
    }

    public File analysisDirectory() {
        return new File(root, IO.escapeName(analysis));
    }

    public File directory(final String dataset) {
        return new File(analysisDirectory(), IO.escapeName(dataset));
    }

    public File mergedDirectory() {
        return new File(analysisDirectory(), MERGED);
    }

    /** whether any skim of the analysis exists */
    public boolean exists() {
        return analysisDirectory().isDirectory();
    }

    /**
     * Makes sure the store can be written to.
     * 
     * @throws PipelineException {@link ErrorCode#STORAGE_OUTAGE} when a shared root is
     *                           not reachable
     */
    public void check() throws PipelineException {
        if (locality == Locality.SHARED) {
            if (!root.isDirectory() || !root.canWrite())
                throw new PipelineException(ErrorCode.STORAGE_OUTAGE, "shared skim root " + root + " is not reachable", root);
            return;
        }
        try {
            Files.createDirectories(root.toPath());
        } catch (IOException ex) {
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "cannot create skim root " + root + ": " + ex, ex);
        }
    }

    /**
     * Records of {@code dataset} by chunk index
     */
    public List<SkimRecord> records(final String dataset) throws IOException {
        final File[] files = directory(dataset).listFiles(f -> f.isFile() && SkimRecord.isDescriptor(f));
        final List<SkimRecord> records = new ArrayList<>();
        if (files == null)
            return records;
        for (final File f : files)
            records.add(SkimRecord.read(f));
        records.sort(Comparator.comparingInt(SkimRecord::chunk));
        return records;
    }

    public boolean hasRecords(final String dataset) {
        final File[] files = directory(dataset).listFiles(f -> f.isFile() && SkimRecord.isDescriptor(f));
        return files != null && files.length > 0;
    }

    /**
     * @return the record of one chunk, or null
     */
    public SkimRecord record(final String dataset, final int chunk) throws IOException {
        final File f = SkimRecord.descriptor(directory(dataset), chunk);
        return f.exists() ? SkimRecord.read(f) : null;
    }

    /**
     * Merged file of {@code dataset}, or null
     */
    public File merged(final String dataset) {
        return mergedFile(IO.escapeName(dataset));
    }

    private File mergedFile(final String escaped) {
        final String prefix = escaped + ".";
        final File[] files = mergedDirectory().listFiles(f -> f.isFile() && f.getName().startsWith(prefix)
                && !f.getName().endsWith(Meta.META_NAME_SUFFIX) && EventFile.supports(f));
        if (files == null || files.length == 0)
            return null;
        Arrays.sort(files);
        return files[0];
    }

    /**
     * Removes every record of {@code dataset} and its merged file. Descriptors go first, so
     * a clear cut short leaves data files without records, never records of an older skim.
     * 
     * @return number of records removed
     */
    public int clear(final String dataset) throws PipelineException {
        final File dir = directory(dataset);
        int removed = 0;
        try {
            final File[] descriptors = dir.listFiles(f -> f.isFile() && SkimRecord.isDescriptor(f));
            if (descriptors != null)
                for (final File f : descriptors)
                    if (Files.deleteIfExists(f.toPath()))
                        removed++;
            final File[] rest = dir.listFiles(File::isFile);
            if (rest != null)
                for (final File f : rest)
                    Files.deleteIfExists(f.toPath());
            final File merged = merged(dataset);
            if (merged != null) {
                Files.deleteIfExists(Meta.descriptor(merged).toPath());
                Files.deleteIfExists(merged.toPath());
            }
        } catch (IOException ex) {
            throw storage("cannot clear skims of " + dataset + " in " + dir + ": " + ex, ex);
        }
        written.removeIf(k -> k.startsWith(dataset + "#"));
        return removed;
    }

    // ---------- write ----------

    /**
     * Persists {@code events} as a FULL record
     */
    public SkimRecord write(final ChunkRef chunk, final Events events) throws PipelineException {
        return write(chunk, events, null);
    }

    /**
     * Persists {@code events}, as a DIFF against the record of the same chunk in
     * {@code baseline} when there is one, otherwise as FULL
     */
    public SkimRecord write(final ChunkRef chunk, final Events events, final SkimStore baseline)
            throws PipelineException {
        final String key = chunk.dataset() + "#" + chunk.index();
        if (!written.add(key))
            throw new PipelineException(ErrorCode.DUPLICATE_RECORD, "chunk " + chunk + " already skimmed in this run", chunk);
        boolean ok = false;
        try {
            final SkimRecord r = persist(chunk, events, baseline);
            ok = true;
            return r;
        } finally {
            if (!ok)
                written.remove(key);
        }
    }

    private SkimRecord persist(final ChunkRef chunk, final Events events, final SkimStore baseline)
            throws PipelineException {
        final File dir = directory(chunk.dataset());
        final String data = "part-" + chunk.index() + plugin.extension();
        try {
            final SkimRecord base = baseline == null ? null : baseline.baselineOf(chunk);
            final BaselineDiff.Delta delta = base == null ? null : diff(base, events);
            final SkimRecord record;
            if (delta == null || delta.isEmpty()) {
                writeData(new File(dir, data), events);
                record = SkimRecord.full(chunk, events, data);
            } else {
                writeData(new File(dir, data), delta.stored());
                record = SkimRecord.diff(chunk, events, data, base, delta.derived());
            }
            record.write(SkimRecord.descriptor(dir, chunk.index()));
            logger.debug("[SKIM ] %s -> %s %s rows=%d", chunk, record.kind(), record.descriptor(), record.rows());
            return record;
        } catch (PipelineException ex) {
            throw ex;
        } catch (IOException ex) {
            throw storage("cannot write skim of " + chunk + ": " + ex, ex);
        }
    }

    /**
     * This store's record of {@code chunk} when it was skimmed from the same entries, or
     * null
     */
    SkimRecord baselineOf(final ChunkRef chunk) throws IOException {
        final SkimRecord base = record(chunk.dataset(), chunk.index());
        if (base == null) {
            logger.log("[SKIM ] no baseline for %s, writing it in full", chunk);
            return null;
        }
        if (base.source().start() != chunk.start() || base.source().stop() != chunk.stop()
                || !base.source().file().equals(chunk.file())) {
            logger.log("[SKIM ] baseline of %s was skimmed from %s:%d-%d, writing it in full", chunk,
                    base.source().file(), base.source().start(), base.source().stop());
            return null;
        }
        return base;
    }

    /**
     * Diff against a baseline record, or null when the baseline cannot be read back
     */
    private BaselineDiff.Delta diff(final SkimRecord base, final Events events) throws PipelineException {
        final Events baseEvents;
        try {
            baseEvents = load(base);
        } catch (PipelineException ex) {
            if (ex.isErrorCode(ErrorCode.STORAGE_OUTAGE))
                throw ex;
            logger.error("[SKIM ] baseline %s unusable, writing in full: %s", base.descriptor(), ex.getMessage());
            return null;
        } catch (IOException ex) {
            logger.error("[SKIM ] baseline %s unreadable, writing in full: %s", base.descriptor(), ex.getMessage());
            return null;
        }
        return BaselineDiff.diff(baseEvents, events);
    }

    private void writeData(final File target, final Events events) throws IOException {
        Files.createDirectories(target.getAbsoluteFile().getParentFile().toPath());
        final File tmp = new File(target.getParentFile(), "." + target.getName() + "." + System.nanoTime() + ".tmp");
        try {
            try (EventFile f = plugin.create(tmp, Meta.of(events), logger, compression)) {
                f.write(events);
            }
            final File desc = Meta.descriptor(tmp);
            if (desc.exists())
                IO.move(desc.toPath(), Meta.descriptor(target).toPath(), true);
            IO.move(tmp.toPath(), target.toPath(), true);
        } finally {
            Files.deleteIfExists(tmp.toPath());
            Files.deleteIfExists(Meta.descriptor(tmp).toPath());
        }
    }

    private PipelineException storage(final String message, final Throwable cause) {
        if (locality == Locality.SHARED && !root.isDirectory())
            return new PipelineException(ErrorCode.STORAGE_OUTAGE, message + " (shared skim root " + root + " unreachable)", cause);
        return new PipelineException(ErrorCode.STORAGE_ERROR, message, cause);
    }

    // ---------- read ----------

    /**
     * Complete events of a record. FULL records must match their fingerprint, otherwise
     * the chunk fails with {@link ErrorCode#STORAGE_ERROR}. DIFF records are rebuilt from
     * their baseline record, which must still have the fingerprint it had when the diff
     * was written.
     */
    public static Events load(final SkimRecord record) throws IOException {
        final Events stored;
        try (EventFile f = EventFile.open(record.dataFile())) {
            stored = f.readAll();
        }
        if (stored.rows() != record.rows())
            throw new PipelineException(ErrorCode.STORAGE_ERROR,
                    record + " holds " + stored.rows() + " rows, descriptor says " + record.rows(), record);
        if (record.kind() == SkimRecord.Kind.FULL) {
            if (!SkimRecord.fingerprint(stored).equals(record.fingerprint()))
                throw new PipelineException(ErrorCode.STORAGE_ERROR,
                        record + ": data file " + record.dataFile() + " does not match its fingerprint", record);
            return stored;
        }

        final File ref = record.baselineRecord();
        if (ref == null || !ref.exists())
            throw new PipelineException(ErrorCode.RECONSTRUCTION_ERROR, record + ": baseline record " + ref + " is gone", record);
        final SkimRecord base = SkimRecord.read(ref);
        if (!base.fingerprint().equals(record.baselineFingerprint()))
            throw new PipelineException(ErrorCode.RECONSTRUCTION_ERROR, record + ": baseline " + ref + " changed", record);
        final Events baseEvents;
        try {
            baseEvents = load(base);
        } catch (PipelineException ex) {
            if (ex.isErrorCode(ErrorCode.STORAGE_ERROR))
                throw new PipelineException(ErrorCode.RECONSTRUCTION_ERROR,
                        record + ": baseline data of " + ref + " changed: " + ex.getMessage(), ex);
            throw ex;
        }

        final Events events = BaselineDiff.reconstruct(baseEvents, record.schema(), record.derived(), stored);
        if (!SkimRecord.fingerprint(events).equals(record.fingerprint()))
            throw new PipelineException(ErrorCode.RECONSTRUCTION_ERROR, record + ": reconstruction does not match", record);
        return events;
    }

    // ---------- merge ----------

    /**
     * Concatenates the records of every dataset into one file per dataset under
     * {@code merged/}, in chunk order. Rows are numbered again from 0 in the merged file.
     * Datasets that already have a merged file are left alone.
     * 
     * @return the merged files
     */
    public List<File> merge() throws IOException {
        final File merged = mergedDirectory();
        final List<File> out = new ArrayList<>();
        final File[] dirs = analysisDirectory().listFiles(File::isDirectory);
        if (dirs == null) {
            logger.error("[MERGE] no skims in %s", analysisDirectory());
            return out;
        }
        Arrays.sort(dirs);
        Files.createDirectories(merged.toPath());
        final IO.StopWatch watch = new IO.StopWatch();
        for (final File dir : dirs) {
            if (dir.getName().equals(MERGED))
                continue;
            final File existing = mergedFile(dir.getName());
            if (existing != null) {
                logger.error("[MERGE] %s exists, skipping", existing);
                continue;
            }
            final File[] parts = dir.listFiles(f -> f.isFile() && SkimRecord.isDescriptor(f));
            if (parts == null || parts.length == 0) {
                logger.log("[MERGE] skipping %s, it holds no skim records", dir.getName());
                continue;
            }
            final List<SkimRecord> records = new ArrayList<>();
            for (final File p : parts)
                records.add(SkimRecord.read(p));
            records.sort(Comparator.comparingInt(SkimRecord::chunk));
            final File target = new File(merged, dir.getName() + plugin.extension());
            final long rows = concat(records, target);
            logger.log("[MERGE] %s: %d parts, %,d rows -> %s", dir.getName(), records.size(), rows, target.getName());
            out.add(target);
        }
        logger.log("[MERGE] merged %d datasets in %,d ms", out.size(), watch.elapsed());
        return out;
    }

    private long concat(final List<SkimRecord> records, final File target) throws IOException {
        final Meta schema = records.get(0).schema();
        final File tmp = new File(target.getParentFile(), "." + target.getName() + "." + System.nanoTime() + ".tmp");
        long next = 0;
        try {
            try (EventFile f = plugin.create(tmp, schema, logger, compression)) {
                for (final SkimRecord r : records) {
                    if (!r.schema().equals(schema))
                        throw new PipelineException(ErrorCode.DATA_ERROR,
                                r + " has schema " + r.schema() + ", first part has " + schema, r);
                    final Events e = load(r);
                    f.write(Events.of(Events.range(next, next + e.rows()), e.columns()));
                    next += e.rows();
                }
            }
            final File desc = Meta.descriptor(tmp);
            if (desc.exists())
                IO.move(desc.toPath(), Meta.descriptor(target).toPath(), false);
            IO.move(tmp.toPath(), target.toPath(), false);
        } finally {
            Files.deleteIfExists(tmp.toPath());
            Files.deleteIfExists(Meta.descriptor(tmp).toPath());
        }
        return next;
    }

    @Override
    public String toString() {
        return "SkimStore [" + analysisDirectory() + ", " + locality + ", " + plugin.format() + "]";
    }
}
