/**
 * 
 */
package hep.afw;

import java.io.File;
import java.io.IOException;
import java.util.Objects;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import hep.afw.skim.SkimStore;

/**
 * Settings of one analysis run.
 * 
 * <pre>
 * &lt;analysis-run name="dilepton" class="org.example.Dilepton" max-threads="8"
 *               skip-bad-chunks="true" luminosity="26671.7" renormalize-limited="true"&gt;
 *     &lt;datasets manifest="datasets.json" chunk-size="500000" max-chunks="-1"/&gt;
 *     &lt;skims directory="${SKIM_LOCATION}" storage="shared" format="parquet"
 *            compression="snappy" baseline="/eos/skims/v1" skip-existing="true"/&gt;
 *     &lt;output directory="plots" extension="svg"/&gt;
 * &lt;/analysis-run&gt;
 * </pre>
 * 
 * Relative paths resolve against the directory of the configuration file. {@code ~} and
 * {@code ${ENV}} references are expanded.
 */
public final class RunConfig {
    public static final int DEFAULT_CHUNK_SIZE = 500_000;

    private String name;
    private String analysisClass;
    private int maxThreads = 1;
    private boolean skipBadChunks = true;
    private double luminosity = Normalization.DEFAULT_LUMINOSITY;
    private boolean renormalizeLimited = true;

    private File manifest;
    private long chunkSize = DEFAULT_CHUNK_SIZE;
    private int maxChunks = -1;

    private File skimDirectory = defaultSkimDirectory();
    private SkimStore.Locality storage = SkimStore.Locality.NODE_LOCAL;
    private String skimFormat = "jsonl";
    private String compression;
    private File baseline;
    private boolean skipExisting = true;

    private File outputDirectory = new File("plots");
    private String extension = "svg";

    private RunConfig() {
    }

    public static Builder builder(final String name) {
        return new Builder(name);
    }

    static File defaultSkimDirectory() {
        final String env = System.getenv("SKIM_LOCATION");
        return env != null && !env.isEmpty() ? IO.path(env) : new File("skims");
    }

    public String name() {
        return name;
    }

    /** fully qualified {@link Analysis} implementation, may be null for programmatic runs */
    public String analysisClass() {
        return analysisClass;
    }

    public int maxThreads() {
        return maxThreads;
    }

    public boolean skipBadChunks() {
        return skipBadChunks;
    }

    public double luminosity() {
        return luminosity;
    }

    public boolean renormalizeLimited() {
        return renormalizeLimited;
    }

    public File manifest() {
        return manifest;
    }

    public long chunkSize() {
        return chunkSize;
    }

    /** chunks per dataset, negative for all */
    public int maxChunks() {
        return maxChunks;
    }

    public File skimDirectory() {
        return skimDirectory;
    }

    public SkimStore.Locality storage() {
        return storage;
    }

    public String skimFormat() {
        return skimFormat;
    }

    /** codec name, null for the format default */
    public String compression() {
        return compression;
    }

    /** skim root of an earlier run used as baseline, or null */
    public File baseline() {
        return baseline;
    }

    public boolean skipExisting() {
        return skipExisting;
    }

    public File outputDirectory() {
        return outputDirectory;
    }

    public String extension() {
        return extension;
    }

    /**
     * Instantiates {@link #analysisClass()} through its public no-argument constructor
     */
    public Analysis loadAnalysis() throws PipelineException {
        if (analysisClass == null)
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "run " + name + " names no analysis class");
        try {
            final Class<?> cls = Class.forName(analysisClass);
            if (!Analysis.class.isAssignableFrom(cls))
                throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, analysisClass + " is not an Analysis");
            final Analysis a = (Analysis) cls.getDeclaredConstructor().newInstance();
            Analysis.validate(a);
            return a;
        } catch (ReflectiveOperationException | IllegalArgumentException ex) {
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "cannot load analysis " + analysisClass + ": " + ex, ex);
        }
    }

    /**
     * Rejects node-local skim storage when chunks may run on other machines
     */
    public void validate(final ChunkScheduler scheduler) throws PipelineException {
        if (storage == SkimStore.Locality.NODE_LOCAL && !scheduler.isSingleNode())
            throw new PipelineException(ErrorCode.STORAGE_LOCALITY,
                    "run " + name + " uses node-local skims at " + skimDirectory + " but the scheduler is not single-node; configure storage=\"shared\"");
    }

    public DatasetSource datasetSource(final Logger logger) throws PipelineException {
        if (manifest == null)
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "run " + name + " has no dataset manifest");
        return new LocalDatasetSource(manifest, chunkSize, logger);
    }

    @Override
    public String toString() {
        return "RunConfig [name=" + name + ", class=" + analysisClass + ", maxThreads=" + maxThreads + ", skipBadChunks="
                + skipBadChunks + ", luminosity=" + luminosity + ", renormalizeLimited=" + renormalizeLimited
                + ", manifest=" + manifest + ", chunkSize=" + chunkSize + ", maxChunks=" + maxChunks + ", skims="
                + skimDirectory + " (" + storage + ", " + skimFormat + "), baseline=" + baseline + ", output="
                + outputDirectory + "]";
    }

    // ---------- XML ----------

    public static RunConfig parse(final File xmlFile) throws IOException {
        final Document doc;
        try {
            doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(xmlFile);
        } catch (ParserConfigurationException | SAXException ex) {
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "cannot parse " + xmlFile + ": " + ex.getMessage(), ex);
        }
        doc.getDocumentElement().normalize();

        final Element root = doc.getDocumentElement();
        if (!"analysis-run".equals(root.getNodeName()))
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "root element must be <analysis-run>");

        final File base = xmlFile.getAbsoluteFile().getParentFile();
        try {
            final Builder b = builder(attr(root, "name", "analysis"))
                    .analysisClass(attr(root, "class", null))
                    .maxThreads(parseInt(attr(root, "max-threads", "1"), 1))
                    .skipBadChunks(Boolean.parseBoolean(attr(root, "skip-bad-chunks", "true")))
                    .luminosity(parseDouble(attr(root, "luminosity", null), Normalization.DEFAULT_LUMINOSITY))
                    .renormalizeLimited(Boolean.parseBoolean(attr(root, "renormalize-limited", "true")));

            final Element datasets = child(root, "datasets");
            if (datasets != null) {
                if (hasAttr(datasets, "manifest"))
                    b.manifest(resolve(base, attr(datasets, "manifest", null)));
                b.chunkSize(parseInt(attr(datasets, "chunk-size", null), DEFAULT_CHUNK_SIZE));
                b.maxChunks(parseInt(attr(datasets, "max-chunks", "-1"), -1));
            }

            final Element skims = child(root, "skims");
            if (skims != null) {
                if (hasAttr(skims, "directory"))
                    b.skimDirectory(resolve(base, attr(skims, "directory", null)));
                b.storage(SkimStore.Locality.parse(attr(skims, "storage", "node-local")));
                b.skimFormat(attr(skims, "format", "jsonl"));
                b.compression(attr(skims, "compression", null));
                if (hasAttr(skims, "baseline"))
                    b.baseline(resolve(base, attr(skims, "baseline", null)));
                b.skipExisting(Boolean.parseBoolean(attr(skims, "skip-existing", "true")));
            }

            final Element output = child(root, "output");
            if (output != null) {
                if (hasAttr(output, "directory"))
                    b.outputDirectory(resolve(base, attr(output, "directory", null)));
                b.extension(attr(output, "extension", "svg"));
            }
            return b.build();
        } catch (IllegalArgumentException ex) {
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, xmlFile + ": " + ex.getMessage(), ex);
        }
    }

    private static File resolve(final File base, final String path) {
        final File f = IO.path(path);
        return f.isAbsolute() ? f : new File(base, f.getPath());
    }

    static int parseInt(final String s, final int dfl) {
        if (s == null || s.isEmpty())
            return dfl;
        try {
            return Integer.parseInt(s.trim().replace("_", ""));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("not an integer: " + s, ex);
        }
    }

    static double parseDouble(final String s, final double dfl) {
        if (s == null || s.isEmpty())
            return dfl;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("not a number: " + s, ex);
        }
    }

    static boolean hasAttr(final Element e, final String name) {
        return e != null && e.hasAttribute(name) && !e.getAttribute(name).isEmpty();
    }

    static String attr(final Element e, final String name, final String dfl) {
        return (e != null && e.hasAttribute(name)) ? e.getAttribute(name) : dfl;
    }

    static Element child(final Element e, final String name) {
        if (e == null)
            return null;
        for (Node n = e.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE && Objects.equals(name, n.getNodeName()))
                return (Element) n;
        }
        return null;
    }

    // ---------- Builder ----------

    public static final class Builder {
        private final RunConfig config = new RunConfig();

        private Builder(final String name) {
            config.name = name;
        }

        public Builder analysisClass(final String cls) {
            config.analysisClass = cls;
            return this;
        }

        public Builder maxThreads(final int threads) {
            config.maxThreads = threads;
            return this;
        }

        public Builder skipBadChunks(final boolean skip) {
            config.skipBadChunks = skip;
            return this;
        }

        public Builder luminosity(final double luminosity) {
            config.luminosity = luminosity;
            return this;
        }

        public Builder renormalizeLimited(final boolean renormalize) {
            config.renormalizeLimited = renormalize;
            return this;
        }

        public Builder manifest(final File manifest) {
            config.manifest = manifest;
            return this;
        }

        public Builder chunkSize(final long chunkSize) {
            config.chunkSize = chunkSize;
            return this;
        }

        public Builder maxChunks(final int maxChunks) {
            config.maxChunks = maxChunks;
            return this;
        }

        public Builder skimDirectory(final File dir) {
            config.skimDirectory = dir;
            return this;
        }

        public Builder storage(final SkimStore.Locality storage) {
            config.storage = storage;
            return this;
        }

        public Builder skimFormat(final String format) {
            config.skimFormat = format;
            return this;
        }

        public Builder compression(final String compression) {
            config.compression = compression;
            return this;
        }

        public Builder baseline(final File baseline) {
            config.baseline = baseline;
            return this;
        }

        public Builder skipExisting(final boolean skip) {
            config.skipExisting = skip;
            return this;
        }

        public Builder outputDirectory(final File dir) {
            config.outputDirectory = dir;
            return this;
        }

        public Builder extension(final String extension) {
            config.extension = extension;
            return this;
        }

        public RunConfig build() {
            if (config.name == null || config.name.isEmpty())
                throw new IllegalArgumentException("run name");
            if (config.maxThreads < 1)
                throw new IllegalArgumentException("max-threads must be >= 1, got " + config.maxThreads);
            if (config.chunkSize < 1)
                throw new IllegalArgumentException("chunk-size must be >= 1, got " + config.chunkSize);
            if (!(config.luminosity > 0))
                throw new IllegalArgumentException("luminosity must be positive, got " + config.luminosity);
            if (config.skimFormat == null || config.skimFormat.isEmpty())
                throw new IllegalArgumentException("skim format");
            if (config.extension == null || config.extension.isEmpty())
                throw new IllegalArgumentException("output extension");
            return config;
        }
    }
}
