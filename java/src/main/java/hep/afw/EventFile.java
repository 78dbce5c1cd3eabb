/**
 * 
 */
package hep.afw;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

import hep.afw.skim.SkimEventFilePlugin;

/**
 * File of events, opened either for reading or for writing.
 * 
 * Rows are addressed by position. Each row also carries its entry number
 * ({@link Events#entries()}), which is stored in the reserved field {@link #ENTRY_FIELD}
 * so that skimmed rows keep the identity they had in their source chunk. Files without
 * that field number their rows from 0.
 */
public interface EventFile extends AutoCloseable {
    String ENTRY_FIELD = "_entry";

    /**
     * Plugin registry for event file formats.
     * Plugins are loaded dynamically via ServiceLoader.
     */
    class PluginRegistry {
        private static final List<EventFilePlugin> plugins = new ArrayList<>();

        static {
            final ServiceLoader<EventFilePlugin> loader = ServiceLoader.load(EventFilePlugin.class);
            for (EventFilePlugin plugin : loader) {
                plugins.add(plugin);
            }

            // built-in formats are available even without ServiceLoader config
            if (plugins.stream().noneMatch(p -> p instanceof JsonlEventFilePlugin))
                plugins.add(new JsonlEventFilePlugin());
            if (plugins.stream().noneMatch(p -> p instanceof ParquetEventFilePlugin))
                plugins.add(new ParquetEventFilePlugin());
            if (plugins.stream().noneMatch(p -> p instanceof SkimEventFilePlugin))
                plugins.add(new SkimEventFilePlugin());

            // Sort by priority (descending)
            plugins.sort(Comparator.comparingInt(EventFilePlugin::priority).reversed());
        }

        static EventFilePlugin find(final File file) {
            for (EventFilePlugin plugin : plugins) {
                if (plugin.supports(file)) {
                    return plugin;
                }
            }
            return null;
        }

        /**
         * @throws PipelineException {@link ErrorCode#INVALID_CONFIGURATION} for an unknown format
         */
        public static EventFilePlugin format(final String format) throws PipelineException {
            for (EventFilePlugin plugin : plugins) {
                if (plugin.format().equalsIgnoreCase(format)) {
                    return plugin;
                }
            }
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "unknown event file format " + format);
        }

        static List<EventFilePlugin> plugins() {
            return new ArrayList<>(plugins);
        }
    }

    /**
     * Field schema, without {@link #ENTRY_FIELD}
     */
    Meta meta() throws IOException;

    /**
     * Number of rows in the file
     */
    long entries() throws IOException;

    /**
     * Reads rows {@code [start, stop)}. Reading past the end returns the rows that exist.
     */
    Events read(long start, long stop) throws IOException;

    default Events readAll() throws IOException {
        return read(0, entries());
    }

    /**
     * Appends events; the file must have been created for writing
     */
    void write(Events events) throws IOException;

    /**
     * Get the size of the file in bytes.
     */
    long fileSize();

    @Override
    void close() throws IOException;

    static boolean supports(final File file) {
        return PluginRegistry.find(file) != null;
    }

    static EventFile open(final File file) throws IOException {
        return open(file, new Logger.NullLogger());
    }

    static EventFile open(final File file, final Logger logger) throws IOException {
        final EventFilePlugin plugin = PluginRegistry.find(file);
        if (plugin == null)
            throw new PipelineException(ErrorCode.DATA_ERROR, "unsupported event file " + file);
        if (!file.exists())
            throw new PipelineException(ErrorCode.DATA_ERROR, "no such event file " + file);
        return plugin.open(file, logger);
    }

    static EventFile create(final File file, final Meta meta, final Logger logger) throws IOException {
        final EventFilePlugin plugin = PluginRegistry.find(file);
        if (plugin == null)
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "unsupported event file " + file);
        return plugin.create(file, meta, logger, "uncompressed");
    }

    /**
     * Rows {@code [start, stop)} of {@code file}
     */
    static Events read(final File file, final long start, final long stop) throws IOException {
        try (EventFile f = open(file)) {
            return f.read(start, stop);
        }
    }
}
