package hep.afw;

import java.io.File;
import java.io.IOException;

/**
 * Plugin interface for event file formats.
 * Implementations should be registered via ServiceLoader.
 */
public interface EventFilePlugin {

    /**
     * Get the priority of this plugin. Higher priority plugins are checked first.
     * @return Priority value (higher = checked first)
     */
    default int priority() {
        return 0;
    }

    /**
     * Short format name as used in run configurations, for example {@code jsonl}
     */
    String format();

    /**
     * File name extension of newly created files, including the dot
     */
    String extension();

    /**
     * Check if this plugin can handle the given file.
     * @param file The file to check
     * @return true if this plugin can handle the file
     */
    boolean supports(File file);

    /**
     * Open an existing file for reading.
     */
    EventFile open(File file, Logger logger) throws IOException;

    /**
     * Create a new file for writing.
     * @param file        The file to create
     * @param meta        Field schema of the events to be written
     * @param logger      The logger to use
     * @param compression Codec name, {@code uncompressed} when the format has no choice
     */
    EventFile create(File file, Meta meta, Logger logger, String compression) throws IOException;
}
