package hep.afw;

import java.io.File;
import java.io.IOException;

/**
 * Plugin for Parquet event files.
 */
public class ParquetEventFilePlugin implements EventFilePlugin {

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public String format() {
        return "parquet";
    }

    @Override
    public String extension() {
        return ".parquet";
    }

    @Override
    public boolean supports(File file) {
        return file.getName().endsWith(".parquet");
    }

    @Override
    public EventFile open(File file, Logger logger) throws IOException {
        return ParquetEventFile.open(file, logger);
    }

    @Override
    public EventFile create(File file, Meta meta, Logger logger, String compression) throws IOException {
        return ParquetEventFile.create(file, meta, logger, ParquetEventFile.codec(compression));
    }
}
