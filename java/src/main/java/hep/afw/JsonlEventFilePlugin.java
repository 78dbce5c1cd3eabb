package hep.afw;

import java.io.File;
import java.io.IOException;

/**
 * Plugin for JSONL event files ({@code .jsonl}, {@code .jsonl.gz}).
 */
public class JsonlEventFilePlugin implements EventFilePlugin {

    @Override
    public String format() {
        return "jsonl";
    }

    @Override
    public String extension() {
        return ".jsonl";
    }

    @Override
    public boolean supports(File file) {
        final String name = file.getName().toLowerCase();
        return name.endsWith(".jsonl") || name.endsWith(".jsonl.gz");
    }

    @Override
    public EventFile open(File file, Logger logger) throws IOException {
        return JsonlEventFile.open(file, logger);
    }

    @Override
    public EventFile create(File file, Meta meta, Logger logger, String compression) throws IOException {
        final boolean gzip = "gzip".equalsIgnoreCase(compression) || file.getName().toLowerCase().endsWith(".gz");
        if (!gzip && compression != null && !"uncompressed".equalsIgnoreCase(compression))
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "jsonl supports gzip or uncompressed, not " + compression);
        return JsonlEventFile.create(file, meta, logger, gzip);
    }
}
