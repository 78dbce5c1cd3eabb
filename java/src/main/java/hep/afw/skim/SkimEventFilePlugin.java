package hep.afw.skim;

import java.io.File;
import java.io.IOException;

import hep.afw.ErrorCode;
import hep.afw.EventFile;
import hep.afw.EventFilePlugin;
import hep.afw.Events;
import hep.afw.Logger;
import hep.afw.Meta;
import hep.afw.PipelineException;

/**
 * Plugin reading skim records ({@code part-N.skim.json}) as event files, so that a
 * dataset can point its chunks at skims. DIFF records are rebuilt from their baseline.
 * Read-only.
 */
public class SkimEventFilePlugin implements EventFilePlugin {

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public String format() {
        return "skim";
    }

    @Override
    public String extension() {
        return SkimRecord.SUFFIX;
    }

    @Override
    public boolean supports(File file) {
        return SkimRecord.isDescriptor(file);
    }

    @Override
    public EventFile open(File file, Logger logger) throws IOException {
        return new SkimEventFile(SkimRecord.read(file), logger);
    }

    @Override
    public EventFile create(File file, Meta meta, Logger logger, String compression) throws IOException {
        throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "skim records are written through SkimStore, not " + file);
    }

    static final class SkimEventFile implements EventFile {
        private final SkimRecord record;
        private final Logger logger;
        private Events events; // loaded on first read

        SkimEventFile(final SkimRecord record, final Logger logger) {
            this.record = record;
            this.logger = logger == null ? new Logger.NullLogger() : logger;
        }

        @Override
        public Meta meta() {
            return record.schema();
        }

        @Override
        public long entries() {
            return record.rows();
        }

        @Override
        public Events read(final long start, final long stop) throws IOException {
            if (events == null) {
                events = SkimStore.load(record);
                logger.debug("[SKIM ] loaded %s", record);
            }
            final int from = (int) Math.max(0, Math.min(start, events.rows()));
            final int to = (int) Math.max(from, Math.min(stop, events.rows()));
            if (from == 0 && to == events.rows())
                return events;
            final int[] index = new int[to - from];
            for (int i = 0; i < index.length; i++)
                index[i] = from + i;
            return events.select(index);
        }

        @Override
        public void write(final Events events) throws IOException {
            throw new PipelineException(ErrorCode.INVALID_CONFIGURATION, "skim record " + record.descriptor() + " is read-only");
        }

        @Override
        public long fileSize() {
            return record.dataFile().length();
        }

        @Override
        public void close() {
            events = null;
        }
    }
}
