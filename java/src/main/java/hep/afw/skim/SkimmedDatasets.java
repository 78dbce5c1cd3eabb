/**
 * 
 */
package hep.afw.skim;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import hep.afw.ChunkRef;
import hep.afw.Dataset;
import hep.afw.EventFile;
import hep.afw.Logger;

/**
 * Points datasets at their skims
 */
public final class SkimmedDatasets {
    private SkimmedDatasets() {
    }

    /**
     * Same datasets with chunks read from the store. Metadata is kept, and every skim chunk
     * declares the entries of the chunk it was skimmed from, so chunk limiting normalizes
     * a skimmed run exactly like the raw one.
     * <p>
     * Each chunk of a dataset maps to the skim record of the same index. A chunk without a
     * record, or whose record was skimmed from other entries, still gets a chunk pointing at
     * a descriptor that is never written; reading it fails, so the run reports the chunk as
     * failed instead of leaving it out. A merged file
     * replaces the records when every chunk has one. Datasets without any skim are dropped.
     */
    public static List<Dataset> convert(final List<Dataset> datasets, final SkimStore store, final Logger logger)
            throws IOException {
        final List<Dataset> out = new ArrayList<>();
        for (final Dataset d : datasets) {
            final List<SkimRecord> records = store.records(d.name());
            if (records.isEmpty()) {
                logger.error("[SKIM ] no skims for %s in %s, dropping it", d.name(), store.directory(d.name()));
                continue;
            }
            final Map<Integer, SkimRecord> byChunk = new HashMap<>();
            for (final SkimRecord r : records)
                byChunk.put(r.chunk(), r);

            final List<ChunkRef.Source> sources = new ArrayList<>();
            int missing = 0;
            for (final ChunkRef c : d.chunks()) {
                final SkimRecord r = byChunk.get(c.index());
                if (r != null && isSkimOf(r, c)) {
                    sources.add(new ChunkRef.Source(r.descriptor().getPath(), 0, r.rows(), c.declaredEntries()));
                    continue;
                }
                if (r == null)
                    logger.error("[SKIM ] %s has no skim record", c);
                else
                    logger.error("[SKIM ] %s was skimmed from %s:%d-%d, not from this chunk", r.descriptor(),
                            r.source().file(), r.source().start(), r.source().stop());
                final File absent = new File(store.directory(d.name()),
                        "part-" + c.index() + ".missing" + SkimRecord.SUFFIX);
                sources.add(new ChunkRef.Source(absent.getPath(), 0, 0, c.declaredEntries()));
                missing++;
            }

            final File merged = store.merged(d.name());
            if (merged != null && missing == 0) {
                try (EventFile f = EventFile.open(merged, logger)) {
                    out.add(d.withSources(List.of(new ChunkRef.Source(merged.getPath(), 0, f.entries(),
                            d.declaredEntries()))));
                }
                continue;
            }
            if (merged != null)
                logger.error("[SKIM ] ignoring merged %s, %d chunks of %s have no skim", merged, missing, d.name());
            out.add(d.withSources(sources));
        }
        return out;
    }

    private static boolean isSkimOf(final SkimRecord record, final ChunkRef chunk) {
        final ChunkRef.Source s = record.source();
        return s.file().equals(chunk.file()) && s.start() == chunk.start() && s.stop() == chunk.stop();
    }
}
