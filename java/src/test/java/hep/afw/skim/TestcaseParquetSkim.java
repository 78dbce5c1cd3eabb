package hep.afw.skim;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import hep.afw.AnalysisRunner;
import hep.afw.ChunkScheduler;
import hep.afw.Dataset;
import hep.afw.Events;
import hep.afw.Fixtures;
import hep.afw.HistogramSpec;
import hep.afw.LocalChunkScheduler;
import hep.afw.RunConfig;
import hep.afw.RunReport;
import hep.afw.TestAnalysis;

class TestcaseParquetSkim {
    private static final String DY = "/DYto2L-4Jets_MLL-50/Run3Summer22EE/NANOAODSIM";

    @TempDir
    File dir;

    @Test
    void parquetSkimsRoundTrip() throws Exception {
        final File source = Fixtures.write(new File(dir, "dy.parquet"), 240, 41);
        final List<Dataset> datasets = List.of(Dataset.builder(DY).shortName("DY").simulated(6688, 5_000_000)
                .chunk(source.getPath(), 0, 120).chunk(source.getPath(), 120, 240).build());
        final RunConfig cfg = Fixtures.config(dir).skimFormat("parquet").compression("uncompressed").build();
        final TestAnalysis analysis = new TestAnalysis();
        final SkimStore store = SkimStore.of(cfg, analysis.name(), Fixtures.LOGGER);

        try (ChunkScheduler scheduler = new LocalChunkScheduler(2)) {
            final SkimWriter.Summary summary = new SkimWriter(analysis, store, null, scheduler, cfg, Fixtures.LOGGER)
                    .write(datasets);
            assertEquals(2, summary.records());

            final SkimRecord first = store.record(DY, 0);
            assertTrue(first.dataFile().getName().endsWith(".parquet"));
            final Events events = SkimStore.load(first);
            assertEquals(first.rows(), events.rows());
            assertEquals(first.fingerprint(), SkimRecord.fingerprint(events));

            final AnalysisRunner runner = new AnalysisRunner(cfg, scheduler, Fixtures.LOGGER);
            final RunReport raw = runner.run(analysis, datasets, false);
            final RunReport skimmed = runner.run(analysis, SkimmedDatasets.convert(datasets, store, Fixtures.LOGGER),
                    true);
            for (final HistogramSpec spec : analysis.histograms())
                assertEquals(raw.result(spec.name()).hist(), skimmed.result(spec.name()).hist());

            final List<File> merged = store.merge();
            assertEquals(1, merged.size());
            assertTrue(merged.get(0).getName().endsWith(".parquet"));
        }
    }
}
