package hep.afw.skim;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.nio.file.Files;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import hep.afw.Analysis;
import hep.afw.AnalysisRunner;
import hep.afw.ChunkExecutor;
import hep.afw.ChunkRef;
import hep.afw.ChunkScheduler;
import hep.afw.Dataset;
import hep.afw.ErrorCode;
import hep.afw.Events;
import hep.afw.Fixtures;
import hep.afw.HistogramSpec;
import hep.afw.LocalChunkScheduler;
import hep.afw.Meta;
import hep.afw.MultiNodeScheduler;
import hep.afw.Normalization;
import hep.afw.PipelineException;
import hep.afw.RunConfig;
import hep.afw.RunReport;
import hep.afw.Stage;
import hep.afw.TestAnalysis;

class TestcaseSkim {
    private static final String TTBAR = "/TTTo2L2Nu/Run3Summer22EE/NANOAODSIM";
    private static final String MUON = "/Muon/Run2022F/NANOAOD";

    @TempDir
    File dir;

    private List<Dataset> datasets;
    private RunConfig config;
    private final Analysis analysis = new TestAnalysis();

    @BeforeEach
    void files() throws Exception {
        final File ttbar = Fixtures.write(new File(dir, "ttbar.jsonl"), 300, 21);
        final File muon = Fixtures.write(new File(dir, "muon.jsonl"), 200, 22);
        datasets = List.of(
                Dataset.builder(TTBAR).shortName("TTBar").simulated(87.3, 1_000_000)
                        .chunk(ttbar.getPath(), 0, 100).chunk(ttbar.getPath(), 100, 200).chunk(ttbar.getPath(), 200, 300)
                        .build(),
                Dataset.builder(MUON).shortName("Muon").data()
                        .chunk(muon.getPath(), 0, 100).chunk(muon.getPath(), 100, 200).build());
        config = Fixtures.config(dir).build();
    }

    private SkimStore store() throws PipelineException {
        return SkimStore.of(config, analysis.name(), Fixtures.LOGGER);
    }

    private SkimWriter.Summary skim(final Analysis a, final SkimStore store, final SkimStore baseline,
            final RunConfig cfg) throws Exception {
        return skim(a, store, baseline, cfg, datasets);
    }

    private SkimWriter.Summary skim(final Analysis a, final SkimStore store, final SkimStore baseline,
            final RunConfig cfg, final List<Dataset> input) throws Exception {
        try (ChunkScheduler scheduler = new LocalChunkScheduler(2)) {
            return new SkimWriter(a, store, baseline, scheduler, cfg, Fixtures.LOGGER).write(input);
        }
    }

    private RunReport run(final List<Dataset> input, final boolean skimmed) throws Exception {
        return run(analysis, config, input, skimmed);
    }

    private RunReport run(final Analysis a, final RunConfig cfg, final List<Dataset> input, final boolean skimmed)
            throws Exception {
        try (ChunkScheduler scheduler = new LocalChunkScheduler(2)) {
            return new AnalysisRunner(cfg, scheduler, Fixtures.LOGGER).run(a, input, skimmed);
        }
    }

    @Test
    void recordsHoldPreselectedMinifiedRows() throws Exception {
        final SkimStore store = store();
        final SkimWriter.Summary summary = skim(analysis, store, null, config);
        assertEquals(5, summary.records());
        assertEquals(0, summary.diffs());
        assertTrue(summary.failures().isEmpty());
        assertEquals(500, summary.rowsIn());
        assertTrue(summary.rowsOut() < summary.rowsIn());

        final List<SkimRecord> records = store.records(TTBAR);
        assertEquals(3, records.size());
        for (final SkimRecord r : records) {
            final ChunkRef chunk = datasets.get(0).chunks().get(r.chunk());
            final Events expected = analysis.minifier().apply(analysis.pipeline()
                    .only(Stage.Phase.OBJECT_DEFINITION, Stage.Phase.PRESELECTION).apply(ChunkExecutor.read(chunk)));
            assertEquals(SkimRecord.Kind.FULL, r.kind());
            assertEquals(List.of("Jet_pt", "MET_pt", "HT"), r.schema().names());
            assertEquals(expected.rows(), r.rows());
            assertEquals(expected, SkimStore.load(r));
            assertEquals(chunk.start(), r.source().start());
            assertTrue(r.dataFile().isFile());
        }
        assertNull(store.record(TTBAR, 7));
    }

    @Test
    void existingSkimsAreSkippedOrOverwritten() throws Exception {
        skim(analysis, store(), null, config);

        final SkimWriter.Summary again = skim(analysis, store(), null, config);
        assertEquals(List.of(TTBAR, MUON), again.skipped());
        assertEquals(0, again.records());

        final RunConfig overwrite = Fixtures.config(dir).skipExisting(false).build();
        final SkimWriter.Summary rewritten = skim(analysis, SkimStore.of(overwrite, analysis.name(), Fixtures.LOGGER),
                null, overwrite);
        assertEquals(List.of(TTBAR, MUON), rewritten.written());
        assertEquals(5, rewritten.records());
    }

    @Test
    void overwriteLeavesNoRecordForChunkThatFailsAgain() throws Exception {
        final SkimStore store = store();
        skim(analysis, store, null, config);
        assertEquals(2, store.merge().size());
        assertNotNull(store.record(TTBAR, 1));

        // chunk 1 now points at events without MET_pt, which the minifier keeps
        final File ttbar = new File(datasets.get(0).chunks().get(0).file());
        final File nomet = Fixtures.write(new File(dir, "ttbar_nomet.jsonl"),
                Fixtures.events(100, 100, 23).without("MET_pt"));
        final List<Dataset> redefined = List.of(Dataset.builder(TTBAR).shortName("TTBar").simulated(87.3, 1_000_000)
                .chunk(ttbar.getPath(), 0, 100).chunk(nomet.getPath(), 0, 100).chunk(ttbar.getPath(), 200, 300)
                .build());

        final RunConfig overwrite = Fixtures.config(dir).skipExisting(false).build();
        final SkimStore again = SkimStore.of(overwrite, analysis.name(), Fixtures.LOGGER);
        final SkimWriter.Summary summary = skim(analysis, again, null, overwrite, redefined);
        assertEquals(1, summary.failures().size());
        assertEquals(1, summary.failures().get(0).chunk().index());
        assertEquals(2, summary.records());

        assertEquals(2, again.records(TTBAR).size());
        assertNull(again.record(TTBAR, 1));
        assertFalse(new File(again.directory(TTBAR), "part-1.jsonl").exists());
        assertNull(again.merged(TTBAR));
        assertNull(again.merged(MUON));

        final List<Dataset> skimmed = SkimmedDatasets.convert(redefined, again, Fixtures.LOGGER);
        assertEquals(3, skimmed.get(0).chunks().size());
        final RunReport report = run(skimmed, true);
        assertFalse(report.isComplete());
        assertEquals("partial (1/3 failed)", report.status());
        assertEquals(1, report.dataset(TTBAR).failures().get(0).chunk().index());

        // a merged file written over the gap is not used
        assertEquals(2, again.merge().size());
        assertEquals(3, SkimmedDatasets.convert(redefined, again, Fixtures.LOGGER).get(0).chunks().size());
    }

    @Test
    void limitedSkimmedRunIsNormalizedLikeRawRun() throws Exception {
        final SkimStore store = store();
        skim(analysis, store, null, config);
        final RunConfig limited = Fixtures.config(dir).maxChunks(1).build();
        final RunReport raw = run(analysis, limited, datasets, false);
        final List<Dataset> skimmed = SkimmedDatasets.convert(datasets, store, Fixtures.LOGGER);
        assertEquals(100, skimmed.get(0).chunks().get(0).declaredEntries());
        assertTrue(skimmed.get(0).chunks().get(0).length() < 100);
        final RunReport fromSkims = run(analysis, limited, skimmed, true);

        final Normalization expected = raw.dataset(TTBAR).normalization();
        final Normalization actual = fromSkims.dataset(TTBAR).normalization();
        assertEquals(Normalization.Kind.SIMULATED_LIMITED, actual.kind());
        assertEquals(1 / 3.0, actual.fraction(), 1e-12);
        assertEquals(expected.fraction(), actual.fraction(), 1e-12);
        assertEquals(expected.adjustedFactor(), actual.adjustedFactor(), 1e-12);
        for (final HistogramSpec spec : analysis.histograms())
            assertEquals(raw.result(spec.name()).hist(), fromSkims.result(spec.name()).hist());
    }

    @Test
    void tamperedFullRecordIsAStorageError() throws Exception {
        final SkimStore store = store();
        skim(analysis, store, null, config);
        final SkimRecord record = store.record(TTBAR, 0);
        final Events events = SkimStore.load(record);
        final double[] met = events.doubles("MET_pt");
        met[0] += 1;
        final File data = record.dataFile();
        Files.delete(data.toPath());
        Files.deleteIfExists(Meta.descriptor(data).toPath());
        Fixtures.write(data, events.with("MET_pt", met));

        final PipelineException ex = assertThrows(PipelineException.class, () -> SkimStore.load(record));
        assertEquals(ErrorCode.STORAGE_ERROR, ex.getErrorCode());
        assertFalse(ex.isFatal());

        final RunReport report = run(SkimmedDatasets.convert(datasets, store, Fixtures.LOGGER), true);
        assertEquals("partial (1/5 failed)", report.status());
        assertEquals(ErrorCode.STORAGE_ERROR, report.dataset(TTBAR).failures().get(0).code());
    }

    @Test
    void chunksWithoutPreselectedRowsGiveEmptyRecords() throws Exception {
        final Analysis empty = TestAnalysis.rejectingAll();
        final SkimStore store = SkimStore.of(config, empty.name(), Fixtures.LOGGER);
        final SkimWriter.Summary summary = skim(empty, store, null, config);
        assertEquals(5, summary.records());
        assertEquals(500, summary.rowsIn());
        assertEquals(0, summary.rowsOut());

        for (final SkimRecord r : store.records(TTBAR)) {
            assertEquals(0, r.rows());
            final Events events = SkimStore.load(r);
            assertEquals(0, events.rows());
            assertEquals(List.of("Jet_pt", "MET_pt", "HT"), events.names());
            assertEquals(events, empty.minifier().apply(events));
        }

        final RunReport report = run(empty, config, SkimmedDatasets.convert(datasets, store, Fixtures.LOGGER), true);
        assertTrue(report.isComplete());
        assertEquals(0.0, report.result(TestAnalysis.MET).hist().total());
        assertEquals(Normalization.Kind.SIMULATED_FULL, report.dataset(TTBAR).normalization().kind());

        final List<File> merged = store.merge();
        assertEquals(2, merged.size());
        final RunReport fromMerged = run(empty, config, SkimmedDatasets.convert(datasets, store, Fixtures.LOGGER), true);
        assertTrue(fromMerged.isComplete());
        assertEquals(0.0, fromMerged.result("NJets").hist().total());
    }

    @Test
    void chunkIsPersistedOnce() throws Exception {
        final SkimStore store = store();
        final ChunkRef chunk = datasets.get(0).chunks().get(0);
        final Events events = analysis.minifier().apply(
                analysis.pipeline().only(Stage.Phase.OBJECT_DEFINITION, Stage.Phase.PRESELECTION)
                        .apply(ChunkExecutor.read(chunk)));
        store.write(chunk, events);
        final PipelineException ex = assertThrows(PipelineException.class, () -> store.write(chunk, events));
        assertEquals(ErrorCode.DUPLICATE_RECORD, ex.getErrorCode());
        assertFalse(ex.isFatal());
    }

    @Test
    void skimmedRunMatchesRawRun() throws Exception {
        final SkimStore store = store();
        skim(analysis, store, null, config);
        final RunReport raw = run(datasets, false);

        final List<Dataset> skimmed = SkimmedDatasets.convert(datasets, store, Fixtures.LOGGER);
        assertEquals(3, skimmed.get(0).chunks().size());
        assertTrue(SkimRecord.isDescriptor(new File(skimmed.get(0).chunks().get(0).file())));
        final RunReport fromSkims = run(skimmed, true);

        assertTrue(fromSkims.isComplete());
        for (final HistogramSpec spec : analysis.histograms())
            assertEquals(raw.result(spec.name()).hist(), fromSkims.result(spec.name()).hist());
    }

    @Test
    void mergedSkimsFeedOneChunkPerDataset() throws Exception {
        final SkimStore store = store();
        skim(analysis, store, null, config);
        final RunReport raw = run(datasets, false);

        final List<File> merged = store.merge();
        assertEquals(2, merged.size());
        assertNotNull(store.merged(TTBAR));
        assertTrue(store.merge().isEmpty());

        final List<Dataset> skimmed = SkimmedDatasets.convert(datasets, store, Fixtures.LOGGER);
        assertEquals(1, skimmed.get(0).chunks().size());
        final RunReport fromMerged = run(skimmed, true);
        for (final HistogramSpec spec : analysis.histograms()) {
            for (final String category : List.of("TTBar", "Muon"))
                assertArrayEquals(raw.result(spec.name()).hist().values(category),
                        fromMerged.result(spec.name()).hist().values(category), 1e-9);
        }
    }

    @Test
    void datasetWithoutSkimsIsDropped() throws Exception {
        final SkimStore store = store();
        assertTrue(SkimmedDatasets.convert(datasets, store, Fixtures.LOGGER).isEmpty());
    }

    @Test
    void nodeLocalNeedsSingleNode() throws Exception {
        try (ChunkScheduler scheduler = new MultiNodeScheduler()) {
            final SkimWriter writer = new SkimWriter(analysis, store(), null, scheduler, config, Fixtures.LOGGER);
            final PipelineException ex = assertThrows(PipelineException.class, () -> writer.write(datasets));
            assertEquals(ErrorCode.STORAGE_LOCALITY, ex.getErrorCode());
            assertThrows(PipelineException.class, () -> config.validate(scheduler));

            final RunConfig shared = Fixtures.config(dir).storage(SkimStore.Locality.SHARED).build();
            shared.validate(scheduler);
        }
    }

    @Test
    void unreachableSharedRootIsAnOutage() throws Exception {
        final RunConfig shared = Fixtures.config(dir).storage(SkimStore.Locality.SHARED)
                .skimDirectory(new File(dir, "not-mounted")).build();
        final SkimStore store = SkimStore.of(shared, analysis.name(), Fixtures.LOGGER);
        final PipelineException ex = assertThrows(PipelineException.class, () -> skim(analysis, store, null, shared));
        assertEquals(ErrorCode.STORAGE_OUTAGE, ex.getErrorCode());
        assertTrue(ex.isFatal());
    }

    @Test
    void unknownFormatIsRejected() {
        final RunConfig cfg = Fixtures.config(dir).skimFormat("root").build();
        final PipelineException ex = assertThrows(PipelineException.class,
                () -> SkimStore.of(cfg, analysis.name(), Fixtures.LOGGER));
        assertEquals(ErrorCode.INVALID_CONFIGURATION, ex.getErrorCode());
    }
}
