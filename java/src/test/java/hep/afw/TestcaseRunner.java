package hep.afw;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestcaseRunner {
    private static final String TTBAR = "/TTTo2L2Nu/Run3Summer22EE/NANOAODSIM";

    @TempDir
    File dir;

    private File good;
    private File broken;

    @BeforeEach
    void files() throws Exception {
        good = Fixtures.write(new File(dir, "ttbar.jsonl"), 200, 11);
        broken = Fixtures.write(new File(dir, "ttbar_nojets.jsonl"), Fixtures.events(0, 100, 12).without("Jet_pt"));
    }

    private Dataset ttbar(final boolean withBroken) {
        final Dataset.Builder b = Dataset.builder(TTBAR).shortName("TTBar").simulated(87.3, 1_000_000)
                .chunk(good.getPath(), 0, 100);
        if (withBroken)
            b.chunk(broken.getPath(), 0, 100);
        return b.chunk(good.getPath(), 100, 200).build();
    }

    private Dataset muon() throws Exception {
        final File f = Fixtures.write(new File(dir, "muon.jsonl"), 300, 13);
        return Dataset.builder("/Muon/Run2022F/NANOAOD").shortName("Muon").data()
                .chunk(f.getPath(), 0, 100).chunk(f.getPath(), 100, 200).chunk(f.getPath(), 200, 300).build();
    }

    private RunReport run(final RunConfig cfg, final List<Dataset> datasets) throws Exception {
        try (ChunkScheduler scheduler = new LocalChunkScheduler(cfg.maxThreads())) {
            return new AnalysisRunner(cfg, scheduler, Fixtures.LOGGER).run(new TestAnalysis(), datasets, false);
        }
    }

    @Test
    void badChunkIsSkippedAndReported() throws Exception {
        final RunReport report = run(Fixtures.config(dir).build(), List.of(ttbar(true)));
        assertFalse(report.isComplete());
        assertEquals("partial (1/3 failed)", report.status());

        final RunReport.DatasetStatus status = report.dataset(TTBAR);
        assertEquals(1, status.failed());
        assertEquals(1, status.failures().get(0).chunk().index());
        assertEquals(ErrorCode.DATA_ERROR, status.failures().get(0).code());
        assertTrue(status.failures().get(0).error().getMessage().contains("Jet_pt"));
        assertEquals("partial (1/3 failed)", report.result(TestAnalysis.MET).status());

        final RunReport clean = run(Fixtures.config(dir).build(), List.of(ttbar(false)));
        assertTrue(clean.isComplete());
        for (final HistogramSpec spec : new TestAnalysis().histograms())
            assertEquals(clean.result(spec.name()).hist(), report.result(spec.name()).hist());
    }

    @Test
    void chunksLeftEmptyByPreselectionStillComplete() throws Exception {
        final RunConfig cfg = Fixtures.config(dir).build();
        final RunReport report;
        try (ChunkScheduler scheduler = new LocalChunkScheduler(cfg.maxThreads())) {
            report = new AnalysisRunner(cfg, scheduler, Fixtures.LOGGER).run(TestAnalysis.rejectingAll(),
                    List.of(ttbar(false), muon()), false);
        }
        assertTrue(report.isComplete());
        assertEquals("complete", report.status());
        assertEquals(5, report.chunks());
        assertEquals(500, report.metrics().entries());
        assertEquals(0.0, report.result(TestAnalysis.MET).hist().total());
        assertEquals(0.0, report.result("NJets").hist().total());
        assertEquals(Normalization.Kind.SIMULATED_FULL, report.dataset(TTBAR).normalization().kind());
    }

    @Test
    void badChunkStopsTheRunWhenNotSkipped() {
        final RunConfig cfg = Fixtures.config(dir).skipBadChunks(false).build();
        final PipelineException ex = assertThrows(PipelineException.class, () -> run(cfg, List.of(ttbar(true))));
        assertEquals(ErrorCode.DATA_ERROR, ex.getErrorCode());
    }

    @Test
    void threadCountDoesNotChangeResults() throws Exception {
        final List<Dataset> datasets = List.of(ttbar(false), muon());
        final RunReport one = run(Fixtures.config(dir).maxThreads(1).build(), datasets);
        final RunReport four = run(Fixtures.config(dir).maxThreads(4).build(), datasets);
        assertEquals(one.results(), four.results());
        assertEquals(List.of("Muon"), one.dataCategories());
        assertEquals(List.of("Muon", "TTBar"), one.result("NJets").hist().categories());
        assertEquals(500, one.metrics().entries());
    }

    @Test
    void limitedSimulationIsRenormalized() throws Exception {
        final List<Dataset> datasets = List.of(ttbar(false));
        final RunReport full = run(Fixtures.config(dir).build(), datasets);
        final RunReport limited = run(Fixtures.config(dir).maxChunks(1).build(), datasets);
        final RunReport unadjusted = run(Fixtures.config(dir).maxChunks(1).renormalizeLimited(false).build(), datasets);

        final RunReport.DatasetStatus status = limited.dataset(TTBAR);
        assertEquals(Normalization.Kind.SIMULATED_LIMITED, status.normalization().kind());
        assertEquals(1, status.processed());
        assertEquals(2, status.total());
        assertTrue(limited.isComplete());

        final double first = unadjusted.result(TestAnalysis.MET).hist().total();
        assertEquals(2 * first, limited.result(TestAnalysis.MET).hist().total(), 1e-9);
        assertTrue(full.result(TestAnalysis.MET).hist().total() > first);
    }

    @Test
    void limitedDataKeepsUnitWeights() throws Exception {
        final RunReport limited = run(Fixtures.config(dir).maxChunks(1).build(), List.of(muon()));
        assertEquals(Normalization.Kind.DATA_LIMITED, limited.dataset("/Muon/Run2022F/NANOAOD").normalization().kind());
        final Hist h = limited.result(TestAnalysis.MET).hist();
        assertEquals(Math.rint(h.total()), h.total());
    }

    @Test
    void duplicateDatasetIsRejected() {
        final PipelineException ex = assertThrows(PipelineException.class,
                () -> run(Fixtures.config(dir).build(), List.of(ttbar(false), ttbar(false))));
        assertEquals(ErrorCode.INVALID_CONFIGURATION, ex.getErrorCode());
    }
}
