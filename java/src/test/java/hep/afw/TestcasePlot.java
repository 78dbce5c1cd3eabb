package hep.afw;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;

class TestcasePlot {
    @TempDir
    File dir;

    private static Reducer.Result result(final int failed) {
        final Hist h = new Hist("MET", Axis.regular("met", "MET", 10, 0, 100));
        h.fill("TTBar", 15, 2.5).fill("DY", 25, 4).fill("DY", 35, 1).fill("Muon", 15, 1).fill("TTTT", 45, 0.01);
        return new Reducer.Result(h.freeze(), 4, failed);
    }

    private static String render(final Reducer.Result result) throws Exception {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        new SvgPlotRenderer(26671.7).render(result, new HistogramSpec.PlotOptions("GeV", 1, Set.of("TTTT")),
                List.of("Muon"), out);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void svgIsDeterministic() throws Exception {
        final String svg = render(result(0));
        assertEquals(svg, render(result(0)));
        assertTrue(svg.startsWith("<svg") || svg.startsWith("<?xml"));
        assertTrue(svg.contains("CMS"));
        assertTrue(svg.contains("Counts / 10 GeV"));
        assertTrue(svg.contains("TTBar"));
        assertTrue(svg.contains("TTTT"));
        assertFalse(svg.contains("chunks failed"));
    }

    @Test
    void partialResultsCarryABanner() throws Exception {
        assertTrue(render(result(1)).contains("partial (1/4 chunks failed)"));
    }

    @Test
    void escapeMarkup() {
        assertEquals("a &lt; b &amp; c", SvgPlotRenderer.escape("a < b & c"));
    }

    @Test
    void replotReproducesSavedPlots() throws Exception {
        final File data = Fixtures.write(new File(dir, "muon.jsonl"), 150, 51);
        final File mc = Fixtures.write(new File(dir, "ttbar.jsonl"), 150, 52);
        final List<Dataset> datasets = List.of(
                Dataset.builder("/Muon/Run2022F/NANOAOD").shortName("Muon").data().chunk(data.getPath(), 0, 150).build(),
                Dataset.builder("/TTTo2L2Nu/Run3Summer22EE/NANOAODSIM").shortName("TTBar").simulated(87.3, 10_000)
                        .chunk(mc.getPath(), 0, 75).chunk(mc.getPath(), 75, 150).build());
        final RunConfig cfg = Fixtures.config(dir).build();
        final TestAnalysis analysis = new TestAnalysis();
        final RunReport report;
        try (ChunkScheduler scheduler = new LocalChunkScheduler(2)) {
            report = new AnalysisRunner(cfg, scheduler, Fixtures.LOGGER).run(analysis, datasets, false);
        }

        final Plotter plotter = new Plotter(new SvgPlotRenderer(cfg.luminosity()), Fixtures.LOGGER);
        final File out = plotter.save(report, analysis.histograms(), cfg.outputDirectory(), "svg");
        assertEquals(new File(cfg.outputDirectory(), "test-analysis"), out);
        final File met = new File(out, "p_T^{miss}.svg");
        final File njets = new File(out, "NJets.svg");
        assertTrue(met.isFile());
        final byte[] first = Files.readAllBytes(met.toPath());
        final byte[] firstNjets = Files.readAllBytes(njets.toPath());

        final HistCodec.Results results = plotter.replot(analysis, cfg.outputDirectory(), "svg");
        assertEquals(List.of("Muon"), results.dataCategories());
        assertEquals(report.result("NJets").hist(), results.get("NJets").hist());
        assertEquals(Hist.State.RENDERED, results.get("NJets").hist().state());
        assertArrayEquals(first, Files.readAllBytes(met.toPath()));
        assertArrayEquals(firstNjets, Files.readAllBytes(njets.toPath()));

        assertThrows(PipelineException.class, () -> plotter.replot(analysis, cfg.outputDirectory(), "pdf"));
    }

    @Test
    void unknownResultsVersionIsRejected() throws Exception {
        final JsonObject o = HistCodec.encode(new HistCodec.Results("a", List.of(), Map.of("MET", result(0))));
        o.addProperty("version", HistCodec.VERSION + 1);
        final PipelineException ex = assertThrows(PipelineException.class, () -> HistCodec.decodeResults(o));
        assertEquals(ErrorCode.SERIALIZATION_VERSION, ex.getErrorCode());
        assertTrue(ex.isFatal());
    }

    @Test
    void resultsRoundTripThroughJson() throws Exception {
        final Reducer.Result r = result(1);
        final HistCodec.Results back = HistCodec.decodeResults(
                HistCodec.encode(new HistCodec.Results("a", List.of("Muon"), Map.of("MET", r))));
        assertEquals(r, back.get("MET"));
        assertEquals("partial (1/4 failed)", back.get("MET").status());
    }

    @Test
    void replotNeedsResults() {
        final PipelineException ex = assertThrows(PipelineException.class,
                () -> new Plotter(new SvgPlotRenderer(), Fixtures.LOGGER).replot(new TestAnalysis(), dir, "svg"));
        assertEquals(ErrorCode.DATA_ERROR, ex.getErrorCode());
    }
}
