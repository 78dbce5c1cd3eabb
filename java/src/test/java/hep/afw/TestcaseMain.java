package hep.afw;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestcaseMain {
    @TempDir
    File dir;

    private File setup() throws Exception {
        Fixtures.write(new File(dir, "data/ttbar.jsonl"), 120, 71);
        Fixtures.write(new File(dir, "data/muon.jsonl"), 80, 72);
        Files.write(new File(dir, "manifest.json").toPath(), ("{\"datasets\": ["
                + "{\"name\": \"/TTTo2L2Nu/Run3Summer22EE/NANOAODSIM\", \"shortName\": \"TTBar\", \"xsec\": 87.3, "
                + "\"nevents\": 100000, \"files\": [\"data/ttbar.jsonl\"]},"
                + "{\"name\": \"/Muon/Run2022F/NANOAOD\", \"shortName\": \"Muon\", \"isData\": true, "
                + "\"files\": [\"data/muon.jsonl\"]}]}").getBytes(StandardCharsets.UTF_8));
        final File cfg = new File(dir, "run.xml");
        Files.write(cfg.toPath(), ("<analysis-run name=\"cli\" class=\"hep.afw.TestAnalysis\" max-threads=\"2\">"
                + "<datasets manifest=\"manifest.json\" chunk-size=\"50\"/>"
                + "<skims directory=\"skims\"/>"
                + "<output directory=\"plots\"/>"
                + "</analysis-run>").getBytes(StandardCharsets.UTF_8));
        return cfg;
    }

    private static int execute(final String... args) throws Exception {
        return Main.execute(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8), args);
    }

    @Test
    void skimMergeRunReplot() throws Exception {
        final String cfg = setup().getPath();
        final File skims = new File(dir, "skims/test-analysis");
        final File plots = new File(dir, "plots/test-analysis");

        assertEquals(0, execute("skim", cfg));
        assertTrue(new File(skims, "TTTo2L2Nu_Run3Summer22EE_NANOAODSIM/part-2.skim.json").isFile());
        assertEquals(0, execute("merge-skims", cfg));
        assertTrue(new File(skims, "merged/Muon_Run2022F_NANOAOD.jsonl").isFile());

        assertEquals(0, execute("run", cfg));
        final File results = new File(plots, HistCodec.RESULTS_FILE);
        assertTrue(results.isFile());
        final byte[] njets = Files.readAllBytes(new File(plots, "NJets.svg").toPath());

        assertEquals(0, execute("-debug", "replot", cfg));
        assertEquals(new String(njets, StandardCharsets.UTF_8),
                new String(Files.readAllBytes(new File(plots, "NJets.svg").toPath()), StandardCharsets.UTF_8));
    }

    @Test
    void usageAndErrors() throws Exception {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertEquals(0, Main.execute(new PrintStream(out, true, StandardCharsets.UTF_8), new String[] { "-version" }));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("0.1.0"));
        assertEquals(0, execute());
        assertThrows(IllegalArgumentException.class, () -> execute("run"));
        final PipelineException ex = assertThrows(PipelineException.class,
                () -> execute("run", new File(dir, "missing.xml").getPath()));
        assertEquals(ErrorCode.INVALID_CONFIGURATION, ex.getErrorCode());
        final String cfg = setup().getPath();
        assertThrows(IllegalArgumentException.class, () -> execute("plot", cfg));
    }
}
