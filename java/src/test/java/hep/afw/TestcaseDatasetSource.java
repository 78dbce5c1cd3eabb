package hep.afw;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestcaseDatasetSource {
    @TempDir
    File dir;

    @Test
    void manifestWithDeclaredEntries() throws Exception {
        final File manifest = new File(getClass().getResource("/manifest.json").toURI());
        final List<Dataset> datasets = new LocalDatasetSource(manifest, 100, Fixtures.LOGGER).datasets();
        assertEquals(3, datasets.size());

        final Dataset ttbar = datasets.get(0);
        assertEquals("TTBar", ttbar.shortName());
        assertTrue(ttbar.isSimulated());
        assertEquals(1_000_000L, ttbar.declaredEvents());
        assertEquals(3, ttbar.chunks().size());
        assertEquals(200, ttbar.chunks().get(2).start());
        assertEquals(250, ttbar.chunks().get(2).stop());
        assertEquals(250, ttbar.declaredEntries());
        for (final ChunkRef c : ttbar.chunks())
            assertTrue(c.file().endsWith("ttbar_0.jsonl"));

        final Dataset muon = datasets.get(1);
        assertFalse(muon.isSimulated());
        assertNull(muon.crossSection());
        assertEquals(2, muon.chunks().size());

        final Dataset tttt = datasets.get(2);
        assertTrue(tttt.isSimulated());
        assertEquals(30L, tttt.declaredEvents());
        assertNull(Datasets.find(datasets, "/EGamma/Run2022F/NANOAOD"));
    }

    @Test
    void entriesAreCountedFromFiles() throws Exception {
        Fixtures.write(new File(dir, "dy.jsonl"), 25, 61);
        final File manifest = new File(dir, "manifest.json");
        Files.write(manifest.toPath(), ("{\"datasets\": [{\"name\": \"/DY/x/NANOAODSIM\", \"shortName\": \"DY\", "
                + "\"xsec\": 6688.0, \"files\": [\"dy.jsonl\"]}]}").getBytes(StandardCharsets.UTF_8));
        final List<Dataset> datasets = new LocalDatasetSource(manifest, 10, Fixtures.LOGGER).datasets();
        assertEquals(1, datasets.size());
        assertEquals(3, datasets.get(0).chunks().size());
        assertEquals(25L, datasets.get(0).declaredEvents());
        assertEquals(new File(dir, "dy.jsonl").getPath(), datasets.get(0).chunks().get(0).file());
    }

    @Test
    void simulationWithoutCrossSectionIsRejected() throws Exception {
        final File manifest = new File(dir, "manifest.json");
        Files.write(manifest.toPath(), ("{\"datasets\": [{\"name\": \"/DY/x/NANOAODSIM\", "
                + "\"files\": [{\"path\": \"dy.jsonl\", \"entries\": 5}]}]}").getBytes(StandardCharsets.UTF_8));
        final PipelineException ex = assertThrows(PipelineException.class,
                () -> new LocalDatasetSource(manifest, 10, Fixtures.LOGGER).datasets());
        assertEquals(ErrorCode.INVALID_CONFIGURATION, ex.getErrorCode());
    }

    @Test
    void malformedManifest() throws Exception {
        final File manifest = new File(dir, "manifest.json");
        Files.write(manifest.toPath(), "{\"sets\": []}".getBytes(StandardCharsets.UTF_8));
        assertThrows(PipelineException.class, () -> new LocalDatasetSource(manifest, 10, Fixtures.LOGGER).datasets());
        assertThrows(IllegalArgumentException.class, () -> new LocalDatasetSource(manifest, 0, Fixtures.LOGGER));
    }
}
