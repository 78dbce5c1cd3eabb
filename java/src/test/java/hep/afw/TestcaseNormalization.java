package hep.afw;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class TestcaseNormalization {

    private static Dataset simulated(final int chunks, final long chunkSize) {
        final Dataset.Builder b = Dataset.builder("/TTTo2L2Nu/Run3Summer22EE/NANOAODSIM").shortName("TTBar")
                .simulated(87.3, 1_000_000);
        for (int i = 0; i < chunks; i++)
            b.chunk("ttbar.jsonl", i * chunkSize, (i + 1) * chunkSize);
        return b.build();
    }

    @Test
    void fullSimulation() {
        final Normalization n = Normalization.of(simulated(4, 250_000), 4, 1000);
        assertEquals(Normalization.Kind.SIMULATED_FULL, n.kind());
        assertEquals(1000 * 87.3 / 1_000_000, n.factor(true), 1e-12);
        assertEquals(n.factor(false), n.factor(true));
        assertEquals(1.0, n.fraction());
    }

    @Test
    void limitedSimulationScalesByDeclaredFraction() {
        final Dataset d = simulated(1000, 1000);
        final Normalization n = Normalization.of(d, Datasets.limit(d, 1), 1000);
        assertEquals(Normalization.Kind.SIMULATED_LIMITED, n.kind());
        assertEquals(0.001, n.fraction(), 1e-15);
        assertEquals(0.0873, n.unadjustedFactor(), 1e-12);
        assertEquals(87.3, n.adjustedFactor(), 1e-9);
        assertEquals(n.adjustedFactor(), n.factor(true));
        assertEquals(n.unadjustedFactor(), n.factor(false));
    }

    @Test
    void dataIsNeverReweighted() {
        final Dataset.Builder b = Dataset.builder("/Muon/Run2022F/NANOAOD").shortName("Muon").data();
        for (int i = 0; i < 10; i++)
            b.chunk("muon.jsonl", i * 100, (i + 1) * 100);
        final Normalization n = Normalization.of(b.build(), 3, 1000);
        assertEquals(Normalization.Kind.DATA_LIMITED, n.kind());
        assertEquals(1.0, n.factor(true));
        assertEquals(1.0, n.factor(false));
        assertEquals(0.3, n.fraction(), 1e-12);
    }

    @Test
    void weightsFollowTheFactor() throws Exception {
        final Dataset d = simulated(2, 500_000);
        final Normalization n = Normalization.of(d, 1, 1000);
        final double[] w = Weights.of(Fixtures.events(0, 3, 1), n, true);
        assertArrayEquals(new double[] { 0.1746, 0.1746, 0.1746 }, w, 1e-12);
    }

    @Test
    void chunkLimit() {
        final Dataset d = simulated(5, 10);
        assertEquals(5, Datasets.limit(d, -1));
        assertEquals(2, Datasets.limit(d, 2));
        assertEquals(5, Datasets.limit(d, 50));
    }
}
