package hep.afw;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class TestcaseHist {

    private static Hist regular() {
        return new Hist("x", Axis.regular("x", "x", 10, 0, 10));
    }

    @Test
    void mergeOrderDoesNotMatter() throws Exception {
        final Hist a = regular().fill("TTBar", 3.5, 4.0);
        final Hist b = regular().fill("TTBar", 3.2, 6.0);

        final Hist ab = regular().merge(a).merge(b);
        final Hist ba = regular().merge(b).merge(a);

        assertEquals(10.0, ab.values("TTBar")[3]);
        assertEquals(ab, ba);
        assertEquals(16.0 + 36.0, ab.variances("TTBar")[3]);
    }

    @Test
    void categoriesStaySorted() throws Exception {
        final Hist h = regular().fill("WZ", 1, 1).fill("DY", 1, 1).fill("TTBar", 1, 1);
        assertEquals(List.of("DY", "TTBar", "WZ"), h.categories());
    }

    @Test
    void flowBins() {
        final Hist h = regular().fill("d", -1, 1).fill("d", 10, 2).fill("d", Double.NaN, 3).fill("d", 0, 5);
        final double[] flow = h.valuesWithFlow("d");
        assertEquals(1.0, flow[0]);
        assertEquals(5.0, flow[1]);
        assertEquals(5.0, flow[11]);
        assertEquals(5.0, h.sum("d"));
        assertEquals(11.0, h.total());
    }

    @Test
    void mergeRejectsOtherAxis() {
        final Hist other = new Hist("x", Axis.regular("x", "x", 20, 0, 10));
        final PipelineException ex = assertThrows(PipelineException.class, () -> regular().merge(other));
        assertEquals(ErrorCode.SCHEMA_MISMATCH, ex.getErrorCode());
        assertTrue(ex.isFatal());
    }

    @Test
    void frozenHistogramRejectsFills() {
        final Hist h = regular().fill("d", 1, 1).freeze();
        assertThrows(IllegalStateException.class, () -> h.fill("d", 2, 1));
        assertThrows(IllegalStateException.class, () -> h.merge(regular()));
        h.rendered();
        assertEquals(Hist.State.RENDERED, h.state());
        assertThrows(IllegalStateException.class, h::freeze);
    }

    @Test
    void renderRequiresReduced() {
        assertThrows(IllegalStateException.class, () -> regular().rendered());
    }

    @Test
    void fillRejectsMisalignedWeights() {
        final PipelineException ex = assertThrows(PipelineException.class,
                () -> regular().fill("d", new double[] { 1, 2 }, new double[] { 1 }));
        assertEquals(ErrorCode.DATA_ERROR, ex.getErrorCode());
    }

    @Test
    void rebinKeepsTotals() throws Exception {
        final Hist h = regular();
        for (int i = 0; i < 10; i++)
            h.fill("d", i + 0.5, i + 1);
        final Hist r = h.rebin(5);
        assertEquals(2, r.axis().bins());
        assertArrayEquals(new double[] { 15, 40 }, r.values("d"));
        assertEquals(h.total(), r.total());

        final Hist odd = h.rebin(3);
        assertEquals(4, odd.axis().bins());
        assertArrayEquals(new double[] { 6, 15, 24, 10 }, odd.values("d"));
    }

    @Test
    void variableAxisIndex() {
        final Axis njet = new CommonSpecs.NJet().create().axis();
        assertEquals(11, njet.bins());
        assertEquals(0, njet.index(3));
        assertEquals(1, njet.index(4));
        assertEquals(11, njet.index(14.5));
        assertEquals(12, njet.index(15));
    }

    @Test
    void projectAndEquality() {
        final Hist h = regular().fill("Muon", 1, 1).fill("EGamma", 2, 1).fill("TTBar", 3, 0.5);
        final Hist data = h.project(List.of("Muon", "EGamma", "MuonEG"));
        assertEquals(List.of("EGamma", "Muon"), data.categories());
        assertArrayEquals(new double[] { 0, 1, 1, 0, 0, 0, 0, 0, 0, 0 }, h.values(List.of("Muon", "EGamma")));
        assertNotEquals(h, data);
        assertEquals(h, h.copy());
    }
}
