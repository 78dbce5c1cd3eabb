package hep.afw;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class TestcaseStagePipeline {

    private static PipelineException violation(final Stage stage) throws PipelineException {
        final Events in = Fixtures.events(0, 20, 3);
        final PipelineException ex = assertThrows(PipelineException.class, () -> StagePipeline.of(stage).apply(in));
        assertEquals(ErrorCode.STAGE_CONTRACT_VIOLATION, ex.getErrorCode());
        assertFalse(ex.isFatal());
        return ex;
    }

    @Test
    void analysisPipelineRunsInOrder() throws Exception {
        final Analysis a = new TestAnalysis();
        final Events in = Fixtures.events(0, 200, 4);
        final Events out = a.pipeline().apply(in);
        assertTrue(out.rows() < in.rows());
        assertTrue(out.has("HT"));
        for (final int n : out.jagged("Jet_pt").counts())
            assertTrue(n >= 2);
        for (final double met : out.doubles("MET_pt"))
            assertTrue(met > 20);
    }

    @Test
    void onlyKeepsRequestedPhases() throws Exception {
        final StagePipeline skim = new TestAnalysis().pipeline().only(Stage.Phase.OBJECT_DEFINITION,
                Stage.Phase.PRESELECTION);
        assertEquals(2, skim.stages().size());
        final Events out = skim.apply(Fixtures.events(0, 200, 4));
        boolean lowMet = false;
        for (final double met : out.doubles("MET_pt"))
            lowMet |= met <= 20;
        assertTrue(lowMet);
    }

    @Test
    void phasesMustNotGoBackwards() {
        final StagePipeline.Builder b = new StagePipeline.Builder()
                .add(Stage.identity(Stage.Phase.PRESELECTION));
        assertThrows(IllegalArgumentException.class, () -> b.add(Stage.identity(Stage.Phase.OBJECT_DEFINITION)));
    }

    @Test
    void filterMayNotRedefine() throws Exception {
        violation(Stage.filter("sneaky", Stage.Phase.PRESELECTION, e -> e.with("HT", new double[e.rows()])));
    }

    @Test
    void redefineMayNotDropRows() throws Exception {
        violation(Stage.redefine("lossy", Stage.Phase.OBJECT_DEFINITION,
                e -> e.select(new int[] { 0, 1, 2 })));
    }

    @Test
    void filterMayNotReorder() throws Exception {
        violation(Stage.filter("shuffle", Stage.Phase.PRESELECTION, e -> e.select(new int[] { 2, 1 })));
    }

    @Test
    void filterMayNotChangeTypes() throws Exception {
        violation(Stage.filter("retype", Stage.Phase.PRESELECTION,
                e -> e.with(Column.ofDoubles("run", new double[e.rows()]))));
    }

    @Test
    void stageMustReturnEvents() throws Exception {
        violation(Stage.redefine("void", Stage.Phase.SELECTION, e -> null));
    }

    @Test
    void runtimeFailureIsDataError() throws Exception {
        final Stage stage = Stage.redefine("broken", Stage.Phase.OBJECT_DEFINITION, e -> {
            throw new ArithmeticException("boom");
        });
        final PipelineException ex = assertThrows(PipelineException.class,
                () -> StagePipeline.of(stage).apply(Fixtures.events(0, 2, 1)));
        assertEquals(ErrorCode.DATA_ERROR, ex.getErrorCode());
    }

    @Test
    void minifierProjects() throws Exception {
        final Events pre = new TestAnalysis().pipeline().only(Stage.Phase.OBJECT_DEFINITION, Stage.Phase.PRESELECTION)
                .apply(Fixtures.events(0, 50, 5));
        final Events min = new TestAnalysis().minifier().apply(pre);
        assertEquals(List.of("Jet_pt", "MET_pt", "HT"), min.names());
        assertEquals(pre.rows(), min.rows());
        assertThrows(IllegalArgumentException.class, () -> Minifier.keep());
        assertThrows(PipelineException.class, () -> Minifier.keep("Muon_pt").apply(pre));
    }

    @Test
    void analysisValidation() {
        assertThrows(IllegalArgumentException.class, () -> Analysis.builder("dup")
                .histogram(new CommonSpecs.NJet())
                .histogram(new CommonSpecs.NJet())
                .build());
    }
}
