package com.dataflywheel.scoring;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.dataflywheel.customization.CustomizationJobHandle;
import com.dataflywheel.customization.CustomizationState;
import com.dataflywheel.customization.CustomizationStatus;
import com.dataflywheel.evaluation.EvaluationResult;
import com.dataflywheel.exception.AggregationException;
import com.dataflywheel.exception.CustomizationTimeoutException;
import com.dataflywheel.exception.EvaluatorUnavailableException;
import com.dataflywheel.job.CandidateConfig;
import com.dataflywheel.job.CandidateFailure;
import com.dataflywheel.job.CandidateResult;
import com.dataflywheel.job.CandidateStage;

import static com.dataflywheel.scoring.ScoringFixtures.T0;
import static com.dataflywheel.scoring.ScoringFixtures.result;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoringAggregatorTest {
    private static final CandidateConfig EVAL_ONLY = new CandidateConfig("small-8b", 8192, 2, "20Gi", null, false);
    private static final CandidateConfig CUSTOMIZED = new CandidateConfig("tiny-3b", 4096, 1, "10Gi", "v2", true);
    private static final CandidateConfig WEAK = new CandidateConfig("nano-1b", 2048, 1, "5Gi", null, false);
    private static final CandidateConfig BROKEN = new CandidateConfig("broken-7b", 8192, 1, "20Gi", null, false);

    private final ScoringAggregator aggregator = new ScoringAggregator(new PromotionPolicy(0.05));
    private final EvaluationResult baseline = result("base-70b", 0.9);

    @Test
    void shouldComputeDeltasPromotionAndOutcomes() {
        ReportArtifact report = aggregator.aggregate(baseline, List.of(
                completed(EVAL_ONLY, result("small-8b", 0.88), null, null),
                completed(CUSTOMIZED, result("tiny-3b", 0.7), succeeded("tiny-3b-ft"), result("tiny-3b-ft", 0.86)),
                completed(WEAK, result("nano-1b", 0.5), null, null),
                new CandidateResult(BROKEN, CandidateStage.FAILED, null, null, null,
                        CandidateFailure.of(new EvaluatorUnavailableException("connection refused"), CandidateStage.EVAL_PRE))));

        assertEquals(0.9, report.baseline().aggregateScore(), 1e-9);
        assertEquals(4, report.candidates().size());

        CandidateReport evalOnly = report.candidates().get(0);
        assertEquals(CandidateOutcome.EVALUATED, evalOnly.outcome());
        assertEquals(-0.02, evalOnly.deltaPre(), 1e-9);
        assertNull(evalOnly.deltaPost());
        assertTrue(evalOnly.promotable());
        assertTrue(evalOnly.missingData().isEmpty());

        CandidateReport customized = report.candidates().get(1);
        assertEquals("tiny-3b:v2", customized.label());
        assertEquals(CandidateOutcome.CUSTOMIZED, customized.outcome());
        assertEquals(-0.2, customized.deltaPre(), 1e-9);
        assertEquals(-0.04, customized.deltaPost(), 1e-9);
        assertEquals(0.86, customized.bestScore(), 1e-9);
        assertEquals("tiny-3b-ft", customized.customizedModel());
        assertTrue(customized.promotable());

        assertFalse(report.candidates().get(2).promotable());

        CandidateReport broken = report.candidates().get(3);
        assertEquals(CandidateOutcome.NOT_EVALUABLE, broken.outcome());
        assertFalse(broken.promotable());
        assertNull(broken.preScore());
        assertEquals(List.of("pre-customization score"), broken.missingData());
        assertEquals("EvaluatorUnavailableException: connection refused", broken.failure());

        assertEquals("tiny-3b:v2", report.recommendedCandidate());
        assertEquals(4, report.toolCallingRecords());
        assertEquals(6, report.freeTextRecords());
        assertEquals(ReportArtifact.COMPARISON_PLOT_FILE, report.comparisonPlot());
    }

    @Test
    void shouldMarkCandidateWhoseCustomizationNeverFinished() {
        CustomizationJobHandle timedOut = CustomizationJobHandle.submitted("tiny-3b", "/data", "cust-1", T0)
                .fail("deadline exceeded", T0);
        CandidateResult incomplete = new CandidateResult(CUSTOMIZED, CandidateStage.FAILED, result("tiny-3b", 0.87), timedOut, null,
                CandidateFailure.of(new CustomizationTimeoutException("did not finish"), CandidateStage.CUSTOMIZING));

        CandidateReport report = aggregator.aggregate(baseline, List.of(incomplete)).candidates().get(0);

        assertEquals(CandidateOutcome.CUSTOMIZATION_INCOMPLETE, report.outcome());
        assertEquals(List.of("post-customization score"), report.missingData());
        assertEquals(0.87, report.bestScore(), 1e-9);
        assertTrue(report.promotable());
        assertNull(report.customizedModel());
        assertTrue(report.failure().startsWith("CustomizationTimeoutException"));
    }

    @Test
    void shouldPreferHigherScoreAmongEquallyCheapCandidates() {
        CandidateConfig strong = new CandidateConfig("strong-8b", 8192, 1, "20Gi", null, false);
        CandidateConfig fair = new CandidateConfig("fair-8b", 8192, 1, "20Gi", null, false);

        ReportArtifact report = aggregator.aggregate(baseline, List.of(
                completed(fair, result("fair-8b", 0.9), null, null),
                completed(strong, result("strong-8b", 0.95), null, null)));

        assertEquals("strong-8b", report.recommendedCandidate());
    }

    @Test
    void shouldPreferCheaperCandidateWhenBothPromotable() {
        CandidateConfig cheapStrong = new CandidateConfig("strong-8b", 8192, 1, "20Gi", null, false);
        CandidateConfig costlyFair = new CandidateConfig("fair-70b", 8192, 4, "80Gi", null, false);
        CandidateConfig cheapFair = new CandidateConfig("fair-3b", 8192, 1, "10Gi", null, false);

        assertEquals("strong-8b", aggregator.aggregate(baseline, List.of(
                completed(costlyFair, result("fair-70b", 0.97), null, null),
                completed(cheapStrong, result("strong-8b", 0.92), null, null))).recommendedCandidate());
        assertEquals("fair-3b", aggregator.aggregate(baseline, List.of(
                completed(costlyFair, result("fair-70b", 0.99), null, null),
                completed(cheapFair, result("fair-3b", 0.86), null, null))).recommendedCandidate());
    }

    @Test
    void shouldRecommendNothingWhenNoCandidateIsPromotable() {
        ReportArtifact report = aggregator.aggregate(baseline, List.of(completed(WEAK, result("nano-1b", 0.5), null, null)));

        assertNull(report.recommendedCandidate());
    }

    @Test
    void shouldBeAPureFunctionOfItsInputs() {
        List<CandidateResult> results = List.of(
                completed(EVAL_ONLY, result("small-8b", 0.88, 2, T0.plusSeconds(30)), null, null),
                completed(CUSTOMIZED, result("tiny-3b", 0.7), succeeded("tiny-3b-ft"), result("tiny-3b-ft", 0.86, 0, T0.plusSeconds(90))));

        ReportArtifact first = aggregator.aggregate(baseline, results);
        ReportArtifact second = new ScoringAggregator(new PromotionPolicy(0.05)).aggregate(baseline, results);

        assertEquals(first, second);
        assertEquals(T0.plusSeconds(90), first.generatedAt());
        assertEquals(2, first.candidates().get(0).skippedRecords());
    }

    @Test
    void shouldRejectMalformedInputs() {
        assertThrows(AggregationException.class, () -> aggregator.aggregate(null, List.of()));
        assertThrows(AggregationException.class, () -> aggregator.aggregate(baseline, List.of(
                completed(EVAL_ONLY, result("small-8b", 0.8), null, null),
                completed(EVAL_ONLY, result("small-8b", 0.8), null, null))));
    }

    private static CandidateResult completed(
            CandidateConfig config, EvaluationResult pre, CustomizationJobHandle handle, EvaluationResult post) {
        return new CandidateResult(config, CandidateStage.COMPLETED, pre, handle, post, null);
    }

    private static CustomizationJobHandle succeeded(String resultModel) {
        return CustomizationJobHandle.submitted("tiny-3b", "/data", "cust-1", T0)
                .advance(new CustomizationStatus(CustomizationState.SUCCEEDED, resultModel, null), T0.plusSeconds(60));
    }
}
