package com.dataflywheel.scoring;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import com.dataflywheel.evaluation.EvaluationResult;
import com.dataflywheel.exception.AggregationException;
import com.dataflywheel.job.CandidateConfig;
import com.dataflywheel.job.CandidateResult;

public class ScoringAggregator {
    private final PromotionPolicy policy;

    public ScoringAggregator(PromotionPolicy policy) {
        this.policy = policy;
    }

    public ReportArtifact aggregate(EvaluationResult baseline, List<CandidateResult> perConfigResults) {
        if (baseline == null) {
            throw new AggregationException("Cannot aggregate without a baseline result");
        }
        if (baseline.perRecordScores().isEmpty()) {
            throw new AggregationException("Baseline result for " + baseline.modelIdentifier() + " has no per-record scores");
        }

        Set<CandidateConfig> seen = new HashSet<>();
        List<CandidateReport> candidates = new ArrayList<>();
        for (CandidateResult result : perConfigResults) {
            if (result == null || result.config() == null) {
                throw new AggregationException("Candidate result without a config");
            }
            if (!seen.add(result.config())) {
                throw new AggregationException("Duplicate result for candidate " + result.config().label());
            }
            candidates.add(report(baseline.aggregateScore(), result));
        }

        String recommended = candidates.stream()
                .filter(CandidateReport::promotable)
                .min(Comparator.comparingInt(CandidateReport::computeUnitCount)
                        .thenComparing(CandidateReport::bestScore, Comparator.reverseOrder())
                        .thenComparing(CandidateReport::label))
                .map(CandidateReport::label)
                .orElse(null);

        int records = baseline.perRecordScores().size();
        return new ReportArtifact(
                new BaselineSummary(baseline.modelIdentifier(), baseline.aggregateScore(), records, baseline.skippedCount()),
                policy.tolerance(),
                candidates,
                recommended,
                baseline.toolCallingRecords(),
                records - baseline.toolCallingRecords(),
                ReportArtifact.COMPARISON_PLOT_FILE,
                latestComputedAt(baseline, perConfigResults));
    }

    private CandidateReport report(double baselineScore, CandidateResult result) {
        CandidateConfig config = result.config();
        EvaluationResult pre = result.pre();
        EvaluationResult post = result.post();
        String failure = result.failure() == null ? null
                : result.failure().errorType() + ": " + result.failure().message();

        List<String> missing = new ArrayList<>();
        if (pre == null) {
            missing.add("pre-customization score");
        }
        if (config.customizationEnabled() && post == null) {
            missing.add("post-customization score");
        }

        CandidateOutcome outcome;
        if (pre == null) {
            outcome = CandidateOutcome.NOT_EVALUABLE;
        } else if (!config.customizationEnabled()) {
            outcome = CandidateOutcome.EVALUATED;
        } else if (post == null) {
            outcome = CandidateOutcome.CUSTOMIZATION_INCOMPLETE;
        } else {
            outcome = CandidateOutcome.CUSTOMIZED;
        }

        Double preScore = pre == null ? null : pre.aggregateScore();
        Double postScore = post == null ? null : post.aggregateScore();
        Double best = postScore != null ? postScore : preScore;
        boolean promotable = best != null && policy.isPromotable(best, baselineScore);
        long skipped = (pre == null ? 0 : pre.skippedCount()) + (post == null ? 0 : post.skippedCount());
        String customizedModel = result.customization() == null ? null : result.customization().resultModelIdentifier();

        return new CandidateReport(
                config.label(),
                config.modelName(),
                config.computeUnitCount(),
                config.customizationEnabled(),
                outcome,
                preScore,
                postScore,
                preScore == null ? null : preScore - baselineScore,
                postScore == null ? null : postScore - baselineScore,
                best,
                promotable,
                customizedModel,
                skipped,
                missing,
                failure);
    }

    private static Instant latestComputedAt(EvaluationResult baseline, List<CandidateResult> results) {
        return Stream.concat(
                        Stream.of(baseline),
                        results.stream().flatMap(result -> Stream.of(result.pre(), result.post())))
                .filter(result -> result != null && result.computedAt() != null)
                .map(EvaluationResult::computedAt)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }
}
