package com.dataflywheel.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataflywheel.customization.CustomizationJobHandle;
import com.dataflywheel.evaluation.EvaluationResult;
import com.dataflywheel.scoring.ReportArtifact;

public class FlywheelJob {
    private static final Logger log = LoggerFactory.getLogger(FlywheelJob.class);

    private final String jobId;
    private final String workloadId;
    private final String clientId;
    private final List<CandidateConfig> configs;
    private final Clock clock;
    private final Instant createdAt;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final List<Future<?>> tasks = new CopyOnWriteArrayList<>();

    private final Map<CandidateConfig, CandidateStage> stages = new LinkedHashMap<>();
    private final Map<CandidateConfig, CustomizationJobHandle> handles = new LinkedHashMap<>();
    private final Map<CandidateConfig, CandidateResult> results = new LinkedHashMap<>();
    private final Set<CandidateConfig> customizationSubmitted = new HashSet<>();

    private JobState state = JobState.CREATED;
    private EvaluationResult baseline;
    private ReportArtifact report;
    private String reportArtifactRef;
    private String failureType;
    private String failureMessage;
    private Instant startedAt;
    private Instant finishedAt;

    public FlywheelJob(String jobId, FlywheelJobRequest request, Clock clock) {
        request.validate();
        this.jobId = jobId;
        this.workloadId = request.workloadId();
        this.clientId = request.clientId();
        this.configs = request.configs();
        this.clock = clock;
        this.createdAt = clock.instant();
        for (CandidateConfig config : configs) {
            stages.put(config, CandidateStage.PENDING);
        }
    }

    public String jobId() {
        return jobId;
    }

    public String workloadId() {
        return workloadId;
    }

    public String clientId() {
        return clientId;
    }

    public List<CandidateConfig> configs() {
        return configs;
    }

    public synchronized JobState state() {
        return state;
    }

    /**
     * Moves the job forward. Returns false when the job already reached a terminal state.
     */
    public synchronized boolean transition(JobState next) {
        if (state.isTerminal()) {
            return false;
        }
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal job transition " + state + " -> " + next + " for job " + jobId);
        }
        log.info("job.state jobId={} from={} to={}", jobId, state, next);
        if (state == JobState.CREATED) {
            startedAt = clock.instant();
        }
        state = next;
        if (next.isTerminal()) {
            finishedAt = clock.instant();
            terminated.countDown();
        }
        return true;
    }

    public synchronized boolean fail(Throwable cause) {
        if (state.isTerminal()) {
            return false;
        }
        failureType = cause.getClass().getSimpleName();
        failureMessage = cause.getMessage() == null ? failureType : cause.getMessage();
        log.error("job.failed jobId={} state={} cause={} message={}", jobId, state, failureType, failureMessage);
        return transition(JobState.FAILED);
    }

    public synchronized boolean complete(ReportArtifact artifact, String artifactRef) {
        if (state.isTerminal()) {
            return false;
        }
        this.report = artifact;
        this.reportArtifactRef = artifactRef;
        return transition(JobState.COMPLETE);
    }

    public synchronized void recordBaseline(EvaluationResult result) {
        if (baseline != null) {
            throw new IllegalStateException("Baseline already recorded for job " + jobId);
        }
        baseline = result;
    }

    public synchronized EvaluationResult baseline() {
        return baseline;
    }

    public synchronized void markStage(CandidateConfig config, CandidateStage stage) {
        requireKnown(config);
        stages.put(config, stage);
    }

    public synchronized boolean markCustomizationSubmitted(CandidateConfig config) {
        requireKnown(config);
        return customizationSubmitted.add(config);
    }

    public synchronized void recordHandle(CandidateConfig config, CustomizationJobHandle handle) {
        requireKnown(config);
        handles.put(config, handle);
    }

    public synchronized CustomizationJobHandle handle(CandidateConfig config) {
        return handles.get(config);
    }

    public synchronized void publish(CandidateResult result) {
        requireKnown(result.config());
        if (results.containsKey(result.config())) {
            throw new IllegalStateException("Result already published for candidate " + result.config().label());
        }
        results.put(result.config(), result);
        stages.put(result.config(), result.stage());
    }

    public synchronized boolean isPublished(CandidateConfig config) {
        return results.containsKey(config);
    }

    public synchronized List<CandidateResult> candidateResults() {
        List<CandidateResult> ordered = new ArrayList<>();
        for (CandidateConfig config : configs) {
            CandidateResult result = results.get(config);
            if (result != null) {
                ordered.add(result);
            }
        }
        return ordered;
    }

    public synchronized boolean allCandidatesPublished() {
        return results.size() == configs.size();
    }

    public synchronized ReportArtifact report() {
        return report;
    }

    public synchronized String reportArtifactRef() {
        return reportArtifactRef;
    }

    public void registerTask(Future<?> task) {
        tasks.add(task);
    }

    public void cancelTasks() {
        for (Future<?> task : tasks) {
            task.cancel(true);
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized JobView view() {
        Map<String, String> candidateStages = new LinkedHashMap<>();
        for (Map.Entry<CandidateConfig, CandidateStage> entry : stages.entrySet()) {
            candidateStages.put(entry.getKey().label(), entry.getValue().name());
        }
        return new JobView(jobId, workloadId, clientId, state, candidateStages, failureType, failureMessage,
                reportArtifactRef, createdAt, startedAt, finishedAt);
    }

    public synchronized FlywheelJobSnapshot snapshot() {
        List<CandidateResult> candidates = new ArrayList<>();
        for (CandidateConfig config : configs) {
            CandidateResult published = results.get(config);
            candidates.add(published != null
                    ? published
                    : new CandidateResult(config, stages.get(config), null, handles.get(config), null, null));
        }
        return new FlywheelJobSnapshot(jobId, workloadId, clientId, state, baseline, candidates,
                failureType, failureMessage, reportArtifactRef, createdAt, startedAt, finishedAt);
    }

    private void requireKnown(CandidateConfig config) {
        if (!stages.containsKey(config)) {
            throw new IllegalArgumentException("Candidate " + config.label() + " is not part of job " + jobId);
        }
    }
}
