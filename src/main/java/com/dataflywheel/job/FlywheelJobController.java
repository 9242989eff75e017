package com.dataflywheel.job;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataflywheel.customization.CustomizationJobHandle;
import com.dataflywheel.customization.CustomizationTrigger;
import com.dataflywheel.customization.DatasetSplit;
import com.dataflywheel.customization.DatasetSplitter;
import com.dataflywheel.customization.TrainingDatasetWriter;
import com.dataflywheel.evaluation.EvaluationResult;
import com.dataflywheel.evaluation.Evaluator;
import com.dataflywheel.exception.CustomizationSubmitException;
import com.dataflywheel.exception.EvaluatorUnavailableException;
import com.dataflywheel.exception.FlywheelException;
import com.dataflywheel.exception.JobCancelledException;
import com.dataflywheel.exception.RecordStoreUnavailableException;
import com.dataflywheel.records.InteractionRecord;
import com.dataflywheel.records.RecordStore;
import com.dataflywheel.records.TimeRange;
import com.dataflywheel.runtime.CallTimeouts;
import com.dataflywheel.scoring.ReportArtifact;
import com.dataflywheel.scoring.ScoringAggregator;

public class FlywheelJobController implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FlywheelJobController.class);

    static final String DATASET_DIR = "datasets";

    private final RecordStore recordStore;
    private final Evaluator evaluator;
    private final CustomizationTrigger customizationTrigger;
    private final DatasetSplitter splitter;
    private final TrainingDatasetWriter datasetWriter;
    private final ScoringAggregator aggregator;
    private final JobSnapshotStore snapshotStore;
    private final CallTimeouts callTimeouts;
    private final ControllerSettings settings;
    private final ExecutorService candidateExecutor;

    public FlywheelJobController(
            RecordStore recordStore,
            Evaluator evaluator,
            CustomizationTrigger customizationTrigger,
            DatasetSplitter splitter,
            TrainingDatasetWriter datasetWriter,
            ScoringAggregator aggregator,
            JobSnapshotStore snapshotStore,
            CallTimeouts callTimeouts,
            ControllerSettings settings) {
        this(recordStore, evaluator, customizationTrigger, splitter, datasetWriter, aggregator, snapshotStore,
                callTimeouts, settings, candidatePool(settings.maxConcurrentCandidates()));
    }

    FlywheelJobController(
            RecordStore recordStore,
            Evaluator evaluator,
            CustomizationTrigger customizationTrigger,
            DatasetSplitter splitter,
            TrainingDatasetWriter datasetWriter,
            ScoringAggregator aggregator,
            JobSnapshotStore snapshotStore,
            CallTimeouts callTimeouts,
            ControllerSettings settings,
            ExecutorService candidateExecutor) {
        this.recordStore = recordStore;
        this.evaluator = evaluator;
        this.customizationTrigger = customizationTrigger;
        this.splitter = splitter;
        this.datasetWriter = datasetWriter;
        this.aggregator = aggregator;
        this.snapshotStore = snapshotStore;
        this.callTimeouts = callTimeouts;
        this.settings = settings;
        this.candidateExecutor = candidateExecutor;
    }

    /**
     * Drives one job from CREATED to a terminal state. Never throws; failures end up on the job.
     */
    public void run(FlywheelJob job) {
        try {
            if (!advance(job, JobState.LOADING_DATA)) {
                return;
            }
            List<InteractionRecord> records = fetch(job);
            DatasetSplit split = splitter.split(records);

            if (!advance(job, JobState.BASELINE_EVAL)) {
                return;
            }
            String baselineModel = baselineModel(records);
            String sliceRef = sliceRef(job, split);
            EvaluationResult baseline = evaluator.evaluate(baselineModel, sliceRef, split.evaluation());
            job.recordBaseline(baseline);
            TrainingData trainingData = prepareTrainingData(job, split);

            if (!advance(job, JobState.EVALUATING_CANDIDATES)) {
                return;
            }
            runCandidates(job, split.evaluation(), sliceRef, trainingData);
            if (job.state().isTerminal()) {
                return;
            }
            boolean anyEvaluated = job.candidateResults().stream().anyMatch(result -> result.pre() != null);
            if (!anyEvaluated) {
                throw new EvaluatorUnavailableException("No candidate of job " + job.jobId() + " could be evaluated");
            }

            if (!advance(job, JobState.AGGREGATING)) {
                return;
            }
            ReportArtifact report = aggregator.aggregate(baseline, job.candidateResults());
            Path reportPath = snapshotStore.writeReport(job.jobId(), report);
            if (job.complete(report, reportPath.toString())) {
                log.info("job.complete jobId={} recommended={} report={}", job.jobId(), report.recommendedCandidate(), reportPath);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.fail(new JobCancelledException("Job " + job.jobId() + " was interrupted", e));
        } catch (IOException e) {
            job.fail(new FlywheelException("Could not write report for job " + job.jobId() + ": " + e.getMessage(), e));
        } catch (RuntimeException e) {
            job.fail(e);
        } finally {
            persist(job);
        }
    }

    private List<InteractionRecord> fetch(FlywheelJob job) throws InterruptedException {
        try {
            List<InteractionRecord> records = callTimeouts.call(
                    () -> recordStore.fetch(job.workloadId(), job.clientId(), TimeRange.ALL),
                    settings.fetchTimeout());
            log.info("job.fetched jobId={} workload={} client={} records={}",
                    job.jobId(), job.workloadId(), job.clientId(), records.size());
            return records;
        } catch (IOException | TimeoutException e) {
            throw new RecordStoreUnavailableException("Record store fetch failed for " + job.workloadId() + "/"
                    + job.clientId() + ": " + e.getMessage(), e);
        }
    }

    private String baselineModel(List<InteractionRecord> records) {
        if (settings.baselineModel() != null && !settings.baselineModel().isBlank()) {
            return settings.baselineModel();
        }
        return records.get(0).request().model();
    }

    private TrainingData prepareTrainingData(FlywheelJob job, DatasetSplit split) {
        boolean needed = job.configs().stream().anyMatch(CandidateConfig::customizationEnabled);
        if (!needed) {
            return new TrainingData(null, null);
        }
        if (split.training().isEmpty()) {
            return new TrainingData(null, "training slice is empty");
        }
        try {
            return new TrainingData(datasetWriter.write(snapshotStore.jobDir(job.jobId()).resolve(DATASET_DIR), split), null);
        } catch (IOException e) {
            log.warn("job.dataset.failed jobId={} reason={}", job.jobId(), e.getMessage());
            return new TrainingData(null, "training dataset could not be written: " + e.getMessage());
        }
    }

    private void runCandidates(FlywheelJob job, List<InteractionRecord> evaluation, String sliceRef, TrainingData trainingData)
            throws InterruptedException {
        List<Future<?>> futures = new ArrayList<>();
        for (CandidateConfig config : job.configs()) {
            Future<?> future = candidateExecutor.submit(() -> runCandidate(job, config, evaluation, sliceRef, trainingData));
            job.registerTask(future);
            futures.add(future);
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (CancellationException e) {
                log.debug("job.candidate.cancelled jobId={}", job.jobId());
            } catch (ExecutionException e) {
                log.error("job.candidate.crashed jobId={}", job.jobId(), e.getCause());
            }
        }
        for (CandidateConfig config : job.configs()) {
            if (!job.isPublished(config)) {
                job.publish(new CandidateResult(config, CandidateStage.FAILED, null, job.handle(config), null,
                        new CandidateFailure("NotRun", "candidate task did not run to completion", CandidateStage.PENDING)));
            }
        }
    }

    private void runCandidate(
            FlywheelJob job,
            CandidateConfig config,
            List<InteractionRecord> evaluation,
            String sliceRef,
            TrainingData trainingData) {
        CandidateStage stage = CandidateStage.EVAL_PRE;
        EvaluationResult pre = null;
        EvaluationResult post = null;
        AtomicReference<CustomizationJobHandle> handle = new AtomicReference<>();
        try {
            job.markStage(config, stage);
            pre = evaluator.evaluate(config.modelName(), sliceRef, evaluation);

            if (config.customizationEnabled()) {
                stage = CandidateStage.CUSTOMIZING;
                job.markStage(config, stage);
                if (trainingData.ref() == null) {
                    throw new CustomizationSubmitException("No training dataset for " + config.label() + ": " + trainingData.problem());
                }
                if (!job.markCustomizationSubmitted(config)) {
                    throw new IllegalStateException("Customization already submitted for " + config.label());
                }
                handle.set(customizationTrigger.submit(config, trainingData.ref()));
                job.recordHandle(config, handle.get());
                persist(job);
                CustomizationJobHandle finished = customizationTrigger.awaitCompletion(handle.get(), update -> {
                    handle.set(update);
                    job.recordHandle(config, update);
                });
                handle.set(finished);

                stage = CandidateStage.EVAL_POST;
                job.markStage(config, stage);
                post = evaluator.evaluate(finished.resultModelIdentifier(), sliceRef, evaluation);
            }
            job.publish(new CandidateResult(config, CandidateStage.COMPLETED, pre, handle.get(), post, null));
            log.info("job.candidate.done jobId={} candidate={} pre={} post={}", job.jobId(), config.label(),
                    pre.aggregateScore(), post == null ? null : post.aggregateScore());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            publishFailure(job, config, stage, pre, handle.get(), new JobCancelledException(
                    "Candidate " + config.label() + " was interrupted during " + stage, e));
        } catch (RuntimeException e) {
            publishFailure(job, config, stage, pre, handle.get(), e);
        }
    }

    private void publishFailure(
            FlywheelJob job,
            CandidateConfig config,
            CandidateStage stage,
            EvaluationResult pre,
            CustomizationJobHandle handle,
            RuntimeException error) {
        log.warn("job.candidate.failed jobId={} candidate={} stage={} cause={} message={}",
                job.jobId(), config.label(), stage, error.getClass().getSimpleName(), error.getMessage());
        job.publish(new CandidateResult(config, CandidateStage.FAILED, pre, handle, null, CandidateFailure.of(error, stage)));
    }

    private boolean advance(FlywheelJob job, JobState next) {
        boolean moved = job.transition(next);
        if (moved) {
            persist(job);
        }
        return moved;
    }

    private void persist(FlywheelJob job) {
        try {
            snapshotStore.persist(job);
        } catch (IOException e) {
            log.warn("job.persist.failed jobId={} reason={}", job.jobId(), e.getMessage());
        }
    }

    private static String sliceRef(FlywheelJob job, DatasetSplit split) {
        return job.workloadId() + "/" + job.clientId() + "@" + job.jobId() + "#eval[" + split.evaluation().size() + "]";
    }

    private static ExecutorService candidatePool(int size) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, size), runnable -> {
            Thread thread = new Thread(runnable, "flywheel-candidate-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void close() {
        candidateExecutor.shutdownNow();
    }

    private record TrainingData(String ref, String problem) {
    }
}
