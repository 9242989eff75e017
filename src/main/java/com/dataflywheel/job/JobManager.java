package com.dataflywheel.job;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataflywheel.exception.JobCancelledException;
import com.dataflywheel.exception.JobDeadlineExceededException;
import com.dataflywheel.scoring.ReportArtifact;

/**
 * Runs flywheel jobs in the background. Every submission gets a fresh job id and its own deadline watchdog.
 * Only the most recent {@code retainedJobs} finished jobs stay in memory; older ones are answered from their snapshots.
 */
public class JobManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobManager.class);

    static final int DEFAULT_RETAINED_JOBS = 100;

    private final FlywheelJobController controller;
    private final JobSnapshotStore snapshotStore;
    private final Duration jobDeadline;
    private final int retainedJobs;
    private final Clock clock;
    private final ExecutorService executor;
    private final ScheduledExecutorService watchdog;
    private final Map<String, FlywheelJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> deadlines = new ConcurrentHashMap<>();

    public JobManager(FlywheelJobController controller, JobSnapshotStore snapshotStore, Duration jobDeadline) {
        this(controller, snapshotStore, jobDeadline, DEFAULT_RETAINED_JOBS);
    }

    public JobManager(FlywheelJobController controller, JobSnapshotStore snapshotStore, Duration jobDeadline, int retainedJobs) {
        this(controller, snapshotStore, jobDeadline, retainedJobs, Clock.systemUTC());
    }

    JobManager(FlywheelJobController controller, JobSnapshotStore snapshotStore, Duration jobDeadline, int retainedJobs,
            Clock clock) {
        if (retainedJobs < 1) {
            throw new IllegalArgumentException("retainedJobs must be >= 1");
        }
        this.controller = controller;
        this.snapshotStore = snapshotStore;
        this.jobDeadline = jobDeadline;
        this.retainedJobs = retainedJobs;
        this.clock = clock;
        this.executor = Executors.newCachedThreadPool(namedThreads("flywheel-job-"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(namedThreads("flywheel-deadline-"));
    }

    public String submit(FlywheelJobRequest request) {
        request.validate();
        String jobId = UUID.randomUUID().toString();
        FlywheelJob job = new FlywheelJob(jobId, request, clock);
        jobs.put(jobId, job);
        persist(job);

        deadlines.put(jobId, watchdog.schedule(() -> expire(job), jobDeadline.toMillis(), TimeUnit.MILLISECONDS));
        Future<?> task = executor.submit(() -> {
            try {
                controller.run(job);
            } finally {
                ScheduledFuture<?> deadline = deadlines.remove(jobId);
                if (deadline != null) {
                    deadline.cancel(false);
                }
                evictFinishedJobs();
            }
        });
        job.registerTask(task);
        log.info("job.submitted jobId={} workload={} client={} candidates={}",
                jobId, request.workloadId(), request.clientId(), request.configs().size());
        return jobId;
    }

    public Optional<JobView> status(String jobId) {
        FlywheelJob job = jobs.get(jobId);
        if (job != null) {
            return Optional.of(job.view());
        }
        return loadSnapshot(jobId).map(JobView::of);
    }

    public Optional<ReportArtifact> report(String jobId) {
        FlywheelJob job = jobs.get(jobId);
        if (job != null) {
            return Optional.ofNullable(job.report());
        }
        return loadSnapshot(jobId)
                .filter(snapshot -> snapshot.reportArtifactRef() != null)
                .map(snapshot -> readReport(snapshot.reportArtifactRef()));
    }

    /**
     * Jobs currently held in memory: every unfinished job plus the most recently finished ones.
     */
    public List<JobView> list() {
        List<JobView> views = new ArrayList<>();
        for (FlywheelJob job : jobs.values()) {
            views.add(job.view());
        }
        views.sort((a, b) -> a.createdAt().compareTo(b.createdAt()));
        return views;
    }

    /**
     * Stops local work for the job. Customization jobs already accepted by the backend keep running there.
     */
    public boolean cancel(String jobId) {
        FlywheelJob job = jobs.get(jobId);
        if (job == null) {
            return snapshotStore.exists(jobId);
        }
        if (job.fail(new JobCancelledException("Job " + jobId + " was cancelled"))) {
            log.info("job.cancelled jobId={}", jobId);
            job.cancelTasks();
            persist(job);
        }
        return true;
    }

    public boolean awaitTermination(String jobId, Duration timeout) throws InterruptedException {
        FlywheelJob job = jobs.get(jobId);
        if (job != null) {
            return job.awaitTermination(timeout);
        }
        return loadSnapshot(jobId)
                .map(snapshot -> snapshot.state().isTerminal())
                .orElseThrow(() -> new IllegalArgumentException("Unknown job " + jobId));
    }

    public void shutdown() {
        watchdog.shutdownNow();
        executor.shutdownNow();
    }

    @Override
    public void close() {
        shutdown();
    }

    private void expire(FlywheelJob job) {
        deadlines.remove(job.jobId());
        if (job.fail(new JobDeadlineExceededException("Job " + job.jobId() + " exceeded its deadline of " + jobDeadline))) {
            job.cancelTasks();
            persist(job);
        }
    }

    private void evictFinishedJobs() {
        List<FlywheelJob> finished = new ArrayList<>();
        for (FlywheelJob job : jobs.values()) {
            if (job.state().isTerminal()) {
                finished.add(job);
            }
        }
        if (finished.size() <= retainedJobs) {
            return;
        }
        finished.sort(Comparator.comparing((FlywheelJob job) -> job.view().finishedAt(),
                Comparator.nullsFirst(Comparator.<Instant>naturalOrder())));
        for (FlywheelJob job : finished.subList(0, finished.size() - retainedJobs)) {
            jobs.remove(job.jobId());
            log.debug("job.evicted jobId={}", job.jobId());
        }
    }

    private Optional<FlywheelJobSnapshot> loadSnapshot(String jobId) {
        if (!snapshotStore.exists(jobId)) {
            return Optional.empty();
        }
        try {
            return Optional.of(snapshotStore.load(jobId));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read snapshot of job " + jobId, e);
        }
    }

    private ReportArtifact readReport(String reportArtifactRef) {
        try {
            return snapshotStore.readReport(reportArtifactRef);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read report " + reportArtifactRef, e);
        }
    }

    private void persist(FlywheelJob job) {
        try {
            snapshotStore.persist(job);
        } catch (IOException e) {
            log.warn("job.persist.failed jobId={} reason={}", job.jobId(), e.getMessage());
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
