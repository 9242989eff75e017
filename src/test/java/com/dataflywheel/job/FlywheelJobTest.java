package com.dataflywheel.job;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.dataflywheel.exception.JobDeadlineExceededException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlywheelJobTest {
    private static final CandidateConfig SMALL = new CandidateConfig("small-8b", 8192, 1, "20Gi", null, true);
    private static final CandidateConfig TINY = new CandidateConfig("tiny-3b", 4096, 1, "10Gi", "v2", false);

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldStayFailedOnceTerminal() {
        FlywheelJob job = job();
        assertTrue(job.transition(JobState.LOADING_DATA));

        assertTrue(job.fail(new JobDeadlineExceededException("deadline of PT12H exceeded")));

        assertFalse(job.transition(JobState.BASELINE_EVAL));
        assertFalse(job.fail(new IllegalStateException("late")));
        assertEquals(JobState.FAILED, job.state());
        assertEquals("JobDeadlineExceededException", job.view().failureType());
        assertEquals("deadline of PT12H exceeded", job.view().failureMessage());
        assertEquals(clock.instant(), job.view().finishedAt());
    }

    @Test
    void shouldRejectSkippedStates() {
        FlywheelJob job = job();

        assertThrows(IllegalStateException.class, () -> job.transition(JobState.AGGREGATING));
        assertEquals(JobState.CREATED, job.state());
    }

    @Test
    void shouldPublishEachCandidateResultOnce() {
        FlywheelJob job = job();
        CandidateResult result = new CandidateResult(TINY, CandidateStage.COMPLETED, null, null, null, null);

        job.publish(result);

        assertThrows(IllegalStateException.class, () -> job.publish(result));
        assertTrue(job.isPublished(TINY));
        assertFalse(job.allCandidatesPublished());
        assertEquals(List.of(result), job.candidateResults());
        assertEquals("COMPLETED", job.view().candidateStages().get("tiny-3b:v2"));
        assertEquals("PENDING", job.view().candidateStages().get("small-8b"));
    }

    @Test
    void shouldSubmitCustomizationOncePerCandidate() {
        FlywheelJob job = job();

        assertTrue(job.markCustomizationSubmitted(SMALL));
        assertFalse(job.markCustomizationSubmitted(SMALL));
        assertThrows(IllegalArgumentException.class,
                () -> job.markCustomizationSubmitted(new CandidateConfig("other", 1, 1, null, null, true)));
    }

    @Test
    void shouldSnapshotUnpublishedCandidatesWithTheirStage() {
        FlywheelJob job = job();
        job.markStage(SMALL, CandidateStage.EVAL_PRE);

        FlywheelJobSnapshot snapshot = job.snapshot();

        assertEquals(2, snapshot.candidates().size());
        assertEquals(CandidateStage.EVAL_PRE, snapshot.candidates().get(0).stage());
        assertNull(snapshot.candidates().get(0).pre());
        assertEquals(JobState.CREATED, snapshot.state());
    }

    @Test
    void shouldRejectInvalidRequests() {
        assertThrows(IllegalArgumentException.class,
                () -> new FlywheelJobRequest("support", "acme", List.of(SMALL, SMALL)).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new FlywheelJobRequest("support", "acme", List.of()).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new FlywheelJobRequest(" ", "acme", List.of(SMALL)).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new FlywheelJobRequest("support", "acme",
                        List.of(new CandidateConfig("", 8192, 1, null, null, false))).validate());
    }

    private FlywheelJob job() {
        return new FlywheelJob("job-1", new FlywheelJobRequest("support", "acme", List.of(SMALL, TINY)), clock);
    }
}
