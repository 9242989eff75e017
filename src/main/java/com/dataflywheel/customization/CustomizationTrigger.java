package com.dataflywheel.customization;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataflywheel.exception.CustomizationFailedException;
import com.dataflywheel.exception.CustomizationSubmitException;
import com.dataflywheel.exception.CustomizationTimeoutException;
import com.dataflywheel.job.CandidateConfig;
import com.dataflywheel.runtime.CallTimeouts;

public class CustomizationTrigger {
    private static final Logger log = LoggerFactory.getLogger(CustomizationTrigger.class);

    private final CustomizationBackend backend;
    private final TrainingHyperparameters hyperparameters;
    private final PollingPolicy pollingPolicy;
    private final CallTimeouts callTimeouts;
    private final Clock clock;
    private final Sleeper sleeper;

    public CustomizationTrigger(
            CustomizationBackend backend,
            TrainingHyperparameters hyperparameters,
            PollingPolicy pollingPolicy,
            CallTimeouts callTimeouts) {
        this(backend, hyperparameters, pollingPolicy, callTimeouts, Clock.systemUTC(), Sleeper.THREAD);
    }

    CustomizationTrigger(
            CustomizationBackend backend,
            TrainingHyperparameters hyperparameters,
            PollingPolicy pollingPolicy,
            CallTimeouts callTimeouts,
            Clock clock,
            Sleeper sleeper) {
        this.backend = backend;
        this.hyperparameters = hyperparameters;
        this.pollingPolicy = pollingPolicy;
        this.callTimeouts = callTimeouts;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public CustomizationJobHandle submit(CandidateConfig candidate, String trainingDatasetRef) throws InterruptedException {
        if (!candidate.customizationEnabled()) {
            throw new IllegalArgumentException("Customization is disabled for candidate " + candidate.label());
        }
        CustomizationRequest request = new CustomizationRequest(candidate.modelName(), trainingDatasetRef, hyperparameters);
        String externalJobId;
        try {
            externalJobId = callTimeouts.call(() -> backend.submit(request), pollingPolicy.submitTimeout());
        } catch (IOException | TimeoutException | RuntimeException e) {
            throw new CustomizationSubmitException("Customization submit failed for " + candidate.label() + ": " + e.getMessage(), e);
        }
        log.info("customization.submitted candidate={} externalJobId={} dataset={}", candidate.label(), externalJobId, trainingDatasetRef);
        return CustomizationJobHandle.submitted(candidate.modelName(), trainingDatasetRef, externalJobId, clock.instant());
    }

    public CustomizationJobHandle poll(CustomizationJobHandle handle) throws IOException, TimeoutException, InterruptedException {
        if (handle.isTerminal()) {
            return handle;
        }
        CustomizationStatus status = callTimeouts.call(() -> backend.status(handle.externalJobId()), pollingPolicy.pollTimeout());
        return handle.advance(status, clock.instant());
    }

    /**
     * Polls until the handle is terminal, publishing every state change to {@code listener}.
     *
     * @throws CustomizationTimeoutException when the deadline passes first
     * @throws CustomizationFailedException when the backend reports failure
     */
    public CustomizationJobHandle awaitCompletion(CustomizationJobHandle handle, Consumer<CustomizationJobHandle> listener)
            throws InterruptedException {
        Instant deadline = clock.instant().plus(pollingPolicy.deadline());
        Duration backoff = pollingPolicy.initialBackoff();
        CustomizationJobHandle current = handle;
        while (!current.isTerminal()) {
            if (!clock.instant().isBefore(deadline)) {
                CustomizationJobHandle timedOut = current.fail("deadline of " + pollingPolicy.deadline() + " exceeded", clock.instant());
                listener.accept(timedOut);
                throw new CustomizationTimeoutException("Customization " + current.externalJobId() + " for "
                        + current.candidateModelIdentifier() + " did not finish within " + pollingPolicy.deadline());
            }
            try {
                CustomizationJobHandle next = poll(current);
                if (next.state() != current.state()) {
                    log.info("customization.state externalJobId={} from={} to={}", next.externalJobId(), current.state(), next.state());
                    listener.accept(next);
                }
                current = next;
            } catch (IOException | TimeoutException e) {
                log.warn("customization.poll.failed externalJobId={} reason={}", current.externalJobId(), e.getMessage());
            }
            if (current.isTerminal()) {
                break;
            }
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (!remaining.isNegative() && !remaining.isZero()) {
                sleeper.sleep(backoff.compareTo(remaining) < 0 ? backoff : remaining);
            }
            backoff = pollingPolicy.nextBackoff(backoff);
        }

        if (current.state() == CustomizationState.FAILED) {
            throw new CustomizationFailedException("Customization " + current.externalJobId() + " for "
                    + current.candidateModelIdentifier() + " failed: " + current.failureReason());
        }
        return current;
    }
}
