package com.dataflywheel.evaluation;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataflywheel.exception.DatasetException;
import com.dataflywheel.exception.EvaluatorUnavailableException;
import com.dataflywheel.inference.ModelClient;
import com.dataflywheel.records.ChatMessage;
import com.dataflywheel.records.ChatRequest;
import com.dataflywheel.records.ChatResponse;
import com.dataflywheel.records.InteractionRecord;
import com.dataflywheel.runtime.CallTimeouts;

public class Evaluator {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final ModelClient modelClient;
    private final ResponseJudge judge;
    private final ToolCallMatcher toolCallMatcher;
    private final EvaluationSettings settings;
    private final CallTimeouts callTimeouts;
    private final Clock clock;

    public Evaluator(ModelClient modelClient, ResponseJudge judge, EvaluationSettings settings, CallTimeouts callTimeouts) {
        this(modelClient, judge, new ToolCallMatcher(), settings, callTimeouts, Clock.systemUTC());
    }

    Evaluator(
            ModelClient modelClient,
            ResponseJudge judge,
            ToolCallMatcher toolCallMatcher,
            EvaluationSettings settings,
            CallTimeouts callTimeouts,
            Clock clock) {
        this.modelClient = modelClient;
        this.judge = judge;
        this.toolCallMatcher = toolCallMatcher;
        this.settings = settings;
        this.callTimeouts = callTimeouts;
        this.clock = clock;
    }

    public EvaluationResult evaluate(String modelIdentifier, String datasetSliceRef, List<InteractionRecord> records)
            throws InterruptedException {
        if (records == null || records.isEmpty()) {
            throw new DatasetException("Cannot evaluate " + modelIdentifier + " on an empty dataset slice");
        }

        List<RecordScore> scores = new ArrayList<>(records.size());
        double sum = 0.0;
        int scored = 0;
        int toolCalling = 0;
        String lastSkipReason = "";
        for (InteractionRecord record : records) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("evaluation of " + modelIdentifier + " interrupted");
            }
            if (record.isToolCalling()) {
                toolCalling++;
            }
            RecordScore score = scoreWithRetries(modelIdentifier, record);
            scores.add(score);
            if (!score.isSkipped()) {
                sum += score.score();
                scored++;
                continue;
            }
            lastSkipReason = score.detail();
            if (scored == 0 && settings.unavailableAfterSkips() > 0 && scores.size() >= settings.unavailableAfterSkips()) {
                throw new EvaluatorUnavailableException("Model " + modelIdentifier + " failed on the first "
                        + scores.size() + " records: " + lastSkipReason);
            }
        }

        if (scored == 0) {
            throw new EvaluatorUnavailableException("All " + records.size() + " records were skipped for model "
                    + modelIdentifier + ": " + lastSkipReason);
        }

        double aggregate = Math.max(0.0, Math.min(1.0, sum / scored));
        log.info("evaluation.complete model={} slice={} records={} scored={} skipped={} aggregate={}",
                modelIdentifier, datasetSliceRef, records.size(), scored, records.size() - scored,
                String.format(Locale.ROOT, "%.4f", aggregate));
        return new EvaluationResult(modelIdentifier, datasetSliceRef, scores, aggregate, toolCalling, clock.instant());
    }

    private RecordScore scoreWithRetries(String modelIdentifier, InteractionRecord record) throws InterruptedException {
        Exception last = null;
        int maxAttempts = Math.max(1, settings.maxRetries() + 1);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return RecordScore.scored(record.recordId(), scoreRecord(modelIdentifier, record));
            } catch (IOException | TimeoutException | RuntimeException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long backoff = settings.retryBackoff().toMillis() * (1L << (attempt - 1));
                log.debug("evaluation.retry record={} model={} attempt={} backoffMs={} reason={}",
                        record.recordId(), modelIdentifier, attempt, backoff, e.getMessage());
                Thread.sleep(backoff);
            }
        }
        String reason = last == null || last.getMessage() == null ? String.valueOf(last) : last.getMessage();
        log.warn("evaluation.skip record={} model={} attempts={} reason={}", record.recordId(), modelIdentifier, maxAttempts, reason);
        return RecordScore.skipped(record.recordId(), reason);
    }

    private double scoreRecord(String modelIdentifier, InteractionRecord record)
            throws IOException, TimeoutException, InterruptedException {
        ChatRequest request = record.request().withModel(modelIdentifier);
        Duration timeout = settings.callTimeout();
        ChatResponse completion = callTimeouts.call(() -> modelClient.complete(request), timeout);
        ChatMessage actual = completion.message();
        ChatMessage expected = record.response().message();

        double score;
        if (expected.hasToolCalls()) {
            score = toolCallMatcher.score(expected, actual);
        } else {
            score = callTimeouts.call(
                    () -> judge.similarity(expected.contentOrEmpty(), actual.contentOrEmpty(), request.messages()),
                    timeout);
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
