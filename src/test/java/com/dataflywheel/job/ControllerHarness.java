package com.dataflywheel.job;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.dataflywheel.customization.CustomizationBackend;
import com.dataflywheel.customization.CustomizationRequest;
import com.dataflywheel.customization.CustomizationState;
import com.dataflywheel.customization.CustomizationStatus;
import com.dataflywheel.customization.CustomizationTrigger;
import com.dataflywheel.customization.DatasetSplitter;
import com.dataflywheel.customization.PollingPolicy;
import com.dataflywheel.customization.TrainingDatasetWriter;
import com.dataflywheel.customization.TrainingHyperparameters;
import com.dataflywheel.evaluation.EvaluationSettings;
import com.dataflywheel.evaluation.Evaluator;
import com.dataflywheel.evaluation.LexicalResponseJudge;
import com.dataflywheel.inference.ModelClient;
import com.dataflywheel.records.ChatMessage;
import com.dataflywheel.records.ChatRequest;
import com.dataflywheel.records.ChatResponse;
import com.dataflywheel.records.JsonlRecordStore;
import com.dataflywheel.runtime.AppConfig;
import com.dataflywheel.runtime.CallTimeouts;
import com.dataflywheel.scoring.PromotionPolicy;
import com.dataflywheel.scoring.ScoringAggregator;

/**
 * Wires a controller against a temp-dir record store, a scripted model client and a scripted customization backend.
 */
final class ControllerHarness implements AutoCloseable {
    final JsonlRecordStore recordStore;
    final JobSnapshotStore snapshotStore;
    final ScriptedModels models = new ScriptedModels();
    final ScriptedCustomizer customizer = new ScriptedCustomizer();
    final CallTimeouts callTimeouts = new CallTimeouts();
    final FlywheelJobController controller;

    ControllerHarness(Path root, int maxConcurrentCandidates, PollingPolicy pollingPolicy) {
        this.recordStore = new JsonlRecordStore(root.resolve("records"));
        this.snapshotStore = new JobSnapshotStore(root.resolve("work"));
        Evaluator evaluator = new Evaluator(models, new LexicalResponseJudge(),
                new EvaluationSettings(0, Duration.ZERO, Duration.ofSeconds(5), 10), callTimeouts);
        CustomizationTrigger trigger = new CustomizationTrigger(
                customizer, TrainingHyperparameters.defaults(), pollingPolicy, callTimeouts);
        this.controller = new FlywheelJobController(
                recordStore,
                evaluator,
                trigger,
                new DatasetSplitter(new AppConfig.DataSplitConfig()),
                new TrainingDatasetWriter(),
                new ScoringAggregator(new PromotionPolicy(0.05)),
                snapshotStore,
                callTimeouts,
                new ControllerSettings(null, Duration.ofSeconds(5), maxConcurrentCandidates));
    }

    ControllerHarness(Path root) {
        this(root, 2, fastPolling(Duration.ofSeconds(5)));
    }

    static PollingPolicy fastPolling(Duration deadline) {
        return new PollingPolicy(Duration.ofMillis(5), Duration.ofMillis(20), deadline, Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    FlywheelJob runJob(String workloadId, String clientId, CandidateConfig... configs) {
        FlywheelJob job = new FlywheelJob("job-" + System.nanoTime(),
                new FlywheelJobRequest(workloadId, clientId, List.of(configs)), Clock.systemUTC());
        controller.run(job);
        return job;
    }

    @Override
    public void close() {
        controller.close();
        callTimeouts.close();
    }

    /**
     * Answers "question-i" with "answer-i" unless the model's behaviour says otherwise.
     */
    static final class ScriptedModels implements ModelClient {
        private final Map<String, Behaviour> behaviours = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        void define(String model, Behaviour behaviour) {
            behaviours.put(model, behaviour);
        }

        int calls(String model) {
            AtomicInteger counter = calls.get(model);
            return counter == null ? 0 : counter.get();
        }

        int totalCalls() {
            return calls.values().stream().mapToInt(AtomicInteger::get).sum();
        }

        @Override
        public ChatResponse complete(ChatRequest request) throws IOException {
            calls.computeIfAbsent(request.model(), ignored -> new AtomicInteger()).incrementAndGet();
            String prompt = request.messages().get(0).content();
            int index = Integer.parseInt(prompt.substring("question-".length()));
            Behaviour behaviour = behaviours.getOrDefault(request.model(), i -> true);
            String answer = behaviour.answersCorrectly(index) ? "answer-" + index : "nope";
            return ChatResponse.of(request.model(), ChatMessage.of("assistant", answer));
        }
    }

    @FunctionalInterface
    interface Behaviour {
        boolean answersCorrectly(int index) throws IOException;
    }

    static final class ScriptedCustomizer implements CustomizationBackend {
        final List<CustomizationRequest> submitted = new ArrayList<>();
        private final Map<String, String> baseModelByJob = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> polls = new ConcurrentHashMap<>();
        private final List<String> neverFinishing = new ArrayList<>();

        synchronized void neverFinish(String baseModel) {
            neverFinishing.add(baseModel);
        }

        @Override
        public synchronized String submit(CustomizationRequest request) {
            submitted.add(request);
            String id = "cust-" + submitted.size();
            baseModelByJob.put(id, request.baseModelIdentifier());
            return id;
        }

        @Override
        public synchronized CustomizationStatus status(String externalJobId) {
            String baseModel = baseModelByJob.get(externalJobId);
            int poll = polls.computeIfAbsent(externalJobId, ignored -> new AtomicInteger()).incrementAndGet();
            if (neverFinishing.contains(baseModel) || poll < 2) {
                return new CustomizationStatus(CustomizationState.RUNNING, null, null);
            }
            return new CustomizationStatus(CustomizationState.SUCCEEDED, baseModel + "-ft", null);
        }
    }
}
