package com.dataflywheel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataflywheel.customization.CustomizationTrigger;
import com.dataflywheel.customization.DatasetSplitter;
import com.dataflywheel.customization.HttpCustomizationBackend;
import com.dataflywheel.customization.PollingPolicy;
import com.dataflywheel.customization.TrainingDatasetWriter;
import com.dataflywheel.evaluation.EvaluationSettings;
import com.dataflywheel.evaluation.Evaluator;
import com.dataflywheel.evaluation.ResponseJudge;
import com.dataflywheel.evaluation.ResponseJudges;
import com.dataflywheel.inference.HttpClients;
import com.dataflywheel.inference.ModelClient;
import com.dataflywheel.inference.OpenAiCompatibleModelClient;
import com.dataflywheel.job.CandidateConfig;
import com.dataflywheel.job.ControllerSettings;
import com.dataflywheel.job.FlywheelJobController;
import com.dataflywheel.job.FlywheelJobRequest;
import com.dataflywheel.job.FlywheelJobSnapshot;
import com.dataflywheel.job.JobManager;
import com.dataflywheel.job.JobSnapshotStore;
import com.dataflywheel.job.JobState;
import com.dataflywheel.job.JobView;
import com.dataflywheel.job.ReportRegenerator;
import com.dataflywheel.records.ImportReport;
import com.dataflywheel.records.JsonlRecordStore;
import com.dataflywheel.records.RecordImporter;
import com.dataflywheel.records.RecordStore;
import com.dataflywheel.runtime.AppConfig;
import com.dataflywheel.runtime.CallTimeouts;
import com.dataflywheel.runtime.SecretResolver;
import com.dataflywheel.scoring.PromotionPolicy;
import com.dataflywheel.scoring.ReportArtifact;
import com.dataflywheel.scoring.ScoringAggregator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "data-flywheel",
        mixinStandardHelpOptions = true,
        version = "data-flywheel 0.1.0",
        description = "Evaluates, customizes and ranks candidate models against captured production traffic.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", required = true)
    Mode mode;

    @Option(names = "--records-file", description = "Newline-delimited JSON file of interaction records (ingest mode)")
    Path recordsFile;

    @Option(names = "--workload", description = "Workload id to evaluate (submit mode)")
    String workloadId;

    @Option(names = "--client", description = "Client id to evaluate (submit mode)")
    String clientId;

    @Option(names = "--candidates", description = "YAML or JSON list of candidate configs (submit mode)")
    Path candidatesFile;

    @Option(names = "--job-id", description = "Job id (status and report modes)")
    String jobId;

    @Option(names = "--store-path", description = "Overrides store.path from the config")
    Path storePath;

    @Option(names = "--work-dir", description = "Overrides orchestrator.workDir from the config")
    Path workDir;

    private final SecretResolver secrets;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    enum Mode {
        ingest,
        submit,
        status,
        report
    }

    public Main() {
        this(SecretResolver.ENVIRONMENT);
    }

    Main(SecretResolver secrets) {
        this.secrets = secrets;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath)).validate();
        if (storePath != null) {
            config.getStore().setPath(storePath.toString());
        }
        if (workDir != null) {
            config.getOrchestrator().setWorkDir(workDir.toString());
        }
        log.info("Starting data-flywheel in {} mode", mode);
        log.info("Using config file: {}", configPath);

        return switch (mode) {
            case ingest -> runIngest(config);
            case submit -> runSubmit(config);
            case status -> runStatus(config);
            case report -> runReport(config);
        };
    }

    private int runIngest(AppConfig config) throws IOException {
        if (recordsFile == null) {
            log.error("--records-file is required in ingest mode");
            return 2;
        }
        RecordImporter importer = new RecordImporter(new JsonlRecordStore(Path.of(config.getStore().getPath())));
        ImportReport report = importer.importFile(recordsFile);
        log.info("Ingested records: read={} stored={} duplicates={}", report.read(), report.stored(), report.duplicates());
        return 0;
    }

    private int runSubmit(AppConfig config) throws IOException, InterruptedException {
        if (workloadId == null || clientId == null || candidatesFile == null) {
            log.error("--workload, --client and --candidates are required in submit mode");
            return 2;
        }
        List<CandidateConfig> candidates = yamlMapper.readValue(candidatesFile.toFile(), new TypeReference<List<CandidateConfig>>() {
        });
        FlywheelJobRequest request = new FlywheelJobRequest(workloadId, clientId, candidates);

        Duration jobDeadline = Duration.ofMillis(config.getOrchestrator().getJobDeadlineMs());
        JobSnapshotStore snapshotStore = new JobSnapshotStore(Path.of(config.getOrchestrator().getWorkDir()));
        try (CallTimeouts callTimeouts = new CallTimeouts();
                FlywheelJobController controller = buildController(config, snapshotStore, callTimeouts);
                JobManager manager = new JobManager(controller, snapshotStore, jobDeadline,
                        config.getOrchestrator().getRetainedJobs())) {
            String submitted = manager.submit(request);
            System.out.println(submitted);
            manager.awaitTermination(submitted, jobDeadline.plusMinutes(1));
            JobView view = manager.status(submitted).orElseThrow();
            System.out.println(jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(view));
            if (view.state() != JobState.COMPLETE) {
                log.error("Job {} ended {}: {} {}", submitted, view.state(), view.failureType(), view.failureMessage());
                return 1;
            }
            log.info("Job {} complete, report at {}", submitted, view.reportArtifactRef());
            return 0;
        }
    }

    private int runStatus(AppConfig config) throws IOException {
        if (jobId == null) {
            log.error("--job-id is required in status mode");
            return 2;
        }
        FlywheelJobSnapshot snapshot = new JobSnapshotStore(Path.of(config.getOrchestrator().getWorkDir())).load(jobId);
        log.info("Job {} state={} failure={} report={}", jobId, snapshot.state(),
                snapshot.failureMessage() == null ? "none" : snapshot.failureMessage(),
                snapshot.reportArtifactRef() == null ? "none" : snapshot.reportArtifactRef());
        System.out.println(jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot));
        return 0;
    }

    private int runReport(AppConfig config) throws IOException {
        if (jobId == null) {
            log.error("--job-id is required in report mode");
            return 2;
        }
        ReportRegenerator regenerator = new ReportRegenerator(
                new JobSnapshotStore(Path.of(config.getOrchestrator().getWorkDir())),
                new ScoringAggregator(new PromotionPolicy(config.getPromotion().getTolerance())));
        ReportArtifact report = regenerator.regenerate(jobId);
        System.out.println(jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        return 0;
    }

    private FlywheelJobController buildController(AppConfig config, JobSnapshotStore snapshotStore, CallTimeouts callTimeouts) {
        AppConfig.ServingConfig serving = config.getServing();
        OkHttpClient servingHttp = HttpClients.create(Duration.ofMillis(serving.getCallTimeoutMs()));
        ModelClient modelClient = new OpenAiCompatibleModelClient(
                servingHttp, serving.getBaseUrl(), secrets.resolveOrNull(serving.getApiKeyEnv()));
        ResponseJudge judge = ResponseJudges.fromConfig(config.getJudge(), servingHttp, secrets);
        Evaluator evaluator = new Evaluator(modelClient, judge, EvaluationSettings.from(config.getEvaluation()), callTimeouts);

        AppConfig.CustomizationConfig customization = config.getCustomization();
        OkHttpClient customizationHttp = HttpClients.create(
                Duration.ofMillis(Math.max(customization.getSubmitTimeoutMs(), customization.getPollTimeoutMs())));
        CustomizationTrigger trigger = new CustomizationTrigger(
                new HttpCustomizationBackend(customizationHttp, customization.getBaseUrl(),
                        secrets.resolveOrNull(customization.getApiKeyEnv())),
                customization.getHyperparameters(),
                PollingPolicy.from(customization),
                callTimeouts);

        RecordStore recordStore = new JsonlRecordStore(Path.of(config.getStore().getPath()));
        return new FlywheelJobController(
                recordStore,
                evaluator,
                trigger,
                new DatasetSplitter(config.getDataSplit()),
                new TrainingDatasetWriter(),
                new ScoringAggregator(new PromotionPolicy(config.getPromotion().getTolerance())),
                snapshotStore,
                callTimeouts,
                ControllerSettings.from(config));
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        return yamlMapper.readValue(config.toFile(), AppConfig.class);
    }
}
