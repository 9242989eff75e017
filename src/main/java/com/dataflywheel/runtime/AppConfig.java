package com.dataflywheel.runtime;

import com.dataflywheel.customization.TrainingHyperparameters;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private JudgeConfig judge = new JudgeConfig();
    private ServingConfig serving = new ServingConfig();
    private EvaluationConfig evaluation = new EvaluationConfig();
    private CustomizationConfig customization = new CustomizationConfig();
    private DataSplitConfig dataSplit = new DataSplitConfig();
    private PromotionConfig promotion = new PromotionConfig();
    private OrchestratorConfig orchestrator = new OrchestratorConfig();
    private StoreConfig store = new StoreConfig();

    public JudgeConfig getJudge() {
        return judge;
    }

    public void setJudge(JudgeConfig judge) {
        this.judge = judge == null ? new JudgeConfig() : judge;
    }

    public ServingConfig getServing() {
        return serving;
    }

    public void setServing(ServingConfig serving) {
        this.serving = serving == null ? new ServingConfig() : serving;
    }

    public EvaluationConfig getEvaluation() {
        return evaluation;
    }

    public void setEvaluation(EvaluationConfig evaluation) {
        this.evaluation = evaluation == null ? new EvaluationConfig() : evaluation;
    }

    public CustomizationConfig getCustomization() {
        return customization;
    }

    public void setCustomization(CustomizationConfig customization) {
        this.customization = customization == null ? new CustomizationConfig() : customization;
    }

    public DataSplitConfig getDataSplit() {
        return dataSplit;
    }

    public void setDataSplit(DataSplitConfig dataSplit) {
        this.dataSplit = dataSplit == null ? new DataSplitConfig() : dataSplit;
    }

    public PromotionConfig getPromotion() {
        return promotion;
    }

    public void setPromotion(PromotionConfig promotion) {
        this.promotion = promotion == null ? new PromotionConfig() : promotion;
    }

    public OrchestratorConfig getOrchestrator() {
        return orchestrator;
    }

    public void setOrchestrator(OrchestratorConfig orchestrator) {
        this.orchestrator = orchestrator == null ? new OrchestratorConfig() : orchestrator;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public AppConfig validate() {
        if (!"local".equals(judge.getType()) && !"remote".equals(judge.getType())) {
            throw new IllegalArgumentException("judge.type must be local or remote, was " + judge.getType());
        }
        if ("remote".equals(judge.getType()) && (judge.getUrl() == null || judge.getUrl().isBlank())) {
            throw new IllegalArgumentException("judge.url is required for a remote judge");
        }
        if (judge.getModelId() == null || judge.getModelId().isBlank()) {
            throw new IllegalArgumentException("judge.modelId is required");
        }
        if (serving.getCallTimeoutMs() <= 0 || evaluation.getCallTimeoutMs() <= 0) {
            throw new IllegalArgumentException("call timeouts must be > 0");
        }
        if (evaluation.getMaxRetries() < 0 || evaluation.getRetryBackoffMs() < 0 || evaluation.getUnavailableAfterSkips() < 0) {
            throw new IllegalArgumentException("evaluation retry settings must be >= 0");
        }
        if (customization.getPollInitialBackoffMs() <= 0
                || customization.getPollMaxBackoffMs() < customization.getPollInitialBackoffMs()) {
            throw new IllegalArgumentException("customization poll backoff must satisfy 0 < initial <= max");
        }
        if (customization.getDeadlineMs() <= 0 || customization.getSubmitTimeoutMs() <= 0 || customization.getPollTimeoutMs() <= 0) {
            throw new IllegalArgumentException("customization deadline and call timeouts must be > 0");
        }
        if (dataSplit.getEvalSize() < 0 || dataSplit.getLimit() < 0 || dataSplit.getMinTotalRecords() < 1) {
            throw new IllegalArgumentException("dataSplit evalSize/limit must be >= 0 and minTotalRecords >= 1");
        }
        if (dataSplit.getValRatio() < 0.0 || dataSplit.getValRatio() >= 1.0) {
            throw new IllegalArgumentException("dataSplit.valRatio must be in [0, 1)");
        }
        if (promotion.getTolerance() < 0.0 || promotion.getTolerance() > 1.0) {
            throw new IllegalArgumentException("promotion.tolerance must be in [0, 1]");
        }
        if (orchestrator.getMaxConcurrentCandidates() < 1) {
            throw new IllegalArgumentException("orchestrator.maxConcurrentCandidates must be >= 1");
        }
        if (orchestrator.getRetainedJobs() < 1) {
            throw new IllegalArgumentException("orchestrator.retainedJobs must be >= 1");
        }
        if (orchestrator.getJobDeadlineMs() <= 0 || orchestrator.getFetchTimeoutMs() <= 0) {
            throw new IllegalArgumentException("orchestrator deadline and fetch timeout must be > 0");
        }
        return this;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JudgeConfig {
        private String type = "local";
        private String url;
        private String modelId = "lexical-overlap";
        private String apiKeyEnv;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServingConfig {
        private String baseUrl = "http://localhost:8000";
        private String apiKeyEnv;
        private long callTimeoutMs = 30000;
        private String baselineModel;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public long getCallTimeoutMs() {
            return callTimeoutMs;
        }

        public void setCallTimeoutMs(long callTimeoutMs) {
            this.callTimeoutMs = callTimeoutMs;
        }

        public String getBaselineModel() {
            return baselineModel;
        }

        public void setBaselineModel(String baselineModel) {
            this.baselineModel = baselineModel;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EvaluationConfig {
        private int maxRetries = 2;
        private long retryBackoffMs = 500;
        private long callTimeoutMs = 60000;
        private int unavailableAfterSkips;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public long getCallTimeoutMs() {
            return callTimeoutMs;
        }

        public void setCallTimeoutMs(long callTimeoutMs) {
            this.callTimeoutMs = callTimeoutMs;
        }

        public int getUnavailableAfterSkips() {
            return unavailableAfterSkips;
        }

        public void setUnavailableAfterSkips(int unavailableAfterSkips) {
            this.unavailableAfterSkips = unavailableAfterSkips;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CustomizationConfig {
        private String baseUrl = "http://localhost:8001";
        private String apiKeyEnv;
        private long submitTimeoutMs = 10000;
        private long pollTimeoutMs = 10000;
        private long pollInitialBackoffMs = 1000;
        private long pollMaxBackoffMs = 60000;
        private long deadlineMs = 6L * 60 * 60 * 1000;
        private TrainingHyperparameters hyperparameters = TrainingHyperparameters.defaults();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public long getSubmitTimeoutMs() {
            return submitTimeoutMs;
        }

        public void setSubmitTimeoutMs(long submitTimeoutMs) {
            this.submitTimeoutMs = submitTimeoutMs;
        }

        public long getPollTimeoutMs() {
            return pollTimeoutMs;
        }

        public void setPollTimeoutMs(long pollTimeoutMs) {
            this.pollTimeoutMs = pollTimeoutMs;
        }

        public long getPollInitialBackoffMs() {
            return pollInitialBackoffMs;
        }

        public void setPollInitialBackoffMs(long pollInitialBackoffMs) {
            this.pollInitialBackoffMs = pollInitialBackoffMs;
        }

        public long getPollMaxBackoffMs() {
            return pollMaxBackoffMs;
        }

        public void setPollMaxBackoffMs(long pollMaxBackoffMs) {
            this.pollMaxBackoffMs = pollMaxBackoffMs;
        }

        public long getDeadlineMs() {
            return deadlineMs;
        }

        public void setDeadlineMs(long deadlineMs) {
            this.deadlineMs = deadlineMs;
        }

        public TrainingHyperparameters getHyperparameters() {
            return hyperparameters;
        }

        public void setHyperparameters(TrainingHyperparameters hyperparameters) {
            this.hyperparameters = hyperparameters == null ? TrainingHyperparameters.defaults() : hyperparameters;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DataSplitConfig {
        private int evalSize = 0;
        private double valRatio = 0.1;
        private int minTotalRecords = 1;
        private long randomSeed = 42;
        private int limit = 0;

        public int getEvalSize() {
            return evalSize;
        }

        public void setEvalSize(int evalSize) {
            this.evalSize = evalSize;
        }

        public double getValRatio() {
            return valRatio;
        }

        public void setValRatio(double valRatio) {
            this.valRatio = valRatio;
        }

        public int getMinTotalRecords() {
            return minTotalRecords;
        }

        public void setMinTotalRecords(int minTotalRecords) {
            this.minTotalRecords = minTotalRecords;
        }

        public long getRandomSeed() {
            return randomSeed;
        }

        public void setRandomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PromotionConfig {
        private double tolerance = 0.05;

        public double getTolerance() {
            return tolerance;
        }

        public void setTolerance(double tolerance) {
            this.tolerance = tolerance;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OrchestratorConfig {
        private int maxConcurrentCandidates = 2;
        private long jobDeadlineMs = 12L * 60 * 60 * 1000;
        private long fetchTimeoutMs = 30000;
        private String workDir = ".flywheel";
        private int retainedJobs = 100;

        public int getMaxConcurrentCandidates() {
            return maxConcurrentCandidates;
        }

        public void setMaxConcurrentCandidates(int maxConcurrentCandidates) {
            this.maxConcurrentCandidates = maxConcurrentCandidates;
        }

        public long getJobDeadlineMs() {
            return jobDeadlineMs;
        }

        public void setJobDeadlineMs(long jobDeadlineMs) {
            this.jobDeadlineMs = jobDeadlineMs;
        }

        public long getFetchTimeoutMs() {
            return fetchTimeoutMs;
        }

        public void setFetchTimeoutMs(long fetchTimeoutMs) {
            this.fetchTimeoutMs = fetchTimeoutMs;
        }

        public String getWorkDir() {
            return workDir;
        }

        public void setWorkDir(String workDir) {
            this.workDir = workDir;
        }

        public int getRetainedJobs() {
            return retainedJobs;
        }

        public void setRetainedJobs(int retainedJobs) {
            this.retainedJobs = retainedJobs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String path = ".flywheel/records";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
