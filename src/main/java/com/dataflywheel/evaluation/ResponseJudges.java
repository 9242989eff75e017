package com.dataflywheel.evaluation;

import com.dataflywheel.inference.OpenAiCompatibleModelClient;
import com.dataflywheel.runtime.AppConfig;
import com.dataflywheel.runtime.SecretResolver;

import okhttp3.OkHttpClient;

public final class ResponseJudges {
    private ResponseJudges() {
    }

    public static ResponseJudge fromConfig(AppConfig.JudgeConfig config, OkHttpClient httpClient, SecretResolver secrets) {
        if (!"remote".equals(config.getType())) {
            return new LexicalResponseJudge();
        }
        String apiKey = secrets.resolveOrNull(config.getApiKeyEnv());
        return new LlmResponseJudge(
                new OpenAiCompatibleModelClient(httpClient, config.getUrl(), apiKey),
                config.getModelId());
    }
}
