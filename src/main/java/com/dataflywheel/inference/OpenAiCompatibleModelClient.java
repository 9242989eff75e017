package com.dataflywheel.inference;

import java.io.IOException;

import com.dataflywheel.records.ChatRequest;
import com.dataflywheel.records.ChatResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class OpenAiCompatibleModelClient implements ModelClient {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final String endpoint;
    private final String apiKey;

    public OpenAiCompatibleModelClient(OkHttpClient httpClient, String baseUrl, String apiKey) {
        this.httpClient = httpClient;
        this.endpoint = trimTrailingSlash(baseUrl) + "/v1/chat/completions";
        this.apiKey = apiKey;
    }

    @Override
    public ChatResponse complete(ChatRequest request) throws IOException {
        String payload = mapper.writeValueAsString(request);
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Model endpoint " + endpoint + " returned HTTP " + response.code()
                        + " for model " + request.model());
            }
            ChatResponse completion = mapper.readValue(body.string(), ChatResponse.class);
            if (completion.choices().isEmpty()) {
                throw new IOException("Model endpoint " + endpoint + " returned no choices for model " + request.model());
            }
            return completion;
        }
    }

    static String trimTrailingSlash(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("base url is required");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
