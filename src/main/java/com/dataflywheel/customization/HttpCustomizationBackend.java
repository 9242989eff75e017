package com.dataflywheel.customization;

import java.io.IOException;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class HttpCustomizationBackend implements CustomizationBackend {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl jobsUrl;
    private final String apiKey;

    public HttpCustomizationBackend(OkHttpClient httpClient, String baseUrl, String apiKey) {
        this.httpClient = httpClient;
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new IllegalArgumentException("Invalid customization base url: " + baseUrl);
        }
        this.jobsUrl = base.newBuilder().addPathSegments("v1/customization/jobs").build();
        this.apiKey = apiKey;
    }

    @Override
    public String submit(CustomizationRequest request) throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(jobsUrl)
                .post(RequestBody.create(mapper.writeValueAsString(request), JSON));
        JsonNode body = execute(builder);
        String id = body.path("id").asText("");
        if (id.isBlank()) {
            throw new IOException("Customization backend accepted the job but returned no id");
        }
        return id;
    }

    @Override
    public CustomizationStatus status(String externalJobId) throws IOException {
        HttpUrl url = jobsUrl.newBuilder().addPathSegment(externalJobId).build();
        JsonNode body = execute(new Request.Builder().url(url).get());
        CustomizationState state = mapState(body.path("status").asText(""));
        String outputModel = body.hasNonNull("output_model") ? body.get("output_model").asText() : null;
        String message = body.hasNonNull("message") ? body.get("message").asText() : null;
        if (state == CustomizationState.SUCCEEDED && (outputModel == null || outputModel.isBlank())) {
            return new CustomizationStatus(CustomizationState.FAILED, null, "job completed without an output model");
        }
        return new CustomizationStatus(state, state == CustomizationState.SUCCEEDED ? outputModel : null, message);
    }

    private JsonNode execute(Request.Builder builder) throws IOException {
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        Request request = builder.build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Customization backend " + request.url() + " returned HTTP " + response.code());
            }
            return mapper.readTree(body.string());
        }
    }

    static CustomizationState mapState(String status) {
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "running", "in_progress" -> CustomizationState.RUNNING;
            case "completed", "succeeded", "success" -> CustomizationState.SUCCEEDED;
            case "failed", "error", "cancelled", "canceled" -> CustomizationState.FAILED;
            default -> CustomizationState.SUBMITTED;
        };
    }
}
