package com.knowledgeinbox.inference;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class OpenAiInferenceEngine implements InferenceEngine {
    private static final Logger log = LoggerFactory.getLogger(OpenAiInferenceEngine.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String provider;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    public OpenAiInferenceEngine(OkHttpClient httpClient,
            String endpoint,
            String provider,
            String apiKey,
            String model,
            double temperature,
            int maxTokens) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("generation endpoint must be configured for provider " + provider);
        }
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.provider = provider;
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public String generate(InferenceRequest request) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            if (model != null && !model.isBlank()) {
                body.put("model", model);
            }
            body.put("messages", List.of(
                    Map.of("role", "system", "content", request.systemPrompt()),
                    Map.of("role", "user", "content", request.userPrompt())));
            body.put("temperature", temperature);
            body.put("max_tokens", maxTokens);

            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(body), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                if ("azure".equalsIgnoreCase(provider)) {
                    requestBuilder.header("api-key", apiKey);
                } else {
                    requestBuilder.header("Authorization", "Bearer " + apiKey);
                }
            }

            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    log.warn("Generation provider {} answered status={}", provider, response.code());
                    throw new GenerationUnavailableException(
                            "Generation provider " + provider + " answered HTTP " + response.code());
                }
                JsonNode content = mapper.readTree(responseBody.string())
                        .path("choices").path(0).path("message").path("content");
                if (!content.isTextual() || content.asText().isBlank()) {
                    throw new GenerationUnavailableException("Generation provider " + provider + " returned no answer");
                }
                return content.asText().strip();
            }
        } catch (IOException e) {
            log.warn("Generation provider {} unreachable: {}", provider, e.getMessage());
            throw new GenerationUnavailableException(
                    "Generation provider " + provider + " unreachable: " + e.getMessage(), e);
        }
    }
}
