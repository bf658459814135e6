package com.knowledgeinbox.ingest;

import java.io.IOException;
import java.util.ArrayList;
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

/**
 * Calls an OpenAI-compatible {@code /embeddings} endpoint with the whole batch in one request. Azure deployments
 * authenticate with an {@code api-key} header, everything else with a bearer token.
 */
public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(ExternalProviderEmbeddingService.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String provider;
    private final String apiKey;
    private final String model;
    private final int dimension;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String provider,
            String apiKey,
            String model,
            int dimension) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("embedding endpoint must be configured for provider " + provider);
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.provider = provider;
        this.apiKey = apiKey;
        this.model = model;
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            if (model != null && !model.isBlank()) {
                body.put("model", model);
            }
            body.put("input", texts);
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
                    log.warn("Embedding provider {} answered status={} for batch of {}", provider, response.code(), texts.size());
                    throw new EmbeddingUnavailableException(
                            "Embedding provider " + provider + " answered HTTP " + response.code());
                }
                return parseVectors(mapper.readTree(responseBody.string()), texts.size());
            }
        } catch (IOException e) {
            log.warn("Embedding provider {} unreachable: {}", provider, e.getMessage());
            throw new EmbeddingUnavailableException("Embedding provider " + provider + " unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private List<float[]> parseVectors(JsonNode root, int expected) {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.size() != expected) {
            throw new EmbeddingUnavailableException("Embedding provider " + provider + " returned "
                    + (data.isArray() ? data.size() : 0) + " vectors for " + expected + " inputs");
        }
        List<float[]> vectors = new ArrayList<>(expected);
        for (int i = 0; i < expected; i++) {
            vectors.add(null);
        }
        for (int position = 0; position < data.size(); position++) {
            JsonNode entry = data.get(position);
            int index = entry.path("index").asInt(position);
            JsonNode vectorNode = entry.path("embedding");
            if (!vectorNode.isArray() || index < 0 || index >= expected) {
                throw new EmbeddingUnavailableException("Embedding provider " + provider + " returned a malformed entry");
            }
            if (vectorNode.size() != dimension) {
                throw new IllegalStateException("Embedding provider " + provider + " returned " + vectorNode.size()
                        + "-dimensional vectors but " + dimension + " are configured");
            }
            float[] out = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                out[i] = (float) vectorNode.get(i).asDouble();
            }
            vectors.set(index, out);
        }
        if (vectors.contains(null)) {
            throw new EmbeddingUnavailableException("Embedding provider " + provider + " returned duplicate indices");
        }
        return vectors;
    }
}
