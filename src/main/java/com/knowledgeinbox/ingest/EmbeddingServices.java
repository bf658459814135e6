package com.knowledgeinbox.ingest;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import com.knowledgeinbox.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    static final String API_KEY_ENV = "KNOWLEDGE_INBOX_EMBEDDING_API_KEY";

    private EmbeddingServices() {
    }

    public static EmbeddingService fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        return fromConfig(config, httpClient, System.getenv());
    }

    static EmbeddingService fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient, Map<String, String> env) {
        String provider = config.getProvider() == null ? "local" : config.getProvider().toLowerCase(Locale.ROOT);
        if ("local".equals(provider)) {
            return new LocalModelEmbeddingService(config.getDimension());
        }
        String apiKey = config.getApiKey() == null || config.getApiKey().isBlank()
                ? env.get(API_KEY_ENV)
                : config.getApiKey();
        OkHttpClient boundedClient = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        return new ExternalProviderEmbeddingService(
                boundedClient,
                config.getEndpoint(),
                provider,
                apiKey,
                config.getModel(),
                config.getDimension());
    }
}
