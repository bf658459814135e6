package com.knowledgeinbox.inference;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import com.knowledgeinbox.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class InferenceEngines {
    static final String API_KEY_ENV = "KNOWLEDGE_INBOX_GENERATION_API_KEY";

    private InferenceEngines() {
    }

    public static InferenceEngine fromConfig(AppConfig.GenerationConfig config, OkHttpClient httpClient) {
        return fromConfig(config, httpClient, System.getenv());
    }

    static InferenceEngine fromConfig(AppConfig.GenerationConfig config, OkHttpClient httpClient, Map<String, String> env) {
        String provider = config.getProvider() == null ? "local" : config.getProvider().toLowerCase(Locale.ROOT);
        if ("local".equals(provider)) {
            return new ExtractiveInferenceEngine();
        }
        String apiKey = config.getApiKey() == null || config.getApiKey().isBlank()
                ? env.get(API_KEY_ENV)
                : config.getApiKey();
        OkHttpClient boundedClient = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        return new OpenAiInferenceEngine(
                boundedClient,
                config.getEndpoint(),
                provider,
                apiKey,
                config.getModel(),
                config.getTemperature(),
                config.getMaxTokens());
    }
}
