package com.knowledgeinbox.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.knowledgeinbox.runtime.AppConfig;

import okhttp3.OkHttpClient;

class EmbeddingServicesTest {

    @Test
    void shouldDefaultToLocalEmbeddings() {
        AppConfig.EmbeddingConfig config = new AppConfig.EmbeddingConfig();

        EmbeddingService service = EmbeddingServices.fromConfig(config, new OkHttpClient(), Map.of());

        assertInstanceOf(LocalModelEmbeddingService.class, service);
        assertEquals(384, service.dimension());
    }

    @Test
    void shouldBuildExternalProviderWhenConfigured() {
        AppConfig.EmbeddingConfig config = new AppConfig.EmbeddingConfig();
        config.setProvider("OpenAI");
        config.setEndpoint("https://api.example.com/v1/embeddings");
        config.setDimension(1536);

        EmbeddingService service = EmbeddingServices.fromConfig(config, new OkHttpClient(),
                Map.of(EmbeddingServices.API_KEY_ENV, "from-env"));

        assertInstanceOf(ExternalProviderEmbeddingService.class, service);
        assertEquals(1536, service.dimension());
    }

    @Test
    void shouldRequireEndpointForExternalProvider() {
        AppConfig.EmbeddingConfig config = new AppConfig.EmbeddingConfig();
        config.setProvider("azure");

        assertThrows(IllegalArgumentException.class,
                () -> EmbeddingServices.fromConfig(config, new OkHttpClient(), Map.of()));
    }
}
