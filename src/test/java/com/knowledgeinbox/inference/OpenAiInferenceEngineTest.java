package com.knowledgeinbox.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class OpenAiInferenceEngineTest {

    private MockWebServer server;
    private OpenAiInferenceEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        engine = new OpenAiInferenceEngine(new OkHttpClient(), server.url("/v1/chat/completions").toString(),
                "openai", "secret", "gpt-35-turbo", 0.7, 800);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldSendGroundedMessagesAndReturnAnswer() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"choices": [{"message": {"role": "assistant", "content": "  The sky is blue [1].  "}}]}
                """));
        InferenceRequest request = new InferenceRequest("system rules", "user prompt", "question", List.of());

        assertEquals("The sky is blue [1].", engine.generate(request));

        RecordedRequest recorded = server.takeRequest();
        assertEquals("Bearer secret", recorded.getHeader("Authorization"));
        JsonNode body = new ObjectMapper().readTree(recorded.getBody().readUtf8());
        assertEquals("gpt-35-turbo", body.path("model").asText());
        assertEquals("system", body.path("messages").get(0).path("role").asText());
        assertEquals("system rules", body.path("messages").get(0).path("content").asText());
        assertEquals("user prompt", body.path("messages").get(1).path("content").asText());
        assertEquals(0.7, body.path("temperature").asDouble(), 1e-9);
        assertEquals(800, body.path("max_tokens").asInt());
    }

    @Test
    void shouldRaiseGenerationUnavailableOnServerError() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThrows(GenerationUnavailableException.class,
                () -> engine.generate(new InferenceRequest("s", "u", "q", List.of())));
    }

    @Test
    void shouldRaiseGenerationUnavailableOnEmptyChoices() {
        server.enqueue(new MockResponse().setBody("{\"choices\": []}"));

        assertThrows(GenerationUnavailableException.class,
                () -> engine.generate(new InferenceRequest("s", "u", "q", List.of())));
    }

    @Test
    void shouldRaiseGenerationUnavailableOnMalformedBody() {
        server.enqueue(new MockResponse().setBody("not json"));

        assertThrows(GenerationUnavailableException.class,
                () -> engine.generate(new InferenceRequest("s", "u", "q", List.of())));
    }
}
