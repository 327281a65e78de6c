package com.graphmem.core.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphmem.core.service.config.GeneratorConfig;
import com.graphmem.core.service.error.GeneratorException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Blocking client for the Ollama {@code /api/generate} endpoint.
 *
 * Network errors, throttling and 5xx responses are reported as transient
 * failures; any other non-2xx response is permanent.
 */
@Slf4j
public class OllamaCompletionClient implements TextCompletionClient {

    private static final String GENERATE_PATH = "/api/generate";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final GeneratorConfig config;

    public OllamaCompletionClient(HttpClient httpClient, ObjectMapper objectMapper, GeneratorConfig config) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    @Override
    public String complete(String prompt) {
        String body = serialize(prompt);
        log.debug("[Ollama:{}] generate POST body-length={}", config.getModel(), body.length());

        HttpResponse<String> response = send(buildRequest(body));
        return parseResponse(response);
    }

    // ==================== Private Methods ====================

    private String serialize(String prompt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.getModel());
        payload.put("prompt", prompt);
        payload.put("stream", false);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new GeneratorException("Failed to serialize generate request", false, e);
        }
    }

    private HttpRequest buildRequest(String body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(config.getBaseUrl()) + GENERATE_PATH))
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GeneratorException("Network error calling Ollama: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeneratorException("Interrupted while calling Ollama", false, e);
        }
    }

    private String parseResponse(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new GeneratorException("Ollama returned HTTP " + status, true);
        }
        if (status < 200 || status >= 300) {
            throw new GeneratorException("Ollama returned HTTP " + status + ": " + response.body(), false);
        }
        try {
            JsonNode root = objectMapper.readTree(response.body());
            return root.path("response").asText("");
        } catch (JsonProcessingException e) {
            throw new GeneratorException("Malformed Ollama response", false, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
