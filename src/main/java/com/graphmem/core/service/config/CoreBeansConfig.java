package com.graphmem.core.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphmem.core.service.error.GeneratorException;
import com.graphmem.core.service.generation.OllamaCompletionClient;
import com.graphmem.core.service.generation.RetryingCompletionClient;
import com.graphmem.core.service.generation.TextCompletionClient;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Shared collaborators constructed once at start and injected into the core services.
 */
@Slf4j
@Configuration
public class CoreBeansConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient generatorHttpClient(GeneratorConfig generatorConfig) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(generatorConfig.getTimeoutSeconds()))
                .build();
    }

    /**
     * Retry policy for text completion. Only transient generator failures are retried.
     */
    @Bean
    public Retry generatorRetry(GeneratorConfig generatorConfig) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, generatorConfig.getMaxAttempts()))
                .waitDuration(Duration.ofMillis(Math.max(1, generatorConfig.getRetryWaitMs())))
                .retryOnException(e -> e instanceof GeneratorException ge && ge.isTransient())
                .build();
        return Retry.of("generator", config);
    }

    /**
     * Text-completion capability shared by the chat, summarizer and dialogue generator.
     */
    @Bean
    public TextCompletionClient textCompletionClient(HttpClient generatorHttpClient,
                                                     ObjectMapper objectMapper,
                                                     GeneratorConfig generatorConfig,
                                                     Retry generatorRetry,
                                                     MetricsConfig metricsConfig) {
        log.info("Initializing Ollama completion client: {} (model {})",
                generatorConfig.getBaseUrl(), generatorConfig.getModel());
        var ollama = new OllamaCompletionClient(generatorHttpClient, objectMapper, generatorConfig);
        return new RetryingCompletionClient(ollama, generatorRetry, metricsConfig.getGenerationTimer());
    }
}
