package com.graphmem.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration of the text-completion collaborator (Ollama generate API).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "graphmem.generator")
public class GeneratorConfig {

    private String baseUrl = "http://localhost:11434";

    private String model = "gpt-oss-20b";

    private int timeoutSeconds = 60;

    /**
     * Attempts per completion, including the first one. Only transient failures are retried.
     */
    private int maxAttempts = 3;

    private long retryWaitMs = 500;

    /**
     * Marker a participant appends when the dialogue has reached its natural end.
     */
    private String stopMarker = "<<END>>";
}
