package com.graphmem.core.service.generation;

import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

/**
 * Decorates a completion client with a Resilience4j retry and a timer.
 */
@Slf4j
public class RetryingCompletionClient implements TextCompletionClient {

    private final TextCompletionClient delegate;
    private final Retry retry;
    private final Timer timer;

    public RetryingCompletionClient(TextCompletionClient delegate, Retry retry, Timer timer) {
        this.delegate = delegate;
        this.retry = retry;
        this.timer = timer;
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying text completion (attempt {}): {}",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    @Override
    public String complete(String prompt) {
        return timer.record(() -> Retry.decorateSupplier(retry, () -> delegate.complete(prompt)).get());
    }
}
