package com.graphmem.core.service.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor configuration for background simulation runs.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final SimulationConfig simulationConfig;

    /**
     * Executor giving every simulation job its own thread.
     *
     * There is no queue in front of the pool: a job submitted while all warm
     * threads are busy gets a new thread instead of waiting for another job
     * to finish. Threads above {@code workerThreads} are released once idle.
     */
    @Bean(name = "simulationExecutor")
    public Executor simulationExecutor() {
        int warmThreads = Math.max(1, simulationConfig.getWorkerThreads());
        log.info("Initializing simulation executor: {} warm threads, one thread per running job",
                warmThreads);
        return createPerJobThreadPool("simulation-", warmThreads, simulationConfig.getIdleThreadKeepAliveSeconds());
    }

    private ThreadPoolTaskExecutor createPerJobThreadPool(String prefix, int coreSize, int keepAliveSeconds) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(Math.max(1, keepAliveSeconds));
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
