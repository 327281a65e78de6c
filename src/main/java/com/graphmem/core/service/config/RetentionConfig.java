package com.graphmem.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for data retention and eviction.
 *
 * Controls the fallback cache bounds, expired message purging and job retention.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "graphmem.retention")
public class RetentionConfig {

    private FallbackRetention fallback = new FallbackRetention();

    private MessageRetention messages = new MessageRetention();

    private JobRetention jobs = new JobRetention();

    @Getter
    @Setter
    public static class FallbackRetention {

        /**
         * Maximum number of records held by the fallback cache.
         */
        private int maxEntries = 10000;

        /**
         * Eviction check interval in milliseconds.
         */
        private long evictionIntervalMs = 60000;
    }

    @Getter
    @Setter
    public static class MessageRetention {

        /**
         * Interval of the expired message purge in milliseconds.
         */
        private long purgeIntervalMs = 300000; // 5 minutes

        /**
         * Messages are purged only once they have been expired for this long.
         */
        private long purgeGraceMs = 60000;

        /**
         * Upper bound of purge rounds per run; each round removes the current chain heads.
         */
        private int maxPurgeRounds = 50;
    }

    @Getter
    @Setter
    public static class JobRetention {

        /**
         * Number of simulation jobs kept before the oldest terminal ones are superseded.
         */
        private int maxRetained = 200;
    }
}
