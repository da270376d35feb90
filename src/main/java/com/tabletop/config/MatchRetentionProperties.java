package com.tabletop.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * How long ended matches stay queryable, bound from {@code engine.matches}.
 *
 * @param finishedRetention time after a match ends before the eviction sweep drops it
 */
@ConfigurationProperties(prefix = "engine.matches")
public record MatchRetentionProperties(Duration finishedRetention) {

    public MatchRetentionProperties {
        if (finishedRetention == null || finishedRetention.isNegative()) {
            finishedRetention = Duration.ofMinutes(10);
        }
    }

    public static MatchRetentionProperties defaults() {
        return new MatchRetentionProperties(null);
    }
}
