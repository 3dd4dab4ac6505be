package tech.compendium.sdk.store;

import tech.compendium.sdk.config.CompendiumConfig;

import java.time.Duration;

/**
 * How often a {@link JobPoller} polls.
 *
 * @param interval           delay between polls
 * @param maxInterval        upper bound when backing off
 * @param exponentialBackoff double the delay every ten polls
 */
public record PollingOptions(Duration interval, Duration maxInterval, boolean exponentialBackoff) {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(60);

    public PollingOptions {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (maxInterval == null || maxInterval.compareTo(interval) < 0) {
            throw new IllegalArgumentException("maxInterval must be at least the interval");
        }
    }

    public static PollingOptions defaults() {
        return new PollingOptions(DEFAULT_INTERVAL, DEFAULT_MAX_INTERVAL, false);
    }

    public static PollingOptions from(CompendiumConfig.PollingConfig config) {
        return new PollingOptions(
            Duration.ofMillis(config.intervalMs()),
            Duration.ofMillis(config.maxIntervalMs()),
            config.exponentialBackoff());
    }

    public PollingOptions withBackoff() {
        return new PollingOptions(interval, maxInterval, true);
    }

    /**
     * Delay before the next poll once {@code pollCount} polls have completed:
     * {@code min(interval * 2^floor(pollCount / 10), maxInterval)} with backoff, else the interval.
     */
    public Duration delayAfter(int pollCount) {
        if (!exponentialBackoff) {
            return interval;
        }
        int doublings = Math.min(pollCount / 10, 30);
        long millis = interval.toMillis() * (1L << doublings);
        return millis >= maxInterval.toMillis() || millis < 0 ? maxInterval : Duration.ofMillis(millis);
    }
}
