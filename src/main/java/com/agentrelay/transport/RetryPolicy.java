package com.agentrelay.transport;

import com.agentrelay.shared.config.TransportConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with a cap and proportional jitter.
 * {@code maxRetries} counts retries after the first attempt.
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, double jitterRatio) {

    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (jitterRatio < 0) throw new IllegalArgumentException("jitterRatio must be >= 0");
    }

    public static RetryPolicy from(TransportConfig config) {
        return new RetryPolicy(config.maxRetries(), config.baseDelay(), config.maxDelay(), config.jitterRatio());
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 0);
    }

    public boolean shouldRetry(CommunicationException e, int attempt) {
        return e.retryable() && attempt < maxRetries;
    }

    /**
     * Backoff before retry number {@code attempt + 1}, where attempt 0 is the first call.
     */
    public long backoffMillis(int attempt) {
        long delay = baseDelay.toMillis();
        for (int i = 0; i < attempt && delay < maxDelay.toMillis(); i++) {
            delay *= 2;
        }
        delay = Math.min(delay, maxDelay.toMillis());
        long jitter = jitterRatio > 0 && delay > 0
                ? ThreadLocalRandom.current().nextLong((long) (delay * jitterRatio) + 1)
                : 0;
        return delay + jitter;
    }
}
