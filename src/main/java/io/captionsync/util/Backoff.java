package io.captionsync.util;

/**
 * Exponential backoff schedule: {@code base * multiplier^attempt}, capped at {@code max}.
 */
public record Backoff(long baseDelayMs, long maxDelayMs, double multiplier) {

    public Backoff {
        if (baseDelayMs < 0L) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0");
        }
        if (maxDelayMs < baseDelayMs) {
            maxDelayMs = baseDelayMs;
        }
        if (multiplier < 1.0d) {
            multiplier = 1.0d;
        }
    }

    public long delayForAttempt(int attempt) {
        int safeAttempt = Math.max(0, attempt);
        double delay = baseDelayMs * Math.pow(multiplier, safeAttempt);
        if (Double.isInfinite(delay) || delay > maxDelayMs) {
            return maxDelayMs;
        }
        return (long) delay;
    }
}
