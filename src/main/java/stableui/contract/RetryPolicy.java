package stableui.contract;

import stableui.config.EngineConfig;
import stableui.model.ActionStep;

/**
 * Bounded retry policy for plan steps: how many attempts a step gets and how
 * long to wait before each retry.
 *
 * <p>A step asks for {@code retries} attempts after the first; the policy caps
 * that at {@link #maxRetries()}. Backoff grows geometrically from
 * {@link #initialBackoffMs()} and never exceeds {@link #maxBackoffMs()}.
 */
public record RetryPolicy(int maxRetries, long initialBackoffMs, double multiplier, long maxBackoffMs) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        if (initialBackoffMs < 0 || maxBackoffMs < 0) {
            throw new IllegalArgumentException("backoff must be >= 0");
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier)) {
            throw new IllegalArgumentException("multiplier must be >= 1.0: " + multiplier);
        }
    }

    public static RetryPolicy fromConfig(EngineConfig config) {
        return new RetryPolicy(config.getRetryMax(), config.getBackoffMs(),
                config.getBackoffMultiplier(), config.getBackoffMaxMs());
    }

    /** Retries allowed as the step declares them, with no waiting in between. */
    public static RetryPolicy noBackoff(int maxRetries) {
        return new RetryPolicy(maxRetries, 0L, 1.0, 0L);
    }

    /** Total attempts the step gets: its capped retry budget plus the first attempt. */
    public int attemptsFor(ActionStep step) {
        return Math.min(step.retries(), maxRetries) + 1;
    }

    /**
     * Wait before the given retry.
     *
     * @param retry 1 for the first retry, 2 for the second, and so on; 0 or less means no wait
     */
    public long backoffFor(int retry) {
        if (retry <= 0 || initialBackoffMs == 0) return 0L;
        double wait = initialBackoffMs * Math.pow(multiplier, retry - 1);
        return (long) Math.min(wait, (double) maxBackoffMs);
    }
}
