package stableui.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One unit of work in a plan: an operation on a named target, guarded by
 * pre-conditions and checked by post-conditions.
 *
 * <p>{@code retries} counts attempts after the first, so a step runs at most
 * {@code retries + 1} times.
 */
public record ActionStep(
        Operation operation,
        String target,
        List<VerifyCondition> verifyBefore,
        List<VerifyCondition> verifyAfter,
        int retries,
        long timeoutMs) {

    public static final int  DEFAULT_RETRIES    = 2;
    public static final long DEFAULT_TIMEOUT_MS = 5000L;

    public ActionStep {
        Objects.requireNonNull(operation, "operation");
        verifyBefore = verifyBefore == null ? List.of() : List.copyOf(verifyBefore);
        verifyAfter  = verifyAfter  == null ? List.of() : List.copyOf(verifyAfter);
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0: " + retries);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0: " + timeoutMs);
        }
    }

    public int maxAttempts() {
        return retries + 1;
    }

    public boolean hasTarget() {
        return target != null && !target.isBlank();
    }

    public String describe() {
        return operation.kind().wireName() + (hasTarget() ? " '" + target + "'" : "");
    }

    public static Builder builder(Operation operation) {
        return new Builder(operation);
    }

    public static final class Builder {
        private final Operation operation;
        private String target;
        private final List<VerifyCondition> before = new ArrayList<>();
        private final List<VerifyCondition> after  = new ArrayList<>();
        private int retries = DEFAULT_RETRIES;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;

        private Builder(Operation operation) {
            this.operation = operation;
        }

        public Builder target(String target)                { this.target = target; return this; }
        public Builder verifyBefore(VerifyCondition c)      { before.add(c); return this; }
        public Builder verifyAfter(VerifyCondition c)       { after.add(c); return this; }
        public Builder retries(int retries)                 { this.retries = retries; return this; }
        public Builder timeoutMs(long timeoutMs)            { this.timeoutMs = timeoutMs; return this; }

        public ActionStep build() {
            return new ActionStep(operation, target, before, after, retries, timeoutMs);
        }
    }
}
