package org.javai.jobguard;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A fully-contextualized abort, carrying enough to diagnose the failure without re-running.
 *
 * @param code The failure identifier (namespace:name)
 * @param message Human-readable description naming the operation, attempts or elapsed time, and the last cause
 * @param type Why the operation was aborted
 * @param operation The description of the operation that was attempted (e.g., "start backup job for EBS")
 * @param attempts Number of invocations or status queries made
 * @param elapsed Wall-clock time spent before giving up
 * @param cause The last observed cause (may be null)
 * @param exception The last underlying exception (may be null)
 * @param occurredAt When the abort happened
 * @param tags Additional key-value metadata (job id, last state, phase)
 */
public record Failure(
        FailureCode code,
        String message,
        FailureType type,
        String operation,
        int attempts,
        Duration elapsed,
        Cause cause,
        Throwable exception,
        Instant occurredAt,
        Map<String, String> tags
) {

    public Failure {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * Creates a builder for constructing Failures with full context.
     */
    public static Builder builder(FailureCode code, String message, FailureType type, String operation) {
        return new Builder(code, message, type, operation);
    }

    /**
     * Returns a copy with the message replaced and the given tags merged in.
     */
    public Failure withContext(String newMessage, Map<String, String> extraTags) {
        Map<String, String> merged = new HashMap<>(tags);
        merged.putAll(extraTags);
        return new Failure(code, newMessage, type, operation, attempts, elapsed,
                cause, exception, occurredAt, merged);
    }

    public static class Builder {
        private final FailureCode code;
        private final String message;
        private final FailureType type;
        private final String operation;
        private int attempts;
        private Duration elapsed = Duration.ZERO;
        private Cause cause;
        private Throwable exception;
        private Instant occurredAt = Instant.now();
        private Map<String, String> tags;

        private Builder(FailureCode code, String message, FailureType type, String operation) {
            this.code = Objects.requireNonNull(code);
            this.message = Objects.requireNonNull(message);
            this.type = Objects.requireNonNull(type);
            this.operation = Objects.requireNonNull(operation);
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder elapsed(Duration elapsed) {
            this.elapsed = elapsed;
            return this;
        }

        public Builder cause(Cause cause) {
            this.cause = cause;
            return this;
        }

        public Builder exception(Throwable exception) {
            this.exception = exception;
            return this;
        }

        public Builder occurredAt(Instant instant) {
            this.occurredAt = instant;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Failure build() {
            return new Failure(code, message, type, operation, attempts, elapsed,
                    cause, exception, occurredAt, tags);
        }
    }
}
