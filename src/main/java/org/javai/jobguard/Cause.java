package org.javai.jobguard;

import java.util.Objects;

/**
 * Captures the underlying cause of a failure for diagnostics.
 *
 * @param type The exception class name or error type
 * @param detail Human-readable details, usually the exception message
 */
public record Cause(String type, String detail) {

    public Cause {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static Cause fromThrowable(Throwable t) {
        Objects.requireNonNull(t, "throwable must not be null");
        return new Cause(t.getClass().getName(), t.getMessage());
    }

    /**
     * A cause that did not come from an exception, such as a terminal job state.
     */
    public static Cause of(String type, String detail) {
        return new Cause(type, detail);
    }

    @Override
    public String toString() {
        return detail != null ? detail : type;
    }
}
