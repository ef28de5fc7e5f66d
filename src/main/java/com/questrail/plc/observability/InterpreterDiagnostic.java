package com.questrail.plc.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing a construct the interpreter skipped or degraded.
 * <p>
 * The interpreter never throws for malformed programs; each of these is the
 * only trace such a construct leaves.
 */
public record InterpreterDiagnostic(
    Instant timestamp,
    Kind kind,
    String subject,
    String message
) {
    public enum Kind {
        /** A call named neither a user FUNCTION nor a standard function; the result was 0. */
        UNKNOWN_FUNCTION,
        /** An assignment targeted a CONSTANT and was skipped. */
        CONSTANT_ASSIGNMENT,
        /** A CASE range was written high..low; it still matches inclusively. */
        DESCENDING_CASE_RANGE,
        /** A call on an instance whose function-block kind could not be determined. */
        UNRESOLVED_FUNCTION_BLOCK,
        /** A call argument that cannot be bound (IN_OUT to a non-variable, unknown parameter). */
        INVALID_ARGUMENT
    }

    public InterpreterDiagnostic {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(message, "message");
    }

    public static InterpreterDiagnostic of(Kind kind, String subject, String message) {
        return new InterpreterDiagnostic(Instant.now(), kind, subject, message);
    }
}
