package document.java17.effect;

import java.util.Objects;

/// A leaf-level failure raised while traversing a document with a failing effect.
/// @param message what went wrong
/// @param cause the exception that triggered the failure, or null
public record TraversalFailure(String message, Throwable cause) {

    public TraversalFailure {
        Objects.requireNonNull(message, "message must not be null");
    }

    public static TraversalFailure of(String message) {
        return new TraversalFailure(message, null);
    }

    /// Wraps an exception, using its message or, if it has none, its class name.
    public static TraversalFailure of(Throwable cause) {
        Objects.requireNonNull(cause, "cause must not be null");
        final String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return new TraversalFailure(message, cause);
    }
}
