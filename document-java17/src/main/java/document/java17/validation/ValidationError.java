package document.java17.validation;

import document.java17.DocumentPath;

import java.util.Objects;

/// A policy violation at one node of a document.
/// @param path where the offending node sits; the root for whole-document rules
/// @param reason a human-readable description of the violation
public record ValidationError(DocumentPath path, String reason) {

    public ValidationError {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public String toString() {
        return "{path=\"" + path + "\", reason=\"" + reason + "\"}";
    }
}
