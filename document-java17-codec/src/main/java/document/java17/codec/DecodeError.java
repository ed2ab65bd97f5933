package document.java17.codec;

import java.util.Objects;

/// Why a JSON value is not a valid encoded document.
/// @param reason the kind of problem
/// @param message human-readable detail
/// @param path RFC 6901 JSON Pointer to the offending node or field; `""` is the root
public record DecodeError(Reason reason, String message, String path) {

    public enum Reason {
        /// The input text is not well-formed JSON.
        MALFORMED_JSON,
        /// A document node is not a JSON object.
        NOT_AN_OBJECT,
        /// The object has no `type` field.
        MISSING_TYPE,
        /// The `type` field is not a string.
        TYPE_NOT_STRING,
        /// The `type` field names no known variant.
        UNKNOWN_TYPE,
        /// The `value` or `cells` field required by the tag is absent.
        MISSING_FIELD,
        /// The `cells` field is not an array.
        CELLS_NOT_ARRAY,
        /// The leaf codec rejected a `value`.
        INVALID_LEAF,
        /// The document nests deeper than the configured maximum.
        TOO_DEEP,
        /// The object carries a field its tag does not define, and unknown fields are rejected.
        UNKNOWN_FIELD
    }

    public DecodeError {
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }

    @Override
    public String toString() {
        return "{reason=" + reason + ", path=\"" + path + "\", message=\"" + message + "\"}";
    }
}
