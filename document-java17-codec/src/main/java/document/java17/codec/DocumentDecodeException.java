package document.java17.codec;

import java.util.Objects;

/// Thrown by [DocumentCodec#decodeOrThrow] when the input is not a valid encoded document.
public class DocumentDecodeException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final DecodeError error;

    /// Creates an exception carrying `error`.
    /// @param error the decode failure
    public DocumentDecodeException(DecodeError error) {
        super(Objects.requireNonNull(error, "error must not be null").toString());
        this.error = error;
    }

    public DecodeError error() {
        return error;
    }
}
