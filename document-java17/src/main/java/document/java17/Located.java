package document.java17;

import java.util.Objects;

/// A leaf value paired with where it sits in its document.
public record Located<A>(A value, DocumentPath path) {
    public Located {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }
}
